package com.ghack.protocol.value;

import com.ghack.protocol.Vector3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value of an entity state: a recursive tagged union of bool, 32-bit int,
 * 32-bit float, string, 3-vector or an array of further values.
 *
 * Instances are immutable and can only be created through the typed
 * factories or the {@link Builder}, both of which guarantee that the kind
 * matches the held value. INT and FLOAT are never converted into each
 * other.
 */
public final class StateValue {

    /**
     * Discriminant with its fixed wire value.
     */
    public enum Kind {
        BOOL(1),
        INT(2),
        FLOAT(3),
        STRING(4),
        ARRAY(5),
        VECTOR3(6);

        private final int id;

        Kind(int id) {
            this.id = id;
        }

        public int id() {
            return id;
        }

        public static Kind fromId(int id) {
            for (Kind kind : values()) {
                if (kind.id == id) {
                    return kind;
                }
            }
            return null;
        }
    }

    private static final StateValue TRUE = new StateValue(Kind.BOOL, Boolean.TRUE);
    private static final StateValue FALSE = new StateValue(Kind.BOOL, Boolean.FALSE);

    private final Kind kind;
    private final Object value;              // scalars and Vector3, null for ARRAY
    private final List<StateValue> elements; // ARRAY only

    private StateValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
        this.elements = null;
    }

    private StateValue(List<StateValue> elements) {
        this.kind = Kind.ARRAY;
        this.value = null;
        this.elements = elements;
    }

    public static StateValue ofBool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static StateValue ofInt(int value) {
        return new StateValue(Kind.INT, value);
    }

    public static StateValue ofFloat(float value) {
        return new StateValue(Kind.FLOAT, value);
    }

    public static StateValue ofString(String value) {
        return new StateValue(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static StateValue ofVector3(Vector3 value) {
        return new StateValue(Kind.VECTOR3, Objects.requireNonNull(value, "value"));
    }

    public static StateValue ofArray(StateValue... elements) {
        return ofArray(List.of(elements));
    }

    /**
     * @throws NullPointerException if the list or any element is null
     */
    public static StateValue ofArray(List<StateValue> elements) {
        return new StateValue(List.copyOf(elements));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean asBool() {
        return (Boolean) expect(Kind.BOOL);
    }

    public int asInt() {
        return (Integer) expect(Kind.INT);
    }

    public float asFloat() {
        return (Float) expect(Kind.FLOAT);
    }

    public String asString() {
        return (String) expect(Kind.STRING);
    }

    public Vector3 asVector3() {
        return (Vector3) expect(Kind.VECTOR3);
    }

    public List<StateValue> asArray() {
        expect(Kind.ARRAY);
        return elements;
    }

    private Object expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("StateValue is " + kind + ", not " + expected);
        }
        return value;
    }

    /**
     * Number of array levels in this value; 0 for scalars, 1 for a flat array.
     */
    public int depth() {
        if (kind != Kind.ARRAY) {
            return 0;
        }
        int deepest = 0;
        for (StateValue element : elements) {
            deepest = Math.max(deepest, element.depth());
        }
        return deepest + 1;
    }

    /**
     * Copies the whole tree. The result is equal to this value but shares no
     * array node with it.
     */
    public StateValue deepCopy() {
        if (kind != Kind.ARRAY) {
            return new StateValue(kind, value);
        }
        List<StateValue> copies = new ArrayList<>(elements.size());
        for (StateValue element : elements) {
            copies.add(element.deepCopy());
        }
        return new StateValue(Collections.unmodifiableList(copies));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateValue)) {
            return false;
        }
        StateValue other = (StateValue) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == Kind.ARRAY) {
            return elements.equals(other.elements);
        }
        if (kind == Kind.FLOAT) {
            return Float.compare((Float) value, (Float) other.value) == 0;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + (kind == Kind.ARRAY ? elements.hashCode() : value.hashCode());
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "String('" + value + "')";
            case ARRAY:
                return "Array" + elements;
            default:
                return kind.name().charAt(0) + kind.name().substring(1).toLowerCase() + "(" + value + ")";
        }
    }

    public static Builder builder(Kind kind) {
        return new Builder(kind);
    }

    /**
     * Wire-shaped construction: a discriminant plus any number of optional
     * fields. {@link #build()} rejects every combination where the populated
     * fields do not match the discriminant.
     */
    public static class Builder {
        private final Kind kind;
        private Boolean boolValue;
        private Integer intValue;
        private Float floatValue;
        private String stringValue;
        private Vector3 vector3Value;
        private final List<StateValue> arrayValue = new ArrayList<>();

        private Builder(Kind kind) {
            this.kind = kind;
        }

        public Builder boolValue(boolean value) {
            this.boolValue = value;
            return this;
        }

        public Builder intValue(int value) {
            this.intValue = value;
            return this;
        }

        public Builder floatValue(float value) {
            this.floatValue = value;
            return this;
        }

        public Builder stringValue(String value) {
            this.stringValue = value;
            return this;
        }

        public Builder vector3Value(Vector3 value) {
            this.vector3Value = value;
            return this;
        }

        public Builder addArrayElement(StateValue element) {
            this.arrayValue.add(Objects.requireNonNull(element, "element"));
            return this;
        }

        /**
         * @throws IllegalArgumentException if the kind is missing, the matching
         *                                  field is absent, or another field is populated
         */
        public StateValue build() {
            if (kind == null) {
                throw new IllegalArgumentException("StateValue kind is required");
            }
            int populated = (boolValue != null ? 1 : 0)
                    + (intValue != null ? 1 : 0)
                    + (floatValue != null ? 1 : 0)
                    + (stringValue != null ? 1 : 0)
                    + (vector3Value != null ? 1 : 0)
                    + (arrayValue.isEmpty() ? 0 : 1);

            StateValue result;
            switch (kind) {
                case BOOL:
                    result = boolValue != null ? ofBool(boolValue) : null;
                    break;
                case INT:
                    result = intValue != null ? ofInt(intValue) : null;
                    break;
                case FLOAT:
                    result = floatValue != null ? ofFloat(floatValue) : null;
                    break;
                case STRING:
                    result = stringValue != null ? ofString(stringValue) : null;
                    break;
                case VECTOR3:
                    result = vector3Value != null ? ofVector3(vector3Value) : null;
                    break;
                case ARRAY:
                    // an empty array has no populated field at all
                    result = ofArray(arrayValue);
                    populated = arrayValue.isEmpty() ? populated + 1 : populated;
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported kind " + kind);
            }

            if (result == null) {
                throw new IllegalArgumentException("StateValue of kind " + kind + " has no " + kind + " field");
            }
            if (populated != 1) {
                throw new IllegalArgumentException("StateValue of kind " + kind
                        + " must populate exactly one field, found " + populated);
            }
            return result;
        }
    }
}

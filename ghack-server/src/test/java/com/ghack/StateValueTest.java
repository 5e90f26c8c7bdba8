package com.ghack;

import com.ghack.protocol.Vector3;
import com.ghack.protocol.value.StateValue;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("State Value Tests")
class StateValueTest {

    @Test
    @DisplayName("Factories should produce the matching kind and value")
    void testFactories() {
        assertEquals(StateValue.Kind.BOOL, StateValue.ofBool(true).getKind());
        assertTrue(StateValue.ofBool(true).asBool());
        assertEquals(30, StateValue.ofInt(30).asInt());
        assertEquals(1.5f, StateValue.ofFloat(1.5f).asFloat());
        assertEquals("@", StateValue.ofString("@").asString());
        assertEquals(new Vector3(1, 2, 3), StateValue.ofVector3(new Vector3(1, 2, 3)).asVector3());
        assertEquals(2, StateValue.ofArray(StateValue.ofInt(1), StateValue.ofBool(false)).asArray().size());
    }

    @Test
    @DisplayName("Reading the wrong kind should fail")
    void testWrongAccessor() {
        StateValue value = StateValue.ofInt(30);
        assertThrows(IllegalStateException.class, value::asFloat);
        assertThrows(IllegalStateException.class, value::asString);
        assertThrows(IllegalStateException.class, value::asArray);
    }

    @Test
    @DisplayName("INT and FLOAT should never be equal")
    void testNoNumericCoercion() {
        assertNotEquals(StateValue.ofInt(1), StateValue.ofFloat(1f));
        assertEquals(StateValue.ofFloat(Float.NaN), StateValue.ofFloat(Float.NaN));
        assertEquals(StateValue.ofInt(7).hashCode(), StateValue.ofInt(7).hashCode());
    }

    @Test
    @DisplayName("Arrays should compare by their elements")
    void testArrayEquality() {
        StateValue array = StateValue.ofArray(StateValue.ofInt(1), StateValue.ofArray(StateValue.ofString("x")));
        StateValue same = StateValue.ofArray(List.of(StateValue.ofInt(1), StateValue.ofArray(StateValue.ofString("x"))));

        assertEquals(array, same);
        assertEquals(array.hashCode(), same.hashCode());
        assertNotEquals(array, StateValue.ofArray(StateValue.ofInt(1)));
        assertNotEquals(StateValue.ofArray(), StateValue.ofString(""));
        assertThrows(IllegalStateException.class, array::asInt);
        assertEquals(StateValue.ofString("x"), array.asArray().get(1).asArray().get(0));
    }

    @Test
    @DisplayName("Arrays should be immutable copies of their input")
    void testArrayImmutable() {
        List<StateValue> elements = new ArrayList<>();
        elements.add(StateValue.ofInt(1));
        StateValue array = StateValue.ofArray(elements);

        elements.add(StateValue.ofInt(2));
        assertEquals(1, array.asArray().size());
        assertThrows(UnsupportedOperationException.class, () -> array.asArray().add(StateValue.ofInt(3)));

        List<StateValue> withNull = new ArrayList<>();
        withNull.add(null);
        assertThrows(NullPointerException.class, () -> StateValue.ofArray(withNull));
    }

    @Test
    @DisplayName("Depth should count array levels")
    void testDepth() {
        assertEquals(0, StateValue.ofInt(1).depth());
        assertEquals(1, StateValue.ofArray().depth());
        assertEquals(3, StateValue.ofArray(
                StateValue.ofInt(1),
                StateValue.ofArray(StateValue.ofArray())).depth());
    }

    @Test
    @DisplayName("Deep copy should be equal but share no arrays")
    void testDeepCopy() {
        StateValue inner = StateValue.ofArray(StateValue.ofString("x"));
        StateValue original = StateValue.ofArray(inner, StateValue.ofInt(2));

        StateValue copy = original.deepCopy();
        assertEquals(original, copy);
        assertNotSame(original.asArray(), copy.asArray());
        assertNotSame(inner.asArray(), copy.asArray().get(0).asArray());
    }

    @Test
    @DisplayName("Builder should accept exactly one matching field")
    void testBuilder() {
        assertEquals(StateValue.ofInt(30), StateValue.builder(StateValue.Kind.INT).intValue(30).build());
        assertEquals(StateValue.ofArray(), StateValue.builder(StateValue.Kind.ARRAY).build());

        assertThrows(IllegalArgumentException.class,
                () -> StateValue.builder(StateValue.Kind.INT).stringValue("30").build());
        assertThrows(IllegalArgumentException.class,
                () -> StateValue.builder(StateValue.Kind.INT).intValue(30).floatValue(30f).build());
        assertThrows(IllegalArgumentException.class,
                () -> StateValue.builder(StateValue.Kind.BOOL).build());
        assertThrows(IllegalArgumentException.class,
                () -> StateValue.builder(StateValue.Kind.ARRAY).intValue(1).build());
        assertThrows(IllegalArgumentException.class,
                () -> StateValue.builder(null).intValue(1).build());
    }

    @Test
    @DisplayName("toString should show kind and value")
    void testToString() {
        assertEquals("Int(30)", StateValue.ofInt(30).toString());
        assertEquals("String('@')", StateValue.ofString("@").toString());
        assertEquals("Array[Bool(true)]", StateValue.ofArray(StateValue.ofBool(true)).toString());
    }
}

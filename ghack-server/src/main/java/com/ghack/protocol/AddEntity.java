package com.ghack.protocol;

import java.util.Objects;

/**
 * Announces an entity. Ids are allocated by the server only.
 */
public final class AddEntity extends Payload {

    private final int id;
    private final String name;

    public AddEntity(int id) {
        this(id, null);
    }

    /**
     * @param name entity type used for special handling, may be null
     */
    public AddEntity(int id, String name) {
        this.id = id;
        this.name = name;
    }

    @Override
    public MessageType type() {
        return MessageType.ADD_ENTITY;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AddEntity)) {
            return false;
        }
        AddEntity other = (AddEntity) o;
        return id == other.id && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "AddEntity{id=" + id + ", name='" + name + "'}";
    }
}

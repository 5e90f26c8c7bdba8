package com.ghack.protocol;

import java.util.Objects;

/**
 * Removes an entity; no further updates follow for it. Removing an id that
 * was never added is a minor error.
 */
public final class RemoveEntity extends Payload {

    private final int id;
    private final String name;

    public RemoveEntity(int id) {
        this(id, null);
    }

    /**
     * @param name entity type used for special handling, may be null
     */
    public RemoveEntity(int id, String name) {
        this.id = id;
        this.name = name;
    }

    @Override
    public MessageType type() {
        return MessageType.REMOVE_ENTITY;
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
        if (!(o instanceof RemoveEntity)) {
            return false;
        }
        RemoveEntity other = (RemoveEntity) o;
        return id == other.id && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "RemoveEntity{id=" + id + ", name='" + name + "'}";
    }
}

package com.ghack.protocol;

import java.util.Objects;

/**
 * Notification that an entity died, optionally naming its killer.
 */
public final class EntityDeath extends Payload {

    private final int uid;
    private final String name;
    private final Integer killerUid;
    private final String killerName;

    private EntityDeath(int uid, String name, Integer killerUid, String killerName) {
        this.uid = uid;
        this.name = name;
        this.killerUid = killerUid;
        this.killerName = killerName;
    }

    public EntityDeath(int uid) {
        this(uid, null, null, null);
    }

    @Override
    public MessageType type() {
        return MessageType.ENTITY_DEATH;
    }

    public int getUid() {
        return uid;
    }

    public String getName() {
        return name;
    }

    public Integer getKillerUid() {
        return killerUid;
    }

    public String getKillerName() {
        return killerName;
    }

    public static Builder builder(int uid) {
        return new Builder(uid);
    }

    public static class Builder {
        private final int uid;
        private String name;
        private Integer killerUid;
        private String killerName;

        private Builder(int uid) {
            this.uid = uid;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder killerUid(Integer killerUid) {
            this.killerUid = killerUid;
            return this;
        }

        public Builder killerName(String killerName) {
            this.killerName = killerName;
            return this;
        }

        public EntityDeath build() {
            return new EntityDeath(uid, name, killerUid, killerName);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityDeath)) {
            return false;
        }
        EntityDeath other = (EntityDeath) o;
        return uid == other.uid
                && Objects.equals(name, other.name)
                && Objects.equals(killerUid, other.killerUid)
                && Objects.equals(killerName, other.killerName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, name, killerUid, killerName);
    }

    @Override
    public String toString() {
        return "EntityDeath{uid=" + uid + ", name='" + name + "', killerUid=" + killerUid
                + ", killerName='" + killerName + "'}";
    }
}

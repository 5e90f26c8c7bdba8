package com.ghack.protocol;

import java.util.Objects;

/**
 * Damage dealt in combat. Informational only.
 */
public final class CombatHit extends Payload {

    private final int attackerUid;
    private final String attackerName;
    private final int victimUid;
    private final String victimName;
    private final float damage;

    private CombatHit(int attackerUid, String attackerName, int victimUid, String victimName, float damage) {
        this.attackerUid = attackerUid;
        this.attackerName = attackerName;
        this.victimUid = victimUid;
        this.victimName = victimName;
        this.damage = damage;
    }

    public CombatHit(int attackerUid, int victimUid, float damage) {
        this(attackerUid, null, victimUid, null, damage);
    }

    @Override
    public MessageType type() {
        return MessageType.COMBAT_HIT;
    }

    public int getAttackerUid() {
        return attackerUid;
    }

    public String getAttackerName() {
        return attackerName;
    }

    public int getVictimUid() {
        return victimUid;
    }

    public String getVictimName() {
        return victimName;
    }

    public float getDamage() {
        return damage;
    }

    public static Builder builder(int attackerUid, int victimUid, float damage) {
        return new Builder(attackerUid, victimUid, damage);
    }

    public static class Builder {
        private final int attackerUid;
        private final int victimUid;
        private final float damage;
        private String attackerName;
        private String victimName;

        private Builder(int attackerUid, int victimUid, float damage) {
            this.attackerUid = attackerUid;
            this.victimUid = victimUid;
            this.damage = damage;
        }

        public Builder attackerName(String attackerName) {
            this.attackerName = attackerName;
            return this;
        }

        public Builder victimName(String victimName) {
            this.victimName = victimName;
            return this;
        }

        public CombatHit build() {
            return new CombatHit(attackerUid, attackerName, victimUid, victimName, damage);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CombatHit)) {
            return false;
        }
        CombatHit other = (CombatHit) o;
        return attackerUid == other.attackerUid
                && victimUid == other.victimUid
                && Float.compare(damage, other.damage) == 0
                && Objects.equals(attackerName, other.attackerName)
                && Objects.equals(victimName, other.victimName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attackerUid, attackerName, victimUid, victimName, damage);
    }

    @Override
    public String toString() {
        return "CombatHit{attackerUid=" + attackerUid + ", attackerName='" + attackerName
                + "', victimUid=" + victimUid + ", victimName='" + victimName
                + "', damage=" + damage + '}';
    }
}

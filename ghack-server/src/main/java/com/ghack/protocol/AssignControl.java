package com.ghack.protocol;

import java.util.Objects;

/**
 * Tells the client it may (or may no longer) control an entity.
 */
public final class AssignControl extends Payload {

    private final int uid;
    private final Boolean revoked;

    public AssignControl(int uid) {
        this(uid, null);
    }

    /**
     * @param revoked true when control is taken away; null is the same as false on the wire
     */
    public AssignControl(int uid, Boolean revoked) {
        this.uid = uid;
        this.revoked = revoked;
    }

    public static AssignControl revoke(int uid) {
        return new AssignControl(uid, Boolean.TRUE);
    }

    @Override
    public MessageType type() {
        return MessageType.ASSIGN_CONTROL;
    }

    public int getUid() {
        return uid;
    }

    /**
     * Raw optional field, null when absent.
     */
    public Boolean getRevoked() {
        return revoked;
    }

    public boolean isRevoked() {
        return Boolean.TRUE.equals(revoked);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssignControl)) {
            return false;
        }
        AssignControl other = (AssignControl) o;
        return uid == other.uid && Objects.equals(revoked, other.revoked);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, revoked);
    }

    @Override
    public String toString() {
        return "AssignControl{uid=" + uid + ", revoked=" + revoked + '}';
    }
}

package com.ghack.protocol;

public enum DisconnectReason {
    /** Normal quit. */
    QUIT(1),
    /** The peer did something that violates the protocol. */
    PROTOCOL_ERROR(2),
    /** Incompatible protocol versions. */
    WRONG_PROTOCOL_VERSION(3),
    /** Forcibly disconnected by an administrator. */
    KICKED(4);

    private final int id;

    DisconnectReason(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static DisconnectReason fromId(int id) {
        for (DisconnectReason reason : values()) {
            if (reason.id == id) {
                return reason;
            }
        }
        return null;
    }
}

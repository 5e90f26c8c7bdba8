package com.ghack.protocol;

/**
 * LoginResult reason codes. ACCEPTED exists on the wire but is never sent;
 * a successful result carries no reason.
 */
public enum LoginFailure {
    ACCEPTED(0),
    /** Wrong user name or password. */
    ACCESS_DENIED(1),
    /** The server reached its maximum number of connected clients. */
    SERVER_FULL(2),
    /** Administrative ban on the connecting address or account. */
    BANNED(3);

    private final int id;

    LoginFailure(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static LoginFailure fromId(int id) {
        for (LoginFailure reason : values()) {
            if (reason.id == id) {
                return reason;
            }
        }
        return null;
    }
}

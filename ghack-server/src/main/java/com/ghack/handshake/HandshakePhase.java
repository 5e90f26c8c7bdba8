package com.ghack.handshake;

/**
 * Phases of a connection, from first byte to close.
 *
 * Server: AWAITING_CONNECT -> AWAITING_LOGIN -> AWAITING_LOGIN_RESULT -> ESTABLISHED
 * Client: AWAITING_CONNECT_ACK -> AWAITING_LOGIN -> AWAITING_LOGIN_RESULT -> ESTABLISHED
 *
 * Every phase can fall to CLOSED, which is terminal.
 */
public enum HandshakePhase {
    /** Server waits for the client's Connect. */
    AWAITING_CONNECT,
    /** Client sent Connect and waits for the server's. */
    AWAITING_CONNECT_ACK,
    /** Versions agreed; the client has to send Login. */
    AWAITING_LOGIN,
    /** Login sent; the login authority decides. */
    AWAITING_LOGIN_RESULT,
    ESTABLISHED,
    CLOSED;

    public static HandshakePhase initial(Role role) {
        return role == Role.SERVER ? AWAITING_CONNECT : AWAITING_CONNECT_ACK;
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}

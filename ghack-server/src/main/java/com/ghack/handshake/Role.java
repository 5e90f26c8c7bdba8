package com.ghack.handshake;

/**
 * Which end of the connection a state machine belongs to.
 */
public enum Role {
    CLIENT,
    SERVER;

    public Role peer() {
        return this == CLIENT ? SERVER : CLIENT;
    }
}

package com.ghack.protocol;

/**
 * Envelope discriminant. The numeric ids are fixed by the wire format and
 * must never be renumbered.
 *
 * Handshake (strict order):
 * - CONNECT, LOGIN, LOGIN_RESULT
 *
 * General traffic (only once the handshake is established):
 * - ADD_ENTITY, REMOVE_ENTITY, UPDATE_STATE: either direction
 * - MOVE: client to server
 * - ASSIGN_CONTROL: server to client
 * - ENTITY_DEATH, COMBAT_HIT: notifications
 *
 * DISCONNECT is valid in any phase.
 */
public enum MessageType {
    CONNECT(1, 16),
    DISCONNECT(2, 17),
    LOGIN(3, 18),
    LOGIN_RESULT(4, 19),
    ADD_ENTITY(5, 2),
    REMOVE_ENTITY(6, 3),
    UPDATE_STATE(7, 4),
    MOVE(8, 5),
    ASSIGN_CONTROL(9, 20),
    ENTITY_DEATH(10, 21),
    COMBAT_HIT(11, 22);

    private final int id;
    private final int payloadField;

    MessageType(int id, int payloadField) {
        this.id = id;
        this.payloadField = payloadField;
    }

    /**
     * Wire value of the discriminant.
     */
    public int id() {
        return id;
    }

    /**
     * Envelope field number carrying the payload of this type.
     * Frequent messages use numbers below 16.
     */
    public int payloadField() {
        return payloadField;
    }

    public boolean isHandshake() {
        return this == CONNECT || this == LOGIN || this == LOGIN_RESULT;
    }

    /**
     * Returns the type for a wire value, or null when the value is unknown.
     */
    public static MessageType fromId(int id) {
        for (MessageType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        return null;
    }

    /**
     * Returns the type whose payload lives at the given envelope field, or null.
     */
    public static MessageType fromPayloadField(int fieldNumber) {
        for (MessageType type : values()) {
            if (type.payloadField == fieldNumber) {
                return type;
            }
        }
        return null;
    }
}

package com.ghack.protocol;

import java.util.Objects;

/**
 * Movement intention of the client. The server decides the resulting
 * position and reports it back through UpdateState.
 */
public final class Move extends Payload {

    private final Vector3 direction;

    public Move(Vector3 direction) {
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    @Override
    public MessageType type() {
        return MessageType.MOVE;
    }

    public Vector3 getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Move && direction.equals(((Move) o).direction));
    }

    @Override
    public int hashCode() {
        return direction.hashCode();
    }

    @Override
    public String toString() {
        return "Move{direction=" + direction + '}';
    }
}

package com.ghack.protocol;

import java.util.Objects;

/**
 * Top-level container for exactly one protocol message.
 *
 * The discriminant is taken from the payload, so an envelope whose type
 * disagrees with its body cannot be built. Envelopes are immutable and
 * safe to share across threads, e.g. when broadcasting the same update to
 * many sessions.
 */
public final class Envelope {

    private final MessageType type;
    private final Payload payload;

    private Envelope(Payload payload) {
        this.payload = Objects.requireNonNull(payload, "payload");
        this.type = payload.type();
    }

    public static Envelope of(Payload payload) {
        return new Envelope(payload);
    }

    public MessageType getType() {
        return type;
    }

    public Payload getPayload() {
        return payload;
    }

    /**
     * Returns the payload cast to the expected class.
     *
     * @throws IllegalStateException if the payload is of another type
     */
    public <T extends Payload> T payload(Class<T> payloadClass) {
        if (!payloadClass.isInstance(payload)) {
            throw new IllegalStateException("Envelope of type " + type + " does not carry "
                    + payloadClass.getSimpleName());
        }
        return payloadClass.cast(payload);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Envelope && payload.equals(((Envelope) o).payload));
    }

    @Override
    public int hashCode() {
        return payload.hashCode();
    }

    @Override
    public String toString() {
        return "Envelope{type=" + type + ", payload=" + payload + '}';
    }
}

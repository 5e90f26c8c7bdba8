package com.ghack.protocol;

/**
 * Body of an {@link Envelope}. Each subclass is bound to exactly one
 * {@link MessageType}, so an envelope can never carry a payload that
 * disagrees with its discriminant.
 */
public abstract class Payload {

    Payload() {
    }

    public abstract MessageType type();
}

package com.ghack.codec;

import com.ghack.protocol.Envelope;

/**
 * Outcome of a single decode attempt: either a complete envelope together
 * with the number of bytes it occupied (prefix included), or
 * {@link #INCOMPLETE} when more bytes have to be buffered first.
 */
public final class DecodeResult {

    public static final DecodeResult INCOMPLETE = new DecodeResult(null, 0);

    private final Envelope envelope;
    private final int bytesConsumed;

    private DecodeResult(Envelope envelope, int bytesConsumed) {
        this.envelope = envelope;
        this.bytesConsumed = bytesConsumed;
    }

    static DecodeResult complete(Envelope envelope, int bytesConsumed) {
        return new DecodeResult(envelope, bytesConsumed);
    }

    public boolean isComplete() {
        return envelope != null;
    }

    /**
     * @throws IllegalStateException for {@link #INCOMPLETE}
     */
    public Envelope getEnvelope() {
        if (envelope == null) {
            throw new IllegalStateException("Frame is incomplete");
        }
        return envelope;
    }

    public int getBytesConsumed() {
        return bytesConsumed;
    }

    @Override
    public String toString() {
        return isComplete() ? "DecodeResult{" + envelope + ", bytes=" + bytesConsumed + '}' : "DecodeResult{INCOMPLETE}";
    }
}

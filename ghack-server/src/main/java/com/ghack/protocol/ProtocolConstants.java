package com.ghack.protocol;

public final class ProtocolConstants {

    /** Protocol version spoken by this implementation. */
    public static final int PROTOCOL_VERSION = 1;

    /** Largest serialized envelope a frame can carry (unsigned 16-bit length). */
    public static final int MAX_FRAME_PAYLOAD = 0xFFFF;

    /** Size of the big-endian length prefix. */
    public static final int LENGTH_PREFIX_BYTES = 2;

    public static final int DEFAULT_MAX_ARRAY_DEPTH = 32;

    private ProtocolConstants() {
    }
}

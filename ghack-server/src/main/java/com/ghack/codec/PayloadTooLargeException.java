package com.ghack.codec;

import io.netty.handler.codec.EncoderException;

/**
 * An envelope serialized to more bytes than a frame length prefix can
 * express. Raised before anything is written.
 */
public class PayloadTooLargeException extends EncoderException {

    private static final long serialVersionUID = 1L;

    private final int size;

    public PayloadTooLargeException(int size, int limit) {
        super("Serialized envelope is " + size + " bytes, limit is " + limit);
        this.size = size;
    }

    public int getSize() {
        return size;
    }
}

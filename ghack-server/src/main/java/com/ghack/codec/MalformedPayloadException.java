package com.ghack.codec;

import io.netty.handler.codec.DecoderException;

/**
 * The bytes of a frame do not parse as an envelope. The stream cannot be
 * resynchronized after this, so the connection has to be closed.
 */
public class MalformedPayloadException extends DecoderException {

    private static final long serialVersionUID = 1L;

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}

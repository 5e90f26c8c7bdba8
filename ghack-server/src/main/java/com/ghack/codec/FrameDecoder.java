package com.ghack.codec;

import com.ghack.protocol.Envelope;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Turns the inbound byte stream of a channel into {@link Envelope}s.
 *
 * Emits nothing while a frame is incomplete. After a malformed frame every
 * further byte is discarded; the handler behind this decoder is expected to
 * close the channel when it sees the exception.
 */
public class FrameDecoder extends ByteToMessageDecoder {

    private final WireCodec codec;
    private boolean failed;

    public FrameDecoder(WireCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            DecodeResult result = codec.decode(in);
            if (result.isComplete()) {
                out.add(result.getEnvelope());
            }
        } catch (MalformedPayloadException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}

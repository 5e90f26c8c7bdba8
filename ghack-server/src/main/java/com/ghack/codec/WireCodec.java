package com.ghack.codec;

import com.ghack.protocol.Envelope;
import com.ghack.protocol.ProtocolConstants;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;

/**
 * Frame level codec: a big-endian unsigned 16-bit length followed by that
 * many bytes of serialized envelope.
 *
 * Decoding is incremental. {@link #decode(ByteBuf)} leaves the buffer
 * untouched and returns {@link DecodeResult#INCOMPLETE} until a whole frame
 * is buffered, so it can be fed from transports that deliver arbitrary
 * fragments. There is no resynchronization: once a frame turns out to be
 * malformed the rest of the stream is meaningless.
 */
public class WireCodec {

    private final EnvelopeSerializer serializer;

    public WireCodec() {
        this(ProtocolConstants.DEFAULT_MAX_ARRAY_DEPTH);
    }

    public WireCodec(int maxArrayDepth) {
        this(new EnvelopeSerializer(maxArrayDepth));
    }

    public WireCodec(EnvelopeSerializer serializer) {
        this.serializer = serializer;
    }

    public EnvelopeSerializer getSerializer() {
        return serializer;
    }

    /**
     * Encodes one envelope into a complete frame.
     *
     * @throws PayloadTooLargeException if the body exceeds 65535 bytes
     */
    public byte[] encode(Envelope envelope) {
        byte[] body = serializeChecked(envelope);
        byte[] frame = new byte[ProtocolConstants.LENGTH_PREFIX_BYTES + body.length];
        frame[0] = (byte) (body.length >>> 8);
        frame[1] = (byte) body.length;
        System.arraycopy(body, 0, frame, ProtocolConstants.LENGTH_PREFIX_BYTES, body.length);
        return frame;
    }

    /**
     * Encodes one envelope into a buffer from the given allocator. The
     * caller owns the returned buffer.
     *
     * @throws PayloadTooLargeException if the body exceeds 65535 bytes
     */
    public ByteBuf encode(Envelope envelope, ByteBufAllocator allocator) {
        byte[] body = serializeChecked(envelope);
        ByteBuf frame = allocator.buffer(ProtocolConstants.LENGTH_PREFIX_BYTES + body.length);
        frame.writeShort(body.length);
        frame.writeBytes(body);
        return frame;
    }

    private byte[] serializeChecked(Envelope envelope) {
        byte[] body = serializer.serialize(envelope);
        if (body.length > ProtocolConstants.MAX_FRAME_PAYLOAD) {
            throw new PayloadTooLargeException(body.length, ProtocolConstants.MAX_FRAME_PAYLOAD);
        }
        return body;
    }

    /**
     * Tries to decode one frame from the readable bytes of {@code in}.
     *
     * On success the reader index is advanced past the frame. When the
     * frame is incomplete nothing is consumed.
     *
     * @throws MalformedPayloadException if a complete frame does not parse; the frame's
     *                                   bytes are consumed in that case
     */
    public DecodeResult decode(ByteBuf in) {
        if (in.readableBytes() < ProtocolConstants.LENGTH_PREFIX_BYTES) {
            return DecodeResult.INCOMPLETE;
        }
        int length = in.getUnsignedShort(in.readerIndex());
        int frameLength = ProtocolConstants.LENGTH_PREFIX_BYTES + length;
        if (in.readableBytes() < frameLength) {
            return DecodeResult.INCOMPLETE;
        }

        byte[] body = new byte[length];
        in.skipBytes(ProtocolConstants.LENGTH_PREFIX_BYTES);
        in.readBytes(body);
        return DecodeResult.complete(serializer.deserialize(body), frameLength);
    }

    /**
     * Decodes the first frame found at the start of {@code bytes}.
     */
    public DecodeResult decode(byte[] bytes) {
        return decode(Unpooled.wrappedBuffer(bytes));
    }
}

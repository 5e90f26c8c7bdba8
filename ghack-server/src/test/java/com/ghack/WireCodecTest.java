package com.ghack;

import com.ghack.codec.DecodeResult;
import com.ghack.codec.FrameDecoder;
import com.ghack.codec.MalformedPayloadException;
import com.ghack.codec.PayloadTooLargeException;
import com.ghack.codec.WireCodec;
import com.ghack.protocol.AddEntity;
import com.ghack.protocol.AssignControl;
import com.ghack.protocol.CombatHit;
import com.ghack.protocol.Connect;
import com.ghack.protocol.Disconnect;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.EntityDeath;
import com.ghack.protocol.Envelope;
import com.ghack.protocol.Login;
import com.ghack.protocol.LoginFailure;
import com.ghack.protocol.LoginResult;
import com.ghack.protocol.Move;
import com.ghack.protocol.RemoveEntity;
import com.ghack.protocol.UpdateState;
import com.ghack.protocol.Vector3;
import com.ghack.protocol.value.StateValue;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.*;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the wire format:
 * - Every message type survives encode/decode
 * - Framing (length prefix, partial input, size limit)
 * - Malformed frames
 */
@DisplayName("Wire Codec Tests")
class WireCodecTest {

    private WireCodec codec;

    @BeforeEach
    void setUp() {
        codec = new WireCodec();
    }

    private static List<Envelope> allMessages() {
        List<Envelope> messages = new ArrayList<>();
        // all optional fields present
        messages.add(Envelope.of(new Connect(1, "ghack 0.1")));
        messages.add(Envelope.of(new Disconnect(DisconnectReason.KICKED, "bye")));
        messages.add(Envelope.of(Login.builder("alice").authToken("secret").permissions(7).build()));
        messages.add(Envelope.of(LoginResult.rejected(LoginFailure.SERVER_FULL)));
        messages.add(Envelope.of(new AddEntity(42, "goblin")));
        messages.add(Envelope.of(new RemoveEntity(42, "goblin")));
        messages.add(Envelope.of(new UpdateState(42, "Health", StateValue.ofInt(30))));
        messages.add(Envelope.of(new Move(new Vector3(1, -0.5, 0))));
        messages.add(Envelope.of(AssignControl.revoke(7)));
        messages.add(Envelope.of(EntityDeath.builder(42).name("goblin").killerUid(7).killerName("alice").build()));
        messages.add(Envelope.of(CombatHit.builder(7, 42, 2.5f).attackerName("alice").victimName("goblin").build()));
        // all optional fields absent
        messages.add(Envelope.of(new Connect(1)));
        messages.add(Envelope.of(new Disconnect(DisconnectReason.QUIT)));
        messages.add(Envelope.of(new Login("bob")));
        messages.add(Envelope.of(LoginResult.accepted()));
        messages.add(Envelope.of(new AddEntity(-3)));
        messages.add(Envelope.of(new RemoveEntity(0)));
        messages.add(Envelope.of(new AssignControl(7)));
        messages.add(Envelope.of(new EntityDeath(42)));
        messages.add(Envelope.of(new CombatHit(7, 42, 0f)));
        return messages;
    }

    // ==========================================
    // Test: Round Trip
    // ==========================================

    @Test
    @DisplayName("Every message type should survive encode/decode")
    void testRoundTripAllTypes() {
        for (Envelope envelope : allMessages()) {
            byte[] frame = codec.encode(envelope);
            DecodeResult result = codec.decode(frame);

            assertTrue(result.isComplete(), "Frame should be complete: " + envelope);
            assertEquals(envelope, result.getEnvelope());
            assertEquals(frame.length, result.getBytesConsumed());
        }
        System.out.println("✓ " + allMessages().size() + " messages round-tripped");
    }

    @Test
    @DisplayName("Every StateValue kind should survive encode/decode")
    void testRoundTripStateValues() {
        List<StateValue> values = List.of(
                StateValue.ofBool(true),
                StateValue.ofBool(false),
                StateValue.ofInt(Integer.MIN_VALUE),
                StateValue.ofFloat(-1.25f),
                StateValue.ofString(""),
                StateValue.ofString("héllo"),
                StateValue.ofVector3(new Vector3(3, 4, 5)),
                StateValue.ofArray(),
                StateValue.ofArray(StateValue.ofInt(1), StateValue.ofArray(StateValue.ofString("x"))),
                StateValue.ofArray(StateValue.ofArray(StateValue.ofVector3(new Vector3(1, -2, 0.5)))));

        for (StateValue value : values) {
            Envelope envelope = Envelope.of(new UpdateState(1, "S", value));
            assertEquals(envelope, codec.decode(codec.encode(envelope)).getEnvelope(), value.toString());
        }
    }

    @Test
    @DisplayName("Frame should match the protobuf encoding byte for byte")
    void testKnownBytes() {
        byte[] frame = codec.encode(Envelope.of(new Connect(1)));

        // length 7 | type=CONNECT | field 16 { version=1 }
        byte[] expected = {0x00, 0x07, 0x08, 0x01, (byte) 0x82, 0x01, 0x02, 0x08, 0x01};
        assertArrayEquals(expected, frame);
    }

    // ==========================================
    // Test: Framing
    // ==========================================

    @Test
    @DisplayName("Length prefix should be big-endian body length")
    void testLengthPrefix() {
        byte[] frame = codec.encode(Envelope.of(new AddEntity(1, "x".repeat(300))));
        int length = ((frame[0] & 0xFF) << 8) | (frame[1] & 0xFF);
        assertEquals(frame.length - 2, length);
    }

    @Test
    @DisplayName("Incomplete input should consume nothing")
    void testIncompleteFrame() {
        byte[] frame = codec.encode(Envelope.of(new AddEntity(42, "goblin")));

        for (int available = 0; available < frame.length; available++) {
            ByteBuf in = Unpooled.wrappedBuffer(frame, 0, available);
            DecodeResult result = codec.decode(in);
            assertFalse(result.isComplete(), "Should be incomplete with " + available + " bytes");
            assertEquals(0, in.readerIndex());
        }
    }

    @Test
    @DisplayName("Decoding should stop at the end of the first frame")
    void testConsumesOneFrame() {
        byte[] first = codec.encode(Envelope.of(new AddEntity(1)));
        byte[] second = codec.encode(Envelope.of(new RemoveEntity(1)));
        ByteBuf in = Unpooled.wrappedBuffer(first, second);

        assertEquals(Envelope.of(new AddEntity(1)), codec.decode(in).getEnvelope());
        assertEquals(first.length, in.readerIndex());
        assertEquals(Envelope.of(new RemoveEntity(1)), codec.decode(in).getEnvelope());
        assertFalse(in.isReadable());
    }

    @Test
    @DisplayName("Feeding one byte at a time should yield the same messages")
    void testByteAtATime() throws Exception {
        List<Envelope> sent = allMessages();
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        for (Envelope envelope : sent) {
            stream.write(codec.encode(envelope));
        }

        EmbeddedChannel channel = new EmbeddedChannel(new FrameDecoder(codec));
        for (byte b : stream.toByteArray()) {
            channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{b}));
        }

        List<Envelope> received = new ArrayList<>();
        Envelope envelope;
        while ((envelope = channel.readInbound()) != null) {
            received.add(envelope);
        }
        assertEquals(sent, received);
        channel.finishAndReleaseAll();

        System.out.println("✓ " + stream.size() + " bytes fed one at a time, " + received.size() + " messages decoded");
    }

    // ==========================================
    // Test: Size Limit
    // ==========================================

    @Test
    @DisplayName("Body of exactly 65535 bytes should encode, 65536 should not")
    void testSizeBoundary() {
        int length = findStringLengthForBody(65535);

        byte[] frame = codec.encode(bigMessage(length));
        assertEquals(65537, frame.length);
        assertEquals((byte) 0xFF, frame[0]);
        assertEquals((byte) 0xFF, frame[1]);
        assertEquals(bigMessage(length), codec.decode(frame).getEnvelope());

        PayloadTooLargeException e = assertThrows(PayloadTooLargeException.class,
                () -> codec.encode(bigMessage(length + 1)));
        assertEquals(65536, e.getSize());

        System.out.println("✓ Size boundary at string length " + length);
    }

    private Envelope bigMessage(int stringLength) {
        return Envelope.of(new UpdateState(1, "Blob", StateValue.ofString("a".repeat(stringLength))));
    }

    private int findStringLengthForBody(int bodySize) {
        for (int length = bodySize - 64; length < bodySize; length++) {
            if (codec.getSerializer().serialize(bigMessage(length)).length == bodySize) {
                return length;
            }
        }
        return fail("No string length gives a body of " + bodySize + " bytes");
    }

    // ==========================================
    // Test: Malformed Frames
    // ==========================================

    @Test
    @DisplayName("Unknown message type should be malformed and the frame consumed")
    void testUnknownType() {
        ByteBuf in = Unpooled.wrappedBuffer(new byte[]{0x00, 0x02, 0x08, 0x63});

        assertThrows(MalformedPayloadException.class, () -> codec.decode(in));
        assertFalse(in.isReadable(), "Malformed frame should be consumed");
    }

    @Test
    @DisplayName("Empty body should be malformed")
    void testEmptyBody() {
        assertThrows(MalformedPayloadException.class, () -> codec.decode(new byte[]{0x00, 0x00}));
    }

    @Test
    @DisplayName("Truncated protobuf inside a complete frame should be malformed")
    void testTruncatedBody() {
        // type=CONNECT, field 16 claims 5 bytes but the frame ends after 1
        byte[] frame = {0x00, 0x05, 0x08, 0x01, (byte) 0x82, 0x01, 0x05};
        assertThrows(MalformedPayloadException.class, () -> codec.decode(frame));
    }

    @Test
    @DisplayName("Frame decoder should fail once and then discard input")
    void testFrameDecoderAfterFailure() {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameDecoder(codec));

        assertThrows(DecoderException.class,
                () -> channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{0x00, 0x02, 0x08, 0x63})));

        // a valid frame after the failure is ignored
        channel.writeInbound(Unpooled.wrappedBuffer(codec.encode(Envelope.of(new AddEntity(1)))));
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }
}

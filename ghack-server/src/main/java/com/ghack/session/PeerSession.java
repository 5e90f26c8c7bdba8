package com.ghack.session;

import com.ghack.codec.PayloadTooLargeException;
import com.ghack.codec.WireCodec;
import com.ghack.handshake.HandshakeStateMachine;
import com.ghack.protocol.Disconnect;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.Envelope;
import com.ghack.protocol.Payload;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One side of a protocol connection: the channel, its handshake state and
 * the entities announced over it.
 *
 * Outbound envelopes are encoded on the calling thread, so an oversized
 * envelope fails at the call site before anything reaches the wire. The
 * write itself is queued on the channel and is safe from any thread.
 */
public class PeerSession {

    private static final Logger logger = LoggerFactory.getLogger(PeerSession.class);

    private final String label;
    private final Channel channel;
    private final WireCodec codec;
    private final HandshakeStateMachine handshake;
    private final EntityTable entities;

    public PeerSession(String label, Channel channel, WireCodec codec, HandshakeStateMachine handshake) {
        this.label = label;
        this.channel = channel;
        this.codec = codec;
        this.handshake = handshake;
        this.entities = new EntityTable(label);
    }

    public String getLabel() {
        return label;
    }

    public Channel getChannel() {
        return channel;
    }

    public HandshakeStateMachine getHandshake() {
        return handshake;
    }

    public EntityTable getEntities() {
        return entities;
    }

    public boolean isEstablished() {
        return handshake.isEstablished();
    }

    /**
     * Checks if the session can still exchange messages (channel open, not closed by protocol).
     */
    public boolean isActive() {
        return channel != null && channel.isActive() && !handshake.isClosed();
    }

    public ChannelFuture send(Payload payload) {
        return send(Envelope.of(payload));
    }

    /**
     * Sends one envelope.
     *
     * @throws IllegalStateException    if the current handshake phase does not allow this message
     * @throws PayloadTooLargeException if the envelope does not fit in a frame
     */
    public ChannelFuture send(Envelope envelope) {
        if (!handshake.permitsOutbound(envelope.getType())) {
            throw new IllegalStateException("Cannot send " + envelope.getType() + " in phase "
                    + handshake.getPhase() + " as " + handshake.getRole());
        }
        return write(envelope);
    }

    /**
     * Sends the envelope if the current phase allows it, otherwise drops it.
     * Used for broadcasts, where a target may be mid-handshake or closing.
     *
     * @return true if the envelope was written
     */
    public boolean trySend(Envelope envelope) {
        // single phase check: the owning event loop may close this session concurrently
        if (!isActive() || !handshake.permitsOutbound(envelope.getType())) {
            return false;
        }
        write(envelope);
        return true;
    }

    private ChannelFuture write(Envelope envelope) {
        ByteBuf frame = codec.encode(envelope, channel.alloc());
        entities.track(envelope.getPayload());
        logger.debug(">> [{}] {}", label, envelope);
        return channel.writeAndFlush(frame);
    }

    /**
     * Sends Disconnect, moves to CLOSED and closes the channel once the
     * Disconnect is flushed. Does nothing when already closed.
     */
    public void disconnect(DisconnectReason reason, String reasonText) {
        if (handshake.isClosed()) {
            return;
        }
        logger.info("[{}] disconnecting: {} {}", label, reason, reasonText != null ? reasonText : "");
        ChannelFuture sent = null;
        if (channel.isActive()) {
            sent = send(new Disconnect(reason, reasonText));
        }
        handshake.apply(HandshakeStateMachine.Event.CLOSED);
        if (sent != null) {
            sent.addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    /**
     * Moves to CLOSED without sending anything, after a Disconnect was
     * received or the transport went away.
     */
    public void markClosed() {
        if (!handshake.isClosed()) {
            handshake.apply(HandshakeStateMachine.Event.CLOSED);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "label='" + label + '\'' +
                ", phase=" + handshake.getPhase() +
                ", entities=" + entities.size() +
                ", active=" + isActive() +
                '}';
    }
}

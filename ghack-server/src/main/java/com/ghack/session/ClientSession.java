package com.ghack.session;

import com.ghack.codec.WireCodec;
import com.ghack.handshake.HandshakeStateMachine;
import com.ghack.handshake.Role;
import io.netty.channel.Channel;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side view of a connected client.
 *
 * Besides the protocol state of {@link PeerSession} it tracks:
 * - Unique session ID
 * - The authenticated identity once Login succeeded
 *
 * Thread Safety:
 * - Session ID and channel are immutable after creation
 * - Identity uses AtomicReference / volatile for safe reads from game logic threads
 */
public class ClientSession extends PeerSession {

    private final String sessionId;
    private final long connectedAt;

    private final AtomicReference<String> playerName;
    private volatile int grantedPermissions;

    public ClientSession(Channel channel, WireCodec codec, int protocolVersion) {
        this(UUID.randomUUID().toString(), channel, codec, protocolVersion);
    }

    private ClientSession(String sessionId, Channel channel, WireCodec codec, int protocolVersion) {
        super(sessionId.substring(0, 8), channel, codec, new HandshakeStateMachine(Role.SERVER, protocolVersion));
        this.sessionId = sessionId;
        this.connectedAt = System.currentTimeMillis();
        this.playerName = new AtomicReference<>(null);
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    /**
     * Authenticated name, null before a successful Login.
     */
    public String getPlayerName() {
        return playerName.get();
    }

    public int getGrantedPermissions() {
        return grantedPermissions;
    }

    /**
     * Records the identity accepted by the login authority.
     */
    public void authenticate(String name, int permissions) {
        playerName.set(name);
        grantedPermissions = permissions;
    }

    @Override
    public String toString() {
        return "ClientSession{" +
                "sessionId='" + sessionId + '\'' +
                ", playerName='" + playerName.get() + '\'' +
                ", phase=" + getHandshake().getPhase() +
                ", active=" + isActive() +
                '}';
    }
}

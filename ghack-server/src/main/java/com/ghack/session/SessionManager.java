package com.ghack.session;

import com.ghack.codec.WireCodec;
import com.ghack.protocol.Envelope;
import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages all connected client sessions.
 *
 * Thread Safety:
 * - Uses ConcurrentHashMap for thread-safe operations
 * - All methods can be called from any thread safely
 *
 * Design Notes:
 * - Session lookup by channel ID for fast access from Netty handlers
 * - Session lookup by session ID for game logic operations
 * - Sessions never share state; each owns its handshake and entity table
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final WireCodec codec;
    private final int protocolVersion;

    // Map channel ID to session for fast lookup from Netty handlers
    private final Map<String, ClientSession> sessionsByChannelId;

    // Map session ID to session for game logic operations
    private final Map<String, ClientSession> sessionsBySessionId;

    public SessionManager(WireCodec codec, int protocolVersion) {
        this.codec = codec;
        this.protocolVersion = protocolVersion;
        this.sessionsByChannelId = new ConcurrentHashMap<>();
        this.sessionsBySessionId = new ConcurrentHashMap<>();
    }

    /**
     * Creates and registers a new session for a connected channel.
     *
     * @param channel The Netty channel for the new connection
     * @return The created ClientSession, waiting for Connect
     */
    public ClientSession createSession(Channel channel) {
        ClientSession session = new ClientSession(channel, codec, protocolVersion);
        String channelId = channel.id().asLongText();

        sessionsByChannelId.put(channelId, session);
        sessionsBySessionId.put(session.getSessionId(), session);

        logger.info("Session created: {} (channel: {})", session.getSessionId(), channelId);
        logger.debug("Total active sessions: {}", sessionsBySessionId.size());

        return session;
    }

    /**
     * Removes a session when the client disconnects.
     *
     * @param channel The Netty channel that disconnected
     * @return The removed session, or null if not found
     */
    public ClientSession removeSession(Channel channel) {
        String channelId = channel.id().asLongText();
        ClientSession session = sessionsByChannelId.remove(channelId);

        if (session != null) {
            sessionsBySessionId.remove(session.getSessionId());
            logger.info("Session removed: {} (channel: {})", session.getSessionId(), channelId);
            logger.debug("Total active sessions: {}", sessionsBySessionId.size());
        }

        return session;
    }

    public ClientSession getSessionByChannel(Channel channel) {
        return sessionsByChannelId.get(channel.id().asLongText());
    }

    public ClientSession getSessionById(String sessionId) {
        return sessionsBySessionId.get(sessionId);
    }

    /**
     * Returns all sessions.
     * Note: Returns a live view - may not reflect concurrent modifications.
     */
    public Collection<ClientSession> getAllSessions() {
        return sessionsBySessionId.values();
    }

    public int getSessionCount() {
        return sessionsBySessionId.size();
    }

    /**
     * Number of sessions that completed the handshake.
     */
    public int getEstablishedCount() {
        return (int) sessionsBySessionId.values().stream()
                .filter(ClientSession::isEstablished)
                .count();
    }

    /**
     * Sends an envelope to every established session except one.
     *
     * @param excludeSessionId session to skip, may be null
     * @return number of sessions the envelope was written to
     */
    public int broadcast(Envelope envelope, String excludeSessionId) {
        int sent = 0;
        for (ClientSession session : sessionsBySessionId.values()) {
            if (session.getSessionId().equals(excludeSessionId) || !session.isEstablished()) {
                continue;
            }
            if (session.trySend(envelope)) {
                sent++;
            }
        }
        return sent;
    }

    public int broadcast(Envelope envelope) {
        return broadcast(envelope, null);
    }
}

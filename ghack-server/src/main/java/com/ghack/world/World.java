package com.ghack.world;

import com.ghack.protocol.AddEntity;
import com.ghack.protocol.AssignControl;
import com.ghack.protocol.Envelope;
import com.ghack.protocol.Payload;
import com.ghack.protocol.RemoveEntity;
import com.ghack.protocol.UpdateState;
import com.ghack.protocol.Vector3;
import com.ghack.protocol.value.StateValue;
import com.ghack.server.GameLogic;
import com.ghack.session.ClientSession;
import com.ghack.session.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A shared world where every logged-in player controls one avatar.
 *
 * - Joining: the newcomer is told about every avatar already present,
 *   then everyone learns about the new avatar and its owner gets control
 * - Moving: the direction is added to the avatar position and the new
 *   position is broadcast
 * - Leaving: the avatar is removed everywhere
 *
 * Thread Safety Strategy:
 * 1. ConcurrentHashMap for avatars - lookups from any event loop
 * 2. AtomicInteger for entity ids - lock-free allocation
 * 3. Joins, moves and leaves are synchronized so every session sees the
 *    same order of AddEntity / UpdateState / RemoveEntity
 * 4. Broadcasts only reach sessions that were already sent the world
 */
public class World implements GameLogic {

    private static final Logger logger = LoggerFactory.getLogger(World.class);

    public static final String POSITION = "Position";
    public static final String ASSET = "Asset";
    public static final String PLAYER_ASSET = "@";

    private final SessionManager sessionManager;
    private final Vector3 spawnPoint;

    private final ConcurrentHashMap<String, Avatar> avatars;  // sessionId -> avatar
    private final AtomicInteger nextEntityId;

    public World(SessionManager sessionManager) {
        this(sessionManager, Vector3.ZERO);
    }

    public World(SessionManager sessionManager, Vector3 spawnPoint) {
        this.sessionManager = sessionManager;
        this.spawnPoint = spawnPoint;
        this.avatars = new ConcurrentHashMap<>();
        this.nextEntityId = new AtomicInteger(1);
    }

    @Override
    public synchronized void onSessionEstablished(ClientSession session) {
        // Bring the newcomer up to date first
        for (Avatar other : avatars.values()) {
            session.send(new AddEntity(other.getId(), other.getName()));
            session.send(new UpdateState(other.getId(), POSITION, StateValue.ofVector3(other.getPosition())));
            session.send(new UpdateState(other.getId(), ASSET, StateValue.ofString(other.getAsset())));
        }

        Avatar avatar = new Avatar(nextEntityId.getAndIncrement(), session.getPlayerName(),
                PLAYER_ASSET, spawnPoint);
        avatars.put(session.getSessionId(), avatar);

        broadcast(new AddEntity(avatar.getId(), avatar.getName()));
        broadcast(new UpdateState(avatar.getId(), POSITION, StateValue.ofVector3(avatar.getPosition())));
        broadcast(new UpdateState(avatar.getId(), ASSET, StateValue.ofString(avatar.getAsset())));
        session.send(new AssignControl(avatar.getId()));

        logger.info("Player {} entered the world as entity {} ({} avatars)",
                avatar.getName(), avatar.getId(), avatars.size());
    }

    @Override
    public synchronized void onMove(ClientSession session, Vector3 direction) {
        Avatar avatar = avatars.get(session.getSessionId());
        if (avatar == null) {
            logger.warn("Move from session {} without an avatar", session.getSessionId());
            return;
        }
        avatar.setPosition(avatar.getPosition().add(direction));
        broadcast(new UpdateState(avatar.getId(), POSITION, StateValue.ofVector3(avatar.getPosition())));
    }

    @Override
    public void onMessage(ClientSession session, Envelope envelope) {
        logger.debug("Ignoring {} from {}", envelope.getType(), session.getPlayerName());
    }

    @Override
    public synchronized void onSessionClosed(ClientSession session) {
        Avatar avatar = avatars.remove(session.getSessionId());
        if (avatar == null) {
            return;
        }
        broadcast(new RemoveEntity(avatar.getId(), avatar.getName()));
        logger.info("Player {} left the world ({} avatars)", avatar.getName(), avatars.size());
    }

    /**
     * Sends to every session that already has an avatar. A session only
     * joins that set after it was sent the world, so it never hears about
     * an entity before its AddEntity.
     */
    private void broadcast(Payload payload) {
        Envelope envelope = Envelope.of(payload);
        for (String sessionId : avatars.keySet()) {
            ClientSession session = sessionManager.getSessionById(sessionId);
            if (session != null) {
                session.trySend(envelope);
            }
        }
    }

    /**
     * Avatar of a session, or null when it has none.
     */
    public Avatar getAvatar(String sessionId) {
        return avatars.get(sessionId);
    }

    public Collection<Avatar> getAvatars() {
        return Collections.unmodifiableCollection(avatars.values());
    }

    public int getAvatarCount() {
        return avatars.size();
    }

    /**
     * The entity a player controls.
     */
    public static class Avatar {
        private final int id;
        private final String name;
        private final String asset;
        private volatile Vector3 position;

        Avatar(int id, String name, String asset, Vector3 position) {
            this.id = id;
            this.name = name;
            this.asset = asset;
            this.position = position;
        }

        public int getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getAsset() {
            return asset;
        }

        public Vector3 getPosition() {
            return position;
        }

        void setPosition(Vector3 position) {
            this.position = position;
        }

        @Override
        public String toString() {
            return "Avatar{id=" + id + ", name='" + name + "', position=" + position + '}';
        }
    }
}

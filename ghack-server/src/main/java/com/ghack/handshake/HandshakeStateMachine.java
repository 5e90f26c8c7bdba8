package com.ghack.handshake;

import com.ghack.protocol.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handshake state of one side of one connection.
 *
 * The machine does not send anything itself. Handlers ask it whether a
 * message may be received ({@link #permitsInbound}) or sent
 * ({@link #permitsOutbound}) in the current phase and report what happened
 * through {@link #apply(Event)}, which either moves to the next phase or
 * rejects the event as an illegal transition.
 *
 * Phase changes happen on the connection's event loop; the phase itself is
 * volatile so other threads can read it.
 */
public class HandshakeStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(HandshakeStateMachine.class);

    /**
     * Things that move the handshake forward.
     */
    public enum Event {
        /** Versions matched (server received Connect, or client received the reply). */
        CONNECT_ACCEPTED,
        /** Client sent Login. */
        LOGIN_SENT,
        /** Server received Login and consults the login authority. */
        LOGIN_RECEIVED,
        LOGIN_SUCCEEDED,
        LOGIN_FAILED,
        /** Disconnect sent or received, transport closed, or protocol error. */
        CLOSED
    }

    private final Role role;
    private final int supportedVersion;
    private volatile HandshakePhase phase;
    private volatile int negotiatedVersion = -1;

    public HandshakeStateMachine(Role role, int supportedVersion) {
        this.role = role;
        this.supportedVersion = supportedVersion;
        this.phase = HandshakePhase.initial(role);
    }

    public Role getRole() {
        return role;
    }

    public HandshakePhase getPhase() {
        return phase;
    }

    public int getSupportedVersion() {
        return supportedVersion;
    }

    /**
     * Version both sides agreed on, or -1 before CONNECT_ACCEPTED.
     */
    public int getNegotiatedVersion() {
        return negotiatedVersion;
    }

    public boolean isEstablished() {
        return phase == HandshakePhase.ESTABLISHED;
    }

    public boolean isClosed() {
        return phase == HandshakePhase.CLOSED;
    }

    public boolean supportsVersion(int version) {
        return version == supportedVersion;
    }

    /**
     * Records the agreed version and leaves the Connect phase.
     */
    public void connectAccepted(int version) {
        if (!supportsVersion(version)) {
            throw new IllegalArgumentException("Version " + version + " is not " + supportedVersion);
        }
        apply(Event.CONNECT_ACCEPTED);
        negotiatedVersion = version;
    }

    /**
     * Applies an event and returns the new phase.
     *
     * @throws IllegalStateException if the event is not valid in the current phase
     */
    public synchronized HandshakePhase apply(Event event) {
        HandshakePhase from = phase;
        HandshakePhase to = next(role, from, event);
        if (to == null) {
            throw new IllegalStateException(role + " cannot handle " + event + " in phase " + from);
        }
        phase = to;
        if (from != to) {
            logger.debug("{} handshake {} -> {} on {}", role, from, to, event);
        }
        return to;
    }

    /**
     * Transition function. Returns null for an illegal transition.
     */
    static HandshakePhase next(Role role, HandshakePhase phase, Event event) {
        if (event == Event.CLOSED) {
            return HandshakePhase.CLOSED;
        }
        switch (phase) {
            case AWAITING_CONNECT:
                return role == Role.SERVER && event == Event.CONNECT_ACCEPTED ? HandshakePhase.AWAITING_LOGIN : null;
            case AWAITING_CONNECT_ACK:
                return role == Role.CLIENT && event == Event.CONNECT_ACCEPTED ? HandshakePhase.AWAITING_LOGIN : null;
            case AWAITING_LOGIN:
                if (role == Role.SERVER && event == Event.LOGIN_RECEIVED) {
                    return HandshakePhase.AWAITING_LOGIN_RESULT;
                }
                return role == Role.CLIENT && event == Event.LOGIN_SENT ? HandshakePhase.AWAITING_LOGIN_RESULT : null;
            case AWAITING_LOGIN_RESULT:
                if (event == Event.LOGIN_SUCCEEDED) {
                    return HandshakePhase.ESTABLISHED;
                }
                return event == Event.LOGIN_FAILED ? HandshakePhase.CLOSED : null;
            default:
                return null;
        }
    }

    /**
     * Whether a message of this type may be received in the current phase.
     */
    public boolean permitsInbound(MessageType type) {
        return permits(role.peer(), phase, type, true);
    }

    /**
     * Whether a message of this type may be sent in the current phase.
     */
    public boolean permitsOutbound(MessageType type) {
        return permits(role, phase, type, false);
    }

    /**
     * @param sender  role of the side sending the message
     * @param phase   phase of the side evaluating the message
     * @param inbound true when evaluated by the receiver
     */
    private static boolean permits(Role sender, HandshakePhase phase, MessageType type, boolean inbound) {
        if (phase == HandshakePhase.CLOSED) {
            return false;
        }
        if (type == MessageType.DISCONNECT) {
            return true;
        }
        if (phase == HandshakePhase.ESTABLISHED) {
            switch (type) {
                case MOVE:
                    return sender == Role.CLIENT;
                case ASSIGN_CONTROL:
                    return sender == Role.SERVER;
                case ADD_ENTITY:
                case REMOVE_ENTITY:
                case UPDATE_STATE:
                case ENTITY_DEATH:
                case COMBAT_HIT:
                    return true;
                default:
                    return false;
            }
        }
        if (sender == Role.CLIENT) {
            // client messages, seen by the server (inbound) or by the client itself
            if (type == MessageType.CONNECT) {
                return phase == (inbound ? HandshakePhase.AWAITING_CONNECT : HandshakePhase.AWAITING_CONNECT_ACK);
            }
            if (type == MessageType.LOGIN) {
                return phase == HandshakePhase.AWAITING_LOGIN;
            }
            return false;
        }
        // server messages; the server sends before it applies the matching event
        if (type == MessageType.CONNECT) {
            return phase == (inbound ? HandshakePhase.AWAITING_CONNECT_ACK : HandshakePhase.AWAITING_LOGIN);
        }
        if (type == MessageType.LOGIN_RESULT) {
            return phase == HandshakePhase.AWAITING_LOGIN_RESULT;
        }
        return false;
    }

    @Override
    public String toString() {
        return "HandshakeStateMachine{role=" + role + ", phase=" + phase + ", version=" + negotiatedVersion + '}';
    }
}

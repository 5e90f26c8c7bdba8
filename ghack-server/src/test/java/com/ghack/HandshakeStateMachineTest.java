package com.ghack;

import com.ghack.handshake.HandshakePhase;
import com.ghack.handshake.HandshakeStateMachine;
import com.ghack.handshake.HandshakeStateMachine.Event;
import com.ghack.handshake.Role;
import com.ghack.protocol.MessageType;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the connection lifecycle:
 * - Legal paths for both roles
 * - Illegal transitions
 * - Which messages each phase lets through, in each direction
 */
@DisplayName("Handshake State Machine Tests")
class HandshakeStateMachineTest {

    private static final int VERSION = 1;

    // ==========================================
    // Test: Transitions
    // ==========================================

    @Test
    @DisplayName("Server should go from AWAITING_CONNECT to ESTABLISHED")
    void testServerHappyPath() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
        assertEquals(HandshakePhase.AWAITING_CONNECT, server.getPhase());
        assertEquals(-1, server.getNegotiatedVersion());

        server.connectAccepted(VERSION);
        assertEquals(HandshakePhase.AWAITING_LOGIN, server.getPhase());
        assertEquals(VERSION, server.getNegotiatedVersion());

        assertEquals(HandshakePhase.AWAITING_LOGIN_RESULT, server.apply(Event.LOGIN_RECEIVED));
        assertEquals(HandshakePhase.ESTABLISHED, server.apply(Event.LOGIN_SUCCEEDED));
        assertTrue(server.isEstablished());
    }

    @Test
    @DisplayName("Client should go from AWAITING_CONNECT_ACK to ESTABLISHED")
    void testClientHappyPath() {
        HandshakeStateMachine client = new HandshakeStateMachine(Role.CLIENT, VERSION);
        assertEquals(HandshakePhase.AWAITING_CONNECT_ACK, client.getPhase());

        client.connectAccepted(VERSION);
        assertEquals(HandshakePhase.AWAITING_LOGIN_RESULT, client.apply(Event.LOGIN_SENT));
        assertEquals(HandshakePhase.ESTABLISHED, client.apply(Event.LOGIN_SUCCEEDED));
    }

    @Test
    @DisplayName("Failed login should close the session")
    void testLoginFailed() {
        HandshakeStateMachine client = new HandshakeStateMachine(Role.CLIENT, VERSION);
        client.connectAccepted(VERSION);
        client.apply(Event.LOGIN_SENT);

        assertEquals(HandshakePhase.CLOSED, client.apply(Event.LOGIN_FAILED));
        assertTrue(client.isClosed());
        assertTrue(client.getPhase().isTerminal());
    }

    @Test
    @DisplayName("Illegal transitions should be rejected")
    void testIllegalTransitions() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
        assertThrows(IllegalStateException.class, () -> server.apply(Event.LOGIN_SUCCEEDED));
        assertThrows(IllegalStateException.class, () -> server.apply(Event.LOGIN_SENT));
        assertEquals(HandshakePhase.AWAITING_CONNECT, server.getPhase(), "Phase should not change");

        server.connectAccepted(VERSION);
        assertThrows(IllegalStateException.class, () -> server.connectAccepted(VERSION));

        HandshakeStateMachine client = new HandshakeStateMachine(Role.CLIENT, VERSION);
        client.connectAccepted(VERSION);
        assertThrows(IllegalStateException.class, () -> client.apply(Event.LOGIN_RECEIVED));
    }

    @Test
    @DisplayName("Version mismatch should not be accepted")
    void testVersionMismatch() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
        assertFalse(server.supportsVersion(VERSION + 1));
        assertThrows(IllegalArgumentException.class, () -> server.connectAccepted(VERSION + 1));
        assertEquals(HandshakePhase.AWAITING_CONNECT, server.getPhase());
    }

    @Test
    @DisplayName("CLOSED should be reachable from every phase and be final")
    void testClosedFromAnywhere() {
        for (int steps = 0; steps <= 3; steps++) {
            HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
            if (steps > 0) {
                server.connectAccepted(VERSION);
            }
            if (steps > 1) {
                server.apply(Event.LOGIN_RECEIVED);
            }
            if (steps > 2) {
                server.apply(Event.LOGIN_SUCCEEDED);
            }
            assertEquals(HandshakePhase.CLOSED, server.apply(Event.CLOSED));
            assertThrows(IllegalStateException.class, () -> server.apply(Event.LOGIN_RECEIVED));
            assertEquals(HandshakePhase.CLOSED, server.apply(Event.CLOSED));
        }
    }

    // ==========================================
    // Test: Permitted Messages
    // ==========================================

    @Test
    @DisplayName("Server should only accept Connect before the handshake")
    void testServerInboundBeforeConnect() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);

        assertTrue(server.permitsInbound(MessageType.CONNECT));
        assertTrue(server.permitsInbound(MessageType.DISCONNECT));
        assertFalse(server.permitsInbound(MessageType.LOGIN));
        assertFalse(server.permitsInbound(MessageType.MOVE));
        assertFalse(server.permitsInbound(MessageType.UPDATE_STATE));
    }

    @Test
    @DisplayName("Server should only accept Login after Connect")
    void testServerInboundAwaitingLogin() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
        server.connectAccepted(VERSION);

        assertTrue(server.permitsInbound(MessageType.LOGIN));
        assertFalse(server.permitsInbound(MessageType.CONNECT));
        assertFalse(server.permitsInbound(MessageType.ADD_ENTITY));
        assertTrue(server.permitsOutbound(MessageType.CONNECT), "Server replies with its own Connect");
        assertFalse(server.permitsOutbound(MessageType.LOGIN_RESULT));
    }

    @Test
    @DisplayName("Established sessions should enforce message direction")
    void testEstablishedDirections() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
        server.connectAccepted(VERSION);
        server.apply(Event.LOGIN_RECEIVED);
        server.apply(Event.LOGIN_SUCCEEDED);

        assertTrue(server.permitsInbound(MessageType.MOVE));
        assertFalse(server.permitsInbound(MessageType.ASSIGN_CONTROL));
        assertTrue(server.permitsOutbound(MessageType.ASSIGN_CONTROL));
        assertFalse(server.permitsOutbound(MessageType.MOVE));
        assertTrue(server.permitsInbound(MessageType.COMBAT_HIT));
        assertTrue(server.permitsOutbound(MessageType.ENTITY_DEATH));
        assertFalse(server.permitsInbound(MessageType.LOGIN));
        assertFalse(server.permitsInbound(MessageType.CONNECT));

        HandshakeStateMachine client = new HandshakeStateMachine(Role.CLIENT, VERSION);
        client.connectAccepted(VERSION);
        client.apply(Event.LOGIN_SENT);
        client.apply(Event.LOGIN_SUCCEEDED);

        assertTrue(client.permitsOutbound(MessageType.MOVE));
        assertTrue(client.permitsInbound(MessageType.ASSIGN_CONTROL));
        assertFalse(client.permitsInbound(MessageType.MOVE));
        assertTrue(client.permitsInbound(MessageType.UPDATE_STATE));
    }

    @Test
    @DisplayName("Closed sessions should permit nothing")
    void testClosedPermitsNothing() {
        HandshakeStateMachine server = new HandshakeStateMachine(Role.SERVER, VERSION);
        server.apply(Event.CLOSED);

        for (MessageType type : MessageType.values()) {
            assertFalse(server.permitsInbound(type), type + " inbound");
            assertFalse(server.permitsOutbound(type), type + " outbound");
        }
    }
}

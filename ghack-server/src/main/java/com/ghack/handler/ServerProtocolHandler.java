package com.ghack.handler;

import com.ghack.auth.LoginAuthority;
import com.ghack.auth.LoginVerdict;
import com.ghack.handshake.HandshakeStateMachine;
import com.ghack.protocol.Connect;
import com.ghack.protocol.Disconnect;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.Envelope;
import com.ghack.protocol.Login;
import com.ghack.protocol.LoginFailure;
import com.ghack.protocol.Move;
import com.ghack.server.GameLogic;
import com.ghack.session.ClientSession;
import com.ghack.session.SessionManager;
import com.ghack.session.SyncOutcome;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of the protocol for one connection.
 *
 * This is where the connection lifecycle lives:
 * - CONNECT: version check, reply with our own Connect
 * - LOGIN: ask the login authority, answer with LoginResult
 * - General traffic: entity table bookkeeping, then hand over to game logic
 * - DISCONNECT: close without answering
 *
 * Anything received outside its phase is a protocol error and closes the
 * connection with Disconnect{PROTOCOL_ERROR}. Entity ordering problems are
 * minor errors and never close anything.
 *
 * Threading Model:
 * - Each channel is handled by a single Netty worker thread
 * - Frames of one connection are processed one at a time in arrival order
 * - Cross-channel operations (broadcasts) use thread-safe collections
 *
 * Important: Never block in this handler! The login authority and game
 * logic are called inline.
 */
public class ServerProtocolHandler extends SimpleChannelInboundHandler<Envelope> {

    private static final Logger logger = LoggerFactory.getLogger(ServerProtocolHandler.class);

    private final SessionManager sessionManager;
    private final LoginAuthority loginAuthority;
    private final GameLogic gameLogic;
    private final String versionString;

    public ServerProtocolHandler(SessionManager sessionManager, LoginAuthority loginAuthority,
                                 GameLogic gameLogic, String versionString) {
        this.sessionManager = sessionManager;
        this.loginAuthority = loginAuthority;
        this.gameLogic = gameLogic;
        this.versionString = versionString;
    }

    /**
     * Called when a new connection is accepted.
     */
    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        ClientSession session = sessionManager.createSession(ctx.channel());
        logger.info("New connection: {}", session.getSessionId());
    }

    /**
     * Called when the connection is gone, whoever closed it.
     */
    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        ClientSession session = sessionManager.removeSession(ctx.channel());
        if (session != null) {
            session.markClosed();
            gameLogic.onSessionClosed(session);
            logger.info("Player {} disconnected ({} minor errors)",
                    session.getPlayerName(), session.getEntities().getMinorErrorCount());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ClientSession session = sessionManager.getSessionByChannel(ctx.channel());
        if (session != null) {
            session.markClosed();
        }
        super.channelInactive(ctx);
    }

    /**
     * Called for every decoded envelope.
     */
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Envelope envelope) {
        ClientSession session = sessionManager.getSessionByChannel(ctx.channel());
        if (session == null) {
            logger.error("Received message from unknown channel");
            ctx.close();
            return;
        }
        HandshakeStateMachine handshake = session.getHandshake();
        if (handshake.isClosed()) {
            logger.debug("Dropping {} from closed session {}", envelope.getType(), session.getSessionId());
            return;
        }

        logger.debug("<< [{}] {}", session.getLabel(), envelope);

        if (!handshake.permitsInbound(envelope.getType())) {
            protocolError(session, "Unexpected " + envelope.getType() + " in phase " + handshake.getPhase());
            return;
        }

        switch (envelope.getType()) {
            case CONNECT -> handleConnect(session, envelope.payload(Connect.class));
            case LOGIN -> handleLogin(session, envelope.payload(Login.class));
            case DISCONNECT -> handleDisconnect(ctx, session, envelope.payload(Disconnect.class));
            case MOVE -> gameLogic.onMove(session, envelope.payload(Move.class).getDirection());
            case ADD_ENTITY, REMOVE_ENTITY, UPDATE_STATE -> handleEntityMessage(session, envelope);
            case ENTITY_DEATH, COMBAT_HIT -> gameLogic.onMessage(session, envelope);
            default -> protocolError(session, "Unexpected " + envelope.getType());
        }
    }

    /**
     * First message of the handshake. A version mismatch ends the session.
     */
    private void handleConnect(ClientSession session, Connect connect) {
        HandshakeStateMachine handshake = session.getHandshake();
        if (!handshake.supportsVersion(connect.getVersion())) {
            logger.warn("Session {} speaks protocol {} ({}), expected {}", session.getSessionId(),
                    connect.getVersion(), connect.getVersionString(), handshake.getSupportedVersion());
            session.disconnect(DisconnectReason.WRONG_PROTOCOL_VERSION,
                    "Server speaks protocol version " + handshake.getSupportedVersion());
            return;
        }
        handshake.connectAccepted(connect.getVersion());
        session.send(new Connect(handshake.getSupportedVersion(), versionString));
        logger.debug("Session {} connected with client {}", session.getSessionId(), connect.getVersionString());
    }

    /**
     * Delegates the credentials to the login authority and reports its verdict.
     */
    private void handleLogin(ClientSession session, Login login) {
        HandshakeStateMachine handshake = session.getHandshake();
        handshake.apply(HandshakeStateMachine.Event.LOGIN_RECEIVED);

        LoginVerdict verdict;
        try {
            verdict = loginAuthority.verify(login.getName(), login.getAuthToken(), login.getPermissions());
        } catch (RuntimeException e) {
            logger.error("Login authority failed for {}", login.getName(), e);
            verdict = LoginVerdict.deny(LoginFailure.ACCESS_DENIED);
        }

        session.send(verdict.toLoginResult());

        if (!verdict.isAccepted()) {
            session.disconnect(DisconnectReason.QUIT, "Login refused: " + verdict.getFailure());
            return;
        }

        session.authenticate(login.getName(), verdict.getGrantedPermissions());
        handshake.apply(HandshakeStateMachine.Event.LOGIN_SUCCEEDED);
        logger.info("Player {} logged in (session {})", login.getName(), session.getSessionId());
        gameLogic.onSessionEstablished(session);
    }

    private void handleDisconnect(ChannelHandlerContext ctx, ClientSession session, Disconnect disconnect) {
        logger.info("Session {} quit: {} {}", session.getSessionId(), disconnect.getReason(),
                disconnect.hasReasonText() ? disconnect.getReasonText() : "");
        session.markClosed();
        ctx.close();
    }

    /**
     * AddEntity / RemoveEntity / UpdateState from the client. Minor errors
     * are dropped here and never reach the game logic.
     */
    private void handleEntityMessage(ClientSession session, Envelope envelope) {
        SyncOutcome outcome = session.getEntities().apply(envelope.getPayload());
        if (!outcome.isMinorError()) {
            gameLogic.onMessage(session, envelope);
        }
    }

    private void protocolError(ClientSession session, String detail) {
        logger.warn("Protocol error from session {}: {}", session.getSessionId(), detail);
        session.disconnect(DisconnectReason.PROTOCOL_ERROR, detail);
    }

    // === Netty Event Handlers ===

    /**
     * Closes connections that stalled in the handshake past the read timeout.
     * The protocol has no keepalive, so a logged-in player standing still is
     * never timed out.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            ClientSession session = sessionManager.getSessionByChannel(ctx.channel());
            if (session != null && session.isEstablished()) {
                logger.debug("Session {} idle, keeping it", session.getSessionId());
            } else if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    /**
     * Stops reading from a client we cannot write to fast enough.
     */
    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        boolean writable = ctx.channel().isWritable();
        ctx.channel().config().setAutoRead(writable);
        if (!writable) {
            logger.debug("Channel {} is not writable, pausing reads", ctx.channel().id());
        }
        super.channelWritabilityChanged(ctx);
    }

    /**
     * Decoding failures end the connection with PROTOCOL_ERROR; anything else
     * just closes it. Other sessions are never affected.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ClientSession session = sessionManager.getSessionByChannel(ctx.channel());
        if (cause instanceof DecoderException && session != null) {
            protocolError(session, "Malformed frame: " + cause.getMessage());
            return;
        }
        logger.error("Connection error", cause);
        ctx.close();
    }
}

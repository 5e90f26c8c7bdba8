package com.ghack.client;

import com.ghack.handshake.HandshakeStateMachine;
import com.ghack.handshake.Role;
import com.ghack.protocol.AddEntity;
import com.ghack.protocol.AssignControl;
import com.ghack.protocol.CombatHit;
import com.ghack.protocol.Connect;
import com.ghack.protocol.Disconnect;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.EntityDeath;
import com.ghack.protocol.Envelope;
import com.ghack.protocol.LoginResult;
import com.ghack.protocol.RemoveEntity;
import com.ghack.protocol.UpdateState;
import com.ghack.session.PeerSession;
import com.ghack.session.SyncOutcome;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the protocol: sends Connect as soon as the connection is
 * up, answers the server's Connect with Login, then mirrors the server's
 * entities and reports everything to the {@link ClientListener}.
 */
public class ClientProtocolHandler extends SimpleChannelInboundHandler<Envelope> {

    private static final Logger logger = LoggerFactory.getLogger(ClientProtocolHandler.class);

    private final GameClient client;
    private PeerSession session;

    // Set when the server said goodbye; reported once the channel is gone
    private DisconnectReason disconnectReason;
    private String disconnectText;

    public ClientProtocolHandler(GameClient client) {
        this.client = client;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        HandshakeStateMachine handshake = new HandshakeStateMachine(Role.CLIENT, client.getProtocolVersion());
        session = new PeerSession("client:" + client.getName(), ctx.channel(), client.getCodec(), handshake);
        client.attach(session);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        session.send(new Connect(client.getProtocolVersion(), client.getVersionString()));
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        session.markClosed();
        logger.info("Connection to server closed ({} {})", disconnectReason,
                disconnectText != null ? disconnectText : "");
        client.onClosed(disconnectReason, disconnectText);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Envelope envelope) {
        HandshakeStateMachine handshake = session.getHandshake();
        if (handshake.isClosed()) {
            logger.debug("Dropping {} after close", envelope.getType());
            return;
        }

        logger.debug("<< [{}] {}", session.getLabel(), envelope);

        if (!handshake.permitsInbound(envelope.getType())) {
            protocolError("Unexpected " + envelope.getType() + " in phase " + handshake.getPhase());
            return;
        }

        ClientListener listener = client.getListener();
        switch (envelope.getType()) {
            case CONNECT -> handleConnect(envelope.payload(Connect.class));
            case LOGIN_RESULT -> handleLoginResult(ctx, envelope.payload(LoginResult.class));
            case DISCONNECT -> {
                Disconnect disconnect = envelope.payload(Disconnect.class);
                disconnectReason = disconnect.getReason();
                disconnectText = disconnect.getReasonText();
                session.markClosed();
                ctx.close();
            }
            case ADD_ENTITY -> {
                AddEntity add = envelope.payload(AddEntity.class);
                if (session.getEntities().apply(add) == SyncOutcome.ADDED) {
                    listener.onEntityAdded(client, add.getId(), add.getName());
                }
            }
            case REMOVE_ENTITY -> {
                RemoveEntity remove = envelope.payload(RemoveEntity.class);
                if (session.getEntities().apply(remove) == SyncOutcome.REMOVED) {
                    client.releaseControl(remove.getId());
                    listener.onEntityRemoved(client, remove.getId(), remove.getName());
                }
            }
            case UPDATE_STATE -> {
                UpdateState update = envelope.payload(UpdateState.class);
                if (session.getEntities().apply(update) == SyncOutcome.UPDATED) {
                    listener.onStateUpdated(client, update.getId(), update.getStateId(), update.getValue());
                }
            }
            case ASSIGN_CONTROL -> {
                AssignControl control = envelope.payload(AssignControl.class);
                if (control.isRevoked()) {
                    client.releaseControl(control.getUid());
                } else {
                    client.takeControl(control.getUid());
                }
                listener.onControlAssigned(client, control.getUid(), control.isRevoked());
            }
            case ENTITY_DEATH -> listener.onEntityDeath(client, envelope.payload(EntityDeath.class));
            case COMBAT_HIT -> listener.onCombatHit(client, envelope.payload(CombatHit.class));
            default -> protocolError("Unexpected " + envelope.getType());
        }
    }

    private void handleConnect(Connect connect) {
        HandshakeStateMachine handshake = session.getHandshake();
        if (!handshake.supportsVersion(connect.getVersion())) {
            logger.error("Server speaks protocol {} ({}), we speak {}", connect.getVersion(),
                    connect.getVersionString(), handshake.getSupportedVersion());
            session.disconnect(DisconnectReason.WRONG_PROTOCOL_VERSION,
                    "Client speaks protocol version " + handshake.getSupportedVersion());
            return;
        }
        handshake.connectAccepted(connect.getVersion());
        logger.debug("Server {} accepted protocol {}", connect.getVersionString(), connect.getVersion());

        session.send(client.getLogin());
        handshake.apply(HandshakeStateMachine.Event.LOGIN_SENT);
    }

    private void handleLoginResult(ChannelHandlerContext ctx, LoginResult result) {
        HandshakeStateMachine handshake = session.getHandshake();
        if (result.isSucceeded()) {
            handshake.apply(HandshakeStateMachine.Event.LOGIN_SUCCEEDED);
            logger.info("Connection established as {}", client.getName());
            client.onEstablished();
            return;
        }
        handshake.apply(HandshakeStateMachine.Event.LOGIN_FAILED);
        logger.error("Login failed: {}", result.getReason());
        client.getListener().onLoginFailed(client, result.getReason());
        ctx.close();
    }

    private void protocolError(String detail) {
        logger.warn("Protocol error from server: {}", detail);
        session.disconnect(DisconnectReason.PROTOCOL_ERROR, detail);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            protocolError("Malformed frame: " + cause.getMessage());
            return;
        }
        logger.error("Client connection error", cause);
        ctx.close();
    }
}

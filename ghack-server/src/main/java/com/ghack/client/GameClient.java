package com.ghack.client;

import com.ghack.codec.FrameDecoder;
import com.ghack.codec.WireCodec;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.Login;
import com.ghack.protocol.Move;
import com.ghack.protocol.Payload;
import com.ghack.protocol.ProtocolConstants;
import com.ghack.protocol.Vector3;
import com.ghack.session.EntityTable;
import com.ghack.session.PeerSession;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A game client: one TCP connection to a server, the client side of the
 * handshake, and a mirror of the entities the server announced.
 *
 * Usage:
 * <pre>
 * GameClient client = GameClient.builder("alice").listener(listener).build();
 * client.connect("localhost", 7777);
 * client.established().get(5, TimeUnit.SECONDS);
 * client.move(new Vector3(1, 0, 0));
 * client.disconnect();
 * </pre>
 */
public class GameClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GameClient.class);

    private final Login login;
    private final int protocolVersion;
    private final String versionString;
    private final WireCodec codec;
    private final ClientListener listener;

    private final Set<Integer> controlled = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<GameClient> established = new CompletableFuture<>();
    private final CompletableFuture<DisconnectReason> closed = new CompletableFuture<>();

    private EventLoopGroup group;
    private volatile PeerSession session;

    private GameClient(Builder builder) {
        this.login = Login.builder(builder.name)
                .authToken(builder.authToken)
                .permissions(builder.permissions)
                .build();
        this.protocolVersion = builder.protocolVersion;
        this.versionString = builder.versionString;
        this.codec = new WireCodec(builder.maxArrayDepth);
        this.listener = builder.listener;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Opens the connection and starts the handshake. Returns once the TCP
     * connection is up; use {@link #established()} to wait for the login.
     */
    public void connect(String host, int port) throws InterruptedException {
        if (group != null) {
            throw new IllegalStateException("Client already connected");
        }
        group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new FrameDecoder(codec));
                        ch.pipeline().addLast(new ClientProtocolHandler(GameClient.this));
                    }
                });

        ChannelFuture future = bootstrap.connect(host, port).sync();
        logger.info("Connected to {}:{}", host, port);
        future.channel().closeFuture().addListener(f -> group.shutdownGracefully());
    }

    /**
     * Sends Move. A zero vector is not sent.
     *
     * @return true if a Move was sent
     * @throws IllegalStateException if the handshake is not complete
     */
    public boolean move(Vector3 direction) {
        if (direction.lengthSquared() == 0) {
            return false;
        }
        send(new Move(direction));
        return true;
    }

    /**
     * Sends any general message.
     *
     * @throws IllegalStateException if the message is not allowed in the current phase
     */
    public void send(Payload payload) {
        PeerSession current = session;
        if (current == null || !current.isEstablished()) {
            throw new IllegalStateException("Cannot send " + payload.type() + " before the connection is established");
        }
        current.send(payload);
    }

    /**
     * Says goodbye with Disconnect{QUIT} and closes the connection.
     */
    public void disconnect() {
        PeerSession current = session;
        if (current == null || !current.isActive()) {
            return;
        }
        current.getChannel().eventLoop().execute(
                () -> current.disconnect(DisconnectReason.QUIT, "Client disconnected"));
    }

    @Override
    public void close() {
        disconnect();
        if (group != null) {
            group.shutdownGracefully();
        }
    }

    // === Called by ClientProtocolHandler ===

    void attach(PeerSession session) {
        this.session = session;
    }

    void onEstablished() {
        established.complete(this);
        listener.onEstablished(this);
    }

    void onClosed(DisconnectReason reason, String text) {
        controlled.clear();
        established.completeExceptionally(new IllegalStateException(
                "Connection closed before login completed: " + reason + " " + (text != null ? text : "")));
        closed.complete(reason);
        listener.onDisconnected(this, reason, text);
    }

    void takeControl(int uid) {
        controlled.add(uid);
    }

    void releaseControl(int uid) {
        controlled.remove(uid);
    }

    // === State ===

    /**
     * Completes when login succeeded; fails if the connection closes first.
     */
    public CompletableFuture<GameClient> established() {
        return established;
    }

    /**
     * Completes when the connection is gone, with the reason the server gave
     * (null if it gave none).
     */
    public CompletableFuture<DisconnectReason> closed() {
        return closed;
    }

    public boolean isEstablished() {
        PeerSession current = session;
        return current != null && current.isEstablished();
    }

    public PeerSession getSession() {
        return session;
    }

    /**
     * Entities the server announced, with their latest states.
     */
    public EntityTable getEntities() {
        PeerSession current = session;
        return current != null ? current.getEntities() : null;
    }

    public Set<Integer> getControlledIds() {
        return Collections.unmodifiableSet(controlled);
    }

    public String getName() {
        return login.getName();
    }

    Login getLogin() {
        return login;
    }

    int getProtocolVersion() {
        return protocolVersion;
    }

    String getVersionString() {
        return versionString;
    }

    WireCodec getCodec() {
        return codec;
    }

    ClientListener getListener() {
        return listener;
    }

    public static class Builder {
        private final String name;
        private String authToken;
        private Integer permissions;
        private int protocolVersion = ProtocolConstants.PROTOCOL_VERSION;
        private String versionString = "ghack-java-client";
        private int maxArrayDepth = ProtocolConstants.DEFAULT_MAX_ARRAY_DEPTH;
        private ClientListener listener = ClientListener.NONE;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder permissions(Integer permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder protocolVersion(int protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder versionString(String versionString) {
            this.versionString = versionString;
            return this;
        }

        public Builder maxArrayDepth(int maxArrayDepth) {
            this.maxArrayDepth = maxArrayDepth;
            return this;
        }

        public Builder listener(ClientListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public GameClient build() {
            return new GameClient(this);
        }
    }
}

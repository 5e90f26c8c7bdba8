package com.ghack.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;

import com.ghack.auth.ConfiguredLoginAuthority;
import com.ghack.auth.LoginAuthority;
import com.ghack.codec.FrameDecoder;
import com.ghack.codec.WireCodec;
import com.ghack.config.ServerConfig;
import com.ghack.handler.ServerProtocolHandler;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.Envelope;
import com.ghack.session.ClientSession;
import com.ghack.session.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * TCP game server using Netty's NIO for high-performance networking.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle I/O operations
 *
 * Every connection gets its own pipeline (idle timeout, frame decoder,
 * protocol handler) and its own session; connections share nothing but
 * the session registry and the game logic.
 */
public class GameServer {

    private static final Logger logger = LoggerFactory.getLogger(GameServer.class);

    private final ServerConfig config;
    private final WireCodec codec;
    private final SessionManager sessionManager;
    private final LoginAuthority loginAuthority;
    private final GameLogic gameLogic;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public GameServer(ServerConfig config, GameLogic gameLogic) {
        this(config, sessions -> gameLogic, null);
    }

    /**
     * @param gameLogicFactory creates the game logic once the session registry exists,
     *                         for logic that broadcasts (e.g. {@code World::new})
     */
    public GameServer(ServerConfig config, Function<SessionManager, GameLogic> gameLogicFactory) {
        this(config, gameLogicFactory, null);
    }

    /**
     * @param loginAuthority authority for Login, null to use {@link ConfiguredLoginAuthority}
     */
    public GameServer(ServerConfig config, Function<SessionManager, GameLogic> gameLogicFactory,
                      LoginAuthority loginAuthority) {
        this.config = config;
        this.codec = new WireCodec(config.getMaxArrayDepth());
        this.sessionManager = new SessionManager(codec, config.getProtocolVersion());
        this.gameLogic = gameLogicFactory.apply(sessionManager);
        this.loginAuthority = loginAuthority != null
                ? loginAuthority
                : new ConfiguredLoginAuthority(config, sessionManager::getEstablishedCount);
    }

    /**
     * Binds the server socket and returns once it accepts connections.
     */
    public void bind() throws InterruptedException {
        // Boss group: accepts incoming connections (1 thread is enough)
        bossGroup = new NioEventLoopGroup(1);

        // Worker group: handles I/O for accepted connections
        // Default: 2 * number of CPU cores
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // TCP options
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(
                        config.getWriteBufferLowWaterMark(), config.getWriteBufferHighWaterMark()))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Drop connections that stay silent
                        if (config.getReadIdleSeconds() > 0) {
                            pipeline.addLast(new IdleStateHandler(config.getReadIdleSeconds(), 0, 0, TimeUnit.SECONDS));
                        }

                        // Length-prefixed frames -> Envelope
                        pipeline.addLast(new FrameDecoder(codec));

                        // Handshake, entity sync and game logic dispatch
                        pipeline.addLast(new ServerProtocolHandler(sessionManager, loginAuthority,
                                gameLogic, config.getVersionString()));
                    }
                });

        serverChannel = bootstrap.bind(config.getPort()).sync().channel();

        logger.info("Server started successfully!");
        logger.info("Listening on port {} (protocol version {})", getPort(), config.getProtocolVersion());
    }

    /**
     * Starts the server.
     * This method blocks until the server is shut down.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            // Block until the server channel is closed
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Gracefully shuts down the server.
     * - Stops accepting new connections
     * - Tells established clients the server is going away
     * - Releases all resources
     */
    public void shutdown() {
        logger.info("Shutting down server...");

        for (ClientSession session : sessionManager.getAllSessions()) {
            if (session.isActive()) {
                session.getChannel().eventLoop().execute(
                        () -> session.disconnect(DisconnectReason.QUIT, "Server shutting down"));
            }
        }

        if (serverChannel != null) {
            serverChannel.close();
        }

        // Graceful shutdown of event loops
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        logger.info("Server shutdown complete.");
    }

    /**
     * Forcibly disconnects a session with reason KICKED.
     *
     * @return false if no such session exists
     */
    public boolean kick(String sessionId, String message) {
        ClientSession session = sessionManager.getSessionById(sessionId);
        if (session == null) {
            return false;
        }
        session.getChannel().eventLoop().execute(() -> session.disconnect(DisconnectReason.KICKED, message));
        return true;
    }

    /**
     * Sends an envelope to every established session.
     */
    public int broadcast(Envelope envelope) {
        return sessionManager.broadcast(envelope);
    }

    /**
     * Port the server is bound to, which differs from the configured one when
     * that was 0.
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel != null && channel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) channel.localAddress()).getPort();
        }
        return config.getPort();
    }

    public ServerConfig getConfig() {
        return config;
    }

    public WireCodec getCodec() {
        return codec;
    }

    public GameLogic getGameLogic() {
        return gameLogic;
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }
}

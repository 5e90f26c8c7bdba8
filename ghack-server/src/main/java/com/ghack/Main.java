package com.ghack;

import com.ghack.config.ServerConfig;
import com.ghack.config.ServerConfigLoader;
import com.ghack.server.GameServer;
import com.ghack.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Entry point for the ghack game server.
 *
 * Usage: {@code Main [port]} or {@code Main <config.json> [port]}. Without a
 * config file the bundled ghack-server.json is used; a port argument always
 * wins over the configured one.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfigLoader loader = new ServerConfigLoader();
        ServerConfig config;
        int next = 0;

        if (args.length > 0 && !isNumber(args[0])) {
            config = loader.load(Paths.get(args[0]));
            next = 1;
        } else {
            config = loader.loadDefault();
        }

        // Allow port override via command line argument
        if (args.length > next) {
            try {
                config.setPort(Integer.parseInt(args[next]));
            } catch (NumberFormatException e) {
                logger.warn("Invalid port argument '{}', using port {}", args[next], config.getPort());
            }
        }

        logger.info("===========================================");
        logger.info("  ghack server {}", config.getVersionString());
        logger.info("  Starting on port {}, protocol version {}", config.getPort(), config.getProtocolVersion());
        logger.info("===========================================");

        GameServer server = new GameServer(config, World::new);

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }

    private static boolean isNumber(String arg) {
        return arg.chars().allMatch(Character::isDigit) && !arg.isEmpty();
    }
}

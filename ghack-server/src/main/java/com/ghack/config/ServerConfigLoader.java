package com.ghack.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ServerConfig} from JSON with Jackson.
 *
 * ObjectMapper is thread-safe after configuration and is reused.
 */
public class ServerConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfigLoader.class);

    /** Classpath resource used when no file is given. */
    public static final String DEFAULT_RESOURCE = "ghack-server.json";

    private final ObjectMapper objectMapper;

    public ServerConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Reads the given file.
     *
     * @throws UncheckedIOException if the file cannot be read or is not valid JSON
     */
    public ServerConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            ServerConfig config = objectMapper.readValue(in, ServerConfig.class);
            logger.info("Loaded configuration from {}", file);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration " + file, e);
        }
    }

    /**
     * Reads the default classpath resource, or returns built-in defaults when
     * it is missing.
     */
    public ServerConfig loadDefault() {
        try (InputStream in = ServerConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.info("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
                return new ServerConfig();
            }
            return objectMapper.readValue(in, ServerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parses configuration from a JSON string.
     */
    public ServerConfig parse(String json) {
        try {
            return objectMapper.readValue(json, ServerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid configuration JSON", e);
        }
    }
}

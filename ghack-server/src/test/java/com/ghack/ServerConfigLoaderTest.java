package com.ghack;

import com.ghack.auth.ConfiguredLoginAuthority;
import com.ghack.config.ServerConfig;
import com.ghack.config.ServerConfigLoader;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Server Config Tests")
class ServerConfigLoaderTest {

    private final ServerConfigLoader loader = new ServerConfigLoader();

    @Test
    @DisplayName("Bundled configuration should load")
    void testLoadDefault() {
        ServerConfig config = loader.loadDefault();

        assertEquals(ServerConfig.DEFAULT_PORT, config.getPort());
        assertEquals(1, config.getProtocolVersion());
        assertEquals(32, config.getMaxArrayDepth());
        assertTrue(config.getWriteBufferLowWaterMark() < config.getWriteBufferHighWaterMark());
    }

    @Test
    @DisplayName("Missing keys should keep their defaults, unknown keys are ignored")
    void testPartialConfig() {
        ServerConfig config = loader.parse("""
            {
                "port": 9000,
                "bannedNames": ["mallory"],
                "motd": "not a known setting"
            }
            """);

        assertEquals(9000, config.getPort());
        assertEquals(List.of("mallory"), config.getBannedNames());
        assertEquals(new ServerConfig().getMaxPlayers(), config.getMaxPlayers());
        assertNull(config.getPassword());
    }

    @Test
    @DisplayName("Null ban list should read as empty")
    void testNullBannedNames() {
        ServerConfig config = loader.parse("""
            {
                "bannedNames": null
            }
            """);

        assertEquals(List.of(), config.getBannedNames());
        ConfiguredLoginAuthority authority = new ConfiguredLoginAuthority(config, () -> 0);
        assertTrue(authority.verify("alice", null, null).isAccepted());
    }

    @Test
    @DisplayName("Configuration file should load from disk")
    void testLoadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("server.json");
        Files.write(file, "{\"password\": \"hunter2\", \"readIdleSeconds\": 0}".getBytes(StandardCharsets.UTF_8));

        ServerConfig config = loader.load(file);
        assertEquals("hunter2", config.getPassword());
        assertEquals(0, config.getReadIdleSeconds());
    }

    @Test
    @DisplayName("Broken JSON should fail loudly")
    void testInvalidJson() {
        assertThrows(UncheckedIOException.class, () -> loader.parse("{\"port\": "));
        assertThrows(UncheckedIOException.class, () -> loader.load(Path.of("does-not-exist.json")));
    }
}

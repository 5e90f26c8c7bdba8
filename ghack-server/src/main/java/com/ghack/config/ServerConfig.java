package com.ghack.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ghack.protocol.ProtocolConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * Server settings, read from JSON by {@link ServerConfigLoader}.
 *
 * Every property has a default so a partial file (or none at all) works.
 *
 * JSON format:
 * {
 *     "port": 7777,
 *     "protocolVersion": 1,
 *     "versionString": "0.1.0",
 *     "maxArrayDepth": 32,
 *     "readIdleSeconds": 60,
 *     "maxPlayers": 64,
 *     "password": null,
 *     "bannedNames": ["griefer"],
 *     "writeBufferLowWaterMark": 32768,
 *     "writeBufferHighWaterMark": 65536
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    public static final int DEFAULT_PORT = 7777;

    private int port = DEFAULT_PORT;
    private int protocolVersion = ProtocolConstants.PROTOCOL_VERSION;
    private String versionString = "ghack-java";
    private int maxArrayDepth = ProtocolConstants.DEFAULT_MAX_ARRAY_DEPTH;
    private int readIdleSeconds = 60;
    private int maxPlayers = 64;
    private String password;
    private List<String> bannedNames = new ArrayList<>();
    private int writeBufferLowWaterMark = 32 * 1024;
    private int writeBufferHighWaterMark = 64 * 1024;

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(int protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public String getVersionString() {
        return versionString;
    }

    public void setVersionString(String versionString) {
        this.versionString = versionString;
    }

    public int getMaxArrayDepth() {
        return maxArrayDepth;
    }

    public void setMaxArrayDepth(int maxArrayDepth) {
        this.maxArrayDepth = maxArrayDepth;
    }

    /**
     * Seconds without inbound traffic before a connection that has not
     * finished the handshake is dropped; 0 disables. Logged-in sessions never
     * time out.
     */
    public int getReadIdleSeconds() {
        return readIdleSeconds;
    }

    public void setReadIdleSeconds(int readIdleSeconds) {
        this.readIdleSeconds = readIdleSeconds;
    }

    /**
     * Maximum number of logged in sessions; 0 means unlimited.
     */
    public int getMaxPlayers() {
        return maxPlayers;
    }

    public void setMaxPlayers(int maxPlayers) {
        this.maxPlayers = maxPlayers;
    }

    /**
     * Shared password every login must present, null when logins are open.
     */
    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public List<String> getBannedNames() {
        return bannedNames;
    }

    public void setBannedNames(List<String> bannedNames) {
        this.bannedNames = bannedNames != null ? new ArrayList<>(bannedNames) : new ArrayList<>();
    }

    public int getWriteBufferLowWaterMark() {
        return writeBufferLowWaterMark;
    }

    public void setWriteBufferLowWaterMark(int writeBufferLowWaterMark) {
        this.writeBufferLowWaterMark = writeBufferLowWaterMark;
    }

    public int getWriteBufferHighWaterMark() {
        return writeBufferHighWaterMark;
    }

    public void setWriteBufferHighWaterMark(int writeBufferHighWaterMark) {
        this.writeBufferHighWaterMark = writeBufferHighWaterMark;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", protocolVersion=" + protocolVersion +
                ", versionString='" + versionString + '\'' +
                ", maxArrayDepth=" + maxArrayDepth +
                ", readIdleSeconds=" + readIdleSeconds +
                ", maxPlayers=" + maxPlayers +
                ", password=" + (password != null ? "<set>" : "none") +
                ", bannedNames=" + bannedNames +
                '}';
    }
}

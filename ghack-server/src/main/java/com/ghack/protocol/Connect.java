package com.ghack.protocol;

import java.util.Objects;

/**
 * First handshake message, sent by the client and echoed by the server.
 */
public final class Connect extends Payload {

    private final int version;
    private final String versionString;

    public Connect(int version) {
        this(version, null);
    }

    /**
     * @param version       protocol version, compared for equality by the peer
     * @param versionString software version such as a git hash or release, may be null
     */
    public Connect(int version, String versionString) {
        this.version = version;
        this.versionString = versionString;
    }

    @Override
    public MessageType type() {
        return MessageType.CONNECT;
    }

    public int getVersion() {
        return version;
    }

    public String getVersionString() {
        return versionString;
    }

    public boolean hasVersionString() {
        return versionString != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Connect)) {
            return false;
        }
        Connect other = (Connect) o;
        return version == other.version && Objects.equals(versionString, other.versionString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, versionString);
    }

    @Override
    public String toString() {
        return "Connect{version=" + version + ", versionString='" + versionString + "'}";
    }
}

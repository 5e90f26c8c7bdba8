package com.ghack.protocol;

import java.util.Objects;

public final class Disconnect extends Payload {

    private final DisconnectReason reason;
    private final String reasonText;

    public Disconnect(DisconnectReason reason) {
        this(reason, null);
    }

    /**
     * @param reason     required
     * @param reasonText human readable detail such as a kick message, may be null
     */
    public Disconnect(DisconnectReason reason, String reasonText) {
        this.reason = Objects.requireNonNull(reason, "reason");
        this.reasonText = reasonText;
    }

    @Override
    public MessageType type() {
        return MessageType.DISCONNECT;
    }

    public DisconnectReason getReason() {
        return reason;
    }

    public String getReasonText() {
        return reasonText;
    }

    public boolean hasReasonText() {
        return reasonText != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Disconnect)) {
            return false;
        }
        Disconnect other = (Disconnect) o;
        return reason == other.reason && Objects.equals(reasonText, other.reasonText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, reasonText);
    }

    @Override
    public String toString() {
        return "Disconnect{reason=" + reason + ", reasonText='" + reasonText + "'}";
    }
}

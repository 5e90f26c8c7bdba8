package com.ghack.protocol;

import java.util.Objects;

public final class LoginResult extends Payload {

    private final boolean succeeded;
    private final LoginFailure reason;

    private LoginResult(boolean succeeded, LoginFailure reason) {
        this.succeeded = succeeded;
        this.reason = reason;
    }

    public static LoginResult accepted() {
        return new LoginResult(true, null);
    }

    public static LoginResult rejected(LoginFailure reason) {
        if (reason == null || reason == LoginFailure.ACCEPTED) {
            throw new IllegalArgumentException("A rejected login needs a failure reason, got " + reason);
        }
        return new LoginResult(false, reason);
    }

    /**
     * Wire-shaped factory used by the decoder. The reason is only kept for a
     * failed result.
     */
    public static LoginResult of(boolean succeeded, LoginFailure reason) {
        return new LoginResult(succeeded, succeeded ? null : reason);
    }

    @Override
    public MessageType type() {
        return MessageType.LOGIN_RESULT;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    /**
     * Failure reason, null on success (and possibly null on a failure sent
     * by a peer that left it out).
     */
    public LoginFailure getReason() {
        return reason;
    }

    public boolean hasReason() {
        return reason != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LoginResult)) {
            return false;
        }
        LoginResult other = (LoginResult) o;
        return succeeded == other.succeeded && reason == other.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(succeeded, reason);
    }

    @Override
    public String toString() {
        return "LoginResult{succeeded=" + succeeded + ", reason=" + reason + '}';
    }
}

package com.ghack.protocol;

import java.util.Objects;

/**
 * Sent by the client once the server acknowledged its Connect. Only the
 * name is required; the server may still demand a token.
 */
public final class Login extends Payload {

    private final String name;
    private final String authToken;
    private final Integer permissions;

    private Login(String name, String authToken, Integer permissions) {
        this.name = Objects.requireNonNull(name, "name");
        this.authToken = authToken;
        this.permissions = permissions;
    }

    public Login(String name) {
        this(name, null, null);
    }

    @Override
    public MessageType type() {
        return MessageType.LOGIN;
    }

    public String getName() {
        return name;
    }

    /**
     * Password or token, null when not sent.
     */
    public String getAuthToken() {
        return authToken;
    }

    public boolean hasAuthToken() {
        return authToken != null;
    }

    /**
     * Requested permission set as an unsigned 32-bit mask, null when not sent.
     */
    public Integer getPermissions() {
        return permissions;
    }

    public boolean hasPermissions() {
        return permissions != null;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String authToken;
        private Integer permissions;

        private Builder(String name) {
            this.name = name;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder permissions(Integer permissions) {
            this.permissions = permissions;
            return this;
        }

        public Login build() {
            return new Login(name, authToken, permissions);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Login)) {
            return false;
        }
        Login other = (Login) o;
        return name.equals(other.name)
                && Objects.equals(authToken, other.authToken)
                && Objects.equals(permissions, other.permissions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, authToken, permissions);
    }

    // authToken is never printed
    @Override
    public String toString() {
        return "Login{name='" + name + "', authToken=" + (authToken != null ? "<set>" : "null")
                + ", permissions=" + permissions + '}';
    }
}

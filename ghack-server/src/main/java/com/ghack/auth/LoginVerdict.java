package com.ghack.auth;

import com.ghack.protocol.LoginFailure;
import com.ghack.protocol.LoginResult;

/**
 * Decision of a {@link LoginAuthority}.
 */
public final class LoginVerdict {

    private final boolean accepted;
    private final LoginFailure failure;
    private final int grantedPermissions;

    private LoginVerdict(boolean accepted, LoginFailure failure, int grantedPermissions) {
        this.accepted = accepted;
        this.failure = failure;
        this.grantedPermissions = grantedPermissions;
    }

    public static LoginVerdict accept(int grantedPermissions) {
        return new LoginVerdict(true, null, grantedPermissions);
    }

    public static LoginVerdict deny(LoginFailure failure) {
        if (failure == null || failure == LoginFailure.ACCEPTED) {
            throw new IllegalArgumentException("A denial needs a failure reason, got " + failure);
        }
        return new LoginVerdict(false, failure, 0);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public LoginFailure getFailure() {
        return failure;
    }

    public int getGrantedPermissions() {
        return grantedPermissions;
    }

    public LoginResult toLoginResult() {
        return accepted ? LoginResult.accepted() : LoginResult.rejected(failure);
    }

    @Override
    public String toString() {
        return accepted ? "LoginVerdict{accepted, permissions=" + grantedPermissions + '}'
                : "LoginVerdict{denied, " + failure + '}';
    }
}

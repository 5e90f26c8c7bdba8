package com.ghack;

import com.ghack.auth.ConfiguredLoginAuthority;
import com.ghack.auth.LoginVerdict;
import com.ghack.config.ServerConfig;
import com.ghack.protocol.LoginFailure;
import com.ghack.protocol.LoginResult;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Login Authority Tests")
class LoginAuthorityTest {

    private ServerConfig config;
    private AtomicInteger online;

    @BeforeEach
    void setUp() {
        config = new ServerConfig();
        config.setMaxPlayers(2);
        config.setBannedNames(List.of("Mallory"));
        online = new AtomicInteger();
    }

    private ConfiguredLoginAuthority authority() {
        return new ConfiguredLoginAuthority(config, online::get);
    }

    @Test
    @DisplayName("Open server should accept with the requested permissions")
    void testAccept() {
        LoginVerdict verdict = authority().verify("alice", null, 5);

        assertTrue(verdict.isAccepted());
        assertEquals(5, verdict.getGrantedPermissions());
        assertEquals(LoginResult.accepted(), verdict.toLoginResult());
        assertEquals(0, authority().verify("bob", null, null).getGrantedPermissions());
    }

    @Test
    @DisplayName("Banned names should be refused regardless of case")
    void testBanned() {
        LoginVerdict verdict = authority().verify("mallory", null, null);

        assertFalse(verdict.isAccepted());
        assertEquals(LoginFailure.BANNED, verdict.getFailure());
        assertEquals(LoginResult.rejected(LoginFailure.BANNED), verdict.toLoginResult());
    }

    @Test
    @DisplayName("Full server should refuse with SERVER_FULL")
    void testServerFull() {
        online.set(2);
        assertEquals(LoginFailure.SERVER_FULL, authority().verify("alice", null, null).getFailure());

        config.setMaxPlayers(0);
        assertTrue(authority().verify("alice", null, null).isAccepted(), "0 means unlimited");
    }

    @Test
    @DisplayName("Configured password should be required as auth token")
    void testPassword() {
        config.setPassword("hunter2");

        assertEquals(LoginFailure.ACCESS_DENIED, authority().verify("alice", null, null).getFailure());
        assertEquals(LoginFailure.ACCESS_DENIED, authority().verify("alice", "hunter3", null).getFailure());
        assertTrue(authority().verify("alice", "hunter2", null).isAccepted());
    }

    @Test
    @DisplayName("Ban should take precedence over other checks")
    void testCheckOrder() {
        online.set(2);
        config.setPassword("hunter2");
        assertEquals(LoginFailure.BANNED, authority().verify("MALLORY", "hunter2", null).getFailure());
        assertEquals(LoginFailure.SERVER_FULL, authority().verify("alice", "wrong", null).getFailure());
    }
}

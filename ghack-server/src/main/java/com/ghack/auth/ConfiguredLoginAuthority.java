package com.ghack.auth;

import com.ghack.config.ServerConfig;
import com.ghack.protocol.LoginFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;

/**
 * Login authority driven by server configuration.
 *
 * Checks, in order: banned names, free player slots, the shared password.
 * Accepted logins are granted the permissions they asked for.
 */
public class ConfiguredLoginAuthority implements LoginAuthority {

    private static final Logger logger = LoggerFactory.getLogger(ConfiguredLoginAuthority.class);

    private final Set<String> bannedNames;
    private final int maxPlayers;
    private final String password;
    private final IntSupplier establishedCount;

    /**
     * @param establishedCount number of sessions currently logged in
     */
    public ConfiguredLoginAuthority(ServerConfig config, IntSupplier establishedCount) {
        this.bannedNames = config.getBannedNames().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.maxPlayers = config.getMaxPlayers();
        this.password = config.getPassword();
        this.establishedCount = establishedCount;
    }

    @Override
    public LoginVerdict verify(String name, String authToken, Integer permissions) {
        if (bannedNames.contains(name.toLowerCase(Locale.ROOT))) {
            logger.info("Login refused for banned name {}", name);
            return LoginVerdict.deny(LoginFailure.BANNED);
        }
        if (maxPlayers > 0 && establishedCount.getAsInt() >= maxPlayers) {
            logger.info("Login refused for {}: server full ({} players)", name, maxPlayers);
            return LoginVerdict.deny(LoginFailure.SERVER_FULL);
        }
        if (password != null && !password.equals(authToken)) {
            logger.info("Login refused for {}: wrong password", name);
            return LoginVerdict.deny(LoginFailure.ACCESS_DENIED);
        }
        return LoginVerdict.accept(permissions != null ? permissions : 0);
    }
}

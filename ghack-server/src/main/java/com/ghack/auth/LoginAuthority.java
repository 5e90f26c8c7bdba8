package com.ghack.auth;

/**
 * External authority consulted when a client logs in.
 *
 * Implementations are called on the connection's event loop and must not
 * block for long; anything slow belongs behind a cache.
 */
public interface LoginAuthority {

    /**
     * @param name        requested user name, never null
     * @param authToken   password or token, null when the client sent none
     * @param permissions requested permission mask, null when the client sent none
     */
    LoginVerdict verify(String name, String authToken, Integer permissions);
}

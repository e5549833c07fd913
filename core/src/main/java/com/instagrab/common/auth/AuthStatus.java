package com.instagrab.common.auth;

/**
 * Whether a provider session is available, and for which account.
 */
public record AuthStatus(boolean loggedIn, String userId) {

    public static AuthStatus loggedOut() {
        return new AuthStatus(false, null);
    }
}

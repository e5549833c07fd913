package com.instagrab.common.auth;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of an authenticated session. Updates (new claim token) produce a new instance,
 * so readers holding an older reference never observe a half-written state.
 */
public record SessionContext(
        String sessionId,
        String csrfToken,
        String userId,
        Map<String, String> cookies,
        String wwwClaim
) {
    public static final String DEFAULT_CLAIM = "0";

    public SessionContext {
        cookies = Map.copyOf(cookies);
        if (wwwClaim == null || wwwClaim.isEmpty()) wwwClaim = DEFAULT_CLAIM;
    }

    public SessionContext withClaim(String newClaim) {
        return new SessionContext(sessionId, csrfToken, userId, cookies, newClaim);
    }

    public String cookieHeader() {
        return cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining("; "));
    }
}

package com.instagrab.core.client;

import java.util.Locale;

/**
 * Maps a failed HTTP exchange onto the error taxonomy. Deterministic: depends only on the status
 * code and, for 401/403, on challenge markers in the body.
 */
public final class ApiErrors {

    private ApiErrors() {
    }

    public static InstagramApiException classify(int status, String responseBody) {
        String body = responseBody != null ? responseBody : "";

        if (status == 429) {
            return new RateLimitedException(body);
        }
        if (status == 401 || status == 403) {
            if (hasChallengeMarker(body)) {
                return new ChallengeRequiredException(status, body);
            }
            return new AuthenticationFailedException(status, body);
        }
        if (status == 404) {
            return new NotFoundException(body);
        }
        return new InstagramApiException(status, body, null);
    }

    static boolean hasChallengeMarker(String body) {
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("challenge") || lower.contains("checkpoint");
    }
}

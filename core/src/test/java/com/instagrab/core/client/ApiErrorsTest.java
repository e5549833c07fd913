package com.instagrab.core.client;

import com.instagrab.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorsTest extends TestBase {

    @Test
    void testStatusMapping() {
        assertInstanceOf(RateLimitedException.class, ApiErrors.classify(429, ""));
        assertInstanceOf(AuthenticationFailedException.class, ApiErrors.classify(401, "{\"message\":\"login_required\"}"));
        assertInstanceOf(AuthenticationFailedException.class, ApiErrors.classify(403, ""));
        assertInstanceOf(NotFoundException.class, ApiErrors.classify(404, null));
        assertEquals(ErrorKind.GENERIC, ApiErrors.classify(500, "oops").getKind());
    }

    @Test
    void testChallengeMarkersWinOverAuthentication() {
        assertInstanceOf(ChallengeRequiredException.class, ApiErrors.classify(403, "{\"message\":\"challenge_required\"}"));
        assertInstanceOf(ChallengeRequiredException.class, ApiErrors.classify(401, "Checkpoint required"));
        assertFalse(ApiErrors.classify(500, "challenge") instanceof ChallengeRequiredException,
                "Markers only matter for 401/403");
    }

    @Test
    void testClassificationIsDeterministic() {
        InstagramApiException a = ApiErrors.classify(403, "checkpoint");
        InstagramApiException b = ApiErrors.classify(403, "checkpoint");
        assertEquals(a.getClass(), b.getClass());
        assertEquals(a.getKind(), b.getKind());
    }

    @Test
    void testRetryableKinds() {
        assertTrue(ApiErrors.classify(429, "").isRetryable());
        assertTrue(new NetworkException("https://x", new java.io.IOException("reset")).isRetryable());
        assertFalse(ApiErrors.classify(401, "").isRetryable());
        assertFalse(ApiErrors.classify(404, "").isRetryable());
        assertFalse(new PrivateAccountException("someone").isRetryable());
    }

    @Test
    void testUserMessages() {
        assertEquals(ErrorKind.RATE_LIMITED.getUserMessage(), ApiErrors.classify(429, "").getUserMessage());
        assertTrue(new PrivateAccountException("someone").getMessage().contains("@someone"));
    }
}

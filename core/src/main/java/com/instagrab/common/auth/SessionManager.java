package com.instagrab.common.auth;

import com.instagrab.api.CredentialProvider;
import com.instagrab.core.client.AuthenticationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active {@link SessionContext}. The context is built lazily from the credential provider,
 * replaced wholesale on claim-token updates and dropped on authentication failure or credential change.
 */
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final CredentialProvider credentialProvider;
    private final AtomicReference<SessionContext> current = new AtomicReference<>();

    public SessionManager(CredentialProvider credentialProvider) {
        this.credentialProvider = credentialProvider;
    }

    /**
     * Returns the active session, creating it from the provider's cookies if needed.
     *
     * @throws AuthenticationFailedException if no session cookie is available
     */
    public SessionContext current() {
        SessionContext ctx = current.get();
        if (ctx != null) return ctx;

        SessionContext created = createFromCookies();
        // Another caller may have won the race; either instance is valid
        if (current.compareAndSet(null, created)) {
            logger.info("🔑 Session established for user {}", created.userId() != null ? created.userId() : "?");
            return created;
        }
        return current.get() != null ? current.get() : created;
    }

    public void updateClaim(String newClaim) {
        SessionContext ctx = current.get();
        if (ctx != null && !newClaim.equals(ctx.wwwClaim())) {
            current.set(ctx.withClaim(newClaim));
            logger.debug("Claim token updated");
        }
    }

    public void invalidate() {
        if (current.getAndSet(null) != null) {
            logger.warn("Session invalidated, it will be rebuilt from credentials on next use");
        }
    }

    /** Called by the shell when the cookie store changed (login, logout, account switch). */
    public void onCredentialsChanged() {
        invalidate();
    }

    public AuthStatus getAuthStatus() {
        try {
            Map<String, String> cookies = credentialProvider.loadCookies();
            String sessionId = cookies.get("sessionid");
            if (sessionId == null || sessionId.isEmpty()) return AuthStatus.loggedOut();
            return new AuthStatus(true, cookies.get("ds_user_id"));
        } catch (IOException e) {
            logger.warn("Could not read credentials: {}", e.getMessage());
            return AuthStatus.loggedOut();
        }
    }

    private SessionContext createFromCookies() {
        Map<String, String> cookies;
        try {
            cookies = new HashMap<>(credentialProvider.loadCookies());
        } catch (IOException e) {
            throw new AuthenticationFailedException(0, "", "Could not read credentials: " + e.getMessage());
        }

        String sessionId = cookies.get("sessionid");
        if (sessionId == null || sessionId.isEmpty()) {
            throw new AuthenticationFailedException(0, "", "Not logged in. Please log in to Instagram first.");
        }

        String csrf = cookies.get("csrftoken");
        if (csrf == null || csrf.isEmpty()) {
            // The provider accepts any freshly generated token as long as cookie and header agree
            csrf = generateCsrfToken();
            cookies.put("csrftoken", csrf);
        }
        return new SessionContext(sessionId, csrf, cookies.get("ds_user_id"), cookies, SessionContext.DEFAULT_CLAIM);
    }

    static String generateCsrfToken() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}

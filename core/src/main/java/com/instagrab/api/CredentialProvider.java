package com.instagrab.api;

import java.io.IOException;
import java.util.Map;

/**
 * Supplies the provider cookies (sessionid, csrftoken, ds_user_id, ...) of the signed-in browser session.
 * Implemented by the hosting shell; the default reads a Netscape cookies.txt export.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * @return cookie name to value, empty if nothing is available
     * @throws IOException if the underlying cookie store cannot be read
     */
    Map<String, String> loadCookies() throws IOException;

    static CredentialProvider of(Map<String, String> cookies) {
        Map<String, String> copy = Map.copyOf(cookies);
        return () -> copy;
    }
}

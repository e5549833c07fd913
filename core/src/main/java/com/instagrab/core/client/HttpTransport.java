package com.instagrab.core.client;

import java.io.IOException;

/**
 * Sends one HTTP exchange. Implementations must not follow redirects; the client classifies them itself.
 */
public interface HttpTransport {

    /**
     * @throws IOException on transport failure only; HTTP error statuses are returned as responses
     */
    ApiResponse execute(ApiRequest request) throws IOException;
}

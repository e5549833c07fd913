package com.instagrab.core.client;

import java.io.IOException;

/**
 * Transport-level failure (DNS, connect, reset, timeout). No HTTP status is available.
 */
public class NetworkException extends InstagramApiException {
    public NetworkException(String url, IOException cause) {
        super(ErrorKind.NETWORK, 0, "", "Network error calling " + url + ": " + cause.getMessage(), cause);
    }
}

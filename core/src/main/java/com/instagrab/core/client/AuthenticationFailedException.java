package com.instagrab.core.client;

/**
 * The session is missing or was rejected. Callers drop the cached session when they see this.
 */
public class AuthenticationFailedException extends InstagramApiException {
    public AuthenticationFailedException(int statusCode, String responseBody) {
        this(statusCode, responseBody, null);
    }

    public AuthenticationFailedException(int statusCode, String responseBody, String message) {
        super(ErrorKind.AUTHENTICATION_FAILED, statusCode, responseBody, message, null);
    }
}

package com.instagrab.core.client;

public class RateLimitedException extends InstagramApiException {
    public RateLimitedException(String responseBody) {
        super(ErrorKind.RATE_LIMITED, 429, responseBody, null, null);
    }
}

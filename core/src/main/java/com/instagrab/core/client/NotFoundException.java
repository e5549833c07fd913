package com.instagrab.core.client;

public class NotFoundException extends InstagramApiException {
    public NotFoundException(String responseBody) {
        this(responseBody, null);
    }

    public NotFoundException(String responseBody, String message) {
        super(ErrorKind.NOT_FOUND, 404, responseBody, message, null);
    }
}

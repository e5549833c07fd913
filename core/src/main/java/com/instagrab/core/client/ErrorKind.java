package com.instagrab.core.client;

/**
 * Failure classes of the provider API. Only RATE_LIMITED and NETWORK are worth retrying.
 */
public enum ErrorKind {
    AUTHENTICATION_FAILED(false, "Not authenticated. Please log in to Instagram."),
    CHALLENGE_REQUIRED(false, "Instagram requires verification. Please complete the challenge in your browser."),
    PRIVATE_ACCOUNT(false, "This account is private. You must follow them to view their content."),
    RATE_LIMITED(true, "Rate limit exceeded. Please wait before trying again."),
    NOT_FOUND(false, "Content not found. It may have been deleted."),
    NETWORK(true, "Network error. Check your connection and try again."),
    GENERIC(false, "Instagram request failed.");

    private final boolean retryable;
    private final String userMessage;

    ErrorKind(boolean retryable, String userMessage) {
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getUserMessage() {
        return userMessage;
    }
}

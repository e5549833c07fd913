package com.instagrab.core.client;

/**
 * Base of the client/extractor error taxonomy. Thrown as-is for the generic (non-retryable) case;
 * the subclasses cover the actionable causes.
 * <p>
 * Unchecked because it has to travel through lazy iterators and streams, where it aborts the
 * current extraction.
 */
public class InstagramApiException extends RuntimeException {
    private final ErrorKind kind;
    private final int statusCode;
    private final String responseBody;

    public InstagramApiException(int statusCode, String responseBody, String message) {
        this(ErrorKind.GENERIC, statusCode, responseBody, message, null);
    }

    protected InstagramApiException(ErrorKind kind, int statusCode, String responseBody, String message, Throwable cause) {
        super(message != null ? message : kind.getUserMessage() + " (HTTP " + statusCode + ")", cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody != null ? responseBody : "";
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /** Message suitable for end users; the exception message itself may carry technical detail. */
    public String getUserMessage() {
        return kind.getUserMessage();
    }
}

package com.instagrab.core.client;

/**
 * The provider wants a manual verification (checkpoint). Never retried automatically.
 */
public class ChallengeRequiredException extends InstagramApiException {
    public ChallengeRequiredException(int statusCode, String responseBody) {
        super(ErrorKind.CHALLENGE_REQUIRED, statusCode, responseBody, null, null);
    }
}

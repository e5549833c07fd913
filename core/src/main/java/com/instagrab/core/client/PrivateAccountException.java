package com.instagrab.core.client;

public class PrivateAccountException extends InstagramApiException {
    private final String username;

    public PrivateAccountException(String username) {
        super(ErrorKind.PRIVATE_ACCOUNT, 403, "",
                "User @" + username + " has a private account. You must follow them to view their content.", null);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}

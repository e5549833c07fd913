package com.instagrab.core.client;

import java.util.Map;

/**
 * @param body form-encoded body, or null for requests without one
 */
public record ApiRequest(String method, String url, Map<String, String> headers, String body) {

    public ApiRequest {
        headers = Map.copyOf(headers);
    }

    public boolean hasBody() {
        return body != null;
    }
}

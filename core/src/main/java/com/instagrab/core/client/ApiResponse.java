package com.instagrab.core.client;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response with header names normalized to lower case.
 */
public record ApiResponse(int status, Map<String, String> headers, String body) {

    public ApiResponse {
        headers = headers.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toLowerCase(Locale.ROOT), Map.Entry::getValue, (a, b) -> a));
        body = body != null ? body : "";
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean isRedirect() {
        return status >= 300 && status < 400;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}

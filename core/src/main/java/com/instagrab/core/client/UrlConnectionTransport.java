package com.instagrab.core.client;

import com.instagrab.common.util.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Default transport on top of {@link HttpURLConnection}.
 */
public class UrlConnectionTransport implements HttpTransport {
    private static final Logger logger = LoggerFactory.getLogger(UrlConnectionTransport.class);

    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public UrlConnectionTransport() {
        this(10_000, 30_000);
    }

    public UrlConnectionTransport(int connectTimeoutMs, int readTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public ApiResponse execute(ApiRequest request) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) URI.create(request.url()).toURL().openConnection();
        try {
            conn.setRequestMethod(request.method());
            conn.setInstanceFollowRedirects(false);
            conn.setConnectTimeout(connectTimeoutMs);
            conn.setReadTimeout(readTimeoutMs);
            request.headers().forEach(conn::setRequestProperty);

            if (request.hasBody()) {
                byte[] payload = request.body().getBytes(StandardCharsets.UTF_8);
                conn.setDoOutput(true);
                conn.setFixedLengthStreamingMode(payload.length);
                try (OutputStream os = conn.getOutputStream()) {
                    os.write(payload);
                }
            }

            int status = conn.getResponseCode();
            String body = HttpUtils.readBody(conn);
            logger.debug("{} {} -> {} ({} chars)", request.method(), request.url(), status, body.length());
            return new ApiResponse(status, headersOf(conn), body);
        } finally {
            conn.disconnect();
        }
    }

    private static Map<String, String> headersOf(HttpURLConnection conn) {
        Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, List<String>> e : conn.getHeaderFields().entrySet()) {
            // The status line is reported under a null key
            if (e.getKey() == null || e.getValue() == null || e.getValue().isEmpty()) continue;
            headers.putIfAbsent(e.getKey(), e.getValue().get(0));
        }
        return headers;
    }
}

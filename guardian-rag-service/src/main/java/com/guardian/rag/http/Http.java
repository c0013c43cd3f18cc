package com.guardian.rag.http;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

public final class Http {
    public static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    /**
     * Adds a bearer token when one is configured.
     */
    public static HttpRequest.Builder withBearer(HttpRequest.Builder builder, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private Http() {}
}

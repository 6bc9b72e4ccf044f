package com.naag.docsync.http;

import java.net.http.HttpClient;
import java.time.Duration;

public final class Http {
    // Graph content downloads answer with a 302 to a pre-authenticated URL
    public static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    private Http() {}
}

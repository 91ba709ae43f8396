package com.locationscout.core.discovery;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 TextFetcher. 리다이렉트는 클라이언트 설정(NORMAL)에 맡긴다. */
public final class HttpTextFetcher implements TextFetcher {
    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpTextFetcher(Duration timeout, String userAgent) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build(), timeout, userAgent);
    }

    public HttpTextFetcher(HttpClient client, Duration timeout, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "LocationScout" : userAgent;
    }

    @Override
    public Response fetch(URI uri) {
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/xml,text/xml,text/plain,*/*;q=0.8")
                    .build();

            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            String body = res.body() == null ? "" : res.body();
            return Response.ok(res.statusCode(), body, res.uri());

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", uri);
        } catch (IOException | RuntimeException e) {
            return Response.fail(e.toString(), uri);
        }
    }
}

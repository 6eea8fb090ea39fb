package com.mod98.alpaca.earningsbot.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Shared plumbing for the REST adapters: JSON requests with retry on 429/5xx and transient I/O errors.
 */
abstract class JsonHttpClient {

    protected final ObjectMapper mapper = new ObjectMapper();

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    private final Duration requestTimeout;
    private final int maxRetries;

    protected JsonHttpClient(Duration requestTimeout, int maxRetries) {
        this.requestTimeout = requestTimeout;
        this.maxRetries = maxRetries;
    }

    /** Headers added to every request (auth, user agent). */
    protected abstract Map<String, String> defaultHeaders();

    protected JsonNode getJson(String url) throws IOException, InterruptedException {
        HttpResponse<String> r = sendWithRetry(req("GET", url, null).build());
        ensure2xx(r);
        return mapper.readTree(r.body());
    }

    protected JsonNode postJson(String url, Object body) throws IOException, InterruptedException {
        HttpResponse<String> r = sendWithRetry(req("POST", url, mapper.writeValueAsString(body)).build());
        ensure2xx(r);
        return mapper.readTree(r.body());
    }

    protected HttpRequest.Builder req(String method, String url, String jsonBody) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        defaultHeaders().forEach(b::header);

        if ("GET".equalsIgnoreCase(method)) return b.GET();
        if ("DELETE".equalsIgnoreCase(method)) return b.DELETE();
        return b.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(jsonBody == null ? "{}" : jsonBody));
    }

    // Send with retry for temporary network/server conditions
    protected HttpResponse<String> sendWithRetry(HttpRequest req) throws IOException, InterruptedException {
        return sendWithRetry(req, true);
    }

    /**
     * @param retryIoErrors false for requests that must not be resent blindly: after a timeout the server may
     *                      already have acted on the first one
     */
    protected HttpResponse<String> sendWithRetry(HttpRequest req, boolean retryIoErrors)
            throws IOException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                int code = resp.statusCode();
                // Retry on 429 (Rate limit) or 5xx (Server) codes
                if (code == 429 || code >= 500) {
                    if (attempt >= maxRetries) return resp; // let ensure2xx handle it
                    Thread.sleep(2000L * (attempt + 1));
                    attempt++;
                    continue;
                }
                return resp;
            } catch (IOException e) {
                if (!retryIoErrors || attempt >= maxRetries) throw e;
                Thread.sleep(2000L * (attempt + 1));
                attempt++;
            }
        }
    }

    protected static void ensure2xx(HttpResponse<String> r) throws HttpStatusException {
        int s = r.statusCode();
        if (s < 200 || s >= 300) throw new HttpStatusException(s, r.body());
    }

    protected static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    /** Non-2xx answer from the remote API. */
    static class HttpStatusException extends IOException {

        private final int statusCode;

        HttpStatusException(int statusCode, String body) {
            super("HTTP " + statusCode + " → " + body);
            this.statusCode = statusCode;
        }

        int statusCode() {
            return statusCode;
        }

        boolean isClientError() {
            return statusCode >= 400 && statusCode < 500;
        }
    }
}

package com.phillippitts.callcopilot.service.http;

import com.phillippitts.callcopilot.exception.UpstreamException;
import com.phillippitts.callcopilot.exception.UpstreamExceptionBuilder;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous JSON requests for the external capabilities.
 *
 * <p>Every failure surfaces as an {@link UpstreamException}: transport errors and 5xx, 408
 * and 429 responses are retryable, other non-2xx responses and unparseable bodies are not.
 * Nothing here retries; callers wrap requests in the resilience layer.
 */
public class JsonHttpClient {

    private static final Logger LOG = LogManager.getLogger(JsonHttpClient.class);

    private static final int MAX_LOGGED_BODY = 200;

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JsonHttpClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    /**
     * POSTs {@code body} and returns the parsed response (empty object for an empty body).
     */
    public CompletableFuture<JSONObject> post(String destination, URI uri, JSONObject body,
                                              Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        headers.forEach(builder::header);
        return send(destination, builder.build());
    }

    /**
     * GETs {@code uri} and returns the parsed response.
     */
    public CompletableFuture<JSONObject> get(String destination, URI uri, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);
        return send(destination, builder.build());
    }

    private CompletableFuture<JSONObject> send(String destination, HttpRequest request) {
        long start = System.nanoTime();
        String target = request.method() + " " + request.uri().getPath();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw UpstreamExceptionBuilder.create("Request failed: " + target)
                                .destination(destination)
                                .cause(cause)
                                .retryable(true)
                                .durationMs(elapsedMs)
                                .build();
                    }
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        LOG.warn("{} {} returned {} in {} ms: {}", destination, target, status, elapsedMs,
                                LogSanitizer.truncate(response.body(), MAX_LOGGED_BODY));
                        throw UpstreamExceptionBuilder.create("Unexpected response: " + target)
                                .destination(destination)
                                .status(status)
                                .durationMs(elapsedMs)
                                .build();
                    }
                    LOG.debug("{} {} returned {} in {} ms", destination, target, status, elapsedMs);
                    return parse(destination, target, response.body());
                });
    }

    private static JSONObject parse(String destination, String target, String body) {
        if (body == null || body.isBlank()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw UpstreamExceptionBuilder.create("Response is not a JSON object: " + target)
                    .destination(destination)
                    .cause(e)
                    .retryable(false)
                    .build();
        }
    }
}

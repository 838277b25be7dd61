package com.phillippitts.callcopilot.service.http;

import com.phillippitts.callcopilot.exception.UpstreamException;
import com.phillippitts.callcopilot.testutil.StubHttpServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonHttpClientTest {

    private StubHttpServer server;
    private JsonHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        client = new JsonHttpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static UpstreamException upstreamFailure(Throwable thrown) {
        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(thrown.getCause()).isInstanceOf(UpstreamException.class);
        return (UpstreamException) thrown.getCause();
    }

    @Test
    void postsJsonAndParsesResponse() {
        server.respond(200, "{\"ok\": true}");

        JSONObject response = client.post("frontend", URI.create(server.baseUrl() + "/api/calls/intent"),
                new JSONObject().put("intent", "credit_card_block"), Map.of()).join();

        assertThat(response.getBoolean("ok")).isTrue();
        assertThat(server.requests()).hasSize(1);
        assertThat(server.requests().get(0).method()).isEqualTo("POST");
        assertThat(new JSONObject(server.requests().get(0).body()).getString("intent"))
                .isEqualTo("credit_card_block");
    }

    @Test
    void emptyBodyIsEmptyObject() {
        server.respond(204, "");

        JSONObject response = client.get("kb", URI.create(server.baseUrl() + "/api/kb/search?q=x"), Map.of()).join();

        assertThat(response.isEmpty()).isTrue();
        assertThat(server.requests().get(0).query()).isEqualTo("q=x");
    }

    @Test
    void serverErrorIsRetryable() {
        server.respond(503, "{\"error\": \"busy\"}");

        Throwable thrown = client.get("kb", URI.create(server.baseUrl() + "/x"), Map.of())
                .handle((r, e) -> e).join();

        UpstreamException ex = upstreamFailure(thrown);
        assertThat(ex.getStatusCode()).isEqualTo(503);
        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getDestination()).isEqualTo("kb");
    }

    @Test
    void clientErrorIsNotRetryable() {
        server.respond(400, "{\"error\": \"bad\"}");

        Throwable thrown = client.post("frontend", URI.create(server.baseUrl() + "/x"), new JSONObject(), Map.of())
                .handle((r, e) -> e).join();

        assertThat(upstreamFailure(thrown).isRetryable()).isFalse();
    }

    @Test
    void malformedBodyIsNotRetryable() {
        server.respond(200, "<html>oops</html>");

        Throwable thrown = client.get("llm", URI.create(server.baseUrl() + "/x"), Map.of())
                .handle((r, e) -> e).join();

        UpstreamException ex = upstreamFailure(thrown);
        assertThat(ex.isRetryable()).isFalse();
        assertThat(ex.getMessage()).contains("not a JSON object");
    }

    @Test
    void connectionFailureIsRetryable() {
        String deadUrl = server.baseUrl() + "/x";
        server.close();

        assertThatThrownBy(() -> client.get("frontend", URI.create(deadUrl), Map.of()).join())
                .isInstanceOf(CompletionException.class)
                .satisfies(e -> assertThat(((UpstreamException) e.getCause()).isRetryable()).isTrue());
    }
}

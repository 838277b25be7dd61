package com.phillippitts.callcopilot.service.casemanagement;

import com.phillippitts.callcopilot.config.properties.FrontendProperties;
import com.phillippitts.callcopilot.domain.Disposition;
import com.phillippitts.callcopilot.domain.DispositionForward;
import com.phillippitts.callcopilot.domain.DispositionSummary;
import com.phillippitts.callcopilot.domain.KbArticle;
import com.phillippitts.callcopilot.domain.KbSuggestionsForward;
import com.phillippitts.callcopilot.domain.SegmentType;
import com.phillippitts.callcopilot.domain.TranscriptForward;
import com.phillippitts.callcopilot.service.http.JsonHttpClient;
import com.phillippitts.callcopilot.testutil.StubHttpServer;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HttpCaseManagementClientTest {

    @Test
    void transcriptUsesWireFieldNames() {
        JSONObject json = HttpCaseManagementClient.toJson(
                new TranscriptForward("CA1", "I want to block my card", 3, SegmentType.FINAL, "acme"));

        assertThat(json.getString("callId")).isEqualTo("CA1");
        assertThat(json.getLong("seq")).isEqualTo(3);
        assertThat(json.getString("type")).isEqualTo("final");
        assertThat(json.getString("tenantId")).isEqualTo("acme");
    }

    @Test
    void dispositionCarriesNotesTitlesAndAuthor() {
        DispositionSummary summary = new DispositionSummary("Lost card", "Blocked", "",
                List.of(new Disposition("credit_card_block", 0.9, null)), 0.8);

        JSONObject json = HttpCaseManagementClient.toJson(
                new DispositionForward("CA1", "acme", summary, "pipecat-copilot"));

        assertThat(json.getString("notes")).isEqualTo("Lost card\n\nBlocked");
        assertThat(json.getString("author")).isEqualTo("pipecat-copilot");
        JSONObject first = json.getJSONArray("dispositions").getJSONObject(0);
        assertThat(first.getString("code")).isEqualTo("credit_card_block");
        assertThat(first.getString("title")).isEqualTo("Credit Card Block");
        assertThat(first.isNull("subDisposition")).isTrue();
    }

    @Test
    void kbSuggestionsListArticles() {
        KbArticle article = new KbArticle("kb-1", "Block a card", "Steps", "https://kb/1",
                List.of("card"), "api", 0.7);

        JSONObject json = HttpCaseManagementClient.toJson(
                new KbSuggestionsForward("CA1", "acme", "credit_card_block", List.of(article)));

        JSONArray articles = json.getJSONArray("articles");
        assertThat(articles.length()).isEqualTo(1);
        assertThat(articles.getJSONObject(0).getString("id")).isEqualTo("kb-1");
        assertThat(articles.getJSONObject(0).getJSONArray("tags").getString(0)).isEqualTo("card");
    }

    @Test
    void postsToConfiguredPath() throws Exception {
        try (StubHttpServer server = new StubHttpServer()) {
            FrontendProperties props = new FrontendProperties();
            props.setBaseUrl(server.baseUrl() + "/");
            HttpCaseManagementClient client = new HttpCaseManagementClient(
                    new JsonHttpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                            Duration.ofSeconds(5)), props);

            client.forwardTranscript(new TranscriptForward("CA1", "hello", 1, SegmentType.PARTIAL, "acme")).join();

            assertThat(server.requests()).extracting(StubHttpServer.Received::path)
                    .containsExactly("/api/calls/ingest-transcript");
        }
    }
}

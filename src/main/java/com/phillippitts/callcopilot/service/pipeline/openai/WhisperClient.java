package com.phillippitts.callcopilot.service.pipeline.openai;

import com.phillippitts.callcopilot.exception.UpstreamException;
import com.phillippitts.callcopilot.exception.UpstreamExceptionBuilder;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Blocking client for the OpenAI {@code /audio/transcriptions} endpoint. One multipart
 * upload per WAV segment.
 */
class WhisperClient {

    static final String DESTINATION = "openai-stt";

    private final RestClient restClient;
    private final String model;

    WhisperClient(RestClient restClient, String model) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /**
     * @return recognized text, possibly empty
     * @throws UpstreamException on transport errors, non-2xx responses or unreadable bodies
     */
    String transcribe(byte[] wav) {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        parts.part("file", new ByteArrayResource(wav))
                .filename("segment.wav")
                .contentType(MediaType.parseMediaType("audio/wav"));
        parts.part("model", model);
        parts.part("response_format", "json");

        long start = System.nanoTime();
        String body;
        try {
            body = restClient.post()
                    .uri("/audio/transcriptions")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(parts.build())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw UpstreamExceptionBuilder.create("Transcription request rejected")
                    .destination(DESTINATION)
                    .status(e.getStatusCode().value())
                    .durationMs(elapsedMs(start))
                    .build();
        } catch (ResourceAccessException e) {
            throw UpstreamExceptionBuilder.create("Transcription request failed")
                    .destination(DESTINATION)
                    .cause(e)
                    .durationMs(elapsedMs(start))
                    .build();
        }

        try {
            return body == null ? "" : new JSONObject(body).optString("text", "").trim();
        } catch (JSONException e) {
            throw UpstreamExceptionBuilder.create("Unreadable transcription response")
                    .destination(DESTINATION)
                    .cause(e)
                    .retryable(false)
                    .build();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}

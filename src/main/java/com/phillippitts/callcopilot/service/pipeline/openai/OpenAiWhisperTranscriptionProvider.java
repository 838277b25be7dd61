package com.phillippitts.callcopilot.service.pipeline.openai;

import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.service.pipeline.PipelineRequest;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSink;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.concurrent.Executors;

/**
 * OpenAI Whisper transcription. The endpoint is batch-only, so audio is cut into segments
 * of {@code copilot.providers.openai-stt-segment} and each is transcribed as a whole. Only
 * final segments are produced.
 */
public class OpenAiWhisperTranscriptionProvider implements TranscriptionProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiWhisperTranscriptionProvider.class);

    private final ProviderProperties properties;

    public OpenAiWhisperTranscriptionProvider(ProviderProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public TranscriptionStream open(PipelineRequest request, TranscriptSink sink, HttpClient httpClient) {
        RestClient restClient = RestClient.builder()
                .requestFactory(new JdkClientHttpRequestFactory(httpClient))
                .baseUrl(properties.getOpenaiBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getOpenaiApiKey())
                .build();
        WhisperClient client = new WhisperClient(restClient, properties.getOpenaiSttModel());
        CustomizableThreadFactory threads = new CustomizableThreadFactory("whisper-" + request.streamId() + "-");
        threads.setDaemon(true);
        LOG.info("Whisper stream opened for {} at {} Hz (segment={})", request.streamId(),
                request.sampleRateHz(), properties.getOpenaiSttSegment());
        return new SegmentedWhisperStream(request.streamId(), request.sampleRateHz(), sink, client::transcribe,
                properties.getOpenaiSttSegment(), properties.getOpenaiSttSilencePeak(),
                Executors.newSingleThreadExecutor(threads));
    }
}

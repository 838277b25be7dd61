package com.phillippitts.callcopilot.service.pipeline.deepgram;

import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.service.pipeline.PipelineRequest;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSink;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionStream;
import com.phillippitts.callcopilot.service.pipeline.socket.ChainedSocketStream;
import com.phillippitts.callcopilot.service.pipeline.socket.ProviderSockets;
import com.phillippitts.callcopilot.service.pipeline.socket.SegmentListener;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Deepgram live transcription over a WebSocket.
 *
 * <p>Audio is sent as binary linear16 frames with interim results enabled, so the sink
 * receives both partial and final segments.
 */
public class DeepgramTranscriptionProvider implements TranscriptionProvider {

    private static final String CLOSE_STREAM = "{\"type\":\"CloseStream\"}";

    private final ProviderProperties properties;

    public DeepgramTranscriptionProvider(ProviderProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String name() {
        return "deepgram";
    }

    @Override
    public TranscriptionStream open(PipelineRequest request, TranscriptSink sink, HttpClient httpClient) {
        WebSocket socket = ProviderSockets.connect(httpClient, listenUri(request.sampleRateHz()),
                Map.of("Authorization", "Token " + properties.getDeepgramApiKey()),
                new SegmentListener(name(), request.streamId(), sink, DeepgramResultParser::parse),
                name(), request);
        return new ChainedSocketStream(name(), request.streamId(), socket,
                (ws, pcm) -> ws.sendBinary(ByteBuffer.wrap(pcm), true), CLOSE_STREAM);
    }

    URI listenUri(int sampleRateHz) {
        String query = "model=" + URLEncoder.encode(properties.getDeepgramModel(), StandardCharsets.UTF_8)
                + "&encoding=linear16"
                + "&sample_rate=" + sampleRateHz
                + "&channels=1"
                + "&interim_results=true"
                + "&punctuate=true"
                + "&smart_format=true";
        return URI.create(properties.getDeepgramUrl() + "?" + query);
    }
}

package com.phillippitts.callcopilot.service.pipeline.elevenlabs;

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
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * ElevenLabs Scribe realtime transcription over a WebSocket.
 *
 * <p>The server segments speech with voice-activity detection. On close an empty chunk with
 * {@code commit=true} is sent so audio still buffered server-side is finalized.
 */
public class ElevenLabsTranscriptionProvider implements TranscriptionProvider {

    private final ProviderProperties properties;

    public ElevenLabsTranscriptionProvider(ProviderProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String name() {
        return "elevenlabs";
    }

    @Override
    public TranscriptionStream open(PipelineRequest request, TranscriptSink sink, HttpClient httpClient) {
        int sampleRate = request.sampleRateHz();
        WebSocket socket = ProviderSockets.connect(httpClient, realtimeUri(sampleRate),
                Map.of("xi-api-key", properties.getElevenlabsApiKey()),
                new SegmentListener(name(), request.streamId(), sink, ElevenLabsMessages::parse),
                name(), request);
        return new ChainedSocketStream(name(), request.streamId(), socket,
                (ws, pcm) -> ws.sendText(ElevenLabsMessages.audioChunk(pcm, sampleRate, false), true),
                ElevenLabsMessages.audioChunk(new byte[0], sampleRate, true));
    }

    URI realtimeUri(int sampleRateHz) {
        String query = "model_id=" + URLEncoder.encode(properties.getElevenlabsModel(), StandardCharsets.UTF_8)
                + "&language_code=" + URLEncoder.encode(properties.getElevenlabsLanguage(), StandardCharsets.UTF_8)
                + "&audio_format=pcm_" + sampleRateHz
                + "&commit_strategy=vad";
        return URI.create(properties.getElevenlabsUrl() + "?" + query);
    }
}

package com.phillippitts.callcopilot.service.pipeline.elevenlabs;

import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Wire format of the ElevenLabs realtime speech-to-text socket.
 *
 * <p>Outbound audio is base64 PCM inside an {@code input_audio_chunk} message. Inbound
 * {@code partial_transcript} messages become partial segments and {@code committed_transcript}
 * messages become final ones. Session and error messages produce nothing; errors are logged.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class ElevenLabsMessages {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsMessages.class);

    // Realtime messages carry no per-segment confidence
    private static final double CONFIDENCE = 1.0;

    private ElevenLabsMessages() {
        // Utility class - prevent instantiation
    }

    static String audioChunk(byte[] pcm, int sampleRateHz, boolean commit) {
        return new JSONObject()
                .put("message_type", "input_audio_chunk")
                .put("audio_base_64", Base64.getEncoder().encodeToString(pcm))
                .put("commit", commit)
                .put("sample_rate", sampleRateHz)
                .toString();
    }

    static Optional<TranscriptSegment> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            LOG.warn("Unparseable ElevenLabs message: {}", e.getMessage());
            return Optional.empty();
        }
        String type = obj.optString("message_type", "");
        switch (type) {
            case "partial_transcript":
                return segment(obj, false);
            case "committed_transcript":
                return segment(obj, true);
            case "session_started":
                LOG.debug("ElevenLabs session started: {}", obj.optString("session_id", "?"));
                return Optional.empty();
            default:
                if (type.endsWith("error") || obj.has("error")) {
                    LOG.warn("ElevenLabs reported {}: {}", type.isEmpty() ? "error" : type,
                            obj.optString("error", obj.optString("message", "")));
                }
                return Optional.empty();
        }
    }

    private static Optional<TranscriptSegment> segment(JSONObject obj, boolean isFinal) {
        String text = obj.optString("text", "").trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TranscriptSegment(text, isFinal, CONFIDENCE, Instant.now()));
    }
}

package com.phillippitts.callcopilot.service.pipeline.deepgram;

import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Optional;

/**
 * Parses Deepgram live-transcription messages.
 *
 * <p>Only {@code "type": "Results"} messages with a non-blank first alternative produce a
 * segment; metadata, utterance-end and speech-started messages are ignored.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class DeepgramResultParser {

    private static final Logger LOG = LogManager.getLogger(DeepgramResultParser.class);

    private DeepgramResultParser() {
        // Utility class - prevent instantiation
    }

    static Optional<TranscriptSegment> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (!"Results".equals(obj.optString("type", "Results"))) {
                return Optional.empty();
            }
            JSONObject channel = obj.optJSONObject("channel");
            if (channel == null) {
                return Optional.empty();
            }
            JSONArray alternatives = channel.optJSONArray("alternatives");
            if (alternatives == null || alternatives.isEmpty()) {
                return Optional.empty();
            }
            JSONObject first = alternatives.getJSONObject(0);
            String text = first.optString("transcript", "").trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            double confidence = Math.min(1.0, Math.max(0.0, first.optDouble("confidence", 0.0)));
            boolean isFinal = obj.optBoolean("is_final", false);
            return Optional.of(new TranscriptSegment(text, isFinal, confidence, Instant.now()));
        } catch (JSONException e) {
            LOG.warn("Unparseable Deepgram message: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

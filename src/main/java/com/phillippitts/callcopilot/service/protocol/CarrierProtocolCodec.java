package com.phillippitts.callcopilot.service.protocol;

import com.phillippitts.callcopilot.exception.InvalidPayloadException;
import com.phillippitts.callcopilot.exception.ProtocolParseException;
import com.phillippitts.callcopilot.service.session.SessionRegistry;
import com.phillippitts.callcopilot.service.session.StreamSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses inbound carrier text frames into {@link CarrierEvent}s.
 *
 * <p>Frame shape: {@code {"event": "...", "sequence_number": n, "stream_sid": "...",
 * "start"|"media"|"stop"|"dtmf"|"mark": {...}}}.
 *
 * <p>Failures are reported per frame:
 * <ul>
 *   <li>{@link ProtocolParseException} - not JSON, unknown event, or missing stream id</li>
 *   <li>{@link InvalidPayloadException} - media payload empty or not base64</li>
 * </ul>
 * Media for a stream without an ACTIVE session is returned with {@code rejected = true}.
 *
 * <p>Thread-safe: holds no per-frame state.
 */
@Component
public class CarrierProtocolCodec {

    private static final Logger LOG = LogManager.getLogger(CarrierProtocolCodec.class);

    static final int RATE_8K = 8000;
    static final int RATE_16K = 16000;
    static final int RATE_24K = 24000;

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");
    private static final String DEFAULT_ENCODING = "pcm16";

    private final SessionRegistry sessions;

    public CarrierProtocolCodec(SessionRegistry sessions) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
    }

    /**
     * Parses one frame.
     *
     * @param frame raw text frame
     * @return typed event
     * @throws ProtocolParseException if the frame is not a known event
     * @throws InvalidPayloadException if a media payload is invalid
     */
    public CarrierEvent decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolParseException("Empty frame");
        }
        JSONObject json;
        try {
            json = new JSONObject(frame);
        } catch (JSONException e) {
            throw new ProtocolParseException("Malformed JSON frame", e);
        }
        String event = json.optString("event", "");
        switch (event) {
            case "connected":
                return new CarrierEvent.Connected();
            case "start":
                return decodeStart(json);
            case "media":
                return decodeMedia(json);
            case "stop":
                return decodeStop(json);
            case "dtmf":
                return decodeDtmf(json);
            case "mark":
                return decodeMark(json);
            default:
                throw new ProtocolParseException("Unknown event", event);
        }
    }

    private CarrierEvent.Start decodeStart(JSONObject json) {
        JSONObject start = json.optJSONObject("start");
        if (start == null) {
            start = new JSONObject();
        }
        String streamId = firstNonBlank(json.optString("stream_sid", null), start.optString("stream_sid", null));
        if (streamId == null) {
            throw new ProtocolParseException("Start event without stream_sid", "start");
        }
        JSONObject mediaFormat = start.optJSONObject("media_format");
        String encoding = DEFAULT_ENCODING;
        Object rawRate = null;
        if (mediaFormat != null) {
            encoding = mediaFormat.optString("encoding", DEFAULT_ENCODING);
            rawRate = mediaFormat.opt("sample_rate");
        }
        int sampleRate = normalizeSampleRate(rawRate, streamId);

        return new CarrierEvent.Start(
                streamId,
                start.optString("call_sid", ""),
                start.optString("account_sid", ""),
                start.optString("from", ""),
                start.optString("to", ""),
                encoding,
                sampleRate,
                customParameters(start.optJSONObject("custom_parameters")));
    }

    private CarrierEvent.Media decodeMedia(JSONObject json) {
        JSONObject media = json.optJSONObject("media");
        String streamId = firstNonBlank(json.optString("stream_sid", null),
                media == null ? null : media.optString("stream_sid", null));
        if (streamId == null) {
            throw new ProtocolParseException("Media event without stream_sid", "media");
        }
        String payload = media == null ? "" : media.optString("payload", "");
        byte[] audio = decodePayload(payload, streamId);
        boolean rejected = !isActive(streamId);
        return new CarrierEvent.Media(
                streamId,
                json.optLong("sequence_number", 0L),
                media == null ? 0L : media.optLong("chunk", 0L),
                media == null ? 0L : media.optLong("timestamp", 0L),
                audio,
                rejected);
    }

    private CarrierEvent.Stop decodeStop(JSONObject json) {
        JSONObject stop = json.optJSONObject("stop");
        if (stop == null) {
            stop = new JSONObject();
        }
        String streamId = firstNonBlank(json.optString("stream_sid", null), stop.optString("stream_sid", null));
        if (streamId == null) {
            throw new ProtocolParseException("Stop event without stream_sid", "stop");
        }
        return new CarrierEvent.Stop(streamId, stop.optString("call_sid", ""), stop.optString("reason", ""));
    }

    private CarrierEvent.Dtmf decodeDtmf(JSONObject json) {
        JSONObject dtmf = json.optJSONObject("dtmf");
        if (dtmf == null) {
            dtmf = new JSONObject();
        }
        return new CarrierEvent.Dtmf(json.optString("stream_sid", ""), dtmf.optString("digit", ""),
                dtmf.optLong("duration", 0L));
    }

    private CarrierEvent.Mark decodeMark(JSONObject json) {
        JSONObject mark = json.optJSONObject("mark");
        return new CarrierEvent.Mark(json.optString("stream_sid", ""),
                mark == null ? "" : mark.optString("name", ""));
    }

    /**
     * Validates the base64 alphabet, then decodes.
     *
     * @throws InvalidPayloadException for an empty, non-conforming or undecodable payload
     */
    static byte[] decodePayload(String payload, String streamId) {
        if (payload == null || payload.isEmpty()) {
            throw new InvalidPayloadException("Empty media payload", streamId, 0);
        }
        if (!BASE64.matcher(payload).matches()) {
            throw new InvalidPayloadException("Media payload is not base64", streamId, payload.length());
        }
        try {
            return Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("Media payload could not be decoded", streamId, payload.length());
        }
    }

    /**
     * Maps the carrier's sample rate onto a supported STT rate: 8000 and 16000 pass through,
     * 24000 becomes 16000, anything else becomes 8000 with a warning.
     *
     * @param raw number or numeric string from {@code media_format.sample_rate}, may be null
     * @param streamId stream the value belongs to, for logging
     * @return 8000 or 16000
     */
    static int normalizeSampleRate(Object raw, String streamId) {
        Integer rate = null;
        if (raw instanceof Number number) {
            rate = number.intValue();
        } else if (raw instanceof String text && !text.isBlank()) {
            try {
                rate = Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                rate = null;
            }
        }
        if (rate != null && (rate == RATE_8K || rate == RATE_16K)) {
            return rate;
        }
        if (rate != null && rate == RATE_24K) {
            LOG.info("Normalizing sample rate 24000 to 16000 (stream={})", streamId);
            return RATE_16K;
        }
        LOG.warn("Unsupported sample rate {} for stream {}; using 8000", raw, streamId);
        return RATE_8K;
    }

    private static Map<String, String> customParameters(JSONObject params) {
        if (params == null) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String key : params.keySet()) {
            Object value = params.opt(key);
            if (value != null && value != JSONObject.NULL) {
                result.put(key, String.valueOf(value));
            }
        }
        return result;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }

    private boolean isActive(String streamId) {
        return sessions.get(streamId).map(StreamSession::isActive).orElse(false);
    }
}

package com.phillippitts.callcopilot.service.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Typed inbound carrier events produced by {@link CarrierProtocolCodec}.
 */
public sealed interface CarrierEvent
        permits CarrierEvent.Connected, CarrierEvent.Start, CarrierEvent.Media,
                CarrierEvent.Stop, CarrierEvent.Dtmf, CarrierEvent.Mark {

    /** Event name as sent by the carrier. */
    String name();

    /**
     * Connection handshake. Carries no stream.
     */
    record Connected() implements CarrierEvent {
        @Override
        public String name() {
            return "connected";
        }
    }

    /**
     * Start of a media stream. {@code sampleRateHz} is already normalized to 8000 or 16000.
     */
    record Start(String streamId,
                 String callId,
                 String accountId,
                 String fromNumber,
                 String toNumber,
                 String encoding,
                 int sampleRateHz,
                 Map<String, String> customParameters) implements CarrierEvent {

        public Start {
            Objects.requireNonNull(streamId, "streamId must not be null");
            customParameters = customParameters == null ? Map.of() : Map.copyOf(customParameters);
        }

        @Override
        public String name() {
            return "start";
        }
    }

    /**
     * One audio frame. {@code audio} is the decoded little-endian PCM16 mono payload.
     * {@code rejected} is set when the stream has no ACTIVE session.
     */
    record Media(String streamId,
                 long sequenceNumber,
                 long chunk,
                 long timestampMs,
                 byte[] audio,
                 boolean rejected) implements CarrierEvent {

        public Media {
            Objects.requireNonNull(streamId, "streamId must not be null");
            Objects.requireNonNull(audio, "audio must not be null");
        }

        @Override
        public String name() {
            return "media";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Media other)) {
                return false;
            }
            return sequenceNumber == other.sequenceNumber && chunk == other.chunk
                    && timestampMs == other.timestampMs && rejected == other.rejected
                    && streamId.equals(other.streamId) && Arrays.equals(audio, other.audio);
        }

        @Override
        public int hashCode() {
            return Objects.hash(streamId, sequenceNumber, chunk, timestampMs, rejected) * 31
                    + Arrays.hashCode(audio);
        }

        @Override
        public String toString() {
            return "Media{streamId=" + streamId + ", seq=" + sequenceNumber + ", bytes=" + audio.length
                    + ", rejected=" + rejected + '}';
        }
    }

    /**
     * End of stream.
     */
    record Stop(String streamId, String callId, String reason) implements CarrierEvent {
        public Stop {
            Objects.requireNonNull(streamId, "streamId must not be null");
        }

        @Override
        public String name() {
            return "stop";
        }
    }

    /**
     * Keypad digit pressed by the caller.
     */
    record Dtmf(String streamId, String digit, long durationMs) implements CarrierEvent {
        @Override
        public String name() {
            return "dtmf";
        }
    }

    /**
     * Playback marker echoed by the carrier.
     */
    record Mark(String streamId, String markName) implements CarrierEvent {
        @Override
        public String name() {
            return "mark";
        }
    }
}

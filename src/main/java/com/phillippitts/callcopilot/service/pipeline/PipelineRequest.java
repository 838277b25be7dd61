package com.phillippitts.callcopilot.service.pipeline;

import java.util.Objects;

/**
 * Parameters for opening one transcription stream.
 */
public record PipelineRequest(String streamId, String callId, int sampleRateHz) {

    public PipelineRequest {
        Objects.requireNonNull(streamId, "streamId must not be null");
        if (sampleRateHz <= 0) {
            throw new IllegalArgumentException("sampleRateHz must be positive: " + sampleRateHz);
        }
    }
}

package com.phillippitts.callcopilot.service.pipeline;

/**
 * Opaque reference to the live transcription pipeline of one session.
 */
public interface PipelineHandle {

    String streamId();

    /** @return true until the pipeline has been stopped */
    boolean isOpen();
}

package com.phillippitts.callcopilot.service.disposition;

import com.phillippitts.callcopilot.domain.DispositionSummary;

import java.util.concurrent.CompletableFuture;

/**
 * Produces an end-of-call summary and disposition codes from the full transcript.
 * Fails the future when no usable summary can be produced.
 */
public interface CallSummarizer {

    CompletableFuture<DispositionSummary> summarize(String transcript);
}

package com.phillippitts.callcopilot.service.casemanagement;

import com.phillippitts.callcopilot.domain.DispositionForward;
import com.phillippitts.callcopilot.domain.IntentForward;
import com.phillippitts.callcopilot.domain.KbSuggestionsForward;
import com.phillippitts.callcopilot.domain.TranscriptForward;

import java.util.concurrent.CompletableFuture;

/**
 * Case-management (agent frontend) ingestion capability.
 *
 * <p>Each method performs exactly one delivery attempt and reports failure through the
 * returned future. Retries and circuit breaking are applied by the caller.
 */
public interface CaseManagementClient {

    CompletableFuture<Void> forwardTranscript(TranscriptForward transcript);

    CompletableFuture<Void> forwardIntent(IntentForward intent);

    CompletableFuture<Void> forwardKbSuggestions(KbSuggestionsForward suggestions);

    CompletableFuture<Void> forwardDisposition(DispositionForward disposition);
}

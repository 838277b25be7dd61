package com.phillippitts.callcopilot.service.casemanagement;

import com.phillippitts.callcopilot.domain.DispositionForward;
import com.phillippitts.callcopilot.domain.IntentForward;
import com.phillippitts.callcopilot.domain.KbSuggestionsForward;
import com.phillippitts.callcopilot.domain.TranscriptForward;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;

/**
 * Writes every forward to the log instead of a backend. For local runs without a frontend.
 */
public class LoggingCaseManagementClient implements CaseManagementClient {

    private static final Logger LOG = LogManager.getLogger(LoggingCaseManagementClient.class);

    @Override
    public CompletableFuture<Void> forwardTranscript(TranscriptForward t) {
        LOG.info("Transcript (call={}, seq={}, type={}): {}", t.callId(), t.seq(), t.type().wireValue(),
                LogSanitizer.truncate(t.text(), 80));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> forwardIntent(IntentForward i) {
        LOG.info("Intent (call={}): {} ({})", i.callId(), i.intent(), i.confidence());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> forwardKbSuggestions(KbSuggestionsForward s) {
        LOG.info("KB suggestions (call={}, intent={}): {} articles", s.callId(), s.intent(), s.articles().size());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> forwardDisposition(DispositionForward d) {
        LOG.info("Disposition (call={}, codes={}, confidence={})", d.callId(),
                d.summary().dispositions().size(), d.summary().confidence());
        return CompletableFuture.completedFuture(null);
    }
}

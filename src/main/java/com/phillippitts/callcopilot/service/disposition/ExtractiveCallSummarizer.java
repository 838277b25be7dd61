package com.phillippitts.callcopilot.service.disposition;

import com.phillippitts.callcopilot.domain.Disposition;
import com.phillippitts.callcopilot.domain.DispositionSummary;
import com.phillippitts.callcopilot.domain.IntentResult;
import com.phillippitts.callcopilot.service.intent.IntentClassifier;
import com.phillippitts.callcopilot.util.LogSanitizer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Offline summarizer: the opening of the transcript becomes the issue and the keyword
 * intent of the whole call becomes the disposition.
 */
public class ExtractiveCallSummarizer implements CallSummarizer {

    private static final int ISSUE_LENGTH = 160;

    private final IntentClassifier classifier;

    public ExtractiveCallSummarizer(IntentClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public CompletableFuture<DispositionSummary> summarize(String transcript) {
        return classifier.classify(transcript, List.of()).thenApply(intent -> toSummary(transcript, intent));
    }

    private static DispositionSummary toSummary(String transcript, IntentResult intent) {
        String code = intent.isUnknown() ? Disposition.GENERAL_INQUIRY : intent.intent();
        double score = intent.isUnknown() ? 0.3 : intent.confidence();
        return new DispositionSummary(
                "Caller said: " + LogSanitizer.truncate(transcript.trim(), ISSUE_LENGTH),
                "",
                "Review call details and confirm the disposition.",
                List.of(new Disposition(code, score, null)),
                score);
    }
}

package com.phillippitts.callcopilot.service.intent;

import com.phillippitts.callcopilot.domain.IntentResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Classifies the caller's primary intent from recent speech.
 *
 * <p>A reply that cannot be interpreted completes with {@link IntentResult#unknown()};
 * transport failures fail the future so the caller's retry and breaker can act on them.
 */
public interface IntentClassifier {

    /**
     * @param text    latest finalized segment
     * @param context most recent final segments, oldest first (may include {@code text})
     * @return detected intent
     */
    CompletableFuture<IntentResult> classify(String text, List<String> context);
}

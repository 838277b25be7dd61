package com.phillippitts.callcopilot.service.fanout;

import com.phillippitts.callcopilot.config.properties.SessionProperties;
import com.phillippitts.callcopilot.domain.IntentForward;
import com.phillippitts.callcopilot.domain.IntentResult;
import com.phillippitts.callcopilot.domain.KbArticle;
import com.phillippitts.callcopilot.domain.KbSuggestionsForward;
import com.phillippitts.callcopilot.domain.SegmentType;
import com.phillippitts.callcopilot.domain.TranscriptForward;
import com.phillippitts.callcopilot.service.casemanagement.CaseManagementClient;
import com.phillippitts.callcopilot.service.intent.IntentClassifier;
import com.phillippitts.callcopilot.service.kb.KnowledgeBaseSearch;
import com.phillippitts.callcopilot.service.metrics.CopilotMetrics;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import com.phillippitts.callcopilot.service.resilience.Destination;
import com.phillippitts.callcopilot.service.resilience.ResilientCaller;
import com.phillippitts.callcopilot.service.session.StreamSession;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Drives each transcript segment downstream without blocking the thread that delivered it.
 *
 * <p>For a final segment:
 * <ol>
 *   <li>append to the session's transcript log, assign the next sequence number and forward it</li>
 *   <li>once that forward has settled, classify intent if the text is long enough, using the
 *   log entries as they stood when the segment was appended</li>
 *   <li>for a known intent, forward it, search the knowledge base and forward any articles</li>
 * </ol>
 * Partial segments only get step 1 and are not logged. Every step is guarded by the
 * resilience layer; a failure is logged and ends that segment's chain only.
 */
@Component
public class TranscriptFanout {

    private static final Logger LOG = LogManager.getLogger(TranscriptFanout.class);

    private static final int PREVIEW = 60;

    private final CaseManagementClient caseManagement;
    private final IntentClassifier intentClassifier;
    private final KnowledgeBaseSearch knowledgeBase;
    private final ResilientCaller resilient;
    private final SessionProperties properties;
    private final Executor executor;
    private final CopilotMetrics metrics;

    public TranscriptFanout(CaseManagementClient caseManagement,
                            IntentClassifier intentClassifier,
                            KnowledgeBaseSearch knowledgeBase,
                            ResilientCaller resilient,
                            SessionProperties properties,
                            @Qualifier("fanoutExecutor") Executor executor,
                            CopilotMetrics metrics) {
        this.caseManagement = Objects.requireNonNull(caseManagement, "caseManagement must not be null");
        this.intentClassifier = Objects.requireNonNull(intentClassifier, "intentClassifier must not be null");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase must not be null");
        this.resilient = Objects.requireNonNull(resilient, "resilient must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Handles one segment. The log append and sequence assignment happen on the calling
     * thread; everything else runs on the fan-out executor.
     *
     * @return future completing when the segment's whole chain has settled; never fails
     */
    public CompletableFuture<Void> onSegment(StreamSession session, TranscriptSegment segment) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(segment, "segment must not be null");
        String text = segment.text().trim();
        if (text.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        if (!segment.isFinal()) {
            long seq = session.nextOutboundSeq();
            return submit(session, () -> forwardTranscript(session, text, seq, SegmentType.PARTIAL));
        }

        long seq = session.appendFinal(text);
        List<String> context = session.recentTranscripts(properties.getIntentContextWindow());
        LOG.debug("Final segment {} for stream {}: {}", seq, session.getStreamId(),
                LogSanitizer.truncate(text, PREVIEW));
        return submit(session, () -> forwardTranscript(session, text, seq, SegmentType.FINAL)
                .thenCompose(ignored -> enrich(session, text, context)));
    }

    private CompletableFuture<Void> submit(StreamSession session, Supplier<CompletableFuture<Void>> chain) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        Runnable task = SessionLogContext.wrap(session, () -> {
            CompletableFuture<Void> started;
            try {
                started = chain.get();
            } catch (RuntimeException e) {
                started = CompletableFuture.failedFuture(e);
            }
            started.whenComplete((v, error) -> {
                if (error != null) {
                    LOG.error("Fan-out failed for stream {}", session.getStreamId(), error);
                }
                done.complete(null);
            });
        });
        executor.execute(task);
        return done;
    }

    /**
     * Forwards one transcript item. Completes normally even when delivery fails.
     */
    private CompletableFuture<Void> forwardTranscript(StreamSession session, String text, long seq, SegmentType type) {
        TranscriptForward payload = new TranscriptForward(session.getCallId(), text, seq, type, session.getTenantId());
        return forward("transcript", session, () -> caseManagement.forwardTranscript(payload));
    }

    private CompletableFuture<Void> enrich(StreamSession session, String text, List<String> context) {
        if (text.length() < properties.getIntentMinLength()) {
            LOG.debug("Skipping intent for short segment ({} chars) on stream {}", text.length(),
                    session.getStreamId());
            return CompletableFuture.completedFuture(null);
        }
        return resilient.call(Destination.LLM, "intent", () -> intentClassifier.classify(text, context))
                .exceptionally(error -> {
                    LOG.warn("Intent detection failed for stream {}: {}", session.getStreamId(), error.toString());
                    return IntentResult.unknown();
                })
                .thenComposeAsync(intent -> onIntent(session, text, intent), executor);
    }

    private CompletableFuture<Void> onIntent(StreamSession session, String text, IntentResult intent) {
        if (intent.isUnknown()) {
            return CompletableFuture.completedFuture(null);
        }
        LOG.info("Intent detected for stream {}: {} ({})", session.getStreamId(), intent.intent(),
                intent.confidence());
        metrics.intentDetected(intent.intent());
        IntentForward payload = new IntentForward(session.getCallId(), intent.intent(), intent.confidence(),
                session.getTenantId());
        return forward("intent", session, () -> caseManagement.forwardIntent(payload))
                .thenCompose(ignored -> searchKnowledgeBase(session, text, intent));
    }

    private CompletableFuture<Void> searchKnowledgeBase(StreamSession session, String text, IntentResult intent) {
        return resilient.call(Destination.KB, "search",
                        () -> knowledgeBase.search(intent.intent(), text, session.getTenantId(),
                                properties.getKbMaxResults()))
                .exceptionally(error -> {
                    LOG.warn("KB search failed for stream {}: {}", session.getStreamId(), error.toString());
                    return List.of();
                })
                .thenComposeAsync(articles -> forwardArticles(session, intent, articles), executor);
    }

    private CompletableFuture<Void> forwardArticles(StreamSession session, IntentResult intent,
                                                    List<KbArticle> articles) {
        if (articles.isEmpty()) {
            LOG.debug("No KB articles for intent {} on stream {}", intent.intent(), session.getStreamId());
            return CompletableFuture.completedFuture(null);
        }
        LOG.info("Forwarding {} KB articles for intent {} on stream {}", articles.size(), intent.intent(),
                session.getStreamId());
        KbSuggestionsForward payload = new KbSuggestionsForward(session.getCallId(), session.getTenantId(),
                intent.intent(), articles);
        return forward("kb", session, () -> caseManagement.forwardKbSuggestions(payload));
    }

    private CompletableFuture<Void> forward(String kind, StreamSession session,
                                            Supplier<CompletableFuture<Void>> call) {
        long start = System.nanoTime();
        return resilient.call(Destination.FRONTEND, kind, call)
                .handle((v, error) -> {
                    boolean ok = error == null;
                    metrics.recordForward(kind, ok, System.nanoTime() - start);
                    if (!ok) {
                        LOG.warn("Failed to forward {} for stream {}: {}", kind, session.getStreamId(),
                                error.toString());
                    }
                    return null;
                });
    }
}

package com.phillippitts.callcopilot.service.disposition;

import com.phillippitts.callcopilot.config.properties.FrontendProperties;
import com.phillippitts.callcopilot.config.properties.SessionProperties;
import com.phillippitts.callcopilot.domain.DispositionForward;
import com.phillippitts.callcopilot.domain.DispositionSummary;
import com.phillippitts.callcopilot.service.casemanagement.CaseManagementClient;
import com.phillippitts.callcopilot.service.fanout.SessionLogContext;
import com.phillippitts.callcopilot.service.metrics.CopilotMetrics;
import com.phillippitts.callcopilot.service.resilience.Destination;
import com.phillippitts.callcopilot.service.resilience.ResilientCaller;
import com.phillippitts.callcopilot.service.session.StreamSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Generates and forwards the end-of-call disposition for a draining session.
 *
 * <p>Best-effort: any failure while summarizing is replaced by
 * {@link DispositionSummary#fallback()}, and a failed forward is logged. The returned
 * future never fails.
 */
@Component
public class DispositionService {

    private static final Logger LOG = LogManager.getLogger(DispositionService.class);

    private final CallSummarizer summarizer;
    private final CaseManagementClient caseManagement;
    private final ResilientCaller resilient;
    private final SessionProperties sessionProperties;
    private final FrontendProperties frontendProperties;
    private final Executor executor;
    private final CopilotMetrics metrics;

    public DispositionService(CallSummarizer summarizer,
                              CaseManagementClient caseManagement,
                              ResilientCaller resilient,
                              SessionProperties sessionProperties,
                              FrontendProperties frontendProperties,
                              @Qualifier("fanoutExecutor") Executor executor,
                              CopilotMetrics metrics) {
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
        this.caseManagement = Objects.requireNonNull(caseManagement, "caseManagement must not be null");
        this.resilient = Objects.requireNonNull(resilient, "resilient must not be null");
        this.sessionProperties = Objects.requireNonNull(sessionProperties, "sessionProperties must not be null");
        this.frontendProperties = Objects.requireNonNull(frontendProperties, "frontendProperties must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Summarizes the session's transcript log and forwards the result, on the fan-out executor.
     *
     * @return future completing once the forward attempt has settled
     */
    public CompletableFuture<Void> generateAndForward(StreamSession session) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        executor.execute(SessionLogContext.wrap(session, () -> {
            CompletableFuture<Void> chain;
            try {
                chain = summarize(session).thenCompose(summary -> forward(session, summary));
            } catch (RuntimeException e) {
                chain = CompletableFuture.failedFuture(e);
            }
            chain.whenComplete((v, error) -> {
                if (error != null) {
                    LOG.error("Disposition failed for stream {}", session.getStreamId(), error);
                }
                done.complete(null);
            });
        }));
        return done;
    }

    CompletableFuture<DispositionSummary> summarize(StreamSession session) {
        String transcript = String.join(" ", session.transcriptSnapshot()).trim();
        if (transcript.length() < sessionProperties.getIntentMinLength()) {
            LOG.info("Transcript too short to summarize for stream {} ({} chars); using fallback",
                    session.getStreamId(), transcript.length());
            metrics.dispositionFallback();
            return CompletableFuture.completedFuture(DispositionSummary.fallback());
        }
        return resilient.call(Destination.LLM, "summarize", () -> summarizer.summarize(transcript))
                .exceptionally(error -> {
                    LOG.warn("Summary failed for stream {}; using fallback: {}", session.getStreamId(),
                            error.toString());
                    metrics.dispositionFallback();
                    return DispositionSummary.fallback();
                });
    }

    private CompletableFuture<Void> forward(StreamSession session, DispositionSummary summary) {
        DispositionForward payload = new DispositionForward(session.getCallId(), session.getTenantId(), summary,
                frontendProperties.getAuthor());
        long start = System.nanoTime();
        return resilient.call(Destination.FRONTEND, "disposition", () -> caseManagement.forwardDisposition(payload))
                .handle((v, error) -> {
                    boolean ok = error == null;
                    metrics.recordForward("disposition", ok, System.nanoTime() - start);
                    if (ok) {
                        LOG.info("Disposition forwarded for stream {} (codes={}, confidence={})",
                                session.getStreamId(), summary.dispositions().size(), summary.confidence());
                    } else {
                        LOG.warn("Failed to forward disposition for stream {}: {}", session.getStreamId(),
                                error.toString());
                    }
                    return null;
                });
    }
}

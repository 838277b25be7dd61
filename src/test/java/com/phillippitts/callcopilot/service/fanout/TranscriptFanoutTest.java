package com.phillippitts.callcopilot.service.fanout;

import com.phillippitts.callcopilot.config.properties.SessionProperties;
import com.phillippitts.callcopilot.domain.IntentResult;
import com.phillippitts.callcopilot.domain.KbArticle;
import com.phillippitts.callcopilot.domain.SegmentType;
import com.phillippitts.callcopilot.domain.TranscriptForward;
import com.phillippitts.callcopilot.exception.UpstreamException;
import com.phillippitts.callcopilot.service.intent.IntentClassifier;
import com.phillippitts.callcopilot.service.kb.KnowledgeBaseSearch;
import com.phillippitts.callcopilot.service.metrics.CopilotMetrics;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import com.phillippitts.callcopilot.service.session.StreamSession;
import com.phillippitts.callcopilot.testutil.RecordingCaseManagementClient;
import com.phillippitts.callcopilot.testutil.SyncExecutor;
import com.phillippitts.callcopilot.testutil.TestResilience;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptFanoutTest {

    private static final KbArticle ARTICLE = new KbArticle("kb-1", "Blocking a lost card", "Steps to block",
            "https://kb/1", List.of("card"), "api", 0.8);

    private RecordingCaseManagementClient client;
    private List<List<String>> classifyContexts;
    private AtomicInteger kbSearches;
    private IntentClassifier classifier;
    private KnowledgeBaseSearch knowledgeBase;
    private SimpleMeterRegistry meters;
    private StreamSession session;

    @BeforeEach
    void setUp() {
        client = new RecordingCaseManagementClient();
        classifyContexts = new CopyOnWriteArrayList<>();
        kbSearches = new AtomicInteger();
        classifier = (text, context) -> {
            classifyContexts.add(context);
            return CompletableFuture.completedFuture(new IntentResult("credit_card_block", 0.9));
        };
        knowledgeBase = (intent, text, tenantId, maxResults) -> {
            kbSearches.incrementAndGet();
            return CompletableFuture.completedFuture(List.of(ARTICLE));
        };
        meters = new SimpleMeterRegistry();
        session = new StreamSession("MZ1", "CA1", "acme", "", "", "pcm16", 8000, Instant.now());
    }

    private TranscriptFanout fanout(Executor executor) {
        return new TranscriptFanout(client, classifier, knowledgeBase, TestResilience.caller(),
                new SessionProperties(), executor, new CopilotMetrics(meters));
    }

    private TranscriptFanout fanout() {
        return fanout(new SyncExecutor());
    }

    @Test
    void finalSegmentRunsWholeChain() {
        fanout().onSegment(session, TranscriptSegment.finalSegment("I lost my credit card yesterday", 0.9)).join();

        assertThat(session.transcriptSnapshot()).containsExactly("I lost my credit card yesterday");
        assertThat(client.transcripts).hasSize(1);
        TranscriptForward forwarded = client.transcripts.get(0);
        assertThat(forwarded.seq()).isEqualTo(1);
        assertThat(forwarded.type()).isEqualTo(SegmentType.FINAL);
        assertThat(forwarded.tenantId()).isEqualTo("acme");

        assertThat(classifyContexts).containsExactly(List.of("I lost my credit card yesterday"));
        assertThat(client.intents).singleElement()
                .satisfies(intent -> assertThat(intent.intent()).isEqualTo("credit_card_block"));
        assertThat(client.suggestions).singleElement()
                .satisfies(s -> assertThat(s.articles()).containsExactly(ARTICLE));
        assertThat(meters.counter("callcopilot.intent", "intent", "credit_card_block").count()).isEqualTo(1.0);
    }

    @Test
    void partialSegmentIsForwardedButNotLoggedOrClassified() {
        fanout().onSegment(session, TranscriptSegment.partialSegment("I lost my credit", 0.4)).join();

        assertThat(client.transcripts).singleElement()
                .satisfies(t -> assertThat(t.type()).isEqualTo(SegmentType.PARTIAL));
        assertThat(session.hasTranscript()).isFalse();
        assertThat(classifyContexts).isEmpty();
    }

    @Test
    void shortFinalSkipsIntent() {
        fanout().onSegment(session, TranscriptSegment.finalSegment("yes ok", 0.9)).join();

        assertThat(client.transcripts).hasSize(1);
        assertThat(classifyContexts).isEmpty();
        assertThat(kbSearches.get()).isZero();
    }

    @Test
    void blankSegmentIsIgnored() {
        fanout().onSegment(session, TranscriptSegment.finalSegment("   ", 0.9)).join();

        assertThat(client.transcripts).isEmpty();
        assertThat(session.getOutboundSeq()).isZero();
    }

    @Test
    void unknownIntentStopsChain() {
        classifier = (text, context) -> CompletableFuture.completedFuture(IntentResult.unknown());

        fanout().onSegment(session, TranscriptSegment.finalSegment("hello is anybody there", 0.9)).join();

        assertThat(client.transcripts).hasSize(1);
        assertThat(client.intents).isEmpty();
        assertThat(kbSearches.get()).isZero();
    }

    @Test
    void classifierFailureIsTreatedAsUnknown() {
        classifier = (text, context) -> CompletableFuture.failedFuture(
                new UpstreamException("bad key", "llm", 401, false));

        CompletableFuture<Void> done = fanout().onSegment(session,
                TranscriptSegment.finalSegment("I lost my credit card yesterday", 0.9));

        assertThat(done).isCompletedWithValue(null);
        assertThat(client.transcripts).hasSize(1);
        assertThat(client.intents).isEmpty();
    }

    @Test
    void kbFailureStillForwardsIntent() {
        knowledgeBase = (intent, text, tenantId, maxResults) -> CompletableFuture.failedFuture(
                new UpstreamException("kb down", "kb", 404, false));

        CompletableFuture<Void> done = fanout().onSegment(session,
                TranscriptSegment.finalSegment("I lost my credit card yesterday", 0.9));

        assertThat(done).isCompletedWithValue(null);
        assertThat(client.intents).hasSize(1);
        assertThat(client.suggestions).isEmpty();
    }

    @Test
    void emptyKbResultForwardsNoSuggestions() {
        knowledgeBase = (intent, text, tenantId, maxResults) -> CompletableFuture.completedFuture(List.of());

        fanout().onSegment(session, TranscriptSegment.finalSegment("I lost my credit card yesterday", 0.9)).join();

        assertThat(client.intents).hasSize(1);
        assertThat(client.suggestions).isEmpty();
    }

    @Test
    void transientForwardFailureIsRetried() {
        client.failTranscripts(2);

        fanout().onSegment(session, TranscriptSegment.finalSegment("yes ok", 0.9)).join();

        assertThat(client.transcriptAttempts.get()).isEqualTo(3);
        assertThat(client.transcripts).hasSize(1);
    }

    @Test
    void exhaustedForwardFailureIsAbsorbed() {
        client.failTranscripts(10);

        CompletableFuture<Void> done = fanout().onSegment(session,
                TranscriptSegment.finalSegment("I lost my credit card yesterday", 0.9));

        assertThat(done).isCompletedWithValue(null);
        assertThat(client.transcriptAttempts.get()).isEqualTo(4);
        // intent still runs from the authoritative log
        assertThat(client.intents).hasSize(1);
        assertThat(meters.counter("callcopilot.forward", "kind", "transcript", "outcome", "failure").count())
                .isEqualTo(1.0);
    }

    @Test
    void sequenceNumbersFollowDeliveryOrder() {
        TranscriptFanout fanout = fanout();

        fanout.onSegment(session, TranscriptSegment.partialSegment("I lost", 0.3)).join();
        fanout.onSegment(session, TranscriptSegment.finalSegment("I lost my card", 0.9)).join();
        fanout.onSegment(session, TranscriptSegment.partialSegment("please", 0.3)).join();

        assertThat(client.transcripts).extracting(TranscriptForward::seq).containsExactly(1L, 2L, 3L);
    }

    @Test
    void intentContextIsFixedWhenSegmentIsAppended() {
        TranscriptFanout fanout = fanout();
        CompletableFuture<Void> slowForward = new CompletableFuture<>();
        client.holdNextTranscript(slowForward);

        CompletableFuture<Void> first = fanout.onSegment(session,
                TranscriptSegment.finalSegment("first statement about my card", 0.9));
        fanout.onSegment(session, TranscriptSegment.finalSegment("second statement said later", 0.9)).join();
        assertThat(first).isNotDone();

        slowForward.complete(null);
        first.join();

        assertThat(classifyContexts).containsExactly(
                List.of("first statement about my card", "second statement said later"),
                List.of("first statement about my card"));
    }

    @Test
    void forwardingRunsOnExecutorNotCaller() {
        Queue<Runnable> queued = new ArrayDeque<>();
        TranscriptFanout fanout = fanout(queued::add);

        CompletableFuture<Void> done = fanout.onSegment(session,
                TranscriptSegment.finalSegment("I lost my credit card yesterday", 0.9));

        assertThat(done).isNotDone();
        assertThat(session.hasTranscript()).isTrue();
        assertThat(client.transcripts).isEmpty();

        while (!queued.isEmpty()) {
            queued.poll().run();
        }
        assertThat(done).isCompletedWithValue(null);
        assertThat(client.suggestions).hasSize(1);
    }
}

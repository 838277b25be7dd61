package com.phillippitts.callcopilot.service.pipeline;

import com.phillippitts.callcopilot.config.properties.ThreadPoolProperties;
import com.phillippitts.callcopilot.exception.SessionFatalException;
import com.phillippitts.callcopilot.exception.UpstreamException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultPipelineManagerTest {

    private FakeProvider provider;
    private DefaultPipelineManager manager;

    @BeforeEach
    void setUp() {
        provider = new FakeProvider();
        manager = new DefaultPipelineManager(provider, new ThreadPoolProperties());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void createsOnePipelinePerStream() {
        PipelineHandle handle = manager.createPipeline("MZ1", "CA1", 8000, segment -> { });

        assertThat(handle.streamId()).isEqualTo("MZ1");
        assertThat(handle.isOpen()).isTrue();
        assertThat(manager.activeCount()).isEqualTo(1);
        assertThat(provider.opened.get()).isEqualTo(1);
        assertThat(provider.lastRequest.sampleRateHz()).isEqualTo(8000);
    }

    @Test
    void duplicateCreateReturnsExistingHandle() {
        PipelineHandle first = manager.createPipeline("MZ1", "CA1", 8000, segment -> { });
        PipelineHandle second = manager.createPipeline("MZ1", "CA1", 8000, segment -> { });

        assertThat(second).isSameAs(first);
        assertThat(provider.opened.get()).isEqualTo(1);
    }

    @Test
    void providerFailureBecomesSessionFatal() {
        provider.failOpen = true;

        assertThatThrownBy(() -> manager.createPipeline("MZ1", "CA1", 8000, segment -> { }))
                .isInstanceOf(SessionFatalException.class)
                .hasCauseInstanceOf(UpstreamException.class);
        assertThat(manager.activeCount()).isZero();
    }

    @Test
    void feedsAudioToLivePipelineOnly() {
        manager.createPipeline("MZ1", "CA1", 8000, segment -> { });

        manager.feedAudio("MZ1", new byte[]{1, 2});
        manager.feedAudio("unknown", new byte[]{3});
        manager.feedAudio("MZ1", new byte[0]);

        assertThat(provider.stream.sent).hasSize(1);
        assertThat(provider.stream.sent.get(0)).containsExactly(1, 2);
    }

    @Test
    void stopClosesStreamAndIsIdempotent() {
        PipelineHandle handle = manager.createPipeline("MZ1", "CA1", 8000, segment -> { });

        manager.stopPipeline("MZ1");
        manager.stopPipeline("MZ1");
        manager.stopPipeline("never-started");

        assertThat(handle.isOpen()).isFalse();
        assertThat(provider.stream.closeCount.get()).isEqualTo(1);
        assertThat(manager.activeCount()).isZero();

        manager.feedAudio("MZ1", new byte[]{1});
        assertThat(provider.stream.sent).isEmpty();
    }

    @Test
    void sendFailureIsAbsorbed() {
        manager.createPipeline("MZ1", "CA1", 8000, segment -> { });
        provider.stream.failSends = true;

        manager.feedAudio("MZ1", new byte[]{1});

        assertThat(manager.activeCount()).isEqualTo(1);
    }

    @Test
    void poolIsCreatedLazilyAndReleasedOnShutdown() {
        assertThat(manager.isPoolAllocated()).isFalse();

        manager.createPipeline("MZ1", "CA1", 8000, segment -> { });
        manager.createPipeline("MZ2", "CA2", 16000, segment -> { });
        assertThat(manager.isPoolAllocated()).isTrue();
        assertThat(provider.clients).hasSize(2);
        assertThat(provider.clients.get(0)).isSameAs(provider.clients.get(1));

        manager.shutdown();
        manager.shutdown();

        assertThat(manager.isPoolAllocated()).isFalse();
        assertThat(manager.activeCount()).isZero();
        assertThatThrownBy(() -> manager.createPipeline("MZ3", "CA3", 8000, segment -> { }))
                .isInstanceOf(SessionFatalException.class);
    }

    @Test
    void stoppingOneStreamLeavesPoolForOthers() {
        manager.createPipeline("MZ1", "CA1", 8000, segment -> { });
        manager.createPipeline("MZ2", "CA2", 8000, segment -> { });

        manager.stopPipeline("MZ1");

        assertThat(manager.isPoolAllocated()).isTrue();
        assertThat(manager.activeCount()).isEqualTo(1);
    }

    private static final class FakeProvider implements TranscriptionProvider {
        final AtomicInteger opened = new AtomicInteger();
        final List<HttpClient> clients = new CopyOnWriteArrayList<>();
        volatile boolean failOpen;
        volatile PipelineRequest lastRequest;
        volatile FakeStream stream;

        @Override
        public TranscriptionStream open(PipelineRequest request, TranscriptSink sink, HttpClient httpClient) {
            if (failOpen) {
                throw new UpstreamException("connect refused", "deepgram", UpstreamException.NO_STATUS, true);
            }
            opened.incrementAndGet();
            clients.add(httpClient);
            lastRequest = request;
            stream = new FakeStream();
            return stream;
        }

        @Override
        public String name() {
            return "fake";
        }
    }

    private static final class FakeStream implements TranscriptionStream {
        final List<byte[]> sent = new CopyOnWriteArrayList<>();
        final AtomicInteger closeCount = new AtomicInteger();
        volatile boolean failSends;

        @Override
        public CompletableFuture<Void> sendAudio(byte[] pcm) {
            if (failSends) {
                return CompletableFuture.failedFuture(new IllegalStateException("socket closed"));
            }
            sent.add(pcm);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
        }
    }
}

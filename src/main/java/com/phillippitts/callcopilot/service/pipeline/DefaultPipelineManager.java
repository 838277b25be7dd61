package com.phillippitts.callcopilot.service.pipeline;

import com.phillippitts.callcopilot.config.properties.ThreadPoolProperties;
import com.phillippitts.callcopilot.exception.SessionFatalException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link PipelineManager} backed by a {@link TranscriptionProvider}.
 *
 * <p>The shared {@link HttpClient} and its executor are created on the first
 * {@link #createPipeline} call and released only by {@link #shutdown()}.
 *
 * <p>Thread-safe. Pipelines are kept in a {@link ConcurrentHashMap}; no lock is held while
 * a provider connection is being opened.
 */
@Component
public class DefaultPipelineManager implements PipelineManager {

    private static final Logger LOG = LogManager.getLogger(DefaultPipelineManager.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final TranscriptionProvider provider;
    private final ThreadPoolProperties.HttpPoolProperties poolProperties;

    private final Map<String, ActivePipeline> pipelines = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final Lock poolLock = new ReentrantLock();
    private ExecutorService httpExecutor;
    private HttpClient httpClient;

    public DefaultPipelineManager(TranscriptionProvider provider, ThreadPoolProperties threadPoolProperties) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.poolProperties = threadPoolProperties.getHttp();
    }

    @Override
    public PipelineHandle createPipeline(String streamId, String callId, int sampleRateHz, TranscriptSink sink) {
        Objects.requireNonNull(streamId, "streamId must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        if (shutdown.get()) {
            throw new SessionFatalException("Pipeline manager is shut down", streamId);
        }
        ActivePipeline existing = pipelines.get(streamId);
        if (existing != null) {
            LOG.warn("Pipeline already active for stream {}; ignoring duplicate create", streamId);
            return existing;
        }

        TranscriptionStream stream;
        try {
            stream = provider.open(new PipelineRequest(streamId, callId, sampleRateHz), sink, sharedClient());
        } catch (RuntimeException e) {
            LOG.error("Failed to create {} pipeline for stream {}", provider.name(), streamId, e);
            throw new SessionFatalException("Could not create transcription pipeline", streamId, e);
        }

        ActivePipeline created = new ActivePipeline(streamId, stream, Instant.now());
        ActivePipeline raced = pipelines.putIfAbsent(streamId, created);
        if (raced != null) {
            LOG.warn("Concurrent pipeline create for stream {}; closing duplicate", streamId);
            closeQuietly(created);
            return raced;
        }
        LOG.info("Pipeline started (stream={}, provider={}, sampleRate={})", streamId, provider.name(), sampleRateHz);
        return created;
    }

    @Override
    public void feedAudio(String streamId, byte[] audio) {
        ActivePipeline pipeline = streamId == null ? null : pipelines.get(streamId);
        if (pipeline == null) {
            LOG.warn("No active pipeline for stream {}; dropping {} bytes", streamId,
                    audio == null ? 0 : audio.length);
            return;
        }
        if (audio == null || audio.length == 0) {
            return;
        }
        pipeline.framesSent.incrementAndGet();
        try {
            pipeline.stream.sendAudio(audio).exceptionally(error -> {
                LOG.warn("Audio send failed for stream {}: {}", streamId, error.toString());
                return null;
            });
        } catch (RuntimeException e) {
            LOG.warn("Audio send failed for stream {}", streamId, e);
        }
    }

    @Override
    public void stopPipeline(String streamId) {
        ActivePipeline pipeline = streamId == null ? null : pipelines.remove(streamId);
        if (pipeline == null) {
            LOG.debug("stopPipeline for unknown or stopped stream {}", streamId);
            return;
        }
        closeQuietly(pipeline);
        LOG.info("Pipeline stopped (stream={}, framesSent={}, durationMs={})", streamId, pipeline.framesSent.get(),
                Duration.between(pipeline.startedAt, Instant.now()).toMillis());
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            LOG.debug("Pipeline manager already shut down");
            return;
        }
        List<String> ids = List.copyOf(pipelines.keySet());
        LOG.info("Shutting down pipeline manager ({} active pipelines)", ids.size());
        for (String id : ids) {
            stopPipeline(id);
        }
        releasePool();
    }

    @Override
    public int activeCount() {
        return pipelines.size();
    }

    /** True once the shared pool has been created and not yet released. */
    boolean isPoolAllocated() {
        poolLock.lock();
        try {
            return httpClient != null;
        } finally {
            poolLock.unlock();
        }
    }

    private HttpClient sharedClient() {
        poolLock.lock();
        try {
            if (httpClient == null) {
                httpExecutor = Executors.newFixedThreadPool(poolProperties.getPoolSize(), threadFactory());
                httpClient = HttpClient.newBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .executor(httpExecutor)
                        .build();
                LOG.info("Shared pipeline HTTP pool created (threads={})", poolProperties.getPoolSize());
            }
            return httpClient;
        } finally {
            poolLock.unlock();
        }
    }

    private void releasePool() {
        ExecutorService executor;
        poolLock.lock();
        try {
            executor = httpExecutor;
            httpExecutor = null;
            httpClient = null;
        } finally {
            poolLock.unlock();
        }
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        LOG.info("Shared pipeline HTTP pool released");
    }

    private CustomizableThreadFactory threadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(poolProperties.getThreadNamePrefix());
        factory.setDaemon(true);
        return factory;
    }

    private static void closeQuietly(ActivePipeline pipeline) {
        pipeline.open.set(false);
        try {
            pipeline.stream.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing pipeline for stream {}", pipeline.streamId, e);
        }
    }

    private static final class ActivePipeline implements PipelineHandle {
        private final String streamId;
        private final TranscriptionStream stream;
        private final Instant startedAt;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final AtomicLong framesSent = new AtomicLong();

        private ActivePipeline(String streamId, TranscriptionStream stream, Instant startedAt) {
            this.streamId = streamId;
            this.stream = stream;
            this.startedAt = startedAt;
        }

        @Override
        public String streamId() {
            return streamId;
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }
    }
}

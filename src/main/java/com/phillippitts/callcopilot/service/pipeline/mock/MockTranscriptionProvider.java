package com.phillippitts.callcopilot.service.pipeline.mock;

import com.phillippitts.callcopilot.service.pipeline.PipelineRequest;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSink;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.HttpClient;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Offline provider for local runs: emits a partial segment halfway through every
 * {@code framesPerSegment} audio frames and a final segment at the end of each block.
 */
public class MockTranscriptionProvider implements TranscriptionProvider {

    private static final Logger LOG = LogManager.getLogger(MockTranscriptionProvider.class);

    private final int framesPerSegment;

    public MockTranscriptionProvider(int framesPerSegment) {
        if (framesPerSegment < 2) {
            throw new IllegalArgumentException("framesPerSegment must be at least 2: " + framesPerSegment);
        }
        this.framesPerSegment = framesPerSegment;
    }

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public TranscriptionStream open(PipelineRequest request, TranscriptSink sink, HttpClient httpClient) {
        LOG.info("Mock transcription stream opened for {} at {} Hz", request.streamId(), request.sampleRateHz());
        return new MockStream(sink, framesPerSegment);
    }

    private static final class MockStream implements TranscriptionStream {
        private final TranscriptSink sink;
        private final int framesPerSegment;
        private final AtomicInteger frames = new AtomicInteger();
        private final AtomicInteger segments = new AtomicInteger();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private MockStream(TranscriptSink sink, int framesPerSegment) {
            this.sink = sink;
            this.framesPerSegment = framesPerSegment;
        }

        @Override
        public CompletableFuture<Void> sendAudio(byte[] pcm) {
            if (closed.get()) {
                return CompletableFuture.failedFuture(new IllegalStateException("Stream closed"));
            }
            int count = frames.incrementAndGet();
            if (count % framesPerSegment == framesPerSegment / 2) {
                sink.onSegment(TranscriptSegment.partialSegment("caller is speaking", 0.5));
            } else if (count % framesPerSegment == 0) {
                int n = segments.incrementAndGet();
                sink.onSegment(TranscriptSegment.finalSegment(
                        "I would like to check the status of my account, segment " + n, 0.9));
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}

package com.phillippitts.callcopilot.service.pipeline.openai;

import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSink;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionStream;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Batch transcription presented as a stream: audio is buffered into fixed-length segments,
 * each segment is uploaded on a per-stream worker, and every non-blank result is delivered
 * as a final segment. Segments whose peak level stays under {@code silencePeak} are
 * skipped. Closing flushes the remainder and lets the worker finish in order.
 */
final class SegmentedWhisperStream implements TranscriptionStream {

    private static final Logger LOG = LogManager.getLogger(SegmentedWhisperStream.class);

    // The batch endpoint reports no confidence
    private static final double CONFIDENCE = 1.0;

    private final String streamId;
    private final int sampleRateHz;
    private final TranscriptSink sink;
    private final Function<byte[], String> transcriber;
    private final int segmentBytes;
    private final int silencePeak;
    private final ExecutorService worker;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean closed;

    SegmentedWhisperStream(String streamId, int sampleRateHz, TranscriptSink sink,
                           Function<byte[], String> transcriber, Duration segment, int silencePeak,
                           ExecutorService worker) {
        this.streamId = Objects.requireNonNull(streamId, "streamId must not be null");
        this.sampleRateHz = sampleRateHz;
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.transcriber = Objects.requireNonNull(transcriber, "transcriber must not be null");
        this.silencePeak = silencePeak;
        this.worker = Objects.requireNonNull(worker, "worker must not be null");
        // 2 bytes per mono PCM16 sample
        this.segmentBytes = (int) Math.max(2, segment.toMillis() * sampleRateHz * 2 / 1000);
    }

    @Override
    public synchronized CompletableFuture<Void> sendAudio(byte[] pcm) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Stream closed: " + streamId));
        }
        buffer.write(pcm, 0, pcm.length);
        if (buffer.size() >= segmentBytes) {
            flush();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (buffer.size() > 0) {
            flush();
        }
        worker.shutdown();
    }

    // Caller holds the monitor
    private void flush() {
        byte[] pcm = buffer.toByteArray();
        buffer.reset();
        if (PcmWav.peak(pcm) < silencePeak) {
            LOG.debug("Skipping silent segment ({} bytes) for stream {}", pcm.length, streamId);
            return;
        }
        worker.execute(() -> transcribe(pcm));
    }

    private void transcribe(byte[] pcm) {
        String text;
        try {
            text = transcriber.apply(PcmWav.wrap(pcm, sampleRateHz));
        } catch (RuntimeException e) {
            LOG.warn("Segment transcription failed for stream {}: {}", streamId, e.getMessage());
            return;
        }
        if (text == null || text.isBlank()) {
            return;
        }
        TranscriptSegment segment = TranscriptSegment.finalSegment(text.trim(), CONFIDENCE);
        try {
            sink.onSegment(segment);
        } catch (RuntimeException e) {
            LOG.error("Transcript sink failed for stream {} (text='{}')", streamId,
                    LogSanitizer.truncate(segment.text(), 40), e);
        }
    }
}

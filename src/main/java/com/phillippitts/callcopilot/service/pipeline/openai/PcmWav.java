package com.phillippitts.callcopilot.service.pipeline.openai;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Wraps raw little-endian PCM16 mono audio in a minimal 44-byte RIFF/WAVE header, and
 * measures its peak level.
 */
final class PcmWav {

    static final int HEADER_SIZE = 44;

    private static final short FORMAT_PCM = 1;
    private static final short CHANNELS = 1;
    private static final short BITS_PER_SAMPLE = 16;

    private PcmWav() {
        // Utility class - prevent instantiation
    }

    static byte[] wrap(byte[] pcm, int sampleRateHz) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        int blockAlign = CHANNELS * BITS_PER_SAMPLE / 8;
        ByteBuffer out = ByteBuffer.allocate(HEADER_SIZE + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
        out.put(new byte[] {'R', 'I', 'F', 'F'});
        out.putInt(36 + pcm.length);
        out.put(new byte[] {'W', 'A', 'V', 'E'});
        out.put(new byte[] {'f', 'm', 't', ' '});
        out.putInt(16);
        out.putShort(FORMAT_PCM);
        out.putShort(CHANNELS);
        out.putInt(sampleRateHz);
        out.putInt(sampleRateHz * blockAlign);
        out.putShort((short) blockAlign);
        out.putShort(BITS_PER_SAMPLE);
        out.put(new byte[] {'d', 'a', 't', 'a'});
        out.putInt(pcm.length);
        out.put(pcm);
        return out.array();
    }

    /** Largest absolute sample value; a trailing odd byte is ignored. */
    static int peak(byte[] pcm) {
        int peak = 0;
        for (int i = 0; i + 1 < pcm.length; i += 2) {
            int sample = (short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8));
            peak = Math.max(peak, Math.abs(sample));
        }
        return peak;
    }
}

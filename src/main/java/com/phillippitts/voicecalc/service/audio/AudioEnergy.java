package com.phillippitts.voicecalc.service.audio;

/**
 * RMS energy of 16-bit little-endian PCM.
 */
public final class AudioEnergy {

    private AudioEnergy() {
        // Utility class
    }

    public static double rms(byte[] pcm) {
        return pcm == null ? 0.0 : rms(pcm, 0, pcm.length);
    }

    /**
     * RMS over {@code length} bytes starting at {@code offset}. A trailing odd byte is ignored;
     * no complete sample yields 0.
     */
    public static double rms(byte[] pcm, int offset, int length) {
        if (pcm == null || length < 2) {
            return 0.0;
        }
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(pcm.length, offset + length);
        for (int i = offset; i + 1 < end; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0.0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}

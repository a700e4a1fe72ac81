package com.phillippitts.voicecalc.service.audio;

/**
 * Fixed PCM format of every audio segment: 16 kHz, 16-bit signed, mono, little-endian.
 */
public final class AudioFormat {

    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    public static final int REQUIRED_CHANNELS = 1;

    public static final boolean REQUIRED_SIGNED = true;
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /**
     * Java Sound descriptor of the required format.
     */
    public static javax.sound.sampled.AudioFormat javaSoundFormat() {
        return new javax.sound.sampled.AudioFormat(
                REQUIRED_SAMPLE_RATE,
                REQUIRED_BITS_PER_SAMPLE,
                REQUIRED_CHANNELS,
                REQUIRED_SIGNED,
                REQUIRED_BIG_ENDIAN);
    }

    /**
     * Number of whole-sample bytes covering the given duration.
     */
    public static int bytesFor(long millis) {
        long bytes = (millis * REQUIRED_BYTE_RATE) / 1000L;
        bytes -= bytes % REQUIRED_BLOCK_ALIGN;
        return (int) Math.min(Integer.MAX_VALUE - 1, Math.max(0, bytes));
    }

    /**
     * Playback duration of a PCM buffer in milliseconds.
     */
    public static long millisOf(int byteCount) {
        return (byteCount * 1000L) / REQUIRED_BYTE_RATE;
    }
}

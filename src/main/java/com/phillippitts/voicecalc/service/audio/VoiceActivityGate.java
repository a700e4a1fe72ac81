package com.phillippitts.voicecalc.service.audio;

/**
 * Energy gate in front of transcription: a segment passes only if its RMS is strictly above
 * the threshold. Empty and all-zero segments never pass.
 */
public final class VoiceActivityGate {

    public static final double DEFAULT_THRESHOLD = 150.0;

    private final double threshold;

    public VoiceActivityGate(double threshold) {
        if (threshold < 0.0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        this.threshold = threshold;
    }

    public boolean passes(byte[] pcm) {
        if (pcm == null || pcm.length < 2) {
            return false;
        }
        return AudioEnergy.rms(pcm) > threshold;
    }
}

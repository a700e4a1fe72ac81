package com.phillippitts.voicecalc.service.audio.capture;

import com.phillippitts.voicecalc.service.audio.AudioFormat;

import java.util.Objects;

/**
 * One captured utterance as raw PCM16LE mono 16 kHz.
 *
 * @param pcm raw sample bytes (not copied; callers must not mutate)
 */
public record AudioSegment(byte[] pcm) {

    public AudioSegment {
        Objects.requireNonNull(pcm, "pcm must not be null");
    }

    public long durationMillis() {
        return AudioFormat.millisOf(pcm.length);
    }

    public int size() {
        return pcm.length;
    }
}

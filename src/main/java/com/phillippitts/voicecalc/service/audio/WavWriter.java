package com.phillippitts.voicecalc.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Writes a segment as a canonical 44-byte-header PCM WAV file, the input whisper.cpp expects.
 */
public final class WavWriter {

    private static final int PCM_FORMAT_TAG = 1;
    private static final int FMT_CHUNK_SIZE = 16;

    private WavWriter() {}

    /**
     * @throws IOException if the file cannot be written
     */
    public static void write(byte[] pcm, Path wavPath) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(new byte[] {'R', 'I', 'F', 'F'});
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] {'W', 'A', 'V', 'E'});

            os.write(new byte[] {'f', 'm', 't', ' '});
            writeLEInt(os, FMT_CHUNK_SIZE);
            writeLEShort(os, PCM_FORMAT_TAG);
            writeLEShort(os, REQUIRED_CHANNELS);
            writeLEInt(os, REQUIRED_SAMPLE_RATE);
            writeLEInt(os, REQUIRED_BYTE_RATE);
            writeLEShort(os, REQUIRED_BLOCK_ALIGN);
            writeLEShort(os, REQUIRED_BITS_PER_SAMPLE);

            os.write(new byte[] {'d', 'a', 't', 'a'});
            writeLEInt(os, pcm.length);
            os.write(pcm);
            os.flush();
        }
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}

package com.phillippitts.voicecalc.service.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.voicecalc.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static com.phillippitts.voicecalc.testutil.FakeSegmentSource.tone;
import static org.assertj.core.api.Assertions.assertThat;

class WavWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteValidWavHeaderAndPayload() throws IOException {
        byte[] pcm = tone(REQUIRED_BYTE_RATE, 700);
        Path wav = tempDir.resolve("segment.wav");

        WavWriter.write(pcm, wav);
        byte[] all = Files.readAllBytes(wav);

        assertThat(all.length).isEqualTo(WAV_HEADER_SIZE + pcm.length);
        assertThat(new String(all, 0, 4)).isEqualTo("RIFF");
        assertThat(leInt(all, 4)).isEqualTo(36 + pcm.length);
        assertThat(new String(all, 8, 4)).isEqualTo("WAVE");
        assertThat(new String(all, 12, 4)).isEqualTo("fmt ");
        assertThat(leInt(all, 16)).isEqualTo(16);
        assertThat(leShort(all, 20)).isEqualTo(1);
        assertThat(leShort(all, 22)).isEqualTo(REQUIRED_CHANNELS);
        assertThat(leInt(all, 24)).isEqualTo(REQUIRED_SAMPLE_RATE);
        assertThat(leInt(all, 28)).isEqualTo(REQUIRED_BYTE_RATE);
        assertThat(leShort(all, 32)).isEqualTo(REQUIRED_BLOCK_ALIGN);
        assertThat(leShort(all, 34)).isEqualTo(REQUIRED_BITS_PER_SAMPLE);
        assertThat(new String(all, 36, 4)).isEqualTo("data");
        assertThat(leInt(all, 40)).isEqualTo(pcm.length);
        assertThat(Arrays.copyOfRange(all, WAV_HEADER_SIZE, all.length)).isEqualTo(pcm);
    }

    @Test
    void emptySegmentProducesHeaderOnly() throws IOException {
        Path wav = tempDir.resolve("empty.wav");

        WavWriter.write(new byte[0], wav);

        assertThat(Files.size(wav)).isEqualTo(WAV_HEADER_SIZE);
    }

    private static int leInt(byte[] b, int off) {
        return (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8) | ((b[off + 2] & 0xFF) << 16) | ((b[off + 3] & 0xFF) << 24);
    }

    private static int leShort(byte[] b, int off) {
        return (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8);
    }
}

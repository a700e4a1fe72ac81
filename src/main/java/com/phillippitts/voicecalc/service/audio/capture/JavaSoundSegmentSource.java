package com.phillippitts.voicecalc.service.audio.capture;

import com.phillippitts.voicecalc.config.audio.AudioCaptureProperties;
import com.phillippitts.voicecalc.exception.AudioCaptureException;
import com.phillippitts.voicecalc.service.audio.AudioEnergy;
import com.phillippitts.voicecalc.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound based microphone source producing PCM16LE mono @16kHz speech segments.
 *
 * <p>{@link #open()} reads {@code audio.capture.calibration-ms} of ambient audio and sets the
 * onset threshold to {@code max(energyThreshold, ambientRms * onsetFactor)}. A segment starts
 * with the first chunk above the onset threshold and ends after {@code pause-ms} of chunks at
 * or below it, or when the maximum duration is reached.
 *
 * <p>Waiting for speech is bounded both by captured audio time and by wall-clock time, so
 * {@link #acquireSegment(Duration, Duration)} returns within the timeout even when the line
 * stalls. Single consumer thread; {@link #close()} may come from any thread.
 */
public class JavaSoundSegmentSource implements SpeechSegmentSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundSegmentSource.class);

    /** Abstraction to probe and open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;

        /**
         * @return empty when a matching line exists, otherwise a description of the problem
         */
        Optional<String> probe(javax.sound.sampled.AudioFormat format, Optional<String> deviceName);
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final javax.sound.sampled.AudioFormat format = AudioFormat.javaSoundFormat();
    private final Optional<String> deviceError;

    private final Object lock = new Object();
    private volatile TargetDataLine line;
    private volatile boolean closed = true;
    private volatile double onsetThreshold;

    public JavaSoundSegmentSource(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundSegmentSource(AudioCaptureProperties props,
                           ApplicationEventPublisher publisher,
                           DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
        this.onsetThreshold = props.getEnergyThreshold();
        this.deviceError = provider.probe(format, Optional.ofNullable(props.getDeviceName()));
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        if (deviceError.isPresent()) {
            LOG.warn("No capture device available (device='{}'): {}", device, deviceError.get());
        } else {
            LOG.info("Audio capture initialized: device='{}', chunk={}ms, calibration={}ms, pause={}ms",
                    device, props.getChunkMillis(), props.getCalibrationMs(), props.getPauseMs());
        }
    }

    private static DataLineProvider defaultProvider() {
        return new DataLineProvider() {
            @Override
            public TargetDataLine open(javax.sound.sampled.AudioFormat fmt, Optional<String> device)
                    throws LineUnavailableException {
                TargetDataLine line = null;
                if (device.isPresent()) {
                    for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                        if (info.getName().equalsIgnoreCase(device.get())) {
                            Mixer m = AudioSystem.getMixer(info);
                            line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, fmt));
                            break;
                        }
                    }
                }
                if (line == null) {
                    line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, fmt));
                }
                line.open(fmt);
                return line;
            }

            @Override
            public Optional<String> probe(javax.sound.sampled.AudioFormat fmt, Optional<String> device) {
                try {
                    if (AudioSystem.isLineSupported(new DataLine.Info(TargetDataLine.class, fmt))) {
                        return Optional.empty();
                    }
                    return Optional.of("No input line supports " + fmt);
                } catch (RuntimeException e) {
                    return Optional.of(e.toString());
                }
            }
        };
    }

    @Override
    public boolean isDeviceAvailable() {
        return deviceError.isEmpty();
    }

    @Override
    public Optional<String> deviceError() {
        return deviceError;
    }

    @Override
    public void open() {
        TargetDataLine opened;
        synchronized (lock) {
            if (!closed) {
                throw new IllegalStateException("Segment source already open");
            }
            try {
                opened = provider.open(format, Optional.ofNullable(props.getDeviceName()));
                opened.start();
            } catch (LineUnavailableException e) {
                publisher.publishEvent(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
                throw new AudioCaptureException("MIC_UNAVAILABLE", "Microphone unavailable: " + e.getMessage(), e);
            } catch (SecurityException e) {
                publisher.publishEvent(new CaptureErrorEvent("MIC_PERMISSION_DENIED", Instant.now()));
                throw new AudioCaptureException("MIC_PERMISSION_DENIED",
                        "Microphone access denied: " + e.getMessage(), e);
            }
            line = opened;
            closed = false;
        }
        calibrate(opened);
    }

    private void calibrate(TargetDataLine opened) {
        int target = AudioFormat.bytesFor(props.getCalibrationMs());
        if (target == 0) {
            onsetThreshold = props.getEnergyThreshold();
            return;
        }
        ByteArrayOutputStream ambient = new ByteArrayOutputStream(target);
        byte[] chunk = new byte[chunkBytes()];
        long deadline = System.nanoTime() + Duration.ofMillis(props.getCalibrationMs()).multipliedBy(2).toNanos();
        while (ambient.size() < target && !closed) {
            int n = readChunk(opened, chunk);
            if (n < 0) {
                close();
                publisher.publishEvent(new CaptureErrorEvent("CALIBRATION_FAILED", Instant.now()));
                throw new AudioCaptureException("CALIBRATION_FAILED", "Microphone stopped during calibration", null);
            }
            ambient.write(chunk, 0, n);
            if (System.nanoTime() > deadline) {
                break;
            }
        }
        double ambientRms = AudioEnergy.rms(ambient.toByteArray());
        onsetThreshold = Math.max(props.getEnergyThreshold(), ambientRms * props.getOnsetFactor());
        LOG.info("Calibrated ambient noise: rms={}, onset threshold={}",
                String.format("%.1f", ambientRms), String.format("%.1f", onsetThreshold));
    }

    @Override
    public AcquireResult acquireSegment(Duration timeout, Duration maxDuration) {
        TargetDataLine current = line;
        if (closed || current == null) {
            return AcquireResult.timedOut();
        }
        byte[] chunk = new byte[chunkBytes()];
        int waitBytes = AudioFormat.bytesFor(timeout.toMillis());
        int maxBytes = AudioFormat.bytesFor(maxDuration.toMillis());
        int pauseBytes = AudioFormat.bytesFor(props.getPauseMs());
        long waitDeadline = System.nanoTime() + timeout.toNanos();

        // Wait for onset
        int waited = 0;
        ByteArrayOutputStream segment = null;
        while (segment == null) {
            if (closed) {
                return AcquireResult.timedOut();
            }
            int n = readChunk(current, chunk);
            if (n < 0) {
                return deviceLost();
            }
            waited += n;
            if (n > 0 && AudioEnergy.rms(chunk, 0, n) > onsetThreshold) {
                segment = new ByteArrayOutputStream(Math.min(maxBytes, AudioFormat.bytesFor(2000)));
                segment.write(chunk, 0, n);
            } else if (waited >= waitBytes || System.nanoTime() >= waitDeadline) {
                return AcquireResult.timedOut();
            }
        }

        // Record until pause or max duration
        int silent = 0;
        long recordDeadline = System.nanoTime() + maxDuration.multipliedBy(2).toNanos();
        while (segment.size() < maxBytes && silent < pauseBytes) {
            if (closed || System.nanoTime() >= recordDeadline) {
                break;
            }
            int n = readChunk(current, chunk);
            if (n < 0) {
                return deviceLost();
            }
            if (n == 0) {
                continue;
            }
            segment.write(chunk, 0, n);
            if (AudioEnergy.rms(chunk, 0, n) > onsetThreshold) {
                silent = 0;
            } else {
                silent += n;
            }
        }
        byte[] pcm = segment.toByteArray();
        LOG.debug("Captured segment of {} ms", AudioFormat.millisOf(pcm.length));
        return new AcquireResult.Captured(new AudioSegment(pcm));
    }

    @Override
    public void close() {
        TargetDataLine toClose;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = line;
            line = null;
        }
        if (toClose != null) {
            try {
                toClose.stop();
                toClose.close();
            } catch (RuntimeException e) {
                LOG.debug("Error while closing capture line: {}", e.toString());
            }
        }
        LOG.debug("Capture line closed");
    }

    // Package-private for tests
    double getOnsetThreshold() {
        return onsetThreshold;
    }

    private int chunkBytes() {
        return Math.max(AudioFormat.REQUIRED_BLOCK_ALIGN, AudioFormat.bytesFor(props.getChunkMillis()));
    }

    /**
     * Reads one chunk. Returns -1 when the line is gone or failed.
     */
    private int readChunk(TargetDataLine current, byte[] chunk) {
        if (!current.isOpen()) {
            return closed ? 0 : -1;
        }
        try {
            int n = current.read(chunk, 0, chunk.length);
            return Math.max(n, 0) - (Math.max(n, 0) % AudioFormat.REQUIRED_BLOCK_ALIGN);
        } catch (RuntimeException e) {
            if (closed) {
                return 0;
            }
            LOG.warn("Capture line read failed: {}", e.toString());
            return -1;
        }
    }

    private AcquireResult deviceLost() {
        if (closed) {
            return AcquireResult.timedOut();
        }
        publisher.publishEvent(new CaptureErrorEvent("DEVICE_LOST", Instant.now()));
        return new AcquireResult.DeviceLost("Microphone stopped delivering audio");
    }
}

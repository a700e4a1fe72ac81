package com.phillippitts.voicecalc.service.audio.capture;

import java.time.Duration;
import java.util.Optional;

/**
 * Continuous microphone input cut into speech segments.
 *
 * <p>Lifecycle per session: {@link #open()} (which includes ambient calibration), any number of
 * {@link #acquireSegment(Duration, Duration)} calls from a single thread, then {@link #close()}.
 * {@code close()} may be called from another thread and unblocks a pending acquisition.
 */
public interface SpeechSegmentSource extends AutoCloseable {

    /**
     * Whether a capture device was found on this host.
     */
    boolean isDeviceAvailable();

    /**
     * Why no device is available, if that is the case.
     */
    Optional<String> deviceError();

    /**
     * Opens the device and calibrates against ambient noise.
     *
     * @throws com.phillippitts.voicecalc.exception.AudioCaptureException if the device cannot be
     *         opened or calibration fails
     */
    void open();

    /**
     * Waits at most {@code timeout} for speech to start, then records until a pause or
     * {@code maxDuration}.
     *
     * @return captured segment, {@link AcquireResult.TimedOut} when nobody spoke, or
     *         {@link AcquireResult.DeviceLost}
     */
    AcquireResult acquireSegment(Duration timeout, Duration maxDuration);

    /**
     * Releases the device. Idempotent.
     */
    @Override
    void close();
}

package com.phillippitts.voicecalc.config.audio;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Required format (enforced by the segment source): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    /** RMS energy a whole segment must exceed to be transcribed. */
    @DecimalMin("0.0")
    private final double energyThreshold;

    /** Ambient noise sampling time before listening starts. */
    @Min(0)
    @Max(10_000)
    private final int calibrationMs;

    /** Trailing silence that ends a segment. */
    @Min(100)
    @Max(5_000)
    private final int pauseMs;

    /** Onset threshold as a multiple of the calibrated ambient RMS. */
    @DecimalMin("1.0")
    private final double onsetFactor;

    @ConstructorBinding
    public AudioCaptureProperties(@NotNull Integer chunkMillis,
                                  String deviceName,
                                  Double energyThreshold,
                                  Integer calibrationMs,
                                  Integer pauseMs,
                                  Double onsetFactor) {
        this.chunkMillis = chunkMillis;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
        this.energyThreshold = energyThreshold == null ? 150.0 : energyThreshold;
        this.calibrationMs = calibrationMs == null ? 1500 : calibrationMs;
        this.pauseMs = pauseMs == null ? 600 : pauseMs;
        this.onsetFactor = onsetFactor == null ? 1.5 : onsetFactor;
    }

    public int getChunkMillis() { return chunkMillis; }
    public String getDeviceName() { return deviceName; }
    public double getEnergyThreshold() { return energyThreshold; }
    public int getCalibrationMs() { return calibrationMs; }
    public int getPauseMs() { return pauseMs; }
    public double getOnsetFactor() { return onsetFactor; }
}

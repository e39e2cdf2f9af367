package com.phillippitts.voiceinput.config.audio;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Capture format is fixed by the service: 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the device in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Maximum capture duration in milliseconds; reaching it stops the recording. */
    @Min(100)
    @Max(600_000)
    private final int maxDurationMs;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    /** Consecutive empty reads after which the device counts as lost. */
    @Min(1)
    private final int lostAfterEmptyReads;

    @ConstructorBinding
    public AudioCaptureProperties(@NotNull Integer chunkMillis,
                                  @NotNull Integer maxDurationMs,
                                  String deviceName,
                                  Integer lostAfterEmptyReads) {
        this.chunkMillis = chunkMillis;
        this.maxDurationMs = maxDurationMs;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
        this.lostAfterEmptyReads = lostAfterEmptyReads == null ? 50 : lostAfterEmptyReads;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getMaxDurationMs() { return maxDurationMs; }
    public String getDeviceName() { return deviceName; }
    public int getLostAfterEmptyReads() { return lostAfterEmptyReads; }
}

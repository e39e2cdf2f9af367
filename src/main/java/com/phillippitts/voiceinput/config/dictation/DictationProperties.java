package com.phillippitts.voiceinput.config.dictation;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the state machine and its channels.
 *
 * <p>The transcription deadline should exceed {@code stt.whisper.timeout-seconds} so
 * the worker normally reports its own timeout first; the deadline is the backstop.
 */
@Validated
@ConfigurationProperties(prefix = "dictation")
public class DictationProperties {

    /** Event poll interval; deadlines are checked at least this often. */
    @Min(10)
    @Max(1000)
    private final int tickMillis;

    @Min(100)
    private final long transcriptionDeadlineMs;

    @Min(1000)
    private final long loadDeadlineMs;

    @Min(1)
    private final int commandCapacity;

    @Min(4)
    private final int uiCapacity;

    @Min(0)
    private final int uiOfferTimeoutMs;

    @NotBlank
    private final String defaultLanguage;

    /** Clips shorter than this are discarded instead of transcribed. */
    @Min(0)
    private final int minClipMs;

    /** Replay a start pressed during transcription once the result is in. */
    private final boolean deferStartWhileTranscribing;

    @ConstructorBinding
    public DictationProperties(Integer tickMillis,
                               Long transcriptionDeadlineMs,
                               Long loadDeadlineMs,
                               Integer commandCapacity,
                               Integer uiCapacity,
                               Integer uiOfferTimeoutMs,
                               String defaultLanguage,
                               Integer minClipMs,
                               Boolean deferStartWhileTranscribing) {
        this.tickMillis = tickMillis == null ? 100 : tickMillis;
        this.transcriptionDeadlineMs = transcriptionDeadlineMs == null ? 45_000L : transcriptionDeadlineMs;
        this.loadDeadlineMs = loadDeadlineMs == null ? 900_000L : loadDeadlineMs;
        this.commandCapacity = commandCapacity == null ? 16 : commandCapacity;
        this.uiCapacity = uiCapacity == null ? 64 : uiCapacity;
        this.uiOfferTimeoutMs = uiOfferTimeoutMs == null ? 250 : uiOfferTimeoutMs;
        this.defaultLanguage = (defaultLanguage == null || defaultLanguage.isBlank()) ? "en" : defaultLanguage;
        this.minClipMs = minClipMs == null ? 250 : minClipMs;
        this.deferStartWhileTranscribing = deferStartWhileTranscribing == null || deferStartWhileTranscribing;
    }

    public int getTickMillis() { return tickMillis; }
    public Duration getTranscriptionDeadline() { return Duration.ofMillis(transcriptionDeadlineMs); }
    public Duration getLoadDeadline() { return Duration.ofMillis(loadDeadlineMs); }
    public int getCommandCapacity() { return commandCapacity; }
    public int getUiCapacity() { return uiCapacity; }
    public int getUiOfferTimeoutMs() { return uiOfferTimeoutMs; }
    public String getDefaultLanguage() { return defaultLanguage; }
    public int getMinClipMs() { return minClipMs; }
    public boolean isDeferStartWhileTranscribing() { return deferStartWhileTranscribing; }
}

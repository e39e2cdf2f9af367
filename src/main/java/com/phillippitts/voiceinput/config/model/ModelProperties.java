package com.phillippitts.voiceinput.config.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for model acquisition.
 *
 * <p>Example application.properties:
 * <pre>
 * model.initial-model=small
 * model.models-dir=${user.home}/.local/share/voice-input/models
 * model.base-url=https://huggingface.co/ggerganov/whisper.cpp/resolve/main
 * model.max-attempts=3
 * model.initial-backoff-ms=2000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "model")
public class ModelProperties {

    @NotBlank
    private final String initialModel;

    @NotBlank
    private final String modelsDir;

    @NotBlank
    private final String baseUrl;

    /** Download attempts per artifact before giving up. */
    @Min(1)
    @Max(10)
    private final int maxAttempts;

    /** Backoff before the second attempt; doubled for each further attempt. */
    @Min(1)
    private final long initialBackoffMs;

    @Min(100)
    private final int connectTimeoutMs;

    @Min(1000)
    private final int readTimeoutMs;

    @ConstructorBinding
    public ModelProperties(String initialModel,
                           String modelsDir,
                           String baseUrl,
                           Integer maxAttempts,
                           Long initialBackoffMs,
                           Integer connectTimeoutMs,
                           Integer readTimeoutMs) {
        this.initialModel = (initialModel == null || initialModel.isBlank()) ? "small" : initialModel;
        this.modelsDir = (modelsDir == null || modelsDir.isBlank())
                ? System.getProperty("user.home") + "/.local/share/voice-input/models"
                : modelsDir;
        this.baseUrl = (baseUrl == null || baseUrl.isBlank())
                ? "https://huggingface.co/ggerganov/whisper.cpp/resolve/main"
                : baseUrl;
        this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        this.initialBackoffMs = initialBackoffMs == null ? 2000L : initialBackoffMs;
        this.connectTimeoutMs = connectTimeoutMs == null ? 10_000 : connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs == null ? 300_000 : readTimeoutMs;
    }

    public String getInitialModel() { return initialModel; }
    public String getModelsDir() { return modelsDir; }
    public String getBaseUrl() { return baseUrl; }
    public int getMaxAttempts() { return maxAttempts; }
    public long getInitialBackoffMs() { return initialBackoffMs; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getReadTimeoutMs() { return readTimeoutMs; }
}

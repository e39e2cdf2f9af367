package com.phillippitts.voiceinput.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp command-line engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>The model file is not configured here: it follows from the model family and
 * language of each request (see {@code ModelCatalog}).
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.timeout-seconds=30
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * stt.whisper.output=text
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param timeoutSeconds Maximum time one inference run may take
 * @param threads Number of CPU threads to use for transcription
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 * @param output Output mode, {@code text} or {@code json}
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        @Pattern(regexp = "(?i)text|json", message = "Output must be 'text' or 'json'")
        String output
) {
    public WhisperConfig {
        output = (output == null || output.isBlank()) ? "text" : output.toLowerCase();
    }

    public boolean jsonOutput() {
        return "json".equals(output);
    }
}

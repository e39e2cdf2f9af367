package com.phillippitts.voiceinput.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} with process context.
 *
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * The resulting message reads {@code message (exitCode=.., durationMs=.., key=value, ...)}.
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Null keys or values are skipped. */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String engine = engineName != null ? engineName : "unknown";
        String detailed = detailedMessage();
        return cause != null
                ? new TranscriptionException(detailed, engine, cause)
                : new TranscriptionException(detailed, engine);
    }

    private String detailedMessage() {
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            details.append("exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            appendSeparator(details).append("durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            appendSeparator(details).append(entry.getKey()).append('=').append(entry.getValue());
        }
        return details.length() == 0 ? message : message + " (" + details + ")";
    }

    private static StringBuilder appendSeparator(StringBuilder sb) {
        return sb.length() == 0 ? sb : sb.append(", ");
    }
}

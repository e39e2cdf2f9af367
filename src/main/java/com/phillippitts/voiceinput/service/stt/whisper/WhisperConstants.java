package com.phillippitts.voiceinput.service.stt.whisper;

/** Limits for whisper.cpp subprocess output handling. */
final class WhisperConstants {

    static final String ENGINE = "whisper";

    /** Stderr kept per run for diagnostics. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Stderr characters quoted in error messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private WhisperConstants() {}
}

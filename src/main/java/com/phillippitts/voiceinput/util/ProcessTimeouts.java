package com.phillippitts.voiceinput.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p>Used by the whisper.cpp process manager and by the runtime when it waits for
 * component threads to exit.
 */
public final class ProcessTimeouts {

    /** Stream gobblers flushing buffered output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort gobbler join during cleanup; they are daemon threads anyway. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Graceful shutdown via {@link Process#destroy()}. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Forceful termination via {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long the runtime waits for each component thread after shutdown was requested.
     * The audio worker may be blocked in a device read for up to one chunk.
     */
    public static final Duration COMPONENT_STOP_TIMEOUT = Duration.ofMillis(2000);

    /** Grace period for an abandoned inference thread before it is left to die on its own. */
    public static final Duration INFERENCE_ABANDON_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}

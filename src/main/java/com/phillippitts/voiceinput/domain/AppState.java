package com.phillippitts.voiceinput.domain;

import java.util.Objects;

/**
 * Application state owned by the dictation state machine.
 *
 * <p>Exactly one value is current at any instant. Only {@link Kind#ERROR} carries the
 * {@code recoverable} flag and a message; every other kind is a plain constant.
 */
public record AppState(Kind kind, boolean recoverable, String message) {

    public enum Kind { LOADING_INITIAL_MODEL, READY, RECORDING, TRANSCRIBING, ERROR, SHUTDOWN }

    public static final AppState LOADING_INITIAL_MODEL = new AppState(Kind.LOADING_INITIAL_MODEL, false, "");
    public static final AppState READY = new AppState(Kind.READY, false, "");
    public static final AppState RECORDING = new AppState(Kind.RECORDING, false, "");
    public static final AppState TRANSCRIBING = new AppState(Kind.TRANSCRIBING, false, "");
    public static final AppState SHUTDOWN = new AppState(Kind.SHUTDOWN, false, "");

    public AppState {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
        if (kind != Kind.ERROR && (recoverable || !message.isEmpty())) {
            throw new IllegalArgumentException("only ERROR carries recoverable/message");
        }
    }

    public static AppState error(boolean recoverable, String message) {
        return new AppState(Kind.ERROR, recoverable, message);
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public boolean isRecoverableError() {
        return kind == Kind.ERROR && recoverable;
    }

    public boolean isFatal() {
        return kind == Kind.ERROR && !recoverable;
    }

    @Override
    public String toString() {
        if (kind == Kind.ERROR) {
            return "Error{recoverable=" + recoverable + ", message='" + message + "'}";
        }
        return kind.name();
    }
}

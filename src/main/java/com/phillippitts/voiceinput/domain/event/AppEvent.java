package com.phillippitts.voiceinput.domain.event;

import com.phillippitts.voiceinput.domain.AudioBuffer;

import java.util.Objects;

/**
 * The only input of the dictation state machine.
 *
 * <p>Events are immutable once built. {@link AudioCaptured} is the single exception in
 * spirit: it moves ownership of its buffer to whoever receives it.
 */
public interface AppEvent {

    /** Processed ahead of every queued non-system event. */
    default boolean isSystem() {
        return false;
    }

    // model events

    record ModelLoaded(String name) implements AppEvent {
        public ModelLoaded {
            Objects.requireNonNull(name, "name");
        }
    }

    record ModelLoadingFailed(String name, String reason, boolean retryable) implements AppEvent {
        public ModelLoadingFailed {
            Objects.requireNonNull(name, "name");
            reason = reason == null ? "unknown error" : reason;
        }
    }

    record ModelDownloadProgress(String name, int percent) implements AppEvent {
        public ModelDownloadProgress {
            Objects.requireNonNull(name, "name");
            percent = Math.max(0, Math.min(100, percent));
        }
    }

    // recording events

    record StartRecording() implements AppEvent {}

    record StopRecording() implements AppEvent {}

    record RecordingStoppedByDevice(String reason) implements AppEvent {}

    record RecordingNeverStarted(String reason) implements AppEvent {}

    record AudioCaptured(AudioBuffer buffer) implements AppEvent {
        public AudioCaptured {
            Objects.requireNonNull(buffer, "buffer");
        }
    }

    // transcription events

    record TranscriptionFinished(long requestId, String text) implements AppEvent {
        public TranscriptionFinished {
            text = text == null ? "" : text;
        }
    }

    record TranscriptionFailed(long requestId, String reason) implements AppEvent {
        public TranscriptionFailed {
            reason = reason == null ? "unknown error" : reason;
        }
    }

    // management events

    record ChangeModel(String name) implements AppEvent {
        public ChangeModel {
            Objects.requireNonNull(name, "name");
        }
    }

    record LoadModel(String name, boolean redownload) implements AppEvent {
        public LoadModel {
            Objects.requireNonNull(name, "name");
        }

        public LoadModel(String name) {
            this(name, false);
        }
    }

    record LanguageDetected(String code) implements AppEvent {
        public LanguageDetected {
            Objects.requireNonNull(code, "code");
        }
    }

    record ToggleTranslate() implements AppEvent {}

    /** A worker thread died; nothing short of a restart fixes it. */
    record WorkerFailed(String component, String reason) implements AppEvent {}

    // system event

    record Shutdown() implements AppEvent {
        @Override
        public boolean isSystem() {
            return true;
        }
    }
}

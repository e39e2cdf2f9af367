package com.phillippitts.voiceinput.domain.ui;

import com.phillippitts.voiceinput.domain.AppState;

import java.util.Objects;

/** Output-only notifications for the presentation layer. */
public interface UiUpdate {

    /** Progress updates may be dropped under backpressure; everything else may not. */
    default boolean isDroppable() {
        return false;
    }

    record StateChanged(AppState state) implements UiUpdate {
        public StateChanged {
            Objects.requireNonNull(state, "state");
        }
    }

    record TranscriptionResult(String text) implements UiUpdate {
        public TranscriptionResult {
            Objects.requireNonNull(text, "text");
        }
    }

    record ErrorMessage(String text) implements UiUpdate {
        public ErrorMessage {
            Objects.requireNonNull(text, "text");
        }
    }

    record ProgressUpdate(String model, int percent) implements UiUpdate {
        @Override
        public boolean isDroppable() {
            return true;
        }
    }

    record TranslateModeChanged(boolean enabled) implements UiUpdate {}
}

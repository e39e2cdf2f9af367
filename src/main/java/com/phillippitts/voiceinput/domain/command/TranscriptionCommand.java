package com.phillippitts.voiceinput.domain.command;

import com.phillippitts.voiceinput.domain.AudioBuffer;

import java.util.Objects;

/** Commands accepted by the transcription worker. */
public interface TranscriptionCommand {

    /**
     * Transcribe {@code buffer}; ownership of the buffer moves with the command.
     *
     * @param requestId echoed back in the result so stale answers can be told apart
     */
    record Process(AudioBuffer buffer, String language, String model, boolean translate, long requestId)
            implements TranscriptionCommand {
        public Process {
            Objects.requireNonNull(buffer, "buffer");
            Objects.requireNonNull(language, "language");
            Objects.requireNonNull(model, "model");
        }
    }

    /** Best-effort abandon of the run for {@code requestId}. */
    record Cancel(long requestId) implements TranscriptionCommand {}

    record Shutdown() implements TranscriptionCommand {}
}

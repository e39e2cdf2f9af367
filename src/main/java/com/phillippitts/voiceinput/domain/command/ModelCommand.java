package com.phillippitts.voiceinput.domain.command;

import java.util.Objects;

/** Commands accepted by the model worker. Names are model families ({@code small}, {@code large}). */
public interface ModelCommand {

    /** Ensure the model is present, downloading only what is missing. */
    record Load(String name) implements ModelCommand {
        public Load {
            Objects.requireNonNull(name, "name");
        }
    }

    /** Fetch the model even if it is already present. */
    record Download(String name) implements ModelCommand {
        public Download {
            Objects.requireNonNull(name, "name");
        }
    }

    /** Best-effort abandon of an in-flight or queued load. */
    record Cancel(String name) implements ModelCommand {
        public Cancel {
            Objects.requireNonNull(name, "name");
        }
    }

    record Shutdown() implements ModelCommand {}
}

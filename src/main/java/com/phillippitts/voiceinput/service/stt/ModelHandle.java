package com.phillippitts.voiceinput.service.stt;

import java.nio.file.Path;
import java.util.Objects;

/** A model file an {@link InferenceEngine} has accepted for inference. */
public record ModelHandle(Path modelPath) {

    public ModelHandle {
        Objects.requireNonNull(modelPath, "modelPath");
    }
}

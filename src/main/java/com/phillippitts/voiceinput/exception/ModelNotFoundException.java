package com.phillippitts.voiceinput.exception;

/**
 * Thrown when a model artifact is not present at the path an engine was asked to load.
 */
public class ModelNotFoundException extends VoiceInputException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}

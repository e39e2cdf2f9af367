package com.phillippitts.voiceinput.exception;

/**
 * Thrown when an inference engine fails to turn audio into text.
 * This may occur due to engine errors, timeout, or unreadable output.
 */
public class TranscriptionException extends VoiceInputException {

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}

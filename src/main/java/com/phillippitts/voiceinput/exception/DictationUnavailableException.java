package com.phillippitts.voiceinput.exception;

/**
 * Thrown when a request reaches the dictation pipeline after it has shut down
 * (or before it was started).
 */
public class DictationUnavailableException extends VoiceInputException {

    public DictationUnavailableException(String message) {
        super(message);
    }
}

package com.phillippitts.voiceinput.exception;

/**
 * Base exception for all voice-input application errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class VoiceInputException extends RuntimeException {

    public VoiceInputException(String message) {
        super(message);
    }

    public VoiceInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

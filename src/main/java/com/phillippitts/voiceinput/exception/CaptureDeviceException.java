package com.phillippitts.voiceinput.exception;

/**
 * Thrown when the microphone cannot be opened or stops delivering audio.
 * The reason is a short code suitable for user-facing messages and metrics tags.
 */
public class CaptureDeviceException extends VoiceInputException {

    public static final String MIC_UNAVAILABLE = "MIC_UNAVAILABLE";
    public static final String MIC_PERMISSION_DENIED = "MIC_PERMISSION_DENIED";
    public static final String DEVICE_LOST = "DEVICE_LOST";
    public static final String CAPTURE_ERROR = "CAPTURE_ERROR";

    private final String reason;

    public CaptureDeviceException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public CaptureDeviceException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}

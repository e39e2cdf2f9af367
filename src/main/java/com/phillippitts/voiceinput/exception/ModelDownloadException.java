package com.phillippitts.voiceinput.exception;

/**
 * Thrown when a model artifact cannot be fetched from the remote store.
 * {@code retryable} is true for network-level failures that another attempt may fix.
 */
public class ModelDownloadException extends VoiceInputException {

    private final String artifact;
    private final boolean retryable;

    public ModelDownloadException(String artifact, String message, boolean retryable) {
        super(message);
        this.artifact = artifact;
        this.retryable = retryable;
    }

    public ModelDownloadException(String artifact, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.artifact = artifact;
        this.retryable = retryable;
    }

    public String getArtifact() {
        return artifact;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

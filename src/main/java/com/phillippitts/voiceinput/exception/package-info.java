/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voiceinput.exception.VoiceInputException} - base for all
 *       application errors</li>
 *   <li>{@link com.phillippitts.voiceinput.exception.TranscriptionException} - inference engine
 *       failed (crash, timeout, unreadable output); built with
 *       {@link com.phillippitts.voiceinput.exception.TranscriptionExceptionBuilder}</li>
 *   <li>{@link com.phillippitts.voiceinput.exception.ModelNotFoundException} - model artifact
 *       missing at load time</li>
 *   <li>{@link com.phillippitts.voiceinput.exception.ModelDownloadException} - remote fetch
 *       failed, flagged retryable or not</li>
 *   <li>{@link com.phillippitts.voiceinput.exception.CaptureDeviceException} - microphone
 *       unavailable, denied or lost</li>
 * </ul>
 *
 * <p>Workers never let these cross a thread boundary: each one is caught where it happens
 * and turned into a failure event for the state machine. Only the REST control surface maps
 * them to HTTP responses, via {@code GlobalExceptionHandler}.
 */
package com.phillippitts.voiceinput.exception;

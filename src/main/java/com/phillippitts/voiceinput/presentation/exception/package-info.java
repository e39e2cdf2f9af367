/**
 * Global exception handling for the control surface.
 *
 * <p>Exception mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voiceinput.exception.DictationUnavailableException} → 409 Conflict</li>
 *   <li>{@code IllegalArgumentException}, bean validation failures, unreadable bodies → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response format:
 * <pre>
 * {
 *   "errorCode": "IllegalArgumentException",
 *   "message": "Invalid request",
 *   "details": "Unknown model 'huge'",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.voiceinput.presentation.exception;

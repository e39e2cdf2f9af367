/**
 * Immutable vocabulary of the dictation core: application state, the owned audio buffer,
 * model descriptors, and the event, command and UI-update messages exchanged between
 * components.
 *
 * <p>Messages are the only thing that crosses a thread boundary. Every type here is
 * either immutable or, like {@link com.phillippitts.voiceinput.domain.AudioBuffer},
 * single-owner by contract.
 */
package com.phillippitts.voiceinput.domain;

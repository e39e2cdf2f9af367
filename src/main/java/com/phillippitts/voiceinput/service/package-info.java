/**
 * The dictation pipeline.
 *
 * <p>Six long-lived components, each on its own named thread, talking only through
 * channels ({@code service.channel}):
 * <ul>
 *   <li>{@code service.hotkey} - event router: global key hook to gesture events</li>
 *   <li>{@code service.statemachine} - the single owner of application state</li>
 *   <li>{@code service.audio.capture} - audio worker: microphone capture</li>
 *   <li>{@code service.model} - model worker: download and load of model artifacts</li>
 *   <li>{@code service.stt} - transcription worker and the whisper.cpp engine</li>
 *   <li>{@code service.ui} - UI update sink and presentation</li>
 * </ul>
 *
 * <p>{@code service.lifecycle} starts and stops them with the Spring context.
 */
package com.phillippitts.voiceinput.service;

package com.phillippitts.voiceinput.service.stt;

import java.nio.file.Path;

/**
 * Speech-to-text backend used by the transcription worker.
 *
 * <p>{@link #run} may be interrupted; implementations must release external resources
 * (processes, temp files) when that happens.
 */
public interface InferenceEngine {

    /** Short engine name used in logs and metrics tags. */
    String name();

    /**
     * @throws com.phillippitts.voiceinput.exception.ModelNotFoundException if the file is missing
     */
    ModelHandle load(Path modelPath);

    /**
     * Transcribes 16 kHz mono PCM16LE audio.
     *
     * @param translate translate the speech to English instead of transcribing it verbatim
     * @return recognized text, empty when nothing was recognized
     * @throws com.phillippitts.voiceinput.exception.TranscriptionException on engine failure
     */
    String run(ModelHandle handle, byte[] pcm16kMono, String language, boolean translate);
}

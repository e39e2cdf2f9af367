package com.phillippitts.voiceinput.testutil;

import com.phillippitts.voiceinput.service.stt.InferenceEngine;
import com.phillippitts.voiceinput.service.stt.ModelHandle;

import java.nio.file.Path;

/** Engine answering every run with {@link #cannedText}. */
public class FakeInferenceEngine implements InferenceEngine {

    public volatile String cannedText;

    public FakeInferenceEngine(String cannedText) {
        this.cannedText = cannedText;
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public ModelHandle load(Path modelPath) {
        return new ModelHandle(modelPath);
    }

    @Override
    public String run(ModelHandle handle, byte[] pcm16kMono, String language, boolean translate) {
        return translate ? "[en] " + cannedText : cannedText;
    }
}

package com.phillippitts.voiceinput.service.stt.whisper;

import com.phillippitts.voiceinput.config.stt.WhisperConfig;
import com.phillippitts.voiceinput.exception.ModelNotFoundException;
import com.phillippitts.voiceinput.exception.TranscriptionException;
import com.phillippitts.voiceinput.service.audio.WavWriter;
import com.phillippitts.voiceinput.service.stt.InferenceEngine;
import com.phillippitts.voiceinput.service.stt.ModelHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link InferenceEngine} running the external whisper.cpp binary.
 *
 * <p>Each run writes the audio to a temporary WAV file, invokes the CLI through
 * {@link WhisperProcessManager} and parses stdout as plain text or JSON
 * ({@code stt.whisper.output}). The temp file is removed whatever the outcome.
 *
 * <p>Privacy: text never reaches INFO logs, only its length.
 */
public class WhisperCliInferenceEngine implements InferenceEngine, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperCliInferenceEngine.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;

    public WhisperCliInferenceEngine(WhisperConfig cfg) {
        this(cfg, new WhisperProcessManager());
    }

    WhisperCliInferenceEngine(WhisperConfig cfg, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        LOG.info("Whisper engine configured: bin={}, timeout={}s, threads={}, output={}",
                cfg.binaryPath(), cfg.timeoutSeconds(), cfg.threads(), cfg.output());
    }

    @Override
    public String name() {
        return WhisperConstants.ENGINE;
    }

    @Override
    public ModelHandle load(Path modelPath) {
        if (!Files.isRegularFile(modelPath)) {
            throw new ModelNotFoundException(modelPath.toString());
        }
        return new ModelHandle(modelPath);
    }

    @Override
    public String run(ModelHandle handle, byte[] pcm16kMono, String language, boolean translate) {
        Objects.requireNonNull(handle, "handle");
        if (pcm16kMono == null || pcm16kMono.length == 0) {
            return "";
        }
        if (!Files.isRegularFile(handle.modelPath())) {
            throw new ModelNotFoundException(handle.modelPath().toString());
        }
        Path wav = null;
        try {
            wav = Files.createTempFile("voice-input-", ".wav");
            WavWriter.writePcm16LeMono16kHz(pcm16kMono, wav);
            String stdout = manager.transcribe(wav, handle.modelPath(), language, translate, cfg);
            return extractText(stdout);
        } catch (IOException | IllegalStateException e) {
            throw new TranscriptionException("Cannot prepare audio for whisper: " + e.getMessage(),
                    WhisperConstants.ENGINE, e);
        } finally {
            deleteQuietly(wav);
        }
    }

    String extractText(String stdout) {
        if (cfg.jsonOutput()) {
            return WhisperJsonParser.extractText(stdout);
        }
        if (stdout == null) {
            return "";
        }
        return stdout.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", wav, e.getMessage());
        }
    }

    /** Kills any whisper process still running; Spring calls this on context shutdown. */
    @Override
    public void close() {
        manager.close();
    }
}

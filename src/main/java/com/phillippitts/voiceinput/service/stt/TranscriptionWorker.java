package com.phillippitts.voiceinput.service.stt;

import com.phillippitts.voiceinput.domain.command.TranscriptionCommand;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.exception.ModelNotFoundException;
import com.phillippitts.voiceinput.exception.TranscriptionException;
import com.phillippitts.voiceinput.service.audio.AudioConverter;
import com.phillippitts.voiceinput.service.audio.AudioFormat;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.metrics.DictationMetrics;
import com.phillippitts.voiceinput.service.model.ModelCatalog;
import com.phillippitts.voiceinput.service.worker.AbstractWorker;
import com.phillippitts.voiceinput.util.LogSanitizer;
import com.phillippitts.voiceinput.util.ProcessTimeouts;
import com.phillippitts.voiceinput.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns an owned audio buffer into text.
 *
 * <p>Each {@code Process} consumes its buffer whatever the outcome and answers with exactly
 * one {@code TranscriptionFinished} or {@code TranscriptionFailed} carrying the request id,
 * unless the request is cancelled. Inference runs on a private helper thread so the worker
 * can keep reading its channel: a run exceeding the timeout, a matching {@code Cancel} or a
 * {@code Shutdown} interrupts the helper, which kills the engine's process, and the helper
 * is replaced. Commands for other requests that arrive meanwhile are served afterwards.
 */
public class TranscriptionWorker extends AbstractWorker<TranscriptionCommand> {

    private static final Logger LOG = LogManager.getLogger(TranscriptionWorker.class);

    public static final String COMPONENT = "transcription-worker";
    private static final long POLL_SLICE_MS = 50;
    private static final int REASON_MAX_CHARS = 200;

    private final InferenceEngine engine;
    private final Path modelsDir;
    private final Duration timeout;
    private final DictationMetrics metrics;

    // Confined to the worker thread
    private final Deque<TranscriptionCommand> pending = new ArrayDeque<>();
    private final Map<Path, ModelHandle> handles = new HashMap<>();
    private ExecutorService inference = newInferenceExecutor();

    public TranscriptionWorker(CommandChannel<TranscriptionCommand> commands,
                               EventChannel events,
                               InferenceEngine engine,
                               Path modelsDir,
                               Duration timeout,
                               DictationMetrics metrics) {
        super(COMPONENT, commands, events);
        this.engine = Objects.requireNonNull(engine, "engine");
        this.modelsDir = Objects.requireNonNull(modelsDir, "modelsDir");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    protected TranscriptionCommand nextCommand() throws InterruptedException {
        TranscriptionCommand queued = pending.poll();
        return queued != null ? queued : commands().take();
    }

    @Override
    protected boolean handle(TranscriptionCommand command) throws InterruptedException {
        if (command instanceof TranscriptionCommand.Process process) {
            return process(process);
        }
        if (command instanceof TranscriptionCommand.Cancel cancel) {
            LOG.debug("Cancel for request {} with nothing running", cancel.requestId());
            return true;
        }
        if (command instanceof TranscriptionCommand.Shutdown) {
            LOG.info("Shutdown received");
            return false;
        }
        LOG.warn("Unknown command {}", command);
        return true;
    }

    /** @return false when a shutdown arrived during the run */
    private boolean process(TranscriptionCommand.Process p) throws InterruptedException {
        long start = System.nanoTime();
        byte[] pcm;
        try {
            pcm = AudioConverter.toMono16k(p.buffer());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.warn("Request {} rejected: {}", p.requestId(), e.getMessage());
            fail(p, "corrupt audio buffer", "corrupt");
            return true;
        }

        ModelHandle handle;
        try {
            handle = handleFor(p.model(), p.language());
        } catch (ModelNotFoundException e) {
            LOG.warn("Request {}: {}", p.requestId(), e.getMessage());
            fail(p, "model not available: " + e.getModelPath(), "model");
            return true;
        }

        LOG.info("Request {}: transcribing {} ms (language={}, translate={})", p.requestId(),
                pcm.length * 1000L / AudioFormat.REQUIRED_BYTE_RATE,
                p.language(), p.translate());
        Future<String> run = inference.submit(() -> engine.run(handle, pcm, p.language(), p.translate()));
        long deadline = start + timeout.toNanos();
        while (true) {
            try {
                String text = run.get(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
                succeed(p, text == null ? "" : text.trim(), start);
                return true;
            } catch (ExecutionException e) {
                onEngineFailure(p, e.getCause());
                return true;
            } catch (TimeoutException e) {
                if (System.nanoTime() - deadline >= 0) {
                    LOG.warn("Request {} exceeded {}ms; abandoning", p.requestId(), timeout.toMillis());
                    abandon(run);
                    fail(p, "timeout", "timeout");
                    return true;
                }
                Boolean verdict = checkInbox(p, run);
                if (verdict != null) {
                    return verdict;
                }
            }
        }
    }

    /** @return null to keep waiting, otherwise the value for {@link #handle} */
    private Boolean checkInbox(TranscriptionCommand.Process p, Future<String> run) {
        TranscriptionCommand command;
        while ((command = commands().poll()) != null) {
            if (command instanceof TranscriptionCommand.Cancel cancel) {
                if (cancel.requestId() == p.requestId()) {
                    LOG.info("Request {} cancelled", p.requestId());
                    abandon(run);
                    metrics.incrementTranscriptionFailure(engine.name(), "cancelled");
                    return true;
                }
                dropQueued(cancel.requestId());
            } else if (command instanceof TranscriptionCommand.Shutdown) {
                LOG.info("Shutdown during request {}; abandoning", p.requestId());
                abandon(run);
                return false;
            } else {
                pending.add(command);
            }
        }
        return null;
    }

    private ModelHandle handleFor(String model, String language) {
        Path path = modelsDir.resolve(ModelCatalog.artifactFor(ModelCatalog.normalize(model), language));
        ModelHandle cached = handles.get(path);
        if (cached != null) {
            return cached;
        }
        ModelHandle loaded = engine.load(path);
        handles.put(path, loaded);
        return loaded;
    }

    private void succeed(TranscriptionCommand.Process p, String text, long start) {
        long elapsed = System.nanoTime() - start;
        metrics.recordTranscriptionLatency(engine.name(), elapsed);
        metrics.incrementTranscriptionSuccess(engine.name());
        LOG.info("Request {} transcribed in {} ms (chars={})", p.requestId(), TimeUtils.nanosToMillis(elapsed),
                LogSanitizer.length(text));
        LOG.debug("Request {} preview: '{}'", p.requestId(), LogSanitizer.truncate(text, 40));
        emit(new AppEvent.TranscriptionFinished(p.requestId(), text));
    }

    private void onEngineFailure(TranscriptionCommand.Process p, Throwable cause) {
        if (cause instanceof ModelNotFoundException missing) {
            handles.values().removeIf(h -> h.modelPath().toString().equals(missing.getModelPath()));
            fail(p, "model not available: " + missing.getModelPath(), "model");
        } else if (cause instanceof TranscriptionException te) {
            LOG.warn("Request {} failed in engine '{}': {}", p.requestId(), te.getEngineName(), te.getMessage());
            fail(p, "transcription failed: " + LogSanitizer.truncate(te.getMessage(), REASON_MAX_CHARS), "engine");
        } else {
            LOG.error("Request {} failed unexpectedly", p.requestId(), cause);
            fail(p, "transcription failed: " + cause, "error");
        }
    }

    private void fail(TranscriptionCommand.Process p, String reason, String tag) {
        p.buffer().discard();
        metrics.incrementTranscriptionFailure(engine.name(), tag);
        emit(new AppEvent.TranscriptionFailed(p.requestId(), reason));
    }

    private void dropQueued(long requestId) {
        Iterator<TranscriptionCommand> it = pending.iterator();
        while (it.hasNext()) {
            if (it.next() instanceof TranscriptionCommand.Process q && q.requestId() == requestId) {
                q.buffer().discard();
                it.remove();
                LOG.info("Dropped queued request {}", requestId);
            }
        }
    }

    private void abandon(Future<String> run) {
        run.cancel(true);
        inference.shutdownNow();
        try {
            if (!inference.awaitTermination(ProcessTimeouts.INFERENCE_ABANDON_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Inference thread still busy after abandon; replacing it");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        inference = newInferenceExecutor();
    }

    private static ExecutorService newInferenceExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "transcription-inference");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    protected void onExit() {
        inference.shutdownNow();
        pending.forEach(command -> {
            if (command instanceof TranscriptionCommand.Process q) {
                q.buffer().discard();
            }
        });
        pending.clear();
    }
}

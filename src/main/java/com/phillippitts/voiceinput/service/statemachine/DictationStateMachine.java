package com.phillippitts.voiceinput.service.statemachine;

import com.phillippitts.voiceinput.config.dictation.DictationProperties;
import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.AppState.Kind;
import com.phillippitts.voiceinput.domain.AudioBuffer;
import com.phillippitts.voiceinput.domain.command.AudioCommand;
import com.phillippitts.voiceinput.domain.command.ModelCommand;
import com.phillippitts.voiceinput.domain.command.TranscriptionCommand;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.channel.UiUpdateChannel;
import com.phillippitts.voiceinput.service.metrics.DictationMetrics;
import com.phillippitts.voiceinput.service.model.ModelCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Single-writer orchestrator of the dictation pipeline and sole owner of {@link AppState}.
 *
 * <p>{@link #submit(AppEvent)} only enqueues. A dedicated thread takes events one at a time
 * from the {@link EventChannel}, decides the transition, sends commands to the audio, model
 * and transcription workers and emits {@link UiUpdate}s. Every field below the channels is
 * confined to that thread; nothing here is locked or shared.
 *
 * <p>Long-running commands ({@code Load}, {@code Process}) carry a deadline checked on every
 * tick. When one expires the machine synthesizes the failure the worker would have reported
 * and sends the worker a best-effort cancel. Answers that arrive afterwards no longer match
 * the model name or request id being waited for and are dropped.
 *
 * <p>Unmatched (state, event) pairs are logged and dropped; handling never throws out of
 * the loop. Audio buffers carried by dropped events are discarded so none outlives its owner.
 */
public class DictationStateMachine {

    private static final Logger LOG = LogManager.getLogger(DictationStateMachine.class);

    public static final String COMPONENT = "state-machine";
    private static final long NO_REQUEST = 0L;

    private final EventChannel events;
    private final CommandChannel<AudioCommand> audio;
    private final CommandChannel<TranscriptionCommand> transcription;
    private final CommandChannel<ModelCommand> model;
    private final UiUpdateChannel ui;
    private final DictationProperties props;
    private final String initialModel;
    private final DictationMetrics metrics;
    private final Clock clock;

    // Confined to the state machine thread
    private AppState state = AppState.LOADING_INITIAL_MODEL;
    private String activeModel;
    private String loadingModel;
    private Instant loadDeadline;
    private int lastProgress = -1;
    private String language;
    private boolean translate;
    private long lastRequestId;
    private long outstandingRequest = NO_REQUEST;
    private Instant transcriptionDeadline;
    private boolean deferredStart;

    private volatile Thread thread;

    public DictationStateMachine(EventChannel events,
                                 CommandChannel<AudioCommand> audio,
                                 CommandChannel<TranscriptionCommand> transcription,
                                 CommandChannel<ModelCommand> model,
                                 UiUpdateChannel ui,
                                 DictationProperties props,
                                 String initialModel,
                                 DictationMetrics metrics,
                                 Clock clock) {
        this.events = Objects.requireNonNull(events);
        this.audio = Objects.requireNonNull(audio);
        this.transcription = Objects.requireNonNull(transcription);
        this.model = Objects.requireNonNull(model);
        this.ui = Objects.requireNonNull(ui);
        this.props = Objects.requireNonNull(props);
        this.initialModel = ModelCatalog.normalize(initialModel);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Enqueues an event; never blocks beyond the enqueue. Safe from any thread. */
    public void submit(AppEvent event) {
        events.send(event);
    }

    /** Starts the state machine thread. Idempotent. */
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        Thread t = new Thread(this::runLoop, COMPONENT);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    public boolean awaitTermination(Duration timeout) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    public boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    private void runLoop() {
        ThreadContext.put("component", COMPONENT);
        try {
            bootstrap();
            while (!state.is(Kind.SHUTDOWN)) {
                AppEvent event = events.poll(props.getTickMillis(), TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
                checkDeadlines();
            }
            discardRemaining();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("State machine interrupted; shutting down workers");
            onShutdown();
        } finally {
            ThreadContext.clearAll();
        }
    }

    /** Announces the initial state and requests the initial model. */
    void bootstrap() {
        ui.send(new UiUpdate.StateChanged(state));
        requestLoad(initialModel, false);
    }

    void dispatch(AppEvent event) {
        try {
            handle(event);
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {} in {}", event, state, e);
            release(event);
        }
    }

    // Package-private for tests: drive transitions without the thread
    void handle(AppEvent event) {
        if (event instanceof AppEvent.Shutdown) {
            onShutdown();
            return;
        }
        if (state.is(Kind.SHUTDOWN)) {
            LOG.debug("Ignoring {} after shutdown", event);
            release(event);
            return;
        }
        if (state.isFatal()) {
            LOG.warn("Ignoring {} in {}", event, state);
            release(event);
            return;
        }
        if (event instanceof AppEvent.WorkerFailed failed) {
            onWorkerFailed(failed);
            return;
        }
        if (event instanceof AppEvent.LanguageDetected detected) {
            language = detected.code();
            LOG.debug("Language set to '{}'", language);
            return;
        }
        if (event instanceof AppEvent.ToggleTranslate) {
            translate = !translate;
            LOG.info("Translate mode {}", translate ? "enabled" : "disabled");
            ui.send(new UiUpdate.TranslateModeChanged(translate));
            return;
        }
        switch (state.kind()) {
            case LOADING_INITIAL_MODEL -> onLoading(event);
            case READY -> onReady(event);
            case RECORDING -> onRecording(event);
            case TRANSCRIBING -> onTranscribing(event);
            case ERROR -> onRecoverableError(event);
            default -> unmatched(event);
        }
    }

    private void onLoading(AppEvent event) {
        if (event instanceof AppEvent.ModelLoaded loaded) {
            if (!loaded.name().equals(loadingModel)) {
                stale(event);
                return;
            }
            activeModel = loaded.name();
            clearLoad();
            LOG.info("Model '{}' ready", activeModel);
            transition(AppState.READY);
        } else if (event instanceof AppEvent.ModelLoadingFailed failed) {
            if (!failed.name().equals(loadingModel)) {
                stale(event);
                return;
            }
            clearLoad();
            String message = "Model '" + failed.name() + "' failed to load: " + failed.reason()
                    + (failed.retryable() ? " (retry may succeed)" : "");
            fail(message);
        } else if (event instanceof AppEvent.ModelDownloadProgress progress) {
            if (progress.name().equals(loadingModel) && progress.percent() != lastProgress) {
                lastProgress = progress.percent();
                ui.send(new UiUpdate.ProgressUpdate(progress.name(), progress.percent()));
            }
        } else if (event instanceof AppEvent.ChangeModel change) {
            changeModel(change.name());
        } else {
            unmatched(event);
        }
    }

    private void onReady(AppEvent event) {
        if (event instanceof AppEvent.StartRecording) {
            startRecording();
        } else if (event instanceof AppEvent.StopRecording) {
            LOG.info("Stray stop in {}; ignoring", state);
        } else if (event instanceof AppEvent.ChangeModel change) {
            changeModel(change.name());
        } else {
            unmatched(event);
        }
    }

    private void onRecording(AppEvent event) {
        if (event instanceof AppEvent.StopRecording) {
            if (!audio.send(new AudioCommand.Stop())) {
                fail("Microphone worker is not accepting commands");
                return;
            }
            transition(AppState.TRANSCRIBING);
            transcriptionDeadline = clock.instant().plus(props.getTranscriptionDeadline());
        } else if (event instanceof AppEvent.StartRecording) {
            LOG.info("Duplicate start while recording; ignoring");
        } else if (event instanceof AppEvent.RecordingStoppedByDevice lost) {
            transition(AppState.READY);
            ui.send(new UiUpdate.ErrorMessage("Recording stopped: " + lost.reason()));
        } else if (event instanceof AppEvent.RecordingNeverStarted never) {
            transition(AppState.READY);
            ui.send(new UiUpdate.ErrorMessage("Recording could not start: " + never.reason()));
        } else if (event instanceof AppEvent.AudioCaptured captured) {
            LOG.info("Capture limit reached; transcribing what was recorded");
            transition(AppState.TRANSCRIBING);
            dispatchProcess(captured.buffer());
        } else {
            unmatched(event);
        }
    }

    private void onTranscribing(AppEvent event) {
        if (event instanceof AppEvent.AudioCaptured captured) {
            if (outstandingRequest != NO_REQUEST) {
                LOG.warn("Second buffer while request {} is outstanding; discarding", outstandingRequest);
                captured.buffer().discard();
                return;
            }
            dispatchProcess(captured.buffer());
        } else if (event instanceof AppEvent.TranscriptionFinished finished) {
            if (!answersOutstanding(finished.requestId())) {
                stale(event);
                return;
            }
            clearTranscription();
            if (finished.text().isBlank()) {
                LOG.info("No speech recognized for request {}", finished.requestId());
                transition(AppState.READY);
            } else {
                transition(AppState.READY);
                ui.send(new UiUpdate.TranscriptionResult(finished.text()));
            }
            replayDeferredStart();
        } else if (event instanceof AppEvent.TranscriptionFailed failed) {
            if (!answersOutstanding(failed.requestId())) {
                stale(event);
                return;
            }
            clearTranscription();
            dropDeferredStart("transcription failed");
            fail(failed.reason());
        } else if (event instanceof AppEvent.StartRecording) {
            deferStart();
        } else if (event instanceof AppEvent.StopRecording) {
            if (deferredStart) {
                deferredStart = false;
                LOG.info("Deferred start cancelled; gesture ended before transcription finished");
            } else {
                LOG.debug("Stop while transcribing; ignoring");
            }
        } else if (event instanceof AppEvent.RecordingStoppedByDevice lost) {
            audioLostBeforeHandover(event, "Recording stopped: " + lost.reason());
        } else if (event instanceof AppEvent.RecordingNeverStarted never) {
            audioLostBeforeHandover(event, "Recording could not start: " + never.reason());
        } else {
            unmatched(event);
        }
    }

    private void onRecoverableError(AppEvent event) {
        if (event instanceof AppEvent.LoadModel load) {
            String name = ModelCatalog.normalize(load.name());
            if (!ModelCatalog.isKnown(name)) {
                ui.send(new UiUpdate.ErrorMessage("Unknown model '" + load.name() + "'"));
                return;
            }
            requestLoad(name, load.redownload());
        } else if (event instanceof AppEvent.ChangeModel change) {
            changeModel(change.name());
        } else if (event instanceof AppEvent.StartRecording) {
            ui.send(new UiUpdate.ErrorMessage("not ready"));
        } else if (event instanceof AppEvent.StopRecording) {
            LOG.debug("Stop in {}; ignoring", state);
        } else {
            unmatched(event);
        }
    }

    private void onWorkerFailed(AppEvent.WorkerFailed failed) {
        clearLoad();
        clearTranscription();
        deferredStart = false;
        String message = "Internal failure in " + failed.component() + " (" + failed.reason()
                + "); restart required";
        transition(AppState.error(false, message));
        ui.send(new UiUpdate.ErrorMessage(message));
    }

    private void onShutdown() {
        if (state.is(Kind.SHUTDOWN)) {
            LOG.debug("Shutdown already processed; ignoring duplicate");
            return;
        }
        LOG.info("Shutting down from {}", state);
        audio.sendUrgent(new AudioCommand.Shutdown());
        transcription.sendUrgent(new TranscriptionCommand.Shutdown());
        model.sendUrgent(new ModelCommand.Shutdown());
        clearLoad();
        clearTranscription();
        deferredStart = false;
        transition(AppState.SHUTDOWN);
    }

    // Package-private for tests: evaluate deadlines against the injected clock
    void checkDeadlines() {
        Instant now = clock.instant();
        if (loadDeadline != null && !now.isBefore(loadDeadline) && state.is(Kind.LOADING_INITIAL_MODEL)) {
            String name = loadingModel;
            LOG.warn("Model '{}' not loaded within {}ms; abandoning", name, props.getLoadDeadline().toMillis());
            model.send(new ModelCommand.Cancel(name));
            handle(new AppEvent.ModelLoadingFailed(name, "timeout", true));
        }
        if (transcriptionDeadline != null && !now.isBefore(transcriptionDeadline) && state.is(Kind.TRANSCRIBING)) {
            if (outstandingRequest != NO_REQUEST) {
                long id = outstandingRequest;
                LOG.warn("Request {} not answered within {}ms; abandoning", id,
                        props.getTranscriptionDeadline().toMillis());
                transcription.send(new TranscriptionCommand.Cancel(id));
                handle(new AppEvent.TranscriptionFailed(id, "timeout"));
            } else {
                LOG.warn("No audio handed over within {}ms of stop", props.getTranscriptionDeadline().toMillis());
                handle(new AppEvent.RecordingStoppedByDevice("no audio received"));
            }
        }
    }

    private void startRecording() {
        if (!audio.send(new AudioCommand.Start())) {
            ui.send(new UiUpdate.ErrorMessage("Microphone is busy; try again"));
            return;
        }
        transition(AppState.RECORDING);
    }

    private void changeModel(String requested) {
        String name = ModelCatalog.normalize(requested);
        if (!ModelCatalog.isKnown(name)) {
            ui.send(new UiUpdate.ErrorMessage("Unknown model '" + requested + "'"));
            return;
        }
        if (name.equals(loadingModel)) {
            LOG.info("Model '{}' already loading", name);
            return;
        }
        if (loadingModel != null) {
            model.send(new ModelCommand.Cancel(loadingModel));
        }
        requestLoad(name, false);
    }

    private void requestLoad(String name, boolean redownload) {
        ModelCommand command = redownload ? new ModelCommand.Download(name) : new ModelCommand.Load(name);
        if (!model.send(command)) {
            clearLoad();
            fail("Model worker is not accepting requests");
            return;
        }
        loadingModel = name;
        lastProgress = -1;
        loadDeadline = clock.instant().plus(props.getLoadDeadline());
        transition(AppState.LOADING_INITIAL_MODEL);
    }

    private void dispatchProcess(AudioBuffer buffer) {
        if (buffer.isEmpty() || buffer.durationMillis() < props.getMinClipMs()) {
            LOG.info("Discarding {}ms clip (minimum {}ms)", buffer.durationMillis(), props.getMinClipMs());
            buffer.discard();
            clearTranscription();
            transition(AppState.READY);
            replayDeferredStart();
            return;
        }
        long requestId = ++lastRequestId;
        String lang = language != null ? language : props.getDefaultLanguage();
        String modelName = activeModel != null ? activeModel : initialModel;
        TranscriptionCommand.Process command =
                new TranscriptionCommand.Process(buffer, lang, modelName, translate, requestId);
        if (!transcription.send(command)) {
            buffer.discard();
            clearTranscription();
            dropDeferredStart("transcription worker busy");
            fail("Transcription worker is not accepting requests");
            return;
        }
        LOG.info("Request {} sent: {}ms of audio, language={}, model={}, translate={}",
                requestId, buffer.durationMillis(), lang, modelName, translate);
        outstandingRequest = requestId;
        transcriptionDeadline = clock.instant().plus(props.getTranscriptionDeadline());
    }

    private boolean answersOutstanding(long requestId) {
        return outstandingRequest != NO_REQUEST && requestId == outstandingRequest;
    }

    private void audioLostBeforeHandover(AppEvent event, String message) {
        if (outstandingRequest != NO_REQUEST) {
            stale(event);
            return;
        }
        clearTranscription();
        dropDeferredStart("no audio captured");
        transition(AppState.READY);
        ui.send(new UiUpdate.ErrorMessage(message));
    }

    private void deferStart() {
        if (!props.isDeferStartWhileTranscribing()) {
            LOG.info("Start while transcribing dropped");
            return;
        }
        if (deferredStart) {
            LOG.debug("Start already deferred; ignoring duplicate");
            return;
        }
        deferredStart = true;
        LOG.info("Start deferred until transcription completes");
    }

    private void replayDeferredStart() {
        if (deferredStart && state.is(Kind.READY)) {
            deferredStart = false;
            LOG.info("Replaying deferred start");
            startRecording();
        }
    }

    private void dropDeferredStart(String why) {
        if (deferredStart) {
            deferredStart = false;
            LOG.info("Deferred start discarded: {}", why);
        }
    }

    private void fail(String message) {
        transition(AppState.error(true, message));
        ui.send(new UiUpdate.ErrorMessage(message));
    }

    private void transition(AppState next) {
        if (next.equals(state)) {
            return;
        }
        AppState previous = state;
        state = next;
        metrics.recordTransition(next.kind());
        LOG.info("{} -> {}", previous, next);
        ui.send(new UiUpdate.StateChanged(next));
    }

    private void clearLoad() {
        loadingModel = null;
        loadDeadline = null;
        lastProgress = -1;
    }

    private void clearTranscription() {
        outstandingRequest = NO_REQUEST;
        transcriptionDeadline = null;
    }

    private void stale(AppEvent event) {
        LOG.info("Ignoring stale {} in {}", event, state);
        release(event);
    }

    private void unmatched(AppEvent event) {
        LOG.info("Ignoring {} in {}", event, state);
        release(event);
    }

    private static void release(AppEvent event) {
        if (event instanceof AppEvent.AudioCaptured captured) {
            captured.buffer().discard();
        }
    }

    private void discardRemaining() {
        List<AppEvent> remaining = events.drain();
        remaining.forEach(DictationStateMachine::release);
        if (!remaining.isEmpty()) {
            LOG.info("Discarded {} event(s) queued behind shutdown", remaining.size());
        }
    }

    // Package-private for tests (same thread as handle)
    AppState state() {
        return state;
    }

    boolean translateEnabled() {
        return translate;
    }

    boolean hasDeferredStart() {
        return deferredStart;
    }

    long outstandingRequest() {
        return outstandingRequest;
    }
}

package com.phillippitts.voiceinput.service.lifecycle;

import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.exception.DictationUnavailableException;
import com.phillippitts.voiceinput.service.audio.capture.AudioWorker;
import com.phillippitts.voiceinput.service.hotkey.HotkeyEventRouter;
import com.phillippitts.voiceinput.service.model.ModelWorker;
import com.phillippitts.voiceinput.service.statemachine.DictationStateMachine;
import com.phillippitts.voiceinput.service.stt.TranscriptionWorker;
import com.phillippitts.voiceinput.service.ui.UiUpdateSink;
import com.phillippitts.voiceinput.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Starts and stops the component threads together with the Spring context.
 *
 * <p>Consumers start before their producers: workers, then the UI sink, then the state
 * machine (which immediately sends the initial model load), and the key router last.
 * On stop the runtime submits {@link AppEvent.Shutdown}; the state machine forwards one
 * Shutdown command to each worker, so the runtime only waits for the threads to exit.
 */
public class DictationRuntime implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DictationRuntime.class);

    private final AudioWorker audioWorker;
    private final ModelWorker modelWorker;
    private final TranscriptionWorker transcriptionWorker;
    private final UiUpdateSink uiSink;
    private final DictationStateMachine stateMachine;
    private final HotkeyEventRouter router;
    private final Duration stopTimeout;

    private volatile boolean running;

    public DictationRuntime(AudioWorker audioWorker,
                            ModelWorker modelWorker,
                            TranscriptionWorker transcriptionWorker,
                            UiUpdateSink uiSink,
                            DictationStateMachine stateMachine,
                            HotkeyEventRouter router) {
        this(audioWorker, modelWorker, transcriptionWorker, uiSink, stateMachine, router,
                ProcessTimeouts.COMPONENT_STOP_TIMEOUT);
    }

    DictationRuntime(AudioWorker audioWorker,
                     ModelWorker modelWorker,
                     TranscriptionWorker transcriptionWorker,
                     UiUpdateSink uiSink,
                     DictationStateMachine stateMachine,
                     HotkeyEventRouter router,
                     Duration stopTimeout) {
        this.audioWorker = Objects.requireNonNull(audioWorker, "audioWorker");
        this.modelWorker = Objects.requireNonNull(modelWorker, "modelWorker");
        this.transcriptionWorker = Objects.requireNonNull(transcriptionWorker, "transcriptionWorker");
        this.uiSink = Objects.requireNonNull(uiSink, "uiSink");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.router = Objects.requireNonNull(router, "router");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        audioWorker.start();
        modelWorker.start();
        transcriptionWorker.start();
        uiSink.start();
        stateMachine.start();
        router.start();
        running = true;
        LOG.info("Dictation pipeline started (hook registered={})", router.isHookRegistered());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        LOG.info("Stopping dictation pipeline");
        router.stop(stopTimeout);
        stateMachine.submit(new AppEvent.Shutdown());
        awaitComponent("state-machine", stateMachine.awaitTermination(stopTimeout));
        awaitComponent(audioWorker.component(), audioWorker.awaitTermination(stopTimeout));
        awaitComponent(modelWorker.component(), modelWorker.awaitTermination(stopTimeout));
        awaitComponent(transcriptionWorker.component(), transcriptionWorker.awaitTermination(stopTimeout));
        awaitComponent(UiUpdateSink.COMPONENT, uiSink.awaitTermination(stopTimeout));
        running = false;
        LOG.info("Dictation pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Hands an operator event to the state machine.
     *
     * @throws DictationUnavailableException when the state machine is not running
     */
    public void submit(AppEvent event) {
        Objects.requireNonNull(event, "event");
        if (!stateMachine.isRunning()) {
            throw new DictationUnavailableException("Dictation pipeline is shut down");
        }
        stateMachine.submit(event);
    }

    private static void awaitComponent(String component, boolean stopped) {
        if (!stopped) {
            LOG.warn("Component {} did not exit in time; abandoning it", component);
        }
    }
}

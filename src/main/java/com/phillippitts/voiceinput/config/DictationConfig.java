package com.phillippitts.voiceinput.config;

import com.phillippitts.voiceinput.config.audio.AudioCaptureProperties;
import com.phillippitts.voiceinput.config.dictation.DictationProperties;
import com.phillippitts.voiceinput.config.hotkey.HotkeyProperties;
import com.phillippitts.voiceinput.config.model.ModelProperties;
import com.phillippitts.voiceinput.config.stt.WhisperConfig;
import com.phillippitts.voiceinput.config.typing.TypingProperties;
import com.phillippitts.voiceinput.domain.command.AudioCommand;
import com.phillippitts.voiceinput.domain.command.ModelCommand;
import com.phillippitts.voiceinput.domain.command.TranscriptionCommand;
import com.phillippitts.voiceinput.service.audio.capture.AudioWorker;
import com.phillippitts.voiceinput.service.audio.capture.CaptureDevice;
import com.phillippitts.voiceinput.service.audio.capture.JavaSoundCaptureDevice;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.channel.UiUpdateChannel;
import com.phillippitts.voiceinput.service.hotkey.GlobalKeyHook;
import com.phillippitts.voiceinput.service.hotkey.HotkeyEventRouter;
import com.phillippitts.voiceinput.service.hotkey.InputContextLanguageDetector;
import com.phillippitts.voiceinput.service.hotkey.LanguageDetector;
import com.phillippitts.voiceinput.service.hotkey.impl.JNativeHookGlobalKeyHook;
import com.phillippitts.voiceinput.service.lifecycle.DictationRuntime;
import com.phillippitts.voiceinput.service.metrics.DictationMetrics;
import com.phillippitts.voiceinput.service.model.ArtifactStore;
import com.phillippitts.voiceinput.service.model.HttpArtifactStore;
import com.phillippitts.voiceinput.service.model.ModelWorker;
import com.phillippitts.voiceinput.service.statemachine.DictationStateMachine;
import com.phillippitts.voiceinput.service.stt.InferenceEngine;
import com.phillippitts.voiceinput.service.stt.TranscriptionWorker;
import com.phillippitts.voiceinput.service.stt.whisper.WhisperCliInferenceEngine;
import com.phillippitts.voiceinput.service.typing.TextInsertionService;
import com.phillippitts.voiceinput.service.ui.DesktopPresentationSink;
import com.phillippitts.voiceinput.service.ui.PresentationSink;
import com.phillippitts.voiceinput.service.ui.UiUpdateSink;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the dictation pipeline: the channels, the six components, and the platform
 * capabilities they are built against (key hook, capture device, artifact store,
 * inference engine, presentation).
 *
 * <p>Platform capabilities are separate beans so tests can replace them with
 * {@code @Primary} fakes without touching the components.
 */
@Configuration
public class DictationConfig {

    @Bean
    public Clock dictationClock() {
        return Clock.systemUTC();
    }

    // ---- channels

    @Bean
    public EventChannel eventChannel() {
        return new EventChannel();
    }

    @Bean
    public CommandChannel<AudioCommand> audioCommands(DictationProperties props) {
        return new CommandChannel<>("audio", props.getCommandCapacity());
    }

    @Bean
    public CommandChannel<ModelCommand> modelCommands(DictationProperties props) {
        return new CommandChannel<>("model", props.getCommandCapacity());
    }

    @Bean
    public CommandChannel<TranscriptionCommand> transcriptionCommands(DictationProperties props) {
        return new CommandChannel<>("transcription", props.getCommandCapacity());
    }

    @Bean
    public UiUpdateChannel uiUpdateChannel(DictationProperties props, DictationMetrics metrics) {
        return new UiUpdateChannel(props.getUiCapacity(), props.getUiOfferTimeoutMs(),
                dropped -> metrics.incrementUiUpdateDropped(dropped.getClass().getSimpleName()));
    }

    // ---- platform capabilities

    @Bean
    public GlobalKeyHook globalKeyHook() {
        return new JNativeHookGlobalKeyHook();
    }

    @Bean
    public LanguageDetector languageDetector(DictationProperties props) {
        return new InputContextLanguageDetector(props.getDefaultLanguage());
    }

    @Bean
    public CaptureDevice captureDevice(AudioCaptureProperties props) {
        return new JavaSoundCaptureDevice(props);
    }

    @Bean
    public ArtifactStore artifactStore(ModelProperties props) {
        return new HttpArtifactStore(props);
    }

    @Bean
    public InferenceEngine inferenceEngine(WhisperConfig whisperConfig) {
        return new WhisperCliInferenceEngine(whisperConfig);
    }

    @Bean
    public TextInsertionService textInsertionService(TypingProperties props) {
        return new TextInsertionService(props);
    }

    @Bean
    public PresentationSink presentationSink(ApplicationEventPublisher publisher, TextInsertionService insertion) {
        return new DesktopPresentationSink(publisher, insertion);
    }

    // ---- components

    @Bean
    public AudioWorker audioWorker(CommandChannel<AudioCommand> audioCommands,
                                   EventChannel events,
                                   CaptureDevice device,
                                   AudioCaptureProperties props) {
        return new AudioWorker(audioCommands, events, device, props);
    }

    @Bean
    public ModelWorker modelWorker(CommandChannel<ModelCommand> modelCommands,
                                   EventChannel events,
                                   ArtifactStore store,
                                   ModelProperties props,
                                   DictationMetrics metrics) {
        return new ModelWorker(modelCommands, events, store, props, metrics);
    }

    @Bean
    public TranscriptionWorker transcriptionWorker(CommandChannel<TranscriptionCommand> transcriptionCommands,
                                                   EventChannel events,
                                                   InferenceEngine engine,
                                                   ModelProperties modelProps,
                                                   WhisperConfig whisperConfig,
                                                   DictationMetrics metrics) {
        return new TranscriptionWorker(transcriptionCommands, events, engine,
                Paths.get(modelProps.getModelsDir()),
                Duration.ofSeconds(whisperConfig.timeoutSeconds()), metrics);
    }

    @Bean
    public DictationStateMachine dictationStateMachine(EventChannel events,
                                                       CommandChannel<AudioCommand> audioCommands,
                                                       CommandChannel<TranscriptionCommand> transcriptionCommands,
                                                       CommandChannel<ModelCommand> modelCommands,
                                                       UiUpdateChannel uiUpdates,
                                                       DictationProperties props,
                                                       ModelProperties modelProps,
                                                       DictationMetrics metrics,
                                                       Clock dictationClock) {
        return new DictationStateMachine(events, audioCommands, transcriptionCommands, modelCommands,
                uiUpdates, props, modelProps.getInitialModel(), metrics, dictationClock);
    }

    @Bean
    public UiUpdateSink uiUpdateSink(UiUpdateChannel uiUpdates, PresentationSink presentation) {
        return new UiUpdateSink(uiUpdates, presentation);
    }

    @Bean
    public HotkeyEventRouter hotkeyEventRouter(GlobalKeyHook hook,
                                               HotkeyProperties props,
                                               LanguageDetector languageDetector,
                                               DictationStateMachine stateMachine) {
        return new HotkeyEventRouter(hook, props, languageDetector, stateMachine::submit);
    }

    @Bean
    public DictationRuntime dictationRuntime(AudioWorker audioWorker,
                                             ModelWorker modelWorker,
                                             TranscriptionWorker transcriptionWorker,
                                             UiUpdateSink uiUpdateSink,
                                             DictationStateMachine stateMachine,
                                             HotkeyEventRouter router) {
        return new DictationRuntime(audioWorker, modelWorker, transcriptionWorker, uiUpdateSink,
                stateMachine, router);
    }
}

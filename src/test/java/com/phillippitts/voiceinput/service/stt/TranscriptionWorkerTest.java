package com.phillippitts.voiceinput.service.stt;

import com.phillippitts.voiceinput.domain.AudioBuffer;
import com.phillippitts.voiceinput.domain.command.TranscriptionCommand;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.exception.ModelNotFoundException;
import com.phillippitts.voiceinput.exception.TranscriptionException;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.metrics.DictationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionWorkerTest {

    private static final Path MODELS = Paths.get("/models");

    private CommandChannel<TranscriptionCommand> commands;
    private EventChannel events;
    private FakeEngine engine;
    private TranscriptionWorker worker;

    @BeforeEach
    void setUp() {
        commands = new CommandChannel<>("transcription", 8);
        events = new EventChannel();
        engine = new FakeEngine();
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            commands.sendUrgent(new TranscriptionCommand.Shutdown());
            worker.awaitTermination(Duration.ofSeconds(2));
        }
    }

    private void startWorker(Duration timeout) {
        worker = new TranscriptionWorker(commands, events, engine, MODELS, timeout,
                new DictationMetrics(new SimpleMeterRegistry()));
        worker.start();
    }

    @Test
    void transcribesConvertedAudioWithRequestedModel() throws Exception {
        // Arrange
        engine.script(() -> "  hello world \n");
        startWorker(Duration.ofSeconds(5));
        AudioBuffer stereo48k = AudioBuffer.ofPcm16(new byte[192_000], 48_000, 2);

        // Act
        commands.send(new TranscriptionCommand.Process(stereo48k, "de", "medium", true, 7));

        // Assert
        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFinished(7, "hello world"));
        assertThat(stereo48k.isConsumed()).isTrue();
        Call call = engine.calls.get(0);
        assertThat(call.pcmLength()).isEqualTo(32_000);
        assertThat(call.modelPath()).isEqualTo(MODELS.resolve("ggml-medium.bin"));
        assertThat(call.language()).isEqualTo("de");
        assertThat(call.translate()).isTrue();
    }

    @Test
    void englishUsesEnglishOnlyArtifactAndCachesHandle() throws Exception {
        engine.script(() -> "one");
        engine.script(() -> "two");
        startWorker(Duration.ofSeconds(5));

        commands.send(process(1, "en"));
        commands.send(process(2, "en"));

        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFinished(1, "one"));
        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFinished(2, "two"));
        assertThat(engine.calls).extracting(Call::modelPath).containsOnly(MODELS.resolve("ggml-small.en.bin"));
        assertThat(engine.loads).hasSize(1);
    }

    @Test
    void misalignedBufferIsRejectedAsCorrupt() throws Exception {
        startWorker(Duration.ofSeconds(5));

        commands.send(new TranscriptionCommand.Process(AudioBuffer.ofPcm16(new byte[3], 16_000, 1),
                "en", "small", false, 3));

        assertThat(events.poll(2, TimeUnit.SECONDS))
                .isEqualTo(new AppEvent.TranscriptionFailed(3, "corrupt audio buffer"));
        assertThat(engine.calls).isEmpty();
    }

    @Test
    void missingModelFileIsReported() throws Exception {
        engine.missing = true;
        startWorker(Duration.ofSeconds(5));

        commands.send(process(4, "en"));

        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFailed(4,
                "model not available: " + MODELS.resolve("ggml-small.en.bin")));
    }

    @Test
    void engineFailureIsReported() throws Exception {
        engine.script(() -> {
            throw new TranscriptionException("Non-zero exit (2)", "fake");
        });
        startWorker(Duration.ofSeconds(5));

        commands.send(process(5, "en"));

        assertThat(events.poll(2, TimeUnit.SECONDS))
                .isEqualTo(new AppEvent.TranscriptionFailed(5, "transcription failed: Non-zero exit (2)"));
    }

    @Test
    void runExceedingTimeoutIsAbandoned() throws Exception {
        // Arrange
        engine.script(engine::blockUntilInterrupted);
        engine.script(() -> "after");
        startWorker(Duration.ofMillis(200));

        // Act
        commands.send(process(6, "en"));
        commands.send(process(7, "en"));

        // Assert
        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFailed(6, "timeout"));
        assertThat(engine.interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFinished(7, "after"));
    }

    @Test
    void cancelAbandonsRunWithoutAnswer() throws Exception {
        engine.script(engine::blockUntilInterrupted);
        engine.script(() -> "next");
        startWorker(Duration.ofSeconds(10));
        commands.send(process(8, "en"));
        assertThat(engine.started.await(2, TimeUnit.SECONDS)).isTrue();

        commands.send(new TranscriptionCommand.Cancel(8));
        commands.send(process(9, "en"));

        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFinished(9, "next"));
        assertThat(engine.interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelForQueuedRequestDropsIt() throws Exception {
        engine.script(() -> {
            engine.started.countDown();
            sleep(300);
            return "first";
        });
        startWorker(Duration.ofSeconds(10));
        commands.send(process(10, "en"));
        assertThat(engine.started.await(2, TimeUnit.SECONDS)).isTrue();
        AudioBuffer queued = oneSecond();

        commands.send(new TranscriptionCommand.Process(queued, "en", "small", false, 11));
        commands.send(new TranscriptionCommand.Cancel(11));

        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.TranscriptionFinished(10, "first"));
        assertThat(events.poll(300, TimeUnit.MILLISECONDS)).isNull();
        assertThat(queued.isConsumed()).isTrue();
        assertThat(engine.calls).hasSize(1);
    }

    @Test
    void shutdownDuringRunStopsWorker() throws Exception {
        engine.script(engine::blockUntilInterrupted);
        startWorker(Duration.ofSeconds(10));
        commands.send(process(12, "en"));
        assertThat(engine.started.await(2, TimeUnit.SECONDS)).isTrue();

        commands.send(new TranscriptionCommand.Shutdown());

        assertThat(worker.awaitTermination(Duration.ofSeconds(2))).isTrue();
        assertThat(events.poll(100, TimeUnit.MILLISECONDS)).isNull();
    }

    private static TranscriptionCommand.Process process(long id, String language) {
        return new TranscriptionCommand.Process(oneSecond(), language, "small", false, id);
    }

    private static AudioBuffer oneSecond() {
        return AudioBuffer.ofPcm16(new byte[32_000], 16_000, 1);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    record Call(Path modelPath, int pcmLength, String language, boolean translate) {}

    /** Engine whose runs follow a script of suppliers, one per call. */
    static final class FakeEngine implements InferenceEngine {
        final List<Call> calls = new CopyOnWriteArrayList<>();
        final List<Path> loads = new CopyOnWriteArrayList<>();
        final Queue<Supplier<String>> script = new ConcurrentLinkedQueue<>();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch interrupted = new CountDownLatch(1);
        volatile boolean missing;

        void script(Supplier<String> behaviour) {
            script.add(behaviour);
        }

        String blockUntilInterrupted() {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new TranscriptionException("interrupted", name());
            }
            return "never";
        }

        @Override
        public String name() {
            return "fake";
        }

        @Override
        public ModelHandle load(Path modelPath) {
            if (missing) {
                throw new ModelNotFoundException(modelPath.toString());
            }
            loads.add(modelPath);
            return new ModelHandle(modelPath);
        }

        @Override
        public String run(ModelHandle handle, byte[] pcm16kMono, String language, boolean translate) {
            calls.add(new Call(handle.modelPath(), pcm16kMono.length, language, translate));
            Supplier<String> next = script.poll();
            return next == null ? "" : next.get();
        }
    }
}

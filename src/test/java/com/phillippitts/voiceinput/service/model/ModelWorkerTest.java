package com.phillippitts.voiceinput.service.model;

import com.phillippitts.voiceinput.config.model.ModelProperties;
import com.phillippitts.voiceinput.domain.command.ModelCommand;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.exception.ModelDownloadException;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.metrics.DictationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class ModelWorkerTest {

    private static final String SMALL_EN = "ggml-small.en.bin";
    private static final String SMALL = "ggml-small.bin";
    private static final String LARGE = "ggml-large-v2.bin";

    @TempDir
    Path modelsDir;

    private CommandChannel<ModelCommand> commands;
    private EventChannel events;
    private FakeArtifactStore store;
    private ModelWorker worker;

    @BeforeEach
    void setUp() {
        commands = new CommandChannel<>("model", 16);
        events = new EventChannel();
        store = new FakeArtifactStore(modelsDir);
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            commands.sendUrgent(new ModelCommand.Shutdown());
            worker.awaitTermination(Duration.ofSeconds(2));
        }
    }

    private void startWorker(int maxAttempts) {
        ModelProperties props = new ModelProperties("small", modelsDir.toString(), "http://localhost",
                maxAttempts, 1L, 100, 1000);
        worker = new ModelWorker(commands, events, store, props, new DictationMetrics(new SimpleMeterRegistry()));
        worker.start();
    }

    @Test
    void presentModelLoadsWithoutDownload() throws Exception {
        // Arrange
        store.preload(SMALL_EN, SMALL);
        startWorker(3);

        // Act
        commands.send(new ModelCommand.Load("small"));

        // Assert
        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.ModelLoaded("small"));
        assertThat(store.fetches).isEmpty();
    }

    @Test
    void legacyNameLoadsDefaultFamily() throws Exception {
        store.preload(SMALL_EN, SMALL);
        startWorker(3);

        commands.send(new ModelCommand.Load("base"));

        assertThat(events.poll(2, TimeUnit.SECONDS)).isEqualTo(new AppEvent.ModelLoaded("small"));
    }

    @Test
    void missingArtifactsAreDownloadedWithOverallProgress() throws Exception {
        startWorker(3);

        commands.send(new ModelCommand.Load("small"));

        List<AppEvent> received = collectUntil(e -> e instanceof AppEvent.ModelLoaded);
        assertThat(received).containsExactly(
                new AppEvent.ModelDownloadProgress("small", 25),
                new AppEvent.ModelDownloadProgress("small", 50),
                new AppEvent.ModelDownloadProgress("small", 75),
                new AppEvent.ModelDownloadProgress("small", 100),
                new AppEvent.ModelLoaded("small"));
        assertThat(store.fetches).containsExactly(SMALL_EN, SMALL);
    }

    @Test
    void retryableFailureIsRetried() throws Exception {
        store.preload(SMALL);
        store.failNext(SMALL_EN, new ModelDownloadException(SMALL_EN, "HTTP 503", true));
        startWorker(3);

        commands.send(new ModelCommand.Load("small"));

        List<AppEvent> received = collectUntil(e -> e instanceof AppEvent.ModelLoaded);
        assertThat(received).last().isEqualTo(new AppEvent.ModelLoaded("small"));
        assertThat(store.fetches).containsExactly(SMALL_EN, SMALL_EN);
    }

    @Test
    void exhaustedRetriesAreReportedAsPermanent() throws Exception {
        store.preload(SMALL);
        store.failNext(SMALL_EN, new ModelDownloadException(SMALL_EN, "HTTP 503", true));
        store.failNext(SMALL_EN, new ModelDownloadException(SMALL_EN, "HTTP 503", true));
        startWorker(2);

        commands.send(new ModelCommand.Load("small"));

        AppEvent event = events.poll(2, TimeUnit.SECONDS);
        assertThat(event).isInstanceOf(AppEvent.ModelLoadingFailed.class);
        AppEvent.ModelLoadingFailed failed = (AppEvent.ModelLoadingFailed) event;
        assertThat(failed.name()).isEqualTo("small");
        assertThat(failed.retryable()).isFalse();
        assertThat(failed.reason()).contains("failed after 2 attempts");
    }

    @Test
    void notFoundIsNotRetried() throws Exception {
        store.failNext(SMALL_EN, new ModelDownloadException(SMALL_EN, "HTTP 404 for " + SMALL_EN, false));
        startWorker(3);

        commands.send(new ModelCommand.Load("small"));

        AppEvent event = events.poll(2, TimeUnit.SECONDS);
        assertThat(event).isEqualTo(new AppEvent.ModelLoadingFailed("small", "HTTP 404 for " + SMALL_EN, false));
        assertThat(store.fetches).containsExactly(SMALL_EN);
    }

    @Test
    void localWriteFailureIsRetryable() throws Exception {
        store.failNext(SMALL_EN, new IOException("disk full"));
        startWorker(3);

        commands.send(new ModelCommand.Load("small"));

        AppEvent event = events.poll(2, TimeUnit.SECONDS);
        assertThat(event).isEqualTo(
                new AppEvent.ModelLoadingFailed("small", "cannot write model files: disk full", true));
    }

    @Test
    void downloadRefetchesPresentArtifacts() throws Exception {
        store.preload(LARGE);
        startWorker(3);

        commands.send(new ModelCommand.Download("large"));

        List<AppEvent> received = collectUntil(e -> e instanceof AppEvent.ModelLoaded);
        assertThat(received).last().isEqualTo(new AppEvent.ModelLoaded("large"));
        assertThat(store.fetches).containsExactly(LARGE);
    }

    @Test
    void cancelAbandonsDownloadSilently() throws Exception {
        // Arrange
        store.slow = true;
        store.preload(LARGE);
        startWorker(3);
        commands.send(new ModelCommand.Load("small"));
        assertThat(store.fetchStarted.await(2, TimeUnit.SECONDS)).isTrue();

        // Act
        commands.send(new ModelCommand.Cancel("small"));
        commands.send(new ModelCommand.Load("large"));

        // Assert
        List<AppEvent> received = collectUntil(e -> e instanceof AppEvent.ModelLoaded);
        assertThat(received).last().isEqualTo(new AppEvent.ModelLoaded("large"));
        assertThat(received).noneMatch(e -> e instanceof AppEvent.ModelLoadingFailed);
        assertThat(store.present).doesNotContain(SMALL_EN);
    }

    @Test
    void duplicateLoadsAreCoalesced() throws Exception {
        store.slow = true;
        startWorker(3);
        commands.send(new ModelCommand.Load("small"));
        assertThat(store.fetchStarted.await(2, TimeUnit.SECONDS)).isTrue();

        commands.send(new ModelCommand.Load("small"));
        commands.send(new ModelCommand.Load("SMALL"));

        collectUntil(e -> e instanceof AppEvent.ModelLoaded);
        assertThat(events.poll(200, TimeUnit.MILLISECONDS)).isNull();
        assertThat(store.fetches).containsExactly(SMALL_EN, SMALL);
    }

    @Test
    void reloadAfterCancelResumesInFlightDownload() throws Exception {
        // Arrange: ChangeModel(large) then ChangeModel(small) while small downloads
        CountDownLatch gate = new CountDownLatch(1);
        store.gate = gate;
        startWorker(3);
        commands.send(new ModelCommand.Load("small"));
        assertThat(store.fetchStarted.await(2, TimeUnit.SECONDS)).isTrue();

        // Act
        commands.send(new ModelCommand.Cancel("small"));
        commands.send(new ModelCommand.Load("large"));
        commands.send(new ModelCommand.Cancel("large"));
        commands.send(new ModelCommand.Load("small"));
        store.gate = null;
        gate.countDown();

        // Assert
        List<AppEvent> received = collectUntil(e -> e instanceof AppEvent.ModelLoaded);
        assertThat(received).last().isEqualTo(new AppEvent.ModelLoaded("small"));
        assertThat(events.poll(200, TimeUnit.MILLISECONDS)).isNull();
        assertThat(store.fetches).doesNotContain(LARGE);
    }

    @Test
    void shutdownDuringDownloadStopsWorker() throws Exception {
        store.slow = true;
        startWorker(3);
        commands.send(new ModelCommand.Load("small"));
        assertThat(store.fetchStarted.await(2, TimeUnit.SECONDS)).isTrue();

        commands.send(new ModelCommand.Shutdown());

        assertThat(worker.awaitTermination(Duration.ofSeconds(2))).isTrue();
        assertThat(store.present).isEmpty();
    }

    private List<AppEvent> collectUntil(Predicate<AppEvent> last) throws InterruptedException {
        List<AppEvent> received = new ArrayList<>();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            AppEvent e = events.poll(100, TimeUnit.MILLISECONDS);
            if (e == null) {
                continue;
            }
            received.add(e);
            if (last.test(e)) {
                return received;
            }
        }
        throw new AssertionError("Timed out; received " + received);
    }

    /**
     * In-memory store. Each fetch reports 50% and 100% progress, or 100 small steps
     * 10 ms apart when {@code slow} is set, then writes a one-byte file.
     */
    static final class FakeArtifactStore implements ArtifactStore {
        private final Path dir;
        final Set<String> present = ConcurrentHashMap.newKeySet();
        final List<String> fetches = new CopyOnWriteArrayList<>();
        final Map<String, Deque<Exception>> failures = new ConcurrentHashMap<>();
        final CountDownLatch fetchStarted = new CountDownLatch(1);
        volatile boolean slow;
        volatile CountDownLatch gate;

        FakeArtifactStore(Path dir) {
            this.dir = dir;
        }

        void preload(String... artifacts) {
            present.addAll(List.of(artifacts));
        }

        void failNext(String artifact, Exception e) {
            failures.computeIfAbsent(artifact, a -> new ArrayDeque<>()).add(e);
        }

        @Override
        public boolean exists(String artifact) {
            return present.contains(artifact);
        }

        @Override
        public Path localPath(String artifact) {
            return dir.resolve(artifact);
        }

        @Override
        public Path fetch(String artifact, ProgressListener listener) throws IOException {
            fetches.add(artifact);
            fetchStarted.countDown();
            Deque<Exception> queued = failures.get(artifact);
            Exception failure = queued == null ? null : queued.poll();
            if (failure instanceof IOException io) {
                throw io;
            }
            if (failure instanceof RuntimeException re) {
                throw re;
            }
            CountDownLatch hold = gate;
            if (hold != null) {
                awaitGate(hold);
            }
            if (slow) {
                for (int i = 1; i <= 100; i++) {
                    listener.onProgress(i, 100);
                    sleep(10);
                }
            } else {
                listener.onProgress(50, 100);
                listener.onProgress(100, 100);
            }
            Path path = localPath(artifact);
            Files.write(path, new byte[] {1});
            present.add(artifact);
            return path;
        }

        private static void awaitGate(CountDownLatch hold) {
            try {
                hold.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private static void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}

package com.phillippitts.voiceinput.service.model;

import com.phillippitts.voiceinput.config.model.ModelProperties;
import com.phillippitts.voiceinput.exception.ModelDownloadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Artifact store downloading whisper.cpp model files over HTTP into {@code model.models-dir}.
 *
 * <p>Bytes stream into {@code <artifact>.part} and are moved into place only when complete,
 * so a crash or cancellation never leaves a truncated model behind. HTTP 4xx responses are
 * permanent failures; 5xx responses, connection errors and stalled bodies are retryable.
 */
public class HttpArtifactStore implements ArtifactStore {

    private static final Logger LOG = LogManager.getLogger(HttpArtifactStore.class);
    private static final int CHUNK_BYTES = 8192;
    private static final String PART_SUFFIX = ".part";

    private final Path modelsDir;
    private final String baseUrl;
    private final Duration readTimeout;
    private final HttpClient httpClient;

    public HttpArtifactStore(ModelProperties props) {
        this(props, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    // Package-private for tests
    HttpArtifactStore(ModelProperties props, HttpClient httpClient) {
        Objects.requireNonNull(props, "props");
        this.modelsDir = Paths.get(props.getModelsDir());
        this.baseUrl = props.getBaseUrl().endsWith("/")
                ? props.getBaseUrl().substring(0, props.getBaseUrl().length() - 1)
                : props.getBaseUrl();
        this.readTimeout = Duration.ofMillis(props.getReadTimeoutMs());
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public boolean exists(String artifact) {
        Path path = localPath(artifact);
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            LOG.warn("Cannot stat {}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public Path localPath(String artifact) {
        return modelsDir.resolve(artifact);
    }

    @Override
    public Path fetch(String artifact, ProgressListener listener) throws IOException {
        Files.createDirectories(modelsDir);
        Path target = localPath(artifact);
        Path part = modelsDir.resolve(artifact + PART_SUFFIX);
        URI uri = URI.create(baseUrl + "/" + artifact);
        LOG.info("Downloading {} from {}", artifact, uri);

        HttpResponse<InputStream> response = send(artifact, uri);
        boolean complete = false;
        try (InputStream in = response.body()) {
            checkStatus(artifact, response.statusCode());
            long total = response.headers().firstValueAsLong("content-length").orElse(-1L);
            long done = copy(artifact, in, part, total, listener);
            if (total > 0 && done != total) {
                throw new ModelDownloadException(artifact,
                        "Truncated download of " + artifact + ": " + done + " of " + total + " bytes", true);
            }
            moveIntoPlace(part, target);
            complete = true;
            LOG.info("Downloaded {} ({} bytes)", artifact, done);
            return target;
        } finally {
            if (!complete) {
                Files.deleteIfExists(part);
            }
        }
    }

    private HttpResponse<InputStream> send(String artifact, URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(readTimeout)
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new ModelDownloadException(artifact, "Cannot reach " + uri.getHost() + ": " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("download of " + artifact + " interrupted");
        }
    }

    private static void checkStatus(String artifact, int status) {
        if (status >= 200 && status < 300) {
            return;
        }
        if (status == 404) {
            throw new ModelDownloadException(artifact, "Model file " + artifact + " not found on server", false);
        }
        boolean retryable = status >= 500 || status == 429;
        throw new ModelDownloadException(artifact, "Server returned HTTP " + status + " for " + artifact, retryable);
    }

    /**
     * Streams the body into {@code part}. {@code HttpRequest.timeout} only covers the wait for
     * headers, so a watchdog closes the body when no bytes arrive within the read timeout.
     */
    private long copy(String artifact, InputStream in, Path part, long total, ProgressListener listener)
            throws IOException {
        byte[] buf = new byte[CHUNK_BYTES];
        long done = 0;
        try (IdleWatchdog watchdog = new IdleWatchdog(artifact, in, readTimeout);
             OutputStream out = Files.newOutputStream(part)) {
            while (true) {
                int n;
                try {
                    n = in.read(buf);
                } catch (IOException e) {
                    if (watchdog.tripped()) {
                        throw stalled(artifact, done);
                    }
                    throw new ModelDownloadException(artifact, "Connection lost after " + done + " bytes: "
                            + e.getMessage(), true, e);
                }
                if (watchdog.tripped()) {
                    throw stalled(artifact, done);
                }
                if (n < 0) {
                    break;
                }
                watchdog.touch();
                out.write(buf, 0, n);
                done += n;
                listener.onProgress(done, total);
            }
        }
        return done;
    }

    private ModelDownloadException stalled(String artifact, long done) {
        return new ModelDownloadException(artifact, "No data for " + readTimeout.toMillis()
                + "ms after " + done + " bytes of " + artifact, true);
    }

    private static void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Closes a response body that has gone quiet for longer than the idle limit. */
    private static final class IdleWatchdog implements AutoCloseable {
        private final String artifact;
        private final InputStream in;
        private final long idleNanos;
        private final ScheduledExecutorService timer;
        private final AtomicBoolean tripped = new AtomicBoolean();
        private volatile long lastData = System.nanoTime();

        IdleWatchdog(String artifact, InputStream in, Duration idle) {
            this.artifact = artifact;
            this.in = in;
            this.idleNanos = idle.toNanos();
            this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "download-watchdog");
                t.setDaemon(true);
                return t;
            });
            long period = Math.max(10L, idle.toMillis() / 4);
            timer.scheduleAtFixedRate(this::check, period, period, TimeUnit.MILLISECONDS);
        }

        void touch() {
            lastData = System.nanoTime();
        }

        boolean tripped() {
            return tripped.get();
        }

        private void check() {
            if (System.nanoTime() - lastData < idleNanos || !tripped.compareAndSet(false, true)) {
                return;
            }
            LOG.warn("Download of {} stalled; closing connection", artifact);
            try {
                in.close();
            } catch (IOException e) {
                LOG.debug("Closing stalled body of {} failed: {}", artifact, e.getMessage());
            }
        }

        @Override
        public void close() {
            timer.shutdownNow();
        }
    }
}

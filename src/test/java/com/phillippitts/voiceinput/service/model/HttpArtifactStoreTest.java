package com.phillippitts.voiceinput.service.model;

import com.phillippitts.voiceinput.config.model.ModelProperties;
import com.phillippitts.voiceinput.exception.ModelDownloadException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Downloads against a local JDK HTTP server.
 */
class HttpArtifactStoreTest {

    private static final byte[] PAYLOAD = new byte[20_000];

    @TempDir
    Path tmp;

    private final CountDownLatch releaseStalled = new CountDownLatch(1);

    private HttpServer server;
    private HttpArtifactStore store;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        for (int i = 0; i < PAYLOAD.length; i++) {
            PAYLOAD[i] = (byte) i;
        }
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ggml-small.bin", exchange -> {
            exchange.sendResponseHeaders(200, PAYLOAD.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(PAYLOAD);
            }
        });
        server.createContext("/ggml-busy.bin", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.createContext("/ggml-stalled.bin", exchange -> {
            exchange.sendResponseHeaders(200, PAYLOAD.length);
            OutputStream out = exchange.getResponseBody();
            out.write(PAYLOAD, 0, 100);
            out.flush();
            try {
                releaseStalled.await(20, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        store = new HttpArtifactStore(new ModelProperties("small", tmp.toString(), baseUrl, 3, 1L, 1000, 5000));
    }

    @AfterEach
    void tearDown() {
        releaseStalled.countDown();
        server.stop(0);
    }

    @Test
    void fetchWritesArtifactAndReportsProgress() throws IOException {
        // Arrange
        List<long[]> progress = new ArrayList<>();

        // Act
        Path path = store.fetch("ggml-small.bin", (done, total) -> progress.add(new long[] {done, total}));

        // Assert
        assertThat(path).isEqualTo(tmp.resolve("ggml-small.bin"));
        assertThat(Files.readAllBytes(path)).isEqualTo(PAYLOAD);
        assertThat(store.exists("ggml-small.bin")).isTrue();
        assertThat(progress).isNotEmpty();
        assertThat(progress.get(progress.size() - 1)).containsExactly(PAYLOAD.length, PAYLOAD.length);
        assertThat(tmp.resolve("ggml-small.bin.part")).doesNotExist();
    }

    @Test
    void missingArtifactIsNotRetryable() {
        assertThatThrownBy(() -> store.fetch("ggml-absent.bin", (done, total) -> { }))
                .isInstanceOf(ModelDownloadException.class)
                .hasMessageContaining("not found")
                .satisfies(e -> assertThat(((ModelDownloadException) e).isRetryable()).isFalse());
        assertThat(store.exists("ggml-absent.bin")).isFalse();
    }

    @Test
    void serverErrorIsRetryable() {
        assertThatThrownBy(() -> store.fetch("ggml-busy.bin", (done, total) -> { }))
                .isInstanceOf(ModelDownloadException.class)
                .hasMessageContaining("HTTP 503")
                .satisfies(e -> assertThat(((ModelDownloadException) e).isRetryable()).isTrue());
    }

    @Test
    void stalledBodyFailsRetryablyAfterReadTimeout() {
        // Arrange
        HttpArtifactStore impatient =
                new HttpArtifactStore(new ModelProperties("small", tmp.toString(), baseUrl, 3, 1L, 1000, 500));

        // Act + Assert
        assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                assertThatThrownBy(() -> impatient.fetch("ggml-stalled.bin", (done, total) -> { }))
                        .isInstanceOf(ModelDownloadException.class)
                        .hasMessageContaining("No data for 500ms")
                        .satisfies(e -> assertThat(((ModelDownloadException) e).isRetryable()).isTrue()));
        assertThat(tmp.resolve("ggml-stalled.bin.part")).doesNotExist();
        assertThat(impatient.exists("ggml-stalled.bin")).isFalse();
    }

    @Test
    void emptyFileDoesNotCountAsPresent() throws IOException {
        Files.createFile(tmp.resolve("ggml-medium.bin"));

        assertThat(store.exists("ggml-medium.bin")).isFalse();
    }
}

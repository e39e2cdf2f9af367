package com.phillippitts.voiceinput.service.stt.whisper;

import com.phillippitts.voiceinput.config.stt.WhisperConfig;
import com.phillippitts.voiceinput.exception.TranscriptionException;
import com.phillippitts.voiceinput.exception.TranscriptionExceptionBuilder;
import com.phillippitts.voiceinput.util.ProcessTimeouts;
import com.phillippitts.voiceinput.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the whisper.cpp CLI for one WAV file and returns its stdout.
 *
 * <p>Stdout and stderr are drained by gobbler threads so the child never blocks on a full
 * pipe. The run is bounded by {@code stt.whisper.timeout-seconds}; an interrupt of the
 * calling thread (the transcription worker abandoning the run) destroys the process the
 * same way. Failures become {@link TranscriptionException}s carrying exit code, duration and
 * a stderr snippet.
 *
 * <p>Each call owns its process and gobblers, so a run abandoned by the transcription worker
 * cannot touch the process of the run that replaced it.
 */
public final class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final ProcessFactory processFactory;

    // Runs still holding a process; an abandoned run may overlap its replacement
    private final Set<Run> active = ConcurrentHashMap.newKeySet();

    private record Run(Process process, Thread outGobbler, Thread errGobbler,
                       StringBuilder stdout, StringBuilder stderr) {}

    public WhisperProcessManager() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Transcribes {@code wavPath} with {@code modelPath}.
     *
     * <p>Command line:
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} [-tr] (-otxt -nt | -oj) -of stdout -t ${threads}
     * </pre>
     *
     * @return raw stdout, possibly empty
     * @throws TranscriptionException on timeout, non-zero exit, I/O failure or interrupt
     */
    public String transcribe(Path wavPath, Path modelPath, String language, boolean translate, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(modelPath, "modelPath");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, wavPath, modelPath, language, translate);
        long startNanos = System.nanoTime();
        StringBuilder stderr = null;
        Run run = null;
        try {
            run = start(command, wavPath, cfg);
            stderr = run.stderr();
            boolean finished = run.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(run.process());
                throw error("Timeout after " + cfg.timeoutSeconds() + "s", cfg, modelPath, -1, stderr, startNanos, null);
            }
            joinQuietly(run.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(run.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = run.process().exitValue();
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, cfg, modelPath, exitCode, stderr, startNanos, null);
            }
            String output = run.stdout().toString();
            LOG.debug("Whisper stdout size={} chars in {} ms", output.length(), TimeUtils.elapsedMillis(startNanos));
            return output;
        } catch (IOException e) {
            throw error("I/O failure: " + e.getMessage(), cfg, modelPath, -1, stderr, startNanos, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw error("Interrupted", cfg, modelPath, -1, stderr, startNanos, e);
        } finally {
            if (run != null) {
                release(run);
            }
        }
    }

    private Run start(List<String> command, Path wavPath, WhisperConfig cfg) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, wavPath.getParent());
        Thread out = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "whisper-err", WhisperConstants.STDERR_MAX_BYTES);
        Run run = new Run(process, out, err, stdout, stderr);
        active.add(run);
        return run;
    }

    List<String> buildCommand(WhisperConfig cfg, Path wavPath, Path modelPath, String language, boolean translate) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(modelPath.toAbsolutePath().toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(language == null || language.isBlank() ? "auto" : language);
        if (translate) {
            cmd.add("-tr");
        }
        if (cfg.jsonOutput()) {
            cmd.add("-oj");
        } else {
            cmd.add("-otxt");
            cmd.add("-nt");
        }
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    /** Relative paths resolve against the working directory. */
    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into {@code sink} up to {@code maxBytes}, then keeps draining without
     * accumulating so the child never blocks.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        process.destroy();
        try {
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            // Still kill it; the interrupt is restored for the caller
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static TranscriptionException error(String msg, WhisperConfig cfg, Path modelPath, int exitCode,
                                                StringBuilder stderr, long startNanos, Throwable cause) {
        String stderrSnippet = "";
        if (stderr != null) {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(WhisperConstants.ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(WhisperConstants.ENGINE)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelPath", modelPath)
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    /** Kills the run's process if still alive and joins its gobblers. */
    private void release(Run run) {
        if (!active.remove(run)) {
            return;
        }
        if (run.process().isAlive()) {
            destroyProcess(run.process());
        }
        joinQuietly(run.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(run.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    /** Kills every running process and joins the gobblers. Idempotent. */
    @Override
    public void close() {
        List.copyOf(active).forEach(this::release);
    }
}

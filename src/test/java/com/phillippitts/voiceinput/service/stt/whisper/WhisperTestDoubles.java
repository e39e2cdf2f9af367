package com.phillippitts.voiceinput.service.stt.whisper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for running the whisper tests without a whisper.cpp binary.
 */
final class WhisperTestDoubles {

    private WhisperTestDoubles() {}

    /**
     * @param stdout what the fake binary prints
     * @param stderr what it prints on stderr
     * @param exitCode exit status once finished
     * @param finishAfterMillis run time; -1 runs until destroyed
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior success(String stdout) {
            return new ProcessBehavior(stdout, "", 0, 0);
        }

        static ProcessBehavior failure(int exitCode, String stderr) {
            return new ProcessBehavior("", stderr, exitCode, 0);
        }

        static ProcessBehavior hanging() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /** Hands back one prepared process and remembers the command it was asked to run. */
    static final class StubProcessFactory implements ProcessFactory {
        private final Process process;
        private volatile List<String> lastCommand;
        private volatile Path lastWorkingDir;

        StubProcessFactory(Process process) {
            this.process = process;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            this.lastCommand = List.copyOf(command);
            this.lastWorkingDir = workingDir;
            return process;
        }

        List<String> lastCommand() {
            return lastCommand;
        }

        Path lastWorkingDir() {
            return lastWorkingDir;
        }
    }

    /** Hands back the prepared processes in order, one per start. */
    static final class SequenceProcessFactory implements ProcessFactory {
        private final Deque<Process> processes;

        SequenceProcessFactory(Process... processes) {
            this.processes = new ConcurrentLinkedDeque<>(List.of(processes));
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            return processes.poll();
        }
    }

    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private final long startedAt = System.currentTimeMillis();
        private volatile boolean destroyed;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
        }

        boolean wasDestroyCalled() {
            return destroyed;
        }

        private long remainingMillis() {
            if (finishAfterMillis < 0) {
                return Long.MAX_VALUE;
            }
            return Math.max(0, startedAt + finishAfterMillis - System.currentTimeMillis());
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            while (isAlive()) {
                Thread.sleep(5);
            }
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long deadline = System.currentTimeMillis() + unit.toMillis(timeout);
            while (isAlive()) {
                if (System.currentTimeMillis() >= deadline) {
                    return false;
                }
                Thread.sleep(5);
            }
            return true;
        }

        @Override
        public int exitValue() {
            if (isAlive()) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return destroyed ? 143 : exitCode;
        }

        @Override
        public void destroy() {
            destroyed = true;
        }

        @Override
        public Process destroyForcibly() {
            destroyed = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return !destroyed && remainingMillis() > 0;
        }
    }
}

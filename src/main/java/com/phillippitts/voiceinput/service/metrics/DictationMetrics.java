package com.phillippitts.voiceinput.service.metrics;

import com.phillippitts.voiceinput.domain.AppState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the dictation pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>State transitions by target state</li>
 *   <li>Transcription latency and success/failure by reason</li>
 *   <li>Model downloads by outcome</li>
 *   <li>UI updates dropped under backpressure</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DictationMetrics {

    private static final String METRIC_PREFIX = "voiceinput";

    private final MeterRegistry registry;

    public DictationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    public void recordTransition(AppState.Kind target) {
        Counter.builder(METRIC_PREFIX + ".state.transitions")
                .description("State machine transitions by target state")
                .tag("state", target.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * @param engineName inference engine name (e.g. whisper)
     * @param durationNanos wall time of the run
     */
    public void recordTranscriptionLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to transcribe audio")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTranscriptionSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".transcription.success")
                .description("Number of successful transcriptions")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure class (timeout, corrupt, model, error)
     */
    public void incrementTranscriptionFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Number of failed transcriptions")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome downloaded, failed, cancelled
     */
    public void recordModelDownload(String outcome) {
        Counter.builder(METRIC_PREFIX + ".model.downloads")
                .description("Model artifact downloads by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementUiUpdateDropped(String type) {
        Counter.builder(METRIC_PREFIX + ".ui.dropped")
                .description("UI updates dropped because the sink fell behind")
                .tag("type", type)
                .register(registry)
                .increment();
    }
}

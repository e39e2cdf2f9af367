package com.phillippitts.voiceinput.service.health;

import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.service.ui.DictationStatusView;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Health indicator reporting the last state rendered by the UI sink.
 *
 * <ul>
 *   <li>UP: loading, ready, recording or transcribing</li>
 *   <li>OUT_OF_SERVICE: recoverable error (an operator can still change or reload the model)</li>
 *   <li>DOWN: fatal error or shut down</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class DictationHealthIndicator implements HealthIndicator {

    private final DictationStatusView statusView;

    public DictationHealthIndicator(DictationStatusView statusView) {
        this.statusView = Objects.requireNonNull(statusView, "statusView");
    }

    @Override
    public Health health() {
        DictationStatusView.Status status = statusView.current();
        AppState state = status.state();

        Health.Builder builder = new Health.Builder();
        if (state.isFatal() || state.is(AppState.Kind.SHUTDOWN)) {
            builder.down();
        } else if (state.isRecoverableError()) {
            builder.outOfService();
        } else {
            builder.up();
        }
        builder.withDetail("state", state.kind().name())
                .withDetail("translate", status.translate());
        if (state.is(AppState.Kind.ERROR)) {
            builder.withDetail("message", state.message());
        }
        if (status.progressPercent() >= 0) {
            builder.withDetail("download", status.progressModel() + " " + status.progressPercent() + "%");
        }
        return builder.build();
    }
}

package com.phillippitts.voiceinput.service.ui;

import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Last rendered view of the pipeline, assembled from {@link UiUpdate}s republished by the
 * presentation sink. Read by the REST controller and the health indicator.
 */
@Component
public class DictationStatusView {

    /**
     * @param progressPercent -1 when no download is running
     */
    public record Status(AppState state,
                         boolean translate,
                         String progressModel,
                         int progressPercent,
                         String lastError,
                         Instant updatedAt) {}

    private final Clock clock;
    private volatile Status status;

    public DictationStatusView() {
        this(Clock.systemUTC());
    }

    DictationStatusView(Clock clock) {
        this.clock = clock;
        this.status = new Status(AppState.LOADING_INITIAL_MODEL, false, null, -1, null, clock.instant());
    }

    public Status current() {
        return status;
    }

    @EventListener
    public void onUpdate(UiUpdate update) {
        Status s = status;
        Instant now = clock.instant();
        if (update instanceof UiUpdate.StateChanged changed) {
            boolean loading = changed.state().is(AppState.Kind.LOADING_INITIAL_MODEL);
            status = new Status(changed.state(), s.translate(),
                    loading ? s.progressModel() : null, loading ? s.progressPercent() : -1, s.lastError(), now);
        } else if (update instanceof UiUpdate.ProgressUpdate progress) {
            status = new Status(s.state(), s.translate(), progress.model(), progress.percent(), s.lastError(), now);
        } else if (update instanceof UiUpdate.TranslateModeChanged translate) {
            status = new Status(s.state(), translate.enabled(), s.progressModel(), s.progressPercent(), s.lastError(), now);
        } else if (update instanceof UiUpdate.ErrorMessage error) {
            status = new Status(s.state(), s.translate(), s.progressModel(), s.progressPercent(), error.text(), now);
        }
    }
}

package com.phillippitts.voiceinput.service.health;

import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import com.phillippitts.voiceinput.service.ui.DictationStatusView;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class DictationHealthIndicatorTest {

    private final DictationStatusView view = new DictationStatusView();
    private final DictationHealthIndicator indicator = new DictationHealthIndicator(view);

    @Test
    void upWhileLoadingWithDownloadDetail() {
        view.onUpdate(new UiUpdate.ProgressUpdate("ggml-small.en.bin", 55));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("state", "LOADING_INITIAL_MODEL")
                .containsEntry("download", "ggml-small.en.bin 55%");
    }

    @Test
    void upWhenReady() {
        view.onUpdate(new UiUpdate.StateChanged(AppState.READY));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("translate", false).doesNotContainKey("download");
    }

    @Test
    void outOfServiceOnRecoverableError() {
        view.onUpdate(new UiUpdate.StateChanged(AppState.error(true, "Model download failed")));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).containsEntry("message", "Model download failed");
    }

    @Test
    void downOnFatalErrorOrShutdown() {
        view.onUpdate(new UiUpdate.StateChanged(AppState.error(false, "Audio worker died")));
        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);

        view.onUpdate(new UiUpdate.StateChanged(AppState.SHUTDOWN));
        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}

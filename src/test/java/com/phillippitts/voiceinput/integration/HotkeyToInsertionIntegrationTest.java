package com.phillippitts.voiceinput.integration;

import com.phillippitts.voiceinput.config.IntegrationTestConfiguration;
import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import com.phillippitts.voiceinput.testutil.FakeGlobalKeyHook;
import com.phillippitts.voiceinput.testutil.RecordingPresentationSink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;

import static com.phillippitts.voiceinput.service.hotkey.NormalizedKeyEvent.pressed;
import static com.phillippitts.voiceinput.service.hotkey.NormalizedKeyEvent.released;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Full pipeline with in-memory seams: hotkey gesture, capture, transcription and text
 * insertion, all wired by the application context.
 */
@Tag("integration")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(
    properties = {
        "model.models-dir=${java.io.tmpdir}/voice-input-it-models",
        "audio.capture.chunk-millis=40"
    }
)
class HotkeyToInsertionIntegrationTest {

    @Autowired
    private FakeGlobalKeyHook hook;

    @Autowired
    private RecordingPresentationSink presentation;

    @Test
    void gestureEndsWithTextInserted() throws InterruptedException {
        // Arrange
        assertThat(hook.isRegistered()).isTrue();
        await().atMost(Duration.ofSeconds(10))
                .until(() -> AppState.READY.equals(presentation.lastState()));
        int insertedBefore = presentation.inserted.size();

        // Act
        hook.emit(pressed("CONTROL"));
        hook.emit(pressed("CAPS_LOCK", "CONTROL"));
        await().atMost(Duration.ofSeconds(5))
                .until(() -> AppState.RECORDING.equals(presentation.lastState()));
        Thread.sleep(500);
        hook.emit(released("CAPS_LOCK", "CONTROL"));
        hook.emit(released("CONTROL"));

        // Assert
        await().atMost(Duration.ofSeconds(10))
                .until(() -> presentation.inserted.size() > insertedBefore);
        assertThat(presentation.inserted.get(insertedBefore)).isEqualTo(IntegrationTestConfiguration.CANNED_TEXT);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> AppState.READY.equals(presentation.lastState()));
        assertThat(presentation.rendered)
                .contains(new UiUpdate.StateChanged(AppState.TRANSCRIBING),
                        new UiUpdate.TranscriptionResult(IntegrationTestConfiguration.CANNED_TEXT));
    }
}

package com.phillippitts.voiceinput.service.hotkey;

import com.phillippitts.voiceinput.config.hotkey.HotkeyProperties;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static com.phillippitts.voiceinput.service.hotkey.NormalizedKeyEvent.pressed;
import static com.phillippitts.voiceinput.service.hotkey.NormalizedKeyEvent.released;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HotkeyEventRouterTest {

    private final HotkeyProperties props = new HotkeyProperties("CONTROL", "CAPS_LOCK", "ALT", List.of());
    private final List<AppEvent> sent = new CopyOnWriteArrayList<>();

    @Test
    void gestureEmitsLanguageThenStartThenStop() {
        // Arrange
        HotkeyEventRouter router = new HotkeyEventRouter(new FakeHook(), props, () -> "fr", sent::add);

        // Act
        router.route(pressed("CONTROL"));
        router.route(pressed("CAPS_LOCK", "CONTROL"));
        router.route(released("CAPS_LOCK", "CONTROL"));

        // Assert
        assertThat(sent).containsExactly(
                new AppEvent.LanguageDetected("fr"),
                new AppEvent.StartRecording(),
                new AppEvent.StopRecording());
    }

    @Test
    void doubleReleaseEmitsSingleStop() {
        HotkeyEventRouter router = new HotkeyEventRouter(new FakeHook(), props, () -> "en", sent::add);

        router.route(pressed("CAPS_LOCK", "CONTROL"));
        router.route(released("CAPS_LOCK"));
        router.route(released("CAPS_LOCK"));

        assertThat(sent.stream().filter(e -> e instanceof AppEvent.StopRecording)).hasSize(1);
    }

    @Test
    void translateGestureEmitsToggle() {
        HotkeyEventRouter router = new HotkeyEventRouter(new FakeHook(), props, () -> "en", sent::add);

        router.route(pressed("ALT"));
        router.route(pressed("CAPS_LOCK", "ALT"));

        assertThat(sent).containsExactly(new AppEvent.ToggleTranslate());
    }

    @Test
    void hookEventsAreRoutedOnRouterThread() {
        // Arrange
        FakeHook hook = new FakeHook();
        HotkeyEventRouter router = new HotkeyEventRouter(hook, props, () -> "en", sent::add);

        // Act
        router.start();
        hook.emit(pressed("CAPS_LOCK", "CONTROL"));
        hook.emit(released("CAPS_LOCK", "CONTROL"));

        // Assert
        await().atMost(2, TimeUnit.SECONDS).until(() -> sent.size() == 3);
        assertThat(router.isHookRegistered()).isTrue();
        router.stop(Duration.ofSeconds(1));
        assertThat(hook.isRegistered()).isFalse();
        assertThat(router.isRunning()).isFalse();
    }

    @Test
    void refusedHookKeepsRouterAlive() {
        FakeHook hook = new FakeHook();
        hook.refuse = true;
        HotkeyEventRouter router = new HotkeyEventRouter(hook, props, () -> "en", sent::add);

        router.start();

        assertThat(router.isHookRegistered()).isFalse();
        assertThat(router.isRunning()).isTrue();
        router.stop(Duration.ofSeconds(1));
    }

    // Simple fake hook for tests
    static class FakeHook implements GlobalKeyHook {
        private final AtomicBoolean reg = new AtomicBoolean();
        private volatile Consumer<NormalizedKeyEvent> listener;
        volatile boolean refuse;

        @Override
        public void register() {
            if (refuse) {
                throw new SecurityException("accessibility permission missing");
            }
            reg.set(true);
        }

        @Override public void unregister() { reg.set(false); }
        @Override public void addListener(Consumer<NormalizedKeyEvent> listener) { this.listener = listener; }
        boolean isRegistered() { return reg.get(); }
        void emit(NormalizedKeyEvent e) { Consumer<NormalizedKeyEvent> l = listener; if (l != null) l.accept(e); }
    }
}

package com.phillippitts.voiceinput.service.ui;

import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import com.phillippitts.voiceinput.service.typing.TextInsertionService;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DesktopPresentationSinkTest {

    @Test
    void republishesEveryUpdate() {
        List<Object> published = new ArrayList<>();
        DesktopPresentationSink sink = new DesktopPresentationSink(published::add, mock(TextInsertionService.class));

        sink.render(new UiUpdate.StateChanged(AppState.READY));
        sink.render(new UiUpdate.ProgressUpdate("ggml-small.bin", 10));

        assertThat(published).containsExactly(
                new UiUpdate.StateChanged(AppState.READY),
                new UiUpdate.ProgressUpdate("ggml-small.bin", 10));
    }

    @Test
    void insertsTextThroughTheInsertionService() {
        TextInsertionService insertion = mock(TextInsertionService.class);
        when(insertion.insert("hello")).thenReturn(null);
        DesktopPresentationSink sink = new DesktopPresentationSink(event -> { }, insertion);

        sink.insertText("hello");

        verify(insertion).insert("hello");
    }
}

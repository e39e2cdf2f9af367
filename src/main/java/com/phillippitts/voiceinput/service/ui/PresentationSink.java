package com.phillippitts.voiceinput.service.ui;

import com.phillippitts.voiceinput.domain.ui.UiUpdate;

/** Where UI updates end up: a tray icon, a window, the log. Called from the UI sink thread only. */
public interface PresentationSink {

    void render(UiUpdate update);

    /** Inserts recognized text at the cursor of the focused application. */
    void insertText(String text);
}

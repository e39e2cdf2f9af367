package com.phillippitts.voiceinput.service.ui;

import com.phillippitts.voiceinput.domain.ui.UiUpdate;
import com.phillippitts.voiceinput.service.typing.TextInsertionService;
import com.phillippitts.voiceinput.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Default presentation: logs each update, republishes it as a Spring application event
 * for in-process listeners (status view, health) and inserts text through
 * {@link TextInsertionService}.
 */
public class DesktopPresentationSink implements PresentationSink {

    private static final Logger LOG = LogManager.getLogger(DesktopPresentationSink.class);

    private final ApplicationEventPublisher publisher;
    private final TextInsertionService insertion;

    public DesktopPresentationSink(ApplicationEventPublisher publisher, TextInsertionService insertion) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.insertion = Objects.requireNonNull(insertion, "insertion");
    }

    @Override
    public void render(UiUpdate update) {
        if (update instanceof UiUpdate.StateChanged changed) {
            LOG.info("State: {}", changed.state());
        } else if (update instanceof UiUpdate.ErrorMessage error) {
            LOG.warn("Error: {}", error.text());
        } else if (update instanceof UiUpdate.ProgressUpdate progress) {
            LOG.info("Downloading model '{}': {}%", progress.model(), progress.percent());
        } else if (update instanceof UiUpdate.TranslateModeChanged translate) {
            LOG.info("Translate mode {}", translate.enabled() ? "on" : "off");
        } else if (update instanceof UiUpdate.TranscriptionResult result) {
            LOG.info("Transcription received (chars={})", LogSanitizer.length(result.text()));
        }
        publisher.publishEvent(update);
    }

    @Override
    public void insertText(String text) {
        if (insertion.insert(text) == null) {
            LOG.warn("Transcription could not be inserted");
        }
    }
}

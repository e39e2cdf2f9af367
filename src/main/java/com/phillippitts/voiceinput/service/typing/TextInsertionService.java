package com.phillippitts.voiceinput.service.typing;

import com.phillippitts.voiceinput.config.typing.TypingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Inserts transcribed text at the cursor, trying strategies in order until one succeeds:
 * clipboard paste, then notify-only. With {@code typing.enabled=false} only the
 * notification runs.
 */
public class TextInsertionService {

    private static final Logger LOG = LogManager.getLogger(TextInsertionService.class);

    private final List<TextInserter> chain;

    public TextInsertionService(TypingProperties props) {
        this(props.isEnabled()
                ? List.of(new ClipboardTextInserter(props), new NotifyOnlyTextInserter())
                : List.of(new NotifyOnlyTextInserter()));
    }

    // Package-private for tests
    TextInsertionService(List<TextInserter> chain) {
        this.chain = List.copyOf(Objects.requireNonNull(chain));
    }

    /** @return name of the strategy that succeeded, or null if none did */
    public String insert(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (TextInserter inserter : chain) {
            if (!inserter.canInsert()) {
                LOG.debug("Skipping inserter {}: unavailable", inserter.name());
                continue;
            }
            try {
                if (inserter.insert(text)) {
                    LOG.info("Inserted via {} (chars={})", inserter.name(), text.length());
                    return inserter.name();
                }
                LOG.info("Inserter {} declined; trying next", inserter.name());
            } catch (RuntimeException e) {
                LOG.warn("Inserter {} failed: {}", inserter.name(), e.toString());
            }
        }
        LOG.warn("No inserter succeeded (chars={})", text.length());
        return null;
    }
}

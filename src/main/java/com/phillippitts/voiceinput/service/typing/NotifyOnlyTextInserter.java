package com.phillippitts.voiceinput.service.typing;

import com.phillippitts.voiceinput.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Last resort: announces the transcription in the log without touching the OS. */
class NotifyOnlyTextInserter implements TextInserter {

    private static final Logger LOG = LogManager.getLogger(NotifyOnlyTextInserter.class);

    @Override
    public boolean canInsert() {
        return true;
    }

    @Override
    public boolean insert(String text) {
        LOG.info("Transcription ready but not inserted (chars={})", LogSanitizer.length(text));
        LOG.debug("Preview: '{}'", LogSanitizer.truncate(text, 120));
        return true;
    }

    @Override
    public String name() {
        return "notify";
    }
}

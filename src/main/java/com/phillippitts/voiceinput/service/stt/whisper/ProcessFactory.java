package com.phillippitts.voiceinput.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Seam over {@link ProcessBuilder} so tests can hand back a fake {@link Process}
 * with scripted stdout, stderr and exit behavior.
 */
interface ProcessFactory {

    /**
     * @param command full command line, executable first
     * @param workingDir working directory, may be null
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}

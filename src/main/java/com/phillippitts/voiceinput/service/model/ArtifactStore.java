package com.phillippitts.voiceinput.service.model;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Local cache of model artifact files backed by a remote source. Used only from the
 * model worker thread, which owns the models directory.
 */
public interface ArtifactStore {

    boolean exists(String artifact);

    /** Where {@code artifact} lives once present. */
    Path localPath(String artifact);

    /**
     * Downloads {@code artifact} into the cache, replacing any existing copy atomically.
     *
     * @param listener progress callback invoked on the calling thread; may throw
     *                 {@link java.util.concurrent.CancellationException} to abandon the fetch
     * @return the local path of the fetched artifact
     * @throws com.phillippitts.voiceinput.exception.ModelDownloadException on remote failure
     * @throws IOException on local file-system failure
     */
    Path fetch(String artifact, ProgressListener listener) throws IOException;

    @FunctionalInterface
    interface ProgressListener {
        /** @param bytesTotal -1 when the remote did not announce a length */
        void onProgress(long bytesDone, long bytesTotal);
    }
}

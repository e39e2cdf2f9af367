package com.phillippitts.voiceinput.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Cached knowledge about one model artifact file. Owned by the model worker; other
 * components only ever see model names.
 *
 * @param name artifact file name (e.g. {@code ggml-small.en.bin})
 * @param localPath where the artifact lives (or will live) on disk
 * @param byteSize size on disk, 0 when unknown
 * @param state download state
 */
public record ModelDescriptor(String name, Path localPath, long byteSize, DownloadState state) {

    public ModelDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(state, "state");
    }

    public ModelDescriptor withState(DownloadState next, long size) {
        return new ModelDescriptor(name, localPath, size, next);
    }
}

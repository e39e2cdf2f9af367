package com.phillippitts.voiceinput.service.audio.capture;

import java.util.Arrays;

/**
 * Growable PCM byte store bounded at a fixed capacity. Bytes past the capacity are
 * refused, so a full accumulator keeps the oldest audio. Confined to the audio worker thread.
 */
final class PcmAccumulator {

    private static final int INITIAL_CAPACITY = 64 * 1024;

    private final int limit;
    private byte[] data;
    private int size;

    PcmAccumulator(int limitBytes) {
        if (limitBytes <= 0) {
            throw new IllegalArgumentException("limitBytes must be positive: " + limitBytes);
        }
        this.limit = limitBytes;
        this.data = new byte[Math.min(INITIAL_CAPACITY, limitBytes)];
    }

    /** @return number of bytes accepted */
    int append(byte[] src, int off, int len) {
        int accepted = Math.min(len, limit - size);
        if (accepted <= 0) {
            return 0;
        }
        ensureCapacity(size + accepted);
        System.arraycopy(src, off, data, size, accepted);
        size += accepted;
        return accepted;
    }

    boolean isFull() {
        return size >= limit;
    }

    int size() {
        return size;
    }

    /** Hands out the accumulated bytes and resets to empty. */
    byte[] drain() {
        byte[] out = Arrays.copyOf(data, size);
        data = new byte[Math.min(INITIAL_CAPACITY, limit)];
        size = 0;
        return out;
    }

    void clear() {
        size = 0;
    }

    private void ensureCapacity(int needed) {
        if (needed <= data.length) {
            return;
        }
        int grown = Math.max(needed, Math.min(limit, data.length * 2));
        data = Arrays.copyOf(data, grown);
    }
}

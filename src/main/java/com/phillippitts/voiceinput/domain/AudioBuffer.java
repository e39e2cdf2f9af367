package com.phillippitts.voiceinput.domain;

import java.util.Objects;

/**
 * Owned sequence of PCM16LE samples with its sample rate and channel count.
 *
 * <p>A buffer has exactly one owner. It travels between threads only inside a channel
 * message and is read exactly once through {@link #consume()}; afterwards it is empty and
 * any further access fails fast. Instances are deliberately not thread-safe.
 */
public final class AudioBuffer {

    private static final int BYTES_PER_SAMPLE = 2;

    private byte[] pcm;
    private final int sampleRate;
    private final int channels;

    private AudioBuffer(byte[] pcm, int sampleRate, int channels) {
        this.pcm = pcm;
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    /**
     * Takes ownership of {@code pcm}; the caller must not touch the array afterwards.
     */
    public static AudioBuffer ofPcm16(byte[] pcm, int sampleRate, int channels) {
        Objects.requireNonNull(pcm, "pcm");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive: " + channels);
        }
        return new AudioBuffer(pcm, sampleRate, channels);
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int channels() {
        return channels;
    }

    public boolean isConsumed() {
        return pcm == null;
    }

    public int byteLength() {
        return pcm == null ? 0 : pcm.length;
    }

    public boolean isEmpty() {
        return byteLength() == 0;
    }

    public long durationMillis() {
        long frameBytes = (long) BYTES_PER_SAMPLE * channels;
        return (byteLength() / frameBytes) * 1000L / sampleRate;
    }

    /**
     * Hands the samples to the caller and empties this buffer.
     *
     * @throws IllegalStateException if the buffer was already consumed or discarded
     */
    public byte[] consume() {
        byte[] data = pcm;
        if (data == null) {
            throw new IllegalStateException("audio buffer already consumed");
        }
        pcm = null;
        return data;
    }

    /** Drops the samples without reading them. Idempotent. */
    public void discard() {
        pcm = null;
    }

    @Override
    public String toString() {
        return "AudioBuffer{bytes=" + byteLength() + ", rate=" + sampleRate + ", channels=" + channels
                + (isConsumed() ? ", consumed" : "") + "}";
    }
}

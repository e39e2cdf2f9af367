package com.phillippitts.voiceinput.service.audio;

/**
 * Audio format constants. Capture and inference both use 16 kHz, 16-bit signed PCM,
 * mono, little-endian; other buffers are converted before inference.
 */
public final class AudioFormat {

    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    public static final int REQUIRED_CHANNELS = 1;

    /** Java Sound flags: signed, little-endian. */
    public static final boolean REQUIRED_SIGNED = true;
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    public static final int BYTES_PER_SAMPLE = REQUIRED_BITS_PER_SAMPLE / 8;
    /** Bytes per mono frame. */
    public static final int REQUIRED_BLOCK_ALIGN = BYTES_PER_SAMPLE * REQUIRED_CHANNELS;
    /** Bytes per second at the required format (32,000). */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Byte count of {@code millis} of PCM16 audio, rounded down to a whole frame. */
    public static int bytesFor(long millis, int sampleRate, int channels) {
        long frames = millis * sampleRate / 1000L;
        return (int) Math.min(Integer.MAX_VALUE, frames * BYTES_PER_SAMPLE * channels);
    }

    public static javax.sound.sampled.AudioFormat captureFormat() {
        return new javax.sound.sampled.AudioFormat(
                REQUIRED_SAMPLE_RATE,
                REQUIRED_BITS_PER_SAMPLE,
                REQUIRED_CHANNELS,
                REQUIRED_SIGNED,
                REQUIRED_BIG_ENDIAN);
    }
}

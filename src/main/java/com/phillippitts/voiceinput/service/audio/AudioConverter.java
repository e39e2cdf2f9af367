package com.phillippitts.voiceinput.service.audio;

import com.phillippitts.voiceinput.domain.AudioBuffer;

import static com.phillippitts.voiceinput.service.audio.AudioFormat.BYTES_PER_SAMPLE;
import static com.phillippitts.voiceinput.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Converts owned PCM16LE buffers to the 16 kHz mono payload the inference engine takes.
 *
 * <p>Channels are averaged to mono; other rates are resampled by linear interpolation.
 * Conversion consumes the buffer.
 */
public final class AudioConverter {

    private AudioConverter() {}

    /**
     * @throws IllegalArgumentException when the byte length is not a whole number of frames
     * @throws IllegalStateException    when the buffer was already consumed
     */
    public static byte[] toMono16k(AudioBuffer buffer) {
        int channels = buffer.channels();
        int sampleRate = buffer.sampleRate();
        byte[] pcm = buffer.consume();
        int frameBytes = BYTES_PER_SAMPLE * channels;
        if (pcm.length % frameBytes != 0) {
            throw new IllegalArgumentException("PCM length " + pcm.length
                    + " is not a multiple of frame size " + frameBytes);
        }
        if (channels == 1 && sampleRate == REQUIRED_SAMPLE_RATE) {
            return pcm;
        }
        short[] mono = downmix(pcm, channels);
        short[] resampled = sampleRate == REQUIRED_SAMPLE_RATE ? mono : resample(mono, sampleRate, REQUIRED_SAMPLE_RATE);
        return toBytes(resampled);
    }

    static short[] downmix(byte[] pcm, int channels) {
        int frames = pcm.length / (BYTES_PER_SAMPLE * channels);
        short[] out = new short[frames];
        int pos = 0;
        for (int f = 0; f < frames; f++) {
            int sum = 0;
            for (int c = 0; c < channels; c++) {
                sum += (short) ((pcm[pos] & 0xFF) | (pcm[pos + 1] << 8));
                pos += BYTES_PER_SAMPLE;
            }
            out[f] = (short) (sum / channels);
        }
        return out;
    }

    static short[] resample(short[] in, int fromRate, int toRate) {
        if (in.length == 0) {
            return in;
        }
        int outLength = (int) ((long) in.length * toRate / fromRate);
        short[] out = new short[outLength];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outLength; i++) {
            double src = i * step;
            int idx = (int) src;
            double frac = src - idx;
            int a = in[Math.min(idx, in.length - 1)];
            int b = in[Math.min(idx + 1, in.length - 1)];
            out[i] = (short) Math.round(a + (b - a) * frac);
        }
        return out;
    }

    private static byte[] toBytes(short[] samples) {
        byte[] out = new byte[samples.length * BYTES_PER_SAMPLE];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) samples[i];
            out[2 * i + 1] = (byte) (samples[i] >> 8);
        }
        return out;
    }
}

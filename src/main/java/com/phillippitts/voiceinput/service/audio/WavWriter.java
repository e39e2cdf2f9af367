package com.phillippitts.voiceinput.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.voiceinput.service.audio.AudioFormat.BYTES_PER_SAMPLE;
import static com.phillippitts.voiceinput.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voiceinput.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voiceinput.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Writes minimal 44-byte-header PCM WAV files for the whisper.cpp CLI.
 */
public final class WavWriter {

    private WavWriter() {}

    /** Writes PCM16LE mono 16 kHz audio, the format whisper.cpp expects. */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) {
        writePcm16Le(pcm, REQUIRED_SAMPLE_RATE, REQUIRED_CHANNELS, wavPath);
    }

    /**
     * Writes a WAV file for a raw PCM16LE payload.
     *
     * @throws IllegalStateException if the file cannot be written
     */
    public static void writePcm16Le(byte[] pcm, int sampleRate, int channels, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        int blockAlign = BYTES_PER_SAMPLE * channels;
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);
            writeLEShort(os, 1); // PCM
            writeLEShort(os, channels);
            writeLEInt(os, sampleRate);
            writeLEInt(os, sampleRate * blockAlign);
            writeLEShort(os, blockAlign);
            writeLEShort(os, REQUIRED_BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, pcm.length);
            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}

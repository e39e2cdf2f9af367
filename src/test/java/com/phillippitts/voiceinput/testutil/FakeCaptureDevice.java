package com.phillippitts.voiceinput.testutil;

import com.phillippitts.voiceinput.service.audio.capture.CaptureDevice;

import java.util.Arrays;

/**
 * Microphone producing a constant low signal at 16 kHz mono. Each read fills the buffer
 * after a short pause so captures accumulate audio at a steady pace.
 */
public class FakeCaptureDevice implements CaptureDevice {

    private volatile boolean open;
    private volatile boolean started;

    @Override
    public void open() {
        open = true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void pause() {
        started = false;
    }

    @Override
    public int read(byte[] buffer) {
        try {
            Thread.sleep(5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
        if (!started) {
            return 0;
        }
        Arrays.fill(buffer, (byte) 1);
        return buffer.length;
    }

    @Override
    public boolean isLost() {
        return false;
    }

    @Override
    public int sampleRate() {
        return 16_000;
    }

    @Override
    public int channels() {
        return 1;
    }

    @Override
    public void close() {
        open = false;
        started = false;
    }
}

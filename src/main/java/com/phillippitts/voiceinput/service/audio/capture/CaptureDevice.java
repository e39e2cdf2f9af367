package com.phillippitts.voiceinput.service.audio.capture;

import com.phillippitts.voiceinput.exception.CaptureDeviceException;

/**
 * Microphone seen by the audio worker. Used from the audio worker thread only.
 *
 * <p>Lifecycle: {@link #open()} once, then any number of {@link #start()}/{@link #pause()}
 * cycles with {@link #read(byte[])} in between, then {@link #close()}.
 */
public interface CaptureDevice {

    /** @throws CaptureDeviceException when the device is unavailable or access is denied */
    void open();

    boolean isOpen();

    /** Starts (or resumes) delivery of samples, discarding anything buffered while paused. */
    void start();

    void pause();

    /**
     * Blocks until up to {@code buffer.length} bytes of PCM16LE are available.
     *
     * @return number of bytes read; 0 when nothing arrived
     * @throws CaptureDeviceException when the device fails mid-read
     */
    int read(byte[] buffer);

    /** True once the OS or driver signalled that the device went away. */
    boolean isLost();

    int sampleRate();

    int channels();

    /** Releases the device. Idempotent. */
    void close();
}

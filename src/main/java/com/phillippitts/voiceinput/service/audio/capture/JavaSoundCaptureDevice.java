package com.phillippitts.voiceinput.service.audio.capture;

import com.phillippitts.voiceinput.config.audio.AudioCaptureProperties;
import com.phillippitts.voiceinput.exception.CaptureDeviceException;
import com.phillippitts.voiceinput.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone producing PCM16LE mono at 16 kHz.
 *
 * <p>Loss is detected two ways: the line reports a CLOSE we did not ask for, or it
 * returns nothing for {@code lostAfterEmptyReads} consecutive reads while started.
 */
public class JavaSoundCaptureDevice implements CaptureDevice {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureDevice.class);

    /** Opens a TargetDataLine; replaced in tests. */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    private TargetDataLine line;
    private volatile boolean lost;
    private volatile boolean closing;
    private int emptyReads;

    public JavaSoundCaptureDevice(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundCaptureDevice(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void open() {
        if (line != null) {
            return;
        }
        try {
            TargetDataLine opened = provider.open(AudioFormat.captureFormat(), Optional.ofNullable(props.getDeviceName()));
            opened.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.CLOSE && !closing) {
                    LOG.warn("Capture line closed by the system");
                    lost = true;
                }
            });
            line = opened;
            lost = false;
            emptyReads = 0;
            LOG.info("Microphone opened (device='{}')",
                    props.getDeviceName() != null ? props.getDeviceName() : "default");
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new CaptureDeviceException(CaptureDeviceException.MIC_UNAVAILABLE,
                    "Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new CaptureDeviceException(CaptureDeviceException.MIC_PERMISSION_DENIED,
                    "Microphone access denied: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return line != null && line.isOpen();
    }

    @Override
    public void start() {
        requireLine();
        line.flush();
        line.start();
        emptyReads = 0;
    }

    @Override
    public void pause() {
        if (line != null) {
            line.stop();
            line.flush();
        }
    }

    @Override
    public int read(byte[] buffer) {
        requireLine();
        if (!line.isOpen()) {
            lost = true;
            return 0;
        }
        int n;
        try {
            n = line.read(buffer, 0, buffer.length);
        } catch (RuntimeException e) {
            throw new CaptureDeviceException(CaptureDeviceException.CAPTURE_ERROR, "Capture read failed: " + e.getMessage(), e);
        }
        if (n <= 0) {
            if (++emptyReads >= props.getLostAfterEmptyReads()) {
                LOG.warn("No audio for {} consecutive reads; treating device as lost", emptyReads);
                lost = true;
            }
            return 0;
        }
        emptyReads = 0;
        return n;
    }

    @Override
    public boolean isLost() {
        return lost;
    }

    @Override
    public int sampleRate() {
        return AudioFormat.REQUIRED_SAMPLE_RATE;
    }

    @Override
    public int channels() {
        return AudioFormat.REQUIRED_CHANNELS;
    }

    @Override
    public void close() {
        TargetDataLine l = line;
        if (l == null) {
            return;
        }
        closing = true;
        try {
            l.stop();
            l.close();
            LOG.info("Microphone closed");
        } finally {
            line = null;
            closing = false;
            lost = false;
        }
    }

    private void requireLine() {
        if (line == null) {
            throw new CaptureDeviceException(CaptureDeviceException.CAPTURE_ERROR, "Capture device not open");
        }
    }
}

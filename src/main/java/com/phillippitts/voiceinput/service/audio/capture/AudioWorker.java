package com.phillippitts.voiceinput.service.audio.capture;

import com.phillippitts.voiceinput.config.audio.AudioCaptureProperties;
import com.phillippitts.voiceinput.domain.AudioBuffer;
import com.phillippitts.voiceinput.domain.command.AudioCommand;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.exception.CaptureDeviceException;
import com.phillippitts.voiceinput.service.audio.AudioFormat;
import com.phillippitts.voiceinput.service.channel.CommandChannel;
import com.phillippitts.voiceinput.service.channel.EventChannel;
import com.phillippitts.voiceinput.service.worker.AbstractWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Exclusive owner of the capture device.
 *
 * <p>{@code Start} opens (or resumes) the device and reads chunks into a private
 * accumulator bounded at {@code audio.capture.max-duration-ms}, checking the command
 * channel between chunks. {@code Stop} or reaching the bound hands the samples out as
 * {@link AppEvent.AudioCaptured}; the worker keeps no reference to them. Device loss
 * during capture yields {@link AppEvent.RecordingStoppedByDevice} and the device is
 * closed so the next {@code Start} reopens it.
 */
public class AudioWorker extends AbstractWorker<AudioCommand> {

    private static final Logger LOG = LogManager.getLogger(AudioWorker.class);

    public static final String COMPONENT = "audio-worker";

    private final CaptureDevice device;
    private final AudioCaptureProperties props;

    public AudioWorker(CommandChannel<AudioCommand> commands,
                       EventChannel events,
                       CaptureDevice device,
                       AudioCaptureProperties props) {
        super(COMPONENT, commands, events);
        this.device = Objects.requireNonNull(device, "device");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    protected boolean handle(AudioCommand command) {
        if (command instanceof AudioCommand.Start) {
            return capture();
        }
        if (command instanceof AudioCommand.Stop) {
            LOG.info("Stop received while idle; nothing to hand over");
            return true;
        }
        if (command instanceof AudioCommand.Shutdown) {
            LOG.info("Shutdown received");
            return false;
        }
        LOG.warn("Unknown command {}", command);
        return true;
    }

    /** @return false when a shutdown arrived mid-capture */
    private boolean capture() {
        try {
            if (!device.isOpen()) {
                device.open();
            }
            device.start();
        } catch (CaptureDeviceException e) {
            LOG.warn("Recording could not start [{}]: {}", e.getReason(), e.getMessage());
            closeQuietly();
            emit(new AppEvent.RecordingNeverStarted(describe(e)));
            return true;
        }

        int rate = device.sampleRate();
        int channels = device.channels();
        int chunkBytes = Math.max(AudioFormat.BYTES_PER_SAMPLE * channels,
                AudioFormat.bytesFor(props.getChunkMillis(), rate, channels));
        PcmAccumulator accumulator = new PcmAccumulator(AudioFormat.bytesFor(props.getMaxDurationMs(), rate, channels));
        byte[] chunk = new byte[chunkBytes];
        LOG.info("Recording started ({} Hz, {} ch)", rate, channels);

        while (true) {
            AudioCommand pending = commands().poll();
            if (pending instanceof AudioCommand.Stop) {
                device.pause();
                handOver(accumulator, rate, channels, "stop");
                return true;
            }
            if (pending instanceof AudioCommand.Shutdown) {
                device.pause();
                LOG.info("Shutdown during recording; discarding {} bytes", accumulator.size());
                accumulator.clear();
                return false;
            }
            if (pending instanceof AudioCommand.Start) {
                LOG.debug("Already recording; ignoring Start");
            }

            int n;
            try {
                n = device.read(chunk);
            } catch (CaptureDeviceException e) {
                return deviceLost(accumulator, describe(e));
            }
            if (device.isLost()) {
                return deviceLost(accumulator, "microphone disconnected");
            }
            if (n > 0) {
                accumulator.append(chunk, 0, n);
                if (accumulator.isFull()) {
                    LOG.info("Max capture duration reached ({} ms)", props.getMaxDurationMs());
                    device.pause();
                    handOver(accumulator, rate, channels, "limit");
                    return true;
                }
            }
        }
    }

    private void handOver(PcmAccumulator accumulator, int rate, int channels, String cause) {
        AudioBuffer buffer = AudioBuffer.ofPcm16(accumulator.drain(), rate, channels);
        LOG.info("Recording finished on {}: {} ms captured", cause, buffer.durationMillis());
        emit(new AppEvent.AudioCaptured(buffer));
    }

    private boolean deviceLost(PcmAccumulator accumulator, String reason) {
        LOG.warn("Device lost during capture: {}; discarding {} bytes", reason, accumulator.size());
        accumulator.clear();
        closeQuietly();
        emit(new AppEvent.RecordingStoppedByDevice(reason));
        return true;
    }

    private void closeQuietly() {
        try {
            device.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close capture device: {}", e.toString());
        }
    }

    private static String describe(CaptureDeviceException e) {
        return switch (e.getReason()) {
            case CaptureDeviceException.MIC_PERMISSION_DENIED -> "microphone access denied";
            case CaptureDeviceException.MIC_UNAVAILABLE -> "microphone unavailable";
            case CaptureDeviceException.DEVICE_LOST -> "microphone disconnected";
            default -> "capture error";
        };
    }

    @Override
    protected void onExit() {
        closeQuietly();
    }
}

package com.phillippitts.voiceinput.service.audio;

import com.phillippitts.voiceinput.domain.AudioBuffer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioConverterTest {

    private static byte[] pcm(short... samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) samples[i];
            out[2 * i + 1] = (byte) (samples[i] >> 8);
        }
        return out;
    }

    private static short sampleAt(byte[] pcm, int index) {
        return (short) ((pcm[2 * index] & 0xFF) | (pcm[2 * index + 1] << 8));
    }

    @Test
    void mono16kPassesThroughUntouched() {
        byte[] input = pcm((short) 1, (short) -2, (short) 300);
        AudioBuffer buffer = AudioBuffer.ofPcm16(input, 16_000, 1);

        byte[] out = AudioConverter.toMono16k(buffer);

        assertThat(out).isSameAs(input);
        assertThat(buffer.isConsumed()).isTrue();
    }

    @Test
    void stereoIsAveragedToMono() {
        AudioBuffer buffer = AudioBuffer.ofPcm16(pcm((short) 100, (short) 300, (short) -1000, (short) 1000), 16_000, 2);

        byte[] out = AudioConverter.toMono16k(buffer);

        assertThat(out).hasSize(4);
        assertThat(sampleAt(out, 0)).isEqualTo((short) 200);
        assertThat(sampleAt(out, 1)).isEqualTo((short) 0);
    }

    @Test
    void higherRateIsDownsampled() {
        short[] samples = new short[48];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (short) (i * 10);
        }
        AudioBuffer buffer = AudioBuffer.ofPcm16(pcm(samples), 48_000, 1);

        byte[] out = AudioConverter.toMono16k(buffer);

        assertThat(out).hasSize(16 * 2);
        assertThat(sampleAt(out, 0)).isEqualTo((short) 0);
        assertThat(sampleAt(out, 1)).isEqualTo((short) 30);
    }

    @Test
    void lowerRateIsUpsampledByInterpolation() {
        short[] out = AudioConverter.resample(new short[] {0, 100}, 8_000, 16_000);

        assertThat(out).containsExactly((short) 0, (short) 50, (short) 100, (short) 100);
    }

    @Test
    void partialFrameIsRejected() {
        AudioBuffer buffer = AudioBuffer.ofPcm16(new byte[3], 16_000, 1);

        assertThatThrownBy(() -> AudioConverter.toMono16k(buffer))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("frame size");
    }
}

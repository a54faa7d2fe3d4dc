package com.phillippitts.denoisebatch.service.engine.spectral;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.NoiseWindow;
import com.phillippitts.denoisebatch.domain.SpectralGateConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.OutOfRangeException;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;
import com.phillippitts.denoisebatch.testutil.TestAudio;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpectralGateEngineTest {

    private static final int RATE = 16_000;

    private SpectralGateEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SpectralGateEngine();
        engine.initialize();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void frameSizeShouldFollowSampleRate() {
        assertThat(SpectralGateEngine.frameSizeFor(8_000)).isEqualTo(512);
        assertThat(SpectralGateEngine.frameSizeFor(16_000)).isEqualTo(1024);
        assertThat(SpectralGateEngine.frameSizeFor(44_100)).isEqualTo(2048);
        assertThat(SpectralGateEngine.frameSizeFor(48_000)).isEqualTo(4096);
        assertThat(SpectralGateEngine.frameSizeFor(192_000)).isEqualTo(4096);
    }

    @Test
    void shouldRejectLowSampleRate() {
        assertThatThrownBy(() -> engine.prepare(SpectralGateConfig.defaults(), new StreamInfo(4_000, 1)))
                .isInstanceOf(UnsupportedConfigurationException.class)
                .hasMessageContaining("4000 Hz");
    }

    @Test
    void shouldRejectTooManyChannels() {
        assertThatThrownBy(() -> engine.prepare(SpectralGateConfig.defaults(), new StreamInfo(RATE, 9)))
                .isInstanceOf(UnsupportedConfigurationException.class)
                .hasMessageContaining("9 channels");
    }

    @Test
    void shouldPreserveLengthForUnalignedBuffers() {
        EngineHandle handle = engine.prepare(SpectralGateConfig.defaults(), new StreamInfo(RATE, 2));
        AudioBuffer input = TestAudio.noise(RATE, 2, 0.75, 0.1, 7L);

        List<AudioBuffer> outputs = new ArrayList<>();
        for (int from = 0; from < input.frames(); from += 3_000) {
            AudioBuffer chunk = input.slice(from, Math.min(input.frames(), from + 3_000));
            AudioBuffer out = engine.process(handle, chunk);
            assertThat(out.frames()).isEqualTo(chunk.frames());
            assertThat(out.channels()).isEqualTo(2);
            outputs.add(out);
        }

        assertThat(AudioBuffer.concat(outputs, 2, RATE).frames()).isEqualTo(input.frames());
        assertThat(engine.finish(handle).isEmpty()).isTrue();
    }

    @Test
    void zeroReductionShouldBeTransparent() {
        SpectralGateConfig config = new SpectralGateConfig(0.0, true, 0.1, 0.1, 1.0, 0.5);
        EngineHandle handle = engine.prepare(config, new StreamInfo(RATE, 1));
        AudioBuffer input = TestAudio.noise(RATE, 1, 0.5, 0.3, 11L);

        AudioBuffer out = engine.process(handle, input);

        for (int i = 0; i < input.frames(); i++) {
            assertThat(out.sample(i, 0)).isCloseTo(input.sample(i, 0), within(1e-4f));
        }
    }

    @Test
    void stationaryNoiseShouldBeAttenuatedAfterLearning() {
        SpectralGateConfig config = new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 1.0);
        EngineHandle handle = engine.prepare(config, new StreamInfo(RATE, 1));
        AudioBuffer input = TestAudio.noise(RATE, 1, 3.0, 0.2, 42L);

        AudioBuffer out = engine.process(handle, input);

        double inRms = rms(input, 2 * RATE, 3 * RATE, 0);
        double outRms = rms(out, 2 * RATE, 3 * RATE, 0);
        assertThat(outRms).isLessThan(inRms * 0.5);
    }

    @Test
    void manualNoiseWindowShouldAttenuateFromTheFirstFrame() {
        SpectralGateConfig config = new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 1.0, 0.0, 1.0);
        EngineHandle handle = engine.prepare(config, new StreamInfo(RATE, 1));
        engine.learnNoise(handle, TestAudio.noise(RATE, 1, 1.0, 0.2, 1L));
        AudioBuffer input = TestAudio.noise(RATE, 1, 1.0, 0.2, 2L);

        AudioBuffer out = engine.process(handle, input);

        double inRms = rms(input, 1024, RATE, 0);
        double outRms = rms(out, 1024, RATE, 0);
        assertThat(outRms).isLessThan(inRms * 0.5);
    }

    @Test
    void noiseWindowShouldRequireBothBoundsAndAUsableSpan() {
        assertThatThrownBy(() -> new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 0.5, 1.0, null))
                .isInstanceOf(OutOfRangeException.class)
                .hasMessageContaining("together");
        assertThatThrownBy(() -> new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 0.5, 2.0, 2.01))
                .isInstanceOf(OutOfRangeException.class);
        assertThatThrownBy(() -> new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 0.5, -1.0, 1.0))
                .isInstanceOf(OutOfRangeException.class);
        assertThat(new SpectralGateConfig(20.0, true, 0.1, 0.1, 1.0, 0.5, 1.0, 3.0).noiseWindow())
                .contains(new NoiseWindow(1.0, 3.0));
        assertThat(SpectralGateConfig.defaults().noiseWindow()).isEmpty();
    }

    @Test
    void toneAboveNoiseFloorShouldPass() {
        // 1000 Hz at 16 kHz falls exactly on bin 64 of a 1024-point frame
        SpectralGateConfig config = new SpectralGateConfig(20.0, true, 0.0, 0.0, 1.0, 0.5);
        EngineHandle handle = engine.prepare(config, new StreamInfo(RATE, 1));
        AudioBuffer noise = TestAudio.noise(RATE, 1, 2.0, 0.01, 3L);
        AudioBuffer tone = TestAudio.sine(RATE, 1, 1.0, 1000.0, 0.5);
        float[] mixed = noise.samples().clone();
        for (int i = 0; i < tone.frames(); i++) {
            mixed[RATE + i] += tone.samples()[i];
        }
        AudioBuffer input = new AudioBuffer(mixed, 1, RATE);

        AudioBuffer out = engine.process(handle, input);

        int from = (int) (1.2 * RATE);
        double inRms = rms(input, from, 2 * RATE, 0);
        double outRms = rms(out, from, 2 * RATE, 0);
        assertThat(outRms).isCloseTo(inRms, within(inRms * 0.1));
    }

    @Test
    void silentChannelShouldStaySilent() {
        EngineHandle handle = engine.prepare(SpectralGateConfig.defaults(), new StreamInfo(RATE, 2));
        AudioBuffer left = TestAudio.noise(RATE, 1, 0.5, 0.2, 5L);
        float[] samples = new float[left.frames() * 2];
        for (int i = 0; i < left.frames(); i++) {
            samples[i * 2] = left.samples()[i];
        }

        AudioBuffer out = engine.process(handle, new AudioBuffer(samples, 2, RATE));

        assertThat(rms(out, 0, out.frames(), 1)).isZero();
    }

    @Test
    void adaptiveModeShouldProduceFiniteOutput() {
        SpectralGateConfig config = new SpectralGateConfig(30.0, false, 0.5, 0.5, 0.8, 0.5);
        EngineHandle handle = engine.prepare(config, new StreamInfo(RATE, 1));
        AudioBuffer input = TestAudio.noise(RATE, 1, 1.0, 0.2, 9L);

        AudioBuffer out = engine.process(handle, input);

        for (float s : out.samples()) {
            assertThat(Float.isFinite(s)).isTrue();
        }
        // whole frames only: per-frame gains never add energy
        int from = 8 * 1024;
        int to = 15 * 1024;
        assertThat(rms(out, from, to, 0)).isLessThanOrEqualTo(rms(input, from, to, 0) + 1e-6);
    }

    private static double rms(AudioBuffer buffer, int from, int to, int channel) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            double s = buffer.sample(i, channel);
            sum += s * s;
        }
        return Math.sqrt(sum / Math.max(1, to - from));
    }
}

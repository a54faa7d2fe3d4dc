package com.phillippitts.denoisebatch.service.audio;

import com.phillippitts.denoisebatch.domain.AudioBuffer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AudioConversionsTest {

    @Test
    void fitFramesShouldPadWithSilenceOrTruncate() {
        AudioBuffer stereo = new AudioBuffer(new float[] {1, 2, 3, 4}, 2, 8_000);

        assertThat(AudioConversions.fitFrames(stereo, 3).samples()).containsExactly(1, 2, 3, 4, 0, 0);
        assertThat(AudioConversions.fitFrames(stereo, 1).samples()).containsExactly(1, 2);
        assertThat(AudioConversions.fitFrames(stereo, 2)).isSameAs(stereo);
    }

    @Test
    void monoShouldBeDuplicatedAcrossChannels() {
        AudioBuffer mono = new AudioBuffer(new float[] {0.1f, 0.2f}, 1, 8_000);

        AudioBuffer stereo = AudioConversions.toChannels(mono, 2);

        assertThat(stereo.channels()).isEqualTo(2);
        assertThat(stereo.samples()).containsExactly(0.1f, 0.1f, 0.2f, 0.2f);
    }

    @Test
    void multichannelShouldBeAveraged() {
        AudioBuffer stereo = new AudioBuffer(new float[] {0.2f, 0.4f, -1f, 1f}, 2, 8_000);

        AudioBuffer mono = AudioConversions.toChannels(stereo, 1);

        assertThat(mono.samples()[0]).isCloseTo(0.3f, within(1e-6f));
        assertThat(mono.samples()[1]).isZero();
    }

    @Test
    void resampleShouldScaleFrameCountAndKeepLevel() {
        float[] samples = new float[2_205 * 2];
        Arrays.fill(samples, 0.4f);
        AudioBuffer in = new AudioBuffer(samples, 2, 22_050);

        AudioBuffer out = AudioConversions.resample(in, 44_100);

        assertThat(out.frames()).isEqualTo(4_410);
        assertThat(out.sampleRate()).isEqualTo(44_100);
        assertThat(out.sample(1_000, 1)).isCloseTo(0.4f, within(1e-6f));
    }

    @Test
    void resampleShouldInterpolateLinearly() {
        AudioBuffer in = new AudioBuffer(new float[] {0f, 1f}, 1, 8_000);

        AudioBuffer out = AudioConversions.resample(in, 16_000);

        assertThat(out.samples()).containsExactly(0f, 0.5f, 1f, 1f);
    }

    @Test
    void mixShouldBlendWetAndDry() {
        AudioBuffer processed = new AudioBuffer(new float[] {0f, 1f}, 1, 8_000);
        AudioBuffer original = new AudioBuffer(new float[] {1f, 1f}, 1, 8_000);

        assertThat(AudioConversions.mix(processed, original, 0.25).samples()).containsExactly(0.75f, 1f);
        assertThat(AudioConversions.mix(processed, original, 1.0)).isSameAs(processed);
    }

    @Test
    void mixShouldRejectLengthMismatch() {
        AudioBuffer a = new AudioBuffer(new float[2], 1, 8_000);
        AudioBuffer b = new AudioBuffer(new float[3], 1, 8_000);

        assertThatThrownBy(() -> AudioConversions.mix(a, b, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

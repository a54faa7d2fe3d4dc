package com.phillippitts.denoisebatch.service.engine.spectral;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FftTest {

    @Test
    void inverseShouldRestoreSignal() {
        Random random = new Random(1L);
        double[] re = new double[256];
        double[] im = new double[256];
        double[] original = new double[256];
        for (int i = 0; i < re.length; i++) {
            re[i] = random.nextGaussian();
            original[i] = re[i];
        }

        Fft.transform(re, im, false);
        Fft.transform(re, im, true);

        for (int i = 0; i < re.length; i++) {
            assertThat(re[i]).isCloseTo(original[i], within(1e-9));
            assertThat(im[i]).isCloseTo(0.0, within(1e-9));
        }
    }

    @Test
    void cosineShouldLandInSingleBin() {
        int n = 64;
        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = Math.cos(2 * Math.PI * 4 * i / n);
        }

        Fft.transform(re, im, false);

        assertThat(Math.hypot(re[4], im[4])).isCloseTo(n / 2.0, within(1e-9));
        assertThat(Math.hypot(re[5], im[5])).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void shouldRejectNonPowerOfTwo() {
        assertThatThrownBy(() -> Fft.transform(new double[100], new double[100], false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Fft.nextPowerOfTwo(736)).isEqualTo(1024);
        assertThat(Fft.isPowerOfTwo(1024)).isTrue();
    }
}

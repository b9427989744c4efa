package io.github.yok.pwfa.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WakeDiagnostics")
class WakeDiagnosticsTest {

    private static final int N = 9;

    private static double[] uniform(double v) {
        double[] rho = new double[N * N];
        Arrays.fill(rho, v);
        return rho;
    }

    private static double[] checkerboard(double amplitude) {
        double[] rho = new double[N * N];
        for (int i = 0; i < N; i++) {
            for (int j = 0; j < N; j++) {
                rho[i * N + j] = (i + j) % 2 == 0 ? amplitude : -amplitude;
            }
        }
        return rho;
    }

    @Nested
    @DisplayName("ノイズ指標 zn")
    class Noise {

        @Test
        @DisplayName("一様な rho は平滑化しても変わらないので zn は 0")
        void uniformHasNoNoise() {
            WakeDiagnostics wake = new WakeDiagnostics(N, 0.2);

            assertThat(wake.noiseLevel(uniform(-1.0))).isCloseTo(0.0, within(1e-9));
        }

        @Test
        @DisplayName("格子間隔の市松模様はほぼ全量が高周波成分になる")
        void checkerboardIsNoise() {
            WakeDiagnostics wake = new WakeDiagnostics(N, 0.2);
            double amplitude = WakeDiagnostics.NOISE_NORMALIZATION;

            double zn = wake.noiseLevel(checkerboard(amplitude));

            assertThat(zn).isGreaterThan(0.5).isLessThan(1.5);
        }

        @Test
        @DisplayName("記録する zn はそれまでの最大値")
        void keepsRunningMaximum() {
            WakeDiagnostics wake = new WakeDiagnostics(N, 0.2);

            wake.record(1, -0.1, 0.0, checkerboard(1e-3));
            wake.record(2, -0.2, 0.0, uniform(0.0));

            List<WakeDiagnostics.Row> rows = wake.rows();
            assertThat(rows.get(0).getMaxNoise()).isPositive();
            assertThat(rows.get(1).getMaxNoise()).isEqualTo(rows.get(0).getMaxNoise());
        }
    }

    @Test
    @DisplayName("Ez のピークは厳密な極大で確定し、最初のピークとの相対偏差を記録する")
    void tracksEzPeaks() {
        WakeDiagnostics wake = new WakeDiagnostics(N, 0.2);
        double[] ez = {0.0, 1.0, 0.5, 1.1, 0.2};
        for (int k = 0; k < ez.length; k++) {
            wake.record(k + 1, -0.1 * (k + 1), ez[k], uniform(0.0));
        }

        List<WakeDiagnostics.Row> rows = wake.rows();
        assertThat(rows.get(1).getEzPeak()).isNull();
        assertThat(rows.get(1).getEzPeakDeviationPercent()).isNull();
        assertThat(rows.get(2).getEzPeak()).isEqualTo(1.0);
        assertThat(rows.get(2).getEzPeakDeviationPercent()).isZero();
        assertThat(rows.get(3).getEzPeak()).isEqualTo(1.0);
        assertThat(rows.get(4).getEzPeak()).isEqualTo(1.1);
        assertThat(rows.get(4).getEzPeakDeviationPercent()).isCloseTo(10.0, within(1e-9));
    }
}

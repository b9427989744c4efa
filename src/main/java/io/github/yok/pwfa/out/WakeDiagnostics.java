package io.github.yok.pwfa.out;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 毎スライスの軸上 Ez と電荷密度のノイズ指標を蓄積するクラスです。
 *
 * <p>
 * ノイズ指標 zn は、rho からガウシアン平滑化（σ = 0.25 / h セル、反射境界）した rho を引いた高周波成分の絶対値平均を
 * {@link #NOISE_NORMALIZATION} で割った値で、これまでの最大値を記録します。 Ez のピークは軸上 Ez 履歴の厳密な極大値で、最新のピーク値と最初のピークに対する相対偏差
 * (%) を記録します。
 * </p>
 */
final class WakeDiagnostics {

    /**
     * zn の正規化定数です。
     */
    static final double NOISE_NORMALIZATION = 4.23045376e-04;

    /**
     * ガウシアン核の打ち切り幅（σ 単位）です。
     */
    private static final double TRUNCATE = 4.0;

    private final int steps;
    private final double[] kernel;
    private final List<Row> rows = new ArrayList<>();

    private double maxNoise = 0.0;
    private double firstPeak = Double.NaN;
    private double lastPeak = Double.NaN;

    /**
     * 1 スライス分の診断値です。
     */
    @Value
    static class Row {
        int slice;
        double xi;
        double ez;
        double maxNoise;

        /**
         * 最新の Ez ピークです。 まだピークがなければ null です。
         */
        Double ezPeak;

        /**
         * 最初のピークに対する最新ピークの相対偏差 (%) です。 まだピークがなければ null です。
         */
        Double ezPeakDeviationPercent;
    }

    /**
     * 診断を生成します。
     *
     * @param steps 格子点数 N です
     * @param stepSize 格子間隔 h です
     */
    WakeDiagnostics(int steps, double stepSize) {
        if (steps < 1 || !(stepSize > 0.0)) {
            throw new IllegalArgumentException("steps/stepSize が不正です: " + steps + ", " + stepSize);
        }
        this.steps = steps;
        this.kernel = gaussianKernel(0.25 / stepSize);
    }

    /**
     * スライス 1 つ分の値を記録します。
     *
     * @param slice 確定後のスライス数です
     * @param xi 確定後の ξ です
     * @param ez 軸上 Ez です
     * @param rho 電荷密度（N*N、行優先）です
     */
    void record(int slice, double xi, double ez, double[] rho) {
        maxNoise = Math.max(maxNoise, noiseLevel(rho));

        // 直前の値が新しい値で極大と確定したか
        int m = rows.size();
        if (m >= 2) {
            double before = rows.get(m - 2).getEz();
            double candidate = rows.get(m - 1).getEz();
            if (candidate > before && candidate > ez) {
                if (Double.isNaN(firstPeak)) {
                    firstPeak = candidate;
                }
                lastPeak = candidate;
            }
        }

        Double peak = Double.isNaN(lastPeak) ? null : lastPeak;
        Double deviation = peak == null ? null : 100.0 * (lastPeak / firstPeak - 1.0);
        rows.add(new Row(slice, xi, ez, maxNoise, peak, deviation));
    }

    /**
     * 記録済みの行を返します。
     *
     * @return 読み取り専用の行リストです
     */
    List<Row> rows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * 1 つの rho に対する（最大化前の）ノイズ指標 zn を返します。
     *
     * @param rho 電荷密度（N*N、行優先）です
     * @return zn です
     */
    double noiseLevel(double[] rho) {
        if (rho.length != steps * steps) {
            throw new IllegalArgumentException(
                    "rho の長さが一致しません: " + rho.length + " != " + steps * steps);
        }
        double[] blurred = blurColumns(blurRows(rho));
        double sum = 0.0;
        for (int k = 0; k < rho.length; k++) {
            sum += Math.abs(rho[k] - blurred[k]);
        }
        return sum / rho.length / NOISE_NORMALIZATION;
    }

    private double[] blurRows(double[] a) {
        int r = kernel.length / 2;
        double[] out = new double[a.length];
        for (int i = 0; i < steps; i++) {
            for (int j = 0; j < steps; j++) {
                double acc = 0.0;
                for (int t = -r; t <= r; t++) {
                    acc += kernel[t + r] * a[i * steps + reflect(j + t)];
                }
                out[i * steps + j] = acc;
            }
        }
        return out;
    }

    private double[] blurColumns(double[] a) {
        int r = kernel.length / 2;
        double[] out = new double[a.length];
        for (int i = 0; i < steps; i++) {
            for (int j = 0; j < steps; j++) {
                double acc = 0.0;
                for (int t = -r; t <= r; t++) {
                    acc += kernel[t + r] * a[reflect(i + t) * steps + j];
                }
                out[i * steps + j] = acc;
            }
        }
        return out;
    }

    /**
     * 端の半セル対称な反射 (d c b a | a b c d | d c b a) でインデックスを範囲内へ戻します。
     */
    private int reflect(int idx) {
        int period = 2 * steps;
        int m = Math.floorMod(idx, period);
        return m < steps ? m : period - 1 - m;
    }

    private static double[] gaussianKernel(double sigma) {
        int radius = (int) (TRUNCATE * sigma + 0.5);
        double[] w = new double[2 * radius + 1];
        double sum = 0.0;
        for (int t = -radius; t <= radius; t++) {
            double v = Math.exp(-0.5 * (t / sigma) * (t / sigma));
            w[t + radius] = v;
            sum += v;
        }
        for (int k = 0; k < w.length; k++) {
            w[k] /= sum;
        }
        return w;
    }
}

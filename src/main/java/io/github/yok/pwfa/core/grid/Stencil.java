package io.github.yok.pwfa.core.grid;

import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 1 粒子の補間ステンシル（中心格子点と 3x3 の重み）です。
 *
 * <p>
 * 重みは x, y それぞれの 2 次スプライン重みの積で、総和は丸め誤差を除き 1 です。 同じステンシルを場の補間と電荷の堆積の両方に使うことで、自己力が生じないようにします。
 * </p>
 */
@Getter
public final class Stencil {

    private final int i;
    private final int j;
    private final int steps;
    private final double wxM;
    private final double wx0;
    private final double wxP;
    private final double wyM;
    private final double wy0;
    private final double wyP;

    /**
     * ステンシルを生成します。
     *
     * @param i 中心格子点の x インデックスです
     * @param j 中心格子点の y インデックスです
     * @param steps 1 軸あたりの格子点数です
     * @param wxM x 方向 -1 の重みです
     * @param wx0 x 方向 0 の重みです
     * @param wxP x 方向 +1 の重みです
     * @param wyM y 方向 -1 の重みです
     * @param wy0 y 方向 0 の重みです
     * @param wyP y 方向 +1 の重みです
     */
    Stencil(int i, int j, int steps, double wxM, double wx0, double wxP, double wyM, double wy0,
            double wyP) {
        this.i = i;
        this.j = j;
        this.steps = steps;
        this.wxM = wxM;
        this.wx0 = wx0;
        this.wxP = wxP;
        this.wyM = wyM;
        this.wy0 = wy0;
        this.wyP = wyP;
    }

    /**
     * 格子量をステンシル位置へ補間します。
     *
     * @param a N×N の格子量です
     * @return 補間値です
     */
    public double interpolate(DMatrixRMaj a) {
        double[] d = a.data;
        int r0 = (i - 1) * steps + j;
        int r1 = r0 + steps;
        int r2 = r1 + steps;
        return wxM * (wyM * d[r0 - 1] + wy0 * d[r0] + wyP * d[r0 + 1])
                + wx0 * (wyM * d[r1 - 1] + wy0 * d[r1] + wyP * d[r1 + 1])
                + wxP * (wyM * d[r2 - 1] + wy0 * d[r2] + wyP * d[r2 + 1]);
    }

    /**
     * 値をステンシルの重みで格子配列へ加算します。
     *
     * @param data 行優先（index = i * N + j）の格子配列です
     * @param value 加算する値です
     */
    public void deposit(double[] data, double value) {
        int r0 = (i - 1) * steps + j;
        int r1 = r0 + steps;
        int r2 = r1 + steps;

        double vM = value * wxM;
        double v0 = value * wx0;
        double vP = value * wxP;

        data[r0 - 1] += vM * wyM;
        data[r0] += vM * wy0;
        data[r0 + 1] += vM * wyP;
        data[r1 - 1] += v0 * wyM;
        data[r1] += v0 * wy0;
        data[r1 + 1] += v0 * wyP;
        data[r2 - 1] += vP * wyM;
        data[r2] += vP * wy0;
        data[r2 + 1] += vP * wyP;
    }
}

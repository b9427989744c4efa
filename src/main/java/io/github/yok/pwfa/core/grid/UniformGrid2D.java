package io.github.yok.pwfa.core.grid;

import io.github.yok.pwfa.core.error.OutOfDomainException;

/**
 * 原点を中心格子点に置いた 2 次元の等間隔格子です。
 *
 * <p>
 * 格子点 i の座標は {@code (i - N/2) * h} です。配列は {@code index = i * N + j}（行が x、列が y）で並べます。
 * </p>
 */
public final class UniformGrid2D implements Grid {

    /**
     * 1 軸あたりの格子点数です。
     */
    private final int steps;

    /**
     * 格子間隔です。
     */
    private final double stepSize;

    /**
     * 中心格子点のインデックス（N/2）です。
     */
    private final int center;

    /**
     * 等間隔格子を生成します。
     *
     * @param steps 1 軸あたりの格子点数です（3 以上の奇数）
     * @param stepSize 格子間隔です（正）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public UniformGrid2D(int steps, double stepSize) {
        if (steps < 3 || steps % 2 == 0) {
            throw new IllegalArgumentException("steps は 3 以上の奇数が必要です: " + steps);
        }
        if (!(stepSize > 0.0)) {
            throw new IllegalArgumentException("stepSize は正の値が必要です: " + stepSize);
        }
        this.steps = steps;
        this.stepSize = stepSize;
        this.center = steps / 2;
    }

    @Override
    public int steps() {
        return steps;
    }

    @Override
    public double stepSize() {
        return stepSize;
    }

    @Override
    public double coordinateOf(int index) {
        return (index - center) * stepSize;
    }

    @Override
    public int[] cellIndex(double x, double y) {
        if (!contains(x, y)) {
            throw new OutOfDomainException(x, y, limit());
        }
        return new int[] {nearest(x), nearest(y)};
    }

    @Override
    public Stencil interpolationWeights(double x, double y) {
        if (!contains(x, y)) {
            throw new OutOfDomainException(x, y, limit());
        }

        // 中心格子点からのずれを [-0.5, 0.5) で表す
        double hx = x / stepSize + 0.5;
        double hy = y / stepSize + 0.5;
        double fx = Math.floor(hx);
        double fy = Math.floor(hy);
        double xLoc = hx - fx - 0.5;
        double yLoc = hy - fy - 0.5;

        int i = (int) fx + center;
        int j = (int) fy + center;

        // 2 次スプライン（3 点）の重み
        double wxM = 0.5 * (0.5 - xLoc) * (0.5 - xLoc);
        double wx0 = 0.75 - xLoc * xLoc;
        double wxP = 0.5 * (0.5 + xLoc) * (0.5 + xLoc);
        double wyM = 0.5 * (0.5 - yLoc) * (0.5 - yLoc);
        double wy0 = 0.75 - yLoc * yLoc;
        double wyP = 0.5 * (0.5 + yLoc) * (0.5 + yLoc);

        return new Stencil(i, j, steps, wxM, wx0, wxP, wyM, wy0, wyP);
    }

    @Override
    public boolean contains(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            return false;
        }
        int i = nearest(x);
        int j = nearest(y);
        return i >= 1 && i <= steps - 2 && j >= 1 && j <= steps - 2;
    }

    /**
     * 最近接格子点のインデックスを返します（範囲検査なし）。
     *
     * @param c 座標です
     * @return インデックスです
     */
    private int nearest(double c) {
        return (int) Math.floor(c / stepSize + 0.5) + center;
    }

    /**
     * 補間可能範囲の半幅を返します（メッセージ用）。
     *
     * @return 半幅です
     */
    private double limit() {
        return stepSize * (center - 0.5);
    }
}

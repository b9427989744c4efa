package io.github.yok.pwfa.core.particle;

import io.github.yok.pwfa.core.grid.Grid;
import java.util.Arrays;
import lombok.Getter;

/**
 * 粗粒子・細粒子の初期配置と、粗→細の双線形補間係数を保持するクラスです。
 *
 * <p>
 * 粗粒子は {@code coarseness} セルごと、細粒子は 1 セルあたり {@code fineness} 個（1 次元）の格子に置きます。 プラズマを置く範囲は格子の両端から
 * {@code paddingSteps} セル内側です。 細粒子 1 個は初期状態で自分を囲む 4 個の粗粒子から補間され、端で囲む粗粒子が欠ける場合は内側の粗粒子だけを使います。
 * 係数は x, y で共通です。
 * </p>
 */
@Getter
public final class PlasmaLattice {

    /**
     * 粗粒子の 1 次元座標（昇順）です。
     */
    private final double[] coarseGrid;

    /**
     * 細粒子の 1 次元座標（昇順）です。
     */
    private final double[] fineGrid;

    /**
     * 細粒子ごとの左側（小さい座標側）の粗粒子インデックスです。
     */
    private final int[] prevIndex;

    /**
     * 細粒子ごとの右側の粗粒子インデックスです。
     */
    private final int[] nextIndex;

    /**
     * 左側の粗粒子の影響度です。
     */
    private final double[] influencePrev;

    /**
     * 右側の粗粒子の影響度です。
     */
    private final double[] influenceNext;

    /**
     * 粗粒子間隔です。
     */
    private final double coarseStep;

    /**
     * 粗粒子 1 個あたりのセル数の平方根です。
     */
    private final int coarseness;

    /**
     * 1 セルあたりの細粒子数の平方根です。
     */
    private final int fineness;

    /**
     * 細粒子の重み縮小係数 1/(coarseness*fineness)^2 です。
     */
    private final double smallness;

    private PlasmaLattice(double[] coarseGrid, double[] fineGrid, int[] prevIndex,
            int[] nextIndex, double[] influencePrev, double[] influenceNext, double coarseStep,
            int coarseness, int fineness) {
        this.coarseGrid = coarseGrid;
        this.fineGrid = fineGrid;
        this.prevIndex = prevIndex;
        this.nextIndex = nextIndex;
        this.influencePrev = influencePrev;
        this.influenceNext = influenceNext;
        this.coarseStep = coarseStep;
        this.coarseness = coarseness;
        this.fineness = fineness;
        double cf = (double) coarseness * fineness;
        this.smallness = 1.0 / (cf * cf);
    }

    /**
     * 格子と設定値から配置を構築します。
     *
     * @param grid 横方向格子です
     * @param paddingSteps プラズマを置かない外周のセル数です
     * @param coarseness 粗さです（1 以上）
     * @param fineness 細かさです（1 以上）
     * @return 配置です
     * @throws IllegalArgumentException 粒子を置く範囲が残らない場合に発生します
     */
    public static PlasmaLattice build(Grid grid, int paddingSteps, int coarseness, int fineness) {
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        if (coarseness < 1 || fineness < 1) {
            throw new IllegalArgumentException(
                    "coarseness/fineness は 1 以上が必要です: " + coarseness + "/" + fineness);
        }
        int plasmaSteps = grid.steps() - 2 * paddingSteps;
        if (plasmaSteps / (2 * coarseness) < 1) {
            throw new IllegalArgumentException("プラズマを置く範囲がありません: plasmaSteps=" + plasmaSteps);
        }
        double h = grid.stepSize();

        double[] coarse = coarseGrid(plasmaSteps, h, coarseness);
        double[] fine = fineGrid(plasmaSteps, h, fineness);
        double coarseStep = h * coarseness;

        int nc = coarse.length;
        int nf = fine.length;
        int[] prev = new int[nf];
        int[] next = new int[nf];
        double[] infPrev = new double[nf];
        double[] infNext = new double[nf];

        for (int f = 0; f < nf; f++) {
            int idx = searchSortedLeft(coarse, fine[f]);
            next[f] = clip(idx, nc);
            prev[f] = clip(idx - 1, nc);
            infPrev[f] = (coarse[next[f]] - fine[f]) / coarseStep;
            infNext[f] = (fine[f] - coarse[prev[f]]) / coarseStep;

            // 左に粗粒子がない
            if (next[f] == 0) {
                infPrev[f] = 0.0;
                infNext[f] = 1.0;
            }
            // 右に粗粒子がない
            if (prev[f] == nc - 1) {
                infNext[f] = 0.0;
                infPrev[f] = 1.0;
            }
        }

        return new PlasmaLattice(coarse, fine, prev, next, infPrev, infNext, coarseStep, coarseness,
                fineness);
    }

    /**
     * 粗粒子の 1 次元座標を作ります（原点を含み、左右対称）。
     */
    static double[] coarseGrid(int plasmaSteps, double h, int coarseness) {
        int half = plasmaSteps / (coarseness * 2);
        double step = h * coarseness;
        double[] out = new double[2 * half - 1];
        for (int k = 0; k < half; k++) {
            out[half - 1 + k] = k * step;
            out[half - 1 - k] = -k * step;
        }
        return out;
    }

    /**
     * 細粒子の 1 次元座標を作ります。
     *
     * <p>
     * fineness が奇数なら原点を含み、偶数なら原点とセル境界を避けて半間隔ずらします。
     * </p>
     */
    static double[] fineGrid(int plasmaSteps, double h, int fineness) {
        int half = plasmaSteps / 2 * fineness;
        double step = h / fineness;
        if (fineness % 2 == 1) {
            double[] out = new double[2 * half - 1];
            for (int k = 0; k < half; k++) {
                out[half - 1 + k] = k * step;
                out[half - 1 - k] = -k * step;
            }
            return out;
        }
        double[] out = new double[2 * half];
        for (int k = 0; k < half; k++) {
            double v = (0.5 + k) * step;
            out[half + k] = v;
            out[half - 1 - k] = -v;
        }
        return out;
    }

    private static int searchSortedLeft(double[] sorted, double value) {
        int idx = Arrays.binarySearch(sorted, value);
        if (idx >= 0) {
            // 同値が並ぶことはないが、左端側に寄せる
            while (idx > 0 && sorted[idx - 1] == value) {
                idx--;
            }
            return idx;
        }
        return -idx - 1;
    }

    private static int clip(int idx, int size) {
        return Math.max(0, Math.min(size - 1, idx));
    }

    /**
     * 1 次元の粗粒子数を返します。
     *
     * @return 粗粒子数（1 次元）です
     */
    public int coarseSize() {
        return coarseGrid.length;
    }

    /**
     * 1 次元の細粒子数を返します。
     *
     * @return 細粒子数（1 次元）です
     */
    public int fineSize() {
        return fineGrid.length;
    }

    /**
     * 粗粒子 (a, b) の平坦化インデックスを返します。
     *
     * @param a x 方向インデックスです
     * @param b y 方向インデックスです
     * @return 平坦化インデックスです
     */
    public int coarseIndex(int a, int b) {
        return a * coarseGrid.length + b;
    }
}

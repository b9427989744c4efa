package io.github.yok.pwfa.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 分離可能な 2 次元楕円型方程式 {@code (-Δ + k) u = f} を固有基底で解くクラスです。
 *
 * <p>
 * {@code û = Qxᵀ f Qy} を固有値和 {@code λx + λy + k} で割り、{@code u = Qx û Qyᵀ} に戻します。 分母が 0 になるモード（Neumann
 * の零モードかつ {@code k = 0}）は 0 として捨てます。
 * </p>
 */
public final class SpectralHelmholtzSolver {

    /**
     * 零モードとみなす分母の相対閾値です。
     */
    private static final double NULL_MODE_RELATIVE = 1e-12;

    private final LaplacianEigenBasis xBasis;
    private final LaplacianEigenBasis yBasis;
    private final double[] inverseDenominators;

    /**
     * ソルバを生成し、分母の逆数を前計算します。
     *
     * @param xBasis x 方向の固有基底です
     * @param yBasis y 方向の固有基底です
     * @param shift Helmholtz 係数 k です（0 以上）
     */
    public SpectralHelmholtzSolver(LaplacianEigenBasis xBasis, LaplacianEigenBasis yBasis,
            double shift) {
        checkArgument(xBasis != null && yBasis != null, "基底は null 不可です");
        checkArgument(shift >= 0.0, "shift は 0 以上が必要です: %s", shift);
        this.xBasis = xBasis;
        this.yBasis = yBasis;

        double[] lx = xBasis.getEigenvalues();
        double[] ly = yBasis.getEigenvalues();
        double scale = lx[lx.length - 1] + ly[ly.length - 1] + shift;

        this.inverseDenominators = new double[lx.length * ly.length];
        for (int a = 0; a < lx.length; a++) {
            for (int b = 0; b < ly.length; b++) {
                double denom = lx[a] + ly[b] + shift;
                inverseDenominators[a * ly.length + b] =
                        (Math.abs(denom) <= NULL_MODE_RELATIVE * scale) ? 0.0 : 1.0 / denom;
            }
        }
    }

    /**
     * 内部格子点上の右辺から解を求めます。
     *
     * @param rhs 内部格子点上の右辺です（nx×ny）
     * @return 内部格子点上の解です（nx×ny）
     */
    public DMatrixRMaj solve(DMatrixRMaj rhs) {
        int nx = xBasis.getSize();
        int ny = yBasis.getSize();
        checkArgument(rhs.numRows == nx && rhs.numCols == ny, "右辺の形状が基底と一致しません: %sx%s",
                rhs.numRows, rhs.numCols);

        DMatrixRMaj qx = xBasis.getVectors();
        DMatrixRMaj qy = yBasis.getVectors();

        // 1) 固有基底へ変換
        DMatrixRMaj tmp = new DMatrixRMaj(nx, ny);
        CommonOps_DDRM.multTransA(qx, rhs, tmp);
        DMatrixRMaj hat = new DMatrixRMaj(nx, ny);
        CommonOps_DDRM.mult(tmp, qy, hat);

        // 2) 対角部分で割る
        double[] h = hat.data;
        for (int k = 0; k < h.length; k++) {
            h[k] *= inverseDenominators[k];
        }

        // 3) 元の基底へ戻す
        CommonOps_DDRM.mult(qx, hat, tmp);
        DMatrixRMaj out = new DMatrixRMaj(nx, ny);
        CommonOps_DDRM.multTransB(tmp, qy, out);
        return out;
    }
}

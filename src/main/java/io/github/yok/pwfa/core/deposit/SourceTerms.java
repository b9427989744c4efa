package io.github.yok.pwfa.core.deposit;

import io.github.yok.pwfa.core.error.InvalidSourceTermsException;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 1 スライス分の電荷・電流密度（rho, jx, jy, jz）と電荷保存検査用の集計値です。
 *
 * <p>
 * 各配列は N×N で、行が x 方向、列が y 方向の格子点です。
 * </p>
 */
@Getter
public final class SourceTerms {

    private final DMatrixRMaj rho;
    private final DMatrixRMaj jx;
    private final DMatrixRMaj jy;
    private final DMatrixRMaj jz;

    /**
     * 堆積した粒子電荷の総和です。
     */
    private double particleCharge;

    /**
     * 堆積した粒子電荷の絶対値の総和です。
     */
    private double absoluteCharge;

    /**
     * 配列と集計値から生成します（配列は複製しません）。
     *
     * @param rho 電荷密度です
     * @param jx 電流密度 x です
     * @param jy 電流密度 y です
     * @param jz 電流密度 z です
     * @param particleCharge 粒子電荷の総和です
     * @param absoluteCharge 粒子電荷の絶対値の総和です
     */
    public SourceTerms(DMatrixRMaj rho, DMatrixRMaj jx, DMatrixRMaj jy, DMatrixRMaj jz,
            double particleCharge, double absoluteCharge) {
        if (rho == null || jx == null || jy == null || jz == null) {
            throw new IllegalArgumentException("rho/jx/jy/jz は null 不可です");
        }
        int n = rho.getNumElements();
        if (jx.getNumElements() != n || jy.getNumElements() != n || jz.getNumElements() != n) {
            throw new IllegalArgumentException("配列サイズが一致しません");
        }
        this.rho = rho;
        this.jx = jx;
        this.jy = jy;
        this.jz = jz;
        this.particleCharge = particleCharge;
        this.absoluteCharge = absoluteCharge;
    }

    /**
     * ゼロのソース項を返します。
     *
     * @param steps 格子点数 N です
     * @return ゼロのソース項です
     */
    public static SourceTerms zeros(int steps) {
        return new SourceTerms(new DMatrixRMaj(steps, steps), new DMatrixRMaj(steps, steps),
                new DMatrixRMaj(steps, steps), new DMatrixRMaj(steps, steps), 0.0, 0.0);
    }

    /**
     * 格子点数 N を返します。
     *
     * @return 格子点数です
     */
    public int steps() {
        return rho.numRows;
    }

    /**
     * 他のソース項を自身に加算します。
     *
     * @param other 加算するソース項です
     * @return 自身です
     */
    public SourceTerms addInPlace(SourceTerms other) {
        if (other.rho.getNumElements() != rho.getNumElements()) {
            throw new IllegalArgumentException("格子サイズが一致しません");
        }
        addArray(rho.data, other.rho.data);
        addArray(jx.data, other.jx.data);
        addArray(jy.data, other.jy.data);
        addArray(jz.data, other.jz.data);
        particleCharge += other.particleCharge;
        absoluteCharge += other.absoluteCharge;
        return this;
    }

    /**
     * 単一粒子の寄与を集計値に加えます（配列への加算は呼び出し側が行います）。
     *
     * @param dq 粒子の実効電荷です
     */
    void countParticle(double dq) {
        particleCharge += dq;
        absoluteCharge += Math.abs(dq);
    }

    /**
     * 符号を反転した複製を返します。
     *
     * @return 符号反転した複製です
     */
    public SourceTerms negate() {
        SourceTerms out = copy();
        negateArray(out.rho.data);
        negateArray(out.jx.data);
        negateArray(out.jy.data);
        negateArray(out.jz.data);
        out.particleCharge = -particleCharge;
        return out;
    }

    /**
     * 格子上の電荷の総和を返します（格子点順に加算します）。
     *
     * @return 格子上の総電荷です
     */
    public double totalCharge() {
        double s = 0.0;
        for (double v : rho.data) {
            s += v;
        }
        return s;
    }

    /**
     * 格子上の総電荷と粒子電荷の総和が相対誤差内で一致することを検査します。
     *
     * @param sliceIndex スライス番号です（例外メッセージ用）
     * @param relativeTolerance 粒子電荷の絶対値総和に対する相対許容誤差です
     * @throws InvalidSourceTermsException 一致しない、または非有限値を含む場合に発生します
     */
    public void verifyChargeConservation(int sliceIndex, double relativeTolerance) {
        double grid = totalCharge();
        double tol = relativeTolerance * Math.max(absoluteCharge, Double.MIN_NORMAL);
        if (!Double.isFinite(grid) || !(Math.abs(grid - particleCharge) <= tol)) {
            throw new InvalidSourceTermsException(sliceIndex, grid, particleCharge, tol);
        }
    }

    private SourceTerms copy() {
        return new SourceTerms(rho.copy(), jx.copy(), jy.copy(), jz.copy(), particleCharge,
                absoluteCharge);
    }

    private static void addArray(double[] dst, double[] src) {
        for (int k = 0; k < dst.length; k++) {
            dst[k] += src[k];
        }
    }

    private static void negateArray(double[] a) {
        for (int k = 0; k < a.length; k++) {
            a[k] = -a[k];
        }
    }
}

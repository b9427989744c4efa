package io.github.yok.pwfa.core.field;

import io.github.yok.pwfa.core.grid.Stencil;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 1 スライス分の電磁場（Ex, Ey, Ez, Bx, By, Bz）です。
 *
 * <p>
 * 各成分は N×N の配列で、行が x 方向、列が y 方向の格子点です。
 * </p>
 */
@Getter
public final class FieldSet {

    private final DMatrixRMaj ex;
    private final DMatrixRMaj ey;
    private final DMatrixRMaj ez;
    private final DMatrixRMaj bx;
    private final DMatrixRMaj by;
    private final DMatrixRMaj bz;

    /**
     * 成分配列から生成します（配列は複製しません）。
     *
     * @param ex Ex です
     * @param ey Ey です
     * @param ez Ez です
     * @param bx Bx です
     * @param by By です
     * @param bz Bz です
     */
    public FieldSet(DMatrixRMaj ex, DMatrixRMaj ey, DMatrixRMaj ez, DMatrixRMaj bx,
            DMatrixRMaj by, DMatrixRMaj bz) {
        if (ex == null || ey == null || ez == null || bx == null || by == null || bz == null) {
            throw new IllegalArgumentException("場の成分は null 不可です");
        }
        this.ex = ex;
        this.ey = ey;
        this.ez = ez;
        this.bx = bx;
        this.by = by;
        this.bz = bz;
    }

    /**
     * 全成分 0 の場を返します。
     *
     * @param steps 格子点数 N です
     * @return ゼロ場です
     */
    public static FieldSet zeros(int steps) {
        return new FieldSet(new DMatrixRMaj(steps, steps), new DMatrixRMaj(steps, steps),
                new DMatrixRMaj(steps, steps), new DMatrixRMaj(steps, steps),
                new DMatrixRMaj(steps, steps), new DMatrixRMaj(steps, steps));
    }

    /**
     * 2 つの場の平均 (a + b) / 2 を返します。
     *
     * @param a 場 a です
     * @param b 場 b です
     * @return 平均場です
     */
    public static FieldSet average(FieldSet a, FieldSet b) {
        DMatrixRMaj[] ca = a.components();
        DMatrixRMaj[] cb = b.components();
        DMatrixRMaj[] out = new DMatrixRMaj[6];
        for (int c = 0; c < 6; c++) {
            DMatrixRMaj m = new DMatrixRMaj(ca[c].numRows, ca[c].numCols);
            double[] da = ca[c].data;
            double[] db = cb[c].data;
            for (int k = 0; k < m.data.length; k++) {
                m.data[k] = (da[k] + db[k]) / 2;
            }
            out[c] = m;
        }
        return new FieldSet(out[0], out[1], out[2], out[3], out[4], out[5]);
    }

    /**
     * 格子点数 N を返します。
     *
     * @return 格子点数です
     */
    public int steps() {
        return ex.numRows;
    }

    /**
     * 成分を Ex, Ey, Ez, Bx, By, Bz の順で返します。
     *
     * @return 成分配列です
     */
    public DMatrixRMaj[] components() {
        return new DMatrixRMaj[] {ex, ey, ez, bx, by, bz};
    }

    /**
     * 全成分の最大絶対差を返します。
     *
     * @param other 比較対象です
     * @return max |this - other| です（NaN を含む場合は NaN）
     */
    public double maxAbsDifference(FieldSet other) {
        DMatrixRMaj[] a = components();
        DMatrixRMaj[] b = other.components();
        double max = 0.0;
        for (int c = 0; c < 6; c++) {
            double[] da = a[c].data;
            double[] db = b[c].data;
            for (int k = 0; k < da.length; k++) {
                double d = Math.abs(da[k] - db[k]);
                if (Double.isNaN(d)) {
                    return Double.NaN;
                }
                if (d > max) {
                    max = d;
                }
            }
        }
        return max;
    }

    /**
     * 指定ステンシルで 6 成分を補間します。
     *
     * @param st ステンシルです
     * @param out 出力先（長さ 6：Ex, Ey, Ez, Bx, By, Bz）です
     */
    public void interpolate(Stencil st, double[] out) {
        out[0] = st.interpolate(ex);
        out[1] = st.interpolate(ey);
        out[2] = st.interpolate(ez);
        out[3] = st.interpolate(bx);
        out[4] = st.interpolate(by);
        out[5] = st.interpolate(bz);
    }
}

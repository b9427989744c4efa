package io.github.yok.pwfa.core.particle;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.app.PwfaProperties.Plasma.BoundaryPolicy;
import io.github.yok.pwfa.core.error.OutOfDomainException;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.grid.Stencil;
import io.github.yok.pwfa.core.model.SpeciesTable;
import java.util.stream.IntStream;
import lombok.Getter;

/**
 * プラズマ粒子を 1 スライス分押し出すクラスです。
 *
 * <p>
 * 場は開始位置と推定位置の中点で補間します。 運動量は 2 パスの中点キック {@code dp = q dξ / (1 - vz) (E + v × B)} で更新し、位置は半ステップの運動量で
 * {@code x += px / (gm - pz) dξ} と進めます。
 * </p>
 *
 * <p>
 * 境界 {@code b = h (N/2 - reflectPaddingSteps)} での扱いは {@link BoundaryPolicy} に従います。 ステンシルが格子から外れた粒子は除去します。
 * </p>
 */
@Getter
public final class PlasmaPusher {

    private final Grid grid;
    private final SpeciesTable speciesTable;
    private final BoundaryPolicy boundaryPolicy;

    /**
     * 反射・除去境界の位置 b です。
     */
    private final double boundary;

    /**
     * 押し出し器を生成します。
     *
     * @param grid 格子です
     * @param speciesTable 粒子種テーブルです
     * @param plasma プラズマ設定です
     */
    public PlasmaPusher(Grid grid, SpeciesTable speciesTable, PwfaProperties.Plasma plasma) {
        if (grid == null || speciesTable == null || plasma == null) {
            throw new IllegalArgumentException("grid/speciesTable/plasma は null 不可です");
        }
        this.grid = grid;
        this.speciesTable = speciesTable;
        this.boundaryPolicy = plasma.getBoundaryPolicy();
        this.boundary = grid.stepSize() * (grid.steps() / 2.0 - plasma.getReflectPaddingSteps());
        if (!(boundary > 0.0)) {
            throw new IllegalArgumentException("reflectPaddingSteps が大きすぎます: b=" + boundary);
        }
    }

    /**
     * 場を使わずに位置だけを推定します（反復の初回用）。
     *
     * <p>
     * 推定位置にも境界の扱いを適用します。 REFLECT では位置だけを鏡映し、REMOVE では推定を無効にします。
     * </p>
     *
     * @param start スライス開始時の粒子群です
     * @param sliceStep スライス刻み幅です
     * @return 推定位置を持つ新しい粒子群です
     */
    public ParticleArrays estimateWithoutFields(ParticleArrays start, double sliceStep) {
        double m = speciesTable.massOf(start.getSpecies());
        ParticleArrays out = start.copy();
        double[] x = out.getX();
        double[] y = out.getY();
        double[] px = out.getPx();
        double[] py = out.getPy();
        double[] pz = out.getPz();
        boolean[] alive = out.getAlive();

        IntStream.range(0, out.size()).parallel().forEach(k -> {
            if (!alive[k]) {
                return;
            }
            double gm = Math.sqrt(m * m + px[k] * px[k] + py[k] * py[k] + pz[k] * pz[k]);
            double xe = x[k] + px[k] / (gm - pz[k]) * sliceStep;
            double ye = y[k] + py[k] / (gm - pz[k]) * sliceStep;
            if (boundaryPolicy == BoundaryPolicy.REMOVE) {
                if (Math.abs(xe) >= boundary || Math.abs(ye) >= boundary) {
                    alive[k] = false;
                    return;
                }
            } else {
                xe = mirror(xe);
                ye = mirror(ye);
            }
            x[k] = xe;
            y[k] = ye;
        });
        return out;
    }

    /**
     * 粒子群を 1 スライス押し出します。
     *
     * @param start スライス開始時の粒子群です（変更しません）
     * @param estimate スライス終了時の位置の推定です
     * @param averagedFields 前スライスと推定の平均場です
     * @param sliceStep スライス刻み幅です
     * @return 押し出し後の新しい粒子群です
     */
    public ParticleArrays push(ParticleArrays start, ParticleArrays estimate,
            FieldSet averagedFields, double sliceStep) {
        if (start == null || estimate == null || averagedFields == null) {
            throw new IllegalArgumentException("start/estimate/averagedFields は null 不可です");
        }
        if (start.size() != estimate.size()) {
            throw new IllegalArgumentException(
                    "粒子数が一致しません: " + start.size() + " != " + estimate.size());
        }
        double q = speciesTable.chargeOf(start.getSpecies());
        double m = speciesTable.massOf(start.getSpecies());

        ParticleArrays out = start.copy();
        IntStream.range(0, out.size()).parallel()
                .forEach(k -> pushOne(start, estimate, out, k, averagedFields, q, m, sliceStep));
        return out;
    }

    private void pushOne(ParticleArrays start, ParticleArrays estimate, ParticleArrays out, int k,
            FieldSet fields, double q, double m, double d) {
        boolean[] alive = out.getAlive();
        if (!alive[k]) {
            return;
        }

        double x0 = start.getX()[k];
        double y0 = start.getY()[k];
        double xe = estimate.getAlive()[k] ? estimate.getX()[k] : x0;
        double ye = estimate.getAlive()[k] ? estimate.getY()[k] : y0;

        Stencil st;
        try {
            st = grid.interpolationWeights((x0 + xe) / 2, (y0 + ye) / 2);
        } catch (OutOfDomainException e) {
            alive[k] = false;
            return;
        }
        double[] f = new double[6];
        fields.interpolate(st, f);
        double ex = f[0];
        double ey = f[1];
        double ez = f[2];
        double bx = f[3];
        double by = f[4];
        double bz = f[5];

        double opx = start.getPx()[k];
        double opy = start.getPy()[k];
        double opz = start.getPz()[k];

        // 1 パス目: 開始時の運動量で速度を評価
        double px = opx;
        double py = opy;
        double pz = opz;
        double dpx = 0.0;
        double dpy = 0.0;
        double dpz = 0.0;
        for (int pass = 0; pass < 2; pass++) {
            double gm = Math.sqrt(m * m + px * px + py * py + pz * pz);
            double vx = px / gm;
            double vy = py / gm;
            double vz = pz / gm;
            double factor = q * d / (1.0 - vz);
            dpx = factor * (ex + vy * bz - vz * by);
            dpy = factor * (ey - vx * bz + vz * bx);
            dpz = factor * (ez + vx * by - vy * bx);
            px = opx + dpx / 2;
            py = opy + dpy / 2;
            pz = opz + dpz / 2;
        }

        double gmHalf = Math.sqrt(m * m + px * px + py * py + pz * pz);
        double x = x0 + px / (gmHalf - pz) * d;
        double y = y0 + py / (gmHalf - pz) * d;

        double npx = opx + dpx;
        double npy = opy + dpy;
        double npz = opz + dpz;

        if (boundaryPolicy == BoundaryPolicy.REMOVE) {
            if (Math.abs(x) >= boundary || Math.abs(y) >= boundary) {
                alive[k] = false;
                return;
            }
        } else {
            if (Math.abs(x) > boundary || (Math.abs(x) == boundary && x * npx > 0)) {
                npx = -npx;
            }
            if (Math.abs(y) > boundary || (Math.abs(y) == boundary && y * npy > 0)) {
                npy = -npy;
            }
            x = mirror(x);
            y = mirror(y);
        }

        if (!grid.contains(x, y)) {
            alive[k] = false;
            return;
        }

        out.getX()[k] = x;
        out.getY()[k] = y;
        out.getPx()[k] = npx;
        out.getPy()[k] = npy;
        out.getPz()[k] = npz;
    }

    /**
     * 境界 {@code ±b} を越えた座標を境界で鏡映します。
     */
    private double mirror(double c) {
        if (c > boundary) {
            return 2 * boundary - c;
        }
        if (c < -boundary) {
            return -2 * boundary - c;
        }
        return c;
    }
}

package io.github.yok.pwfa.core.particle;

import io.github.yok.pwfa.core.error.OutOfDomainException;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.grid.Stencil;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.model.SpeciesTable;
import java.util.stream.IntStream;
import lombok.Getter;

/**
 * 収束した場でビーム粒子を 1 ビーム時間刻み進めるクラスです。
 *
 * <p>
 * 各粒子は自分が進入したスライスの場で 1 回だけ進めます（中点キック）。 横方向に格子外へ出た粒子、ξ が [xiEnd, xiStart] から外れた粒子は除去します。
 * </p>
 */
@Getter
public final class BeamAdvancer {

    private final Grid grid;
    private final double charge;
    private final double mass;
    private final double timeStep;
    private final double xiStart;
    private final double xiEnd;

    /**
     * 前進器を生成します。
     *
     * @param grid 格子です
     * @param speciesTable 粒子種テーブルです
     * @param timeStep ビーム時間刻みです（正）
     * @param xiStart 計算領域の ξ 上端です
     * @param xiEnd 計算領域の ξ 下端です
     */
    public BeamAdvancer(Grid grid, SpeciesTable speciesTable, double timeStep, double xiStart,
            double xiEnd) {
        if (grid == null || speciesTable == null) {
            throw new IllegalArgumentException("grid/speciesTable は null 不可です");
        }
        if (!(timeStep > 0.0)) {
            throw new IllegalArgumentException("timeStep は正の値が必要です: " + timeStep);
        }
        this.grid = grid;
        this.charge = speciesTable.chargeOf(Species.BEAM);
        this.mass = speciesTable.massOf(Species.BEAM);
        this.timeStep = timeStep;
        this.xiStart = xiStart;
        this.xiEnd = xiEnd;
    }

    /**
     * 範囲 [from, to) の粒子を進めます。
     *
     * @param beam ビーム状態です（直接更新します）
     * @param from 開始インデックスです
     * @param to 終了インデックスです
     * @param fields スライスの収束場です
     * @return この呼び出しで除去した粒子数です
     */
    public int advance(BeamState beam, int from, int to, FieldSet fields) {
        if (beam == null || fields == null) {
            throw new IllegalArgumentException("beam/fields は null 不可です");
        }
        ParticleArrays p = beam.getParticles();
        boolean[] alive = p.getAlive();
        int before = countAlive(alive, from, to);

        IntStream.range(from, to).parallel().forEach(k -> advanceOne(beam, k, fields));

        return before - countAlive(alive, from, to);
    }

    private void advanceOne(BeamState beam, int k, FieldSet fields) {
        ParticleArrays p = beam.getParticles();
        boolean[] alive = p.getAlive();
        if (!alive[k]) {
            return;
        }
        double[] xs = p.getX();
        double[] ys = p.getY();

        Stencil st;
        try {
            st = grid.interpolationWeights(xs[k], ys[k]);
        } catch (OutOfDomainException e) {
            alive[k] = false;
            return;
        }
        double[] f = new double[6];
        fields.interpolate(st, f);

        double dt = timeStep;
        double opx = p.getPx()[k];
        double opy = p.getPy()[k];
        double opz = p.getPz()[k];

        double px = opx;
        double py = opy;
        double pz = opz;
        double dpx = 0.0;
        double dpy = 0.0;
        double dpz = 0.0;
        for (int pass = 0; pass < 2; pass++) {
            double gm = Math.sqrt(mass * mass + px * px + py * py + pz * pz);
            double vx = px / gm;
            double vy = py / gm;
            double vz = pz / gm;
            dpx = charge * dt * (f[0] + vy * f[5] - vz * f[4]);
            dpy = charge * dt * (f[1] - vx * f[5] + vz * f[3]);
            dpz = charge * dt * (f[2] + vx * f[4] - vy * f[3]);
            px = opx + dpx / 2;
            py = opy + dpy / 2;
            pz = opz + dpz / 2;
        }

        double gmHalf = Math.sqrt(mass * mass + px * px + py * py + pz * pz);
        double x = xs[k] + px / gmHalf * dt;
        double y = ys[k] + py / gmHalf * dt;
        double xi = beam.getXi()[k] + (pz / gmHalf - 1.0) * dt;

        xs[k] = x;
        ys[k] = y;
        beam.getXi()[k] = xi;
        p.getPx()[k] = opx + dpx;
        p.getPy()[k] = opy + dpy;
        p.getPz()[k] = opz + dpz;

        if (!grid.contains(x, y) || xi < xiEnd || xi > xiStart) {
            alive[k] = false;
        }
    }

    private static int countAlive(boolean[] alive, int from, int to) {
        int c = 0;
        for (int k = from; k < to; k++) {
            if (alive[k]) {
                c++;
            }
        }
        return c;
    }
}

package io.github.yok.pwfa.core.deposit;

import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.grid.Stencil;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.model.SpeciesTable;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.IntStream;
import lombok.Getter;

/**
 * 2 次スプライン形状関数で堆積するエンジンです。
 *
 * <p>
 * 粒子を固定サイズのチャンクに分けて並列に部分和を作り、チャンク順に足し合わせます。 結果はスレッド数に依存しません。
 * </p>
 */
@Getter
public final class ShapeFunctionDepositionEngine implements DepositionEngine {

    private final Grid grid;
    private final SpeciesTable speciesTable;
    private final Map<Species, ParticleChargeKernel> kernels;
    private final int chunkSize;

    /**
     * エンジンを生成します。
     *
     * @param grid 格子です
     * @param speciesTable 粒子種テーブルです
     * @param kernels 粒子種ごとのカーネルです
     * @param chunkSize チャンクあたりの粒子数です（1 以上）
     */
    public ShapeFunctionDepositionEngine(Grid grid, SpeciesTable speciesTable,
            Map<Species, ParticleChargeKernel> kernels, int chunkSize) {
        if (grid == null || speciesTable == null || kernels == null) {
            throw new IllegalArgumentException("grid/speciesTable/kernels は null 不可です");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize は 1 以上が必要です: " + chunkSize);
        }
        this.grid = grid;
        this.speciesTable = speciesTable;
        this.kernels = new EnumMap<>(kernels);
        this.chunkSize = chunkSize;
    }

    /**
     * 標準のカーネル表（プラズマ種は準静的、ビームは超相対論的）を返します。
     *
     * @return カーネル表です
     */
    public static Map<Species, ParticleChargeKernel> defaultKernels() {
        Map<Species, ParticleChargeKernel> m = new EnumMap<>(Species.class);
        ParticleChargeKernel plasma = new QuasiStaticPlasmaKernel();
        m.put(Species.PLASMA_ELECTRON, plasma);
        m.put(Species.PLASMA_ION, plasma);
        m.put(Species.BEAM, new UltraRelativisticBeamKernel());
        return m;
    }

    @Override
    public SourceTerms deposit(ParticleArrays particles, int from, int to, double sliceStep) {
        if (particles == null) {
            throw new IllegalArgumentException("particles は null 不可です");
        }
        if (from < 0 || to > particles.size() || from > to) {
            throw new IllegalArgumentException("範囲が不正です: [" + from + ", " + to + ")");
        }
        if (!(sliceStep > 0.0)) {
            throw new IllegalArgumentException("sliceStep は正の値が必要です: " + sliceStep);
        }

        Species species = particles.getSpecies();
        ParticleChargeKernel kernel = kernels.get(species);
        if (kernel == null) {
            throw new IllegalStateException("カーネルが未登録の粒子種です: " + species);
        }
        double q = speciesTable.chargeOf(species);
        double m = speciesTable.massOf(species);
        int steps = grid.steps();

        int count = to - from;
        int chunks = (count + chunkSize - 1) / chunkSize;
        SourceTerms[] partial = new SourceTerms[chunks];

        IntStream.range(0, chunks).parallel().forEach(c -> {
            int lo = from + c * chunkSize;
            int hi = Math.min(to, lo + chunkSize);
            partial[c] = depositChunk(particles, lo, hi, kernel, q, m, sliceStep, steps);
        });

        SourceTerms total = SourceTerms.zeros(steps);
        for (SourceTerms p : partial) {
            total.addInPlace(p);
        }
        return total;
    }

    private SourceTerms depositChunk(ParticleArrays p, int lo, int hi, ParticleChargeKernel kernel,
            double q, double m, double sliceStep, int steps) {
        SourceTerms s = SourceTerms.zeros(steps);
        double[] rho = s.getRho().data;
        double[] jx = s.getJx().data;
        double[] jy = s.getJy().data;
        double[] jz = s.getJz().data;
        double[] out = new double[4];

        boolean[] alive = p.getAlive();
        double[] xs = p.getX();
        double[] ys = p.getY();

        for (int k = lo; k < hi; k++) {
            if (!alive[k]) {
                continue;
            }
            kernel.contribution(p, k, q, m, sliceStep, out);
            Stencil st = grid.interpolationWeights(xs[k], ys[k]);
            st.deposit(rho, out[0]);
            st.deposit(jx, out[1]);
            st.deposit(jy, out[2]);
            st.deposit(jz, out[3]);
            s.countParticle(out[0]);
        }
        return s;
    }
}

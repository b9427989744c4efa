package io.github.yok.pwfa.core.particle;

import java.util.stream.IntStream;

/**
 * 粗粒子群から細粒子群を生成する純粋関数です。
 *
 * <p>
 * 位置の初期配置からのずれ、運動量、重みを 4 個の粗粒子から双線形補間し、重みには縮小係数を掛けます。 補間に寄与する粗粒子が除去済みの細粒子は生成しません（除去済みとして返します）。
 * </p>
 */
public final class FineParticleRefiner {

    /**
     * 細粒子群を生成します。
     *
     * @param coarse 粗粒子群です
     * @param lattice 初期配置です
     * @return 細粒子群です（新しい配列）
     */
    public ParticleArrays refine(ParticleArrays coarse, PlasmaLattice lattice) {
        if (coarse == null || lattice == null) {
            throw new IllegalArgumentException("coarse/lattice は null 不可です");
        }
        int nc = lattice.coarseSize();
        if (coarse.size() != nc * nc) {
            throw new IllegalArgumentException("粗粒子数が配置と一致しません: " + coarse.size());
        }

        int nf = lattice.fineSize();
        ParticleArrays fine = new ParticleArrays(coarse.getSpecies(), nf * nf);

        double[] cGrid = lattice.getCoarseGrid();
        double[] fGrid = lattice.getFineGrid();
        int[] prev = lattice.getPrevIndex();
        int[] next = lattice.getNextIndex();
        double[] wPrev = lattice.getInfluencePrev();
        double[] wNext = lattice.getInfluenceNext();
        double smallness = lattice.getSmallness();

        double[] cx = coarse.getX();
        double[] cy = coarse.getY();
        double[] cpx = coarse.getPx();
        double[] cpy = coarse.getPy();
        double[] cpz = coarse.getPz();
        double[] cw = coarse.getWeight();
        boolean[] calive = coarse.getAlive();

        double[] fx = fine.getX();
        double[] fy = fine.getY();
        double[] fpx = fine.getPx();
        double[] fpy = fine.getPy();
        double[] fpz = fine.getPz();
        double[] fw = fine.getWeight();
        boolean[] falive = fine.getAlive();

        IntStream.range(0, nf).parallel().forEach(fa -> {
            int[] ax = {prev[fa], prev[fa], next[fa], next[fa]};
            double[] wx = {wPrev[fa], wPrev[fa], wNext[fa], wNext[fa]};
            int[] corner = new int[4];
            double[] w = new double[4];

            for (int fb = 0; fb < nf; fb++) {
                int k = fa * nf + fb;
                corner[0] = ax[0] * nc + prev[fb];
                corner[1] = ax[1] * nc + next[fb];
                corner[2] = ax[2] * nc + prev[fb];
                corner[3] = ax[3] * nc + next[fb];
                w[0] = wx[0] * wPrev[fb];
                w[1] = wx[1] * wNext[fb];
                w[2] = wx[2] * wPrev[fb];
                w[3] = wx[3] * wNext[fb];

                boolean ok = true;
                double dx = 0.0;
                double dy = 0.0;
                double px = 0.0;
                double py = 0.0;
                double pz = 0.0;
                double weight = 0.0;
                for (int c = 0; c < 4; c++) {
                    if (w[c] == 0.0) {
                        continue;
                    }
                    int ci = corner[c];
                    if (!calive[ci]) {
                        ok = false;
                        break;
                    }
                    dx += w[c] * (cx[ci] - cGrid[ci / nc]);
                    dy += w[c] * (cy[ci] - cGrid[ci % nc]);
                    px += w[c] * cpx[ci];
                    py += w[c] * cpy[ci];
                    pz += w[c] * cpz[ci];
                    weight += w[c] * cw[ci];
                }

                if (!ok) {
                    falive[k] = false;
                    fx[k] = fGrid[fa];
                    fy[k] = fGrid[fb];
                    continue;
                }
                fx[k] = fGrid[fa] + dx;
                fy[k] = fGrid[fb] + dy;
                fpx[k] = px;
                fpy[k] = py;
                fpz[k] = pz;
                fw[k] = weight * smallness;
            }
        });

        return fine;
    }
}

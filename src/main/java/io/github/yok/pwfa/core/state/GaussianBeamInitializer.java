package io.github.yok.pwfa.core.state;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.particle.BeamState;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * ガウス分布のビームを規則格子上に生成します。
 *
 * <ul>
 * <li>横方向: {@code transverseSpacing} セル間隔の格子点のうち、半径 cutoffSigmas*σr 以内かつ格子内の点</li>
 * <li>縦方向: 各スライス中心 {@code xiStart - (k + 1/2) dξ} のうち、|ξ - xiCenter| が cutoffSigmas*σξ 以内の点</li>
 * <li>重み: {@code nb exp(-r²/2σr²) exp(-(ξ-ξc)²/2σξ²) s² dξ}（s は横方向間隔のセル数）</li>
 * </ul>
 *
 * <p>
 * 乱数は使わないため、同じ設定からは常に同じビームが得られます。
 * </p>
 */
@Slf4j
public final class GaussianBeamInitializer {

    private final Grid grid;
    private final PwfaProperties.Beam beam;
    private final PwfaProperties.Xi xi;
    private final double mass;

    /**
     * 生成器を作成します。
     *
     * @param grid 格子です
     * @param beam ビーム設定です
     * @param xi ξ 範囲の設定です
     * @param mass ビーム粒子の質量です
     */
    public GaussianBeamInitializer(Grid grid, PwfaProperties.Beam beam, PwfaProperties.Xi xi,
            double mass) {
        if (grid == null || beam == null || xi == null) {
            throw new IllegalArgumentException("grid/beam/xi は null 不可です");
        }
        this.grid = grid;
        this.beam = beam;
        this.xi = xi;
        this.mass = mass;
    }

    /**
     * ビームを生成します。
     *
     * @return 進入座標の降順に並んだビームです
     */
    public BeamState create() {
        double h = grid.stepSize();
        int s = beam.getTransverseSpacing();
        double spacing = s * h;
        double rMax = beam.getCutoffSigmas() * beam.getSigmaR();
        double xiMax = beam.getCutoffSigmas() * beam.getSigmaXi();
        double d = xi.getStep();
        double pz = mass * Math.sqrt(beam.getGamma() * beam.getGamma() - 1.0);

        // 横方向の格子点（原点を含む）
        List<double[]> transverse = new ArrayList<>();
        int kMax = (int) Math.floor(rMax / spacing);
        for (int a = -kMax; a <= kMax; a++) {
            for (int b = -kMax; b <= kMax; b++) {
                double x = a * spacing;
                double y = b * spacing;
                if (x * x + y * y <= rMax * rMax && grid.contains(x, y)) {
                    transverse.add(new double[] {x, y});
                }
            }
        }

        List<double[]> rows = new ArrayList<>();
        for (int k = 0;; k++) {
            double sliceXi = xi.getStart() - (k + 0.5) * d;
            if (sliceXi < xi.getEnd()) {
                break;
            }
            double dz = sliceXi - beam.getXiCenter();
            if (Math.abs(dz) > xiMax) {
                continue;
            }
            double gXi = Math.exp(-dz * dz / (2 * beam.getSigmaXi() * beam.getSigmaXi()));
            for (double[] t : transverse) {
                double rr = t[0] * t[0] + t[1] * t[1];
                double gR = Math.exp(-rr / (2 * beam.getSigmaR() * beam.getSigmaR()));
                double w = beam.getPeakDensity() * gR * gXi * s * s * d;
                rows.add(new double[] {t[0], t[1], sliceXi, w});
            }
        }

        int n = rows.size();
        ParticleArrays p = new ParticleArrays(Species.BEAM, n);
        double[] xis = new double[n];
        double[] entry = new double[n];
        for (int k = 0; k < n; k++) {
            double[] r = rows.get(k);
            p.getX()[k] = r[0];
            p.getY()[k] = r[1];
            p.getPz()[k] = pz;
            p.getWeight()[k] = r[3];
            xis[k] = r[2];
            entry[k] = r[2];
        }

        log.info("ビームを生成しました。粒子数={}、横方向点数={}、γ={}", n, transverse.size(),
                beam.getGamma());
        return new BeamState(p, xis, entry, 0);
    }
}

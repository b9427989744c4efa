package io.github.yok.pwfa.core.state;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.deposit.DepositionEngine;
import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.model.BackgroundIonModel;
import io.github.yok.pwfa.core.model.DensityProfile;
import io.github.yok.pwfa.core.model.ImmobileIonBackground;
import io.github.yok.pwfa.core.model.MobileIonBackground;
import io.github.yok.pwfa.core.model.ParabolicChannelProfile;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.model.SpeciesTable;
import io.github.yok.pwfa.core.model.UniformDensityProfile;
import io.github.yok.pwfa.core.particle.BeamState;
import io.github.yok.pwfa.core.particle.FineParticleRefiner;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import io.github.yok.pwfa.core.particle.PlasmaLattice;
import io.github.yok.pwfa.core.particle.PlasmaPopulation;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 設定値から初期状態を生成します。
 *
 * <ul>
 * <li>プラズマ電子: 粗粒子格子に静止状態で配置し、重みを密度分布 × coarseness² とします</li>
 * <li>イオン: IMMOBILE なら初期の細粒子電子を打ち消す背景、MOBILE なら電子と同じ配置の粗粒子</li>
 * <li>ビーム: {@link GaussianBeamInitializer} で生成します（無効なら空）</li>
 * <li>場・ソース項: 0 から始めます</li>
 * </ul>
 */
@Slf4j
public final class ConfiguredSimulationInitializer implements SimulationStateInitializer {

    private final PwfaProperties properties;
    private final Grid grid;
    private final PlasmaLattice lattice;
    private final SpeciesTable speciesTable;
    private final FineParticleRefiner refiner;
    private final DepositionEngine depositionEngine;

    /**
     * 初期値生成器を作成します。
     *
     * @param properties 設定です
     * @param grid 格子です
     * @param lattice プラズマの初期配置です
     * @param speciesTable 粒子種テーブルです
     * @param refiner 細粒子生成器です
     * @param depositionEngine 堆積エンジンです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public ConfiguredSimulationInitializer(PwfaProperties properties, Grid grid,
            PlasmaLattice lattice, SpeciesTable speciesTable, FineParticleRefiner refiner,
            DepositionEngine depositionEngine) {
        if (properties == null) {
            throw new IllegalArgumentException("properties は null 不可です");
        }
        if (grid == null || lattice == null || speciesTable == null || refiner == null
                || depositionEngine == null) {
            throw new IllegalArgumentException(
                    "grid/lattice/speciesTable/refiner/depositionEngine は null 不可です");
        }
        this.properties = properties;
        this.grid = grid;
        this.lattice = lattice;
        this.speciesTable = speciesTable;
        this.refiner = refiner;
        this.depositionEngine = depositionEngine;
    }

    @Override
    public SimulationState create() {
        PwfaProperties.Xi xi = properties.getXi();
        int steps = grid.steps();
        DensityProfile profile = densityProfile(properties.getPlasma().getProfile());
        int c = properties.getPlasma().getCoarseness();

        ParticleArrays electrons = placeCoarse(Species.PLASMA_ELECTRON, profile, c * c);
        Map<Species, ParticleArrays> coarse = new EnumMap<>(Species.class);
        coarse.put(Species.PLASMA_ELECTRON, electrons);

        BackgroundIonModel ions;
        if (properties.getIons().getMode() == PwfaProperties.Ions.Mode.MOBILE) {
            double z = speciesTable.chargeOf(Species.PLASMA_ION);
            coarse.put(Species.PLASMA_ION, placeCoarse(Species.PLASMA_ION, profile, c * c / z));
            ions = new MobileIonBackground(steps);
        } else {
            SourceTerms initial =
                    depositionEngine.deposit(refiner.refine(electrons, lattice), xi.getStep());
            ions = ImmobileIonBackground.neutralizing(initial);
        }

        BeamState beam = properties.getBeam().isEnabled()
                ? new GaussianBeamInitializer(grid, properties.getBeam(), xi,
                        speciesTable.massOf(Species.BEAM)).create()
                : BeamState.empty();

        log.info("初期状態を生成しました。粗粒子={}x{}、細粒子={}x{}、イオン={}、ビーム粒子={}", lattice.coarseSize(),
                lattice.coarseSize(), lattice.fineSize(), lattice.fineSize(),
                properties.getIons().getMode(), beam.getParticles().size());

        return new SimulationState(0, xi.getStart(), xi.getStep(), 0,
                new PlasmaPopulation(lattice, coarse), beam, FieldSet.zeros(steps),
                SourceTerms.zeros(steps), ions);
    }

    /**
     * 粗粒子を初期配置に静止状態で並べます。
     *
     * @param species 粒子種です
     * @param profile 密度分布です
     * @param weightScale 密度に掛ける重み係数です
     * @return 粗粒子群です
     */
    private ParticleArrays placeCoarse(Species species, DensityProfile profile,
            double weightScale) {
        double[] g = lattice.getCoarseGrid();
        int nc = g.length;
        ParticleArrays p = new ParticleArrays(species, nc * nc);
        for (int a = 0; a < nc; a++) {
            for (int b = 0; b < nc; b++) {
                int k = lattice.coarseIndex(a, b);
                p.getX()[k] = g[a];
                p.getY()[k] = g[b];
                p.getWeight()[k] = profile.densityAt(g[a], g[b]) * weightScale;
            }
        }
        return p;
    }

    private static DensityProfile densityProfile(PwfaProperties.Plasma.Profile p) {
        switch (p.getType()) {
            case PARABOLIC_CHANNEL:
                return new ParabolicChannelProfile(p.getDensity(), p.getChannelRadius(),
                        p.getChannelDepth());
            case UNIFORM:
            default:
                return new UniformDensityProfile(p.getDensity());
        }
    }
}

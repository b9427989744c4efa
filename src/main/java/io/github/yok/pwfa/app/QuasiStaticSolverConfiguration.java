package io.github.yok.pwfa.app;

import io.github.yok.pwfa.core.deposit.DepositionEngine;
import io.github.yok.pwfa.core.deposit.ShapeFunctionDepositionEngine;
import io.github.yok.pwfa.core.field.FieldSolver;
import io.github.yok.pwfa.core.field.QuasiStaticFieldSolver;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.grid.UniformGrid2D;
import io.github.yok.pwfa.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.pwfa.core.linearalgebra.EjmlSymmetricEigenDecompositionBackend;
import io.github.yok.pwfa.core.model.SpeciesTable;
import io.github.yok.pwfa.core.particle.BeamAdvancer;
import io.github.yok.pwfa.core.particle.FineParticleRefiner;
import io.github.yok.pwfa.core.particle.PlasmaLattice;
import io.github.yok.pwfa.core.particle.PlasmaPusher;
import io.github.yok.pwfa.core.solver.FixedPointSliceSolver;
import io.github.yok.pwfa.core.solver.SliceObserver;
import io.github.yok.pwfa.core.solver.SliceSolver;
import io.github.yok.pwfa.core.solver.XiStepper;
import io.github.yok.pwfa.core.state.ConfiguredSimulationInitializer;
import io.github.yok.pwfa.core.state.SimulationStateInitializer;
import io.github.yok.pwfa.out.CsvDiagnosticsWriter;
import io.github.yok.pwfa.out.JsonCheckpointStore;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 準静的 ξ ステッピング一式の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 格子・粒子種テーブル・堆積エンジン・場のソルバ・押し出し器を組み立て、固定点ソルバと ξ ステッパにまとめます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class QuasiStaticSolverConfiguration {

    /**
     * pwfa-solver の設定値（pwfa.*）です。
     */
    private final PwfaProperties p;

    /**
     * 格子を生成します。
     *
     * <p>
     * 全 Bean の起点なので、ここで設定値の整合性を検証します。
     * </p>
     *
     * @return 格子です
     */
    @Bean
    public Grid grid() {
        p.validate();
        return new UniformGrid2D(p.getGrid().getSteps(), p.getGrid().getStepSize());
    }

    /**
     * 粒子種テーブルを生成します。
     *
     * @return 粒子種テーブルです
     */
    @Bean
    public SpeciesTable speciesTable() {
        return SpeciesTable.from(p);
    }

    /**
     * プラズマの初期配置を生成します。
     *
     * @param grid 格子です
     * @return 初期配置です
     */
    @Bean
    public PlasmaLattice plasmaLattice(Grid grid) {
        PwfaProperties.Plasma pl = p.getPlasma();
        return PlasmaLattice.build(grid, pl.getPaddingSteps(), pl.getCoarseness(),
                pl.getFineness());
    }

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlSymmetricEigenDecompositionBackend();
    }

    /**
     * 場のソルバを生成します。
     *
     * @param grid 格子です
     * @param eigen 固有分解バックエンドです
     * @return 場のソルバです
     */
    @Bean
    public FieldSolver fieldSolver(Grid grid, EigenDecompositionBackend eigen) {
        return new QuasiStaticFieldSolver(grid, eigen, p.getSolver());
    }

    /**
     * 堆積エンジンを生成します。
     *
     * @param grid 格子です
     * @param speciesTable 粒子種テーブルです
     * @return 堆積エンジンです
     */
    @Bean
    public DepositionEngine depositionEngine(Grid grid, SpeciesTable speciesTable) {
        return new ShapeFunctionDepositionEngine(grid, speciesTable,
                ShapeFunctionDepositionEngine.defaultKernels(), p.getParallel().getChunkSize());
    }

    /**
     * 細粒子生成器を生成します。
     *
     * @return 細粒子生成器です
     */
    @Bean
    public FineParticleRefiner fineParticleRefiner() {
        return new FineParticleRefiner();
    }

    /**
     * プラズマ押し出し器を生成します。
     *
     * @param grid 格子です
     * @param speciesTable 粒子種テーブルです
     * @return 押し出し器です
     */
    @Bean
    public PlasmaPusher plasmaPusher(Grid grid, SpeciesTable speciesTable) {
        return new PlasmaPusher(grid, speciesTable, p.getPlasma());
    }

    /**
     * スライスごとの固定点ソルバを生成します。
     *
     * @param pusher 押し出し器です
     * @param refiner 細粒子生成器です
     * @param engine 堆積エンジンです
     * @param fieldSolver 場のソルバです
     * @return 固定点ソルバです
     */
    @Bean
    public SliceSolver sliceSolver(PlasmaPusher pusher, FineParticleRefiner refiner,
            DepositionEngine engine, FieldSolver fieldSolver) {
        return new FixedPointSliceSolver(pusher, refiner, engine, fieldSolver, p.getSolver());
    }

    /**
     * ビーム前進器を生成します。
     *
     * @param grid 格子です
     * @param speciesTable 粒子種テーブルです
     * @return ビーム前進器です
     */
    @Bean
    public BeamAdvancer beamAdvancer(Grid grid, SpeciesTable speciesTable) {
        return new BeamAdvancer(grid, speciesTable, p.getBeam().getTimeStep(),
                p.getXi().getStart(), p.getXi().getEnd());
    }

    /**
     * 初期状態の生成ロジックを生成します。
     *
     * @param grid 格子です
     * @param lattice プラズマの初期配置です
     * @param speciesTable 粒子種テーブルです
     * @param refiner 細粒子生成器です
     * @param engine 堆積エンジンです
     * @return 初期値生成ロジックです
     */
    @Bean
    public SimulationStateInitializer simulationStateInitializer(Grid grid,
            PlasmaLattice lattice, SpeciesTable speciesTable, FineParticleRefiner refiner,
            DepositionEngine engine) {
        return new ConfiguredSimulationInitializer(p, grid, lattice, speciesTable, refiner,
                engine);
    }

    /**
     * チェックポイントの入出力を生成します。
     *
     * @return チェックポイントの入出力です
     */
    @Bean
    public JsonCheckpointStore jsonCheckpointStore() {
        return new JsonCheckpointStore(p.getCheckpoint().getDir(),
                p.getCheckpoint().getEverySlices());
    }

    /**
     * ξ ステッパを生成します。
     *
     * <p>
     * 診断出力とチェックポイントは、有効な場合だけ観測者として登録します。
     * </p>
     *
     * @param grid 格子です
     * @param sliceSolver 固定点ソルバです
     * @param engine 堆積エンジンです
     * @param beamAdvancer ビーム前進器です
     * @param checkpointStore チェックポイントの入出力です
     * @return ξ ステッパです
     */
    @Bean
    public XiStepper xiStepper(Grid grid, SliceSolver sliceSolver, DepositionEngine engine,
            BeamAdvancer beamAdvancer, JsonCheckpointStore checkpointStore) {
        List<SliceObserver> observers = new ArrayList<>();
        PwfaProperties.Diagnostics d = p.getDiagnostics();
        if (d.isEnabled()) {
            observers.add(new CsvDiagnosticsWriter(d.getDir(), grid, d.getEverySlices()));
        }
        if (p.getCheckpoint().isEnabled()) {
            observers.add(checkpointStore);
        }
        return new XiStepper(sliceSolver, engine, beamAdvancer, p.getXi(), p.getStepControl(),
                d.getEverySlices(), observers);
    }
}

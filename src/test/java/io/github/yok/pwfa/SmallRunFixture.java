package io.github.yok.pwfa;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.app.QuasiStaticSolverConfiguration;
import io.github.yok.pwfa.core.deposit.DepositionEngine;
import io.github.yok.pwfa.core.field.FieldSolver;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.pwfa.core.model.SpeciesTable;
import io.github.yok.pwfa.core.particle.BeamAdvancer;
import io.github.yok.pwfa.core.particle.FineParticleRefiner;
import io.github.yok.pwfa.core.particle.PlasmaLattice;
import io.github.yok.pwfa.core.particle.PlasmaPusher;
import io.github.yok.pwfa.core.solver.SliceObserver;
import io.github.yok.pwfa.core.solver.SliceSolver;
import io.github.yok.pwfa.core.solver.XiStepper;
import io.github.yok.pwfa.core.state.SimulationStateInitializer;
import java.util.List;

/**
 * テスト用の小さな計算設定と、Bean 定義を手で組み立てたコンポーネント一式です。
 */
public final class SmallRunFixture {

    public final PwfaProperties properties;
    public final Grid grid;
    public final SpeciesTable speciesTable;
    public final PlasmaLattice lattice;
    public final DepositionEngine engine;
    public final FieldSolver fieldSolver;
    public final FineParticleRefiner refiner;
    public final PlasmaPusher pusher;
    public final SliceSolver sliceSolver;
    public final BeamAdvancer beamAdvancer;
    public final SimulationStateInitializer initializer;

    public SmallRunFixture(PwfaProperties properties) {
        QuasiStaticSolverConfiguration c = new QuasiStaticSolverConfiguration(properties);
        this.properties = properties;
        this.grid = c.grid();
        this.speciesTable = c.speciesTable();
        this.lattice = c.plasmaLattice(grid);
        EigenDecompositionBackend eigen = c.eigenDecompositionBackend();
        this.engine = c.depositionEngine(grid, speciesTable);
        this.fieldSolver = c.fieldSolver(grid, eigen);
        this.refiner = c.fineParticleRefiner();
        this.pusher = c.plasmaPusher(grid, speciesTable);
        this.sliceSolver = c.sliceSolver(pusher, refiner, engine, fieldSolver);
        this.beamAdvancer = c.beamAdvancer(grid, speciesTable);
        this.initializer =
                c.simulationStateInitializer(grid, lattice, speciesTable, refiner, engine);
    }

    /**
     * 41×41 格子、h=0.2 の小さな設定を返します（ビームは軸上の細いガウス分布）。
     */
    public static PwfaProperties properties() {
        PwfaProperties p = new PwfaProperties();
        p.getGrid().setSteps(41);
        p.getGrid().setStepSize(0.2);

        p.getPlasma().setCoarseness(2);
        p.getPlasma().setFineness(2);
        p.getPlasma().setPaddingSteps(6);
        p.getPlasma().setReflectPaddingSteps(4);

        p.getBeam().setEnabled(true);
        p.getBeam().setPeakDensity(0.01);
        p.getBeam().setSigmaR(0.5);
        p.getBeam().setSigmaXi(0.5);
        p.getBeam().setXiCenter(-1.0);
        p.getBeam().setCutoffSigmas(3.0);

        p.getXi().setStart(0.0);
        p.getXi().setEnd(-1.0);
        p.getXi().setStep(0.05);

        p.getSolver().setMaxIterations(60);
        p.getSolver().setTolerance(1e-8);

        p.getStepControl().setMinStep(0.0125);

        p.getParallel().setChunkSize(257);
        p.getDiagnostics().setEnabled(false);
        p.getCheckpoint().setEnabled(false);
        return p;
    }

    public XiStepper stepper(List<SliceObserver> observers) {
        return new XiStepper(sliceSolver, engine, beamAdvancer, properties.getXi(),
                properties.getStepControl(), 1000, observers);
    }
}

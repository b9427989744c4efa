package io.github.yok.pwfa.core.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.pwfa.SmallRunFixture;
import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.error.InvalidSourceTermsException;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import io.github.yok.pwfa.core.state.SimulationState;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FixedPointSliceSolver")
class FixedPointSliceSolverTest {

    private static final double D = 0.05;

    private SmallRunFixture fx;
    private SimulationState state;

    @BeforeEach
    void setUp() {
        PwfaProperties p = SmallRunFixture.properties();
        p.getBeam().setEnabled(false);
        fx = new SmallRunFixture(p);
        state = fx.initializer.create();
    }

    private SliceInput input(FieldSet guess, SourceTerms beamSources, SourceTerms ions) {
        return new SliceInput(0, 0.0, D, state.getPopulation(), state.getFields(),
                state.getSources(), guess, beamSources, ions);
    }

    private SourceTerms beamOnAxis() {
        double[][] at = {{0.0, 0.0}, {0.1, 0.0}, {-0.1, 0.0}, {0.0, 0.1}, {0.0, -0.1}};
        ParticleArrays b = new ParticleArrays(Species.BEAM, at.length);
        for (int k = 0; k < at.length; k++) {
            b.getX()[k] = at[k][0];
            b.getY()[k] = at[k][1];
            b.getPz()[k] = 1.0e6;
            b.getWeight()[k] = 1.0e-5;
        }
        return fx.engine.deposit(b, D);
    }

    @Test
    @DisplayName("一様プラズマだけなら 1 反復で場 0 に収束する")
    void uniformPlasmaConvergesToZero() {
        SliceOutcome out = fx.sliceSolver.solve(input(state.getFields(),
                SourceTerms.zeros(41), state.getIonModel().sourceContribution()));

        assertThat(out.isConverged()).isTrue();
        assertThat(out.getIterations()).isEqualTo(1);
        for (DMatrixRMaj c : out.getFields().components()) {
            assertThat(c.data).containsOnly(0.0);
        }
        ParticleArrays e = out.getPopulation().coarse(Species.PLASMA_ELECTRON);
        assertThat(e.getX()).containsExactly(
                state.getPopulation().coarse(Species.PLASMA_ELECTRON).getX());
    }

    @Test
    @DisplayName("ビームがあれば収束した場を初期値に再度解いても許容誤差内で一致する")
    void resolvingFromConvergedFieldsIsStable() {
        SourceTerms beam = beamOnAxis();
        SourceTerms ions = state.getIonModel().sourceContribution();

        SliceOutcome first = fx.sliceSolver.solve(input(state.getFields(), beam, ions));
        assertThat(first.isConverged()).isTrue();
        assertThat(first.getFields().getEz().get(20, 20)).isNotZero();

        SliceOutcome second = fx.sliceSolver.solve(input(first.getFields(), beam, ions));

        assertThat(second.isConverged()).isTrue();
        assertThat(second.getIterations()).isLessThanOrEqualTo(first.getIterations());
        assertThat(second.getFields().maxAbsDifference(first.getFields()))
                .isLessThan(fx.properties.getSolver().getTolerance());
    }

    @Test
    @DisplayName("細粒子をスライスごとに作る設定でも一様プラズマは場 0")
    void perSliceRefresh() {
        PwfaProperties p = SmallRunFixture.properties();
        p.getBeam().setEnabled(false);
        p.getSolver().setFineRefresh(PwfaProperties.Solver.FineRefresh.PER_SLICE);
        fx = new SmallRunFixture(p);
        state = fx.initializer.create();

        SliceOutcome out = fx.sliceSolver.solve(input(state.getFields(),
                SourceTerms.zeros(41), state.getIonModel().sourceContribution()));

        assertThat(out.isConverged()).isTrue();
        assertThat(out.getFields().getEx().data).containsOnly(0.0);
    }

    @Test
    @DisplayName("電荷保存が破れたソースは InvalidSourceTermsException")
    void brokenChargeIsFatal() {
        SourceTerms broken = new SourceTerms(new DMatrixRMaj(41, 41), new DMatrixRMaj(41, 41),
                new DMatrixRMaj(41, 41), new DMatrixRMaj(41, 41), 1.0, 1.0);

        assertThatThrownBy(() -> fx.sliceSolver.solve(input(state.getFields(), broken,
                state.getIonModel().sourceContribution())))
                        .isInstanceOf(InvalidSourceTermsException.class);
    }

    @Test
    @DisplayName("反復上限に達すると DIVERGED を返す")
    void reportsDivergenceWhenIterationsRunOut() {
        PwfaProperties p = SmallRunFixture.properties();
        p.getBeam().setEnabled(false);
        p.getSolver().setMaxIterations(1);
        fx = new SmallRunFixture(p);
        state = fx.initializer.create();
        FieldSet guess = FieldSet.zeros(41);
        guess.getEx().set(20, 20, 1.0);

        SliceOutcome out = fx.sliceSolver.solve(input(guess, SourceTerms.zeros(41),
                state.getIonModel().sourceContribution()));

        assertThat(out.isConverged()).isFalse();
        assertThat(out.getStatus()).isEqualTo(SliceOutcome.Status.DIVERGED);
        assertThat(out.getIterations()).isEqualTo(1);
    }
}

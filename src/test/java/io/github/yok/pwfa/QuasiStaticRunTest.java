package io.github.yok.pwfa;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import io.github.yok.pwfa.core.solver.RunResult;
import io.github.yok.pwfa.core.state.SimulationState;
import java.util.Collections;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("小さな設定での ξ ステッピング")
class QuasiStaticRunTest {

    @Test
    @DisplayName("ビームなしの一様プラズマは全スライスで場 0 のまま")
    void uniformPlasmaStaysQuiet() {
        PwfaProperties p = SmallRunFixture.properties();
        p.getBeam().setEnabled(false);
        p.getXi().setEnd(-0.5);
        SmallRunFixture fx = new SmallRunFixture(p);
        SimulationState state = fx.initializer.create();
        double[] x0 = state.getPopulation().coarse(Species.PLASMA_ELECTRON).getX().clone();

        RunResult r = fx.stepper(Collections.emptyList()).run(state);

        assertThat(r.getStatus()).isEqualTo(RunResult.Status.COMPLETED);
        assertThat(r.getSlices()).isEqualTo(10);
        assertThat(r.getRetries()).isZero();
        for (DMatrixRMaj c : state.getFields().components()) {
            assertThat(c.data).containsOnly(0.0);
        }
        assertThat(state.getPopulation().coarse(Species.PLASMA_ELECTRON).getX())
                .containsExactly(x0);
    }

    @Test
    @DisplayName("正電荷のビームは中心で減速方向 (負) の Ez を作る")
    void positiveDriverWake() {
        PwfaProperties p = SmallRunFixture.properties();
        SmallRunFixture fx = new SmallRunFixture(p);
        SimulationState state = fx.initializer.create();
        assertThat(state.getBeam().getParticles().size()).isPositive();

        RunResult r = fx.stepper(Collections.emptyList()).run(state);

        assertThat(r.getStatus()).isEqualTo(RunResult.Status.COMPLETED);
        assertThat(r.getFinalXi()).isEqualTo(-1.0);
        FieldSet f = state.getFields();
        double ez = f.getEz().get(20, 20);
        double nb = p.getBeam().getPeakDensity();
        assertThat(ez).isNegative();
        assertThat(Math.abs(ez)).isBetween(nb * 1e-3, nb * 3);
        // 軸対称なので横電場は原点で打ち消し合う
        assertThat(Math.abs(f.getEx().get(20, 20))).isLessThan(Math.abs(ez));
    }

    @Test
    @DisplayName("中心に 1 粒子だけ置いた静止プラズマは中和背景のもとで何スライス進めても動かない")
    void singleCentralParticleStaysPut() {
        PwfaProperties p = SmallRunFixture.properties();
        p.getBeam().setEnabled(false);
        // 41 点格子で余白 17 なら粗粒子は原点の 1 個だけになる
        p.getPlasma().setPaddingSteps(17);
        p.getXi().setEnd(-2.0);
        SmallRunFixture fx = new SmallRunFixture(p);
        SimulationState state = fx.initializer.create();
        assertThat(state.getPopulation().coarse(Species.PLASMA_ELECTRON).size()).isEqualTo(1);

        RunResult r = fx.stepper(Collections.emptyList()).run(state);

        assertThat(r.getStatus()).isEqualTo(RunResult.Status.COMPLETED);
        assertThat(r.getFinalXi()).isEqualTo(-2.0);
        ParticleArrays e = state.getPopulation().coarse(Species.PLASMA_ELECTRON);
        assertThat(e.getAlive()[0]).isTrue();
        assertThat(Math.abs(e.getX()[0])).isLessThan(1e-12);
        assertThat(Math.abs(e.getY()[0])).isLessThan(1e-12);
    }

    @Test
    @DisplayName("可動イオンでも一様プラズマは静かなまま")
    void mobileIonsStayQuiet() {
        PwfaProperties p = SmallRunFixture.properties();
        p.getBeam().setEnabled(false);
        p.getIons().setMode(PwfaProperties.Ions.Mode.MOBILE);
        p.getXi().setEnd(-0.2);
        SmallRunFixture fx = new SmallRunFixture(p);
        SimulationState state = fx.initializer.create();

        RunResult r = fx.stepper(Collections.emptyList()).run(state);

        assertThat(r.getStatus()).isEqualTo(RunResult.Status.COMPLETED);
        assertThat(state.getPopulation().species()).contains(Species.PLASMA_ION);
        assertThat(state.getIonModel().isMobile()).isTrue();
        for (DMatrixRMaj c : state.getFields().components()) {
            for (double v : c.data) {
                assertThat(Math.abs(v)).isLessThan(1e-9);
            }
        }
    }
}

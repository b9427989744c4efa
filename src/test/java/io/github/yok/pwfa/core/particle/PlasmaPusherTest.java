package io.github.yok.pwfa.core.particle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.app.PwfaProperties.Plasma.BoundaryPolicy;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.grid.UniformGrid2D;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.model.SpeciesTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PlasmaPusher")
class PlasmaPusherTest {

    private static final double D = 0.5;

    private UniformGrid2D grid;
    private SpeciesTable table;
    private PwfaProperties.Plasma plasma;

    @BeforeEach
    void setUp() {
        grid = new UniformGrid2D(21, 0.5);
        table = SpeciesTable.from(new PwfaProperties());
        plasma = new PwfaProperties.Plasma();
        plasma.setReflectPaddingSteps(4);
    }

    private ParticleArrays single(double x, double px, double pz) {
        ParticleArrays p = new ParticleArrays(Species.PLASMA_ELECTRON, 1);
        p.getX()[0] = x;
        p.getPx()[0] = px;
        p.getPz()[0] = pz;
        p.getWeight()[0] = 1.0;
        return p;
    }

    private ParticleArrays push(ParticleArrays start, FieldSet fields) {
        PlasmaPusher pusher = new PlasmaPusher(grid, table, plasma);
        ParticleArrays estimate = pusher.estimateWithoutFields(start, D);
        return pusher.push(start, estimate, fields, D);
    }

    @Test
    @DisplayName("場がなければ静止粒子は動かない")
    void restParticleStaysPut() {
        ParticleArrays start = single(0.3, 0.0, 0.0);

        ParticleArrays out = push(start, FieldSet.zeros(21));

        assertThat(out.getX()[0]).isEqualTo(0.3);
        assertThat(out.getPx()[0]).isZero();
        assertThat(out.getAlive()[0]).isTrue();
    }

    @Test
    @DisplayName("境界はグリッド中心から h (N/2 - 反射余白) の位置")
    void boundaryPosition() {
        assertThat(new PlasmaPusher(grid, table, plasma).getBoundary()).isEqualTo(3.25);
    }

    @Test
    @DisplayName("REFLECT: 境界にちょうど到達した外向き粒子は運動量だけ反転する")
    void reflectExactlyOnBoundary() {
        plasma.setBoundaryPolicy(BoundaryPolicy.REFLECT);
        // γm = 1.5, γm - pz = 2 なので Δx = 1/2 * 0.5 = 0.25
        ParticleArrays out = push(single(3.0, 1.0, -0.5), FieldSet.zeros(21));

        assertThat(out.getAlive()[0]).isTrue();
        assertThat(out.getX()[0]).isEqualTo(3.25);
        assertThat(out.getPx()[0]).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("REFLECT: 境界を越えた粒子は鏡映される")
    void reflectBeyondBoundary() {
        plasma.setBoundaryPolicy(BoundaryPolicy.REFLECT);

        ParticleArrays out = push(single(3.15, 1.0, -0.5), FieldSet.zeros(21));

        assertThat(out.getX()[0]).isCloseTo(3.1, within(1e-12));
        assertThat(out.getPx()[0]).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("REMOVE: 境界に到達した粒子は除去される")
    void removeOnBoundary() {
        plasma.setBoundaryPolicy(BoundaryPolicy.REMOVE);

        ParticleArrays out = push(single(3.0, 1.0, -0.5), FieldSet.zeros(21));

        assertThat(out.getAlive()[0]).isFalse();
        assertThat(out.aliveCount()).isZero();
    }

    @Test
    @DisplayName("REFLECT: 初回推定が格子外へ出るほどの刻みでも粒子は鏡映されて生き残る")
    void reflectKeepsParticleWhenEstimateLeavesGrid() {
        plasma.setBoundaryPolicy(BoundaryPolicy.REFLECT);
        PlasmaPusher pusher = new PlasmaPusher(grid, table, plasma);
        ParticleArrays start = single(3.2, 10.0, 0.0);
        // vx ≈ 0.995 なので Δx ≈ 2.985 となり、鏡映しなければ格子の外 (x > 4.75) に出る
        double step = 3.0;

        ParticleArrays estimate = pusher.estimateWithoutFields(start, step);
        ParticleArrays out = pusher.push(start, estimate, FieldSet.zeros(21), step);

        assertThat(estimate.getAlive()[0]).isTrue();
        assertThat(Math.abs(estimate.getX()[0])).isLessThanOrEqualTo(3.25);
        assertThat(estimate.getPx()[0]).isEqualTo(10.0);
        assertThat(out.getAlive()[0]).isTrue();
        assertThat(Math.abs(out.getX()[0])).isLessThanOrEqualTo(3.25);
        assertThat(out.getPx()[0]).isEqualTo(-10.0);
    }

    @Test
    @DisplayName("REMOVE: 境界を越える初回推定は無効になり、押し出し後に除去される")
    void removeDropsEstimateBeyondBoundary() {
        plasma.setBoundaryPolicy(BoundaryPolicy.REMOVE);
        PlasmaPusher pusher = new PlasmaPusher(grid, table, plasma);
        ParticleArrays start = single(3.2, 10.0, 0.0);

        ParticleArrays estimate = pusher.estimateWithoutFields(start, 3.0);
        ParticleArrays out = pusher.push(start, estimate, FieldSet.zeros(21), 3.0);

        assertThat(estimate.getAlive()[0]).isFalse();
        assertThat(out.getAlive()[0]).isFalse();
    }

    @Test
    @DisplayName("正の Ex は電子を -x 方向へ加速する")
    void electricFieldAcceleratesElectron() {
        FieldSet fields = FieldSet.zeros(21);
        fields.getEx().fill(0.1);

        ParticleArrays out = push(single(0.0, 0.0, 0.0), fields);

        assertThat(out.getPx()[0]).isNegative();
        assertThat(out.getX()[0]).isNegative();
        assertThat(out.getPz()[0]).isZero();
    }
}

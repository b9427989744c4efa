package io.github.yok.pwfa.core.particle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.grid.UniformGrid2D;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.model.SpeciesTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BeamState と BeamAdvancer")
class BeamAdvancerTest {

    private UniformGrid2D grid;
    private SpeciesTable table;

    @BeforeEach
    void setUp() {
        grid = new UniformGrid2D(21, 0.5);
        table = SpeciesTable.from(new PwfaProperties());
    }

    private static BeamState beam(double[] xiEntry, double pz) {
        int n = xiEntry.length;
        ParticleArrays p = new ParticleArrays(Species.BEAM, n);
        for (int k = 0; k < n; k++) {
            p.getPz()[k] = pz;
            p.getWeight()[k] = 1.0;
        }
        return new BeamState(p, xiEntry.clone(), xiEntry.clone(), 0);
    }

    @Test
    @DisplayName("スライス範囲は ξ - dξ より前方に入る粒子まで")
    void sliceRange() {
        BeamState b = beam(new double[] {-0.01, -0.04, -0.05, -0.07, -0.2}, 1000.0);

        assertThat(b.sliceEnd(0.0, 0.05)).isEqualTo(2);
        b.commitSlice(2);
        assertThat(b.getCursor()).isEqualTo(2);
        assertThat(b.sliceEnd(-0.05, 0.05)).isEqualTo(4);
        assertThatThrownBy(() -> b.commitSlice(1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("降順でない入射位置は拒否する")
    void rejectsUnsortedEntry() {
        assertThatThrownBy(() -> beam(new double[] {-0.1, -0.05}, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("場がなければ超相対論的粒子はほとんど動かない")
    void freeStreaming() {
        BeamState b = beam(new double[] {-1.0}, 1836.15 * 1000.0);
        BeamAdvancer adv = new BeamAdvancer(grid, table, 1.0, 0.0, -5.0);

        int removed = adv.advance(b, 0, 1, FieldSet.zeros(21));

        assertThat(removed).isZero();
        assertThat(b.getParticles().getX()[0]).isZero();
        assertThat(b.getXi()[0]).isLessThan(-1.0).isGreaterThan(-1.0 - 1e-6);
    }

    @Test
    @DisplayName("ξ の下限を越えた粒子と横方向に出た粒子は除去される")
    void removesEscapedParticles() {
        BeamState b = beam(new double[] {-0.5, -1.0}, 10.0);
        b.getParticles().getX()[1] = 4.0;
        b.getParticles().getPx()[1] = 1.0e4;
        // 遅い粒子は ξ 方向に大きく後退する
        BeamAdvancer adv = new BeamAdvancer(grid, table, 2.0, 0.0, -1.0);

        int removed = adv.advance(b, 0, 2, FieldSet.zeros(21));

        assertThat(removed).isEqualTo(2);
        assertThat(b.getParticles().aliveCount()).isZero();
    }

    @Test
    @DisplayName("縦電場で運動量 pz が変化する")
    void longitudinalKick() {
        BeamState b = beam(new double[] {-1.0}, 1000.0);
        FieldSet f = FieldSet.zeros(21);
        f.getEz().fill(-0.1);
        BeamAdvancer adv = new BeamAdvancer(grid, table, 1.0, 0.0, -5.0);

        adv.advance(b, 0, 1, f);

        assertThat(b.getParticles().getPz()[0]).isLessThan(1000.0);
    }
}

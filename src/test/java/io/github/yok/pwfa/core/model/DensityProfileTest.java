package io.github.yok.pwfa.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.pwfa.app.PwfaProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("密度分布と粒子種テーブル")
class DensityProfileTest {

    @Test
    @DisplayName("放物型チャネルは半径 R で n0 (1 + depth)")
    void parabolicChannel() {
        ParabolicChannelProfile p = new ParabolicChannelProfile(2.0, 1.5, -0.4);

        assertThat(p.densityAt(0.0, 0.0)).isEqualTo(2.0);
        assertThat(p.densityAt(0.9, 1.2)).isCloseTo(2.0 * 0.6, within(1e-12));
        assertThatThrownBy(() -> new ParabolicChannelProfile(1.0, 1.0, -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("電子は電荷 -1・質量 1、イオンとビームは設定値")
    void speciesTableFromProperties() {
        PwfaProperties props = new PwfaProperties();
        props.getIons().setCharge(2.0);
        props.getIons().setMassRatio(7344.6);
        props.getBeam().setCharge(-1.0);
        props.getBeam().setMassRatio(1.0);

        SpeciesTable t = SpeciesTable.from(props);

        assertThat(t.chargeOf(Species.PLASMA_ELECTRON)).isEqualTo(-1.0);
        assertThat(t.massOf(Species.PLASMA_ELECTRON)).isEqualTo(1.0);
        assertThat(t.chargeOf(Species.PLASMA_ION)).isEqualTo(2.0);
        assertThat(t.massOf(Species.PLASMA_ION)).isEqualTo(7344.6);
        assertThat(t.chargeOf(Species.BEAM)).isEqualTo(-1.0);
        assertThat(Species.BEAM.isPlasma()).isFalse();
    }
}

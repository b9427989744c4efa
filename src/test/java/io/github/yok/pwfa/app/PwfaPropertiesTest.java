package io.github.yok.pwfa.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.pwfa.core.error.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PwfaProperties")
class PwfaPropertiesTest {

    private PwfaProperties props;

    @BeforeEach
    void setUp() {
        props = new PwfaProperties();
    }

    @Test
    @DisplayName("既定値は検証を通る")
    void defaultsAreValid() {
        assertThatCode(props::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("偶数の格子点数は拒否する")
    void evenGrid() {
        props.getGrid().setSteps(120);

        assertThatThrownBy(props::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("grid.steps");
    }

    @Test
    @DisplayName("反射境界の余白は粗粒子の広がりより大きくなければならない")
    void reflectPaddingTooSmall() {
        props.getPlasma().setCoarseness(4);
        props.getPlasma().setReflectPaddingSteps(5);

        assertThatThrownBy(props::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("reflectPaddingSteps");
    }

    @Test
    @DisplayName("ξ は減少方向に進む")
    void xiMustDecrease() {
        props.getXi().setEnd(1.0);

        assertThatThrownBy(props::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("xi.start");
    }

    @Test
    @DisplayName("最小刻み幅は基本刻み幅以下")
    void minStepAboveBase() {
        props.getStepControl().setMinStep(0.1);

        assertThatThrownBy(props::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("minStep");
    }

    @Test
    @DisplayName("ビームが無効ならビーム項目は検証しない")
    void disabledBeamSkipsChecks() {
        props.getBeam().setEnabled(false);
        props.getBeam().setSigmaR(-1.0);

        assertThatCode(props::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("整形文字列は全セクションを含む")
    void multilineString() {
        String s = props.toMultilineString();

        assertThat(s).contains("grid:", "plasma:", "solver:", "stepControl:", "checkpoint:")
                .contains("subtractionTrick: 1.0");
    }
}

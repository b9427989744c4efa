package io.github.yok.pwfa.core.grid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.pwfa.core.error.OutOfDomainException;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UniformGrid2D")
class UniformGrid2DTest {

    private UniformGrid2D grid;

    @BeforeEach
    void setUp() {
        grid = new UniformGrid2D(11, 0.5);
    }

    @Test
    @DisplayName("中心格子点が原点に来る")
    void centerNodeIsOrigin() {
        assertThat(grid.coordinateOf(5)).isEqualTo(0.0);
        assertThat(grid.coordinateOf(0)).isEqualTo(-2.5);
        assertThat(grid.cellIndex(0.0, 0.0)).containsExactly(5, 5);
        assertThat(grid.cellIndex(0.26, -0.24)).containsExactly(6, 5);
    }

    @Test
    @DisplayName("偶数の格子点数は拒否する")
    void rejectsEvenSteps() {
        assertThatThrownBy(() -> new UniformGrid2D(10, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("補間重み")
    class Weights {

        @Test
        @DisplayName("9 点の重みの和は 1")
        void weightsSumToOne() {
            double[][] points = {{0.0, 0.0}, {0.123, -0.77}, {1.249, 1.251}, {-2.2, 0.3}};
            for (double[] pt : points) {
                Stencil st = grid.interpolationWeights(pt[0], pt[1]);
                double sx = st.getWxM() + st.getWx0() + st.getWxP();
                double sy = st.getWyM() + st.getWy0() + st.getWyP();
                assertThat(sx * sy).isCloseTo(1.0, within(1e-14));
            }
        }

        @Test
        @DisplayName("一定値の配列を補間すると同じ値になる")
        void constantIsReproduced() {
            DMatrixRMaj a = new DMatrixRMaj(11, 11);
            a.fill(3.0);
            assertThat(grid.interpolationWeights(0.37, -1.1).interpolate(a))
                    .isCloseTo(3.0, within(1e-13));
        }

        @Test
        @DisplayName("堆積した値の総和は元の値に一致する")
        void depositConservesValue() {
            double[] data = new double[121];
            grid.interpolationWeights(-0.61, 0.98).deposit(data, 2.5);
            double sum = 0.0;
            for (double v : data) {
                sum += v;
            }
            assertThat(sum).isCloseTo(2.5, within(1e-14));
        }

        @Test
        @DisplayName("ステンシルが格子から外れる位置は OutOfDomainException")
        void outsideRaises() {
            assertThat(grid.contains(2.3, 0.0)).isFalse();
            assertThatThrownBy(() -> grid.interpolationWeights(2.3, 0.0))
                    .isInstanceOf(OutOfDomainException.class);
            assertThatThrownBy(() -> grid.interpolationWeights(Double.NaN, 0.0))
                    .isInstanceOf(OutOfDomainException.class);
        }
    }
}

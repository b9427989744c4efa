package io.github.yok.pwfa.core.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.pwfa.SmallRunFixture;
import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.error.NonConvergenceException;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.state.SimulationSnapshot;
import io.github.yok.pwfa.core.state.SimulationState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("XiStepper")
class XiStepperTest {

    private PwfaProperties props;
    private SmallRunFixture fx;

    @BeforeEach
    void setUp() {
        props = SmallRunFixture.properties();
        props.getBeam().setEnabled(false);
        props.getXi().setEnd(-0.1);
        props.getStepControl().setReductionFactor(0.5);
        props.getStepControl().setMinStep(0.01);
        props.getStepControl().setMaxRetriesAtMinStep(3);
        fx = new SmallRunFixture(props);
    }

    /**
     * 指定回数だけ失敗し、その後は入力をそのまま確定させるソルバです。
     */
    private static final class ScriptedSolver implements SliceSolver {

        private final int failures;
        private final List<Double> steps = new ArrayList<>();

        ScriptedSolver(int failures) {
            this.failures = failures;
        }

        @Override
        public SliceOutcome solve(SliceInput input) {
            steps.add(input.getSliceStep());
            if (steps.size() <= failures) {
                return SliceOutcome.diverged(input.getInitialGuess(), 3, Double.NaN);
            }
            return SliceOutcome.converged(input.getPreviousFields(), input.getPreviousSources(),
                    input.getPopulation(), 1, 0.0);
        }
    }

    private XiStepper stepper(SliceSolver solver, List<SliceObserver> observers) {
        return new XiStepper(solver, fx.engine, fx.beamAdvancer, props.getXi(),
                props.getStepControl(), 1, observers);
    }

    @Nested
    @DisplayName("刻み幅制御")
    class StepControl {

        @Test
        @DisplayName("最小刻み幅で規定回数失敗すると NonConvergenceException")
        void givesUpAtMinimumStep() {
            ScriptedSolver solver = new ScriptedSolver(Integer.MAX_VALUE);
            SimulationState state = fx.initializer.create();

            assertThatThrownBy(() -> stepper(solver, Collections.emptyList()).run(state))
                    .isInstanceOfSatisfying(NonConvergenceException.class,
                            e -> assertThat(e.getSliceIndex()).isZero());
            // 0.05, 0.025, 0.0125, 0.01 x 4 (初回 + 再試行 3 回)
            assertThat(solver.steps).hasSize(7);
            assertThat(solver.steps.get(6)).isEqualTo(0.01);
            assertThat(solver.steps.get(3)).isEqualTo(0.01);
            assertThat(state.getSliceIndex()).isZero();
            assertThat(state.getXi()).isZero();
        }

        @Test
        @DisplayName("最小刻み幅での再試行は規定回数まで許され、その後に成功すれば完走する")
        void allowsConfiguredRetriesAtMinimumStep() {
            // 0.05, 0.025, 0.0125 と最小刻みで 3 回失敗し、4 回目の最小刻みで成功する
            ScriptedSolver solver = new ScriptedSolver(6);
            SimulationState state = fx.initializer.create();

            RunResult r = stepper(solver, Collections.emptyList()).run(state);

            assertThat(r.getStatus()).isEqualTo(RunResult.Status.COMPLETED);
            assertThat(r.getRetries()).isEqualTo(6);
            assertThat(solver.steps.get(6)).isEqualTo(0.01);
            assertThat(r.getFinalXi()).isEqualTo(-0.1);
        }

        @Test
        @DisplayName("失敗後は刻みを縮め、成功すると戻し、最後は終端にちょうど着地する")
        void shrinksRecoversAndLands() {
            ScriptedSolver solver = new ScriptedSolver(1);
            SimulationState state = fx.initializer.create();

            RunResult r = stepper(solver, Collections.emptyList()).run(state);

            assertThat(r.getStatus()).isEqualTo(RunResult.Status.COMPLETED);
            assertThat(r.getFinalXi()).isEqualTo(-0.1);
            assertThat(r.getSlices()).isEqualTo(3);
            assertThat(r.getRetries()).isEqualTo(1);
            assertThat(solver.steps).hasSize(4);
            assertThat(solver.steps.get(0)).isEqualTo(0.05);
            assertThat(solver.steps.get(1)).isEqualTo(0.025);
            assertThat(solver.steps.get(2)).isEqualTo(0.05);
            assertThat(solver.steps.get(3)).isCloseTo(0.025, within(1e-12));
        }
    }

    @Nested
    @DisplayName("観測者")
    class Observers {

        @Test
        @DisplayName("中断要求を受けると次のスライスの前で ABORTED を返し、最終状態を通知する")
        void abortFromObserver() {
            props.getXi().setEnd(-1.0);
            XiStepper[] holder = new XiStepper[1];
            List<Integer> snapshots = new ArrayList<>();
            SliceObserver observer = new SliceObserver() {
                @Override
                public int everySlices() {
                    return 5;
                }

                @Override
                public void onSnapshot(SimulationSnapshot snapshot) {
                    snapshots.add(snapshot.getSliceIndex());
                }

                @Override
                public void onSliceCommitted(int sliceIndex, double xi, FieldSet fields,
                        SourceTerms sources) {
                    if (sliceIndex == 2) {
                        holder[0].requestAbort();
                    }
                }
            };
            holder[0] = stepper(new ScriptedSolver(0), Collections.singletonList(observer));

            RunResult r = holder[0].run(fx.initializer.create());

            assertThat(r.getStatus()).isEqualTo(RunResult.Status.ABORTED);
            assertThat(r.getSlices()).isEqualTo(2);
            assertThat(r.getFinalXi()).isCloseTo(-0.1, within(1e-12));
            assertThat(snapshots).containsExactly(2);
        }

        @Test
        @DisplayName("スナップショットは観測者ごとの間隔と終了時に渡される")
        void cadencePerObserver() {
            props.getXi().setEnd(-0.35);
            List<Integer> every2 = new ArrayList<>();
            List<Integer> every3 = new ArrayList<>();

            RunResult r = stepper(new ScriptedSolver(0),
                    List.of(recorder(2, every2), recorder(3, every3))).run(fx.initializer.create());

            assertThat(r.getSlices()).isEqualTo(7);
            assertThat(every2).containsExactly(2, 4, 6, 7);
            assertThat(every3).containsExactly(3, 6, 7);
        }
    }

    private static SliceObserver recorder(int every, List<Integer> sink) {
        return new SliceObserver() {
            @Override
            public int everySlices() {
                return every;
            }

            @Override
            public void onSnapshot(SimulationSnapshot snapshot) {
                sink.add(snapshot.getSliceIndex());
            }
        };
    }
}

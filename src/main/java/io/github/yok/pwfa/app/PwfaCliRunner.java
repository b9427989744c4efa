package io.github.yok.pwfa.app;

import io.github.yok.pwfa.core.particle.PlasmaLattice;
import io.github.yok.pwfa.core.solver.RunResult;
import io.github.yok.pwfa.core.solver.XiStepper;
import io.github.yok.pwfa.core.state.SimulationSnapshot;
import io.github.yok.pwfa.core.state.SimulationState;
import io.github.yok.pwfa.core.state.SimulationStateInitializer;
import io.github.yok.pwfa.out.JsonCheckpointStore;
import java.nio.file.Paths;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で pwfa-solver を実行するクラスです。
 *
 * <p>
 * 設定から初期状態を作る（またはチェックポイントから再開する）→ ξ 終端までステッピング → 結果の要約を表示、の順に実行します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PwfaCliRunner implements CommandLineRunner {

    /**
     * pwfa-solver の設定値（pwfa.*）です。
     */
    private final PwfaProperties properties;

    /**
     * 初期状態の生成ロジックです。
     */
    private final SimulationStateInitializer simulationStateInitializer;

    /**
     * チェックポイントの入出力です。
     */
    private final JsonCheckpointStore checkpointStore;

    /**
     * プラズマの初期配置です（再開時の復元に使います）。
     */
    private final PlasmaLattice plasmaLattice;

    /**
     * ξ ステッパです。
     */
    private final XiStepper xiStepper;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== pwfa-solver start: quasi-static xi stepping ===");
        System.out.print(properties.toMultilineString());

        String resumeFrom = properties.getCheckpoint().getResumeFrom();
        SimulationState state;
        if (resumeFrom != null && !resumeFrom.isEmpty()) {
            SimulationSnapshot snapshot = checkpointStore.read(Paths.get(resumeFrom));
            state = SimulationState.restore(snapshot, plasmaLattice);
            System.out.println("再開: " + resumeFrom + "（slice=" + state.getSliceIndex() + ", xi="
                    + fmt5(state.getXi()) + "）");
        } else {
            state = simulationStateInitializer.create();
        }

        RunResult result = xiStepper.run(state);

        System.out.println("=== 結果 ===");
        System.out.println("結果: status=" + result.getStatus() + ", slices=" + result.getSlices()
                + ", xi=" + fmt5(result.getFinalXi()));
        System.out.println("結果: iterations=" + result.getTotalIterations() + ", retries="
                + result.getRetries() + ", elapsed=" + result.getElapsedMillis() + "ms");
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}

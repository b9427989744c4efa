package io.github.yok.pwfa.core.solver;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.deposit.DepositionEngine;
import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.error.NonConvergenceException;
import io.github.yok.pwfa.core.particle.BeamAdvancer;
import io.github.yok.pwfa.core.particle.BeamState;
import io.github.yok.pwfa.core.state.SimulationSnapshot;
import io.github.yok.pwfa.core.state.SimulationState;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * ξ をスライスごとに進めるオーケストレータです。
 *
 * <p>
 * 1 スライス: ビーム粒子の割り当て → ビームの堆積 → 固定点反復 → 確定 → ビーム前進 → ξ を減らす。 発散したら刻み幅を縮めて同じ状態から再試行し、最小刻み幅での失敗が続いたら
 * {@link NonConvergenceException} で終了します。 中断要求はスライス境界でのみ受け付けます。
 * </p>
 */
@Getter
@Slf4j
public final class XiStepper {

    /**
     * 最終スライスに吸収する端数（設定刻み幅に対する比）です。
     */
    private static final double LANDING_SLACK = 1e-9;

    private final SliceSolver sliceSolver;
    private final DepositionEngine depositionEngine;
    private final BeamAdvancer beamAdvancer;
    private final double xiEnd;
    private final double baseStep;
    private final double reductionFactor;
    private final double minStep;
    private final int maxRetriesAtMinStep;
    private final int progressEverySlices;
    private final List<SliceObserver> observers;

    private final AtomicBoolean abortRequested = new AtomicBoolean(false);

    /**
     * ステッパを生成します。
     *
     * @param sliceSolver スライスソルバです
     * @param depositionEngine ビーム堆積に使うエンジンです
     * @param beamAdvancer ビーム前進器です
     * @param xi ξ 範囲の設定です
     * @param stepControl 刻み幅制御の設定です
     * @param progressEverySlices 進捗ログの間隔（スライス数）です
     * @param observers 観測者です
     */
    public XiStepper(SliceSolver sliceSolver, DepositionEngine depositionEngine,
            BeamAdvancer beamAdvancer, PwfaProperties.Xi xi, PwfaProperties.StepControl stepControl,
            int progressEverySlices, List<SliceObserver> observers) {
        if (sliceSolver == null || depositionEngine == null || beamAdvancer == null) {
            throw new IllegalArgumentException("sliceSolver/depositionEngine/beamAdvancer は null 不可です");
        }
        if (xi == null || stepControl == null) {
            throw new IllegalArgumentException("xi/stepControl は null 不可です");
        }
        if (progressEverySlices < 1) {
            throw new IllegalArgumentException(
                    "progressEverySlices は 1 以上が必要です: " + progressEverySlices);
        }
        this.sliceSolver = sliceSolver;
        this.depositionEngine = depositionEngine;
        this.beamAdvancer = beamAdvancer;
        this.xiEnd = xi.getEnd();
        this.baseStep = xi.getStep();
        this.reductionFactor = stepControl.getReductionFactor();
        this.minStep = stepControl.getMinStep();
        this.maxRetriesAtMinStep = stepControl.getMaxRetriesAtMinStep();
        this.progressEverySlices = progressEverySlices;
        this.observers = (observers == null) ? new ArrayList<>() : new ArrayList<>(observers);
    }

    /**
     * 次のスライス境界で中断するよう要求します。
     */
    public void requestAbort() {
        abortRequested.set(true);
    }

    /**
     * ξ 終端まで（または中断まで）ステッピングします。
     *
     * @param state 状態です（直接更新します）
     * @return 実行結果です
     * @throws NonConvergenceException 最小刻み幅での失敗が上限に達した場合に発生します
     */
    public RunResult run(SimulationState state) {
        if (state == null) {
            throw new IllegalArgumentException("state は null 不可です");
        }
        long t0 = System.nanoTime();
        long totalIterations = 0L;
        int retries = 0;
        // 観測者ごとに最後にスナップショットを渡したスライス
        int[] lastNotified = new int[observers.size()];
        Arrays.fill(lastNotified, state.getSliceIndex());

        log.info("ξステッピングを開始します。ξ={} → {}、dξ={}、開始スライス={}", fmt5(state.getXi()),
                fmt5(xiEnd), fmt5(state.getCurrentStep()), state.getSliceIndex());

        while (state.getXi() > xiEnd) {
            if (abortRequested.get()) {
                log.warn("中断要求を受け付けました。スライス={}、ξ={}", state.getSliceIndex(),
                        fmt5(state.getXi()));
                notifyFinal(state, lastNotified);
                return new RunResult(RunResult.Status.ABORTED, state.getSliceIndex(), state.getXi(),
                        totalIterations, retries, elapsedMillis(t0));
            }

            double xi = state.getXi();
            double remaining = xi - xiEnd;
            double step = state.getCurrentStep();
            boolean landing = remaining - step <= LANDING_SLACK * baseStep;
            if (landing) {
                step = remaining;
            }

            // ビーム粒子の割り当てと堆積
            BeamState beam = state.getBeam();
            int beamFrom = beam.getCursor();
            int beamTo = beam.sliceEnd(xi, step);
            SourceTerms beamSources =
                    depositionEngine.deposit(beam.getParticles(), beamFrom, beamTo, step);

            SliceInput input = new SliceInput(state.getSliceIndex(), xi, step, state.getPopulation(),
                    state.getFields(), state.getSources(), state.getFields(), beamSources,
                    state.getIonModel().sourceContribution());
            SliceOutcome outcome = sliceSolver.solve(input);
            totalIterations += outcome.getIterations();

            if (!outcome.isConverged()) {
                retries++;
                boolean atMin = step <= minStep * (1.0 + 1e-12);
                if (atMin) {
                    state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);
                    if (state.getConsecutiveFailures() > maxRetriesAtMinStep) {
                        throw new NonConvergenceException(state.getSliceIndex(), xi, step,
                                outcome.getIterations(), outcome.getLastChange());
                    }
                }
                double next = Math.max(step * reductionFactor, minStep);
                log.warn("スライス {} が収束しませんでした。dξ={} → {} で再試行します（最小刻み幅での失敗={}）",
                        state.getSliceIndex(), fmt5(step), fmt5(next),
                        state.getConsecutiveFailures());
                state.setCurrentStep(next);
                continue;
            }

            double nextXi = landing ? xiEnd : xi - step;
            state.commitSlice(nextXi, outcome.getPopulation(), outcome.getFields(),
                    outcome.getSources());
            int removed = beamAdvancer.advance(beam, beamFrom, beamTo, outcome.getFields());
            beam.commitSlice(beamTo);
            state.setConsecutiveFailures(0);
            if (!landing) {
                state.setCurrentStep(Math.min(baseStep, state.getCurrentStep() / reductionFactor));
            }

            if (removed > 0) {
                log.warn("スライス {} でビーム粒子を {} 個除去しました", state.getSliceIndex(), removed);
            }

            int slice = state.getSliceIndex();
            for (SliceObserver o : observers) {
                o.onSliceCommitted(slice, nextXi, outcome.getFields(), outcome.getSources());
            }
            if (slice % progressEverySlices == 0) {
                log.info("スライス {} を確定しました。ξ={}、dξ={}、反復={}、場の変化={}", slice, fmt5(nextXi),
                        fmt5(step), outcome.getIterations(),
                        String.format(Locale.ROOT, "%.3e", outcome.getLastChange()));
            }
            notifyAtCadence(state, slice, lastNotified);
        }

        notifyFinal(state, lastNotified);
        long elapsed = elapsedMillis(t0);
        log.info("ξステッピングが完了しました。スライス数={}、反復合計={}、再試行={}、所要時間={}ms",
                state.getSliceIndex(), totalIterations, retries, elapsed);
        return new RunResult(RunResult.Status.COMPLETED, state.getSliceIndex(), state.getXi(),
                totalIterations, retries, elapsed);
    }

    private void notifyAtCadence(SimulationState state, int slice, int[] lastNotified) {
        SimulationSnapshot snapshot = null;
        for (int i = 0; i < observers.size(); i++) {
            SliceObserver o = observers.get(i);
            if (slice % o.everySlices() == 0) {
                if (snapshot == null) {
                    snapshot = state.snapshot();
                }
                o.onSnapshot(snapshot);
                lastNotified[i] = slice;
            }
        }
    }

    private void notifyFinal(SimulationState state, int[] lastNotified) {
        SimulationSnapshot snapshot = null;
        for (int i = 0; i < observers.size(); i++) {
            if (lastNotified[i] == state.getSliceIndex()) {
                continue;
            }
            if (snapshot == null) {
                snapshot = state.snapshot();
            }
            observers.get(i).onSnapshot(snapshot);
            lastNotified[i] = state.getSliceIndex();
        }
    }

    private static long elapsedMillis(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
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

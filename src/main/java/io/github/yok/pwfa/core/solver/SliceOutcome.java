package io.github.yok.pwfa.core.solver;

import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.particle.PlasmaPopulation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 1 スライスの固定点反復の結果です。
 *
 * <p>
 * 収束（{@link Status#CONVERGED}）なら場・ソース項・押し出し後の粗粒子を持ちます。 発散（{@link Status#DIVERGED}）なら最後の反復値を持ち、呼び出し側が刻み幅を縮めて再試行します。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SliceOutcome {

    /**
     * 反復の結末です。
     */
    public enum Status {
        CONVERGED, DIVERGED
    }

    Status status;

    /**
     * 最後の反復で得た場です。
     */
    FieldSet fields;

    /**
     * 最後の反復で得たソース項です。
     */
    SourceTerms sources;

    /**
     * 最後の反復で押し出した粗粒子です。
     */
    PlasmaPopulation population;

    /**
     * 実行した反復回数です。
     */
    int iterations;

    /**
     * 最後の反復での場の変化（max ノルム）です。
     */
    double lastChange;

    /**
     * 収束結果を作ります。
     *
     * @param fields 場です
     * @param sources ソース項です
     * @param population 押し出し後の粗粒子です
     * @param iterations 反復回数です
     * @param lastChange 最後の変化量です
     * @return 収束結果です
     */
    public static SliceOutcome converged(FieldSet fields, SourceTerms sources,
            PlasmaPopulation population, int iterations, double lastChange) {
        return new SliceOutcome(Status.CONVERGED, fields, sources, population, iterations,
                lastChange);
    }

    /**
     * 発散結果を作ります。
     *
     * @param lastIterate 最後の反復で得た場です（null 可）
     * @param iterations 反復回数です
     * @param lastChange 最後の変化量です
     * @return 発散結果です
     */
    public static SliceOutcome diverged(FieldSet lastIterate, int iterations, double lastChange) {
        return new SliceOutcome(Status.DIVERGED, lastIterate, null, null, iterations, lastChange);
    }

    /**
     * 収束したかどうかを返します。
     *
     * @return 収束なら true です
     */
    public boolean isConverged() {
        return status == Status.CONVERGED;
    }
}

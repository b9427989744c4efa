package io.github.yok.pwfa.core.solver;

/**
 * 1 スライス分の場とプラズマを自己無撞着に求めるインタフェースです。
 */
public interface SliceSolver {

    /**
     * スライスを解きます。
     *
     * <p>
     * 数値的な発散は例外ではなく {@link SliceOutcome.Status#DIVERGED} で返します。
     * </p>
     *
     * @param input スライス入力です
     * @return 結果です
     */
    SliceOutcome solve(SliceInput input);
}

package io.github.yok.pwfa.core.error;

import lombok.Getter;

/**
 * スライス内の固定点反復が上限回数以内に収束しなかったことを表す例外です。
 *
 * <p>
 * 刻み幅を縮めて再試行しても最小刻みで規定回数連続して失敗した場合に、xi ステッパが送出します（致命的）。
 * </p>
 */
@Getter
public class NonConvergenceException extends PwfaException {

    private static final long serialVersionUID = 1L;

    /**
     * 失敗したスライス番号です。
     */
    private final int sliceIndex;

    /**
     * 最後の試行で使った反復回数です。
     */
    private final int iterations;

    /**
     * 最後の反復での場の変化量（max ノルム）です。
     */
    private final double lastChange;

    /**
     * 例外を生成します。
     *
     * @param sliceIndex スライス番号です
     * @param xi 失敗したスライスの xi です
     * @param step 最後に試した刻み幅です
     * @param iterations 反復回数です
     * @param lastChange 最後の変化量です
     */
    public NonConvergenceException(int sliceIndex, double xi, double step, int iterations,
            double lastChange) {
        super("固定点反復が収束しませんでした: slice=" + sliceIndex + ", xi=" + xi + ", step=" + step
                + ", iterations=" + iterations + ", lastChange=" + lastChange);
        this.sliceIndex = sliceIndex;
        this.iterations = iterations;
        this.lastChange = lastChange;
    }
}

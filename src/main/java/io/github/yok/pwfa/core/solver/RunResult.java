package io.github.yok.pwfa.core.solver;

import lombok.Value;

/**
 * ξ ステッピング 1 回分の実行結果です。
 */
@Value
public class RunResult {

    /**
     * 終了の種別です。
     */
    public enum Status {
        COMPLETED, ABORTED
    }

    Status status;

    /**
     * 確定済みスライス数です。
     */
    int slices;

    /**
     * 終了時の ξ です。
     */
    double finalXi;

    /**
     * 全スライスの固定点反復回数の合計です。
     */
    long totalIterations;

    /**
     * 刻み幅を縮めて再試行した回数です。
     */
    int retries;

    /**
     * 所要時間（ミリ秒）です。
     */
    long elapsedMillis;
}

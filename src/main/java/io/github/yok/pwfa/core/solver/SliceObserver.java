package io.github.yok.pwfa.core.solver;

import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.state.SimulationSnapshot;

/**
 * スライス確定を受け取る観測者です（診断出力・チェックポイント）。
 */
public interface SliceObserver {

    /**
     * スナップショットを受け取る間隔（スライス数）を返します。
     *
     * @return 間隔です（1 以上）
     */
    int everySlices();

    /**
     * スナップショットを受け取ります。
     *
     * <p>
     * {@link #everySlices()} ごと、および最後のスライスの後に呼ばれます。
     * </p>
     *
     * @param snapshot 読み取り専用のスナップショットです
     */
    void onSnapshot(SimulationSnapshot snapshot);

    /**
     * 毎スライスの確定時に呼ばれます。
     *
     * @param sliceIndex 確定後のスライス数です
     * @param xi 確定後の ξ です
     * @param fields 収束した場です（変更しないこと）
     * @param sources 収束時のソース項です（変更しないこと）
     */
    default void onSliceCommitted(int sliceIndex, double xi, FieldSet fields,
            SourceTerms sources) {
        // 既定では何もしない
    }
}

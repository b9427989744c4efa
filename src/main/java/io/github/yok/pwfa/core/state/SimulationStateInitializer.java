package io.github.yok.pwfa.core.state;

/**
 * シミュレーション状態の初期値を生成するインターフェースです。
 */
public interface SimulationStateInitializer {

    /**
     * 初期化済みのシミュレーション状態を生成します。
     *
     * @return 初期化済みの状態です
     */
    SimulationState create();
}

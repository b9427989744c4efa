package io.github.yok.pwfa.core.state;

import io.github.yok.pwfa.core.model.Species;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * シミュレーション状態の読み取り専用スナップショットです。
 *
 * <p>
 * 診断出力とチェックポイント（JSON）の両方に使います。 配列はすべて状態から複製した値です。
 * </p>
 */
@Data
@NoArgsConstructor
public class SimulationSnapshot {

    /**
     * 確定済みスライス数です。
     */
    private int sliceIndex;

    /**
     * 現在の ξ です。
     */
    private double xi;

    /**
     * 次のスライスの刻み幅です。
     */
    private double currentStep;

    /**
     * 最小刻み幅での連続失敗回数です。
     */
    private int consecutiveFailures;

    /**
     * 格子点数 N です。
     */
    private int gridSteps;

    /**
     * プラズマ種ごとの粗粒子です。
     */
    private Map<Species, ParticleData> plasma;

    /**
     * ビームです。
     */
    private BeamData beam;

    /**
     * 直前に確定したスライスの場です。
     */
    private FieldData fields;

    /**
     * 直前に確定したスライスのソース項です。
     */
    private SourceData sources;

    /**
     * 静止イオン背景です（可動イオンの場合は null）。
     */
    private SourceData ionBackground;

    /**
     * 粒子群の値です。
     */
    @Data
    @NoArgsConstructor
    public static class ParticleData {
        private Species species;
        private double[] x;
        private double[] y;
        private double[] px;
        private double[] py;
        private double[] pz;
        private double[] weight;
        private boolean[] alive;
    }

    /**
     * ビームの値です。
     */
    @Data
    @NoArgsConstructor
    public static class BeamData {
        private ParticleData particles;
        private double[] xi;
        private double[] xiEntry;
        private int cursor;
    }

    /**
     * 場の値です（行優先で平坦化した N×N 配列）。
     */
    @Data
    @NoArgsConstructor
    public static class FieldData {
        private double[] ex;
        private double[] ey;
        private double[] ez;
        private double[] bx;
        private double[] by;
        private double[] bz;
    }

    /**
     * ソース項の値です（行優先で平坦化した N×N 配列）。
     */
    @Data
    @NoArgsConstructor
    public static class SourceData {
        private double[] rho;
        private double[] jx;
        private double[] jy;
        private double[] jz;
        private double particleCharge;
        private double absoluteCharge;
    }
}

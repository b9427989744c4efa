package io.github.yok.pwfa.core.model;

import lombok.Getter;

/**
 * 放物線型チャネルの密度分布を計算するクラスです。
 *
 * <p>
 * n(r) = n0 * (1 + depth * (r/R)^2)
 * </p>
 */
@Getter
public final class ParabolicChannelProfile implements DensityProfile {

    /**
     * 軸上密度 n0 です。
     */
    private final double axisDensity;

    /**
     * チャネル半径 R です。
     */
    private final double channelRadius;

    /**
     * 深さ depth です。
     */
    private final double depth;

    /**
     * 放物線型チャネルを生成します。
     *
     * @param axisDensity 軸上密度 n0 です（正）
     * @param channelRadius チャネル半径 R です（正）
     * @param depth 深さです（-1 より大きい）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ParabolicChannelProfile(double axisDensity, double channelRadius, double depth) {
        if (!(axisDensity > 0.0)) {
            throw new IllegalArgumentException("axisDensity は正である必要があります: " + axisDensity);
        }
        if (!(channelRadius > 0.0)) {
            throw new IllegalArgumentException("channelRadius は正である必要があります: " + channelRadius);
        }
        if (!(depth > -1.0)) {
            throw new IllegalArgumentException("depth は -1 より大きい必要があります: " + depth);
        }
        this.axisDensity = axisDensity;
        this.channelRadius = channelRadius;
        this.depth = depth;
    }

    @Override
    public double densityAt(double x, double y) {
        double rr = (x * x + y * y) / (channelRadius * channelRadius);
        return axisDensity * (1.0 + depth * rr);
    }
}

package io.github.yok.pwfa.core.model;

import lombok.Getter;

/**
 * 一様密度のプラズマです。
 */
@Getter
public final class UniformDensityProfile implements DensityProfile {

    /**
     * 密度です。
     */
    private final double density;

    /**
     * 一様密度を生成します。
     *
     * @param density 密度です（正）
     * @throws IllegalArgumentException density が正でない場合に発生します
     */
    public UniformDensityProfile(double density) {
        if (!(density > 0.0)) {
            throw new IllegalArgumentException("density は正である必要があります: " + density);
        }
        this.density = density;
    }

    @Override
    public double densityAt(double x, double y) {
        return density;
    }
}

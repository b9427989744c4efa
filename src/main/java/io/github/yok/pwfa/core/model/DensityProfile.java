package io.github.yok.pwfa.core.model;

/**
 * プラズマの横方向密度分布 n(x, y) を提供するインタフェースです。
 *
 * <p>
 * 粗粒子の初期重みはこの値から決まります。
 * </p>
 */
public interface DensityProfile {

    /**
     * 指定位置の密度を返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @return 密度です（0 以上）
     */
    double densityAt(double x, double y);
}

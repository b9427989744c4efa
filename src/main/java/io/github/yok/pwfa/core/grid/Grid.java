package io.github.yok.pwfa.core.grid;

/**
 * 場の計算と堆積で共有する横方向格子を表すインタフェースです。
 *
 * <p>
 * 格子は実行中不変で、すべてのコンポーネントから読み取り専用で参照されます。 ソルバ側は格子の具体形状を意識せず、格子点数・間隔・補間ステンシルのみを利用します。
 * </p>
 */
public interface Grid {

    /**
     * 1 軸あたりの格子点数 N を返します。
     *
     * @return 格子点数です
     */
    int steps();

    /**
     * 格子間隔 h を返します。
     *
     * @return 格子間隔です
     */
    double stepSize();

    /**
     * 格子点インデックスに対応する座標を返します。
     *
     * @param index 格子点インデックスです（0 以上 N 未満）
     * @return 座標です
     */
    double coordinateOf(int index);

    /**
     * 位置に最も近い格子点のインデックス (i, j) を返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @return 長さ 2 の配列 {i, j} です
     * @throws io.github.yok.pwfa.core.error.OutOfDomainException 位置が範囲外の場合に発生します
     */
    int[] cellIndex(double x, double y);

    /**
     * 位置の補間ステンシル（近傍 3x3 格子点と重み）を返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @return 補間ステンシルです
     * @throws io.github.yok.pwfa.core.error.OutOfDomainException ステンシルが格子からはみ出す場合に発生します
     */
    Stencil interpolationWeights(double x, double y);

    /**
     * 位置のステンシルが格子内に収まるかどうかを返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @return 収まる場合は true です
     */
    boolean contains(double x, double y);
}

package io.github.yok.pwfa.core.error;

import lombok.Getter;

/**
 * 粒子位置が格子の補間可能範囲の外にあることを表す例外です。
 *
 * <p>
 * 格子自体は方針を持たず、反射・除去などの扱いはプッシャ側の境界方針で決めます。
 * </p>
 */
@Getter
public class OutOfDomainException extends PwfaException {

    private static final long serialVersionUID = 1L;

    /**
     * x 座標です。
     */
    private final double x;

    /**
     * y 座標です。
     */
    private final double y;

    /**
     * 例外を生成します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @param limit 補間可能範囲の半幅です
     */
    public OutOfDomainException(double x, double y, double limit) {
        super("粒子位置が格子範囲外です: (x, y)=(" + x + ", " + y + "), 範囲=±" + limit);
        this.x = x;
        this.y = y;
    }
}

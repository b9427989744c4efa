package io.github.yok.pwfa.core.error;

/**
 * pwfa-solver のコアが送出する例外の基底クラスです。
 *
 * <p>
 * すべて非検査例外とし、回復可能かどうかは具象クラスごとに呼び出し側が判断します。
 * </p>
 */
public class PwfaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public PwfaException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public PwfaException(String message, Throwable cause) {
        super(message, cause);
    }
}

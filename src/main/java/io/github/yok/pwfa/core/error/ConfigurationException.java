package io.github.yok.pwfa.core.error;

/**
 * 設定値が不正で初期化を完了できないことを表す例外です。
 */
public class ConfigurationException extends PwfaException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public ConfigurationException(String message) {
        super(message);
    }
}

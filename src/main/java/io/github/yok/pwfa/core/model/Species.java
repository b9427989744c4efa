package io.github.yok.pwfa.core.model;

/**
 * 粒子種の閉じた集合です。
 */
public enum Species {

    /**
     * プラズマ電子です。
     */
    PLASMA_ELECTRON,

    /**
     * 可動プラズマイオンです（ions.mode=MOBILE のときのみ粒子として扱います）。
     */
    PLASMA_ION,

    /**
     * ドライバ／被加速ビームです。
     */
    BEAM;

    /**
     * 準静的プラズマ粒子として押し出される種かどうかを返します。
     *
     * @return プラズマ種なら true です
     */
    public boolean isPlasma() {
        return this != BEAM;
    }
}

package io.github.yok.pwfa.core.model;

import io.github.yok.pwfa.core.deposit.SourceTerms;

/**
 * 背景イオンのソース項への寄与を提供するインタフェースです。
 */
public interface BackgroundIonModel {

    /**
     * 各スライスのソース項に加える背景寄与を返します。
     *
     * @return 背景寄与です（呼び出し側は変更しないこと）
     */
    SourceTerms sourceContribution();

    /**
     * イオンを粒子として押し出す必要があるかを返します。
     *
     * @return 可動イオンなら true です
     */
    boolean isMobile();
}

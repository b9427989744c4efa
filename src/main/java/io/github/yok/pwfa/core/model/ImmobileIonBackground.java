package io.github.yok.pwfa.core.model;

import io.github.yok.pwfa.core.deposit.SourceTerms;

/**
 * 動かないイオン背景です。
 *
 * <p>
 * 初期の細粒子電子の堆積結果を符号反転して保持します。 電子が初期状態のままなら、総和は格子点ごとに厳密に 0 になります。
 * </p>
 */
public final class ImmobileIonBackground implements BackgroundIonModel {

    private final SourceTerms contribution;

    /**
     * 背景を生成します。
     *
     * @param initialElectronSources 初期の細粒子電子を堆積したソース項です
     * @return 符号反転した背景です
     */
    public static ImmobileIonBackground neutralizing(SourceTerms initialElectronSources) {
        if (initialElectronSources == null) {
            throw new IllegalArgumentException("initialElectronSources は null 不可です");
        }
        SourceTerms neg = initialElectronSources.negate();
        // 静止イオンは電流を持たない
        neg.getJx().zero();
        neg.getJy().zero();
        neg.getJz().zero();
        return new ImmobileIonBackground(neg);
    }

    /**
     * 保存済みの背景寄与から復元します。
     *
     * @param contribution 背景寄与です
     */
    public ImmobileIonBackground(SourceTerms contribution) {
        if (contribution == null) {
            throw new IllegalArgumentException("contribution は null 不可です");
        }
        this.contribution = contribution;
    }

    @Override
    public SourceTerms sourceContribution() {
        return contribution;
    }

    @Override
    public boolean isMobile() {
        return false;
    }
}

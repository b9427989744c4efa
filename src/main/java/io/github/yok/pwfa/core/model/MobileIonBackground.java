package io.github.yok.pwfa.core.model;

import io.github.yok.pwfa.core.deposit.SourceTerms;

/**
 * 可動イオンの場合の背景です。
 *
 * <p>
 * イオンは {@link Species#PLASMA_ION} の粗粒子として別に押し出されるため、背景寄与は 0 です。
 * </p>
 */
public final class MobileIonBackground implements BackgroundIonModel {

    private final SourceTerms zero;

    /**
     * 背景を生成します。
     *
     * @param steps 格子点数です
     */
    public MobileIonBackground(int steps) {
        this.zero = SourceTerms.zeros(steps);
    }

    @Override
    public SourceTerms sourceContribution() {
        return zero;
    }

    @Override
    public boolean isMobile() {
        return true;
    }
}

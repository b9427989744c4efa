package io.github.yok.pwfa.core.deposit;

import io.github.yok.pwfa.core.particle.ParticleArrays;

/**
 * 粒子の電荷・電流を格子へ堆積するインタフェースです。
 *
 * <p>
 * 堆積は粒子を変更しません。 格子上の総電荷は粒子の実効電荷の総和と丸め誤差の範囲で一致します。
 * </p>
 */
public interface DepositionEngine {

    /**
     * 全粒子を堆積します。
     *
     * @param particles 粒子群です
     * @param sliceStep スライス刻み幅です
     * @return ソース項です
     */
    default SourceTerms deposit(ParticleArrays particles, double sliceStep) {
        return deposit(particles, 0, particles.size(), sliceStep);
    }

    /**
     * 指定範囲 [from, to) の粒子を堆積します。
     *
     * @param particles 粒子群です
     * @param from 開始インデックスです（含む）
     * @param to 終了インデックスです（含まない）
     * @param sliceStep スライス刻み幅です
     * @return ソース項です
     */
    SourceTerms deposit(ParticleArrays particles, int from, int to, double sliceStep);
}

package io.github.yok.pwfa.core.deposit;

import io.github.yok.pwfa.core.particle.ParticleArrays;

/**
 * 粒子 1 個の実効電荷と電流を計算するカーネルです。
 *
 * <p>
 * 粒子種ごとに {@link ShapeFunctionDepositionEngine} のディスパッチ表へ登録します。
 * </p>
 */
public interface ParticleChargeKernel {

    /**
     * 粒子 k の寄与を計算します。
     *
     * @param particles 粒子群です
     * @param k 粒子インデックスです
     * @param charge 単位重みあたりの電荷です
     * @param mass 単位重みあたりの質量です
     * @param sliceStep スライス刻み幅です
     * @param out 出力先（長さ 4：dq, jx, jy, jz）です
     */
    void contribution(ParticleArrays particles, int k, double charge, double mass,
            double sliceStep, double[] out);
}

package io.github.yok.pwfa.core.deposit;

import io.github.yok.pwfa.core.particle.ParticleArrays;

/**
 * 超相対論的ビーム粒子のカーネルです（dq = w q / dξ、jz = dq、横電流なし）。
 */
public final class UltraRelativisticBeamKernel implements ParticleChargeKernel {

    @Override
    public void contribution(ParticleArrays particles, int k, double charge, double mass,
            double sliceStep, double[] out) {
        double dq = particles.getWeight()[k] * charge / sliceStep;
        out[0] = dq;
        out[1] = 0.0;
        out[2] = 0.0;
        out[3] = dq;
    }
}

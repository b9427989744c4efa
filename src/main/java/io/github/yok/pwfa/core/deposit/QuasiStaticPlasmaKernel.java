package io.github.yok.pwfa.core.deposit;

import io.github.yok.pwfa.core.particle.ParticleArrays;

/**
 * 準静的プラズマ粒子のカーネルです。
 *
 * <p>
 * gm = sqrt(m^2 + p^2)、dq = w q / (1 - pz/gm)、j = p/gm * dq です。
 * </p>
 */
public final class QuasiStaticPlasmaKernel implements ParticleChargeKernel {

    @Override
    public void contribution(ParticleArrays particles, int k, double charge, double mass,
            double sliceStep, double[] out) {
        double px = particles.getPx()[k];
        double py = particles.getPy()[k];
        double pz = particles.getPz()[k];
        double gm = Math.sqrt(mass * mass + px * px + py * py + pz * pz);
        double dq = particles.getWeight()[k] * charge / (1.0 - pz / gm);
        out[0] = dq;
        out[1] = px / gm * dq;
        out[2] = py / gm * dq;
        out[3] = pz / gm * dq;
    }
}

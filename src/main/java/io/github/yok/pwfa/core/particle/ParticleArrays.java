package io.github.yok.pwfa.core.particle;

import io.github.yok.pwfa.core.model.Species;
import java.util.Arrays;
import lombok.Getter;

/**
 * 同一種の粒子群を構造体配列（SoA）で保持するクラスです。
 *
 * <p>
 * 運動量は物理粒子 1 個あたりの値、重みは統計重みです。 重みは押し出しで変化しません。 除去された粒子は {@code alive=false} のまま配列に残ります。
 * </p>
 */
@Getter
public final class ParticleArrays {

    /**
     * 粒子種です。
     */
    private final Species species;

    /**
     * x 座標です。
     */
    private final double[] x;

    /**
     * y 座標です。
     */
    private final double[] y;

    /**
     * 運動量 px です。
     */
    private final double[] px;

    /**
     * 運動量 py です。
     */
    private final double[] py;

    /**
     * 運動量 pz です。
     */
    private final double[] pz;

    /**
     * 統計重みです。
     */
    private final double[] weight;

    /**
     * 生存フラグです。
     */
    private final boolean[] alive;

    /**
     * 全粒子を生存状態・ゼロ値で確保します。
     *
     * @param species 粒子種です
     * @param size 粒子数です（0 以上）
     */
    public ParticleArrays(Species species, int size) {
        if (species == null) {
            throw new IllegalArgumentException("species は null 不可です");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size は 0 以上が必要です: " + size);
        }
        this.species = species;
        this.x = new double[size];
        this.y = new double[size];
        this.px = new double[size];
        this.py = new double[size];
        this.pz = new double[size];
        this.weight = new double[size];
        this.alive = new boolean[size];
        Arrays.fill(alive, true);
    }

    /**
     * 既存の配列を包んで生成します（配列は複製しません）。
     *
     * @param species 粒子種です
     * @param x x 座標です
     * @param y y 座標です
     * @param px 運動量 px です
     * @param py 運動量 py です
     * @param pz 運動量 pz です
     * @param weight 統計重みです
     * @param alive 生存フラグです
     * @throws IllegalArgumentException 配列長が揃っていない場合に発生します
     */
    public ParticleArrays(Species species, double[] x, double[] y, double[] px, double[] py,
            double[] pz, double[] weight, boolean[] alive) {
        if (species == null) {
            throw new IllegalArgumentException("species は null 不可です");
        }
        int n = x.length;
        if (y.length != n || px.length != n || py.length != n || pz.length != n
                || weight.length != n || alive.length != n) {
            throw new IllegalArgumentException("配列長が一致しません: species=" + species);
        }
        this.species = species;
        this.x = x;
        this.y = y;
        this.px = px;
        this.py = py;
        this.pz = pz;
        this.weight = weight;
        this.alive = alive;
    }

    /**
     * 粒子数（除去済みを含む）を返します。
     *
     * @return 粒子数です
     */
    public int size() {
        return x.length;
    }

    /**
     * 生存粒子数を返します。
     *
     * @return 生存粒子数です
     */
    public int aliveCount() {
        int c = 0;
        for (boolean a : alive) {
            if (a) {
                c++;
            }
        }
        return c;
    }

    /**
     * 深い複製を返します。
     *
     * @return 複製です
     */
    public ParticleArrays copy() {
        return new ParticleArrays(species, x.clone(), y.clone(), px.clone(), py.clone(), pz.clone(),
                weight.clone(), alive.clone());
    }
}

package io.github.yok.pwfa.core.particle;

import io.github.yok.pwfa.core.model.Species;
import lombok.Getter;

/**
 * ビーム粒子群と、スライスへの割り当て情報を保持するクラスです。
 *
 * <p>
 * 粒子は進入座標 {@code xiEntry} の降順に並び、{@code cursor} より前の粒子は今回の走査で前進済みです。 除去された粒子は復活しません。
 * </p>
 */
@Getter
public final class BeamState {

    /**
     * ビーム粒子群です。
     */
    private final ParticleArrays particles;

    /**
     * 粒子ごとの縦方向座標 ξ です。
     */
    private final double[] xi;

    /**
     * 粒子ごとのスライス進入座標です（降順）。
     */
    private final double[] xiEntry;

    /**
     * 未前進の先頭粒子のインデックスです。
     */
    private int cursor;

    /**
     * ビーム状態を生成します。
     *
     * @param particles ビーム粒子群です
     * @param xi 縦方向座標です
     * @param xiEntry 進入座標です（降順）
     * @param cursor 未前進の先頭粒子のインデックスです
     * @throws IllegalArgumentException 配列長・並び順・カーソルが不正な場合に発生します
     */
    public BeamState(ParticleArrays particles, double[] xi, double[] xiEntry, int cursor) {
        if (particles == null || xi == null || xiEntry == null) {
            throw new IllegalArgumentException("particles/xi/xiEntry は null 不可です");
        }
        if (particles.getSpecies() != Species.BEAM) {
            throw new IllegalArgumentException("ビーム以外の粒子種です: " + particles.getSpecies());
        }
        int n = particles.size();
        if (xi.length != n || xiEntry.length != n) {
            throw new IllegalArgumentException("配列長が一致しません");
        }
        for (int k = 1; k < n; k++) {
            if (xiEntry[k] > xiEntry[k - 1]) {
                throw new IllegalArgumentException("xiEntry が降順ではありません: index=" + k);
            }
        }
        if (cursor < 0 || cursor > n) {
            throw new IllegalArgumentException("cursor が範囲外です: " + cursor);
        }
        this.particles = particles;
        this.xi = xi;
        this.xiEntry = xiEntry;
        this.cursor = cursor;
    }

    /**
     * 粒子を持たないビームを返します。
     *
     * @return 空のビームです
     */
    public static BeamState empty() {
        return new BeamState(new ParticleArrays(Species.BEAM, 0), new double[0], new double[0], 0);
    }

    /**
     * スライス (xi - step, xi] に進入する粒子範囲の終端（含まない）を返します。
     *
     * <p>
     * 範囲は {@code [cursor, end)} です。
     * </p>
     *
     * @param sliceXi スライス開始の ξ です
     * @param step スライス刻み幅です
     * @return 範囲の終端です
     */
    public int sliceEnd(double sliceXi, double step) {
        double lower = sliceXi - step;
        int end = cursor;
        while (end < xiEntry.length && xiEntry[end] > lower) {
            end++;
        }
        return end;
    }

    /**
     * スライス確定時にカーソルを進めます。
     *
     * @param end 前進済みにした範囲の終端です
     */
    public void commitSlice(int end) {
        if (end < cursor || end > xiEntry.length) {
            throw new IllegalArgumentException("end が範囲外です: " + end);
        }
        this.cursor = end;
    }
}

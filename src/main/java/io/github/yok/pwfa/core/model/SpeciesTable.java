package io.github.yok.pwfa.core.model;

import io.github.yok.pwfa.app.PwfaProperties;
import java.util.EnumMap;
import java.util.Map;

/**
 * 粒子種ごとの電荷と質量（単位重みあたり）を保持するテーブルです。
 *
 * <p>
 * 電荷質量比は粒子ではなく種の性質として扱います。 プラズマ単位では電子の電荷は -1、質量は 1 です。
 * </p>
 */
public final class SpeciesTable {

    private final Map<Species, Double> charges;
    private final Map<Species, Double> masses;

    /**
     * テーブルを生成します。
     *
     * @param charges 種ごとの電荷です（全種が必要です）
     * @param masses 種ごとの質量です（全種が必要で、正）
     * @throws IllegalArgumentException 欠落または不正値がある場合に発生します
     */
    public SpeciesTable(Map<Species, Double> charges, Map<Species, Double> masses) {
        if (charges == null || masses == null) {
            throw new IllegalArgumentException("charges/masses は null 不可です");
        }
        this.charges = new EnumMap<>(Species.class);
        this.masses = new EnumMap<>(Species.class);
        for (Species s : Species.values()) {
            Double q = charges.get(s);
            Double m = masses.get(s);
            if (q == null || m == null) {
                throw new IllegalArgumentException("電荷・質量が未定義の粒子種があります: " + s);
            }
            if (!(m > 0.0)) {
                throw new IllegalArgumentException("質量は正の値が必要です: " + s + "=" + m);
            }
            this.charges.put(s, q);
            this.masses.put(s, m);
        }
    }

    /**
     * 設定値からテーブルを作ります。
     *
     * @param p 設定値です
     * @return 粒子種テーブルです
     */
    public static SpeciesTable from(PwfaProperties p) {
        Map<Species, Double> q = new EnumMap<>(Species.class);
        Map<Species, Double> m = new EnumMap<>(Species.class);
        q.put(Species.PLASMA_ELECTRON, -1.0);
        m.put(Species.PLASMA_ELECTRON, 1.0);
        q.put(Species.PLASMA_ION, p.getIons().getCharge());
        m.put(Species.PLASMA_ION, p.getIons().getMassRatio());
        q.put(Species.BEAM, p.getBeam().getCharge());
        m.put(Species.BEAM, p.getBeam().getMassRatio());
        return new SpeciesTable(q, m);
    }

    /**
     * 単位重みあたりの電荷を返します。
     *
     * @param species 粒子種です
     * @return 電荷です
     */
    public double chargeOf(Species species) {
        return charges.get(species);
    }

    /**
     * 単位重みあたりの質量を返します。
     *
     * @param species 粒子種です
     * @return 質量です
     */
    public double massOf(Species species) {
        return masses.get(species);
    }
}

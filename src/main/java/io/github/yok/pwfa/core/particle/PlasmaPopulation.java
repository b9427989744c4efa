package io.github.yok.pwfa.core.particle;

import io.github.yok.pwfa.core.model.Species;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * プラズマ種ごとの粗粒子群と、その初期配置を保持するクラスです。
 *
 * <p>
 * 粗粒子群は永続化される正本で、スライス確定時にだけ置き換えられます。 細粒子群はここには保持せず、{@link FineParticleRefiner} で都度生成します。
 * </p>
 */
public final class PlasmaPopulation {

    /**
     * 初期配置です（全種で共通）。
     */
    @Getter
    private final PlasmaLattice lattice;

    private final Map<Species, ParticleArrays> coarse;

    /**
     * 集団を生成します。
     *
     * @param lattice 初期配置です
     * @param coarse プラズマ種ごとの粗粒子群です
     */
    public PlasmaPopulation(PlasmaLattice lattice, Map<Species, ParticleArrays> coarse) {
        if (lattice == null || coarse == null || coarse.isEmpty()) {
            throw new IllegalArgumentException("lattice/coarse は必須です");
        }
        int expected = lattice.coarseSize() * lattice.coarseSize();
        for (Map.Entry<Species, ParticleArrays> e : coarse.entrySet()) {
            if (!e.getKey().isPlasma()) {
                throw new IllegalArgumentException("プラズマ種ではありません: " + e.getKey());
            }
            if (e.getValue().size() != expected) {
                throw new IllegalArgumentException("粗粒子数が配置と一致しません: " + e.getKey() + "="
                        + e.getValue().size() + ", expected=" + expected);
            }
        }
        this.lattice = lattice;
        this.coarse = Collections.unmodifiableMap(new EnumMap<>(coarse));
    }

    /**
     * 含まれるプラズマ種を列挙順で返します。
     *
     * @return プラズマ種の集合です
     */
    public Set<Species> species() {
        return coarse.keySet();
    }

    /**
     * 指定種の粗粒子群を返します。
     *
     * @param species プラズマ種です
     * @return 粗粒子群です
     */
    public ParticleArrays coarse(Species species) {
        ParticleArrays p = coarse.get(species);
        if (p == null) {
            throw new IllegalArgumentException("含まれない粒子種です: " + species);
        }
        return p;
    }
}

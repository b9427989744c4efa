package io.github.yok.pwfa.core.state;

import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.model.BackgroundIonModel;
import io.github.yok.pwfa.core.model.ImmobileIonBackground;
import io.github.yok.pwfa.core.model.MobileIonBackground;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.particle.BeamState;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import io.github.yok.pwfa.core.particle.PlasmaLattice;
import io.github.yok.pwfa.core.particle.PlasmaPopulation;
import io.github.yok.pwfa.core.state.SimulationSnapshot.BeamData;
import io.github.yok.pwfa.core.state.SimulationSnapshot.FieldData;
import io.github.yok.pwfa.core.state.SimulationSnapshot.ParticleData;
import io.github.yok.pwfa.core.state.SimulationSnapshot.SourceData;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.ejml.data.DMatrixRMaj;

/**
 * ξ ステッピングの状態を保持するクラスです。
 *
 * <p>
 * ステッパだけが更新します。 それ以外の利用者は {@link #snapshot()} の複製を読みます。
 * </p>
 */
@Getter
public final class SimulationState {

    /**
     * 確定済みスライス数です。
     */
    private int sliceIndex;

    /**
     * 現在の ξ です。
     */
    private double xi;

    /**
     * 次のスライスの刻み幅です（縮小中は設定値より小さい）。
     */
    @Setter
    private double currentStep;

    /**
     * 最小刻み幅での連続失敗回数です。
     */
    @Setter
    private int consecutiveFailures;

    /**
     * プラズマ粗粒子です。
     */
    private PlasmaPopulation population;

    /**
     * ビームです。
     */
    private final BeamState beam;

    /**
     * 直前に確定したスライスの場です。
     */
    private FieldSet fields;

    /**
     * 直前に確定したスライスのソース項です。
     */
    private SourceTerms sources;

    /**
     * 背景イオンです。
     */
    private final BackgroundIonModel ionModel;

    /**
     * 状態を生成します。
     *
     * @param sliceIndex 確定済みスライス数です
     * @param xi 現在の ξ です
     * @param currentStep 次のスライスの刻み幅です
     * @param consecutiveFailures 最小刻み幅での連続失敗回数です
     * @param population プラズマ粗粒子です
     * @param beam ビームです
     * @param fields 直前スライスの場です
     * @param sources 直前スライスのソース項です
     * @param ionModel 背景イオンです
     */
    public SimulationState(int sliceIndex, double xi, double currentStep, int consecutiveFailures,
            PlasmaPopulation population, BeamState beam, FieldSet fields, SourceTerms sources,
            BackgroundIonModel ionModel) {
        if (population == null || beam == null || fields == null || sources == null
                || ionModel == null) {
            throw new IllegalArgumentException("population/beam/fields/sources/ionModel は null 不可です");
        }
        if (!(currentStep > 0.0)) {
            throw new IllegalArgumentException("currentStep は正の値が必要です: " + currentStep);
        }
        this.sliceIndex = sliceIndex;
        this.xi = xi;
        this.currentStep = currentStep;
        this.consecutiveFailures = consecutiveFailures;
        this.population = population;
        this.beam = beam;
        this.fields = fields;
        this.sources = sources;
        this.ionModel = ionModel;
    }

    /**
     * スライスを確定します。
     *
     * @param nextXi 確定後の ξ です
     * @param newPopulation 押し出し後の粗粒子です
     * @param newFields 収束した場です
     * @param newSources 収束時のソース項です
     */
    public void commitSlice(double nextXi, PlasmaPopulation newPopulation, FieldSet newFields,
            SourceTerms newSources) {
        if (newPopulation == null || newFields == null || newSources == null) {
            throw new IllegalArgumentException("newPopulation/newFields/newSources は null 不可です");
        }
        this.xi = nextXi;
        this.population = newPopulation;
        this.fields = newFields;
        this.sources = newSources;
        this.sliceIndex++;
    }

    /**
     * 現在の状態の複製をスナップショットとして返します。
     *
     * @return スナップショットです
     */
    public SimulationSnapshot snapshot() {
        SimulationSnapshot s = new SimulationSnapshot();
        s.setSliceIndex(sliceIndex);
        s.setXi(xi);
        s.setCurrentStep(currentStep);
        s.setConsecutiveFailures(consecutiveFailures);
        s.setGridSteps(fields.steps());

        Map<Species, ParticleData> plasma = new EnumMap<>(Species.class);
        for (Species sp : population.species()) {
            plasma.put(sp, toData(population.coarse(sp)));
        }
        s.setPlasma(plasma);

        BeamData b = new BeamData();
        b.setParticles(toData(beam.getParticles()));
        b.setXi(beam.getXi().clone());
        b.setXiEntry(beam.getXiEntry().clone());
        b.setCursor(beam.getCursor());
        s.setBeam(b);

        FieldData f = new FieldData();
        f.setEx(fields.getEx().data.clone());
        f.setEy(fields.getEy().data.clone());
        f.setEz(fields.getEz().data.clone());
        f.setBx(fields.getBx().data.clone());
        f.setBy(fields.getBy().data.clone());
        f.setBz(fields.getBz().data.clone());
        s.setFields(f);

        s.setSources(toData(sources));
        s.setIonBackground(ionModel.isMobile() ? null : toData(ionModel.sourceContribution()));
        return s;
    }

    /**
     * スナップショットから状態を復元します。
     *
     * @param s スナップショットです
     * @param lattice プラズマの初期配置（設定から再構築したもの）です
     * @return 復元した状態です
     * @throws IllegalArgumentException スナップショットが配置・格子と整合しない場合に発生します
     */
    public static SimulationState restore(SimulationSnapshot s, PlasmaLattice lattice) {
        if (s == null || lattice == null) {
            throw new IllegalArgumentException("snapshot/lattice は null 不可です");
        }
        if (s.getPlasma() == null || s.getBeam() == null || s.getFields() == null
                || s.getSources() == null) {
            throw new IllegalArgumentException("スナップショットに必須項目がありません");
        }
        int steps = s.getGridSteps();

        Map<Species, ParticleArrays> coarse = new EnumMap<>(Species.class);
        for (Map.Entry<Species, ParticleData> e : s.getPlasma().entrySet()) {
            coarse.put(e.getKey(), fromData(e.getValue()));
        }
        PlasmaPopulation population = new PlasmaPopulation(lattice, coarse);

        BeamData b = s.getBeam();
        BeamState beam = new BeamState(fromData(b.getParticles()), b.getXi().clone(),
                b.getXiEntry().clone(), b.getCursor());

        FieldData f = s.getFields();
        FieldSet fields = new FieldSet(matrix(steps, f.getEx()), matrix(steps, f.getEy()),
                matrix(steps, f.getEz()), matrix(steps, f.getBx()), matrix(steps, f.getBy()),
                matrix(steps, f.getBz()));

        BackgroundIonModel ions = (s.getIonBackground() == null) ? new MobileIonBackground(steps)
                : new ImmobileIonBackground(fromData(steps, s.getIonBackground()));

        return new SimulationState(s.getSliceIndex(), s.getXi(), s.getCurrentStep(),
                s.getConsecutiveFailures(), population, beam, fields,
                fromData(steps, s.getSources()), ions);
    }

    private static ParticleData toData(ParticleArrays p) {
        ParticleData d = new ParticleData();
        d.setSpecies(p.getSpecies());
        d.setX(p.getX().clone());
        d.setY(p.getY().clone());
        d.setPx(p.getPx().clone());
        d.setPy(p.getPy().clone());
        d.setPz(p.getPz().clone());
        d.setWeight(p.getWeight().clone());
        d.setAlive(p.getAlive().clone());
        return d;
    }

    private static ParticleArrays fromData(ParticleData d) {
        return new ParticleArrays(d.getSpecies(), d.getX().clone(), d.getY().clone(),
                d.getPx().clone(), d.getPy().clone(), d.getPz().clone(), d.getWeight().clone(),
                d.getAlive().clone());
    }

    private static SourceData toData(SourceTerms t) {
        SourceData d = new SourceData();
        d.setRho(t.getRho().data.clone());
        d.setJx(t.getJx().data.clone());
        d.setJy(t.getJy().data.clone());
        d.setJz(t.getJz().data.clone());
        d.setParticleCharge(t.getParticleCharge());
        d.setAbsoluteCharge(t.getAbsoluteCharge());
        return d;
    }

    private static SourceTerms fromData(int steps, SourceData d) {
        return new SourceTerms(matrix(steps, d.getRho()), matrix(steps, d.getJx()),
                matrix(steps, d.getJy()), matrix(steps, d.getJz()), d.getParticleCharge(),
                d.getAbsoluteCharge());
    }

    private static DMatrixRMaj matrix(int steps, double[] data) {
        if (data == null || data.length != steps * steps) {
            throw new IllegalArgumentException("配列長が格子と一致しません: steps=" + steps);
        }
        return DMatrixRMaj.wrap(steps, steps, data.clone());
    }
}

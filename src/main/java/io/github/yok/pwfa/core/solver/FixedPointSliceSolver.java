package io.github.yok.pwfa.core.solver;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.app.PwfaProperties.Solver.FineRefresh;
import io.github.yok.pwfa.core.deposit.DepositionEngine;
import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.field.FieldSolver;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.particle.FineParticleRefiner;
import io.github.yok.pwfa.core.particle.ParticleArrays;
import io.github.yok.pwfa.core.particle.PlasmaLattice;
import io.github.yok.pwfa.core.particle.PlasmaPopulation;
import io.github.yok.pwfa.core.particle.PlasmaPusher;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * スライスごとの固定点反復を実行するクラスです。
 *
 * <p>
 * 場の推定 → 平均場で粗粒子を押し出し → 細粒子化 → 堆積 → 電荷保存検査 → 場の計算 → 推定との差で収束判定、を反復します。 初回の推定は入力の
 * {@code initialGuess}（通常は直前スライスの場）です。
 * </p>
 */
@Getter
@Slf4j
public final class FixedPointSliceSolver implements SliceSolver {

    private final PlasmaPusher pusher;
    private final FineParticleRefiner refiner;
    private final DepositionEngine depositionEngine;
    private final FieldSolver fieldSolver;

    /**
     * スライスあたりの最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 反復間の場の変化（max ノルム）の許容上限です。
     */
    private final double tolerance;

    /**
     * 電荷保存検査の相対許容誤差です。
     */
    private final double chargeTolerance;

    /**
     * 細粒子の再生成方針です。
     */
    private final FineRefresh fineRefresh;

    /**
     * 固定点ソルバを生成します。
     *
     * @param pusher プラズマ押し出し器です（null 不可）
     * @param refiner 細粒子生成器です（null 不可）
     * @param depositionEngine 堆積エンジンです（null 不可）
     * @param fieldSolver 場のソルバです（null 不可）
     * @param solver ソルバ設定です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public FixedPointSliceSolver(PlasmaPusher pusher, FineParticleRefiner refiner,
            DepositionEngine depositionEngine, FieldSolver fieldSolver,
            PwfaProperties.Solver solver) {
        if (pusher == null) {
            throw new IllegalArgumentException("pusher は null 不可です");
        }
        if (refiner == null) {
            throw new IllegalArgumentException("refiner は null 不可です");
        }
        if (depositionEngine == null) {
            throw new IllegalArgumentException("depositionEngine は null 不可です");
        }
        if (fieldSolver == null) {
            throw new IllegalArgumentException("fieldSolver は null 不可です");
        }
        if (solver == null) {
            throw new IllegalArgumentException("solver は null 不可です");
        }
        if (solver.getMaxIterations() <= 0) {
            throw new IllegalArgumentException(
                    "solver.maxIterations は 1 以上が必要です: " + solver.getMaxIterations());
        }
        if (!(solver.getTolerance() > 0.0)) {
            throw new IllegalArgumentException(
                    "solver.tolerance は 0 より大きい必要があります: " + solver.getTolerance());
        }
        this.pusher = pusher;
        this.refiner = refiner;
        this.depositionEngine = depositionEngine;
        this.fieldSolver = fieldSolver;
        this.maxIterations = solver.getMaxIterations();
        this.tolerance = solver.getTolerance();
        this.chargeTolerance = solver.getChargeTolerance();
        this.fineRefresh = solver.getFineRefresh();
    }

    @Override
    public SliceOutcome solve(SliceInput input) {
        if (input == null) {
            throw new IllegalArgumentException("input は null 不可です");
        }
        int slice = input.getSliceIndex();
        double d = input.getSliceStep();
        PlasmaPopulation start = input.getPopulation();
        PlasmaLattice lattice = start.getLattice();
        FieldSet previous = input.getPreviousFields();

        // 初回の位置推定（場なし）
        Map<Species, ParticleArrays> coarseEstimate = new EnumMap<>(Species.class);
        Map<Species, ParticleArrays> fineStart = new EnumMap<>(Species.class);
        Map<Species, ParticleArrays> fineEstimate = new EnumMap<>(Species.class);
        for (Species s : start.species()) {
            ParticleArrays c = start.coarse(s);
            coarseEstimate.put(s, pusher.estimateWithoutFields(c, d));
            if (fineRefresh == FineRefresh.PER_SLICE) {
                ParticleArrays f = refiner.refine(c, lattice);
                fineStart.put(s, f);
                fineEstimate.put(s, pusher.estimateWithoutFields(f, d));
            }
        }

        FieldSet guess = input.getInitialGuess();
        double change = Double.POSITIVE_INFINITY;

        for (int iter = 1; iter <= maxIterations; iter++) {
            FieldSet averaged = FieldSet.average(previous, guess);

            // 1) 押し出しと堆積（種ごとに別のソース項へ）
            Map<Species, ParticleArrays> pushed = new EnumMap<>(Species.class);
            SourceTerms total = SourceTerms.zeros(previous.steps());
            for (Species s : start.species()) {
                ParticleArrays c = pusher.push(start.coarse(s), coarseEstimate.get(s), averaged, d);
                pushed.put(s, c);

                ParticleArrays fine;
                if (fineRefresh == FineRefresh.PER_ITERATION) {
                    fine = refiner.refine(c, lattice);
                } else {
                    fine = pusher.push(fineStart.get(s), fineEstimate.get(s), averaged, d);
                    fineEstimate.put(s, fine);
                }
                total.addInPlace(depositionEngine.deposit(fine, d));
            }
            coarseEstimate = pushed;

            // 2) 背景とビーム
            total.addInPlace(input.getIonBackground());
            total.addInPlace(input.getBeamSources());

            // 3) 電荷保存（破れていれば致命的）
            total.verifyChargeConservation(slice, chargeTolerance);

            // 4) 場
            FieldSet next = fieldSolver.solve(total, input.getPreviousSources(), previous, guess, d);
            change = next.maxAbsDifference(guess);
            guess = next;

            if (log.isDebugEnabled()) {
                log.debug("スライス {} 反復 {} / {}：場の変化={}（許容={}）", slice, iter, maxIterations,
                        fmtE(change), fmtE(tolerance));
            }

            if (!Double.isFinite(change)) {
                log.warn("スライス {} の場が有限値ではなくなりました。反復={}", slice, iter);
                return SliceOutcome.diverged(next, iter, change);
            }
            if (change < tolerance) {
                return SliceOutcome.converged(next, total,
                        new PlasmaPopulation(lattice, pushed), iter, change);
            }
        }

        log.warn("スライス {} が未収束で終了しました。反復={}、場の変化={}（許容={}）、dξ={}", slice, maxIterations,
                fmtE(change), fmtE(tolerance), fmt5(d));
        return SliceOutcome.diverged(guess, maxIterations, change);
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 数値を指数表記（有効数字 3 桁）に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }
}

package io.github.yok.pwfa.core.field;

import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.pwfa.core.linearalgebra.LaplacianEigenBasis;
import io.github.yok.pwfa.core.linearalgebra.LaplacianEigenBasis.Kind;
import io.github.yok.pwfa.core.linearalgebra.SpectralHelmholtzSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 準静的近似の場の方程式を解くクラスです。
 *
 * <p>
 * 内部格子点で以下を解きます（周辺格子点は 0 固定）。 横方向の場は Helmholtz 係数 k を入れた形（subtraction trick）で、推定値の平均 F_avg
 * を右辺に戻します。
 * </p>
 *
 * <ul>
 * <li>(-Δ + k) Ex = -(∂ρ/∂x - ∂Jx/∂ξ) + k Ex_avg</li>
 * <li>(-Δ + k) Ey = -(∂ρ/∂y - ∂Jy/∂ξ) + k Ey_avg</li>
 * <li>(-Δ + k) Bx = +(∂Jz/∂y - ∂Jy/∂ξ) + k Bx_avg</li>
 * <li>(-Δ + k) By = -(∂Jz/∂x - ∂Jx/∂ξ) + k By_avg</li>
 * <li>-Δ Ez = -(∂Jx/∂x + ∂Jy/∂y)</li>
 * <li>-Δ Bz = -(∂Jx/∂y - ∂Jy/∂x)</li>
 * </ul>
 *
 * <p>
 * ∂J/∂ξ は (J_prev - J) / dξ で近似します（ξ は減少方向に進むため）。
 * </p>
 */
@Getter
@Slf4j
public final class QuasiStaticFieldSolver implements FieldSolver {

    private final int steps;
    private final double stepSize;
    private final double subtractionTrick;
    private final PwfaProperties.Solver.FieldBoundary boundary;
    private final boolean solveBz;

    private final SpectralHelmholtzSolver exSolver;
    private final SpectralHelmholtzSolver eySolver;
    private final SpectralHelmholtzSolver bxSolver;
    private final SpectralHelmholtzSolver bySolver;
    private final SpectralHelmholtzSolver ezSolver;
    private final SpectralHelmholtzSolver bzSolver;

    /**
     * ソルバを生成し、1 次元ラプラシアンの固有基底を前計算します。
     *
     * @param grid 格子です
     * @param eigenBackend 固有分解バックエンドです
     * @param solver ソルバ設定です
     */
    public QuasiStaticFieldSolver(Grid grid, EigenDecompositionBackend eigenBackend,
            PwfaProperties.Solver solver) {
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        if (eigenBackend == null) {
            throw new IllegalArgumentException("eigenBackend は null 不可です");
        }
        if (solver == null) {
            throw new IllegalArgumentException("solver は null 不可です");
        }
        this.steps = grid.steps();
        this.stepSize = grid.stepSize();
        this.subtractionTrick = solver.getSubtractionTrick();
        this.boundary = solver.getFieldBoundary();
        this.solveBz = solver.isSolveBz();

        int n = steps - 2;
        LaplacianEigenBasis dirichlet =
                LaplacianEigenBasis.build(eigenBackend, Kind.DIRICHLET, n, stepSize);
        LaplacianEigenBasis neumann =
                LaplacianEigenBasis.build(eigenBackend, Kind.NEUMANN, n, stepSize);

        double k = subtractionTrick;
        if (boundary == PwfaProperties.Solver.FieldBoundary.MIXED) {
            // Ex, By は x 方向 Neumann / y 方向 Dirichlet、Ey, Bx はその転置
            this.exSolver = new SpectralHelmholtzSolver(neumann, dirichlet, k);
            this.bySolver = exSolver;
            this.eySolver = new SpectralHelmholtzSolver(dirichlet, neumann, k);
            this.bxSolver = eySolver;
            this.bzSolver = new SpectralHelmholtzSolver(neumann, neumann, 0.0);
        } else {
            this.exSolver = new SpectralHelmholtzSolver(dirichlet, dirichlet, k);
            this.eySolver = exSolver;
            this.bxSolver = exSolver;
            this.bySolver = exSolver;
            this.bzSolver = new SpectralHelmholtzSolver(dirichlet, dirichlet, 0.0);
        }
        this.ezSolver = new SpectralHelmholtzSolver(dirichlet, dirichlet, 0.0);

        log.info("場のソルバを初期化しました。格子={}x{}、境界={}、k={}、Bz計算={}", steps, steps, boundary,
                k, solveBz);
    }

    @Override
    public FieldSet solve(SourceTerms sources, SourceTerms previousSources,
            FieldSet previousFields, FieldSet guess, double sliceStep) {
        if (sources == null || previousSources == null || previousFields == null
                || guess == null) {
            throw new IllegalArgumentException("sources/previousSources/previousFields/guess は null 不可です");
        }
        if (!(sliceStep > 0.0)) {
            throw new IllegalArgumentException("sliceStep は正の値が必要です: " + sliceStep);
        }

        int n = steps - 2;
        double h2 = 2.0 * stepSize;
        double k = subtractionTrick;

        double[] rho = sources.getRho().data;
        double[] jx = sources.getJx().data;
        double[] jy = sources.getJy().data;
        double[] jz = sources.getJz().data;
        double[] jxPrev = previousSources.getJx().data;
        double[] jyPrev = previousSources.getJy().data;

        DMatrixRMaj exRhs = new DMatrixRMaj(n, n);
        DMatrixRMaj eyRhs = new DMatrixRMaj(n, n);
        DMatrixRMaj bxRhs = new DMatrixRMaj(n, n);
        DMatrixRMaj byRhs = new DMatrixRMaj(n, n);
        DMatrixRMaj ezRhs = new DMatrixRMaj(n, n);
        DMatrixRMaj bzRhs = new DMatrixRMaj(n, n);

        double[] exPrev = previousFields.getEx().data;
        double[] eyPrev = previousFields.getEy().data;
        double[] bxPrev = previousFields.getBx().data;
        double[] byPrev = previousFields.getBy().data;
        double[] exGuess = guess.getEx().data;
        double[] eyGuess = guess.getEy().data;
        double[] bxGuess = guess.getBx().data;
        double[] byGuess = guess.getBy().data;

        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= n; j++) {
                int c = i * steps + j;
                int xp = c + steps;
                int xm = c - steps;
                int yp = c + 1;
                int ym = c - 1;

                double dRhoDx = (rho[xp] - rho[xm]) / h2;
                double dRhoDy = (rho[yp] - rho[ym]) / h2;
                double dJzDx = (jz[xp] - jz[xm]) / h2;
                double dJzDy = (jz[yp] - jz[ym]) / h2;
                double dJxDx = (jx[xp] - jx[xm]) / h2;
                double dJxDy = (jx[yp] - jx[ym]) / h2;
                double dJyDx = (jy[xp] - jy[xm]) / h2;
                double dJyDy = (jy[yp] - jy[ym]) / h2;
                double dJxDxi = (jxPrev[c] - jx[c]) / sliceStep;
                double dJyDxi = (jyPrev[c] - jy[c]) / sliceStep;

                double exAvg = (exPrev[c] + exGuess[c]) / 2;
                double eyAvg = (eyPrev[c] + eyGuess[c]) / 2;
                double bxAvg = (bxPrev[c] + bxGuess[c]) / 2;
                double byAvg = (byPrev[c] + byGuess[c]) / 2;

                int r = (i - 1) * n + (j - 1);
                exRhs.data[r] = -(dRhoDx - dJxDxi) + k * exAvg;
                eyRhs.data[r] = -(dRhoDy - dJyDxi) + k * eyAvg;
                bxRhs.data[r] = +(dJzDy - dJyDxi) + k * bxAvg;
                byRhs.data[r] = -(dJzDx - dJxDxi) + k * byAvg;
                ezRhs.data[r] = -(dJxDx + dJyDy);
                bzRhs.data[r] = -(dJxDy - dJyDx);
            }
        }

        DMatrixRMaj ex = embed(exSolver.solve(exRhs));
        DMatrixRMaj ey = embed(eySolver.solve(eyRhs));
        DMatrixRMaj bx = embed(bxSolver.solve(bxRhs));
        DMatrixRMaj by = embed(bySolver.solve(byRhs));
        DMatrixRMaj ez = embed(ezSolver.solve(ezRhs));
        DMatrixRMaj bz = solveBz ? embed(bzSolver.solve(bzRhs)) : new DMatrixRMaj(steps, steps);

        return new FieldSet(ex, ey, ez, bx, by, bz);
    }

    /**
     * 内部格子点の解を周辺 0 の N×N 配列へ埋め込みます。
     *
     * @param interior 内部格子点の解です
     * @return N×N 配列です
     */
    private DMatrixRMaj embed(DMatrixRMaj interior) {
        int n = steps - 2;
        DMatrixRMaj out = new DMatrixRMaj(steps, steps);
        for (int i = 0; i < n; i++) {
            System.arraycopy(interior.data, i * n, out.data, (i + 1) * steps + 1, n);
        }
        return out;
    }
}

package io.github.yok.pwfa.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.pwfa.core.linearalgebra.EigenDecompositionBackend.SymmetricEigenPairs;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 1 次元離散ラプラシアン {@code -d²/dx²} の固有基底です。
 *
 * <p>
 * 内部格子点 n 個（周辺の格子点は 0 に固定）に対する 3 点差分行列を作り、固有分解します。 Dirichlet 端では対角成分を {@code 2/h²}、Neumann
 * 端では鏡映ゴースト点により {@code 1/h²} とします。 Dirichlet の基底は DST、Neumann の基底は DCT に相当します。
 * </p>
 */
@Getter
public final class LaplacianEigenBasis {

    /**
     * 端の境界条件です。
     */
    public enum Kind {
        DIRICHLET, NEUMANN
    }

    /**
     * 境界条件です。
     */
    private final Kind kind;

    /**
     * 内部格子点数です。
     */
    private final int size;

    /**
     * 固有値（昇順、非負）です。
     */
    private final double[] eigenvalues;

    /**
     * 固有ベクトル行列（列が正規直交基底）です。
     */
    private final DMatrixRMaj vectors;

    private LaplacianEigenBasis(Kind kind, int size, double[] eigenvalues, DMatrixRMaj vectors) {
        this.kind = kind;
        this.size = size;
        this.eigenvalues = eigenvalues;
        this.vectors = vectors;
    }

    /**
     * 固有基底を構築します。
     *
     * @param backend 固有分解バックエンドです
     * @param kind 境界条件です
     * @param size 内部格子点数です（2 以上）
     * @param stepSize 格子間隔です（正）
     * @return 固有基底です
     */
    public static LaplacianEigenBasis build(EigenDecompositionBackend backend, Kind kind,
            int size, double stepSize) {
        checkNotNull(backend, "backend は null 不可です");
        checkNotNull(kind, "kind は null 不可です");
        checkArgument(size >= 2, "size は 2 以上が必要です: %s", size);
        checkArgument(stepSize > 0.0, "stepSize は正の値が必要です: %s", stepSize);

        double inv = 1.0 / (stepSize * stepSize);
        DMatrixRMaj op = new DMatrixRMaj(size, size);
        for (int k = 0; k < size; k++) {
            op.set(k, k, 2.0 * inv);
            if (k > 0) {
                op.set(k, k - 1, -inv);
            }
            if (k < size - 1) {
                op.set(k, k + 1, -inv);
            }
        }
        if (kind == Kind.NEUMANN) {
            op.set(0, 0, inv);
            op.set(size - 1, size - 1, inv);
        }

        SymmetricEigenPairs eig = backend.decomposeSorted(op);
        if (eig.dimension() != size) {
            throw new IllegalStateException("固有対の次元が一致しません: " + eig.dimension() + " != " + size);
        }
        return new LaplacianEigenBasis(kind, size, eig.getValues(), eig.getVectors());
    }
}

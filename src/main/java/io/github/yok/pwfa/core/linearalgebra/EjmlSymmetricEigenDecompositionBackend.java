package io.github.yok.pwfa.core.linearalgebra;

import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて実対称行列の固有分解を行うクラスです。
 *
 * <p>
 * 固有値を昇順に並べ、固有ベクトルも同じ順序に揃えます。 実行ごとに同じ基底が得られるよう、各固有ベクトルは絶対値最大の成分が正になる向きに揃えます。
 * </p>
 */
public final class EjmlSymmetricEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException symmetricMatrix が null または正方でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public SymmetricEigenPairs decomposeSorted(DMatrixRMaj symmetricMatrix) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new IllegalArgumentException("正方行列が必要です: " + symmetricMatrix.numRows + "x"
                    + symmetricMatrix.numCols);
        }

        int dim = symmetricMatrix.numRows;

        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, true);

        // EJML は入力を書き換えることがあるため複製を渡す
        if (!decomposition.decompose(symmetricMatrix.copy())) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）: dim=" + dim);
        }

        double[] values = new double[dim];
        for (int k = 0; k < dim; k++) {
            values[k] = decomposition.getEigenvalue(k).getReal();
        }

        int[] order = argsortAscending(values);

        double[] sortedValues = new double[dim];
        DMatrixRMaj sortedVectors = new DMatrixRMaj(dim, dim);

        for (int newCol = 0; newCol < dim; newCol++) {
            int oldCol = order[newCol];
            sortedValues[newCol] = values[oldCol];

            DMatrixRMaj vec = decomposition.getEigenVector(oldCol);
            if (vec == null) {
                throw new IllegalStateException("固有ベクトルが取得できません: col=" + oldCol);
            }

            double sign = dominantSign(vec, dim);
            for (int row = 0; row < dim; row++) {
                sortedVectors.set(row, newCol, sign * vec.get(row, 0));
            }
        }

        return new SymmetricEigenPairs(sortedValues, sortedVectors);
    }

    /**
     * 絶対値最大の成分の符号を返します。
     *
     * @param vec 列ベクトルです
     * @param dim 次元です
     * @return +1 または -1 です
     */
    private static double dominantSign(DMatrixRMaj vec, int dim) {
        double best = 0.0;
        for (int row = 0; row < dim; row++) {
            double v = vec.get(row, 0);
            if (Math.abs(v) > Math.abs(best)) {
                best = v;
            }
        }
        return (best < 0.0) ? -1.0 : 1.0;
    }

    /**
     * 配列を昇順ソートしたときのインデックス順（argsort）を返します。
     *
     * @param values 対象配列です
     * @return 昇順のインデックス配列です
     */
    private static int[] argsortAscending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }
        Arrays.sort(indices, (a, b) -> Double.compare(values[a], values[b]));
        return Arrays.stream(indices).mapToInt(Integer::intValue).toArray();
    }
}

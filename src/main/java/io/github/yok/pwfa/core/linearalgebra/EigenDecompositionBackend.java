package io.github.yok.pwfa.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実対称行列の固有対を求めるバックエンドです。
 *
 * <p>
 * 場のソルバは 1 次元離散ラプラシアンの固有基底を起動時に一度だけ求め、以降のスライスではその基底で楕円型方程式を対角化して解きます。
 * 固有ベクトルの向きは実装が決定的に揃える必要があります（再開後の計算を一致させるため）。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値の昇順に並べた固有対を返します。
     *
     * @param symmetricMatrix 実対称行列です（入力は変更されません）
     * @return 昇順の固有対です
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    SymmetricEigenPairs decomposeSorted(DMatrixRMaj symmetricMatrix);

    /**
     * 昇順に並んだ固有値と、同じ順序の正規直交固有ベクトル（列）の組です。
     */
    @Value
    class SymmetricEigenPairs {

        double[] values;

        DMatrixRMaj vectors;

        /**
         * 行列の次元を返します。
         *
         * @return 次元です
         */
        public int dimension() {
            return values.length;
        }
    }
}

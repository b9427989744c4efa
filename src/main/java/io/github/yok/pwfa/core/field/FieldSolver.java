package io.github.yok.pwfa.core.field;

import io.github.yok.pwfa.core.deposit.SourceTerms;

/**
 * ソース項から 1 スライス分の電磁場を求めるインタフェースです。
 */
public interface FieldSolver {

    /**
     * 電磁場を求めます。
     *
     * @param sources 現スライスのソース項（ビームを含む）です
     * @param previousSources 直前スライスのソース項（dJ/dξ 用）です
     * @param previousFields 直前スライスの場です
     * @param guess 現スライスの場の推定値です
     * @param sliceStep スライス刻み幅です
     * @return 新しい場です
     */
    FieldSet solve(SourceTerms sources, SourceTerms previousSources, FieldSet previousFields,
            FieldSet guess, double sliceStep);
}

package io.github.yok.pwfa.core.solver;

import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.particle.PlasmaPopulation;
import lombok.Value;

/**
 * 1 スライスの固定点反復への入力です。
 *
 * <p>
 * いずれもスライス開始時点の値で、反復中に変更されません。
 * </p>
 */
@Value
public class SliceInput {

    /**
     * スライス番号です。
     */
    int sliceIndex;

    /**
     * スライス開始の ξ です。
     */
    double xi;

    /**
     * スライス刻み幅です。
     */
    double sliceStep;

    /**
     * スライス開始時のプラズマ粗粒子です。
     */
    PlasmaPopulation population;

    /**
     * 直前スライスの場です。
     */
    FieldSet previousFields;

    /**
     * 直前スライスのソース項です。
     */
    SourceTerms previousSources;

    /**
     * 反復の初期推定です（通常は直前スライスの場）。
     */
    FieldSet initialGuess;

    /**
     * このスライスに進入するビーム粒子のソース項です。
     */
    SourceTerms beamSources;

    /**
     * 背景イオンの寄与です。
     */
    SourceTerms ionBackground;
}

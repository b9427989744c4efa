package io.github.yok.pwfa.core.error;

import lombok.Getter;

/**
 * 堆積後の電荷総和が粒子電荷の総和と一致しないことを表す例外です。
 *
 * <p>
 * 堆積またはソルバの欠陥を意味するため、常に致命的として扱い、実行を中断します。
 * </p>
 */
@Getter
public class InvalidSourceTermsException extends PwfaException {

    private static final long serialVersionUID = 1L;

    /**
     * 検出したスライス番号です。
     */
    private final int sliceIndex;

    /**
     * 格子上の電荷総和です。
     */
    private final double gridCharge;

    /**
     * 粒子電荷の総和です。
     */
    private final double particleCharge;

    /**
     * 例外を生成します。
     *
     * @param sliceIndex スライス番号です
     * @param gridCharge 格子上の電荷総和です
     * @param particleCharge 粒子電荷の総和です
     * @param tolerance 相対許容誤差です
     */
    public InvalidSourceTermsException(int sliceIndex, double gridCharge, double particleCharge,
            double tolerance) {
        super("電荷保存が破れています: slice=" + sliceIndex + ", grid=" + gridCharge + ", particles="
                + particleCharge + ", 相対許容=" + tolerance);
        this.sliceIndex = sliceIndex;
        this.gridCharge = gridCharge;
        this.particleCharge = particleCharge;
    }
}

package io.github.yok.pwfa.app;

import io.github.yok.pwfa.core.error.ConfigurationException;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * pwfa-solver の設定値（pwfa.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、初期化（Initialize）の前に一度だけ検証されます。 コアはこの値を検証済みの不透明な設定として受け取ります。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "pwfa")
public class PwfaProperties {

    /**
     * 横方向格子の設定です。
     */
    @Valid
    private Grid grid = new Grid();

    /**
     * プラズマ粒子の設定です。
     */
    @Valid
    private Plasma plasma = new Plasma();

    /**
     * 背景イオンの設定です。
     */
    @Valid
    private Ions ions = new Ions();

    /**
     * ビームの設定です。
     */
    @Valid
    private Beam beam = new Beam();

    /**
     * xi 方向の範囲と刻みの設定です。
     */
    @Valid
    private Xi xi = new Xi();

    /**
     * 場のソルバと固定点反復の設定です。
     */
    @Valid
    private Solver solver = new Solver();

    /**
     * 非収束時の刻み幅制御の設定です。
     */
    @Valid
    private StepControl stepControl = new StepControl();

    /**
     * スライス内並列化の設定です。
     */
    @Valid
    private Parallel parallel = new Parallel();

    /**
     * 診断出力の設定です。
     */
    @Valid
    private Diagnostics diagnostics = new Diagnostics();

    /**
     * チェックポイントの設定です。
     */
    @Valid
    private Checkpoint checkpoint = new Checkpoint();

    /**
     * 項目間の整合性を検証します。
     *
     * <p>
     * アノテーションでは表せない条件（奇数格子、パディングの大小関係、xi 範囲など）をここで確認します。
     * </p>
     *
     * @throws ConfigurationException 設定値が不正な場合に発生します
     */
    public void validate() {
        Grid g = getGrid();
        Plasma p = getPlasma();
        Xi x = getXi();
        Solver s = getSolver();
        StepControl sc = getStepControl();

        require(g.getSteps() >= 9, "grid.steps は 9 以上が必要です: " + g.getSteps());
        require(g.getSteps() % 2 == 1, "grid.steps は奇数が必要です（中心格子点を原点に置くため）: " + g.getSteps());
        require(g.getStepSize() > 0.0, "grid.stepSize は正の値が必要です: " + g.getStepSize());

        require(p.getCoarseness() >= 1, "plasma.coarseness は 1 以上が必要です: " + p.getCoarseness());
        require(p.getFineness() >= 1, "plasma.fineness は 1 以上が必要です: " + p.getFineness());
        // 細粒子が反射境界より外の格子点に届かないための条件
        require(p.getReflectPaddingSteps() > p.getCoarseness() + 1,
                "plasma.reflectPaddingSteps は coarseness+1 より大きい必要があります: "
                        + p.getReflectPaddingSteps());
        require(p.getPaddingSteps() >= p.getReflectPaddingSteps(),
                "plasma.paddingSteps は reflectPaddingSteps 以上が必要です: " + p.getPaddingSteps());
        require(g.getSteps() - 2 * p.getPaddingSteps() >= 2 * p.getCoarseness(),
                "plasma.paddingSteps が大きすぎてプラズマ粒子を配置できません: " + p.getPaddingSteps());
        require(p.getProfile().getDensity() > 0.0,
                "plasma.profile.density は正の値が必要です: " + p.getProfile().getDensity());
        require(p.getProfile().getChannelRadius() > 0.0,
                "plasma.profile.channelRadius は正の値が必要です: " + p.getProfile().getChannelRadius());
        require(p.getProfile().getChannelDepth() > -1.0,
                "plasma.profile.channelDepth は -1 より大きい必要があります: " + p.getProfile().getChannelDepth());

        require(getIons().getCharge() > 0.0, "ions.charge は正の値が必要です: " + getIons().getCharge());
        require(getIons().getMassRatio() > 0.0,
                "ions.massRatio は正の値が必要です: " + getIons().getMassRatio());

        Beam b = getBeam();
        if (b.isEnabled()) {
            require(b.getCharge() != 0.0, "beam.charge は 0 以外が必要です");
            require(b.getMassRatio() > 0.0, "beam.massRatio は正の値が必要です: " + b.getMassRatio());
            require(b.getGamma() >= 1.0, "beam.gamma は 1 以上が必要です: " + b.getGamma());
            require(b.getSigmaR() > 0.0, "beam.sigmaR は正の値が必要です: " + b.getSigmaR());
            require(b.getSigmaXi() > 0.0, "beam.sigmaXi は正の値が必要です: " + b.getSigmaXi());
            require(b.getPeakDensity() >= 0.0 && Double.isFinite(b.getPeakDensity()),
                    "beam.peakDensity は 0 以上の有限値が必要です: " + b.getPeakDensity());
            require(b.getTransverseSpacing() >= 1,
                    "beam.transverseSpacing は 1 以上が必要です: " + b.getTransverseSpacing());
            require(b.getTimeStep() > 0.0, "beam.timeStep は正の値が必要です: " + b.getTimeStep());
        }

        require(x.getStart() > x.getEnd(),
                "xi.start は xi.end より大きい必要があります: " + x.getStart() + " <= " + x.getEnd());
        require(x.getStep() > 0.0, "xi.step は正の値が必要です: " + x.getStep());

        require(s.getMaxIterations() >= 1, "solver.maxIterations は 1 以上が必要です: " + s.getMaxIterations());
        require(s.getTolerance() > 0.0, "solver.tolerance は正の値が必要です: " + s.getTolerance());
        require(s.getChargeTolerance() > 0.0,
                "solver.chargeTolerance は正の値が必要です: " + s.getChargeTolerance());
        require(s.getSubtractionTrick() >= 0.0,
                "solver.subtractionTrick は 0 以上が必要です: " + s.getSubtractionTrick());

        require(sc.getReductionFactor() > 0.0 && sc.getReductionFactor() < 1.0,
                "stepControl.reductionFactor は (0, 1) が必要です: " + sc.getReductionFactor());
        require(sc.getMinStep() > 0.0 && sc.getMinStep() <= x.getStep(),
                "stepControl.minStep は (0, xi.step] が必要です: " + sc.getMinStep());
        require(sc.getMaxRetriesAtMinStep() >= 1,
                "stepControl.maxRetriesAtMinStep は 1 以上が必要です: " + sc.getMaxRetriesAtMinStep());

        require(getParallel().getChunkSize() >= 1,
                "parallel.chunkSize は 1 以上が必要です: " + getParallel().getChunkSize());
        require(getDiagnostics().getEverySlices() >= 1,
                "diagnostics.everySlices は 1 以上が必要です: " + getDiagnostics().getEverySlices());
        require(getCheckpoint().getEverySlices() >= 1,
                "checkpoint.everySlices は 1 以上が必要です: " + getCheckpoint().getEverySlices());
    }

    /**
     * 条件を満たさない場合に設定例外を送出します。
     *
     * @param condition 条件です
     * @param message 条件を満たさない場合のメッセージです
     */
    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "pwfa")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Grid g = getGrid();
        Plasma p = getPlasma();
        Ions i = getIons();
        Beam b = getBeam();
        Xi x = getXi();
        Solver s = getSolver();
        StepControl sc = getStepControl();

        StringBuilder sb = new StringBuilder(512).append(nl);

        appendSection(sb, nl, "grid",
                // steps: 横方向格子点数（奇数）
                "steps", g.getSteps(),
                // stepSize: 格子間隔（プラズマ単位）
                "stepSize", g.getStepSize());

        appendSection(sb, nl, "plasma",
                // coarseness: 粗粒子1個あたりのセル数の平方根
                "coarseness", p.getCoarseness(),
                // fineness: 1セルあたりの細粒子数の平方根
                "fineness", p.getFineness(),
                "paddingSteps", p.getPaddingSteps(),
                "reflectPaddingSteps", p.getReflectPaddingSteps(),
                "boundaryPolicy", p.getBoundaryPolicy(),
                "profile.type", p.getProfile().getType(),
                "profile.density", p.getProfile().getDensity(),
                "profile.channelRadius", p.getProfile().getChannelRadius(),
                "profile.channelDepth", p.getProfile().getChannelDepth());

        appendSection(sb, nl, "ions",
                "mode", i.getMode(),
                "charge", i.getCharge(),
                "massRatio", i.getMassRatio());

        appendSection(sb, nl, "beam",
                "enabled", b.isEnabled(),
                "charge", b.getCharge(),
                "massRatio", b.getMassRatio(),
                "gamma", b.getGamma(),
                "peakDensity", b.getPeakDensity(),
                "sigmaR", b.getSigmaR(),
                "sigmaXi", b.getSigmaXi(),
                "xiCenter", b.getXiCenter(),
                "cutoffSigmas", b.getCutoffSigmas(),
                "transverseSpacing", b.getTransverseSpacing(),
                "timeStep", b.getTimeStep());

        appendSection(sb, nl, "xi",
                "start", x.getStart(),
                "end", x.getEnd(),
                "step", x.getStep());

        appendSection(sb, nl, "solver",
                // maxIterations: スライスあたりの固定点反復の上限
                "maxIterations", s.getMaxIterations(),
                // tolerance: 反復間の場の変化（max ノルム）の許容上限
                "tolerance", s.getTolerance(),
                "chargeTolerance", s.getChargeTolerance(),
                // subtractionTrick: 横方向場の Helmholtz 係数（0 で Poisson）
                "subtractionTrick", s.getSubtractionTrick(),
                "fieldBoundary", s.getFieldBoundary(),
                "solveBz", s.isSolveBz(),
                "fineRefresh", s.getFineRefresh());

        appendSection(sb, nl, "stepControl",
                "reductionFactor", sc.getReductionFactor(),
                "minStep", sc.getMinStep(),
                "maxRetriesAtMinStep", sc.getMaxRetriesAtMinStep());

        appendSection(sb, nl, "parallel",
                "chunkSize", getParallel().getChunkSize());

        appendSection(sb, nl, "diagnostics",
                "enabled", getDiagnostics().isEnabled(),
                "everySlices", getDiagnostics().getEverySlices(),
                "dir", getDiagnostics().getDir());

        appendSection(sb, nl, "checkpoint",
                "enabled", getCheckpoint().isEnabled(),
                "everySlices", getCheckpoint().getEverySlices(),
                "dir", getCheckpoint().getDir(),
                "resumeFrom", getCheckpoint().getResumeFrom());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Grid {

        /**
         * 1 軸あたりの格子点数 N です（奇数）。
         */
        @Min(9)
        private int steps = 121;

        /**
         * 格子間隔 h です。
         */
        @Positive
        private double stepSize = 0.1;
    }

    @Data
    public static class Plasma {

        /**
         * 粗粒子 1 個あたりのセル数の平方根です。
         */
        @Min(1)
        private int coarseness = 2;

        /**
         * 1 セルあたりの細粒子数の平方根です。
         */
        @Min(1)
        private int fineness = 2;

        /**
         * プラズマ配置領域と場の計算領域の間の余白（格子数）です。
         */
        @Min(0)
        private int paddingSteps = 10;

        /**
         * 反射境界と場の計算領域の間の余白（格子数）です。
         */
        @Min(0)
        private int reflectPaddingSteps = 5;

        /**
         * 境界を越えたプラズマ粒子の扱いです。
         */
        private BoundaryPolicy boundaryPolicy = BoundaryPolicy.REFLECT;

        /**
         * 横方向密度分布です。
         */
        @Valid
        private Profile profile = new Profile();

        public enum BoundaryPolicy {
            REFLECT, REMOVE
        }

        @Data
        public static class Profile {

            /**
             * 分布の種類です。
             */
            private Type type = Type.UNIFORM;

            /**
             * 軸上（または一様）密度です（n0 単位）。
             */
            private double density = 1.0;

            /**
             * 放物型チャネルの半径です。
             */
            private double channelRadius = 2.0;

            /**
             * 放物型チャネルの深さ（半径位置での相対増分）です。
             */
            private double channelDepth = 0.5;

            public enum Type {
                UNIFORM, PARABOLIC_CHANNEL
            }
        }
    }

    @Data
    public static class Ions {

        /**
         * イオンの扱いです。
         */
        private Mode mode = Mode.IMMOBILE;

        /**
         * 可動イオンの電荷（素電荷単位）です。
         */
        private double charge = 1.0;

        /**
         * 可動イオンの質量（電子質量単位）です。
         */
        private double massRatio = 1836.15;

        public enum Mode {
            IMMOBILE, MOBILE
        }
    }

    @Data
    public static class Beam {

        /**
         * ビームを配置するかどうかです。
         */
        private boolean enabled = true;

        /**
         * ビーム粒子の電荷（素電荷単位）です。
         */
        private double charge = 1.0;

        /**
         * ビーム粒子の質量（電子質量単位）です。
         */
        private double massRatio = 1836.15;

        /**
         * ローレンツ因子です。
         */
        private double gamma = 1000.0;

        /**
         * ピーク密度（n0 単位）です。
         */
        private double peakDensity = 0.05;

        /**
         * 横方向の RMS サイズです。
         */
        private double sigmaR = 1.0;

        /**
         * 縦方向の RMS 長です。
         */
        private double sigmaXi = 1.0;

        /**
         * 縦方向の中心位置です。
         */
        private double xiCenter = -3.0;

        /**
         * 分布を打ち切る σ 倍数です。
         */
        private double cutoffSigmas = 3.0;

        /**
         * 横方向のサンプリング間隔（格子数）です。
         */
        private int transverseSpacing = 1;

        /**
         * ビーム粒子を押す時間刻みです。
         */
        private double timeStep = 1.0;
    }

    @Data
    public static class Xi {

        /**
         * 開始位置（先頭側、大きい方）です。
         */
        private double start = 0.0;

        /**
         * 終了位置です。
         */
        private double end = -30.0;

        /**
         * 基準の刻み幅です。
         */
        @Positive
        private double step = 0.05;
    }

    @Data
    public static class Solver {

        /**
         * スライスあたりの固定点反復の最大回数です。
         */
        @Min(1)
        private int maxIterations = 30;

        /**
         * 反復間の場の変化（max ノルム）の許容上限です。
         */
        private double tolerance = 1e-7;

        /**
         * 電荷保存検査の相対許容誤差です。
         */
        private double chargeTolerance = 1e-10;

        /**
         * 横方向場の Helmholtz 係数（subtraction trick）です。
         */
        private double subtractionTrick = 1.0;

        /**
         * 場の境界条件です。
         */
        private FieldBoundary fieldBoundary = FieldBoundary.MIXED;

        /**
         * Bz を解くかどうかです。
         */
        private boolean solveBz = true;

        /**
         * 細粒子の再生成タイミングです。
         */
        private FineRefresh fineRefresh = FineRefresh.PER_ITERATION;

        public enum FieldBoundary {
            DIRICHLET, MIXED
        }

        public enum FineRefresh {
            PER_ITERATION, PER_SLICE
        }
    }

    @Data
    public static class StepControl {

        /**
         * 非収束時に刻み幅へ掛ける縮小率です。
         */
        private double reductionFactor = 0.5;

        /**
         * 刻み幅の下限です。
         */
        private double minStep = 0.005;

        /**
         * 最小刻みで再試行できる回数です。 最小刻みでの連続失敗がこれを超えると中断します。
         */
        private int maxRetriesAtMinStep = 3;
    }

    @Data
    public static class Parallel {

        /**
         * 堆積で 1 タスクが受け持つ粒子数です。
         */
        private int chunkSize = 4096;
    }

    @Data
    public static class Diagnostics {

        /**
         * 診断出力を行うかどうかです。
         */
        private boolean enabled = true;

        /**
         * 出力間隔（スライス数）です。
         */
        private int everySlices = 20;

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }

    @Data
    public static class Checkpoint {

        /**
         * チェックポイントを書き出すかどうかです。
         */
        private boolean enabled = false;

        /**
         * 書き出し間隔（スライス数）です。
         */
        private int everySlices = 200;

        /**
         * 書き出し先ディレクトリです。
         */
        private String dir = "./checkpoint";

        /**
         * 再開に使うチェックポイントファイルです（空なら新規実行）。
         */
        private String resumeFrom = "";
    }
}

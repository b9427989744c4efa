package io.github.yok.pwfa.out;

import io.github.yok.pwfa.core.deposit.SourceTerms;
import io.github.yok.pwfa.core.field.FieldSet;
import io.github.yok.pwfa.core.grid.Grid;
import io.github.yok.pwfa.core.model.Species;
import io.github.yok.pwfa.core.solver.SliceObserver;
import io.github.yok.pwfa.core.state.SimulationSnapshot;
import io.github.yok.pwfa.core.state.SimulationSnapshot.BeamData;
import io.github.yok.pwfa.core.state.SimulationSnapshot.FieldData;
import io.github.yok.pwfa.core.state.SimulationSnapshot.ParticleData;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 診断結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（slice は確定済みスライス数、xi はその時点の ξ）。
 * </p>
 *
 * <ul>
 * <li>{@code pwfa_fields_slice=000120_xi=-6.000.csv}（格子点ごとの 6 成分と rho）</li>
 * <li>{@code pwfa_plasma_slice=000120_xi=-6.000.csv}（粗粒子）</li>
 * <li>{@code pwfa_beam_slice=000120_xi=-6.000.csv}（ビーム粒子）</li>
 * <li>{@code pwfa_ez_axis.csv}（毎スライスの軸上 Ez、ノイズ指標 zn の最大値、最新の Ez ピークとその偏差。スナップショットのたびに上書き）</li>
 * </ul>
 */
public final class CsvDiagnosticsWriter implements SliceObserver {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "pwfa";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * 格子です（座標の計算に使います）。
     */
    private final Grid grid;

    /**
     * スナップショットの出力間隔です。
     */
    private final int everySlices;

    /**
     * 毎スライスの軸上診断です。
     */
    private final WakeDiagnostics wake;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param grid 格子です
     * @param everySlices 出力間隔です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvDiagnosticsWriter(String outputDir, Grid grid, int everySlices) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("diagnostics.dir は必須です");
        }
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        if (everySlices < 1) {
            throw new IllegalArgumentException("everySlices は 1 以上を指定してください: " + everySlices);
        }
        this.outputDir = Paths.get(outputDir);
        this.grid = grid;
        this.everySlices = everySlices;
        this.wake = new WakeDiagnostics(grid.steps(), grid.stepSize());
    }

    @Override
    public int everySlices() {
        return everySlices;
    }

    @Override
    public void onSliceCommitted(int sliceIndex, double xi, FieldSet fields,
            SourceTerms sources) {
        int c = grid.steps() / 2;
        wake.record(sliceIndex, xi, fields.getEz().get(c, c), sources.getRho().data);
    }

    /**
     * スナップショットを CSV に出力します。
     *
     * @param snapshot スナップショットです
     * @throws IllegalArgumentException snapshot が null、または格子と一致しない場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void onSnapshot(SimulationSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot は null 不可です");
        }
        if (snapshot.getGridSteps() != grid.steps()) {
            throw new IllegalArgumentException("格子点数が一致しません: snapshot="
                    + snapshot.getGridSteps() + ", grid=" + grid.steps());
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 場と電荷密度
            writeFieldsCsv(snapshot);

            // 2) プラズマ粗粒子
            writePlasmaCsv(snapshot);

            // 3) ビーム
            writeBeamCsv(snapshot);

            // 4) 軸上の診断履歴
            writeEzAxisCsv();

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 格子点ごとの場と電荷密度を出力します。
     *
     * @param s スナップショットです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeFieldsCsv(SimulationSnapshot s) throws IOException {
        Path file = outputDir.resolve(buildFileName("fields", s));
        FieldData f = s.getFields();
        double[] rho = s.getSources().getRho();
        int n = grid.steps();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("x", "y", "i", "j", "Ex", "Ey", "Ez", "Bx", "By", "Bz", "rho")
                        .build().print(w)) {

            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    int k = i * n + j;
                    pr.printRecord(grid.coordinateOf(i), grid.coordinateOf(j), i, j, f.getEx()[k],
                            f.getEy()[k], f.getEz()[k], f.getBx()[k], f.getBy()[k], f.getBz()[k],
                            rho[k]);
                }
            }
        }
    }

    /**
     * プラズマ粗粒子を出力します。
     *
     * @param s スナップショットです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writePlasmaCsv(SimulationSnapshot s) throws IOException {
        Path file = outputDir.resolve(buildFileName("plasma", s));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("species", "k", "x", "y", "px", "py", "pz", "weight", "alive")
                        .build().print(w)) {

            for (Map.Entry<Species, ParticleData> e : s.getPlasma().entrySet()) {
                ParticleData p = e.getValue();
                for (int k = 0; k < p.getX().length; k++) {
                    pr.printRecord(e.getKey(), k, p.getX()[k], p.getY()[k], p.getPx()[k],
                            p.getPy()[k], p.getPz()[k], p.getWeight()[k], p.getAlive()[k]);
                }
            }
        }
    }

    /**
     * ビーム粒子を出力します。
     *
     * @param s スナップショットです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeBeamCsv(SimulationSnapshot s) throws IOException {
        Path file = outputDir.resolve(buildFileName("beam", s));
        BeamData b = s.getBeam();
        ParticleData p = b.getParticles();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("k", "x", "y", "xi", "px", "py", "pz", "weight", "alive",
                                "advanced")
                        .build().print(w)) {

            for (int k = 0; k < p.getX().length; k++) {
                pr.printRecord(k, p.getX()[k], p.getY()[k], b.getXi()[k], p.getPx()[k],
                        p.getPy()[k], p.getPz()[k], p.getWeight()[k], p.getAlive()[k],
                        k < b.getCursor());
            }
        }
    }

    /**
     * 軸上の診断履歴を出力します。 ピークがまだなければ該当列は空欄です。
     *
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeEzAxisCsv() throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_ez_axis.csv");

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("slice", "xi", "Ez", "zn", "EzPeak", "EzPeakDeviationPercent")
                        .build().print(w)) {

            for (WakeDiagnostics.Row r : wake.rows()) {
                pr.printRecord(r.getSlice(), r.getXi(), r.getEz(), r.getMaxNoise(), r.getEzPeak(),
                        r.getEzPeakDeviationPercent());
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code pwfa_fields_slice=000120_xi=-6.000.csv}
     * </p>
     *
     * @param kind 量の識別子（fields/plasma/beam）
     * @param s スナップショットです
     * @return ファイル名です
     */
    private static String buildFileName(String kind, SimulationSnapshot s) {
        return FILE_HEAD + "_" + kind + "_slice="
                + String.format(Locale.ROOT, "%06d", s.getSliceIndex()) + "_xi="
                + String.format(Locale.ROOT, "%.3f", s.getXi()) + ".csv";
    }
}

package io.github.yok.pwfa.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.pwfa.SmallRunFixture;
import io.github.yok.pwfa.app.PwfaProperties;
import io.github.yok.pwfa.core.grid.UniformGrid2D;
import io.github.yok.pwfa.core.state.SimulationSnapshot;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CsvDiagnosticsWriter")
class CsvDiagnosticsWriterTest {

    @TempDir
    Path dir;

    private static List<CSVRecord> read(Path file) throws Exception {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                    .setSkipHeaderRecord(true).build().parse(r).getRecords();
        }
    }

    @Test
    @DisplayName("スライスごとに場・プラズマ・ビームの CSV と軸上 Ez の履歴を書く")
    void writesPerSliceFiles() throws Exception {
        PwfaProperties p = SmallRunFixture.properties();
        p.getXi().setEnd(-0.1);
        SmallRunFixture fx = new SmallRunFixture(p);
        CsvDiagnosticsWriter writer = new CsvDiagnosticsWriter(dir.toString(), fx.grid, 1);

        fx.stepper(Collections.singletonList(writer)).run(fx.initializer.create());

        Path fields = dir.resolve("pwfa_fields_slice=000002_xi=-0.100.csv");
        assertThat(fields).exists();
        assertThat(dir.resolve("pwfa_fields_slice=000001_xi=-0.050.csv")).exists();
        assertThat(dir.resolve("pwfa_plasma_slice=000002_xi=-0.100.csv")).exists();
        assertThat(dir.resolve("pwfa_beam_slice=000002_xi=-0.100.csv")).exists();

        List<CSVRecord> rows = read(fields);
        assertThat(rows).hasSize(41 * 41);
        assertThat(Files.readAllLines(fields, StandardCharsets.UTF_8).get(0))
                .isEqualTo("x,y,i,j,Ex,Ey,Ez,Bx,By,Bz,rho");
        CSVRecord center = rows.get(20 * 41 + 20);
        assertThat(Double.parseDouble(center.get("x"))).isZero();
        assertThat(Integer.parseInt(center.get("i"))).isEqualTo(20);

        Path axisFile = dir.resolve("pwfa_ez_axis.csv");
        assertThat(Files.readAllLines(axisFile, StandardCharsets.UTF_8).get(0))
                .isEqualTo("slice,xi,Ez,zn,EzPeak,EzPeakDeviationPercent");
        List<CSVRecord> axis = read(axisFile);
        assertThat(axis).hasSize(2);
        assertThat(Double.parseDouble(axis.get(1).get("zn"))).isNotNegative();
        assertThat(axis.get(1).get("EzPeak")).isEmpty();
        assertThat(axis.get(1).get("slice")).isEqualTo("2");
        assertThat(Double.parseDouble(axis.get(1).get("xi"))).isEqualTo(-0.1);

        List<CSVRecord> plasma = read(dir.resolve("pwfa_plasma_slice=000002_xi=-0.100.csv"));
        assertThat(plasma).hasSize(fx.lattice.coarseSize() * fx.lattice.coarseSize());
        assertThat(plasma.get(0).get("species")).isEqualTo("PLASMA_ELECTRON");
    }

    @Test
    @DisplayName("格子の異なるスナップショットは拒否する")
    void rejectsMismatchedGrid() {
        CsvDiagnosticsWriter writer =
                new CsvDiagnosticsWriter(dir.toString(), new UniformGrid2D(11, 0.1), 1);
        SimulationSnapshot s = new SimulationSnapshot();
        s.setGridSteps(41);

        assertThatThrownBy(() -> writer.onSnapshot(s))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package io.github.yok.pwfa.out;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.pwfa.core.solver.SliceObserver;
import io.github.yok.pwfa.core.state.SimulationSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * スナップショットを JSON のチェックポイントとして読み書きするクラスです。
 *
 * <p>
 * 倍精度値は往復で値が変わらない最短表現で書き出されるため、復元後の計算は中断しなかった場合とビット単位で一致します。 ファイル名は
 * {@code checkpoint_slice=000200.json} です。
 * </p>
 */
@Slf4j
public final class JsonCheckpointStore implements SliceObserver {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Path outputDir;

    private final int everySlices;

    /**
     * チェックポイントの入出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param everySlices 出力間隔です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public JsonCheckpointStore(String outputDir, int everySlices) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("checkpoint.dir は必須です");
        }
        if (everySlices < 1) {
            throw new IllegalArgumentException("everySlices は 1 以上を指定してください: " + everySlices);
        }
        this.outputDir = Paths.get(outputDir);
        this.everySlices = everySlices;
    }

    @Override
    public int everySlices() {
        return everySlices;
    }

    @Override
    public void onSnapshot(SimulationSnapshot snapshot) {
        write(snapshot);
    }

    /**
     * スナップショットを書き出します。
     *
     * @param snapshot スナップショットです
     * @return 書き出したファイルです
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    public Path write(SimulationSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot は null 不可です");
        }
        Path file = outputDir.resolve("checkpoint_slice="
                + String.format(Locale.ROOT, "%06d", snapshot.getSliceIndex()) + ".json");
        try {
            Files.createDirectories(outputDir);
            objectMapper.writeValue(file.toFile(), snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("チェックポイントの出力に失敗しました: " + file, e);
        }
        log.info("チェックポイントを書き出しました: {}", file);
        return file;
    }

    /**
     * チェックポイントを読み込みます。
     *
     * @param file チェックポイントファイルです
     * @return スナップショットです
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public SimulationSnapshot read(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        try {
            return objectMapper.readValue(file.toFile(), SimulationSnapshot.class);
        } catch (IOException e) {
            throw new IllegalStateException("チェックポイントの読み込みに失敗しました: " + file, e);
        }
    }
}

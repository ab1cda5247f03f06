package io.github.yok.fluxgrid.out;

import io.github.yok.fluxgrid.core.contour.FluxContour;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.separatrix.LegPosition;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixLegs;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 等値線を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います。
 * </p>
 *
 * <ul>
 * <li>{@code fluxgrid_leg_inner_lower.csv} など（脚ごと、列は i, s, R, Z, psi）</li>
 * <li>{@code fluxgrid_meta.csv}（X 点、セパラトリクスの psi、壁との交点、脚の点数と長さ）</li>
 * </ul>
 */
@Slf4j
public final class CsvContourWriter implements ContourWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "fluxgrid";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvContourWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * セパラトリクスの追跡結果と、脚ごとの再配置済み等値線を出力します。
     *
     * @param separatrix セパラトリクスの追跡結果です
     * @param gridLines 象限ごとの再配置済み等値線です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(SeparatrixLegs separatrix, Map<LegPosition, FluxContour> gridLines) {
        if (separatrix == null) {
            throw new IllegalArgumentException("separatrix は null 不可です");
        }
        if (gridLines == null) {
            throw new IllegalArgumentException("gridLines は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            for (Map.Entry<LegPosition, FluxContour> e : gridLines.entrySet()) {
                writeLegCsv(e.getKey(), e.getValue());
            }

            writeMetaCsv(separatrix, gridLines);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("CSV を出力しました。出力先={}、脚の数={}", outputDir.toAbsolutePath(), gridLines.size());
    }

    /**
     * 1 本の等値線を出力します。
     *
     * @param position 象限です
     * @param contour 等値線です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeLegCsv(LegPosition position, FluxContour contour) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_leg_" + position.label() + ".csv");
        double[] distance = contour.getDistance();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("i", "s", "R", "Z", "psi").build().print(w)) {

            for (int i = 0; i < contour.size(); i++) {
                Point2D p = contour.get(i);
                pr.printRecord(i, distance[i], p.getR(), p.getZ(), contour.getField().psi(p));
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param separatrix セパラトリクスの追跡結果です
     * @param gridLines 象限ごとの再配置済み等値線です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(SeparatrixLegs separatrix, Map<LegPosition, FluxContour> gridLines)
            throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_meta.csv");

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("xpoint.R", separatrix.getXPoint().getR());
            pr.printRecord("xpoint.Z", separatrix.getXPoint().getZ());
            pr.printRecord("psi.separatrix", separatrix.getPsiSeparatrix());

            for (int i = 0; i < separatrix.getWallIntersections().size(); i++) {
                Point2D p = separatrix.getWallIntersections().get(i);
                pr.printRecord("wall." + i + ".R", p.getR());
                pr.printRecord("wall." + i + ".Z", p.getZ());
            }

            for (Map.Entry<LegPosition, FluxContour> e : gridLines.entrySet()) {
                String key = "leg." + e.getKey().label();
                pr.printRecord(key + ".points", e.getValue().size());
                pr.printRecord(key + ".length", e.getValue().getTotalLength());
            }
        }
    }
}

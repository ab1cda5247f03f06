package io.github.yok.fluxgrid.app;

import io.github.yok.fluxgrid.core.contour.FluxContour;
import io.github.yok.fluxgrid.core.contour.PoloidalSpacing;
import io.github.yok.fluxgrid.core.equilibrium.EquilibriumAnalyzer;
import io.github.yok.fluxgrid.core.field.ScalarField2D;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.separatrix.LegPosition;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixLegs;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixTracer;
import io.github.yok.fluxgrid.out.ContourWriter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で flux-grid を実行するクラスです。
 *
 * <p>
 * 探索ボックス内の X 点を求め、セパラトリクスの 4 本の脚を壁まで追跡し、 各脚を指定した点数に再配置して出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class FluxGridCliRunner implements CommandLineRunner {

    /**
     * flux-grid の設定値（fluxgrid.*）です。
     */
    private final FluxGridProperties properties;

    /**
     * 磁束場です。
     */
    private final ScalarField2D field;

    /**
     * 平衡解析器です。
     */
    private final EquilibriumAnalyzer equilibriumAnalyzer;

    /**
     * セパラトリクス追跡器です。
     */
    private final SeparatrixTracer separatrixTracer;

    /**
     * 結果出力ロジックです。
     */
    private final ContourWriter contourWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== flux-grid start: trace separatrix legs ===");
        System.out.print(properties.toMultilineString());

        FluxGridProperties.XPointSearch box = properties.getXPointSearch();
        Point2D xPoint = equilibriumAnalyzer.findSaddlePoint(box.getMinR(), box.getMaxR(),
                box.getMinZ(), box.getMaxZ(), box.getAtol());
        double psiSeparatrix = field.psi(xPoint);

        System.out.println("=== X点 ===");
        System.out.println("結果: R=" + fmt5(xPoint.getR()) + ", Z=" + fmt5(xPoint.getZ()) + ", psi="
                + psiSeparatrix);

        SeparatrixLegs separatrix = separatrixTracer.trace(xPoint, psiSeparatrix);

        FluxGridProperties.Regrid regrid = properties.getRegrid();
        Map<LegPosition, FluxContour> gridLines = new EnumMap<>(LegPosition.class);

        // 脚ごとに再配置
        for (Map.Entry<LegPosition, FluxContour> e : separatrix.getLegs().entrySet()) {
            FluxContour leg = e.getValue();
            FluxContour line = leg.getRegridded(regrid.getPoints(), spacingFor(leg, regrid),
                    regrid.getWidth(), regrid.getAtol(), regrid.getExtendLower(),
                    regrid.getExtendUpper());
            gridLines.put(e.getKey(), line);

            System.out.println("=== 脚: " + e.getKey().label() + " ===");
            System.out.println("結果: points=" + line.size() + ", length="
                    + fmt5(line.getTotalLength()) + ", 壁側の端点=(" + fmt5(line.get(line.size() - 1).getR())
                    + ", " + fmt5(line.get(line.size() - 1).getZ()) + ")");
        }

        contourWriter.write(separatrix, gridLines);
    }

    /**
     * 端の間隔の設定から弧長関数を作ります（いずれも未指定なら null = 等間隔）。
     *
     * @param leg 再配置する脚です
     * @param regrid 再配置の設定です
     * @return 弧長関数、または null です
     */
    static DoubleUnaryOperator spacingFor(FluxContour leg, FluxGridProperties.Regrid regrid) {
        if (regrid.getDLower() == null && regrid.getDUpper() == null) {
            return null;
        }
        double last = regrid.getPoints() - 1;
        return PoloidalSpacing.builder().length(leg.getTotalLength()).n(last).nNorm(last)
                .dLower(regrid.getDLower()).dUpper(regrid.getDUpper()).build();
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}

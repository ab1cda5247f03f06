package io.github.yok.fluxgrid.app;

import io.github.yok.fluxgrid.core.equilibrium.EquilibriumAnalyzer;
import io.github.yok.fluxgrid.core.field.Coil;
import io.github.yok.fluxgrid.core.field.CoilField;
import io.github.yok.fluxgrid.core.field.FluxSampleGrid;
import io.github.yok.fluxgrid.core.field.ScalarField2D;
import io.github.yok.fluxgrid.core.field.SpectralFluxField;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.linearalgebra.CosineTransformBackend;
import io.github.yok.fluxgrid.core.linearalgebra.EjmlCosineTransformBackend;
import io.github.yok.fluxgrid.core.separatrix.CircularWall;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixTracer;
import io.github.yok.fluxgrid.core.separatrix.Wall;
import io.github.yok.fluxgrid.core.solver.BrentBoundedMinimizer;
import io.github.yok.fluxgrid.core.solver.BrentRootFinder;
import io.github.yok.fluxgrid.core.solver.RootFinder;
import io.github.yok.fluxgrid.core.solver.ScalarMinimizer;
import io.github.yok.fluxgrid.out.ContourWriter;
import io.github.yok.fluxgrid.out.CsvContourWriter;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 磁束場・平衡解析・セパラトリクス追跡の Bean 定義を行う設定クラスです。
 *
 * <p>
 * fluxgrid.field.type に応じて磁束場の実装（スペクトル補間・解析式・コイル）を選び、 下流の処理はすべて
 * {@link ScalarField2D} として受け取ります。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class FluxSurfaceConfiguration {

    /**
     * flux-grid の設定値（fluxgrid.*）です。
     */
    private final FluxGridProperties p;

    /**
     * DCT バックエンドを生成します。
     *
     * @return DCT バックエンドです
     */
    @Bean
    public CosineTransformBackend cosineTransformBackend() {
        return new EjmlCosineTransformBackend();
    }

    /**
     * 設定に応じた磁束場を生成します。
     *
     * @param backend DCT バックエンドです
     * @return 磁束場です
     * @throws IllegalStateException 設定が不正な場合に発生します
     */
    @Bean
    public ScalarField2D fluxField(CosineTransformBackend backend) {
        FluxGridProperties.Field f = p.getField();
        switch (f.getType()) {
            case SPECTRAL:
                // 解析平衡を等間隔格子でサンプリングし、平衡ファイルの読み込み結果の代わりにします。
                FluxSampleGrid grid = FluxSampleGrid.sample(f.getGeometry(), f.getMinR(),
                        f.getMaxR(), f.getNr(), f.getMinZ(), f.getMaxZ(), f.getNz());
                return new SpectralFluxField(grid.getR(), grid.getZ(), grid.getPsi(), backend);
            case ANALYTIC:
                return f.getGeometry();
            case COIL:
                if (f.getCoils() == null || f.getCoils().isEmpty()) {
                    throw new IllegalStateException("field.coils は COIL の場合に必須です");
                }
                List<Coil> coils = f.getCoils().stream()
                        .map(c -> new Coil(c.getR(), c.getZ(), c.getCurrent()))
                        .collect(Collectors.toList());
                return new CoilField(coils);
            default:
                throw new IllegalStateException("未対応の field.type です: " + f.getType());
        }
    }

    /**
     * 有界 1 次元最小化を生成します。
     *
     * @return 最小化です
     */
    @Bean
    public ScalarMinimizer scalarMinimizer() {
        return new BrentBoundedMinimizer();
    }

    /**
     * 根探索を生成します。
     *
     * @return 根探索です
     */
    @Bean
    public RootFinder rootFinder() {
        return new BrentRootFinder();
    }

    /**
     * 平衡解析器を生成します。
     *
     * @param field 磁束場です
     * @param minimizer 最小化です
     * @param rootFinder 根探索です
     * @return 平衡解析器です
     */
    @Bean
    public EquilibriumAnalyzer equilibriumAnalyzer(ScalarField2D field, ScalarMinimizer minimizer,
            RootFinder rootFinder) {
        return new EquilibriumAnalyzer(field, minimizer, rootFinder,
                p.getXPointSearch().getMaxIterations());
    }

    /**
     * 壁を生成します。
     *
     * @return 円形の壁です
     */
    @Bean
    public Wall wall() {
        FluxGridProperties.Wall w = p.getWall();
        return new CircularWall(new Point2D(w.getCenterR(), w.getCenterZ()), w.getRadius());
    }

    /**
     * セパラトリクス追跡器を生成します。
     *
     * @param analyzer 平衡解析器です
     * @param wall 壁です
     * @return 追跡器です
     */
    @Bean
    public SeparatrixTracer separatrixTracer(EquilibriumAnalyzer analyzer, Wall wall) {
        FluxGridProperties.Separatrix s = p.getSeparatrix();
        return new SeparatrixTracer(analyzer, wall, s.getLegPoints(), s.getRefineWidth(),
                s.getAtol());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ContourWriter contourWriter() {
        return new CsvContourWriter(p.getOutput().getDir());
    }
}

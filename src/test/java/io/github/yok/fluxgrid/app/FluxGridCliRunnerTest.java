package io.github.yok.fluxgrid.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.github.yok.fluxgrid.core.contour.FluxContour;
import io.github.yok.fluxgrid.core.contour.PoloidalSpacing;
import io.github.yok.fluxgrid.core.equilibrium.EquilibriumAnalyzer;
import io.github.yok.fluxgrid.core.field.SyntheticTokamak;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.separatrix.CircularWall;
import io.github.yok.fluxgrid.core.separatrix.LegPosition;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixLegs;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixTracer;
import io.github.yok.fluxgrid.out.ContourWriter;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * {@link FluxGridCliRunner} のテストです。
 */
class FluxGridCliRunnerTest {

    @Test
    @DisplayName("X 点探索から脚の再配置までを実行し、4 本の脚を出力に渡す")
    @SuppressWarnings("unchecked")
    void run_tracesAndRegridsAllLegs() {
        // --- 1. Arrange ---
        FluxGridProperties properties = new FluxGridProperties();
        properties.getField().setType(FluxGridProperties.Field.FieldType.ANALYTIC);
        properties.getSeparatrix().setLegPoints(60);
        properties.getRegrid().setPoints(21);

        EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(SyntheticTokamak.LSN);
        SeparatrixTracer tracer = new SeparatrixTracer(analyzer,
                new CircularWall(new Point2D(1.5, -0.3), 0.15), 60, 0.05, 2e-8);
        ContourWriter writer = mock(ContourWriter.class);
        FluxGridCliRunner runner =
                new FluxGridCliRunner(properties, SyntheticTokamak.LSN, analyzer, tracer, writer);

        // --- 2. Act ---
        runner.run();

        // --- 3. Assert ---
        ArgumentCaptor<SeparatrixLegs> separatrix = ArgumentCaptor.forClass(SeparatrixLegs.class);
        ArgumentCaptor<Map<LegPosition, FluxContour>> lines = ArgumentCaptor.forClass(Map.class);
        verify(writer).write(separatrix.capture(), lines.capture());

        assertEquals(1.5, separatrix.getValue().getXPoint().getR(), 1e-6);
        assertEquals(-0.3, separatrix.getValue().getXPoint().getZ(), 1e-6);
        assertEquals(4, lines.getValue().size());
        double psiSep = separatrix.getValue().getPsiSeparatrix();
        for (FluxContour line : lines.getValue().values()) {
            assertEquals(21, line.size());
            for (Point2D p : line) {
                assertTrue(Math.abs(SyntheticTokamak.LSN.psi(p) - psiSep) <= 2e-8);
            }
        }
    }

    @Test
    @DisplayName("端の間隔が未指定なら等間隔（null）を返す")
    void spacingFor_uniform() {
        FluxGridProperties.Regrid regrid = new FluxGridProperties.Regrid();

        assertNull(FluxGridCliRunner.spacingFor(straightLeg(), regrid));
    }

    @Test
    @DisplayName("端の間隔を指定すると脚の全長に合わせた間隔関数を返す")
    void spacingFor_withLowerSpacing() {
        FluxGridProperties.Regrid regrid = new FluxGridProperties.Regrid();
        regrid.setPoints(11);
        regrid.setDLower(0.01);

        DoubleUnaryOperator f = FluxGridCliRunner.spacingFor(straightLeg(), regrid);

        PoloidalSpacing spacing = assertInstanceOf(PoloidalSpacing.class, f);
        assertEquals(2.0, spacing.getLength(), 1e-15);
        assertEquals(10.0, spacing.getN(), 0.0);
        assertEquals(0.0, f.applyAsDouble(0.0), 1e-15);
        assertEquals(2.0, f.applyAsDouble(10.0), 1e-12);
    }

    @Test
    @DisplayName("延長を指定しても端の間隔から間隔関数を作る")
    void spacingFor_withExtension() {
        FluxGridProperties.Regrid regrid = new FluxGridProperties.Regrid();
        regrid.setPoints(11);
        regrid.setDUpper(0.01);
        regrid.setExtendLower(1);
        regrid.setExtendUpper(2);

        DoubleUnaryOperator f = FluxGridCliRunner.spacingFor(straightLeg(), regrid);

        assertInstanceOf(PoloidalSpacing.class, f);
        assertEquals(2.0, f.applyAsDouble(10.0), 1e-12);
    }

    @Test
    @DisplayName("X 点探索に失敗した場合は出力せずに例外を伝播する")
    void run_propagatesSaddleFailure() {
        FluxGridProperties properties = new FluxGridProperties();
        // X 点を含まない箱
        properties.getXPointSearch().setMinZ(0.2);
        properties.getXPointSearch().setMaxZ(0.4);
        EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(SyntheticTokamak.LSN);
        SeparatrixTracer tracer = new SeparatrixTracer(analyzer,
                new CircularWall(new Point2D(1.5, -0.3), 0.15), 10, 0.05, 2e-8);
        ContourWriter writer = mock(ContourWriter.class);
        FluxGridCliRunner runner =
                new FluxGridCliRunner(properties, SyntheticTokamak.LSN, analyzer, tracer, writer);

        assertThrows(IllegalStateException.class, runner::run);
        verify(writer, never()).write(any(), any());
    }

    private static FluxContour straightLeg() {
        return new FluxContour(List.of(new Point2D(0.0, 0.0), new Point2D(1.2, 1.6)),
                SyntheticTokamak.LSN, 0.0);
    }
}

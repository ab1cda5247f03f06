package io.github.yok.fluxgrid.core.equilibrium;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.yok.fluxgrid.core.field.AnalyticField;
import io.github.yok.fluxgrid.core.field.Coil;
import io.github.yok.fluxgrid.core.field.CoilField;
import io.github.yok.fluxgrid.core.field.FluxSampleGrid;
import io.github.yok.fluxgrid.core.field.SpectralFluxField;
import io.github.yok.fluxgrid.core.field.SyntheticTokamak;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.solver.BrentBoundedMinimizer;
import io.github.yok.fluxgrid.core.solver.RootFinder;
import io.github.yok.fluxgrid.core.solver.RootSearchException;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * {@link EquilibriumAnalyzer} の極値・鞍点・根探索のテストです。
 */
class EquilibriumAnalyzerTest {

    /**
     * psi = (R-0.1)^2 - 2(Z+0.2)^2 + 0.9RZ + 0.3R^3 の鞍点 (0.16183, -0.16359) です。
     */
    private static final double SKEW_SADDLE_R =
            (-2.2025 + Math.sqrt(2.2025 * 2.2025 + 4.0 * 0.9 * 0.38)) / 1.8;

    private static final double SKEW_SADDLE_Z = -0.2 + 0.225 * SKEW_SADDLE_R;

    private static AnalyticField skewField() {
        return AnalyticField.of((r, z) -> (r - 0.1) * (r - 0.1) - 2.0 * (z + 0.2) * (z + 0.2)
                + 0.9 * r * z + 0.3 * r * r * r);
    }

    @Nested
    @DisplayName("1 次元の極値探索")
    class Extremum1D {

        private final EquilibriumAnalyzer analyzer =
                new EquilibriumAnalyzer(AnalyticField.of((r, z) -> (r - 0.3) * (r - 0.3)));

        @Test
        @DisplayName("線分内部の極小を求める")
        void interiorMinimum() {
            Extremum extremum =
                    analyzer.findExtremum1D(new Point2D(0.0, 0.0), new Point2D(1.0, 0.0));

            assertTrue(extremum.isMinimum());
            assertEquals(0.3, extremum.getPosition().getR(), 1e-7);
            assertEquals(0.0, extremum.getPosition().getZ(), 0.0);
        }

        @Test
        @DisplayName("極小が端点にある場合は極大を探す")
        void interiorMaximum() {
            EquilibriumAnalyzer negated =
                    new EquilibriumAnalyzer(AnalyticField.of((r, z) -> -(r - 0.3) * (r - 0.3)));

            Extremum extremum =
                    negated.findExtremum1D(new Point2D(0.0, 0.0), new Point2D(1.0, 0.0));

            assertFalse(extremum.isMinimum());
            assertEquals(0.3, extremum.getPosition().getR(), 1e-7);
        }

        @Test
        @DisplayName("単調な場合は ExtremumNotFoundException になる")
        void monotone_throws() {
            EquilibriumAnalyzer linear = new EquilibriumAnalyzer(AnalyticField.of((r, z) -> r + z));

            assertThrows(ExtremumNotFoundException.class,
                    () -> linear.findExtremum1D(new Point2D(0.0, 0.0), new Point2D(1.0, 1.0)));
        }

        @Test
        @DisplayName("端点も含めた最小点・最大点を返す")
        void minimumAndMaximumIncludeEndpoints() {
            Point2D start = new Point2D(0.0, 0.0);
            Point2D end = new Point2D(1.0, 0.0);

            Point2D min = analyzer.findMinimum1D(start, end, 1e-9);
            Point2D max = analyzer.findMaximum1D(start, end, 1e-9);

            assertEquals(0.3, min.getR(), 1e-7);
            assertEquals(1.0, max.getR(), 1e-6);
        }
    }

    @Nested
    @DisplayName("鞍点探索")
    class SaddlePoint {

        @Test
        @DisplayName("R^2 - Z^2 の鞍点は原点になる")
        void hyperbolicSaddle() {
            EquilibriumAnalyzer analyzer =
                    new EquilibriumAnalyzer(AnalyticField.of((r, z) -> r * r - z * z));

            Point2D saddle = analyzer.findSaddlePoint(-1.0, 1.0, -1.0, 1.0);

            assertEquals(0.0, saddle.getR(), 2e-8);
            assertEquals(0.0, saddle.getZ(), 2e-8);
        }

        @Test
        @DisplayName("軸に沿わない鞍点も求められる")
        void skewedSaddle() {
            EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(skewField());

            Point2D saddle = analyzer.findSaddlePoint(-0.5, 0.5, -0.5, 0.5);

            assertEquals(SKEW_SADDLE_R, saddle.getR(), 1e-6);
            assertEquals(SKEW_SADDLE_Z, saddle.getZ(), 1e-6);
        }

        @Test
        @DisplayName("3 次の項を含む場でも原点の鞍点を求める")
        void cubicSaddle() {
            EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(AnalyticField.of((r, z) -> r * r
                    - z * z + 0.5 * r * z + 0.2 * r * r * z + 0.1 * z * z * z));

            Point2D saddle = analyzer.findSaddlePoint(-1.0, 1.0, -1.0, 1.0);

            assertEquals(0.0, saddle.getR(), 1e-7);
            assertEquals(0.0, saddle.getZ(), 1e-7);
        }

        @Test
        @DisplayName("辺の極値がすべて極小なら鞍点ではない")
        void bowl_throws() {
            EquilibriumAnalyzer analyzer =
                    new EquilibriumAnalyzer(AnalyticField.of((r, z) -> r * r + z * z));

            assertThrows(SaddlePointConvergenceException.class,
                    () -> analyzer.findSaddlePoint(-1.0, 1.0, -1.0, 1.0));
        }

        @Test
        @DisplayName("反復上限を超えると SaddlePointConvergenceException になる")
        void iterationCap_throws() {
            EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(skewField(),
                    new BrentBoundedMinimizer(), mock(RootFinder.class), 3);

            SaddlePointConvergenceException e = assertThrows(SaddlePointConvergenceException.class,
                    () -> analyzer.findSaddlePoint(-0.5, 0.5, -0.5, 0.5));
            assertTrue(e.getMessage().contains("3"), e.getMessage());
        }

        @Test
        @DisplayName("スペクトル補間した LSN 平衡の X 点を求める")
        void spectralLowerSingleNull() {
            FluxSampleGrid grid = SyntheticTokamak.LSN.sample(65, 65);
            SpectralFluxField field =
                    new SpectralFluxField(grid.getR(), grid.getZ(), grid.getPsi());
            EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(field);

            Point2D xPoint = analyzer.findSaddlePoint(1.4, 1.6, -0.4, -0.2);

            assertEquals(1.5, xPoint.getR(), 5e-4);
            assertEquals(-0.3, xPoint.getZ(), 5e-4);
        }

        @Test
        @DisplayName("上下対称なコイル対の間の X 点を求める")
        void coilPair() {
            CoilField field = new CoilField(
                    List.of(new Coil(1.0, 0.3, 1000.0), new Coil(1.0, -0.3, 1000.0)));
            EquilibriumAnalyzer analyzer = new EquilibriumAnalyzer(field);

            Point2D xPoint = analyzer.findSaddlePoint(0.8, 1.2, -0.15, 0.15);

            assertEquals(0.97962, xPoint.getR(), 1e-4);
            assertEquals(0.0, xPoint.getZ(), 1e-6);
        }
    }

    @Nested
    @DisplayName("1 次元の根探索")
    class Roots1D {

        private final EquilibriumAnalyzer analyzer =
                new EquilibriumAnalyzer(AnalyticField.of((r, z) -> r));

        @Test
        @DisplayName("期待より多くの根が見つかった場合はすべて返す")
        void moreRootsThanExpected() {
            double[] roots = analyzer.findRoots1D(Math::sin, 2, 0.5, 10.0);

            assertArrayEquals(new double[] {Math.PI, 2.0 * Math.PI, 3.0 * Math.PI}, roots, 1e-7);
        }

        @Test
        @DisplayName("単一の根を求める")
        void singleRoot() {
            double[] roots = analyzer.findRoots1D(x -> x - Math.PI, 1, 0.0, 2.0 * Math.PI);

            assertEquals(1, roots.length);
            assertEquals(Math.PI, roots[0], 1e-8);
        }

        @Test
        @DisplayName("隣り合う区間の近接した 2 根をどちらも返す")
        void closeRootsInAdjacentBrackets() {
            // --- 1. Arrange ---
            DoubleUnaryOperator f = x -> (x - 0.5 + 1e-7) * (x - 0.5 - 1e-7);

            // --- 2. Act ---
            double[] roots = analyzer.findRoots1D(f, 2, 0.0, 1.0);

            // --- 3. Assert ---
            assertEquals(2, roots.length);
            assertEquals(0.5 - 1e-7, roots[0], 2e-8);
            assertEquals(0.5 + 1e-7, roots[1], 2e-8);
            assertTrue(roots[0] < roots[1]);
        }

        @Test
        @DisplayName("根がない場合は RootSearchException になる")
        void noRoot_throws() {
            assertThrows(RootSearchException.class,
                    () -> analyzer.findRoots1D(x -> x * x + 1.0, 1, -1.0, 1.0));
        }

        @Test
        @DisplayName("サンプル点がちょうど根に一致した場合は RootSearchException になる")
        void exactZeroSample_throws() {
            assertThrows(RootSearchException.class,
                    () -> analyzer.findRoots1D(x -> x, 2, -1.0, 1.0));
        }

        @Test
        @DisplayName("根探索が収束しない場合は RootSearchException になる")
        void nonConvergedBracket_throws() {
            // --- 1. Arrange ---
            RootFinder rootFinder = mock(RootFinder.class);
            when(rootFinder.findRoot(any(DoubleUnaryOperator.class), anyDouble(), anyDouble(),
                    anyDouble(), anyDouble()))
                    .thenReturn(new RootFinder.RootResult(0.5, 1.0, 200, false));
            EquilibriumAnalyzer mocked = new EquilibriumAnalyzer(AnalyticField.of((r, z) -> r),
                    new BrentBoundedMinimizer(), rootFinder, 10);

            // --- 2. Act ---
            RootSearchException e = assertThrows(RootSearchException.class,
                    () -> mocked.findRoots1D(x -> x - 0.3, 1, 0.0, 1.0));

            // --- 3. Assert ---
            assertTrue(e.getMessage().contains("収束"), e.getMessage());
        }
    }

    @Test
    @DisplayName("null の依存や 0 以下の反復上限は拒否される")
    void constructor_rejectsInvalidArguments() {
        AnalyticField field = AnalyticField.of((r, z) -> r);

        assertThrows(IllegalArgumentException.class, () -> new EquilibriumAnalyzer(null));
        assertThrows(IllegalArgumentException.class,
                () -> new EquilibriumAnalyzer(field, null, mock(RootFinder.class), 10));
        assertThrows(IllegalArgumentException.class,
                () -> new EquilibriumAnalyzer(field, new BrentBoundedMinimizer(), null, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new EquilibriumAnalyzer(field, new BrentBoundedMinimizer(),
                        mock(RootFinder.class), 0));
    }
}

package io.github.yok.fluxgrid.core.contour;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.fluxgrid.core.field.AnalyticField;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.solver.RootSearchException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleFunction;
import java.util.function.DoubleUnaryOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link FluxContour} のテストです。
 *
 * <p>
 * 基本となる等値線は中心 (0.2, 0.3)、半径 1 の円周上に 23 点を並べたもので、 磁束場は psi = R^2 + Z^4 です。
 * </p>
 */
class FluxContourTest {

    private static final int NPOINTS = 23;

    private static final double RADIUS = 1.0;

    private static final double R0 = 0.2;

    private static final double Z0 = 0.3;

    private static final AnalyticField QUARTIC = AnalyticField.of((r, z) -> r * r + z * z * z * z,
            (r, z) -> 2.0 * r, (r, z) -> 4.0 * z * z * z);

    private static final AnalyticField CIRCULAR =
            AnalyticField.of((r, z) -> r * r + z * z, (r, z) -> 2.0 * r, (r, z) -> 2.0 * z);

    private List<Point2D> circle;

    private FluxContour contour;

    @BeforeEach
    void setUp() {
        circle = circle(R0, Z0, RADIUS, NPOINTS);
        contour = new FluxContour(circle, QUARTIC, 0.0);
    }

    @Test
    @DisplayName("累積弧長は円周上の弦の長さの倍数になる")
    void distance_isMultipleOfChord() {
        double segment = 2.0 * RADIUS * Math.sin(2.0 * Math.PI / (NPOINTS - 1) / 2.0);

        double[] distance = contour.getDistance();

        assertEquals(NPOINTS, distance.length);
        for (int i = 0; i < NPOINTS; i++) {
            assertEquals(segment * i, distance[i], 1e-12);
        }
        assertEquals(segment * (NPOINTS - 1), contour.getTotalLength(), 1e-12);
    }

    @Test
    @DisplayName("反復と添字アクセスは元の点列を返す")
    void iterationAndIndexing() {
        List<Point2D> iterated = new ArrayList<>();
        contour.forEach(iterated::add);

        assertEquals(circle, iterated);
        assertEquals(circle.get(5), contour.get(5));
        assertEquals(NPOINTS, contour.size());
        assertThrows(UnsupportedOperationException.class,
                () -> contour.getPoints().add(new Point2D(0.0, 0.0)));
    }

    @Test
    @DisplayName("点を追加すると累積弧長が延長される")
    void append_extendsDistance() {
        Point2D last = contour.get(NPOINTS - 1);
        double expected = contour.getTotalLength()
                + Math.sqrt((1.0 - last.getR()) * (1.0 - last.getR())
                        + (1.0 - last.getZ()) * (1.0 - last.getZ()));

        contour.append(new Point2D(1.0, 1.0));

        assertEquals(NPOINTS + 1, contour.size());
        assertEquals(expected, contour.getTotalLength(), 1e-12);
    }

    @Test
    @DisplayName("反転すると点・累積弧長・端点の目印が逆順になる")
    void reverse_reversesPointsDistanceAndTags() {
        // --- 1. Arrange ---
        double[] before = contour.getDistance();
        double total = contour.getTotalLength();
        EndpointTag start = new EndpointTag("xpoint", contour.get(0));
        contour.setStartTag(start);

        // --- 2. Act ---
        contour.reverse();

        // --- 3. Assert ---
        double[] after = contour.getDistance();
        for (int i = 0; i < NPOINTS; i++) {
            assertEquals(circle.get(NPOINTS - 1 - i), contour.get(i));
            assertEquals(total - before[NPOINTS - 1 - i], after[i], 1e-12);
        }
        assertNull(contour.getStartTag());
        assertSame(start, contour.getEndTag());
    }

    @Test
    @DisplayName("射影後の各点は指定した psi の等値線上にある")
    void refine_projectsOntoContour() {
        contour.setPsival(0.7);

        contour.refine(1.0, 1e-13);

        for (Point2D p : contour) {
            assertEquals(0.7, QUARTIC.psi(p), 1e-13);
        }
    }

    @Test
    @DisplayName("getRefined は元の点列を変更しない")
    void getRefined_leavesOriginalUntouched() {
        contour.setPsival(0.7);

        FluxContour refined = contour.getRefined(1.0, 1e-13);

        assertEquals(circle, contour.getPoints());
        assertEquals(0.7, QUARTIC.psi(refined.get(3)), 1e-13);
        assertEquals(0.7, refined.getPsival(), 0.0);
    }

    @Test
    @DisplayName("窓内に等値線がなければ RootSearchException になる")
    void refine_withoutCrossingInWindow_throws() {
        FluxContour unit = new FluxContour(circle(0.0, 0.0, 1.0, 9), CIRCULAR, 4.0);

        assertThrows(RootSearchException.class, () -> unit.refine(0.1, 1e-10));
    }

    @Test
    @DisplayName("補間関数は弧長の中点で円の反対側の点を返す")
    void interpFunction_midpoint() {
        DoubleFunction<Point2D> f = contour.interpFunction();

        Point2D p = f.apply(0.5 * contour.getTotalLength());

        assertEquals(R0 - RADIUS, p.getR(), 1e-12);
        assertEquals(Z0, p.getZ(), 1e-12);
    }

    @Test
    @DisplayName("弧長関数に沿って円周上に再配置する")
    void getRegridded_withArcLengthFunction() {
        // --- 1. Arrange ---
        FluxContour orig = new FluxContour(circle(0.0, 0.0, 1.0, 1000), CIRCULAR, 1.0);
        int newNpoints = 97;
        DoubleUnaryOperator sfunc = i -> Math.sqrt(i / (newNpoints - 1)) * 2.0 * Math.PI;

        // --- 2. Act ---
        FluxContour regridded = orig.getRegridded(newNpoints, sfunc, 1e-3);

        // --- 3. Assert ---
        assertEquals(newNpoints, regridded.size());
        for (int i = 0; i < newNpoints; i++) {
            double theta = sfunc.applyAsDouble(i);
            assertEquals(Math.cos(theta), regridded.get(i).getR(), 2e-5, "R at " + i);
            assertEquals(Math.sin(theta), regridded.get(i).getZ(), 2e-5, "Z at " + i);
        }
    }

    @Test
    @DisplayName("両端を延長して再配置すると外挿した点が追加される")
    void getRegridded_withExtension() {
        // --- 1. Arrange ---
        List<Point2D> unit = circle(0.0, 0.0, 1.0, NPOINTS);
        FluxContour orig = new FluxContour(unit, CIRCULAR, 1.0);
        orig.setEndTag(new EndpointTag("wall", unit.get(NPOINTS - 1)));

        // --- 2. Act ---
        FluxContour extended = orig.getRegridded(NPOINTS, null, 0.1, FluxContour.DEFAULT_ATOL, 1, 2);

        // --- 3. Assert ---
        assertEquals(NPOINTS + 3, extended.size());
        for (int i = 0; i < NPOINTS; i++) {
            assertEquals(unit.get(i).getR(), extended.get(i + 1).getR(), 1e-10);
            assertEquals(unit.get(i).getZ(), extended.get(i + 1).getZ(), 1e-10);
        }
        assertClose(unit.get(NPOINTS - 2), extended.get(0), 2e-3);
        assertClose(unit.get(1), extended.get(NPOINTS + 1), 2e-3);
        assertClose(unit.get(2), extended.get(NPOINTS + 2), 2e-2);
        for (Point2D p : extended) {
            assertEquals(1.0, CIRCULAR.psi(p), 1e-7);
        }
        assertSame(orig.getEndTag(), extended.getEndTag());
    }

    @Test
    @DisplayName("弧長関数と延長を併用すると端の間隔を延ばした位置に点を追加する")
    void getRegridded_withArcLengthFunctionAndExtension() {
        // --- 1. Arrange ---
        List<Point2D> half = new ArrayList<>(200);
        for (int i = 0; i < 200; i++) {
            double theta = Math.PI * i / 199;
            half.add(new Point2D(Math.cos(theta), Math.sin(theta)));
        }
        FluxContour orig = new FluxContour(half, CIRCULAR, 1.0);
        double total = orig.getTotalLength();
        int newNpoints = 21;
        // i < 0 では NaN になる弧長関数です。
        DoubleUnaryOperator sfunc = i -> Math.sqrt(i / (newNpoints - 1)) * total;

        // --- 2. Act ---
        FluxContour extended = orig.getRegridded(newNpoints, sfunc, 0.1, 1e-10, 1, 1);

        // --- 3. Assert ---
        assertEquals(newNpoints + 2, extended.size());
        double lowerStep = sfunc.applyAsDouble(1) - sfunc.applyAsDouble(0);
        double upperStep = sfunc.applyAsDouble(newNpoints - 1) - sfunc.applyAsDouble(newNpoints - 2);
        double[] expectedS = new double[newNpoints + 2];
        expectedS[0] = -lowerStep;
        for (int i = 0; i < newNpoints; i++) {
            expectedS[i + 1] = sfunc.applyAsDouble(i);
        }
        expectedS[newNpoints + 1] = total + upperStep;
        for (int i = 0; i < expectedS.length; i++) {
            Point2D p = extended.get(i);
            assertEquals(Math.cos(expectedS[i]), p.getR(), 1e-4, "R at " + i);
            assertEquals(Math.sin(expectedS[i]), p.getZ(), 1e-4, "Z at " + i);
            assertEquals(1.0, CIRCULAR.psi(p), 1e-9, "psi at " + i);
        }
    }

    @Test
    @DisplayName("等間隔の再配置は始点と終点を保つ")
    void getRegridded_uniformKeepsEndpoints() {
        FluxContour orig = new FluxContour(circle(0.0, 0.0, 1.0, 40), CIRCULAR, 1.0);

        FluxContour regridded = orig.getRegridded(11, 1e-2, 1e-12);

        assertEquals(11, regridded.size());
        assertClose(orig.get(0), regridded.get(0), 1e-12);
        assertClose(orig.get(39), regridded.get(10), 1e-12);
        double[] distance = regridded.getDistance();
        for (int i = 1; i < 11; i++) {
            assertEquals(distance[1], distance[i] - distance[i - 1], 1e-3);
        }
    }

    private static void assertClose(Point2D expected, Point2D actual, double tolerance) {
        assertEquals(expected.getR(), actual.getR(), tolerance, "R: " + actual);
        assertEquals(expected.getZ(), actual.getZ(), tolerance, "Z: " + actual);
    }

    private static List<Point2D> circle(double r0, double z0, double radius, int n) {
        List<Point2D> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double theta = 2.0 * Math.PI * i / (n - 1);
            out.add(new Point2D(r0 + radius * Math.cos(theta), z0 + radius * Math.sin(theta)));
        }
        return out;
    }
}

package io.github.yok.fluxgrid.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fluxgrid.core.solver.ScalarMinimizer.MinimizationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link BrentBoundedMinimizer} のテストです。
 */
class BrentBoundedMinimizerTest {

    private final BrentBoundedMinimizer minimizer = new BrentBoundedMinimizer();

    @Test
    @DisplayName("放物線の最小点を求める")
    void minimize_parabola() {
        MinimizationResult result = minimizer.minimize(x -> (x - 2.0) * (x - 2.0) + 1.0, 0.0, 5.0,
                1e-10);

        assertTrue(result.isConverged());
        assertEquals(2.0, result.getPosition(), 1e-6);
        assertEquals(1.0, result.getValue(), 1e-12);
    }

    @Test
    @DisplayName("区間内の cos の最小点 π を求める")
    void minimize_cosine() {
        MinimizationResult result = minimizer.minimize(Math::cos, 1.0, 5.0, 1e-10);

        assertTrue(result.isConverged());
        assertEquals(Math.PI, result.getPosition(), 1e-6);
    }

    @Test
    @DisplayName("単調関数では区間端の近くで止まる")
    void minimize_monotone_stopsNearBoundary() {
        MinimizationResult result = minimizer.minimize(x -> x, 0.0, 1.0, 1e-8);

        assertTrue(result.getPosition() < 1e-6, "下端付近で止まっていません: " + result.getPosition());
    }

    @Test
    @DisplayName("評価回数の上限に達すると未収束を返す")
    void minimize_evaluationCap() {
        BrentBoundedMinimizer capped = new BrentBoundedMinimizer(3);

        MinimizationResult result = capped.minimize(Math::cos, 1.0, 5.0, 1e-12);

        assertFalse(result.isConverged());
        assertEquals(3, result.getEvaluations());
    }

    @Test
    @DisplayName("不正な区間・許容誤差は拒否される")
    void minimize_rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> minimizer.minimize(x -> x, 1.0, 1.0, 1e-8));
        assertThrows(IllegalArgumentException.class, () -> minimizer.minimize(x -> x, 0.0, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new BrentBoundedMinimizer(0));
    }
}

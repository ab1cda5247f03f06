package io.github.yok.fluxgrid.core.solver;

import java.util.function.DoubleUnaryOperator;
import lombok.Value;

/**
 * 有界区間上の 1 変数関数を最小化する処理を表すインタフェースです。
 */
public interface ScalarMinimizer {

    /**
     * 区間 [lower, upper] 上で f を最小化します。
     *
     * @param f 目的関数です
     * @param lower 区間の下端です
     * @param upper 区間の上端です
     * @param xatol 位置の絶対許容誤差です
     * @return 最小化結果です
     */
    MinimizationResult minimize(DoubleUnaryOperator f, double lower, double upper, double xatol);

    /**
     * 最小化の結果を保持するクラスです。
     */
    @Value
    class MinimizationResult {

        /**
         * 最小点の位置です。
         */
        double position;

        /**
         * 最小点での関数値です。
         */
        double value;

        /**
         * 関数評価回数です。
         */
        int evaluations;

        /**
         * 許容誤差内に収束したかどうかです。
         */
        boolean converged;
    }
}

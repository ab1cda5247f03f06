package io.github.yok.fluxgrid.core.solver;

import java.util.function.DoubleUnaryOperator;
import lombok.Value;

/**
 * 符号反転で挟まれた区間から 1 変数関数の根を求める処理を表すインタフェースです。
 */
public interface RootFinder {

    /**
     * 区間 [a, b] 内の f の根を求めます。
     *
     * @param f 対象関数です
     * @param a 区間の一端です
     * @param b 区間の他端です
     * @param xtol 位置の絶対許容誤差です
     * @param ftol 残差の許容誤差（|f| ≤ ftol で停止、0 なら無効）です
     * @return 探索結果です
     * @throws IllegalArgumentException f(a) と f(b) が同符号の場合に発生します
     */
    RootResult findRoot(DoubleUnaryOperator f, double a, double b, double xtol, double ftol);

    /**
     * 根探索の結果を保持するクラスです。
     */
    @Value
    class RootResult {

        /**
         * 根の推定値です。
         */
        double root;

        /**
         * 推定値での関数値です。
         */
        double value;

        /**
         * 反復回数です。
         */
        int iterations;

        /**
         * 許容誤差内に収束したかどうかです。
         */
        boolean converged;
    }
}

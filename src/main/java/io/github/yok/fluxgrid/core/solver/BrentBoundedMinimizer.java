package io.github.yok.fluxgrid.core.solver;

import com.google.common.base.Preconditions;
import java.util.function.DoubleUnaryOperator;
import lombok.Getter;

/**
 * 黄金分割と放物線補間を組み合わせた Brent 法で、有界区間上の最小値を探索します。
 *
 * <p>
 * 停止条件は {@code |x - m| <= 2 tol1 - (b - a)/2}（m は区間中点、{@code tol1 = sqrt(ε)|x| + xatol/3}）です。
 * 評価回数が上限に達した場合は、その時点の最良点を未収束として返します。
 * </p>
 */
@Getter
public final class BrentBoundedMinimizer implements ScalarMinimizer {

    /**
     * 既定の関数評価回数の上限です。
     */
    public static final int DEFAULT_MAX_EVALUATIONS = 500;

    private static final double SQRT_EPS = Math.sqrt(2.2e-16);

    private static final double GOLDEN = 0.5 * (3.0 - Math.sqrt(5.0));

    /**
     * 関数評価回数の上限です。
     */
    private final int maxEvaluations;

    /**
     * 既定の評価回数上限で生成します。
     */
    public BrentBoundedMinimizer() {
        this(DEFAULT_MAX_EVALUATIONS);
    }

    /**
     * 評価回数上限を指定して生成します。
     *
     * @param maxEvaluations 関数評価回数の上限（1以上）です
     */
    public BrentBoundedMinimizer(int maxEvaluations) {
        Preconditions.checkArgument(maxEvaluations >= 1, "評価回数の上限は 1 以上である必要があります。max=%s",
                maxEvaluations);
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * 区間 [lower, upper] 上で f を最小化します。
     *
     * @param f 目的関数です
     * @param lower 区間の下端です
     * @param upper 区間の上端です
     * @param xatol 位置の絶対許容誤差（正）です
     * @return 最小化結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    @Override
    public MinimizationResult minimize(DoubleUnaryOperator f, double lower, double upper,
            double xatol) {
        Preconditions.checkNotNull(f, "目的関数が null です。");
        Preconditions.checkArgument(lower < upper, "区間の下端は上端より小さい必要があります。[%s, %s]", lower, upper);
        Preconditions.checkArgument(xatol > 0.0, "許容誤差は正である必要があります。xatol=%s", xatol);

        double a = lower;
        double b = upper;

        // xf: 最良点、nfc: 2番目、fulc: 3番目
        double fulc = a + GOLDEN * (b - a);
        double nfc = fulc;
        double xf = fulc;
        double rat = 0.0;
        double e = 0.0;
        double fx = f.applyAsDouble(xf);
        int evaluations = 1;
        double ffulc = fx;
        double fnfc = fx;
        double xm = 0.5 * (a + b);
        double tol1 = SQRT_EPS * Math.abs(xf) + xatol / 3.0;
        double tol2 = 2.0 * tol1;

        while (Math.abs(xf - xm) > (tol2 - 0.5 * (b - a))) {
            boolean goldenStep = true;

            if (Math.abs(e) > tol1) {
                // 放物線補間を試します。
                goldenStep = false;
                double r = (xf - nfc) * (fx - ffulc);
                double q = (xf - fulc) * (fx - fnfc);
                double p = (xf - fulc) * q - (xf - nfc) * r;
                q = 2.0 * (q - r);
                if (q > 0.0) {
                    p = -p;
                }
                q = Math.abs(q);
                r = e;
                e = rat;

                if (Math.abs(p) < Math.abs(0.5 * q * r) && p > q * (a - xf) && p < q * (b - xf)) {
                    rat = p / q;
                    double x = xf + rat;
                    if ((x - a) < tol2 || (b - x) < tol2) {
                        rat = tol1 * signOf(xm - xf);
                    }
                } else {
                    goldenStep = true;
                }
            }

            if (goldenStep) {
                e = (xf >= xm) ? (a - xf) : (b - xf);
                rat = GOLDEN * e;
            }

            double x = xf + signOf(rat) * Math.max(Math.abs(rat), tol1);
            double fu = f.applyAsDouble(x);
            evaluations++;

            if (fu <= fx) {
                if (x >= xf) {
                    a = xf;
                } else {
                    b = xf;
                }
                fulc = nfc;
                ffulc = fnfc;
                nfc = xf;
                fnfc = fx;
                xf = x;
                fx = fu;
            } else {
                if (x < xf) {
                    a = x;
                } else {
                    b = x;
                }
                if (fu <= fnfc || nfc == xf) {
                    fulc = nfc;
                    ffulc = fnfc;
                    nfc = x;
                    fnfc = fu;
                } else if (fu <= ffulc || fulc == xf || fulc == nfc) {
                    fulc = x;
                    ffulc = fu;
                }
            }

            xm = 0.5 * (a + b);
            tol1 = SQRT_EPS * Math.abs(xf) + xatol / 3.0;
            tol2 = 2.0 * tol1;

            if (evaluations >= maxEvaluations) {
                return new MinimizationResult(xf, fx, evaluations, false);
            }
        }
        return new MinimizationResult(xf, fx, evaluations, true);
    }

    /**
     * 符号を返します（0 は正とみなします）。
     *
     * @param v 値です
     * @return 1.0 または -1.0 です
     */
    private static double signOf(double v) {
        return v < 0.0 ? -1.0 : 1.0;
    }
}

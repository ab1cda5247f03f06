package io.github.yok.fluxgrid.core.solver;

import com.google.common.base.Preconditions;
import java.util.function.DoubleUnaryOperator;
import lombok.Getter;

/**
 * 逆二次補間・割線法・二分法を組み合わせた Brent 法で根を求めます。
 *
 * <p>
 * 常に符号反転区間を保持するため、挟み込み区間が与えられれば必ず収束に向かいます。 停止条件は、区間半幅が
 * {@code (xtol + rtol|x|)/2} 未満になるか、{@code |f(x)| <= ftol} となった場合です。
 * </p>
 */
@Getter
public final class BrentRootFinder implements RootFinder {

    /**
     * 既定の反復回数の上限です。
     */
    public static final int DEFAULT_MAX_ITERATIONS = 200;

    /**
     * 位置の相対許容誤差（4 マシンイプシロン）です。
     */
    private static final double RTOL = 4.0 * Math.ulp(1.0);

    /**
     * 反復回数の上限です。
     */
    private final int maxIterations;

    /**
     * 既定の反復回数上限で生成します。
     */
    public BrentRootFinder() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    /**
     * 反復回数上限を指定して生成します。
     *
     * @param maxIterations 反復回数の上限（1以上）です
     */
    public BrentRootFinder(int maxIterations) {
        Preconditions.checkArgument(maxIterations >= 1, "反復回数の上限は 1 以上である必要があります。max=%s",
                maxIterations);
        this.maxIterations = maxIterations;
    }

    @Override
    public RootResult findRoot(DoubleUnaryOperator f, double a, double b, double xtol,
            double ftol) {
        Preconditions.checkNotNull(f, "対象関数が null です。");
        Preconditions.checkArgument(xtol >= 0.0 && ftol >= 0.0, "許容誤差は非負である必要があります。xtol=%s, ftol=%s",
                xtol, ftol);

        double xpre = a;
        double xcur = b;
        double fpre = f.applyAsDouble(xpre);
        double fcur = f.applyAsDouble(xcur);

        if (fpre == 0.0) {
            return new RootResult(xpre, fpre, 0, true);
        }
        if (fcur == 0.0) {
            return new RootResult(xcur, fcur, 0, true);
        }
        if ((fpre > 0.0) == (fcur > 0.0)) {
            throw new IllegalArgumentException(
                    "区間の両端で符号が反転していません: f(" + a + ")=" + fpre + ", f(" + b + ")=" + fcur);
        }

        // xblk: 符号反転の相手側の端点
        double xblk = 0.0;
        double fblk = 0.0;
        double spre = 0.0;
        double scur = 0.0;

        for (int iter = 1; iter <= maxIterations; iter++) {
            if (fpre != 0.0 && fcur != 0.0 && ((fpre < 0.0) != (fcur < 0.0))) {
                xblk = xpre;
                fblk = fpre;
                spre = xcur - xpre;
                scur = spre;
            }
            if (Math.abs(fblk) < Math.abs(fcur)) {
                xpre = xcur;
                xcur = xblk;
                xblk = xpre;
                fpre = fcur;
                fcur = fblk;
                fblk = fpre;
            }

            double delta = 0.5 * (xtol + RTOL * Math.abs(xcur));
            double sbis = 0.5 * (xblk - xcur);
            if (fcur == 0.0 || Math.abs(sbis) < delta || Math.abs(fcur) <= ftol) {
                return new RootResult(xcur, fcur, iter, true);
            }

            if (Math.abs(spre) > delta && Math.abs(fcur) < Math.abs(fpre)) {
                double stry;
                if (xpre == xblk) {
                    // 割線法
                    stry = -fcur * (xcur - xpre) / (fcur - fpre);
                } else {
                    // 逆二次補間
                    double dpre = (fpre - fcur) / (xpre - xcur);
                    double dblk = (fblk - fcur) / (xblk - xcur);
                    stry = -fcur * (fblk * dblk - fpre * dpre) / (dblk * dpre * (fblk - fpre));
                }
                if (2.0 * Math.abs(stry) < Math.min(Math.abs(spre), 3.0 * Math.abs(sbis) - delta)) {
                    spre = scur;
                    scur = stry;
                } else {
                    spre = sbis;
                    scur = sbis;
                }
            } else {
                spre = sbis;
                scur = sbis;
            }

            xpre = xcur;
            fpre = fcur;
            if (Math.abs(scur) > delta) {
                xcur += scur;
            } else {
                xcur += (sbis > 0.0) ? delta : -delta;
            }
            fcur = f.applyAsDouble(xcur);
        }
        return new RootResult(xcur, fcur, maxIterations, false);
    }
}

package io.github.yok.fluxgrid.core.contour;

import com.google.common.base.Preconditions;
import java.util.function.DoubleUnaryOperator;
import lombok.Builder;
import lombok.Getter;

/**
 * 点番号 i∈[0, N] から弧長 s(i)∈[0, L] への写像（再配置用の間隔関数）です。
 *
 * <p>
 * 端の間隔を指定しない場合は等間隔 {@code s = iL/N} です。 始点側の間隔 d_lower を指定すると、i≪1 で
 * {@code s ≈ 2 d_sqrt_lower sqrt(i/N_norm) + d_lower i/N_norm} となり、X 点近傍の点を密にできます。 終点側も同様です。
 * 端の値 s(0)=0、s(N)=L は多項式補正で満たし、両端を指定した場合は端の傾きも保ちます。
 * </p>
 *
 * <p>
 * {@link FluxContour#getRegridded(int, DoubleUnaryOperator, double, double, int, int)} の sfunc
 * として使えます。
 * </p>
 */
public final class PoloidalSpacing implements DoubleUnaryOperator {

    /**
     * 全長 L です。
     */
    @Getter
    private final double length;

    /**
     * 最後の点番号 N です。
     */
    @Getter
    private final double n;

    /**
     * 正規化用の点数 N_norm です。
     */
    @Getter
    private final double nNorm;

    private final Double dLower;

    private final Double dSqrtLower;

    private final Double dUpper;

    private final Double dSqrtUpper;

    private final double c0;

    private final double c1;

    private final double c2;

    private final double c3;

    /**
     * 間隔関数を生成します。
     *
     * @param length 全長 L（正）です
     * @param n 最後の点番号 N（正）です
     * @param nNorm 正規化用の点数 N_norm（正）です
     * @param dLower 始点側の線形間隔（null なら指定なし）です
     * @param dSqrtLower 始点側の平方根項の係数（null なら dLower と同じ）です
     * @param dUpper 終点側の線形間隔（null なら指定なし）です
     * @param dSqrtUpper 終点側の平方根項の係数（null なら dUpper と同じ）です
     */
    @Builder
    private PoloidalSpacing(double length, double n, double nNorm, Double dLower,
            Double dSqrtLower, Double dUpper, Double dSqrtUpper) {
        Preconditions.checkArgument(length > 0.0, "全長 L は正である必要があります。L=%s", length);
        Preconditions.checkArgument(n > 0.0, "点番号 N は正である必要があります。N=%s", n);
        Preconditions.checkArgument(nNorm > 0.0, "N_norm は正である必要があります。N_norm=%s", nNorm);
        Preconditions.checkArgument(dSqrtLower == null || dLower != null,
                "d_sqrt_lower を指定する場合は d_lower も指定してください。");
        Preconditions.checkArgument(dSqrtUpper == null || dUpper != null,
                "d_sqrt_upper を指定する場合は d_upper も指定してください。");
        this.length = length;
        this.n = n;
        this.nNorm = nNorm;
        this.dLower = dLower;
        this.dSqrtLower = (dLower != null && dSqrtLower == null) ? dLower : dSqrtLower;
        this.dUpper = dUpper;
        this.dSqrtUpper = (dUpper != null && dSqrtUpper == null) ? dUpper : dSqrtUpper;

        if (dLower != null && dUpper != null) {
            // s = gL + gU + c0 + c1 i + c2 i^2 + c3 i^3 で s(0)=0、s(N)=L と端の傾きを合わせます。
            double a0 = -upperTerm(0.0);
            double a1 = -upperSlopeAtStart();
            double rest = length - lowerTerm(n) - a0 - a1 * n;
            double slope = -lowerSlopeAtEnd() - a1;
            this.c0 = a0;
            this.c1 = a1;
            this.c3 = (slope * n - 2.0 * rest) / (n * n * n);
            this.c2 = (rest - c3 * n * n * n) / (n * n);
        } else if (dLower != null) {
            this.c0 = 0.0;
            this.c1 = 0.0;
            this.c2 = (length - lowerTerm(n)) / (n * n);
            this.c3 = 0.0;
        } else if (dUpper != null) {
            this.c0 = 0.0;
            this.c1 = 0.0;
            this.c2 = (length + upperTerm(0.0)) / (n * n);
            this.c3 = 0.0;
        } else {
            this.c0 = 0.0;
            this.c1 = 0.0;
            this.c2 = 0.0;
            this.c3 = 0.0;
        }
    }

    /**
     * 点番号 i の弧長を返します。
     *
     * @param i 点番号（0 ≤ i ≤ N）です
     * @return 弧長 s(i) です
     */
    @Override
    public double applyAsDouble(double i) {
        if (dLower == null && dUpper == null) {
            return i * length / n;
        }
        if (dUpper == null) {
            return lowerTerm(i) + c2 * i * i;
        }
        if (dLower == null) {
            double m = n - i;
            return length + upperTerm(i) - c2 * m * m;
        }
        return lowerTerm(i) + upperTerm(i) + c0 + c1 * i + c2 * i * i + c3 * i * i * i;
    }

    /**
     * 整数点と中間点を交互に並べた 1 次元格子を返します。
     *
     * <p>
     * 長さ 2n+1 の配列で、偶数番目 2i に f(i)、奇数番目 2i+1 に f(i) と f(i+1) の平均を入れます。
     * </p>
     *
     * @param n 整数点の最後の番号です
     * @param f 点番号から値への関数です
     * @return 長さ 2n+1 の格子です
     */
    public static double[] make1dGrid(int n, DoubleUnaryOperator f) {
        Preconditions.checkArgument(n >= 0, "n は非負である必要があります。n=%s", n);
        Preconditions.checkNotNull(f, "関数が null です。");
        double[] out = new double[2 * n + 1];
        for (int i = 0; i <= n; i++) {
            out[2 * i] = f.applyAsDouble(i);
        }
        for (int i = 0; i < n; i++) {
            out[2 * i + 1] = 0.5 * (out[2 * i] + out[2 * i + 2]);
        }
        return out;
    }

    private double lowerTerm(double i) {
        if (dLower == null) {
            return 0.0;
        }
        return 2.0 * dSqrtLower * Math.sqrt(i / nNorm) + dLower * i / nNorm;
    }

    private double lowerSlopeAtEnd() {
        return dSqrtLower / Math.sqrt(n * nNorm) + dLower / nNorm;
    }

    private double upperTerm(double i) {
        if (dUpper == null) {
            return 0.0;
        }
        double m = n - i;
        return -(2.0 * dSqrtUpper * Math.sqrt(m / nNorm) + dUpper * m / nNorm);
    }

    private double upperSlopeAtStart() {
        return dSqrtUpper / Math.sqrt(n * nNorm) + dUpper / nNorm;
    }
}

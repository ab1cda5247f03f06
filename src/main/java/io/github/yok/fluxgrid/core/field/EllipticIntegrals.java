package io.github.yok.fluxgrid.core.field;

import com.google.common.base.Preconditions;

/**
 * 第1種・第2種完全楕円積分 K(m), E(m) を算術幾何平均（AGM）で計算するユーティリティです。
 *
 * <p>
 * パラメータ m は母数 k の二乗（m = k^2）で、0 ≤ m < 1 を受け付けます。
 * </p>
 */
public final class EllipticIntegrals {

    private static final int MAX_ITERATIONS = 60;

    private EllipticIntegrals() {}

    /**
     * 第1種完全楕円積分 K(m) を返します。
     *
     * @param m パラメータ（0 ≤ m < 1）です
     * @return K(m) です
     */
    public static double completeK(double m) {
        return completeKE(m)[0];
    }

    /**
     * 第2種完全楕円積分 E(m) を返します。
     *
     * @param m パラメータ（0 ≤ m < 1）です
     * @return E(m) です
     */
    public static double completeE(double m) {
        return completeKE(m)[1];
    }

    /**
     * K(m) と E(m) をまとめて計算します。
     *
     * @param m パラメータ（0 ≤ m < 1）です
     * @return {K(m), E(m)} です
     * @throws IllegalArgumentException m が範囲外の場合に発生します
     */
    public static double[] completeKE(double m) {
        Preconditions.checkArgument(m >= 0.0 && m < 1.0, "楕円積分のパラメータ m は [0, 1) の範囲である必要があります。m=%s",
                m);
        double a = 1.0;
        double b = Math.sqrt(1.0 - m);
        // E = K (1 - Σ 2^(n-1) c_n^2)、c_0^2 = m
        double sum = 0.5 * m;
        double power = 1.0;
        for (int n = 0; n < MAX_ITERATIONS; n++) {
            double c = 0.5 * (a - b);
            double aNext = 0.5 * (a + b);
            b = Math.sqrt(a * b);
            a = aNext;
            power *= 2.0;
            sum += 0.5 * power * c * c;
            if (Math.abs(c) < 1e-16 * a) {
                break;
            }
        }
        double k = Math.PI / (2.0 * a);
        return new double[] {k, k * (1.0 - sum)};
    }
}

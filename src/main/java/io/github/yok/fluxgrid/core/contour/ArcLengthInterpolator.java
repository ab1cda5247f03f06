package io.github.yok.fluxgrid.core.contour;

import com.google.common.base.Preconditions;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleFunction;

/**
 * 累積弧長 s をパラメータとして点列を補間する関数です。
 *
 * <p>
 * 区間 [s_i, s_{i+1}] では、点 i-1..i+1 と点 i..i+2 を通る 2 つの 2 次補間を弧長について線形に混合します（弧長パラメータの
 * Catmull-Rom / Barry-Goldman 型）。 各追跡点は自身の弧長で厳密に再現されます。 端の区間では片側の 2 次補間だけを使い、
 * [0, 全長] の外側は端の 6 点を通る 5 次式で外挿します（点が 6 未満なら全点を使います）。
 * </p>
 */
public final class ArcLengthInterpolator implements DoubleFunction<Point2D> {

    /**
     * 外挿に使う端点の数です。
     */
    private static final int EXTRAPOLATION_POINTS = 6;

    private final double[] s;

    private final double[] r;

    private final double[] z;

    /**
     * 補間関数を生成します。
     *
     * @param points 点列（2点以上）です
     * @param distance 各点の累積弧長（狭義単調増加）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ArcLengthInterpolator(List<Point2D> points, double[] distance) {
        Preconditions.checkArgument(points != null && points.size() >= 2, "補間には 2 点以上が必要です。");
        Preconditions.checkArgument(distance != null && distance.length == points.size(),
                "弧長配列の長さが点数と一致しません。");
        int n = points.size();
        this.s = Arrays.copyOf(distance, n);
        this.r = new double[n];
        this.z = new double[n];
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                Preconditions.checkArgument(s[i] > s[i - 1], "弧長が狭義単調増加ではありません。index=%s", i);
            }
            r[i] = points.get(i).getR();
            z[i] = points.get(i).getZ();
        }
    }

    /**
     * 弧長 x の点を返します。
     *
     * @param x 弧長です
     * @return 補間（または外挿）した点です
     */
    @Override
    public Point2D apply(double x) {
        int n = s.length;
        if (x < s[0]) {
            return lagrange(0, Math.min(EXTRAPOLATION_POINTS, n), x);
        }
        if (x > s[n - 1]) {
            int count = Math.min(EXTRAPOLATION_POINTS, n);
            return lagrange(n - count, count, x);
        }
        if (n == 2) {
            return lagrange(0, 2, x);
        }

        int i = segmentIndex(x);
        boolean hasLeft = i > 0;
        boolean hasRight = i + 2 < n;
        if (!hasLeft) {
            return lagrange(i, 3, x);
        }
        if (!hasRight) {
            return lagrange(i - 1, 3, x);
        }
        Point2D left = lagrange(i - 1, 3, x);
        Point2D right = lagrange(i, 3, x);
        double w = (x - s[i]) / (s[i + 1] - s[i]);
        return left.multiply(1.0 - w).add(right.multiply(w));
    }

    /**
     * 全長（最後の点の弧長）を返します。
     *
     * @return 全長です
     */
    public double getTotalLength() {
        return s[s.length - 1];
    }

    /**
     * s[i] ≤ x < s[i+1] となる区間番号を返します（0..n-2 に丸めます）。
     *
     * @param x 弧長です
     * @return 区間番号です
     */
    private int segmentIndex(double x) {
        int idx = Arrays.binarySearch(s, x);
        int i = (idx >= 0) ? idx : (-idx - 2);
        return Math.max(0, Math.min(i, s.length - 2));
    }

    /**
     * 点 from..from+count-1 を通る Lagrange 補間多項式の値を返します。
     *
     * @param from 先頭の点番号です
     * @param count 点数です
     * @param x 弧長です
     * @return 補間値です
     */
    private Point2D lagrange(int from, int count, double x) {
        double outR = 0.0;
        double outZ = 0.0;
        for (int j = from; j < from + count; j++) {
            double basis = 1.0;
            for (int m = from; m < from + count; m++) {
                if (m != j) {
                    basis *= (x - s[m]) / (s[j] - s[m]);
                }
            }
            outR += basis * r[j];
            outZ += basis * z[j];
        }
        return new Point2D(outR, outZ);
    }
}

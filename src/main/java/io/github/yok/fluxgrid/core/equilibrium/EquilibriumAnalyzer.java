package io.github.yok.fluxgrid.core.equilibrium;

import com.google.common.base.Preconditions;
import io.github.yok.fluxgrid.core.field.ScalarField2D;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.solver.BrentBoundedMinimizer;
import io.github.yok.fluxgrid.core.solver.BrentRootFinder;
import io.github.yok.fluxgrid.core.solver.RootFinder;
import io.github.yok.fluxgrid.core.solver.RootSearchException;
import io.github.yok.fluxgrid.core.solver.ScalarMinimizer;
import java.util.Locale;
import java.util.function.DoubleUnaryOperator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 磁束場 psi の極値・鞍点（X 点）と、1 変数関数の根を探索するクラスです。
 *
 * <p>
 * 磁束場は {@link ScalarField2D} として受け取り、具体的な実装（スペクトル補間・解析式・コイル）には依存しません。 1
 * 次元の最小化と根探索はそれぞれ {@link ScalarMinimizer}、{@link RootFinder} に委譲します。
 * </p>
 */
@Slf4j
public final class EquilibriumAnalyzer {

    /**
     * 極値判定の相対許容誤差（端点からの距離 / 線分長）の既定値です。
     */
    public static final double DEFAULT_EXTREMUM_RTOL = 1e-5;

    /**
     * 極値探索の位置許容誤差の既定値です。
     */
    public static final double DEFAULT_EXTREMUM_ATOL = 1e-14;

    /**
     * 鞍点探索の位置許容誤差の既定値です。
     */
    public static final double DEFAULT_SADDLE_ATOL = 2e-8;

    /**
     * 鞍点探索の最大反復回数の既定値です。
     */
    public static final int DEFAULT_MAX_SADDLE_ITERATIONS = 100;

    /**
     * 根探索の位置許容誤差の既定値です。
     */
    public static final double DEFAULT_ROOT_ATOL = 2e-8;

    /**
     * 近接した根を同一とみなす相対許容誤差の既定値です。
     */
    public static final double DEFAULT_ROOT_RTOL = 1e-5;

    /**
     * 根探索で許す区間分割数の上限の既定値です。
     */
    public static final int DEFAULT_MAX_INTERVALS = 1024;

    /**
     * 解析対象の磁束場です。
     */
    @Getter
    private final ScalarField2D field;

    /**
     * 有界 1 次元最小化です。
     */
    private final ScalarMinimizer minimizer;

    /**
     * 挟み込み区間での根探索です。
     */
    private final RootFinder rootFinder;

    /**
     * 鞍点探索の最大反復回数です。
     */
    @Getter
    private final int maxSaddleIterations;

    /**
     * Brent 法の既定実装で解析器を生成します。
     *
     * @param field 解析対象の磁束場です
     */
    public EquilibriumAnalyzer(ScalarField2D field) {
        this(field, new BrentBoundedMinimizer(), new BrentRootFinder(),
                DEFAULT_MAX_SADDLE_ITERATIONS);
    }

    /**
     * 解析器を生成します。
     *
     * @param field 解析対象の磁束場です
     * @param minimizer 有界 1 次元最小化です
     * @param rootFinder 根探索です
     * @param maxSaddleIterations 鞍点探索の最大反復回数（1以上）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public EquilibriumAnalyzer(ScalarField2D field, ScalarMinimizer minimizer,
            RootFinder rootFinder, int maxSaddleIterations) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        if (minimizer == null) {
            throw new IllegalArgumentException("minimizer は null 不可です");
        }
        if (rootFinder == null) {
            throw new IllegalArgumentException("rootFinder は null 不可です");
        }
        if (maxSaddleIterations <= 0) {
            throw new IllegalArgumentException(
                    "maxSaddleIterations は 1 以上を指定してください: " + maxSaddleIterations);
        }
        this.field = field;
        this.minimizer = minimizer;
        this.rootFinder = rootFinder;
        this.maxSaddleIterations = maxSaddleIterations;
    }

    /**
     * 線分 pos1→pos2 上で psi が最小となる点を返します（端点でもかまいません）。
     *
     * @param pos1 線分の始点です
     * @param pos2 線分の終点です
     * @param atol 位置の絶対許容誤差です
     * @return 最小点です
     * @throws ExtremumNotFoundException 最小化が収束しない場合に発生します
     */
    public Point2D findMinimum1D(Point2D pos1, Point2D pos2, double atol) {
        return searchAlongSegment(pos1, pos2, atol, 1.0);
    }

    /**
     * 線分 pos1→pos2 上で psi が最大となる点を返します（端点でもかまいません）。
     *
     * @param pos1 線分の始点です
     * @param pos2 線分の終点です
     * @param atol 位置の絶対許容誤差です
     * @return 最大点です
     * @throws ExtremumNotFoundException 最大化が収束しない場合に発生します
     */
    public Point2D findMaximum1D(Point2D pos1, Point2D pos2, double atol) {
        return searchAlongSegment(pos1, pos2, atol, -1.0);
    }

    /**
     * 既定の許容誤差で {@link #findExtremum1D(Point2D, Point2D, double, double)} を実行します。
     *
     * @param pos1 線分の始点です
     * @param pos2 線分の終点です
     * @return 内部の極値です
     */
    public Extremum findExtremum1D(Point2D pos1, Point2D pos2) {
        return findExtremum1D(pos1, pos2, DEFAULT_EXTREMUM_RTOL, DEFAULT_EXTREMUM_ATOL);
    }

    /**
     * 線分 pos1→pos2 の内部にある psi の極値を探索します。
     *
     * <p>
     * まず最小化し、最小点が両端から {@code rtol·|pos2-pos1|} より離れていれば極小として返します。 そうでなければ最大化を行い、
     * 同じ条件で極大として返します。
     * </p>
     *
     * @param pos1 線分の始点です
     * @param pos2 線分の終点です
     * @param rtol 端点判定の相対許容誤差です
     * @param atol 位置の絶対許容誤差です
     * @return 内部の極値です
     * @throws ExtremumNotFoundException 内部に極値がない、または最適化が収束しない場合に発生します
     */
    public Extremum findExtremum1D(Point2D pos1, Point2D pos2, double rtol, double atol) {
        double smallDistance = rtol * pos1.distanceTo(pos2);

        Point2D minimum = findMinimum1D(pos1, pos2, atol);
        if (isInterior(minimum, pos1, pos2, smallDistance)) {
            return new Extremum(minimum, true);
        }

        Point2D maximum = findMaximum1D(pos1, pos2, atol);
        if (isInterior(maximum, pos1, pos2, smallDistance)) {
            return new Extremum(maximum, false);
        }

        throw new ExtremumNotFoundException(
                "区間内に極小・極大のいずれも見つかりません: " + pos1 + " -> " + pos2);
    }

    /**
     * 既定の許容誤差で {@link #findSaddlePoint(double, double, double, double, double)} を実行します。
     *
     * @param rMin 探索ボックスの R 下端です
     * @param rMax 探索ボックスの R 上端です
     * @param zMin 探索ボックスの Z 下端です
     * @param zMax 探索ボックスの Z 上端です
     * @return 鞍点です
     */
    public Point2D findSaddlePoint(double rMin, double rMax, double zMin, double zMax) {
        return findSaddlePoint(rMin, rMax, zMin, zMax, DEFAULT_SADDLE_ATOL);
    }

    /**
     * 探索ボックス内の psi の鞍点（X 点）を探索します。
     *
     * <p>
     * ボックスの 4 辺で極値を求め、上下の辺と左右の辺で極値の種類が逆になっていることを確認します。 その後、縦方向の直線探索と横方向の直線探索を交互に行い、
     * 両者の推定点の距離が atol 未満になったら中点を返します。 直線探索の許容誤差は反復ごとに半分にします。
     * </p>
     *
     * @param rMin 探索ボックスの R 下端です
     * @param rMax 探索ボックスの R 上端です
     * @param zMin 探索ボックスの Z 下端です
     * @param zMax 探索ボックスの Z 上端です
     * @param atol 位置の絶対許容誤差です
     * @return 鞍点です
     * @throws SaddlePointConvergenceException 辺の極値が鞍点の特徴と一致しない、または反復上限に達した場合に発生します
     * @throws ExtremumNotFoundException 辺上に極値が見つからない場合に発生します
     */
    public Point2D findSaddlePoint(double rMin, double rMax, double zMin, double zMax,
            double atol) {
        Preconditions.checkArgument(rMin < rMax && zMin < zMax,
                "探索ボックスが不正です。R=[%s, %s]、Z=[%s, %s]", rMin, rMax, zMin, zMax);
        Preconditions.checkArgument(atol > 0.0, "許容誤差は正である必要があります。atol=%s", atol);

        log.info("鞍点探索を開始します。R=[{}, {}]、Z=[{}, {}]、許容誤差={}、最大反復回数={}", fmt5(rMin), fmt5(rMax),
                fmt5(zMin), fmt5(zMax), atol, maxSaddleIterations);

        Extremum top = findExtremum1D(new Point2D(rMin, zMax), new Point2D(rMax, zMax));
        Extremum bottom = findExtremum1D(new Point2D(rMin, zMin), new Point2D(rMax, zMin));
        Extremum left = findExtremum1D(new Point2D(rMin, zMin), new Point2D(rMin, zMax));
        Extremum right = findExtremum1D(new Point2D(rMax, zMin), new Point2D(rMax, zMax));

        if (top.isMinimum() != bottom.isMinimum() || left.isMinimum() != right.isMinimum()
                || top.isMinimum() == left.isMinimum()) {
            throw new SaddlePointConvergenceException("探索ボックスの辺の極値が鞍点の特徴と一致しません: top="
                    + label(top) + ", bottom=" + label(bottom) + ", left=" + label(left)
                    + ", right=" + label(right));
        }

        // 上下の辺で極小なら縦方向は極大を、左右の辺で極小なら横方向は極大を探します。
        double verticalSign = top.isMinimum() ? -1.0 : 1.0;
        double horizontalSign = left.isMinimum() ? -1.0 : 1.0;

        Point2D topPos = top.getPosition();
        Point2D bottomPos = bottom.getPosition();
        Point2D leftPos = left.getPosition();
        Point2D rightPos = right.getPosition();

        Point2D extremumVertical = new Point2D(rMin, zMin);
        Point2D extremumHorizontal = new Point2D(rMax, zMax);
        double tolerance = 0.5 * atol;
        int iterations = 0;

        while (extremumVertical.distanceTo(extremumHorizontal) > atol) {
            iterations++;
            if (iterations > maxSaddleIterations) {
                throw new SaddlePointConvergenceException("鞍点探索が反復上限内に収束しませんでした: 上限="
                        + maxSaddleIterations + ", 距離="
                        + extremumVertical.distanceTo(extremumHorizontal));
            }

            extremumVertical = lineSearch(bottomPos, topPos, tolerance, verticalSign);
            leftPos = new Point2D(leftPos.getR(), extremumVertical.getZ());
            rightPos = new Point2D(rightPos.getR(), extremumVertical.getZ());

            extremumHorizontal = lineSearch(leftPos, rightPos, tolerance, horizontalSign);
            bottomPos = new Point2D(extremumHorizontal.getR(), bottomPos.getZ());
            topPos = new Point2D(extremumHorizontal.getR(), topPos.getZ());

            log.debug("鞍点探索の反復 {}: 縦方向={}、横方向={}、距離={}", iterations, extremumVertical,
                    extremumHorizontal, extremumVertical.distanceTo(extremumHorizontal));

            tolerance *= 0.5;
        }

        Point2D saddle = extremumVertical.add(extremumHorizontal).multiply(0.5);
        log.info("鞍点探索を終了します。X点=({}, {})、反復回数={}", fmt5(saddle.getR()), fmt5(saddle.getZ()),
                iterations);
        return saddle;
    }

    /**
     * 既定の許容誤差で {@link #findRoots1D(DoubleUnaryOperator, int, double, double, double, double, int)}
     * を実行します。
     *
     * @param f 対象関数です
     * @param expectedRoots 期待する根の数です
     * @param xMin 探索区間の下端です
     * @param xMax 探索区間の上端です
     * @return 昇順の根です
     */
    public double[] findRoots1D(DoubleUnaryOperator f, int expectedRoots, double xMin,
            double xMax) {
        return findRoots1D(f, expectedRoots, xMin, xMax, DEFAULT_ROOT_ATOL, DEFAULT_ROOT_RTOL,
                DEFAULT_MAX_INTERVALS);
    }

    /**
     * 区間 [xMin, xMax] 内の f の根を、期待する個数以上見つかるまで等間隔サンプリングを細かくして探索します。
     *
     * <p>
     * サンプル値がちょうど 0 になった場合は、区間端が根に一致する退化ケースとして失敗させます。 期待より多くの根が見つかった場合は警告を出力し、
     * すべて返します。 隣り合う符号反転区間の根はそれぞれ別の根として扱い、{@code rtol·(xMax-xMin)} より近い根の組は
     * 警告を出力するだけで取り除きません。
     * </p>
     *
     * @param f 対象関数です
     * @param expectedRoots 期待する根の数（1以上）です
     * @param xMin 探索区間の下端です
     * @param xMax 探索区間の上端です
     * @param atol 根の位置の絶対許容誤差です
     * @param rtol 近接した根として警告する距離の相対値（区間長に対する比）です
     * @param maxIntervals 区間分割数の上限です
     * @return 昇順の根です
     * @throws RootSearchException 符号反転が足りない、サンプルが 0 に一致した、または根探索が収束しない場合に発生します
     */
    public double[] findRoots1D(DoubleUnaryOperator f, int expectedRoots, double xMin,
            double xMax, double atol, double rtol, int maxIntervals) {
        Preconditions.checkNotNull(f, "対象関数が null です。");
        Preconditions.checkArgument(expectedRoots >= 1, "期待する根の数は 1 以上である必要があります。n=%s",
                expectedRoots);
        Preconditions.checkArgument(xMin < xMax, "探索区間が不正です。[%s, %s]", xMin, xMax);
        Preconditions.checkArgument(rtol >= 0.0, "相対許容誤差は非負である必要があります。rtol=%s", rtol);

        int intervals = expectedRoots;
        double[] xs;
        int[] brackets;
        int bracketCount;

        while (true) {
            xs = new double[intervals + 1];
            double[] fs = new double[intervals + 1];
            for (int i = 0; i <= intervals; i++) {
                xs[i] = xMin + (xMax - xMin) * i / intervals;
                fs[i] = f.applyAsDouble(xs[i]);
                if (fs[i] == 0.0) {
                    throw new RootSearchException("サンプル点がちょうど根に一致しました（未対応の退化ケース）: x=" + xs[i]);
                }
            }

            brackets = new int[intervals];
            bracketCount = 0;
            for (int i = 0; i < intervals; i++) {
                if ((fs[i] < 0.0) != (fs[i + 1] < 0.0)) {
                    brackets[bracketCount++] = i;
                }
            }
            log.debug("根探索: 区間数={}、符号反転数={}", intervals, bracketCount);

            if (bracketCount >= expectedRoots) {
                break;
            }
            intervals *= 2;
            if (intervals > maxIntervals) {
                throw new RootSearchException("符号反転が " + expectedRoots + " 個見つかりません: 区間数上限="
                        + maxIntervals + ", 見つかった数=" + bracketCount);
            }
        }

        double minSeparation = rtol * (xMax - xMin);
        double[] roots = new double[bracketCount];
        for (int b = 0; b < bracketCount; b++) {
            double lower = xs[brackets[b]];
            double upper = xs[brackets[b] + 1];
            RootFinder.RootResult result = rootFinder.findRoot(f, lower, upper, atol, 0.0);
            if (!result.isConverged()) {
                throw new RootSearchException(
                        "根探索が収束しませんでした: 区間=[" + lower + ", " + upper + "]");
            }
            roots[b] = result.getRoot();
            if (b > 0 && roots[b] - roots[b - 1] < minSeparation) {
                log.warn("近接した根が見つかりました。x1={}、x2={}", roots[b - 1], roots[b]);
            }
        }

        if (bracketCount > expectedRoots) {
            log.warn("期待より多くの根が見つかりました。期待数={}、見つかった数={}、区間=[{}, {}]", expectedRoots,
                    bracketCount, fmt5(xMin), fmt5(xMax));
        }
        return roots;
    }

    /**
     * 線分上で sign·psi を最小化した点を返します（鞍点探索の直線探索用）。
     *
     * @param pos1 線分の始点です
     * @param pos2 線分の終点です
     * @param tolerance 位置の絶対許容誤差です
     * @param sign 1.0 なら最小化、-1.0 なら最大化です
     * @return 極値点です
     * @throws SaddlePointConvergenceException 直線探索が収束しない場合に発生します
     */
    private Point2D lineSearch(Point2D pos1, Point2D pos2, double tolerance, double sign) {
        try {
            return searchAlongSegment(pos1, pos2, tolerance, sign);
        } catch (ExtremumNotFoundException e) {
            throw new SaddlePointConvergenceException("鞍点探索の直線探索が収束しませんでした", e);
        }
    }

    /**
     * 線分 pos1 + s(pos2-pos1)、s∈[0,1] 上で sign·psi を最小化します。
     *
     * @param pos1 線分の始点です
     * @param pos2 線分の終点です
     * @param atol 位置の絶対許容誤差（物理長）です
     * @param sign 1.0 なら最小化、-1.0 なら最大化です
     * @return 最適点です
     * @throws ExtremumNotFoundException 最適化が収束しない場合に発生します
     */
    private Point2D searchAlongSegment(Point2D pos1, Point2D pos2, double atol, double sign) {
        Preconditions.checkNotNull(pos1, "始点が null です。");
        Preconditions.checkNotNull(pos2, "終点が null です。");
        Point2D delta = pos2.subtract(pos1);
        double length = delta.norm();
        Preconditions.checkArgument(length > 0.0, "線分の長さが 0 です。pos=%s", pos1);

        // 許容誤差は線分パラメータ s の単位に換算します。
        ScalarMinimizer.MinimizationResult result = minimizer.minimize(
                s -> sign * field.psi(pos1.add(delta.multiply(s))), 0.0, 1.0, atol / length);
        if (!result.isConverged()) {
            throw new ExtremumNotFoundException((sign > 0 ? "最小化" : "最大化") + "が収束しませんでした: "
                    + pos1 + " -> " + pos2 + ", 評価回数=" + result.getEvaluations());
        }
        return pos1.add(delta.multiply(result.getPosition()));
    }

    private static boolean isInterior(Point2D p, Point2D pos1, Point2D pos2,
            double smallDistance) {
        return p.distanceTo(pos1) > smallDistance && p.distanceTo(pos2) > smallDistance;
    }

    private static String label(Extremum e) {
        return e.isMinimum() ? "min" : "max";
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}

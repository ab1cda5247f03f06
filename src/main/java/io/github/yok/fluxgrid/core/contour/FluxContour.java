package io.github.yok.fluxgrid.core.contour;

import com.google.common.base.Preconditions;
import io.github.yok.fluxgrid.core.field.ScalarField2D;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import io.github.yok.fluxgrid.core.solver.BrentRootFinder;
import io.github.yok.fluxgrid.core.solver.RootFinder;
import io.github.yok.fluxgrid.core.solver.RootSearchException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.DoubleFunction;
import java.util.function.DoubleUnaryOperator;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * psi の等値線（磁気面）上にある順序付き点列です。
 *
 * <p>
 * 点の順序は経路に沿った幾何学的順序で、各点の累積弧長 {@code distance[i]} を保持します（{@code distance[0] = 0}）。
 * {@link #append(Point2D)}、{@link #reverse()}、{@link #refine(double, double)} はこの点列自体を変更し、
 * {@link #getRefined(double, double)} と {@code getRegridded} は新しい点列を返します。
 * </p>
 *
 * <p>
 * 等値線への射影（精密化）は、点列の接線に垂直な直線上で、点から外側へ順に走査して最も近い符号反転区間を見つけ、 その区間で
 * Brent 法を用いて psi = psival を解きます。
 * </p>
 */
@Slf4j
public final class FluxContour implements Iterable<Point2D> {

    /**
     * 精密化のための射影幅の既定値です。
     */
    public static final double DEFAULT_WIDTH = 1e-2;

    /**
     * 精密化の psi 許容誤差の既定値です。
     */
    public static final double DEFAULT_ATOL = 2e-8;

    /**
     * 射影窓の片側あたりの走査分割数です。
     */
    private static final int SCAN_STEPS = 16;

    private final List<Point2D> points;

    private final List<Double> distance;

    /**
     * この等値線が乗る磁束場です。
     */
    @Getter
    private final ScalarField2D field;

    /**
     * 射影に使う根探索です。
     */
    private final RootFinder rootFinder;

    /**
     * 各点が満たすべき psi の値です。
     */
    @Getter
    @Setter
    private double psival;

    /**
     * 始点の目印（なければ null）です。
     */
    @Getter
    @Setter
    private EndpointTag startTag;

    /**
     * 終点の目印（なければ null）です。
     */
    @Getter
    @Setter
    private EndpointTag endTag;

    /**
     * Brent 法の既定実装で等値線を生成します。
     *
     * @param points 点列です
     * @param field 磁束場です
     * @param psival 等値線の psi の値です
     */
    public FluxContour(List<Point2D> points, ScalarField2D field, double psival) {
        this(points, field, psival, new BrentRootFinder());
    }

    /**
     * 等値線を生成します。
     *
     * @param points 点列です
     * @param field 磁束場です
     * @param psival 等値線の psi の値です
     * @param rootFinder 射影に使う根探索です
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public FluxContour(List<Point2D> points, ScalarField2D field, double psival,
            RootFinder rootFinder) {
        Preconditions.checkNotNull(points, "点列が null です。");
        this.field = Preconditions.checkNotNull(field, "磁束場が null です。");
        this.rootFinder = Preconditions.checkNotNull(rootFinder, "根探索が null です。");
        this.psival = psival;
        this.points = new ArrayList<>(points.size());
        this.distance = new ArrayList<>(points.size());
        for (Point2D p : points) {
            append(p);
        }
    }

    /**
     * 点数を返します。
     *
     * @return 点数です
     */
    public int size() {
        return points.size();
    }

    /**
     * i 番目の点を返します。
     *
     * @param i 点番号です
     * @return 点です
     */
    public Point2D get(int i) {
        return points.get(i);
    }

    /**
     * 点列（変更不可のビュー）を返します。
     *
     * @return 点列です
     */
    public List<Point2D> getPoints() {
        return Collections.unmodifiableList(points);
    }

    /**
     * 各点の累積弧長の配列（コピー）を返します。
     *
     * @return 累積弧長です
     */
    public double[] getDistance() {
        double[] out = new double[distance.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = distance.get(i);
        }
        return out;
    }

    /**
     * 全長（最後の点の累積弧長）を返します。
     *
     * @return 全長（点がなければ 0）です
     */
    public double getTotalLength() {
        return distance.isEmpty() ? 0.0 : distance.get(distance.size() - 1);
    }

    @Override
    public Iterator<Point2D> iterator() {
        return getPoints().iterator();
    }

    /**
     * 末尾に点を追加し、累積弧長を延長します。
     *
     * @param point 追加する点です
     */
    public void append(Point2D point) {
        Preconditions.checkNotNull(point, "点が null です。");
        if (points.isEmpty()) {
            distance.add(0.0);
        } else {
            Point2D last = points.get(points.size() - 1);
            distance.add(distance.get(distance.size() - 1) + last.distanceTo(point));
        }
        points.add(point);
    }

    /**
     * 点の順序をその場で反転します。
     *
     * <p>
     * 累積弧長は {@code distance_new[i] = total - distance_old[n-1-i]} として付け直し、始点と終点の目印も入れ替えます。
     * </p>
     */
    public void reverse() {
        int n = points.size();
        double total = getTotalLength();
        List<Double> reversedDistance = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            reversedDistance.add(total - distance.get(n - 1 - i));
        }
        Collections.reverse(points);
        distance.clear();
        distance.addAll(reversedDistance);

        EndpointTag tmp = startTag;
        startTag = endTag;
        endTag = tmp;
    }

    /**
     * 各点をその場で等値線 psi = psival 上へ射影します。
     *
     * @param width 射影窓の片側の幅（点から法線方向に ±width を探索）です
     * @param atol psi の許容誤差です
     * @throws RootSearchException 窓内で等値線が見つからない場合に発生します
     */
    public void refine(double width, double atol) {
        List<Point2D> refined = refinedPoints(points, width, atol);
        points.clear();
        distance.clear();
        for (Point2D p : refined) {
            append(p);
        }
    }

    /**
     * 各点を等値線 psi = psival 上へ射影した新しい等値線を返します（この点列は変更しません）。
     *
     * @param width 射影窓の片側の幅です
     * @param atol psi の許容誤差です
     * @return 射影後の等値線です
     * @throws RootSearchException 窓内で等値線が見つからない場合に発生します
     */
    public FluxContour getRefined(double width, double atol) {
        return derive(refinedPoints(points, width, atol));
    }

    /**
     * 累積弧長から点への補間関数を返します。
     *
     * <p>
     * 返される関数は現時点の点列のコピーを保持するため、その後この等値線を変更しても影響を受けません。
     * </p>
     *
     * @return 補間関数です
     * @throws IllegalArgumentException 点数が 2 未満、または重複点がある場合に発生します
     */
    public DoubleFunction<Point2D> interpFunction() {
        return new ArcLengthInterpolator(points, getDistance());
    }

    /**
     * 弧長について等間隔に再配置した等値線を返します。
     *
     * @param newNpoints 新しい点数（2以上）です
     * @param width 射影窓の片側の幅です
     * @param atol psi の許容誤差です
     * @return 再配置した等値線です
     */
    public FluxContour getRegridded(int newNpoints, double width, double atol) {
        return getRegridded(newNpoints, null, width, atol, 0, 0);
    }

    /**
     * 弧長関数 sfunc で再配置した等値線を返します（psi 許容誤差は既定値）。
     *
     * @param newNpoints 新しい点数（2以上）です
     * @param sfunc 点番号 i から弧長を返す関数です
     * @param width 射影窓の片側の幅です
     * @return 再配置した等値線です
     */
    public FluxContour getRegridded(int newNpoints, DoubleUnaryOperator sfunc, double width) {
        return getRegridded(newNpoints, sfunc, width, DEFAULT_ATOL, 0, 0);
    }

    /**
     * 弧長関数 sfunc で点を再配置し、等値線上へ射影し直した新しい等値線を返します。
     *
     * <p>
     * 点番号 i = 0 .. newNpoints-1 について {@code s_i = sfunc(i)} を評価します。 sfunc が null の場合は
     * {@code s_i = total·i/(newNpoints-1)} です。 延長点の弧長は sfunc を範囲外で評価せず、端の間隔を延ばして
     * {@code s_{-k} = s_0 - k(s_1 - s_0)}、{@code s_{N-1+k} = s_{N-1} + k(s_{N-1} - s_{N-2})} とします。
     * [0, total] の外側の点は端の点列から外挿し、同様に射影します。
     * </p>
     *
     * @param newNpoints 新しい点数（延長分を除き 2 以上）です
     * @param sfunc 点番号 i から弧長を返す関数（null なら等間隔）です
     * @param width 射影窓の片側の幅です
     * @param atol psi の許容誤差です
     * @param extendLower 始点側に延長する点数です
     * @param extendUpper 終点側に延長する点数です
     * @return 再配置した等値線です
     * @throws RootSearchException 窓内で等値線が見つからない場合に発生します
     */
    public FluxContour getRegridded(int newNpoints, DoubleUnaryOperator sfunc, double width,
            double atol, int extendLower, int extendUpper) {
        Preconditions.checkArgument(newNpoints >= 2, "再配置後の点数は 2 以上である必要があります。n=%s", newNpoints);
        Preconditions.checkArgument(extendLower >= 0 && extendUpper >= 0,
                "延長点数は非負である必要があります。lower=%s, upper=%s", extendLower, extendUpper);

        DoubleFunction<Point2D> interp = interpFunction();
        double total = getTotalLength();
        DoubleUnaryOperator positions =
                (sfunc != null) ? sfunc : i -> total * i / (newNpoints - 1);

        double[] s = new double[newNpoints];
        for (int i = 0; i < newNpoints; i++) {
            s[i] = positions.applyAsDouble(i);
        }
        double lowerStep = s[1] - s[0];
        double upperStep = s[newNpoints - 1] - s[newNpoints - 2];

        List<Point2D> raw = new ArrayList<>(newNpoints + extendLower + extendUpper);
        for (int k = extendLower; k >= 1; k--) {
            raw.add(interp.apply(s[0] - k * lowerStep));
        }
        for (double position : s) {
            raw.add(interp.apply(position));
        }
        for (int k = 1; k <= extendUpper; k++) {
            raw.add(interp.apply(s[newNpoints - 1] + k * upperStep));
        }

        log.debug("等値線を再配置します。元の点数={}、新しい点数={}、延長=({}, {})", points.size(), newNpoints,
                extendLower, extendUpper);
        return derive(refinedPoints(raw, width, atol));
    }

    @Override
    public String toString() {
        return "FluxContour(size=" + points.size() + ", psival=" + psival + ", length="
                + getTotalLength() + ")";
    }

    /**
     * 同じ磁束場・psival・目印を持つ新しい等値線を生成します。
     *
     * @param newPoints 点列です
     * @return 新しい等値線です
     */
    private FluxContour derive(List<Point2D> newPoints) {
        FluxContour out = new FluxContour(newPoints, field, psival, rootFinder);
        out.setStartTag(startTag);
        out.setEndTag(endTag);
        return out;
    }

    /**
     * 点列の各点を、隣接点から求めた接線に垂直な方向へ射影します。
     *
     * @param chain 点列です
     * @param width 射影窓の片側の幅です
     * @param atol psi の許容誤差です
     * @return 射影後の点列です
     */
    private List<Point2D> refinedPoints(List<Point2D> chain, double width, double atol) {
        Preconditions.checkArgument(width > 0.0, "射影幅は正である必要があります。width=%s", width);
        Preconditions.checkArgument(atol > 0.0, "許容誤差は正である必要があります。atol=%s", atol);
        int n = chain.size();
        List<Point2D> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Point2D p = chain.get(i);
            Point2D tangent = (n < 2) ? null
                    : chain.get(Math.min(i + 1, n - 1)).subtract(chain.get(Math.max(i - 1, 0)));
            out.add(refinePoint(p, tangent, width, atol));
        }
        return out;
    }

    /**
     * 1 点を等値線上へ射影します。
     *
     * @param p 射影する点です
     * @param tangent 点列の接線（null または長さ 0 なら grad psi 方向に探索）です
     * @param width 射影窓の片側の幅です
     * @param atol psi の許容誤差です
     * @return 射影後の点です
     * @throws RootSearchException 窓内で等値線が見つからない、または根探索が収束しない場合に発生します
     */
    private Point2D refinePoint(Point2D p, Point2D tangent, double width, double atol) {
        double f0 = field.psi(p) - psival;
        if (Math.abs(f0) <= atol) {
            return p;
        }

        Point2D direction = searchDirection(p, tangent);
        DoubleUnaryOperator g = x -> field.psi(p.add(direction.multiply(x))) - psival;

        // 点から両側へ交互に走査し、最も近い符号反転区間を探します。
        double h = width / SCAN_STEPS;
        double previousPlus = f0;
        double previousMinus = f0;
        for (int k = 1; k <= SCAN_STEPS; k++) {
            double fPlus = g.applyAsDouble(k * h);
            if (fPlus == 0.0 || (fPlus < 0.0) != (previousPlus < 0.0)) {
                return solveOnNormal(p, direction, g, (k - 1) * h, k * h, atol);
            }
            previousPlus = fPlus;

            double fMinus = g.applyAsDouble(-k * h);
            if (fMinus == 0.0 || (fMinus < 0.0) != (previousMinus < 0.0)) {
                return solveOnNormal(p, direction, g, -k * h, -(k - 1) * h, atol);
            }
            previousMinus = fMinus;
        }
        throw new RootSearchException("射影窓内に等値線が見つかりません: point=" + p + ", psi-psival=" + f0
                + ", width=" + width);
    }

    private Point2D solveOnNormal(Point2D p, Point2D direction, DoubleUnaryOperator g,
            double lower, double upper, double atol) {
        RootFinder.RootResult result = rootFinder.findRoot(g, lower, upper, 0.0, atol);
        if (!result.isConverged()) {
            throw new RootSearchException(
                    "等値線への射影が収束しませんでした: point=" + p + ", 区間=[" + lower + ", " + upper + "]");
        }
        return p.add(direction.multiply(result.getRoot()));
    }

    /**
     * 射影方向（単位ベクトル）を返します。
     *
     * @param p 射影する点です
     * @param tangent 点列の接線です
     * @return 接線に垂直な単位ベクトル（接線がなければ grad psi の向き）です
     */
    private Point2D searchDirection(Point2D p, Point2D tangent) {
        if (tangent != null && tangent.norm() > 0.0) {
            return new Point2D(-tangent.getZ(), tangent.getR()).divide(tangent.norm());
        }
        Point2D gradient = new Point2D(field.ddR(p.getR(), p.getZ()), field.ddZ(p.getR(), p.getZ()));
        if (!(gradient.norm() > 0.0)) {
            throw new RootSearchException("射影方向を決められません（接線も勾配も 0 です）: point=" + p);
        }
        return gradient.divide(gradient.norm());
    }
}

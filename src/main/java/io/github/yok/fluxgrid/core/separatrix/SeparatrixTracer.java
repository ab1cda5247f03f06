package io.github.yok.fluxgrid.core.separatrix;

import com.google.common.base.Preconditions;
import io.github.yok.fluxgrid.core.contour.EndpointTag;
import io.github.yok.fluxgrid.core.contour.FluxContour;
import io.github.yok.fluxgrid.core.equilibrium.EquilibriumAnalyzer;
import io.github.yok.fluxgrid.core.field.ScalarField2D;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * X 点から壁までのセパラトリクスの 4 本の脚を追跡するクラスです。
 *
 * <p>
 * 壁に沿った psi(wall(s)) - psi_sep の根から 4 つの交点を求め、X 点と各交点を結ぶ直線上に点を並べてから、 等値線 psi =
 * psi_sep 上へ射影します。 脚は X 点に対する交点の象限で分類します。
 * </p>
 */
@Slf4j
@Getter
public final class SeparatrixTracer {

    /**
     * X 点から出る脚の本数です。
     */
    public static final int LEG_COUNT = 4;

    /**
     * X 点の目印の名前です。
     */
    public static final String XPOINT_TAG = "xpoint";

    /**
     * 壁の目印の名前です。
     */
    public static final String WALL_TAG = "wall";

    /**
     * 根探索に使う解析器です。
     */
    private final EquilibriumAnalyzer analyzer;

    /**
     * 壁です。
     */
    private final Wall wall;

    /**
     * 1 本の脚あたりの点数です。
     */
    private final int legPoints;

    /**
     * 射影窓の片側の幅です。
     */
    private final double refineWidth;

    /**
     * 根探索・射影の許容誤差です。
     */
    private final double atol;

    /**
     * 追跡器を生成します。
     *
     * @param analyzer 解析器です
     * @param wall 壁です
     * @param legPoints 1 本の脚あたりの点数（2以上）です
     * @param refineWidth 射影窓の片側の幅（正）です
     * @param atol 許容誤差（正）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SeparatrixTracer(EquilibriumAnalyzer analyzer, Wall wall, int legPoints,
            double refineWidth, double atol) {
        this.analyzer = Preconditions.checkNotNull(analyzer, "解析器が null です。");
        this.wall = Preconditions.checkNotNull(wall, "壁が null です。");
        Preconditions.checkArgument(legPoints >= 2, "脚の点数は 2 以上である必要があります。n=%s", legPoints);
        Preconditions.checkArgument(refineWidth > 0.0, "射影幅は正である必要があります。width=%s", refineWidth);
        Preconditions.checkArgument(atol > 0.0, "許容誤差は正である必要があります。atol=%s", atol);
        this.legPoints = legPoints;
        this.refineWidth = refineWidth;
        this.atol = atol;
    }

    /**
     * X 点の psi をセパラトリクスの値として脚を追跡します。
     *
     * @param xPoint X 点です
     * @return 追跡結果です
     */
    public SeparatrixLegs trace(Point2D xPoint) {
        return trace(xPoint, analyzer.getField().psi(xPoint));
    }

    /**
     * セパラトリクスの 4 本の脚を追跡します。
     *
     * @param xPoint X 点です
     * @param psiSeparatrix セパラトリクス上の psi です
     * @return 追跡結果です
     * @throws IllegalStateException 2 本の脚が同じ象限にある場合に発生します
     * @throws io.github.yok.fluxgrid.core.solver.RootSearchException 交点が見つからない、または射影に失敗した場合に発生します
     */
    public SeparatrixLegs trace(Point2D xPoint, double psiSeparatrix) {
        Preconditions.checkNotNull(xPoint, "X 点が null です。");
        ScalarField2D field = analyzer.getField();

        log.info("セパラトリクスの追跡を開始します。X点=({}, {})、psi={}、脚の点数={}、射影幅={}", fmt5(xPoint.getR()),
                fmt5(xPoint.getZ()), psiSeparatrix, legPoints, fmt5(refineWidth));

        double[] roots = analyzer.findRoots1D(s -> field.psi(wall.pointAt(s)) - psiSeparatrix,
                LEG_COUNT, 0.0, 1.0, atol, EquilibriumAnalyzer.DEFAULT_ROOT_RTOL,
                EquilibriumAnalyzer.DEFAULT_MAX_INTERVALS);

        List<Point2D> intersections = new ArrayList<>(roots.length);
        Map<LegPosition, FluxContour> legs = new EnumMap<>(LegPosition.class);
        for (double s : roots) {
            Point2D boundary = wall.pointAt(s);
            intersections.add(boundary);

            LegPosition position = LegPosition.classify(xPoint, boundary);
            if (legs.containsKey(position)) {
                throw new IllegalStateException(
                        "同じ象限に 2 本の脚があります: " + position + ", 交点=" + boundary);
            }

            FluxContour leg = new FluxContour(straightLine(xPoint, boundary), field, psiSeparatrix);
            leg.setStartTag(new EndpointTag(XPOINT_TAG, xPoint));
            leg.setEndTag(new EndpointTag(WALL_TAG, boundary));
            leg.refine(refineWidth, atol);
            legs.put(position, leg);

            log.info("脚を追跡しました。象限={}、壁との交点=({}, {})、長さ={}", position, fmt5(boundary.getR()),
                    fmt5(boundary.getZ()), fmt5(leg.getTotalLength()));
        }

        return new SeparatrixLegs(xPoint, psiSeparatrix, Collections.unmodifiableList(intersections),
                Collections.unmodifiableMap(legs));
    }

    /**
     * X 点の近傍（距離 10·atol の割合）から壁上の点までの直線上に点を並べます。
     *
     * @param xPoint X 点です
     * @param boundary 壁上の点です
     * @return 点列です
     */
    private List<Point2D> straightLine(Point2D xPoint, Point2D boundary) {
        Point2D delta = boundary.subtract(xPoint);
        double start = 10.0 * atol;
        List<Point2D> out = new ArrayList<>(legPoints);
        for (int i = 0; i < legPoints; i++) {
            double s = start + (1.0 - start) * i / (legPoints - 1);
            out.add(xPoint.add(delta.multiply(s)));
        }
        return out;
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

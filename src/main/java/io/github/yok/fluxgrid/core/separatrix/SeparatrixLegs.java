package io.github.yok.fluxgrid.core.separatrix;

import io.github.yok.fluxgrid.core.contour.FluxContour;
import io.github.yok.fluxgrid.core.geometry.Point2D;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * セパラトリクス追跡の結果（X 点、psi 値、壁との交点、象限ごとの脚）を保持するクラスです。
 */
@Value
public class SeparatrixLegs {

    /**
     * X 点です。
     */
    Point2D xPoint;

    /**
     * セパラトリクス上の psi です。
     */
    double psiSeparatrix;

    /**
     * 壁との交点（壁パラメータの昇順）です。
     */
    List<Point2D> wallIntersections;

    /**
     * 象限ごとの脚（X 点から壁へ向かう向き）です。
     */
    Map<LegPosition, FluxContour> legs;

    /**
     * 指定した象限の脚を返します。
     *
     * @param position 象限です
     * @return 脚です
     * @throws IllegalArgumentException 該当する脚がない場合に発生します
     */
    public FluxContour getLeg(LegPosition position) {
        FluxContour leg = legs.get(position);
        if (leg == null) {
            throw new IllegalArgumentException("脚が見つかりません: " + position);
        }
        return leg;
    }
}

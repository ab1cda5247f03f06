package io.github.yok.fluxgrid.core.separatrix;

import io.github.yok.fluxgrid.core.geometry.Point2D;
import lombok.Value;

/**
 * 円形の壁です（s=0 が外側赤道面、反時計回り）。
 */
@Value
public class CircularWall implements Wall {

    /**
     * 中心です。
     */
    Point2D center;

    /**
     * 半径です。
     */
    double radius;

    /**
     * 円形の壁を生成します。
     *
     * @param center 中心です
     * @param radius 半径（正）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CircularWall(Point2D center, double radius) {
        if (center == null) {
            throw new IllegalArgumentException("center は null 不可です");
        }
        if (!(radius > 0.0)) {
            throw new IllegalArgumentException("radius は正の値を指定してください: " + radius);
        }
        this.center = center;
        this.radius = radius;
    }

    @Override
    public Point2D pointAt(double s) {
        double theta = 2.0 * Math.PI * s;
        return center.add(new Point2D(radius * Math.cos(theta), radius * Math.sin(theta)));
    }
}

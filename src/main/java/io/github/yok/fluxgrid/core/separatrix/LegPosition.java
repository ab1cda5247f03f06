package io.github.yok.fluxgrid.core.separatrix;

import io.github.yok.fluxgrid.core.geometry.Point2D;

/**
 * X 点から見たセパラトリクスの脚の位置（象限）です。
 */
public enum LegPosition {

    INNER_LOWER, INNER_UPPER, OUTER_UPPER, OUTER_LOWER;

    /**
     * X 点に対する壁との交点の位置から、脚の象限を判定します。
     *
     * @param xPoint X 点です
     * @param wallPoint 脚と壁との交点です
     * @return 脚の象限です
     */
    public static LegPosition classify(Point2D xPoint, Point2D wallPoint) {
        boolean inner = wallPoint.getR() < xPoint.getR();
        boolean lower = wallPoint.getZ() < xPoint.getZ();
        if (inner) {
            return lower ? INNER_LOWER : INNER_UPPER;
        }
        return lower ? OUTER_LOWER : OUTER_UPPER;
    }

    /**
     * 出力ファイル名などに使う小文字の名前を返します。
     *
     * @return 例: {@code "inner_lower"} です
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}

package io.github.yok.fluxgrid.core.separatrix;

import io.github.yok.fluxgrid.core.geometry.Point2D;

/**
 * 装置の第一壁など、ポロイダル断面上の閉曲線を表すインタフェースです。
 *
 * <p>
 * 曲線はパラメータ s∈[0, 1) で一周するように表し、s=0 と s=1 は同じ点を指します。
 * </p>
 */
public interface Wall {

    /**
     * パラメータ s の点を返します。
     *
     * @param s 周回パラメータ（0 ≤ s ≤ 1）です
     * @return 壁上の点です
     */
    Point2D pointAt(double s);
}

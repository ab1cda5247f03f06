package io.github.yok.fluxgrid.core.equilibrium;

import io.github.yok.fluxgrid.core.geometry.Point2D;
import lombok.Value;

/**
 * 線分上で見つかった psi の極値を表すクラスです。
 */
@Value
public class Extremum {

    /**
     * 極値の位置です。
     */
    Point2D position;

    /**
     * 極小なら true、極大なら false です。
     */
    boolean minimum;
}

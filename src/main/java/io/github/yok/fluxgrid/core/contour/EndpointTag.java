package io.github.yok.fluxgrid.core.contour;

import io.github.yok.fluxgrid.core.geometry.Point2D;
import lombok.Value;

/**
 * 等値線の端点に付ける目印（X 点や壁との交点など）です。
 *
 * <p>
 * メッシュ組み立て時に、どの等値線同士を端点でつなぐかを判定するために使います。
 * </p>
 */
@Value
public class EndpointTag {

    /**
     * 目印の名前（例: {@code "xpoint"}、{@code "wall"}）です。
     */
    String name;

    /**
     * 目印の位置です。
     */
    Point2D position;
}

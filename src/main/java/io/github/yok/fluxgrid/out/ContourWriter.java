package io.github.yok.fluxgrid.out;

import io.github.yok.fluxgrid.core.contour.FluxContour;
import io.github.yok.fluxgrid.core.separatrix.LegPosition;
import io.github.yok.fluxgrid.core.separatrix.SeparatrixLegs;
import java.util.Map;

/**
 * 追跡・再配置した等値線を出力する処理のインタフェースです。
 *
 * <p>
 * 出力形式（CSV、NetCDF など）を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface ContourWriter {

    /**
     * セパラトリクスの追跡結果と、脚ごとの再配置済み等値線を出力します。
     *
     * @param separatrix セパラトリクスの追跡結果です
     * @param gridLines 象限ごとの再配置済み等値線です
     */
    void write(SeparatrixLegs separatrix, Map<LegPosition, FluxContour> gridLines);
}

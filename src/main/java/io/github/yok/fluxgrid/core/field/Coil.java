package io.github.yok.fluxgrid.core.field;

import lombok.Value;

/**
 * 軸対称な円形電流ループ（ポロイダル磁場コイル）を表すクラスです。
 */
@Value
public class Coil {

    /**
     * ループ半径（主半径 R）です。
     */
    double r;

    /**
     * ループの高さ Z です。
     */
    double z;

    /**
     * 電流 [A] です。
     */
    double current;
}

package io.github.yok.fluxgrid.core.field;

/**
 * ガウス関数の和で表した解析的なトカマク平衡（テスト・デモ用）です。
 *
 * <p>
 * いずれも R0 = 1.5 上に幅 0.3 のガウス関数を並べたもので、隣り合う山の間に X 点ができます。 既定のサンプル領域は
 * R∈[1.2, 1.8]、Z∈[-0.5, 0.5] です。
 * </p>
 */
public enum SyntheticTokamak implements ScalarField2D {

    /**
     * 下側シングルヌル（X 点は (1.5, -0.3) 付近）です。
     */
    LSN(1.0, 0.0, -0.6),

    /**
     * 上側シングルヌルです。
     */
    USN(1.0, 0.6, 0.0),

    /**
     * 上下対称のダブルヌルです。
     */
    CDN(1.0, 0.0, -0.6, 0.6),

    /**
     * 上側がわずかに優勢なダブルヌルです。
     */
    UDN(1.0, 0.0, -0.602, 0.6),

    /**
     * 下側が優勢なダブルヌル（符号反転）です。
     */
    LDN(-1.0, 0.0, -0.6, 0.603),

    /**
     * 二次 X 点がプラズマ端から離れたダブルヌルです。
     */
    UDN2(1.0, 0.0, -0.62, 0.6);

    /**
     * ガウス関数の中心 R です。
     */
    public static final double R0 = 1.5;

    /**
     * ガウス関数の幅です。
     */
    public static final double WIDTH = 0.3;

    public static final double DEFAULT_R_MIN = 1.2;

    public static final double DEFAULT_R_MAX = 1.8;

    public static final double DEFAULT_Z_MIN = -0.5;

    public static final double DEFAULT_Z_MAX = 0.5;

    private final double sign;

    private final double[] centersZ;

    SyntheticTokamak(double sign, double... centersZ) {
        this.sign = sign;
        this.centersZ = centersZ;
    }

    @Override
    public double psi(double r, double z) {
        double total = 0.0;
        for (double zc : centersZ) {
            total += gaussian(r, z, zc);
        }
        return sign * total;
    }

    @Override
    public double ddR(double r, double z) {
        double total = 0.0;
        for (double zc : centersZ) {
            total += -2.0 * (r - R0) / (WIDTH * WIDTH) * gaussian(r, z, zc);
        }
        return sign * total;
    }

    @Override
    public double ddZ(double r, double z) {
        double total = 0.0;
        for (double zc : centersZ) {
            total += -2.0 * (z - zc) / (WIDTH * WIDTH) * gaussian(r, z, zc);
        }
        return sign * total;
    }

    /**
     * 既定の領域で等間隔サンプルを生成します。
     *
     * @param nR R 方向の点数です
     * @param nZ Z 方向の点数です
     * @return サンプル格子です
     */
    public FluxSampleGrid sample(int nR, int nZ) {
        return FluxSampleGrid.sample(this, DEFAULT_R_MIN, DEFAULT_R_MAX, nR, DEFAULT_Z_MIN,
                DEFAULT_Z_MAX, nZ);
    }

    private static double gaussian(double r, double z, double zc) {
        double dr = r - R0;
        double dz = z - zc;
        return Math.exp(-(dr * dr + dz * dz) / (WIDTH * WIDTH));
    }
}

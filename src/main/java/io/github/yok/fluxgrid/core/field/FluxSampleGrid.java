package io.github.yok.fluxgrid.core.field;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * 等間隔格子上の psi サンプル（平衡ファイルから読み込む配列に相当）を保持するクラスです。
 */
@Value
public class FluxSampleGrid {

    /**
     * R 座標（長さ nR）です。
     */
    double[] r;

    /**
     * Z 座標（長さ nZ）です。
     */
    double[] z;

    /**
     * psi のサンプル（psi[j][i] = psi(R_i, Z_j)）です。
     */
    double[][] psi;

    /**
     * 任意の磁束場を等間隔格子上でサンプリングします。
     *
     * @param field サンプリングする磁束場です
     * @param rMin R の下端です
     * @param rMax R の上端です
     * @param nR R 方向の点数（2以上）です
     * @param zMin Z の下端です
     * @param zMax Z の上端です
     * @param nZ Z 方向の点数（2以上）です
     * @return サンプル格子です
     */
    public static FluxSampleGrid sample(ScalarField2D field, double rMin, double rMax, int nR,
            double zMin, double zMax, int nZ) {
        Preconditions.checkNotNull(field, "磁束場が null です。");
        double[] r = linspace(rMin, rMax, nR);
        double[] z = linspace(zMin, zMax, nZ);
        double[][] psi = new double[nZ][nR];
        for (int j = 0; j < nZ; j++) {
            for (int i = 0; i < nR; i++) {
                psi[j][i] = field.psi(r[i], z[j]);
            }
        }
        return new FluxSampleGrid(r, z, psi);
    }

    /**
     * 両端を含む等間隔の点列を返します。
     *
     * @param start 始点です
     * @param end 終点です
     * @param n 点数（2以上）です
     * @return 点列です
     */
    public static double[] linspace(double start, double end, int n) {
        Preconditions.checkArgument(n >= 2, "点数は 2 以上である必要があります。n=%s", n);
        double[] out = new double[n];
        double step = (end - start) / (n - 1);
        for (int i = 0; i < n; i++) {
            out[i] = start + i * step;
        }
        return out;
    }
}

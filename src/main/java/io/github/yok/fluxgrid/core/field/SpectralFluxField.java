package io.github.yok.fluxgrid.core.field;

import io.github.yok.fluxgrid.core.linearalgebra.CosineTransformBackend;
import io.github.yok.fluxgrid.core.linearalgebra.EjmlCosineTransformBackend;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 等間隔格子上の psi サンプルを 2 次元コサイン級数で補間する磁束場です。
 *
 * <p>
 * 構築時に type-II DCT で係数を求め、評価時は
 * {@code Σ_{j,k} c[j,k] cos(κ_R[k](i_R+1/2)) cos(κ_Z[j](i_Z+1/2))} を点ごとに計算します。 格子点上では元のサンプルを再現し、
 * 偏微分は級数を項別微分して求めます。
 * </p>
 *
 * <p>
 * 構築後は不変で、複数スレッドから同時に評価してかまいません。
 * </p>
 */
@Slf4j
@Getter
public final class SpectralFluxField implements ScalarField2D {

    /**
     * 等間隔判定の相対許容誤差です。
     */
    static final double UNIFORMITY_TOLERANCE = 1e-13;

    /**
     * R 方向の格子点数です。
     */
    private final int nR;

    /**
     * Z 方向の格子点数です。
     */
    private final int nZ;

    /**
     * R の下端です。
     */
    private final double rMin;

    /**
     * R の上端です。
     */
    private final double rMax;

    /**
     * Z の下端です。
     */
    private final double zMin;

    /**
     * Z の上端です。
     */
    private final double zMax;

    /**
     * R 方向の格子間隔です。
     */
    private final double dR;

    /**
     * Z 方向の格子間隔です。
     */
    private final double dZ;

    /**
     * 正規化済みの DCT 係数（nZ×nR）です。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final DMatrixRMaj coefficients;

    /**
     * R 方向の角周波数 π k / nR です。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final double[] coefR;

    /**
     * Z 方向の角周波数 π j / nZ です。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final double[] coefZ;

    /**
     * EJML バックエンドでスペクトル補間場を構築します。
     *
     * @param rArray 等間隔・狭義単調増加の R 座標です
     * @param zArray 等間隔・狭義単調増加の Z 座標です
     * @param psiRZ psi のサンプル（psiRZ[j][i] = psi(R_i, Z_j)）です
     * @throws FieldValidationException 入力が不正な場合に発生します
     */
    public SpectralFluxField(double[] rArray, double[] zArray, double[][] psiRZ) {
        this(rArray, zArray, psiRZ, new EjmlCosineTransformBackend());
    }

    /**
     * スペクトル補間場を構築します。
     *
     * @param rArray 等間隔・狭義単調増加の R 座標です
     * @param zArray 等間隔・狭義単調増加の Z 座標です
     * @param psiRZ psi のサンプル（psiRZ[j][i] = psi(R_i, Z_j)）です
     * @param backend DCT バックエンドです
     * @throws FieldValidationException 入力が不正な場合に発生します
     */
    public SpectralFluxField(double[] rArray, double[] zArray, double[][] psiRZ,
            CosineTransformBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend は null 不可です");
        }
        validateAxis("R", rArray);
        validateAxis("Z", zArray);

        this.nR = rArray.length;
        this.nZ = zArray.length;
        validateShape(psiRZ, nZ, nR);

        this.rMin = rArray[0];
        this.rMax = rArray[nR - 1];
        this.zMin = zArray[0];
        this.zMax = zArray[nZ - 1];
        this.dR = (rMax - rMin) / (nR - 1);
        this.dZ = (zMax - zMin) / (nZ - 1);

        DMatrixRMaj c = backend.forward2d(new DMatrixRMaj(psiRZ));

        // nR*nZ で正規化し、ゼロ周波数の行と列を半分にします（平均値の二重計上を補正）。
        double norm = (double) nR * nZ;
        for (int j = 0; j < nZ; j++) {
            for (int k = 0; k < nR; k++) {
                double v = c.get(j, k) / norm;
                if (j == 0) {
                    v *= 0.5;
                }
                if (k == 0) {
                    v *= 0.5;
                }
                c.set(j, k, v);
            }
        }
        this.coefficients = c;

        this.coefR = new double[nR];
        for (int k = 0; k < nR; k++) {
            coefR[k] = Math.PI * k / nR;
        }
        this.coefZ = new double[nZ];
        for (int j = 0; j < nZ; j++) {
            coefZ[j] = Math.PI * j / nZ;
        }

        log.debug("スペクトル補間場を構築しました。nR={}、nZ={}、R=[{}, {}]、Z=[{}, {}]", nR, nZ, fmt5(rMin),
                fmt5(rMax), fmt5(zMin), fmt5(zMax));
    }

    /**
     * 点 (R, Z) における psi を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return psi(R, Z) です
     */
    @Override
    public double psi(double r, double z) {
        double[] cr = new double[nR];
        double[] cz = new double[nZ];
        double ir = indexR(r);
        double iz = indexZ(z);
        for (int k = 0; k < nR; k++) {
            cr[k] = Math.cos(coefR[k] * (ir + 0.5));
        }
        for (int j = 0; j < nZ; j++) {
            cz[j] = Math.cos(coefZ[j] * (iz + 0.5));
        }
        return sum(cz, cr);
    }

    /**
     * 点 (R, Z) における dpsi/dR を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return dpsi/dR です
     */
    @Override
    public double ddR(double r, double z) {
        double[] cr = new double[nR];
        double[] cz = new double[nZ];
        double ir = indexR(r);
        double iz = indexZ(z);
        for (int k = 0; k < nR; k++) {
            cr[k] = coefR[k] / dR * Math.sin(coefR[k] * (ir + 0.5));
        }
        for (int j = 0; j < nZ; j++) {
            cz[j] = Math.cos(coefZ[j] * (iz + 0.5));
        }
        return -sum(cz, cr);
    }

    /**
     * 点 (R, Z) における dpsi/dZ を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return dpsi/dZ です
     */
    @Override
    public double ddZ(double r, double z) {
        double[] cr = new double[nR];
        double[] cz = new double[nZ];
        double ir = indexR(r);
        double iz = indexZ(z);
        for (int k = 0; k < nR; k++) {
            cr[k] = Math.cos(coefR[k] * (ir + 0.5));
        }
        for (int j = 0; j < nZ; j++) {
            cz[j] = coefZ[j] / dZ * Math.sin(coefZ[j] * (iz + 0.5));
        }
        return -sum(cz, cr);
    }

    /**
     * 係数行列を挟んだ二重和 Σ_j cz[j] Σ_k c[j,k] cr[k] を計算します。
     *
     * @param cz Z 方向の因子です
     * @param cr R 方向の因子です
     * @return 二重和です
     */
    private double sum(double[] cz, double[] cr) {
        double[] data = coefficients.data;
        double total = 0.0;
        for (int j = 0; j < nZ; j++) {
            int row = j * nR;
            double inner = 0.0;
            for (int k = 0; k < nR; k++) {
                inner += data[row + k] * cr[k];
            }
            total += cz[j] * inner;
        }
        return total;
    }

    private double indexR(double r) {
        return (r - rMin) / (rMax - rMin) * (nR - 1);
    }

    private double indexZ(double z) {
        return (z - zMin) / (zMax - zMin) * (nZ - 1);
    }

    /**
     * 座標軸が 2 点以上・狭義単調増加・等間隔であることを検査します。
     *
     * @param axis 軸名です
     * @param values 座標値です
     * @throws FieldValidationException 条件を満たさない場合に発生します
     */
    static void validateAxis(String axis, double[] values) {
        if (values == null || values.length < 2) {
            throw new FieldValidationException(axis + " 軸には 2 点以上の座標が必要です");
        }
        int n = values.length;
        double first = values[0];
        double last = values[n - 1];
        if (!(last > first)) {
            throw new FieldValidationException(axis + " 軸は狭義単調増加である必要があります");
        }
        double step = (last - first) / (n - 1);
        double tol = UNIFORMITY_TOLERANCE * Math.max(1.0, Math.max(Math.abs(first), Math.abs(last)));
        for (int i = 0; i < n; i++) {
            if (i > 0 && !(values[i] > values[i - 1])) {
                throw new FieldValidationException(
                        axis + " 軸は狭義単調増加である必要があります: index=" + i);
            }
            double expected = first + i * step;
            if (Math.abs(values[i] - expected) > tol) {
                throw new FieldValidationException(axis + " 軸が等間隔ではありません: index=" + i
                        + ", value=" + values[i] + ", expected=" + expected);
            }
        }
    }

    /**
     * サンプル配列の形状が nZ×nR であることを検査します。
     *
     * @param psiRZ サンプル配列です
     * @param nZ Z 方向の点数です
     * @param nR R 方向の点数です
     * @throws FieldValidationException 形状が一致しない場合に発生します
     */
    private static void validateShape(double[][] psiRZ, int nZ, int nR) {
        if (psiRZ == null || psiRZ.length != nZ) {
            throw new FieldValidationException("psiRZ の行数が Z 軸の点数と一致しません: expected=" + nZ
                    + ", actual=" + (psiRZ == null ? "null" : psiRZ.length));
        }
        for (int j = 0; j < nZ; j++) {
            if (psiRZ[j] == null || psiRZ[j].length != nR) {
                throw new FieldValidationException("psiRZ の列数が R 軸の点数と一致しません: row=" + j
                        + ", expected=" + nR);
            }
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}

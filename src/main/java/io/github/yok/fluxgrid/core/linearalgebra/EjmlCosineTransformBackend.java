package io.github.yok.fluxgrid.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * EJML の行列積を用いて 2 次元 type-II DCT を計算するクラスです。
 *
 * <p>
 * 基底行列 C_N[k][n] = 2 cos(π k (2n+1) / (2N)) を作り、{@code C_Z · X · C_R^T} として計算します。 計算量は
 * O(nZ·nR·(nZ+nR)) で、平衡サンプル格子（数百点四方）には十分です。
 * </p>
 */
public final class EjmlCosineTransformBackend implements CosineTransformBackend {

    /**
     * 2 次元の type-II DCT（正規化なし）を計算します。
     *
     * @param samples nZ×nR のサンプル行列です
     * @return nZ×nR の変換係数行列です
     * @throws IllegalArgumentException samples が null または空の場合に発生します
     */
    @Override
    public DMatrixRMaj forward2d(DMatrixRMaj samples) {
        if (samples == null) {
            throw new IllegalArgumentException("samples は null 不可です");
        }
        int nZ = samples.numRows;
        int nR = samples.numCols;
        if (nZ == 0 || nR == 0) {
            throw new IllegalArgumentException("samples が空です: " + nZ + "x" + nR);
        }

        DMatrixRMaj basisZ = cosineBasis(nZ);
        DMatrixRMaj basisR = cosineBasis(nR);

        // Z 方向（行）に変換: tmp = C_Z · X
        DMatrixRMaj tmp = new DMatrixRMaj(nZ, nR);
        CommonOps_DDRM.mult(basisZ, samples, tmp);

        // R 方向（列）に変換: out = tmp · C_R^T
        DMatrixRMaj out = new DMatrixRMaj(nZ, nR);
        CommonOps_DDRM.multTransB(tmp, basisR, out);
        return out;
    }

    /**
     * type-II DCT の基底行列を生成します。
     *
     * @param n 変換長です
     * @return n×n の基底行列です
     */
    static DMatrixRMaj cosineBasis(int n) {
        DMatrixRMaj basis = new DMatrixRMaj(n, n);
        for (int k = 0; k < n; k++) {
            for (int m = 0; m < n; m++) {
                basis.set(k, m, 2.0 * Math.cos(Math.PI * k * (2 * m + 1) / (2.0 * n)));
            }
        }
        return basis;
    }
}

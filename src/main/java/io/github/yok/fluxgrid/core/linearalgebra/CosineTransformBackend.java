package io.github.yok.fluxgrid.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;

/**
 * 2 次元の離散コサイン変換（DCT）を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 行列積による直接計算や FFT 系ライブラリなど、実装を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface CosineTransformBackend {

    /**
     * 2 次元の type-II DCT（正規化なし）を計算します。
     *
     * <p>
     * 行方向（Z, 長さ nZ）と列方向（R, 長さ nR）にそれぞれ 1 次元 type-II DCT
     * {@code y[k] = 2 Σ_n x[n] cos(π k (2n+1) / (2N))} を適用した結果を返します。
     * </p>
     *
     * @param samples nZ×nR のサンプル行列です
     * @return nZ×nR の変換係数行列です
     * @throws IllegalArgumentException samples が null または空の場合に発生します
     */
    DMatrixRMaj forward2d(DMatrixRMaj samples);
}

package io.github.yok.fluxgrid.core.field;

import io.github.yok.fluxgrid.core.geometry.Point2D;

/**
 * ポロイダル断面 (R, Z) 上のスカラー磁束関数 psi を表すインタフェースです。
 *
 * <p>
 * スペクトル補間場・解析場・コイル場などの実装を差し替えられるようにするためのインタフェースです。 X 点探索や等値線の精密化などの下流処理は、
 * このインタフェースだけに依存します。
 * </p>
 */
public interface ScalarField2D {

    /**
     * 点 (R, Z) における psi を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return psi(R, Z) です
     */
    double psi(double r, double z);

    /**
     * 点 (R, Z) における dpsi/dR を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return dpsi/dR です
     */
    double ddR(double r, double z);

    /**
     * 点 (R, Z) における dpsi/dZ を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return dpsi/dZ です
     */
    double ddZ(double r, double z);

    /**
     * 点 p における psi を返します。
     *
     * @param p 評価点です
     * @return psi(p) です
     */
    default double psi(Point2D p) {
        return psi(p.getR(), p.getZ());
    }

    /**
     * ds/dpsi 方向場の R 成分（dpsi/dR / |grad psi|^2）を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return f_R です
     */
    default double fR(double r, double z) {
        double dr = ddR(r, z);
        double dz = ddZ(r, z);
        return dr / (dr * dr + dz * dz);
    }

    /**
     * ds/dpsi 方向場の Z 成分（dpsi/dZ / |grad psi|^2）を返します。
     *
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return f_Z です
     */
    default double fZ(double r, double z) {
        double dr = ddR(r, z);
        double dz = ddZ(r, z);
        return dz / (dr * dr + dz * dz);
    }

    /**
     * 同じ長さの R, Z 配列について要素ごとに psi を評価します。
     *
     * @param r R の配列です
     * @param z Z の配列です
     * @return psi の配列です
     * @throws FieldValidationException 配列長が一致しない場合に発生します
     */
    default double[] psi(double[] r, double[] z) {
        FieldArrays.requireSameLength(r, z);
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) {
            out[i] = psi(r[i], z[i]);
        }
        return out;
    }

    /**
     * 同じ長さの R, Z 配列について要素ごとに dpsi/dR を評価します。
     *
     * @param r R の配列です
     * @param z Z の配列です
     * @return dpsi/dR の配列です
     * @throws FieldValidationException 配列長が一致しない場合に発生します
     */
    default double[] ddR(double[] r, double[] z) {
        FieldArrays.requireSameLength(r, z);
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) {
            out[i] = ddR(r[i], z[i]);
        }
        return out;
    }

    /**
     * 同じ長さの R, Z 配列について要素ごとに dpsi/dZ を評価します。
     *
     * @param r R の配列です
     * @param z Z の配列です
     * @return dpsi/dZ の配列です
     * @throws FieldValidationException 配列長が一致しない場合に発生します
     */
    default double[] ddZ(double[] r, double[] z) {
        FieldArrays.requireSameLength(r, z);
        double[] out = new double[r.length];
        for (int i = 0; i < r.length; i++) {
            out[i] = ddZ(r[i], z[i]);
        }
        return out;
    }

    /**
     * 同じ形状の 2 次元 R, Z 配列について要素ごとに psi を評価します。
     *
     * @param r R の 2 次元配列です
     * @param z Z の 2 次元配列です
     * @return psi の 2 次元配列です
     * @throws FieldValidationException 形状が一致しない場合に発生します
     */
    default double[][] psi(double[][] r, double[][] z) {
        FieldArrays.requireSameShape(r, z);
        double[][] out = new double[r.length][];
        for (int j = 0; j < r.length; j++) {
            out[j] = psi(r[j], z[j]);
        }
        return out;
    }
}

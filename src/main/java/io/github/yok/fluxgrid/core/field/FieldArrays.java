package io.github.yok.fluxgrid.core.field;

/**
 * 評価点配列の形状検査をまとめたユーティリティです。
 */
final class FieldArrays {

    private FieldArrays() {}

    /**
     * 2 つの 1 次元配列の長さが一致することを検査します。
     *
     * @param r R の配列です
     * @param z Z の配列です
     * @throws FieldValidationException null または長さ不一致の場合に発生します
     */
    static void requireSameLength(double[] r, double[] z) {
        if (r == null || z == null) {
            throw new FieldValidationException("R/Z 配列は null 不可です");
        }
        if (r.length != z.length) {
            throw new FieldValidationException(
                    "R と Z の配列長が一致しません: R=" + r.length + ", Z=" + z.length);
        }
    }

    /**
     * 2 つの 2 次元配列の形状が一致することを検査します。
     *
     * @param r R の 2 次元配列です
     * @param z Z の 2 次元配列です
     * @throws FieldValidationException null または形状不一致の場合に発生します
     */
    static void requireSameShape(double[][] r, double[][] z) {
        if (r == null || z == null) {
            throw new FieldValidationException("R/Z 配列は null 不可です");
        }
        if (r.length != z.length) {
            throw new FieldValidationException(
                    "R と Z の行数が一致しません: R=" + r.length + ", Z=" + z.length);
        }
        for (int j = 0; j < r.length; j++) {
            if (r[j] == null || z[j] == null || r[j].length != z[j].length) {
                throw new FieldValidationException("R と Z の形状が一致しません: row=" + j);
            }
        }
    }
}

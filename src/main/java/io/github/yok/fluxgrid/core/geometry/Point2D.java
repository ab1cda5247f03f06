package io.github.yok.fluxgrid.core.geometry;

import java.util.Iterator;
import java.util.List;
import lombok.Value;

/**
 * ポロイダル断面上の点 (R, Z) を表す不変クラスです。
 *
 * <p>
 * 加減算・スカラー倍/除算を持つ 2 次元ベクトルとして扱えます。 反復すると R, Z の順に値を返します。
 * </p>
 */
@Value
public class Point2D implements Iterable<Double> {

    /**
     * 主半径方向の座標 R です。
     */
    double r;

    /**
     * 鉛直方向の座標 Z です。
     */
    double z;

    /**
     * ベクトル和を返します。
     *
     * @param other 加える点です
     * @return this + other です
     */
    public Point2D add(Point2D other) {
        return new Point2D(r + other.r, z + other.z);
    }

    /**
     * ベクトル差を返します。
     *
     * @param other 引く点です
     * @return this - other です
     */
    public Point2D subtract(Point2D other) {
        return new Point2D(r - other.r, z - other.z);
    }

    /**
     * スカラー倍を返します。
     *
     * @param factor 係数です
     * @return factor * this です
     */
    public Point2D multiply(double factor) {
        return new Point2D(r * factor, z * factor);
    }

    /**
     * スカラーで割った点を返します。
     *
     * @param divisor 除数です
     * @return this / divisor です
     */
    public Point2D divide(double divisor) {
        return new Point2D(r / divisor, z / divisor);
    }

    /**
     * 原点からのユークリッド距離を返します。
     *
     * @return |this| です
     */
    public double norm() {
        return Math.hypot(r, z);
    }

    /**
     * 2 点間のユークリッド距離を返します。
     *
     * @param other 相手の点です
     * @return |this - other| です
     */
    public double distanceTo(Point2D other) {
        return Math.hypot(r - other.r, z - other.z);
    }

    /**
     * 成分ごとに許容誤差内で一致するかどうかを返します。
     *
     * @param other 比較する点です
     * @param tolerance 成分ごとの絶対許容誤差です
     * @return 一致とみなせる場合 true です
     */
    public boolean isClose(Point2D other, double tolerance) {
        return Math.abs(r - other.r) <= tolerance && Math.abs(z - other.z) <= tolerance;
    }

    /**
     * {R, Z} の配列を返します。
     *
     * @return 長さ 2 の配列です
     */
    public double[] toArray() {
        return new double[] {r, z};
    }

    @Override
    public Iterator<Double> iterator() {
        return List.of(r, z).iterator();
    }

    @Override
    public String toString() {
        return "Point2D(" + r + "," + z + ")";
    }
}

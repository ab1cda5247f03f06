package io.github.yok.fluxgrid.core.field;

import com.google.common.base.Preconditions;
import java.util.function.DoubleUnaryOperator;
import lombok.Getter;

/**
 * 中心差分と Richardson 外挿により 1 変数関数の微分を数値計算するクラスです。
 *
 * <p>
 * 刻み h, h/2, h/4, ... の中心差分を Neville 表で外挿し、誤差 O(h^2) の項を段階的に消去します。
 * </p>
 */
@Getter
public final class RichardsonDifferentiator {

    /**
     * 既定の初期刻み幅です。
     */
    public static final double DEFAULT_STEP = 1e-2;

    /**
     * 既定の外挿段数です。
     */
    public static final int DEFAULT_LEVELS = 4;

    /**
     * 初期刻み幅です。
     */
    private final double step;

    /**
     * 外挿段数（中心差分を評価する刻みの数）です。
     */
    private final int levels;

    /**
     * 既定値（刻み 1e-2、4 段）で生成します。
     */
    public RichardsonDifferentiator() {
        this(DEFAULT_STEP, DEFAULT_LEVELS);
    }

    /**
     * 刻み幅と段数を指定して生成します。
     *
     * @param step 初期刻み幅（正）です
     * @param levels 外挿段数（1以上）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public RichardsonDifferentiator(double step, int levels) {
        Preconditions.checkArgument(step > 0.0 && Double.isFinite(step), "刻み幅は正の有限値である必要があります。step=%s",
                step);
        Preconditions.checkArgument(levels >= 1, "外挿段数は 1 以上である必要があります。levels=%s", levels);
        this.step = step;
        this.levels = levels;
    }

    /**
     * g'(x) を返します。
     *
     * @param g 微分する関数です
     * @param x 評価点です
     * @return 外挿した微分値です
     */
    public double derivative(DoubleUnaryOperator g, double x) {
        double[] table = new double[levels];
        double h = step;
        for (int i = 0; i < levels; i++) {
            table[i] = (g.applyAsDouble(x + h) - g.applyAsDouble(x - h)) / (2.0 * h);
            // 刻みを半分にするごとに誤差は 1/4 になるため、係数 4^k で外挿します。
            double factor = 4.0;
            for (int k = i - 1; k >= 0; k--) {
                table[k] = table[k + 1] + (table[k + 1] - table[k]) / (factor - 1.0);
                factor *= 4.0;
            }
            h *= 0.5;
        }
        return table[0];
    }
}

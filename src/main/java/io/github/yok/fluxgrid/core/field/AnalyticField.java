package io.github.yok.fluxgrid.core.field;

import com.google.common.base.Preconditions;
import java.util.function.DoubleBinaryOperator;

/**
 * 閉じた式で与えられる psi(R, Z) を磁束場として扱うクラスです。
 *
 * <p>
 * 偏微分も閉じた式で与えるか、省略して {@link RichardsonDifferentiator} による数値微分を使うかを選べます。
 * </p>
 */
public final class AnalyticField implements ScalarField2D {

    private final DoubleBinaryOperator psiFunction;

    private final DoubleBinaryOperator ddRFunction;

    private final DoubleBinaryOperator ddZFunction;

    private final RichardsonDifferentiator differentiator;

    private AnalyticField(DoubleBinaryOperator psiFunction, DoubleBinaryOperator ddRFunction,
            DoubleBinaryOperator ddZFunction, RichardsonDifferentiator differentiator) {
        this.psiFunction = Preconditions.checkNotNull(psiFunction, "psi 関数が null です。");
        this.ddRFunction = ddRFunction;
        this.ddZFunction = ddZFunction;
        this.differentiator = differentiator;
    }

    /**
     * 偏微分を数値微分（既定の Richardson 外挿）で求める解析場を生成します。
     *
     * @param psi psi(R, Z) です
     * @return 解析場です
     */
    public static AnalyticField of(DoubleBinaryOperator psi) {
        return of(psi, new RichardsonDifferentiator());
    }

    /**
     * 偏微分を指定の数値微分器で求める解析場を生成します。
     *
     * @param psi psi(R, Z) です
     * @param differentiator 数値微分器です
     * @return 解析場です
     */
    public static AnalyticField of(DoubleBinaryOperator psi,
            RichardsonDifferentiator differentiator) {
        Preconditions.checkNotNull(differentiator, "数値微分器が null です。");
        return new AnalyticField(psi, null, null, differentiator);
    }

    /**
     * 偏微分も閉じた式で与える解析場を生成します。
     *
     * @param psi psi(R, Z) です
     * @param ddR dpsi/dR です
     * @param ddZ dpsi/dZ です
     * @return 解析場です
     */
    public static AnalyticField of(DoubleBinaryOperator psi, DoubleBinaryOperator ddR,
            DoubleBinaryOperator ddZ) {
        Preconditions.checkNotNull(ddR, "dpsi/dR 関数が null です。");
        Preconditions.checkNotNull(ddZ, "dpsi/dZ 関数が null です。");
        return new AnalyticField(psi, ddR, ddZ, null);
    }

    @Override
    public double psi(double r, double z) {
        return psiFunction.applyAsDouble(r, z);
    }

    @Override
    public double ddR(double r, double z) {
        if (ddRFunction != null) {
            return ddRFunction.applyAsDouble(r, z);
        }
        return differentiator.derivative(x -> psiFunction.applyAsDouble(x, z), r);
    }

    @Override
    public double ddZ(double r, double z) {
        if (ddZFunction != null) {
            return ddZFunction.applyAsDouble(r, z);
        }
        return differentiator.derivative(x -> psiFunction.applyAsDouble(r, x), z);
    }
}

package io.github.yok.fluxgrid.core.field;

import com.google.common.base.Preconditions;
import java.util.List;

/**
 * 円形電流ループの集合が作るトロイダル方向ベクトルポテンシャルを psi とする磁束場です。
 *
 * <p>
 * 各ループの寄与は完全楕円積分で表され、
 * {@code A = -(μ0 I / π) sqrt(a/R) / sqrt(m) ((1 - m/2) K(m) - E(m))}、
 * {@code m = 4aR / ((a+R)^2 + (Z-z_c)^2)} です。 偏微分は {@link RichardsonDifferentiator} で数値的に求めます。
 * </p>
 */
public final class CoilField implements ScalarField2D {

    /**
     * 真空の透磁率 μ0 [H/m] です。
     */
    public static final double MU0 = 4.0e-7 * Math.PI;

    private final List<Coil> coils;

    private final RichardsonDifferentiator differentiator;

    /**
     * 既定の数値微分器でコイル場を生成します。
     *
     * @param coils コイルの一覧（1つ以上）です
     */
    public CoilField(List<Coil> coils) {
        this(coils, new RichardsonDifferentiator());
    }

    /**
     * コイル場を生成します。
     *
     * @param coils コイルの一覧（1つ以上）です
     * @param differentiator 数値微分器です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CoilField(List<Coil> coils, RichardsonDifferentiator differentiator) {
        Preconditions.checkArgument(coils != null && !coils.isEmpty(), "コイルを 1 つ以上指定してください。");
        for (Coil coil : coils) {
            Preconditions.checkArgument(coil != null && coil.getR() > 0.0,
                    "コイル半径は正である必要があります。coil=%s", coil);
        }
        this.coils = List.copyOf(coils);
        this.differentiator = Preconditions.checkNotNull(differentiator, "数値微分器が null です。");
    }

    /**
     * コイルの一覧を返します。
     *
     * @return 変更不可のコイル一覧です
     */
    public List<Coil> getCoils() {
        return coils;
    }

    @Override
    public double psi(double r, double z) {
        Preconditions.checkArgument(r > 0.0, "コイル場は R > 0 でのみ評価できます。R=%s", r);
        double total = 0.0;
        for (Coil coil : coils) {
            total += loopPotential(coil, r, z);
        }
        return total;
    }

    @Override
    public double ddR(double r, double z) {
        return differentiator.derivative(x -> psi(x, z), r);
    }

    @Override
    public double ddZ(double r, double z) {
        return differentiator.derivative(x -> psi(r, x), z);
    }

    /**
     * 1 つのループが点 (R, Z) に作るベクトルポテンシャルを返します。
     *
     * @param coil ループです
     * @param r 主半径 R です
     * @param z 鉛直座標 Z です
     * @return A_phi です
     */
    private static double loopPotential(Coil coil, double r, double z) {
        double a = coil.getR();
        double dz = z - coil.getZ();
        double m = 4.0 * a * r / ((a + r) * (a + r) + dz * dz);
        double[] ke = EllipticIntegrals.completeKE(m);
        return -MU0 * coil.getCurrent() / Math.PI * Math.sqrt(a / r) / Math.sqrt(m)
                * ((1.0 - 0.5 * m) * ke[0] - ke[1]);
    }
}

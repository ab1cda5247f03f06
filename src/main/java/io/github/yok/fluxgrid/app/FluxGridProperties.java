package io.github.yok.fluxgrid.app;

import io.github.yok.fluxgrid.core.field.SyntheticTokamak;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * flux-grid の設定値（fluxgrid.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "fluxgrid")
public class FluxGridProperties {

    /**
     * 磁束場の設定です。
     */
    @Valid
    private Field field = new Field();

    /**
     * X 点探索の設定です。
     */
    @Valid
    private XPointSearch xPointSearch = new XPointSearch();

    /**
     * 壁の設定です。
     */
    @Valid
    private Wall wall = new Wall();

    /**
     * セパラトリクス追跡の設定です。
     */
    @Valid
    private Separatrix separatrix = new Separatrix();

    /**
     * 脚の再配置の設定です。
     */
    @Valid
    private Regrid regrid = new Regrid();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "fluxgrid")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Field f = getField();
        XPointSearch x = getXPointSearch();
        Wall w = getWall();
        Separatrix s = getSeparatrix();
        Regrid r = getRegrid();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "field",
                // type: 磁束場の種類（SPECTRAL/ANALYTIC/COIL）
                "type", f.getType(),
                // geometry: 解析平衡の形状（SPECTRAL/ANALYTIC で使用）
                "geometry", f.getGeometry(),
                // nr, nz: サンプル格子の点数（SPECTRAL で使用）
                "nr", f.getNr(), "nz", f.getNz(),
                // minR..maxZ: サンプル格子の範囲
                "minR", f.getMinR(), "maxR", f.getMaxR(), "minZ", f.getMinZ(), "maxZ", f.getMaxZ(),
                // coils: コイルの一覧（COIL で使用）
                "coils", f.getCoils());

        appendSection(sb, nl, "xPointSearch",
                // minR..maxZ: 探索ボックス
                "minR", x.getMinR(), "maxR", x.getMaxR(), "minZ", x.getMinZ(), "maxZ", x.getMaxZ(),
                // atol: 位置の許容誤差
                "atol", x.getAtol(),
                // maxIterations: 交互直線探索の最大反復回数
                "maxIterations", x.getMaxIterations());

        appendSection(sb, nl, "wall",
                // centerR, centerZ, radius: 円形の壁
                "centerR", w.getCenterR(), "centerZ", w.getCenterZ(), "radius", w.getRadius());

        appendSection(sb, nl, "separatrix",
                // legPoints: 1 本の脚あたりの点数
                "legPoints", s.getLegPoints(),
                // refineWidth: 等値線への射影窓の片側の幅
                "refineWidth", s.getRefineWidth(),
                // atol: 根探索・射影の許容誤差
                "atol", s.getAtol());

        appendSection(sb, nl, "regrid",
                // points: 再配置後の点数
                "points", r.getPoints(),
                // width, atol: 射影窓の片側の幅と psi の許容誤差
                "width", r.getWidth(), "atol", r.getAtol(),
                // extendLower, extendUpper: 両端に延長する点数
                "extendLower", r.getExtendLower(), "extendUpper", r.getExtendUpper(),
                // dLower, dUpper: 端の間隔（未指定なら等間隔）
                "dLower", r.getDLower(), "dUpper", r.getDUpper());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Field {

        /**
         * 磁束場の種類です。
         */
        private FieldType type = FieldType.SPECTRAL;

        /**
         * 解析平衡の形状です。
         */
        private SyntheticTokamak geometry = SyntheticTokamak.LSN;

        /**
         * R 方向のサンプル点数です。
         */
        @Min(2)
        private int nr = 65;

        /**
         * Z 方向のサンプル点数です。
         */
        @Min(2)
        private int nz = 65;

        /**
         * サンプル格子の R 下端です。
         */
        private double minR = SyntheticTokamak.DEFAULT_R_MIN;

        /**
         * サンプル格子の R 上端です。
         */
        private double maxR = SyntheticTokamak.DEFAULT_R_MAX;

        /**
         * サンプル格子の Z 下端です。
         */
        private double minZ = SyntheticTokamak.DEFAULT_Z_MIN;

        /**
         * サンプル格子の Z 上端です。
         */
        private double maxZ = SyntheticTokamak.DEFAULT_Z_MAX;

        /**
         * コイルの一覧です。
         */
        @Valid
        private List<CoilSpec> coils = new ArrayList<>();

        public enum FieldType {
            SPECTRAL, ANALYTIC, COIL
        }
    }

    @Data
    public static class CoilSpec {

        /**
         * ループ半径です。
         */
        @Positive
        private double r;

        /**
         * ループの高さです。
         */
        private double z;

        /**
         * 電流 [A] です。
         */
        private double current;
    }

    @Data
    public static class XPointSearch {

        /**
         * 探索ボックスの R 下端です。
         */
        private double minR = 1.4;

        /**
         * 探索ボックスの R 上端です。
         */
        private double maxR = 1.6;

        /**
         * 探索ボックスの Z 下端です。
         */
        private double minZ = -0.4;

        /**
         * 探索ボックスの Z 上端です。
         */
        private double maxZ = -0.2;

        /**
         * 位置の許容誤差です。
         */
        @Positive
        private double atol = 2e-8;

        /**
         * 交互直線探索の最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 100;
    }

    @Data
    public static class Wall {

        /**
         * 円形の壁の中心 R です。
         */
        private double centerR = 1.5;

        /**
         * 円形の壁の中心 Z です。
         */
        private double centerZ = -0.3;

        /**
         * 円形の壁の半径です。
         */
        @Positive
        private double radius = 0.15;
    }

    @Data
    public static class Separatrix {

        /**
         * 1 本の脚あたりの点数です。
         */
        @Min(2)
        private int legPoints = 100;

        /**
         * 等値線への射影窓の片側の幅です。
         */
        @Positive
        private double refineWidth = 0.05;

        /**
         * 根探索・射影の許容誤差です。
         */
        @Positive
        private double atol = 2e-8;
    }

    @Data
    public static class Regrid {

        /**
         * 再配置後の点数です。
         */
        @Min(2)
        private int points = 33;

        /**
         * 射影窓の片側の幅です。
         */
        @Positive
        private double width = 1e-2;

        /**
         * psi の許容誤差です。
         */
        @Positive
        private double atol = 2e-8;

        /**
         * 始点側（X 点側）に延長する点数です。
         */
        @Min(0)
        private int extendLower = 0;

        /**
         * 終点側（壁側）に延長する点数です。
         */
        @Min(0)
        private int extendUpper = 0;

        /**
         * 始点側の間隔です（未指定なら指定なし）。
         */
        private Double dLower;

        /**
         * 終点側の間隔です（未指定なら指定なし）。
         */
        private Double dUpper;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotEmpty
        private String dir = "./out";
    }
}

package io.github.yok.vib.app;

import io.github.yok.vib.core.basis.ModeParity;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

/**
 * vib-solver の設定値（vib.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "vib")
public class VibProperties {

    /**
     * 入力ファイル設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 基底設定です。
     */
    @Valid
    private Basis basis = new Basis();

    /**
     * 周波数シフト設定です。
     */
    private Shift shift = new Shift();

    /**
     * 摂動行列の組み立て設定です。
     */
    @Valid
    private Assembly assembly = new Assembly();

    /**
     * 変分計算設定です。
     */
    private Variational variational = new Variational();

    /**
     * 摂動級数設定です。
     */
    @Valid
    private Rspt rspt = new Rspt();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "vib")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input i = getInput();
        Basis b = getBasis();
        Shift s = getShift();
        Assembly a = getAssembly();
        Variational v = getVariational();
        Rspt r = getRspt();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // frequencies: 調和振動数の表
                "frequencies", describe(i.getFrequencies()),
                // anharmonicCoefficients: 非調和係数の表
                "anharmonicCoefficients", describe(i.getAnharmonicCoefficients()));

        appendSection(sb, nl, "basis",
                // energyCutoff: ゼロ次エネルギーの上限 Emax
                "energyCutoff", b.getEnergyCutoff(),
                // parity: モードごとの偶奇条件
                "parity", b.getParity());

        appendSection(sb, nl, "shift",
                // frequencyShifts: モードごとのシフト量
                "frequencyShifts", s.getFrequencyShifts());

        appendSection(sb, nl, "assembly",
                // method: 組み立て方式（TABULATED/CLOSED_FORM）
                "method", a.getMethod(),
                // parallelism: 並列度
                "parallelism", a.getParallelism());

        appendSection(sb, nl, "variational",
                // enabled: 変分計算を行うかどうか
                "enabled", v.isEnabled(),
                // referenceEnergy: 基準エネルギー E0（未指定なら最低固有値）
                "referenceEnergy", v.getReferenceEnergy());

        appendSection(sb, nl, "rspt",
                // enabled: 摂動級数を生成するかどうか
                "enabled", r.isEnabled(),
                // targetState: 対象状態の基底番号
                "targetState", r.getTargetState(),
                // order: 係数の数 Nmax
                "order", r.getOrder(),
                // precisionDigits: 有効桁数
                "precisionDigits", r.getPrecisionDigits());

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

    private static String describe(Resource resource) {
        return resource == null ? null : resource.getDescription();
    }

    @Data
    public static class Input {

        /**
         * 調和振動数の表です（空白区切り、先頭列が振動数）。
         */
        @NotNull
        private Resource frequencies;

        /**
         * 非調和係数の表です（空白区切り、M 列のべき指数と係数）。
         */
        @NotNull
        private Resource anharmonicCoefficients;
    }

    @Data
    public static class Basis {

        /**
         * ゼロ次エネルギーの上限 Emax です（零点エネルギーを含みます）。
         */
        private double energyCutoff = 13000.0;

        /**
         * モードごとの偶奇条件です（空なら選別しません）。
         */
        private List<ModeParity> parity = List.of();
    }

    @Data
    public static class Shift {

        /**
         * モードごとの周波数シフト量です（空なら適用しません）。
         */
        private List<Double> frequencyShifts = List.of();
    }

    @Data
    public static class Assembly {

        /**
         * 組み立て方式です。
         */
        @NotNull
        private Method method = Method.TABULATED;

        /**
         * 並列度（ワーカースレッド数）です。
         */
        @Min(1)
        private int parallelism = 1;

        public enum Method {
            TABULATED, CLOSED_FORM
        }
    }

    @Data
    public static class Variational {

        /**
         * 変分計算を行うかどうかです。
         */
        private boolean enabled = true;

        /**
         * 基準エネルギー E0 です。
         *
         * <p>
         * 未指定の場合は最低固有値を使い、最低状態のエネルギーが 0 になります。
         * </p>
         */
        private Double referenceEnergy;
    }

    @Data
    public static class Rspt {

        /**
         * 摂動級数を生成するかどうかです。
         */
        private boolean enabled = false;

        /**
         * 対象状態の基底番号です（0 が基底状態）。
         */
        @Min(0)
        private int targetState = 0;

        /**
         * 係数の数 Nmax です。
         */
        @Min(2)
        private int order = 10;

        /**
         * 多倍長演算の有効桁数です。
         */
        @Min(1)
        private int precisionDigits = 50;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}

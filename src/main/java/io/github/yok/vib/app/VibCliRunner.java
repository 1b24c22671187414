package io.github.yok.vib.app;

import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.series.RsptSeries;
import io.github.yok.vib.core.solver.CalculationRequest;
import io.github.yok.vib.core.solver.CalculationResult;
import io.github.yok.vib.core.solver.VariationalSolver.VariationalResult;
import io.github.yok.vib.core.solver.VibState;
import io.github.yok.vib.core.solver.VibrationalCalculator;
import io.github.yok.vib.input.MolecularInputReader;
import io.github.yok.vib.out.ResultWriter;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で vib-solver を実行するクラスです。
 *
 * <p>
 * 入力表を読み込み、ゼロ次基底の列挙から変分計算・摂動級数の生成までを実行して結果を出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class VibCliRunner implements CommandLineRunner {

    /**
     * 標準出力に表示する状態数の上限です。
     */
    private static final int SUMMARY_STATES = 10;

    /**
     * vib-solver の設定値（vib.*）です。
     */
    private final VibProperties properties;

    /**
     * 入力表の読み込みロジックです。
     */
    private final MolecularInputReader inputReader;

    /**
     * 計算手順全体の実行ロジックです。
     */
    private final VibrationalCalculator calculator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== vib-solver start: vibrational energy levels ===");
        System.out.print(properties.toMultilineString());

        VibProperties.Input in = properties.getInput();
        if (in.getFrequencies() == null || in.getAnharmonicCoefficients() == null) {
            throw new IllegalStateException("input.frequencies と input.anharmonic-coefficients は必須です");
        }

        double[] frequencies = inputReader.readFrequencies(in.getFrequencies());
        AnharmonicPotential potential =
                inputReader.readAnharmonicPotential(in.getAnharmonicCoefficients());

        double energyCutoff = properties.getBasis().getEnergyCutoff();
        CalculationRequest request = CalculationRequest.builder().frequencies(frequencies)
                .potential(potential).energyCutoff(energyCutoff)
                .parities(properties.getBasis().getParity())
                .frequencyShifts(toArray(properties.getShift().getFrequencyShifts()))
                .variationalEnabled(properties.getVariational().isEnabled())
                .referenceEnergy(properties.getVariational().getReferenceEnergy())
                .rsptEnabled(properties.getRspt().isEnabled())
                .rsptTargetState(properties.getRspt().getTargetState())
                .rsptOrder(properties.getRspt().getOrder()).build();

        System.out.println("入力: 振動数=" + Arrays.toString(frequencies) + ", 単項式数="
                + potential.size() + ", Emax=" + fmt5(energyCutoff));

        CalculationResult result = calculator.calculate(request);
        resultWriter.write(result, energyCutoff);

        System.out.println("結果: 基底の状態数=" + result.getBasis().size());

        if (result.hasVariational()) {
            VariationalResult v = result.getVariational();
            System.out.println("=== 変分計算（E0=" + fmt5(v.getReferenceEnergy()) + "） ===");
            List<VibState> byEnergy = sortedByEnergy(v.getStates());
            for (int i = 0; i < Math.min(SUMMARY_STATES, byEnergy.size()); i++) {
                VibState s = byEnergy.get(i);
                System.out.println("  v=" + Arrays.toString(s.quantumNumbers()) + " E="
                        + fmt5(s.getEnergy()) + " |c|^2=" + fmt5(s.getOverlap()));
            }
        }

        if (result.hasSeries()) {
            RsptSeries series = result.getSeries();
            List<BigDecimal> sums = series.partialSums();
            System.out.println("=== 摂動級数（q=" + series.getTargetIndex() + ", v="
                    + Arrays.toString(series.getQuantumNumbers()) + "） ===");
            System.out.println("  E(0)=" + fmt5(series.getZeroOrderEnergy()) + ", 部分和(次数="
                    + series.order() + ")=" + fmt5(sums.get(sums.size() - 1).doubleValue()));
        }
    }

    private static List<VibState> sortedByEnergy(List<VibState> states) {
        VibState[] sorted = states.toArray(new VibState[0]);
        Arrays.sort(sorted, (a, b) -> Double.compare(a.getEnergy(), b.getEnergy()));
        return Arrays.asList(sorted);
    }

    private static double[] toArray(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new IllegalStateException("shift.frequency-shifts に null が含まれています");
            }
            out[i] = v;
        }
        return out;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}

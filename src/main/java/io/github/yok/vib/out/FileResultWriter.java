package io.github.yok.vib.out;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderState;
import io.github.yok.vib.core.series.RsptSeries;
import io.github.yok.vib.core.solver.CalculationResult;
import io.github.yok.vib.core.solver.VariationalSolver.VariationalResult;
import io.github.yok.vib.core.solver.VibState;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果をファイルに出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（Emax はエネルギー上限、q は摂動級数の対象状態）。
 * </p>
 *
 * <ul>
 * <li>{@code vib_zeroOrder_Emax=13000.00.txt}（ゼロ次基底、固定幅テキスト）</li>
 * <li>{@code vib_variational_Emax=13000.00.txt}（変分計算の状態、固定幅テキスト）</li>
 * <li>{@code vib_rspt_q=0_Emax=13000.00.csv}（摂動係数と部分和）</li>
 * <li>{@code vib_meta_Emax=13000.00.csv}（状態数、E0 などの補助情報）</li>
 * </ul>
 *
 * <p>
 * 固定幅テキストは 1 行 1 状態で、量子数を {@code %4d}、エネルギーを {@code %24.16f} で並べます。
 * </p>
 */
@Slf4j
public final class FileResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "vib";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * ファイル出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public FileResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 計算結果を出力します。
     *
     * @param result 計算結果です
     * @param energyCutoff 列挙に使ったエネルギー上限 Emax です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(CalculationResult result, double energyCutoff) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (!Double.isFinite(energyCutoff)) {
            throw new IllegalArgumentException("Emax は有限値を指定してください: " + energyCutoff);
        }

        try {
            Files.createDirectories(outputDir);

            // 1) ゼロ次基底（シフト前）
            writeZeroOrderBasis(result.getUnshiftedBasis(), energyCutoff);

            // 2) 変分計算の状態
            if (result.hasVariational()) {
                writeVariationalStates(result.getVariational(), energyCutoff);
            }

            // 3) 摂動級数
            if (result.hasSeries()) {
                writeSeriesCsv(result.getSeries(), energyCutoff);
            }

            // 4) メタ
            writeMetaCsv(result, energyCutoff);

        } catch (IOException e) {
            throw new IllegalStateException("結果の出力に失敗しました: " + outputDir, e);
        }
        log.info("結果を出力しました。dir={}", outputDir.toAbsolutePath());
    }

    /**
     * ゼロ次基底を固定幅テキストで出力します。
     *
     * @param basis ゼロ次基底です
     * @param energyCutoff エネルギー上限です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeZeroOrderBasis(ZeroOrderBasis basis, double energyCutoff)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("zeroOrder", energyCutoff, "txt"));
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (ZeroOrderState s : basis) {
                w.write(formatRow(s.quantumNumbers(), s.getEnergy()));
                w.newLine();
            }
        }
    }

    /**
     * 変分計算の状態を固定幅テキストで出力します。
     *
     * @param variational 変分計算の結果です
     * @param energyCutoff エネルギー上限です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeVariationalStates(VariationalResult variational, double energyCutoff)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("variational", energyCutoff, "txt"));
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (VibState s : variational.getStates()) {
                w.write(formatRow(s.quantumNumbers(), s.getEnergy()));
                w.newLine();
            }
        }
    }

    /**
     * 摂動係数と部分和を CSV で出力します。
     *
     * @param series 摂動級数です
     * @param energyCutoff エネルギー上限です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSeriesCsv(RsptSeries series, double energyCutoff) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_rspt_q=" + series.getTargetIndex() + "_Emax="
                + formatEmax(energyCutoff) + ".csv");

        List<BigDecimal> coefficients = series.getCoefficients();
        List<BigDecimal> partialSums = series.partialSums();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("order", "coefficient", "partialSum").build().print(w)) {

            for (int k = 0; k < coefficients.size(); k++) {
                pr.printRecord(k, coefficients.get(k), partialSums.get(k));
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param result 計算結果です
     * @param energyCutoff エネルギー上限です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(CalculationResult result, double energyCutoff) throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", energyCutoff, "csv"));
        ZeroOrderBasis basis = result.getBasis();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.Emax", energyCutoff);
            pr.printRecord("modeCount", basis.modeCount());
            pr.printRecord("basisSize", basis.size());
            pr.printRecord("maxQuantumNumber", basis.maxQuantumNumber());

            if (result.hasVariational()) {
                VariationalResult v = result.getVariational();
                pr.printRecord("variational.E0", v.getReferenceEnergy());
                pr.printRecord("variational.contestedAssignments", v.getContestedAssignments());
            }
            if (result.hasSeries()) {
                RsptSeries s = result.getSeries();
                pr.printRecord("rspt.targetState", s.getTargetIndex());
                pr.printRecord("rspt.zeroOrderEnergy", s.getZeroOrderEnergy());
                pr.printRecord("rspt.order", s.order());
                pr.printRecord("rspt.precisionDigits", s.getPrecisionDigits());
            }
        }
    }

    /**
     * 量子数とエネルギーを固定幅の 1 行に整形します。
     *
     * @param quantumNumbers 量子数の組です
     * @param energy エネルギーです
     * @return 整形した行です
     */
    static String formatRow(int[] quantumNumbers, double energy) {
        StringBuilder sb = new StringBuilder(quantumNumbers.length * 4 + 24);
        for (int v : quantumNumbers) {
            sb.append(String.format(Locale.ROOT, "%4d", v));
        }
        sb.append(String.format(Locale.ROOT, "%24.16f", energy));
        return sb.toString();
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code vib_zeroOrder_Emax=13000.00.txt}
     * </p>
     *
     * @param kind 出力の識別子（zeroOrder/variational/meta）
     * @param energyCutoff エネルギー上限です
     * @param extension 拡張子です
     * @return ファイル名です
     */
    private static String buildFileName(String kind, double energyCutoff, String extension) {
        return FILE_HEAD + "_" + kind + "_Emax=" + formatEmax(energyCutoff) + "." + extension;
    }

    /**
     * Emax を小数点以下2桁に整形します（ファイル名用）。
     *
     * @param energyCutoff エネルギー上限です
     * @return 整形文字列（例: 13000.00）
     */
    private static String formatEmax(double energyCutoff) {
        return String.format(Locale.ROOT, "%.2f", energyCutoff);
    }
}

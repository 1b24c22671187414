package io.github.yok.vib.input;

import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.potential.AnharmonicTerm;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

/**
 * 分子の入力表（調和振動数と非調和係数）を読み込むクラスです。
 *
 * <p>
 * どちらの表も空白区切りのテキストです。 空行と {@code #} で始まる行は読み飛ばします。
 * </p>
 * <ul>
 * <li>振動数表: 1 行 1 モード、先頭列が振動数です。</li>
 * <li>係数表: 1 行 1 単項式、先頭 M 列がべき指数、最後の列が係数です。 M は先頭行の列数 - 1 で決まり、以降の行も同じ列数が必要です。</li>
 * </ul>
 */
@Slf4j
public final class MolecularInputReader {

    /**
     * 振動数表を読み込みます。
     *
     * @param resource 振動数表です
     * @return 振動数の配列です
     * @throws IllegalArgumentException 表の形式が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public double[] readFrequencies(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource は null 不可です");
        }
        try (Reader r = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return parseFrequencies(r, resource.getDescription());
        } catch (IOException e) {
            throw new IllegalStateException("振動数表の読み込みに失敗しました: " + resource.getDescription(), e);
        }
    }

    /**
     * 振動数表を読み込みます。
     *
     * @param file 振動数表のパスです
     * @return 振動数の配列です
     * @throws IllegalArgumentException 表の形式が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public double[] readFrequencies(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseFrequencies(r, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("振動数表の読み込みに失敗しました: " + file, e);
        }
    }

    /**
     * 係数表を読み込みます。
     *
     * @param resource 係数表です
     * @return 非調和ポテンシャルです
     * @throws IllegalArgumentException 表の形式が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public AnharmonicPotential readAnharmonicPotential(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource は null 不可です");
        }
        try (Reader r = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return parsePotential(r, resource.getDescription());
        } catch (IOException e) {
            throw new IllegalStateException("係数表の読み込みに失敗しました: " + resource.getDescription(), e);
        }
    }

    /**
     * 係数表を読み込みます。
     *
     * @param file 係数表のパスです
     * @return 非調和ポテンシャルです
     * @throws IllegalArgumentException 表の形式が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public AnharmonicPotential readAnharmonicPotential(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parsePotential(r, file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("係数表の読み込みに失敗しました: " + file, e);
        }
    }

    private double[] parseFrequencies(Reader reader, String source) throws IOException {
        List<String[]> rows = readRows(reader);
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("振動数表が空です: " + source);
        }
        double[] frequencies = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            frequencies[i] = parseDouble(rows.get(i)[0], source, i + 1);
        }
        log.info("振動数表を読み込みました。source={}、モード数={}", source, frequencies.length);
        return frequencies;
    }

    private AnharmonicPotential parsePotential(Reader reader, String source) throws IOException {
        List<String[]> rows = readRows(reader);
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("係数表が空です: " + source);
        }
        int columns = rows.get(0).length;
        int modeCount = columns - 1;
        if (modeCount < 1) {
            throw new IllegalArgumentException("係数表は 2 列以上が必要です: " + source);
        }

        List<AnharmonicTerm> terms = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (row.length != columns) {
                throw new IllegalArgumentException("係数表の列数が一致しません: " + source + "のデータ行 "
                        + (i + 1) + "（" + row.length + " 列、期待値 " + columns + " 列）");
            }
            int[] powers = new int[modeCount];
            for (int m = 0; m < modeCount; m++) {
                powers[m] = parsePower(row[m], source, i + 1);
            }
            terms.add(new AnharmonicTerm(powers, parseDouble(row[modeCount], source, i + 1)));
        }
        log.info("係数表を読み込みました。source={}、モード数={}、単項式数={}", source, modeCount, terms.size());
        return new AnharmonicPotential(modeCount, terms);
    }

    private static List<String[]> readRows(Reader reader) throws IOException {
        List<String[]> rows = new ArrayList<>();
        BufferedReader br = new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            rows.add(trimmed.split("\\s+"));
        }
        return rows;
    }

    private static double parseDouble(String token, String source, int line) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("数値として解釈できません: '" + token + "'（" + source
                    + "のデータ行 " + line + "）", e);
        }
    }

    /**
     * べき指数を読み込みます（{@code 3} と {@code 3.0} のどちらも受け付けます）。
     */
    private static int parsePower(String token, String source, int line) {
        double value = parseDouble(token, source, line);
        if (value < 0 || value != Math.rint(value) || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("べき指数は 0 以上の整数が必要です: '" + token + "'（"
                    + source + "のデータ行 " + line + "）");
        }
        return (int) value;
    }
}

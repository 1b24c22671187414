package io.github.yok.vib.core.series;

import static com.google.common.base.Preconditions.checkArgument;
import io.github.yok.vib.core.basis.ZeroOrderBasis;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 摂動行列 W とゼロ次エネルギーから、1 つの対象状態 q の Rayleigh–Schrödinger 摂動係数を漸化式で求めるクラスです。
 *
 * <p>
 * エネルギー分母 {@code E_d[i] = 1/(E_q - E_i)}（{@code E_d[q] = 0}）を用い、中間規格化のもとで次を計算します。
 * </p>
 * <ul>
 * <li>{@code e_0 = W[q,q]}</li>
 * <li>{@code psi_1 = E_d ∘ W[q,:]}、 {@code e_1 = psi_1 · W[q,:]}</li>
 * <li>{@code psi_n = E_d ∘ (psi_{n-1} W - Σ_{k=1}^{n-1} e_{k-1} psi_{n-k})}、
 * {@code e_n = psi_n · W[q,:]}（n = 2..Nmax-1）</li>
 * </ul>
 *
 * <p>
 * 発散する級数では係数が階乗的に増え、桁落ちが静かに蓄積するため、 W と E の変換以降の演算はすべて指定桁数の {@link BigDecimal} で行います。
 * 対角の自己項は {@code E_d[q] = 0} によって除かれ、ループ内で分岐しません。
 * </p>
 */
@Slf4j
public final class RsptSeriesGenerator {

    /**
     * 既定の有効桁数です。
     */
    public static final int DEFAULT_PRECISION_DIGITS = 50;

    /**
     * 有効桁数です。
     */
    @Getter
    private final int precisionDigits;

    private final MathContext mc;

    /**
     * 既定の有効桁数（50 桁）で生成します。
     */
    public RsptSeriesGenerator() {
        this(DEFAULT_PRECISION_DIGITS);
    }

    /**
     * 有効桁数を指定して生成します。
     *
     * @param precisionDigits 有効桁数です（1 以上）
     * @throws IllegalArgumentException precisionDigits が 1 未満の場合に発生します
     */
    public RsptSeriesGenerator(int precisionDigits) {
        checkArgument(precisionDigits > 0, "precisionDigits は 1 以上が必要です: %s", precisionDigits);
        this.precisionDigits = precisionDigits;
        this.mc = new MathContext(precisionDigits, RoundingMode.HALF_EVEN);
    }

    /**
     * 対象状態 q の摂動係数 e_0 .. e_{order-1} を返します。
     *
     * @param target 対象状態の基底番号 q です（0 以上 N 未満）
     * @param basis ゼロ次基底です（ゼロ次エネルギーの供給元）
     * @param perturbation 摂動行列 W です（N×N、対角にゼロ次エネルギーを含まない）
     * @param order 係数の数 Nmax です（2 以上）
     * @return 摂動級数です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 対象状態と厳密に縮退した状態があり分母が 0 になる場合に発生します
     */
    public RsptSeries series(int target, ZeroOrderBasis basis, DMatrixRMaj perturbation,
            int order) {
        checkArgument(basis != null, "basis は null 不可です");
        checkArgument(perturbation != null, "perturbation は null 不可です");
        int n = basis.size();
        checkArgument(perturbation.numRows == n && perturbation.numCols == n,
                "行列の次元と基底の状態数が一致しません: %sx%s vs %s", perturbation.numRows,
                perturbation.numCols, n);
        checkArgument(target >= 0 && target < n, "対象状態の番号が範囲外です: %s（N=%s）", target, n);
        checkArgument(order >= 2, "order は 2 以上が必要です: %s", order);

        long t0 = System.nanoTime();
        double[] energies = basis.energies();
        double eq = energies[target];

        // エネルギー分母（E_d[q] = 0）
        BigDecimal[] denominators = new BigDecimal[n];
        BigDecimal eqBig = new BigDecimal(eq);
        for (int i = 0; i < n; i++) {
            if (i == target) {
                denominators[i] = BigDecimal.ZERO;
                continue;
            }
            if (energies[i] == eq) {
                throw new IllegalStateException("対象状態と縮退したゼロ次状態があるため分母が 0 になります: q=" + target
                        + "、i=" + i + "、E=" + eq + "。周波数シフトで縮退を解いてください");
            }
            denominators[i] = BigDecimal.ONE.divide(eqBig.subtract(new BigDecimal(energies[i]), mc),
                    mc);
        }

        SparseRows rows = SparseRows.of(perturbation);
        BigDecimal[] wq = rows.denseRow(target, n);

        List<BigDecimal> coefficients = new ArrayList<>(order);
        List<BigDecimal[]> psis = new ArrayList<>(order);

        coefficients.add(wq[target]);

        BigDecimal[] psi1 = new BigDecimal[n];
        for (int i = 0; i < n; i++) {
            psi1[i] = wq[i].multiply(denominators[i], mc);
        }
        psis.add(psi1);
        coefficients.add(dot(psi1, wq));

        for (int k = 2; k < order; k++) {
            BigDecimal[] previous = psis.get(k - 2);
            BigDecimal[] product = rows.leftMultiply(previous, mc);

            // Σ_{j=1}^{k-1} E^(j) psi_{k-j}
            BigDecimal[] accumulated = zeros(n);
            for (int j = 1; j < k; j++) {
                BigDecimal ej = coefficients.get(j - 1);
                if (ej.signum() == 0) {
                    continue;
                }
                BigDecimal[] psi = psis.get(k - j - 1);
                for (int i = 0; i < n; i++) {
                    if (psi[i].signum() != 0) {
                        accumulated[i] = accumulated[i].add(ej.multiply(psi[i], mc), mc);
                    }
                }
            }

            BigDecimal[] next = new BigDecimal[n];
            for (int i = 0; i < n; i++) {
                next[i] = denominators[i].multiply(product[i].subtract(accumulated[i], mc), mc);
            }
            psis.add(next);
            coefficients.add(dot(next, wq));
        }

        warnIfGrowing(target, coefficients);
        log.info("摂動級数を生成しました。q={}、N={}、次数={}、有効桁数={}、所要時間={}ms", target, n, order,
                precisionDigits, (System.nanoTime() - t0) / 1_000_000L);

        return new RsptSeries(target, basis.get(target).quantumNumbers(), eq, coefficients,
                precisionDigits);
    }

    private BigDecimal dot(BigDecimal[] a, BigDecimal[] b) {
        BigDecimal s = BigDecimal.ZERO;
        for (int i = 0; i < a.length; i++) {
            if (a[i].signum() != 0 && b[i].signum() != 0) {
                s = s.add(a[i].multiply(b[i], mc), mc);
            }
        }
        return s;
    }

    private static BigDecimal[] zeros(int n) {
        BigDecimal[] z = new BigDecimal[n];
        for (int i = 0; i < n; i++) {
            z[i] = BigDecimal.ZERO;
        }
        return z;
    }

    /**
     * 末尾の係数の絶対値が単調に増え続けている場合に警告します（発散の兆候）。
     *
     * @param target 対象状態の基底番号です
     * @param coefficients 係数列です
     */
    private void warnIfGrowing(int target, List<BigDecimal> coefficients) {
        int size = coefficients.size();
        if (size < 4) {
            return;
        }
        for (int k = size - 3; k < size; k++) {
            if (coefficients.get(k).abs().compareTo(coefficients.get(k - 1).abs()) <= 0) {
                return;
            }
        }
        log.warn("摂動係数の絶対値が増え続けています（発散級数の可能性）。q={}、|e_{}|={}。総和法を用いる場合は有効桁数 {} が十分か確認してください",
                target, size - 1, coefficients.get(size - 1).abs().round(new MathContext(6)),
                precisionDigits);
    }

    /**
     * W の非零要素を行ごとに {@link BigDecimal} で保持するクラスです。
     */
    private static final class SparseRows {

        private final int[][] columns;

        private final BigDecimal[][] values;

        private SparseRows(int[][] columns, BigDecimal[][] values) {
            this.columns = columns;
            this.values = values;
        }

        static SparseRows of(DMatrixRMaj w) {
            int n = w.numRows;
            int[][] columns = new int[n][];
            BigDecimal[][] values = new BigDecimal[n][];
            for (int r = 0; r < n; r++) {
                int count = 0;
                for (int c = 0; c < n; c++) {
                    if (w.unsafe_get(r, c) != 0.0) {
                        count++;
                    }
                }
                columns[r] = new int[count];
                values[r] = new BigDecimal[count];
                int p = 0;
                for (int c = 0; c < n; c++) {
                    double x = w.unsafe_get(r, c);
                    if (x != 0.0) {
                        columns[r][p] = c;
                        values[r][p] = new BigDecimal(x);
                        p++;
                    }
                }
            }
            return new SparseRows(columns, values);
        }

        BigDecimal[] denseRow(int r, int n) {
            BigDecimal[] row = zeros(n);
            for (int p = 0; p < columns[r].length; p++) {
                row[columns[r][p]] = values[r][p];
            }
            return row;
        }

        /**
         * 行ベクトルと W の積 x·W を返します。
         */
        BigDecimal[] leftMultiply(BigDecimal[] x, MathContext mc) {
            BigDecimal[] out = zeros(x.length);
            for (int r = 0; r < x.length; r++) {
                if (x[r].signum() == 0) {
                    continue;
                }
                int[] cols = columns[r];
                BigDecimal[] vals = values[r];
                for (int p = 0; p < cols.length; p++) {
                    out[cols[p]] = out[cols[p]].add(x[r].multiply(vals[p], mc), mc);
                }
            }
            return out;
        }
    }
}

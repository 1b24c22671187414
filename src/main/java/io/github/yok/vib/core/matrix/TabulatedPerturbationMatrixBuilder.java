package io.github.yok.vib.core.matrix;

import static com.google.common.base.Preconditions.checkArgument;
import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.harmonic.HarmonicWeightTable;
import io.github.yok.vib.core.harmonic.HarmonicWeightTableCache;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 前計算した重み表を引いて摂動行列 W を組み立てる本番用の実装です。
 *
 * <p>
 * モードごとに N×N の {@code |v_i(row) - v_i(col)|} と {@code max(v_i(row), v_i(col))} を前計算し、 上三角 (i ≤ j)
 * の各要素について全単項式の寄与 k · Π_m weight(ik_m, dv_m, v_m) を足し合わせます。 いずれかのモードで重みが厳密に 0
 * の単項式はその場で打ち切ります。 最後に上三角を下三角へ写すため、W は厳密に対称です。
 * </p>
 *
 * <p>
 * 行単位で並列化します。 行 i が書き込むのは (i, j) と (j, i)（j ≥ i）だけなので、スレッド間で書き込み先は重なりません。
 * 各行の開始時に中断要求を確認し、要求があれば {@link CancellationException} で打ち切ります。
 * </p>
 */
@Slf4j
public final class TabulatedPerturbationMatrixBuilder implements PerturbationMatrixBuilder {

    /**
     * 進捗を DEBUG 出力する行間隔です。
     */
    private static final int PROGRESS_INTERVAL = 1000;

    /**
     * 重み表のキャッシュです。
     */
    private final HarmonicWeightTableCache tableCache;

    /**
     * 並列度（ワーカースレッド数）です。
     */
    @Getter
    private final int parallelism;

    /**
     * 中断要求の有無を返す関数です。
     */
    private final BooleanSupplier cancellationRequested;

    /**
     * 中断なしで組み立てる実装を生成します。
     *
     * @param tableCache 重み表のキャッシュです（null 不可）
     * @param parallelism 並列度です（1 以上）
     */
    public TabulatedPerturbationMatrixBuilder(HarmonicWeightTableCache tableCache,
            int parallelism) {
        this(tableCache, parallelism, () -> false);
    }

    /**
     * 実装を生成します。
     *
     * @param tableCache 重み表のキャッシュです（null 不可）
     * @param parallelism 並列度です（1 以上）
     * @param cancellationRequested 中断要求の有無を返す関数です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public TabulatedPerturbationMatrixBuilder(HarmonicWeightTableCache tableCache,
            int parallelism, BooleanSupplier cancellationRequested) {
        checkArgument(tableCache != null, "tableCache は null 不可です");
        checkArgument(parallelism > 0, "parallelism は 1 以上が必要です: %s", parallelism);
        this.tableCache = tableCache;
        this.parallelism = parallelism;
        checkArgument(cancellationRequested != null, "cancellationRequested は null 不可です");
        this.cancellationRequested = cancellationRequested;
    }

    /**
     * N×N の実対称な摂動行列 W を組み立てて返します。
     *
     * @param potential 非調和ポテンシャルです
     * @param basis ゼロ次基底です（空は不可）
     * @return 摂動行列です
     * @throws IllegalArgumentException モード数が一致しない場合などに発生します
     * @throws IllegalStateException 基底が空の場合、または並列実行に失敗した場合に発生します
     * @throws CancellationException 中断要求を受けた場合に発生します
     */
    @Override
    public DMatrixRMaj build(AnharmonicPotential potential, ZeroOrderBasis basis) {
        AssemblyInputs inputs = AssemblyInputs.prepare(potential, basis);

        long t0 = System.nanoTime();
        int n = basis.size();
        int modeCount = basis.modeCount();

        HarmonicWeightTable table =
                tableCache.get(basis.maxQuantumNumber(), Math.max(0, potential.maxPower()));

        // モードごとの dv と v（N×N、行優先）
        int[][] dv = new int[modeCount][n * n];
        int[][] vmax = new int[modeCount][n * n];
        for (int mode = 0; mode < modeCount; mode++) {
            int[] q = new int[n];
            for (int i = 0; i < n; i++) {
                q[i] = basis.get(i).quantumNumber(mode);
            }
            int[] dvMode = dv[mode];
            int[] vMode = vmax[mode];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    dvMode[i * n + j] = Math.abs(q[i] - q[j]);
                    vMode[i * n + j] = Math.max(q[i], q[j]);
                }
            }
        }

        DMatrixRMaj w = new DMatrixRMaj(n, n);
        RowAssembler rows = new RowAssembler(n, modeCount, inputs, table, dv, vmax, w.data);

        if (parallelism == 1) {
            for (int row = 0; row < n; row++) {
                assembleRow(rows, row, n);
            }
        } else {
            ForkJoinPool pool = new ForkJoinPool(parallelism);
            try {
                pool.submit(() -> IntStream.range(0, n).parallel()
                        .forEach(row -> assembleRow(rows, row, n))).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("摂動行列の組み立て中に割り込まれました");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("摂動行列の組み立てに失敗しました", cause);
            } finally {
                pool.shutdown();
            }
        }

        log.info("摂動行列を組み立てました（表引き）。N={}、単項式数={}、非零要素数={}、並列度={}、所要時間={}ms", n,
                inputs.termCount(), countNonZero(w), parallelism,
                (System.nanoTime() - t0) / 1_000_000L);
        return w;
    }

    private void assembleRow(RowAssembler rows, int row, int n) {
        if (cancellationRequested.getAsBoolean()) {
            throw new CancellationException("摂動行列の組み立てを中断しました: row=" + row);
        }
        rows.assemble(row);
        if (log.isDebugEnabled() && (row + 1) % PROGRESS_INTERVAL == 0) {
            log.debug("摂動行列の組み立て中です。行={}/{}", row + 1, n);
        }
    }

    /**
     * 非零要素数を数えます。
     *
     * @param w 行列です
     * @return 非零要素数です
     */
    static int countNonZero(DMatrixRMaj w) {
        int count = 0;
        for (int i = 0; i < w.getNumElements(); i++) {
            if (w.data[i] != 0.0) {
                count++;
            }
        }
        return count;
    }

    /**
     * 1 行分（上三角部分）を計算して、対称位置にも書き込むクラスです。
     */
    private static final class RowAssembler {

        private final int n;

        private final int modeCount;

        private final int[][] powers;

        private final double[] coefficients;

        private final HarmonicWeightTable table;

        private final int[][] dv;

        private final int[][] vmax;

        private final double[] out;

        RowAssembler(int n, int modeCount, AssemblyInputs inputs, HarmonicWeightTable table,
                int[][] dv, int[][] vmax, double[] out) {
            this.n = n;
            this.modeCount = modeCount;
            this.powers = inputs.powers;
            this.coefficients = inputs.coefficients;
            this.table = table;
            this.dv = dv;
            this.vmax = vmax;
            this.out = out;
        }

        void assemble(int row) {
            for (int col = row; col < n; col++) {
                int cell = row * n + col;
                double sum = 0.0;
                for (int t = 0; t < coefficients.length; t++) {
                    int[] p = powers[t];
                    double product = coefficients[t];
                    for (int mode = 0; mode < modeCount; mode++) {
                        int d = dv[mode][cell];
                        if (table.isZero(p[mode], d)) {
                            product = 0.0;
                            break;
                        }
                        product *= table.weight(p[mode], d, vmax[mode][cell]);
                    }
                    if (product != 0.0) {
                        sum += product;
                    }
                }
                out[cell] = sum;
                out[col * n + row] = sum;
            }
        }
    }
}

package io.github.yok.vib.core.harmonic;

import static com.google.common.base.Preconditions.checkArgument;
import lombok.Getter;

/**
 * 調和振動子の行列要素の重みを (n, dv, v) で前計算した表です。
 *
 * <p>
 * 行列組み立ての O(N²·K·M) ループで同じ閉形式を繰り返し評価しないためのメモ化層です。 構築後は読み取り専用のため、
 * 複数スレッドから共有できます。
 * </p>
 */
@Getter
public final class HarmonicWeightTable {

    /**
     * 表に含める最大次数です（8 を超える指定は 8 に切り詰めます）。
     */
    private final int maxOrder;

    /**
     * 表に含める量子数の最大値です。
     */
    private final int maxQuantumNumber;

    /**
     * weights[n][dv][v] です。零要素の (n, dv) は null のままにします。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final double[][][] weights;

    private HarmonicWeightTable(int maxOrder, int maxQuantumNumber, double[][][] weights) {
        this.maxOrder = maxOrder;
        this.maxQuantumNumber = maxQuantumNumber;
        this.weights = weights;
    }

    /**
     * 表を構築します。
     *
     * @param maxQuantumNumber 量子数の最大値です（0 以上）
     * @param maxOrder 次数の最大値です（0 以上。8 を超える次数は常に 0 です）
     * @return 構築した表です
     * @throws IllegalArgumentException 引数が負の場合に発生します
     */
    public static HarmonicWeightTable build(int maxQuantumNumber, int maxOrder) {
        checkArgument(maxQuantumNumber >= 0, "maxQuantumNumber は 0 以上が必要です: %s",
                maxQuantumNumber);
        checkArgument(maxOrder >= 0, "maxOrder は 0 以上が必要です: %s", maxOrder);

        int nmax = Math.min(maxOrder, HarmonicMatrixElements.MAX_ORDER);
        double[][][] weights = new double[nmax + 1][nmax + 1][];

        for (int n = 0; n <= nmax; n++) {
            // dv は n と同じ偶奇のみ非零です。
            for (int dv = n % 2; dv <= n; dv += 2) {
                double[] row = new double[maxQuantumNumber + 1];
                for (int v = 0; v <= maxQuantumNumber; v++) {
                    row[v] = HarmonicMatrixElements.weight(n, dv, v);
                }
                weights[n][dv] = row;
            }
        }
        return new HarmonicWeightTable(nmax, maxQuantumNumber, weights);
    }

    /**
     * 行列要素が厳密に 0 となるかどうかを返します。
     *
     * @param n 次数です
     * @param dv 量子数の差の絶対値です
     * @return 厳密に 0 の場合は true です
     */
    public boolean isZero(int n, int dv) {
        return HarmonicMatrixElements.isZero(n, dv);
    }

    /**
     * 重みを返します。
     *
     * <p>
     * 零要素は 0 を返します。 n または v が表の範囲外の場合は閉形式で直接評価します。
     * </p>
     *
     * @param n 次数です
     * @param dv 量子数の差の絶対値です
     * @param v 量子数の大きい方です
     * @return 重みです
     */
    public double weight(int n, int dv, int v) {
        if (isZero(n, dv)) {
            return 0.0;
        }
        if (n > maxOrder || v > maxQuantumNumber) {
            return HarmonicMatrixElements.weight(n, dv, v);
        }
        return weights[n][dv][v];
    }

    /**
     * 非零な (n, dv, v) の要素数を返します。
     *
     * @return 要素数です
     */
    public int size() {
        int count = 0;
        for (double[][] byDv : weights) {
            for (double[] row : byDv) {
                if (row != null) {
                    count += row.length;
                }
            }
        }
        return count;
    }
}

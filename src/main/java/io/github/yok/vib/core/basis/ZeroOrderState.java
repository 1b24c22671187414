package io.github.yok.vib.core.basis;

import java.util.Arrays;
import lombok.Getter;

/**
 * ゼロ次近似（調和振動子の直積）の状態を表すクラスです。
 *
 * <p>
 * 同一性は量子数の組 (v1, ..., vM) で決まります。 エネルギーは量子数（と周波数シフト）から決まる派生値です。
 * </p>
 */
public final class ZeroOrderState {

    /**
     * 基底内の位置です（0 始まり、密な番号）。
     */
    @Getter
    private final int index;

    /**
     * 量子数の組です。
     */
    private final int[] quantumNumbers;

    /**
     * ゼロ次エネルギーです。
     */
    @Getter
    private final double energy;

    /**
     * 状態を生成します。
     *
     * @param index 基底内の位置です（0 以上）
     * @param quantumNumbers 量子数の組です（null 不可、各要素 0 以上）
     * @param energy ゼロ次エネルギーです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ZeroOrderState(int index, int[] quantumNumbers, double energy) {
        if (index < 0) {
            throw new IllegalArgumentException("index は 0 以上が必要です: " + index);
        }
        if (quantumNumbers == null || quantumNumbers.length == 0) {
            throw new IllegalArgumentException("quantumNumbers は 1 要素以上が必要です");
        }
        for (int v : quantumNumbers) {
            if (v < 0) {
                throw new IllegalArgumentException(
                        "量子数は 0 以上が必要です: " + Arrays.toString(quantumNumbers));
            }
        }
        this.index = index;
        this.quantumNumbers = quantumNumbers.clone();
        this.energy = energy;
    }

    /**
     * モード数 M を返します。
     *
     * @return モード数です
     */
    public int modeCount() {
        return quantumNumbers.length;
    }

    /**
     * 指定モードの量子数を返します。
     *
     * @param mode モード番号です（0 以上 M 未満）
     * @return 量子数です
     */
    public int quantumNumber(int mode) {
        return quantumNumbers[mode];
    }

    /**
     * 量子数の組の複製を返します。
     *
     * @return 量子数の組です
     */
    public int[] quantumNumbers() {
        return quantumNumbers.clone();
    }

    /**
     * 量子数の最大値を返します。
     *
     * @return 量子数の最大値です
     */
    public int maxQuantumNumber() {
        int max = 0;
        for (int v : quantumNumbers) {
            max = Math.max(max, v);
        }
        return max;
    }

    /**
     * 番号を付け替えた状態を返します。
     *
     * @param newIndex 新しい番号です
     * @return 新しい状態です
     */
    public ZeroOrderState withIndex(int newIndex) {
        return new ZeroOrderState(newIndex, quantumNumbers, energy);
    }

    /**
     * エネルギーを置き換えた状態を返します。
     *
     * @param newEnergy 新しいエネルギーです
     * @return 新しい状態です
     */
    public ZeroOrderState withEnergy(double newEnergy) {
        return new ZeroOrderState(index, quantumNumbers, newEnergy);
    }

    /**
     * 量子数の組を辞書順で比較します。
     *
     * @param other 比較対象です
     * @return 比較結果です
     */
    public int compareQuantumNumbers(ZeroOrderState other) {
        return Arrays.compare(quantumNumbers, other.quantumNumbers);
    }

    @Override
    public String toString() {
        return "ZeroOrderState(index=" + index + ", v=" + Arrays.toString(quantumNumbers)
                + ", energy=" + energy + ")";
    }
}

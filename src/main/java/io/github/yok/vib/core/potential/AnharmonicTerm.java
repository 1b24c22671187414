package io.github.yok.vib.core.potential;

import java.util.Arrays;

/**
 * ポテンシャル展開の 1 つの単項式 k · q1^ik1 · q2^ik2 · ... · qM^ikM を表すクラスです。
 */
public final class AnharmonicTerm {

    /**
     * モードごとのべき指数です。
     */
    private final int[] powers;

    /**
     * 係数 k です。
     */
    private final double coefficient;

    /**
     * 単項式を生成します。
     *
     * @param powers モードごとのべき指数です（null 不可、各要素 0 以上）
     * @param coefficient 係数です（有限値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public AnharmonicTerm(int[] powers, double coefficient) {
        if (powers == null || powers.length == 0) {
            throw new IllegalArgumentException("powers は 1 要素以上が必要です");
        }
        for (int p : powers) {
            if (p < 0) {
                throw new IllegalArgumentException("べき指数は 0 以上が必要です: " + Arrays.toString(powers));
            }
        }
        if (!Double.isFinite(coefficient)) {
            throw new IllegalArgumentException("係数は有限値が必要です: " + coefficient);
        }
        this.powers = powers.clone();
        this.coefficient = coefficient;
    }

    /**
     * 便宜的な生成メソッドです。
     *
     * @param coefficient 係数です
     * @param powers モードごとのべき指数です
     * @return 単項式です
     */
    public static AnharmonicTerm of(double coefficient, int... powers) {
        return new AnharmonicTerm(powers, coefficient);
    }

    /**
     * モード数 M を返します。
     *
     * @return モード数です
     */
    public int modeCount() {
        return powers.length;
    }

    /**
     * 指定モードのべき指数を返します。
     *
     * @param mode モード番号です
     * @return べき指数です
     */
    public int power(int mode) {
        return powers[mode];
    }

    /**
     * べき指数の複製を返します。
     *
     * @return べき指数です
     */
    public int[] powers() {
        return powers.clone();
    }

    /**
     * 係数を返します。
     *
     * @return 係数です
     */
    public double coefficient() {
        return coefficient;
    }

    /**
     * べき指数の最大値（この項が要求する行列要素の最大次数）を返します。
     *
     * @return 最大次数です
     */
    public int maxPower() {
        int max = 0;
        for (int p : powers) {
            max = Math.max(max, p);
        }
        return max;
    }

    @Override
    public String toString() {
        return "AnharmonicTerm(powers=" + Arrays.toString(powers) + ", k=" + coefficient + ")";
    }
}

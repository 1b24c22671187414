package io.github.yok.vib.core.harmonic;

/**
 * 1 次元調和振動子の行列要素の「重み」を閉形式で与えるクラスです。
 *
 * <p>
 * 無次元座標 q の n 乗について、量子数 v1, v2 間の行列要素 {@code <v1|q^n|v2>} を、 {@code dv = |v1 - v2|} と
 * {@code v = max(v1, v2)} の関数として返します。 n = 0..8 の各 (n, dv) 分岐は梯子演算子から導かれる固定の式です。
 * </p>
 *
 * <p>
 * {@code dv > n}、{@code (n - dv)} が奇数、または {@code n > 8} のとき要素は厳密に 0 です。 呼び出し側は
 * {@link #isZero(int, int)} で先に枝刈りしてから {@link #weight(int, int, int)} を呼びます。
 * </p>
 */
public final class HarmonicMatrixElements {

    /**
     * 閉形式が用意されている最大の次数です。
     */
    public static final int MAX_ORDER = 8;

    private static final double SQRT2 = Math.sqrt(2.0);

    private HarmonicMatrixElements() {
    }

    /**
     * 行列要素が厳密に 0 となるかどうかを返します。
     *
     * @param n 非調和項の次数です
     * @param dv 量子数の差の絶対値です
     * @return 厳密に 0 の場合は true です
     */
    public static boolean isZero(int n, int dv) {
        return n < 0 || dv < 0 || n > MAX_ORDER || dv > n || ((n - dv) & 1) != 0;
    }

    /**
     * 行列要素の重みを返します。
     *
     * <p>
     * {@link #isZero(int, int)} が true となる組み合わせでは 0 を返します。
     * </p>
     *
     * @param n 非調和項の次数です（0 以上 8 以下で非零）
     * @param dv 量子数の差の絶対値です
     * @param v 量子数の大きい方です
     * @return 行列要素の重みです
     */
    public static double weight(int n, int dv, int v) {
        if (isZero(n, dv)) {
            return 0.0;
        }
        double x = v;
        switch (n) {
            case 0:
                return 1.0;
            case 1:
                return Math.sqrt(x / 2.0);
            case 2:
                return order2(dv, x);
            case 3:
                return order3(dv, x);
            case 4:
                return order4(dv, x);
            case 5:
                return order5(dv, x);
            case 6:
                return order6(dv, x);
            case 7:
                return order7(dv, x);
            default:
                return order8(dv, x);
        }
    }

    private static double order2(int dv, double v) {
        if (dv == 0) {
            return v + 0.5;
        }
        return 0.5 * Math.sqrt(fall(v, 2));
    }

    private static double order3(int dv, double v) {
        if (dv == 1) {
            return 0.75 * SQRT2 * Math.pow(v, 1.5);
        }
        return 0.25 * Math.sqrt(2.0 * fall(v, 3));
    }

    private static double order4(int dv, double v) {
        switch (dv) {
            case 0:
                return 1.5 * v * v + 1.5 * v + 0.75;
            case 2:
                return (v - 0.5) * Math.sqrt(fall(v, 2));
            default:
                return 0.25 * Math.sqrt(fall(v, 4));
        }
    }

    private static double order5(int dv, double v) {
        switch (dv) {
            case 1:
                return (1.25 * v * v + 0.625) * Math.sqrt(2.0 * v);
            case 3:
                return (0.625 * v - 0.625) * Math.sqrt(2.0 * fall(v, 3));
            default:
                return 0.125 * Math.sqrt(2.0 * fall(v, 5));
        }
    }

    private static double order6(int dv, double v) {
        switch (dv) {
            case 0:
                return 0.625 * (2.0 * v + 1.0) * (2.0 * v * v + 2.0 * v + 3.0);
            case 2:
                return 1.875 * (v * v - v + 1.0) * Math.sqrt(fall(v, 2));
            case 4:
                return (0.75 * v - 1.125) * Math.sqrt(fall(v, 4));
            default:
                return 0.125 * Math.sqrt(fall(v, 6));
        }
    }

    private static double order7(int dv, double v) {
        switch (dv) {
            case 1:
                return 2.1875 * (v * v + 2.0) * v * Math.sqrt(2.0 * v);
            case 3:
                return 1.3125 * (v * v - 2.0 * v + 2.0) * Math.sqrt(2.0 * fall(v, 3));
            case 5:
                return 0.4375 * (v - 2.0) * Math.sqrt(2.0 * fall(v, 5));
            default:
                return 0.0625 * Math.sqrt(2.0 * fall(v, 7));
        }
    }

    private static double order8(int dv, double v) {
        switch (dv) {
            case 0:
                return 4.375 * (Math.pow(v, 4) + 2.0 * Math.pow(v, 3) + 5.0 * v * v + 4.0 * v + 1.5);
            case 2:
                return 1.75 * (2.0 * v - 1.0) * (v * v - v + 3.0) * Math.sqrt(fall(v, 2));
            case 4:
                return 0.875 * (2.0 * v * v - 6.0 * v + 7.0) * Math.sqrt(fall(v, 4));
            case 6:
                return (0.5 * v - 1.25) * Math.sqrt(fall(v, 6));
            default:
                return 0.0625 * Math.sqrt(fall(v, 8));
        }
    }

    /**
     * 下降階乗 v (v-1) ... (v-k+1) を返します。
     *
     * <p>
     * v &lt; k のときは因子に 0 を含むため 0 になります（負の平方根は発生しません）。
     * </p>
     *
     * @param v 量子数です
     * @param k 因子の個数です
     * @return 下降階乗です
     */
    private static double fall(double v, int k) {
        double p = 1.0;
        for (int i = 0; i < k; i++) {
            p *= (v - i);
        }
        // v < k では積に 0 が含まれ、符号付きゼロになり得るため正規化します。
        return p > 0.0 ? p : 0.0;
    }
}

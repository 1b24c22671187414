package io.github.yok.vib.core.series;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 1 つの対象状態に対する Rayleigh–Schrödinger 摂動級数の係数列です。
 *
 * <p>
 * {@code coefficients.get(k)} は (k+1) 次のエネルギー補正 E^(k+1) です。 ゼロ次エネルギー E^(0) は
 * {@link #getZeroOrderEnergy()} に別に保持します。
 * </p>
 */
@Value
public class RsptSeries {

    /**
     * 対象状態の基底番号です。
     */
    int targetIndex;

    /**
     * 対象状態の量子数の組です。
     */
    int[] quantumNumbers;

    /**
     * 対象状態のゼロ次エネルギー E^(0) です。
     */
    double zeroOrderEnergy;

    /**
     * 係数 e_0 .. e_{Nmax-1} です（読み取り専用）。
     */
    List<BigDecimal> coefficients;

    /**
     * 計算に使った有効桁数です。
     */
    int precisionDigits;

    /**
     * 係数列を生成します。
     *
     * @param targetIndex 対象状態の基底番号です
     * @param quantumNumbers 対象状態の量子数の組です（複製して保持します）
     * @param zeroOrderEnergy 対象状態のゼロ次エネルギーです
     * @param coefficients 係数 e_0 .. e_{Nmax-1} です（複製して保持します）
     * @param precisionDigits 計算に使った有効桁数です
     */
    public RsptSeries(int targetIndex, int[] quantumNumbers, double zeroOrderEnergy,
            List<BigDecimal> coefficients, int precisionDigits) {
        this.targetIndex = targetIndex;
        this.quantumNumbers = quantumNumbers.clone();
        this.zeroOrderEnergy = zeroOrderEnergy;
        this.coefficients = List.copyOf(coefficients);
        this.precisionDigits = precisionDigits;
    }

    /**
     * 対象状態の量子数の組の複製を返します。
     *
     * @return 量子数の組です
     */
    public int[] getQuantumNumbers() {
        return quantumNumbers.clone();
    }

    /**
     * 係数の数 Nmax を返します。
     *
     * @return 係数の数です
     */
    public int order() {
        return coefficients.size();
    }

    /**
     * 部分和 E^(0) + e_0 + ... + e_m を m = 0..Nmax-1 について返します。
     *
     * <p>
     * 発散級数の総和法（Padé 型近似など）に渡す入力として使います。
     * </p>
     *
     * @return 部分和の列です（読み取り専用）
     */
    public List<BigDecimal> partialSums() {
        MathContext mc = new MathContext(precisionDigits, RoundingMode.HALF_EVEN);
        List<BigDecimal> sums = new ArrayList<>(coefficients.size());
        BigDecimal s = new BigDecimal(zeroOrderEnergy);
        for (BigDecimal e : coefficients) {
            s = s.add(e, mc);
            sums.add(s);
        }
        return Collections.unmodifiableList(sums);
    }

    /**
     * 係数を倍精度に丸めた配列を返します。
     *
     * @return 係数の配列です
     */
    public double[] coefficientsAsDouble() {
        double[] out = new double[coefficients.size()];
        for (int k = 0; k < out.length; k++) {
            out[k] = coefficients.get(k).doubleValue();
        }
        return out;
    }
}

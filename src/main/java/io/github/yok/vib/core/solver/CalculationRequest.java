package io.github.yok.vib.core.solver;

import io.github.yok.vib.core.basis.ModeParity;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 1 回の振動エネルギー計算の入力をまとめたクラスです。
 */
@Value
@Builder
public class CalculationRequest {

    /**
     * 調和振動数の配列です（モード数 M）。
     */
    double[] frequencies;

    /**
     * 非調和ポテンシャルです（モード数 M）。
     */
    AnharmonicPotential potential;

    /**
     * ゼロ次エネルギーの上限 Emax です（零点エネルギーを含みます）。
     */
    double energyCutoff;

    /**
     * モードごとの偶奇条件です（空なら選別しません）。
     */
    @Builder.Default
    List<ModeParity> parities = List.of();

    /**
     * モードごとの周波数シフト量です（null または空なら適用しません）。
     */
    double[] frequencyShifts;

    /**
     * 変分計算を行うかどうかです。
     */
    @Builder.Default
    boolean variationalEnabled = true;

    /**
     * 変分計算の基準エネルギー E0 です（null なら最低固有値）。
     */
    Double referenceEnergy;

    /**
     * 摂動級数を生成するかどうかです。
     */
    @Builder.Default
    boolean rsptEnabled = false;

    /**
     * 摂動級数の対象状態の基底番号です。
     */
    int rsptTargetState;

    /**
     * 摂動級数の係数の数 Nmax です。
     */
    @Builder.Default
    int rsptOrder = 10;

    /**
     * 調和振動数の配列の複製を返します。
     *
     * @return 調和振動数の配列です
     */
    public double[] getFrequencies() {
        return frequencies == null ? null : frequencies.clone();
    }

    /**
     * 周波数シフト量の配列の複製を返します。
     *
     * @return シフト量の配列です（未指定なら null）
     */
    public double[] getFrequencyShifts() {
        return frequencyShifts == null ? null : frequencyShifts.clone();
    }

    /**
     * 周波数シフトを適用するかどうかを返します。
     *
     * @return シフト量が指定されている場合は true です
     */
    public boolean hasFrequencyShifts() {
        return frequencyShifts != null && frequencyShifts.length > 0;
    }

    /**
     * 偶奇条件で基底を選別するかどうかを返します。
     *
     * @return 偶奇条件が指定されている場合は true です
     */
    public boolean hasParityFilter() {
        return parities != null && !parities.isEmpty();
    }

    /**
     * 配列を複製して受け取るビルダーです。
     */
    public static class CalculationRequestBuilder {

        /**
         * 調和振動数の配列を設定します（複製して保持します）。
         *
         * @param frequencies 調和振動数の配列です
         * @return このビルダーです
         */
        public CalculationRequestBuilder frequencies(double[] frequencies) {
            this.frequencies = frequencies == null ? null : frequencies.clone();
            return this;
        }

        /**
         * 周波数シフト量の配列を設定します（複製して保持します）。
         *
         * @param frequencyShifts シフト量の配列です
         * @return このビルダーです
         */
        public CalculationRequestBuilder frequencyShifts(double[] frequencyShifts) {
            this.frequencyShifts = frequencyShifts == null ? null : frequencyShifts.clone();
            return this;
        }
    }
}

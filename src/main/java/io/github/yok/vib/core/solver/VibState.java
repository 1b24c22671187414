package io.github.yok.vib.core.solver;

import java.util.Arrays;
import lombok.Getter;

/**
 * 対角化後の振動状態を表すクラスです。
 *
 * <p>
 * 量子数は、固有ベクトルとの重なりが最大のゼロ次状態から引き継いだ表示用のラベルです。 エネルギーは基準エネルギー E0 からの相対値です。
 * </p>
 */
@Getter
public final class VibState {

    /**
     * 表示順の番号です（0 始まり、密な番号）。
     */
    private final int index;

    /**
     * 割り当てたゼロ次状態の量子数の組です。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final int[] quantumNumbers;

    /**
     * 補正後のエネルギー（E0 からの相対値）です。
     */
    private final double energy;

    /**
     * 割り当てたゼロ次状態のゼロ次エネルギーです。
     */
    private final double zeroOrderEnergy;

    /**
     * 割り当てたゼロ次状態との重なり |c|² です。
     */
    private final double overlap;

    /**
     * 固有値昇順での元の番号です。
     */
    private final int eigenvalueIndex;

    /**
     * 振動状態を生成します。
     *
     * @param index 表示順の番号です
     * @param quantumNumbers 量子数の組です（null 不可）
     * @param energy 補正後の相対エネルギーです
     * @param zeroOrderEnergy ゼロ次エネルギーです
     * @param overlap ゼロ次状態との重なり |c|² です
     * @param eigenvalueIndex 固有値昇順での番号です
     */
    public VibState(int index, int[] quantumNumbers, double energy, double zeroOrderEnergy,
            double overlap, int eigenvalueIndex) {
        if (quantumNumbers == null) {
            throw new IllegalArgumentException("quantumNumbers は null 不可です");
        }
        this.index = index;
        this.quantumNumbers = quantumNumbers.clone();
        this.energy = energy;
        this.zeroOrderEnergy = zeroOrderEnergy;
        this.overlap = overlap;
        this.eigenvalueIndex = eigenvalueIndex;
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
     * 指定モードの量子数を返します。
     *
     * @param mode モード番号です
     * @return 量子数です
     */
    public int quantumNumber(int mode) {
        return quantumNumbers[mode];
    }

    @Override
    public String toString() {
        return "VibState(index=" + index + ", v=" + Arrays.toString(quantumNumbers) + ", energy="
                + energy + ", overlap=" + overlap + ")";
    }
}

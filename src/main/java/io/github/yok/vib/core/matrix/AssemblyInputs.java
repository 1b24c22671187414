package io.github.yok.vib.core.matrix;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.harmonic.HarmonicMatrixElements;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import io.github.yok.vib.core.potential.AnharmonicTerm;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 行列組み立て前の入力検証と、単項式の配列化を行うクラスです。
 */
@Slf4j
final class AssemblyInputs {

    /**
     * 寄与し得る単項式のべき指数です（powers[t][mode]）。
     */
    final int[][] powers;

    /**
     * 寄与し得る単項式の係数です。
     */
    final double[] coefficients;

    private AssemblyInputs(int[][] powers, double[] coefficients) {
        this.powers = powers;
        this.coefficients = coefficients;
    }

    /**
     * 入力を検証し、行列に寄与し得る単項式だけを配列に詰めます。
     *
     * <p>
     * 8 次を超えるべき指数を含む単項式は寄与 0 として除外し、警告ログを出します。 係数 0 の単項式も除外します。
     * </p>
     *
     * @param potential 非調和ポテンシャルです
     * @param basis ゼロ次基底です
     * @return 配列化した単項式です
     * @throws IllegalArgumentException 引数が null、またはモード数が一致しない場合に発生します
     * @throws IllegalStateException 基底が空の場合に発生します
     */
    static AssemblyInputs prepare(AnharmonicPotential potential, ZeroOrderBasis basis) {
        if (potential == null) {
            throw new IllegalArgumentException("potential は null 不可です");
        }
        if (basis == null) {
            throw new IllegalArgumentException("basis は null 不可です");
        }
        if (basis.isEmpty()) {
            throw new IllegalStateException("基底が空です。エネルギー上限や偶奇条件を見直してください");
        }
        if (potential.getModeCount() != basis.modeCount()) {
            throw new IllegalArgumentException("ポテンシャルと基底のモード数が一致しません: "
                    + potential.getModeCount() + " vs " + basis.modeCount());
        }

        List<AnharmonicTerm> beyond = potential.termsBeyondMaxOrder();
        if (!beyond.isEmpty()) {
            log.warn("{} 次を超えるべき指数を含む単項式は寄与 0 として扱います。対象={}",
                    HarmonicMatrixElements.MAX_ORDER, beyond);
        }

        List<AnharmonicTerm> active = new ArrayList<>();
        for (AnharmonicTerm t : potential.terms()) {
            if (t.maxPower() <= HarmonicMatrixElements.MAX_ORDER && t.coefficient() != 0.0) {
                active.add(t);
            }
        }

        int[][] powers = new int[active.size()][];
        double[] coefficients = new double[active.size()];
        for (int t = 0; t < active.size(); t++) {
            powers[t] = active.get(t).powers();
            coefficients[t] = active.get(t).coefficient();
        }
        return new AssemblyInputs(powers, coefficients);
    }

    /**
     * 寄与し得る単項式の数を返します。
     *
     * @return 単項式の数です
     */
    int termCount() {
        return coefficients.length;
    }
}

package io.github.yok.vib.out;

import io.github.yok.vib.core.solver.CalculationResult;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 出力の命名規約に必要なエネルギー上限 {@code Emax} を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 計算結果を出力します。
     *
     * @param result 計算結果です
     * @param energyCutoff 列挙に使ったエネルギー上限 Emax です
     */
    void write(CalculationResult result, double energyCutoff);
}

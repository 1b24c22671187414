package io.github.yok.vib.core.matrix;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderState;
import io.github.yok.vib.core.harmonic.HarmonicMatrixElements;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 要素ごとに閉形式を直接評価して摂動行列 W を組み立てる参照用の実装です。
 *
 * <p>
 * 前計算もキャッシュも持たず、単一スレッドで動きます。 表引き実装の検証に使います。
 * </p>
 */
@Slf4j
public final class ClosedFormPerturbationMatrixBuilder implements PerturbationMatrixBuilder {

    /**
     * N×N の実対称な摂動行列 W を組み立てて返します。
     *
     * @param potential 非調和ポテンシャルです
     * @param basis ゼロ次基底です（空は不可）
     * @return 摂動行列です
     * @throws IllegalArgumentException モード数が一致しない場合などに発生します
     * @throws IllegalStateException 基底が空の場合に発生します
     */
    @Override
    public DMatrixRMaj build(AnharmonicPotential potential, ZeroOrderBasis basis) {
        AssemblyInputs inputs = AssemblyInputs.prepare(potential, basis);

        long t0 = System.nanoTime();
        int n = basis.size();
        DMatrixRMaj w = new DMatrixRMaj(n, n);

        for (int i = 0; i < n; i++) {
            ZeroOrderState bra = basis.get(i);
            for (int j = i; j < n; j++) {
                double value = element(inputs, bra, basis.get(j));
                w.unsafe_set(i, j, value);
                w.unsafe_set(j, i, value);
            }
        }

        log.info("摂動行列を組み立てました（閉形式）。N={}、単項式数={}、所要時間={}ms", n, inputs.termCount(),
                (System.nanoTime() - t0) / 1_000_000L);
        return w;
    }

    /**
     * 2 状態間の行列要素 {@code <bra|V|ket>} を計算します。
     *
     * @param inputs 配列化した単項式です
     * @param bra 行側の状態です
     * @param ket 列側の状態です
     * @return 行列要素です
     */
    private static double element(AssemblyInputs inputs, ZeroOrderState bra, ZeroOrderState ket) {
        int modeCount = bra.modeCount();
        double sum = 0.0;
        for (int t = 0; t < inputs.termCount(); t++) {
            int[] p = inputs.powers[t];
            double product = inputs.coefficients[t];
            for (int mode = 0; mode < modeCount; mode++) {
                int v1 = bra.quantumNumber(mode);
                int v2 = ket.quantumNumber(mode);
                int dv = Math.abs(v1 - v2);
                if (HarmonicMatrixElements.isZero(p[mode], dv)) {
                    product = 0.0;
                    break;
                }
                product *= HarmonicMatrixElements.weight(p[mode], dv, Math.max(v1, v2));
            }
            if (product != 0.0) {
                sum += product;
            }
        }
        return sum;
    }
}

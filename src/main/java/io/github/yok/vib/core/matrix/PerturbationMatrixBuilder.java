package io.github.yok.vib.core.matrix;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.potential.AnharmonicPotential;
import org.ejml.data.DMatrixRMaj;

/**
 * ゼロ次状態間の摂動行列 W を組み立てる処理を表すインタフェースです。
 *
 * <p>
 * 表引きによる本番用の実装と、閉形式を毎回評価する参照用の実装を差し替えるための境界です。
 * </p>
 */
public interface PerturbationMatrixBuilder {

    /**
     * N×N の実対称な摂動行列 W を組み立てて返します。
     *
     * <p>
     * W の対角要素にゼロ次エネルギーは含みません。 行・列の順序は基底の順序です。
     * </p>
     *
     * @param potential 非調和ポテンシャルです
     * @param basis ゼロ次基底です（空は不可）
     * @return 摂動行列です
     * @throws IllegalArgumentException モード数が一致しない場合などに発生します
     * @throws IllegalStateException 基底が空の場合に発生します
     */
    DMatrixRMaj build(AnharmonicPotential potential, ZeroOrderBasis basis);
}

package io.github.yok.vib.core.solver;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.series.RsptSeries;
import io.github.yok.vib.core.solver.VariationalSolver.VariationalResult;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 1 回の振動エネルギー計算の結果をまとめたクラスです。
 *
 * <p>
 * 周波数シフトを適用した場合、{@link #getBasis()} と {@link #getPerturbation()} はシフト後の配分です。 シフト前の基底は
 * {@link #getUnshiftedBasis()} に残します。
 * </p>
 */
@Value
public class CalculationResult {

    /**
     * シフト前のゼロ次基底です。
     */
    ZeroOrderBasis unshiftedBasis;

    /**
     * 計算に使ったゼロ次基底です（シフト後）。
     */
    ZeroOrderBasis basis;

    /**
     * 摂動行列 W です（シフト後）。
     */
    DMatrixRMaj perturbation;

    /**
     * ハミルトニアン行列 H = W + diag(E) です。
     */
    DMatrixRMaj hamiltonian;

    /**
     * 変分計算の結果です（無効の場合は null）。
     */
    VariationalResult variational;

    /**
     * 摂動級数です（無効の場合は null）。
     */
    RsptSeries series;

    /**
     * 変分計算の結果を持つかどうかを返します。
     *
     * @return 持つ場合は true です
     */
    public boolean hasVariational() {
        return variational != null;
    }

    /**
     * 摂動級数を持つかどうかを返します。
     *
     * @return 持つ場合は true です
     */
    public boolean hasSeries() {
        return series != null;
    }
}

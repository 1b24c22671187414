package io.github.yok.vib.core.matrix;

import io.github.yok.vib.core.basis.ZeroOrderBasis;
import io.github.yok.vib.core.basis.ZeroOrderState;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 摂動行列 W とハミルトニアン行列 H の間の変換をまとめたクラスです。
 */
@Slf4j
public final class HamiltonianMatrices {

    private HamiltonianMatrices() {
    }

    /**
     * W の対角にゼロ次エネルギーを加えた H を返します。
     *
     * <p>
     * 引数の W は変更しません。
     * </p>
     *
     * @param perturbation 摂動行列 W です（N×N）
     * @param basis ゼロ次基底です（状態数 N）
     * @return ハミルトニアン行列 H です
     * @throws IllegalArgumentException 次元が一致しない場合に発生します
     */
    public static DMatrixRMaj addZeroOrderEnergies(DMatrixRMaj perturbation, ZeroOrderBasis basis) {
        checkDimensions(perturbation, basis);
        DMatrixRMaj h = perturbation.copy();
        for (int i = 0; i < basis.size(); i++) {
            h.add(i, i, basis.get(i).getEnergy());
        }
        return h;
    }

    /**
     * 周波数シフト変換を W と基底に適用します（どちらもその場で書き換えます）。
     *
     * <p>
     * 各状態について {@code s = Σ_m (v_m + 1/2) · shift_m} を計算し、 状態のゼロ次エネルギーに s を加え、 W の対応する対角要素から
     * s を引きます。 H = W + diag(E) は丸め誤差を除いて変わりませんが、 ゼロ次エネルギーと摂動の配分が変わるため、
     * 近縮退（共鳴）する状態のゼロ次エネルギーを引き離せます。
     * </p>
     *
     * @param shifts モードごとのシフト量です（長さはモード数と一致、各要素は有限値）
     * @param basis ゼロ次基底です（その場で書き換えます）
     * @param perturbation 摂動行列 W です（その場で書き換えます）
     * @throws IllegalArgumentException 長さや次元が一致しない場合、または非有限値を含む場合に発生します
     */
    public static void shiftFrequencies(double[] shifts, ZeroOrderBasis basis,
            DMatrixRMaj perturbation) {
        if (shifts == null) {
            throw new IllegalArgumentException("shifts は null 不可です");
        }
        checkDimensions(perturbation, basis);
        if (shifts.length != basis.modeCount()) {
            throw new IllegalArgumentException("シフト量の長さがモード数と一致しません: " + shifts.length + " vs "
                    + basis.modeCount());
        }
        for (double s : shifts) {
            if (!Double.isFinite(s)) {
                throw new IllegalArgumentException("シフト量は有限値が必要です: " + s);
            }
        }

        double maxAbsShift = 0.0;
        for (int i = 0; i < basis.size(); i++) {
            ZeroOrderState state = basis.get(i);
            double s = 0.0;
            for (int mode = 0; mode < shifts.length; mode++) {
                s += (state.quantumNumber(mode) + 0.5) * shifts[mode];
            }
            if (s == 0.0) {
                continue;
            }
            basis.shiftEnergy(i, s);
            perturbation.add(i, i, -s);
            maxAbsShift = Math.max(maxAbsShift, Math.abs(s));
        }
        log.info("周波数シフトを適用しました。N={}、最大シフト量={}", basis.size(), maxAbsShift);
    }

    /**
     * 行列のトレースを返します。
     *
     * @param matrix 正方行列です
     * @return トレースです
     */
    public static double trace(DMatrixRMaj matrix) {
        double t = 0.0;
        int n = Math.min(matrix.numRows, matrix.numCols);
        for (int i = 0; i < n; i++) {
            t += matrix.unsafe_get(i, i);
        }
        return t;
    }

    /**
     * 行列が厳密に（ビット単位で）対称かどうかを返します。
     *
     * @param matrix 正方行列です
     * @return 厳密に対称な場合は true です
     */
    public static boolean isExactlySymmetric(DMatrixRMaj matrix) {
        if (matrix.numRows != matrix.numCols) {
            return false;
        }
        int n = matrix.numRows;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Double.compare(matrix.unsafe_get(i, j), matrix.unsafe_get(j, i)) != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    private static void checkDimensions(DMatrixRMaj perturbation, ZeroOrderBasis basis) {
        if (perturbation == null) {
            throw new IllegalArgumentException("perturbation は null 不可です");
        }
        if (basis == null) {
            throw new IllegalArgumentException("basis は null 不可です");
        }
        if (perturbation.numRows != basis.size() || perturbation.numCols != basis.size()) {
            throw new IllegalArgumentException("行列の次元と基底の状態数が一致しません: " + perturbation.numRows
                    + "x" + perturbation.numCols + " vs " + basis.size());
        }
    }
}

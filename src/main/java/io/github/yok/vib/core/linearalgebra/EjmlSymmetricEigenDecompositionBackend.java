package io.github.yok.vib.core.linearalgebra;

import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、ハミルトニアン行列（実対称）の固有分解を行うクラスです。
 *
 * <p>
 * 固有値を昇順に並べ替え、固有ベクトルも同じ順序に揃えて返します。 大きな N では、この同期的な密行列の分解が
 * 行列組み立てに次ぐ計算時間を占めます。
 * </p>
 */
@Slf4j
public final class EjmlSymmetricEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 対称性判定の許容誤差（要素の絶対値の最大に対する相対値）です。
     */
    private static final double SYMMETRY_TOLERANCE = 1e-12;

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException symmetricMatrix が null、正方でない、または対称でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public EigenDecompositionResult decomposeSymmetricAndSort(DMatrixRMaj symmetricMatrix) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        if (symmetricMatrix.numRows != symmetricMatrix.numCols) {
            throw new IllegalArgumentException("正方行列が必要です: " + symmetricMatrix.numRows + "x"
                    + symmetricMatrix.numCols);
        }
        if (!MatrixFeatures_DDRM.isSymmetric(symmetricMatrix, SYMMETRY_TOLERANCE)) {
            throw new IllegalArgumentException("ハミルトニアン行列が対称ではありません");
        }

        int dim = symmetricMatrix.numRows;
        long t0 = System.nanoTime();

        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, true);

        // 分解器が入力を書き換える場合に備え、呼び出し側の行列は複製して渡します。
        DMatrixRMaj input =
                decomposition.inputModified() ? symmetricMatrix.copy() : symmetricMatrix;
        if (!decomposition.decompose(input)) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）: N=" + dim);
        }

        double[] eigenvalues = new double[dim];
        DMatrixRMaj eigenvectors = new DMatrixRMaj(dim, dim);

        for (int col = 0; col < dim; col++) {
            // 実対称のため、固有値は実数部のみを使います。
            eigenvalues[col] = decomposition.getEigenvalue(col).getReal();

            DMatrixRMaj vec = decomposition.getEigenVector(col);
            if (vec == null) {
                throw new IllegalStateException("固有ベクトルが取得できません: col=" + col);
            }
            for (int row = 0; row < dim; row++) {
                eigenvectors.unsafe_set(row, col, vec.get(row, 0));
            }
        }

        int[] order = argsortAscending(eigenvalues);

        double[] sortedValues = new double[dim];
        DMatrixRMaj sortedVectors = new DMatrixRMaj(dim, dim);
        for (int newCol = 0; newCol < dim; newCol++) {
            int oldCol = order[newCol];
            sortedValues[newCol] = eigenvalues[oldCol];
            for (int row = 0; row < dim; row++) {
                sortedVectors.unsafe_set(row, newCol, eigenvectors.unsafe_get(row, oldCol));
            }
        }

        log.info("固有分解が完了しました。N={}、最小固有値={}、最大固有値={}、所要時間={}ms", dim,
                dim > 0 ? sortedValues[0] : Double.NaN, dim > 0 ? sortedValues[dim - 1] : Double.NaN,
                (System.nanoTime() - t0) / 1_000_000L);
        return new EigenDecompositionResult(sortedValues, sortedVectors);
    }

    /**
     * 配列を昇順ソートしたときのインデックス順（argsort）を返します。
     *
     * <p>
     * 同値の場合は元のインデックス順を保ちます。
     * </p>
     *
     * @param values 対象配列です
     * @return 昇順のインデックス配列です
     */
    private static int[] argsortAscending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }
        Arrays.sort(indices, (i, j) -> Double.compare(values[i], values[j]));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }
}

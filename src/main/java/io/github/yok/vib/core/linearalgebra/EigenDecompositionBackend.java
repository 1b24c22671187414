package io.github.yok.vib.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * ハミルトニアン行列の固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 変分計算で使う線形代数ライブラリを差し替えるための境界です。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実対称行列を固有分解し、固有値昇順の結果を返します。
     *
     * <p>
     * 引数の行列は変更しません。
     * </p>
     *
     * @param symmetricMatrix 実対称行列です
     * @return 固有値昇順の固有分解結果です
     * @throws IllegalArgumentException 正方でない場合、または対称でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    EigenDecompositionResult decomposeSymmetricAndSort(DMatrixRMaj symmetricMatrix);

    /**
     * 固有分解の結果（固有値・固有ベクトル）を保持するクラスです。
     *
     * <p>
     * 固有ベクトル行列は「列が固有ベクトル」で、列 k が固有値 k に対応します。 各列は正規化済みです。
     * </p>
     */
    @Value
    class EigenDecompositionResult {

        /**
         * 固有値配列です（昇順）。
         */
        double[] eigenvalues;

        /**
         * 固有ベクトル行列です（列が固有ベクトルです）。
         */
        DMatrixRMaj eigenvectors;

        /**
         * 固有値の数（行列の次元）を返します。
         *
         * @return 固有値の数です
         */
        public int size() {
            return eigenvalues.length;
        }
    }
}

package io.github.yok.bid.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 特異値分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface SingularValueDecompositionBackend {

    /**
     * 行列を特異値分解し、特異値降順の結果を返します。
     *
     * @param matrix 対象行列です（変更しません）
     * @return 特異値降順の分解結果です
     * @throws IllegalStateException 特異値分解に失敗した場合に発生します
     */
    SingularValueDecompositionResult decomposeAndSort(DMatrixRMaj matrix);

    /**
     * 行列の特異値のみを降順で返します。
     *
     * @param matrix 対象行列です（変更しません）
     * @return 降順の特異値配列です
     * @throws IllegalStateException 特異値分解に失敗した場合に発生します
     */
    double[] singularValuesDescending(DMatrixRMaj matrix);

    /**
     * 特異値分解の結果（特異値・右特異ベクトル）を保持するクラスです。
     *
     * <p>
     * 右特異ベクトル行列は「列が右特異ベクトル」である前提です。
     * </p>
     */
    @Value
    class SingularValueDecompositionResult {

        /**
         * 降順の特異値配列です。
         */
        double[] singularValues;

        /**
         * 右特異ベクトル行列です（列 k が特異値 k に対応します）。
         */
        DMatrixRMaj rightSingularVectors;

        /**
         * 指定インデックスの右特異ベクトルのコピーを返します。
         *
         * @param index 特異値インデックスです（0 始まり、降順）
         * @return 右特異ベクトルです
         */
        public double[] rightSingularVector(int index) {
            int n = rightSingularVectors.numRows;
            double[] out = new double[n];
            for (int row = 0; row < n; row++) {
                out[row] = rightSingularVectors.get(row, index);
            }
            return out;
        }
    }
}

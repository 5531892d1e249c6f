package io.github.yok.bid.core.linearalgebra;

import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * EJML を用いて、実行列の特異値分解を行うクラスです。
 *
 * <p>
 * 特異値を降順に並べ替え、右特異ベクトルも同じ順序に揃えて返します。
 * </p>
 */
public final class EjmlSingularValueDecompositionBackend
        implements SingularValueDecompositionBackend {

    /**
     * 行列を特異値分解し、特異値降順の結果を返します。
     *
     * @param matrix 対象行列です
     * @return 特異値降順の分解結果です
     * @throws IllegalArgumentException matrix が null の場合に発生します
     * @throws IllegalStateException 特異値分解に失敗した場合に発生します
     */
    @Override
    public SingularValueDecompositionResult decomposeAndSort(DMatrixRMaj matrix) {
        SingularValueDecomposition_F64<DMatrixRMaj> svd = decompose(matrix, true);

        double[] values = copyValues(svd);
        DMatrixRMaj v = svd.getV(null, false);
        if (v == null) {
            throw new IllegalStateException("右特異ベクトルが取得できません（EJML）");
        }

        // 特異値を降順にし、右特異ベクトル（列）も同じ順序で並べ替えます。
        int[] order = argsortDescending(values);
        int count = values.length;
        double[] sortedValues = new double[count];
        DMatrixRMaj sortedVectors = new DMatrixRMaj(v.numRows, count);

        for (int newCol = 0; newCol < count; newCol++) {
            int oldCol = order[newCol];
            sortedValues[newCol] = values[oldCol];
            for (int row = 0; row < v.numRows; row++) {
                sortedVectors.set(row, newCol, v.get(row, oldCol));
            }
        }

        return new SingularValueDecompositionResult(sortedValues, sortedVectors);
    }

    /**
     * 行列の特異値のみを降順で返します。
     *
     * @param matrix 対象行列です
     * @return 降順の特異値配列です
     * @throws IllegalArgumentException matrix が null の場合に発生します
     * @throws IllegalStateException 特異値分解に失敗した場合に発生します
     */
    @Override
    public double[] singularValuesDescending(DMatrixRMaj matrix) {
        double[] values = copyValues(decompose(matrix, false));
        Arrays.sort(values);
        // 昇順を反転して降順にします。
        for (int i = 0, j = values.length - 1; i < j; i++, j--) {
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
        return values;
    }

    /**
     * EJML の分解器を生成して分解を実行します。
     *
     * @param matrix 対象行列です
     * @param needV 右特異ベクトルが必要かどうかです
     * @return 分解済みの分解器です
     */
    private static SingularValueDecomposition_F64<DMatrixRMaj> decompose(DMatrixRMaj matrix,
            boolean needV) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }

        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                DecompositionFactory_DDRM.svd(matrix.numRows, matrix.numCols, false, needV, true);

        // 入力を書き換える実装があるため、その場合はコピーを渡します。
        DMatrixRMaj input = svd.inputModified() ? matrix.copy() : matrix;
        if (!svd.decompose(input)) {
            throw new IllegalStateException("特異値分解に失敗しました（EJML）: "
                    + matrix.numRows + "x" + matrix.numCols);
        }
        return svd;
    }

    /**
     * 分解器から特異値を有効個数分だけコピーします。
     *
     * @param svd 分解済みの分解器です
     * @return 特異値配列です（順序は未定義）
     */
    private static double[] copyValues(SingularValueDecomposition_F64<DMatrixRMaj> svd) {
        return Arrays.copyOf(svd.getSingularValues(), svd.numberOfSingularValues());
    }

    /**
     * 配列を降順ソートしたときのインデックス順を返します。
     *
     * <p>
     * 同値の場合は元のインデックス順を保ちます（安定ソート）。
     * </p>
     *
     * @param values 対象配列です
     * @return 降順のインデックス配列です
     */
    private static int[] argsortDescending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }

        Arrays.sort(indices, (i, j) -> Double.compare(values[j], values[i]));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }
}

package io.github.yok.bid.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;

/**
 * 下三角の係数行列に対して、Sylvester 方程式 {@code A X + X B = C} を代入法で解くクラスです。
 *
 * <p>
 * 下三角行列はそれ自身が Schur 形なので、Bartels–Stewart 法の分解段を省略し、 行 i を上から順に確定させます。
 * </p>
 *
 * <pre>
 *   X[i,:] (A[i,i] I + B) = C[i,:] - Σ_{k&lt;i} A[i,k] X[k,:]
 * </pre>
 *
 * <p>
 * 右辺の {@code (A[i,i] I + B)} も下三角なので、列 j を右端から後退代入で解きます。 計算量は O(h²w + hw²) です。
 * </p>
 */
public final class TriangularSylvesterEquationBackend implements SylvesterEquationBackend {

    /**
     * {@code A X + X B = C} を解きます。
     *
     * @param a 下三角の係数行列（h×h）です
     * @param b 下三角の係数行列（w×w）です
     * @param c 右辺（h×w）です
     * @return 解 X（h×w）です（対角和が 0 の場合は非有限値を含みます）
     * @throws IllegalArgumentException 形状が不正、または下三角でない場合に発生します
     */
    @Override
    public DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj c) {
        SylvesterEquationBackend.checkShapes(a, b, c);
        requireLowerTriangular(a, "a");
        requireLowerTriangular(b, "b");

        int h = a.numRows;
        int w = b.numRows;
        DMatrixRMaj x = new DMatrixRMaj(h, w);
        double[] rhs = new double[w];

        for (int i = 0; i < h; i++) {
            // 既に確定した行 k<i の寄与を右辺から差し引きます。
            for (int j = 0; j < w; j++) {
                double s = c.get(i, j);
                for (int k = 0; k < i; k++) {
                    double aik = a.get(i, k);
                    if (aik != 0.0) {
                        s -= aik * x.get(k, j);
                    }
                }
                rhs[j] = s;
            }

            // 行ベクトル x_i について x_i (a_ii I + B) = rhs を後退代入で解きます。
            double aii = a.get(i, i);
            for (int j = w - 1; j >= 0; j--) {
                double s = rhs[j];
                for (int l = j + 1; l < w; l++) {
                    double blj = b.get(l, j);
                    if (blj != 0.0) {
                        s -= x.get(i, l) * blj;
                    }
                }
                x.set(i, j, s / (aii + b.get(j, j)));
            }
        }
        return x;
    }

    /**
     * 行列が下三角（対角より上がすべて 0）であることを検査します。
     *
     * @param m 行列です
     * @param name エラーメッセージ用の名前です
     * @throws IllegalArgumentException 下三角でない場合に発生します
     */
    private static void requireLowerTriangular(DMatrixRMaj m, String name) {
        for (int row = 0; row < m.numRows; row++) {
            for (int col = row + 1; col < m.numCols; col++) {
                if (m.get(row, col) != 0.0) {
                    throw new IllegalArgumentException(name + " は下三角行列である必要があります: (" + row
                            + ", " + col + ")=" + m.get(row, col));
                }
            }
        }
    }
}

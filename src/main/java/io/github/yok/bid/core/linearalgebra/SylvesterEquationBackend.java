package io.github.yok.bid.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;

/**
 * Sylvester 方程式 {@code A X + X B = C} を直接法で解くバックエンドを表すインタフェースです。
 *
 * <p>
 * A は h×h、B は w×w、C と解 X は h×w です。
 * </p>
 */
public interface SylvesterEquationBackend {

    /**
     * {@code A X + X B = C} を解きます。
     *
     * <p>
     * 解が非有限値を含むかどうかの判定は呼び出し側が行います。
     * </p>
     *
     * @param a 左側の係数行列（h×h）です
     * @param b 右側の係数行列（w×w）です
     * @param c 右辺（h×w）です
     * @return 解 X（h×w）です
     * @throws IllegalArgumentException 行列の形状・構造が前提を満たさない場合に発生します
     * @throws IllegalStateException 分解に失敗した場合に発生します
     */
    DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj c);

    /**
     * 行列の形状が {@code A X + X B = C} と整合しているかを検査します。
     *
     * @param a 左側の係数行列です
     * @param b 右側の係数行列です
     * @param c 右辺です
     * @throws IllegalArgumentException 形状が整合しない場合に発生します
     */
    static void checkShapes(DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj c) {
        if (a == null || b == null || c == null) {
            throw new IllegalArgumentException("a/b/c は null 不可です");
        }
        if (a.numRows != a.numCols) {
            throw new IllegalArgumentException(
                    "a は正方行列である必要があります: " + a.numRows + "x" + a.numCols);
        }
        if (b.numRows != b.numCols) {
            throw new IllegalArgumentException(
                    "b は正方行列である必要があります: " + b.numRows + "x" + b.numCols);
        }
        if (c.numRows != a.numRows || c.numCols != b.numRows) {
            throw new IllegalArgumentException("c の形状が一致しません: c=" + c.numRows + "x" + c.numCols
                    + ", 期待値=" + a.numRows + "x" + b.numRows);
        }
    }
}

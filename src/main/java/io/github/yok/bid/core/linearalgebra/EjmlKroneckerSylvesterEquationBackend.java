package io.github.yok.bid.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * Sylvester 方程式をクロネッカー積でベクトル化し、EJML の LU 分解で解くクラスです。
 *
 * <pre>
 *   (I_w ⊗ A + Bᵀ ⊗ I_h) vec(X) = vec(C)
 * </pre>
 *
 * <p>
 * vec は列優先で、X[i,j] は {@code j*h + i} 番目に対応します。 係数行列が (hw)×(hw) になるため、小さな画像や検算用途向けです。
 * </p>
 */
public final class EjmlKroneckerSylvesterEquationBackend implements SylvesterEquationBackend {

    /**
     * 未知数 h*w の既定上限です。
     */
    public static final int DEFAULT_MAX_UNKNOWNS = 1600;

    /**
     * 未知数 h*w の上限です。
     */
    private final int maxUnknowns;

    /**
     * 既定の上限でバックエンドを生成します。
     */
    public EjmlKroneckerSylvesterEquationBackend() {
        this(DEFAULT_MAX_UNKNOWNS);
    }

    /**
     * バックエンドを生成します。
     *
     * @param maxUnknowns 未知数 h*w の上限です（1 以上）
     * @throws IllegalArgumentException maxUnknowns が 1 未満の場合に発生します
     */
    public EjmlKroneckerSylvesterEquationBackend(int maxUnknowns) {
        if (maxUnknowns <= 0) {
            throw new IllegalArgumentException("maxUnknowns は 1 以上が必要です: " + maxUnknowns);
        }
        this.maxUnknowns = maxUnknowns;
    }

    /**
     * {@code A X + X B = C} を解きます。
     *
     * @param a 係数行列（h×h）です
     * @param b 係数行列（w×w）です
     * @param c 右辺（h×w）です
     * @return 解 X（h×w）です
     * @throws IllegalArgumentException 形状が不正、または未知数が上限を超える場合に発生します
     * @throws IllegalStateException LU 分解に失敗した、または係数行列が特異な場合に発生します
     */
    @Override
    public DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj c) {
        SylvesterEquationBackend.checkShapes(a, b, c);

        int h = a.numRows;
        int w = b.numRows;
        int n = h * w;
        if (n > maxUnknowns) {
            throw new IllegalArgumentException(
                    "未知数 h*w が上限を超えています: " + h + "x" + w + " > " + maxUnknowns);
        }

        DMatrixRMaj system = new DMatrixRMaj(n, n);
        DMatrixRMaj rhs = new DMatrixRMaj(n, 1);

        for (int j = 0; j < w; j++) {
            for (int i = 0; i < h; i++) {
                int row = j * h + i;
                rhs.set(row, 0, c.get(i, j));

                // (I_w ⊗ A): 同じ列 j の中で A[i,k] が掛かります。
                for (int k = 0; k < h; k++) {
                    double aik = a.get(i, k);
                    if (aik != 0.0) {
                        system.add(row, j * h + k, aik);
                    }
                }

                // (Bᵀ ⊗ I_h): 同じ行 i の中で B[l,j] が掛かります。
                for (int l = 0; l < w; l++) {
                    double blj = b.get(l, j);
                    if (blj != 0.0) {
                        system.add(row, l * h + i, blj);
                    }
                }
            }
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(n);
        if (!solver.setA(system)) {
            throw new IllegalStateException("LU 分解に失敗しました（EJML）: n=" + n);
        }
        if (solver.quality() == 0.0) {
            throw new IllegalStateException("係数行列 I⊗A + Bᵀ⊗I が特異です: n=" + n);
        }
        DMatrixRMaj vecX = new DMatrixRMaj(n, 1);
        solver.solve(rhs, vecX);

        DMatrixRMaj x = new DMatrixRMaj(h, w);
        for (int j = 0; j < w; j++) {
            for (int i = 0; i < h; i++) {
                x.set(i, j, vecX.get(j * h + i, 0));
            }
        }
        return x;
    }
}

package io.github.yok.bid.core.restoration;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.NumericalInstabilityException;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.linearalgebra.SylvesterEquationBackend;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 一般化 Sylvester 方程式 {@code H_y X + X H_x = B} を解いて復元画像を求めるクラスです。
 *
 * <p>
 * 求解は直接法のみで、解が非有限値を含む場合は {@link NumericalInstabilityException} を送出します。 求解後の輝度は
 * {@link IntensityMapping} で入力に揃えます。
 * </p>
 */
@Slf4j
public final class SylvesterRestorer {

    /**
     * Sylvester 方程式の求解バックエンドです。
     */
    private final SylvesterEquationBackend backend;

    /**
     * 求解後の輝度写像です。
     */
    private final IntensityMapping intensityMapping;

    /**
     * 復元器を生成します。
     *
     * @param backend 求解バックエンドです（null 不可）
     * @param intensityMapping 求解後の輝度写像です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public SylvesterRestorer(SylvesterEquationBackend backend, IntensityMapping intensityMapping) {
        if (backend == null) {
            throw new IllegalArgumentException("backend は null 不可です");
        }
        if (intensityMapping == null) {
            throw new IllegalArgumentException("intensityMapping は null 不可です");
        }
        this.backend = backend;
        this.intensityMapping = intensityMapping;
    }

    /**
     * 復元画像を求めます。
     *
     * @param operators 2 軸分の作用素です
     * @param blurred ぼけ画像です
     * @return 復元画像（入力と同じ形状）です
     * @throws InvalidInputException 作用素と画像の形状が一致しない場合に発生します
     * @throws NumericalInstabilityException 解が非有限値を含む場合に発生します
     */
    public GrayImage restore(BandedOperators operators, GrayImage blurred) {
        DMatrixRMaj solution = solve(operators, blurred);
        return intensityMapping.apply(solution, blurred);
    }

    /**
     * 輝度写像を行わずに Sylvester 方程式の解を返します。
     *
     * @param operators 2 軸分の作用素です
     * @param blurred ぼけ画像です
     * @return 解 X（height×width）です（有限値のみ）
     * @throws InvalidInputException 作用素と画像の形状が一致しない場合に発生します
     * @throws NumericalInstabilityException 解が非有限値を含む、または分解に失敗した場合に発生します
     */
    public DMatrixRMaj solve(BandedOperators operators, GrayImage blurred) {
        if (operators == null || blurred == null) {
            throw new InvalidInputException("operators/blurred は null 不可です");
        }
        DMatrixRMaj hy = operators.getVertical();
        DMatrixRMaj hx = operators.getHorizontal();
        if (hy.numRows != blurred.height() || hx.numRows != blurred.width()) {
            throw new InvalidInputException("作用素と画像の形状が一致しません: H_y=" + hy.numRows + ", H_x="
                    + hx.numRows + ", image=" + blurred.height() + "x" + blurred.width());
        }

        long t0 = System.nanoTime();
        DMatrixRMaj x;
        try {
            x = backend.solve(hy, hx, blurred.toMatrix());
        } catch (IllegalStateException e) {
            throw new NumericalInstabilityException("H_y ⊕ H_x", "Sylvester 方程式の直接解法に失敗しました", e);
        }

        ensureFinite(x, hy, hx);
        log.debug("Sylvester 方程式を解きました。サイズ={}x{}、経過={}ms", blurred.height(), blurred.width(),
                (System.nanoTime() - t0) / 1_000_000L);
        return x;
    }

    /**
     * 解が有限値のみであることを検査し、そうでなければ原因となった作用素を特定して例外を送出します。
     *
     * @param x 解です
     * @param hy 縦方向の作用素です
     * @param hx 横方向の作用素です
     * @throws NumericalInstabilityException 解が非有限値を含む場合に発生します
     */
    private static void ensureFinite(DMatrixRMaj x, DMatrixRMaj hy, DMatrixRMaj hx) {
        int badRow = -1;
        int badCol = -1;
        for (int i = 0; i < x.numRows && badRow < 0; i++) {
            for (int j = 0; j < x.numCols; j++) {
                if (!Double.isFinite(x.get(i, j))) {
                    badRow = i;
                    badCol = j;
                    break;
                }
            }
        }
        if (badRow < 0) {
            return;
        }

        // 三角系では対角和 H_y[i,i] + H_x[j,j] が 0 になると解が発散します。
        for (int i = 0; i < hy.numRows; i++) {
            for (int j = 0; j < hx.numRows; j++) {
                double pivot = hy.get(i, i) + hx.get(j, j);
                if (pivot == 0.0 || !Double.isFinite(pivot)) {
                    throw new NumericalInstabilityException("H_y[" + i + "," + i + "]+H_x[" + j + ","
                            + j + "]", "正則化後も対角和が 0 のため解が非有限値になりました: pivot=" + pivot);
                }
            }
        }
        throw new NumericalInstabilityException("H_y ⊕ H_x",
                "正則化後も解が非有限値になりました: X[" + badRow + "," + badCol + "]=" + x.get(badRow, badCol));
    }
}

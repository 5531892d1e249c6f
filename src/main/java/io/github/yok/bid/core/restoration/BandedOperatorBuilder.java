package io.github.yok.bid.core.restoration;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.psf.PointSpreadFunction;
import org.ejml.data.DMatrixRMaj;

/**
 * 2 次元 PSF から、軸ごとの正則化付き帯行列（因果的な Toeplitz 型作用素）を構築するクラスです。
 *
 * <p>
 * 行 i の列 [max(0, i−k+1), i] に、1 次元プロファイルを反転して配置します（{@code H[i][j] = profile[i−j]}）。 折り返しはありません。
 * 最後に対角へ ε を加えます。
 * </p>
 */
public final class BandedOperatorBuilder {

    /**
     * 正則化係数の既定値です。
     */
    public static final double DEFAULT_REGULARIZATION = 1e-6;

    /**
     * PSF から H_y（先頭列）と H_x（先頭行）を構築します。
     *
     * @param psf 2 次元 PSF です
     * @param height 画像の高さです（H_y のサイズ）
     * @param width 画像の幅です（H_x のサイズ）
     * @param regularization 対角に加える ε です（有限かつ 0 以上）
     * @return 2 軸分の作用素です
     * @throws InvalidInputException 引数が不正な場合に発生します
     */
    public BandedOperators build(PointSpreadFunction psf, int height, int width,
            double regularization) {
        if (psf == null) {
            throw new InvalidInputException("psf は null 不可です");
        }
        DMatrixRMaj hy = buildAxisOperator(psf.firstColumn(), height, regularization);
        DMatrixRMaj hx = buildAxisOperator(psf.firstRow(), width, regularization);
        return new BandedOperators(hy, hx);
    }

    /**
     * 1 次元プロファイルから n×n の帯行列を構築します。
     *
     * @param profile 1 次元プロファイルです（長さ 1 以上）
     * @param n 行列サイズです（1 以上）
     * @param regularization 対角に加える ε です（有限かつ 0 以上）
     * @return 帯行列です
     * @throws InvalidInputException 引数が不正な場合に発生します
     */
    public DMatrixRMaj buildAxisOperator(double[] profile, int n, double regularization) {
        if (profile == null || profile.length == 0) {
            throw new InvalidInputException("profile は長さ 1 以上が必要です");
        }
        if (n <= 0) {
            throw new InvalidInputException("作用素サイズは 1 以上が必要です: " + n);
        }
        if (!Double.isFinite(regularization) || regularization < 0.0) {
            throw new InvalidInputException("regularization は有限かつ 0 以上が必要です: " + regularization);
        }

        int k = profile.length;
        DMatrixRMaj h = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = Math.max(0, i - k + 1); j <= i; j++) {
                h.set(i, j, profile[i - j]);
            }
            h.add(i, i, regularization);
        }
        return h;
    }
}

package io.github.yok.bid.core.restoration;

import io.github.yok.bid.core.image.GrayImage;
import org.ejml.data.DMatrixRMaj;

/**
 * Sylvester 方程式の解を復元画像の画素値へ写す方法です。
 *
 * <p>
 * 加法モデル {@code H_y X + X H_x = B} の解は輝度のスケールが入力と一致しないため、 求解後に輝度範囲を揃えます。
 * </p>
 */
public enum IntensityMapping {

    /**
     * 解を入力（ぼけ画像）の [min, max] に線形写像します。
     *
     * <p>
     * 入力の輝度範囲が 0（定数画像）の場合は入力と同じ定数画像を返します。
     * </p>
     */
    INPUT_RANGE {
        @Override
        public GrayImage apply(DMatrixRMaj solution, GrayImage blurred) {
            double bMin = blurred.min();
            double bMax = blurred.max();
            if (bMax == bMin) {
                return GrayImage.filled(blurred.height(), blurred.width(), bMin);
            }
            return rescale(solution, bMin, bMax, 0.5 * (bMin + bMax));
        }
    },

    /**
     * 解を [0, 1] に min-max 正規化します（解が定数の場合は全画素 0）。
     */
    UNIT_RANGE {
        @Override
        public GrayImage apply(DMatrixRMaj solution, GrayImage blurred) {
            return rescale(solution, 0.0, 1.0, 0.0);
        }
    },

    /**
     * 解を [0, 1] にクリップします。
     */
    CLIP {
        @Override
        public GrayImage apply(DMatrixRMaj solution, GrayImage blurred) {
            DMatrixRMaj out = solution.copy();
            for (int i = 0; i < out.getNumElements(); i++) {
                out.data[i] = clamp(out.data[i], 0.0, 1.0);
            }
            return GrayImage.fromMatrix(out);
        }
    };

    /**
     * 解を画素値へ写します。
     *
     * @param solution Sylvester 方程式の解です（有限値のみ、変更しません）
     * @param blurred 入力のぼけ画像です
     * @return 復元画像です
     */
    public abstract GrayImage apply(DMatrixRMaj solution, GrayImage blurred);

    /**
     * 解を [lo, hi] に min-max 写像します。
     *
     * @param solution 解です
     * @param lo 写像先の下限です
     * @param hi 写像先の上限です
     * @param flatValue 解が定数の場合に用いる値です
     * @return 写像後の画像です
     */
    private static GrayImage rescale(DMatrixRMaj solution, double lo, double hi,
            double flatValue) {
        double xMin = Double.POSITIVE_INFINITY;
        double xMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < solution.getNumElements(); i++) {
            xMin = Math.min(xMin, solution.data[i]);
            xMax = Math.max(xMax, solution.data[i]);
        }

        DMatrixRMaj out = new DMatrixRMaj(solution.numRows, solution.numCols);
        if (xMax == xMin) {
            out.fill(flatValue);
            return GrayImage.fromMatrix(out);
        }

        double scale = (hi - lo) / (xMax - xMin);
        for (int i = 0; i < out.getNumElements(); i++) {
            out.data[i] = clamp(lo + (solution.data[i] - xMin) * scale, lo, hi);
        }
        return GrayImage.fromMatrix(out);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}

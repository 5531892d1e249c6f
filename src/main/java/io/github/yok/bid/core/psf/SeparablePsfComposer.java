package io.github.yok.bid.core.psf;

import io.github.yok.bid.core.InvalidInputException;

/**
 * 縦・横の 1 次元 PSF から、外積で分離可能な 2 次元 PSF を合成するクラスです。
 *
 * <p>
 * {@code psf[y][x] = vertical[y] * horizontal[x]} を総和 1 に再正規化します。
 * </p>
 */
public final class SeparablePsfComposer {

    /**
     * 推定結果 2 軸分から 2 次元 PSF を合成します。
     *
     * @param vertical 縦方向の推定結果です
     * @param horizontal 横方向の推定結果です
     * @return 2 次元 PSF です
     * @throws InvalidInputException 引数が null の場合に発生します
     */
    public PointSpreadFunction compose(AxisPsfEstimate vertical, AxisPsfEstimate horizontal) {
        if (vertical == null || horizontal == null) {
            throw new InvalidInputException("vertical/horizontal は null 不可です");
        }
        return compose(vertical.getKernel(), horizontal.getKernel());
    }

    /**
     * 1 次元カーネル 2 本から 2 次元 PSF を合成します。
     *
     * @param vertical 縦方向カーネルです（長さ psfHeight）
     * @param horizontal 横方向カーネルです（長さ psfWidth）
     * @return 2 次元 PSF です
     * @throws InvalidInputException 空配列、または外積の総和が 0 の場合に発生します
     */
    public PointSpreadFunction compose(double[] vertical, double[] horizontal) {
        if (vertical == null || vertical.length == 0 || horizontal == null
                || horizontal.length == 0) {
            throw new InvalidInputException("vertical/horizontal は長さ 1 以上が必要です");
        }

        double[][] outer = new double[vertical.length][horizontal.length];
        double total = 0.0;
        for (int y = 0; y < vertical.length; y++) {
            for (int x = 0; x < horizontal.length; x++) {
                outer[y][x] = vertical[y] * horizontal[x];
                total += outer[y][x];
            }
        }
        if (total == 0.0 || !Double.isFinite(total)) {
            throw new InvalidInputException("外積の総和が 0 または非有限値のため正規化できません: " + total);
        }

        for (double[] row : outer) {
            for (int x = 0; x < row.length; x++) {
                row[x] /= total;
            }
        }
        return new PointSpreadFunction(outer);
    }
}

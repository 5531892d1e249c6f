package io.github.yok.bid.core.synthetic;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.image.GrayImage;

/**
 * 出力サイズが入力と同じ（same）畳み込みを行うユーティリティです。
 *
 * <p>
 * 画像外は 0 として扱います。カーネル長 K の中心は {@code (K−1)/2} です。
 * </p>
 */
public final class Convolution {

    private Convolution() {
    }

    /**
     * 1 次元の same 畳み込みを行います。
     *
     * @param signal 入力系列です
     * @param kernel カーネルです（長さ 1 以上）
     * @return 入力と同じ長さの系列です
     */
    public static double[] same(double[] signal, double[] kernel) {
        requireKernel(kernel);
        int n = signal.length;
        int center = (kernel.length - 1) / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double s = 0.0;
            for (int j = 0; j < kernel.length; j++) {
                int src = i + center - j;
                if (src >= 0 && src < n) {
                    s += kernel[j] * signal[src];
                }
            }
            out[i] = s;
        }
        return out;
    }

    /**
     * 分離可能なカーネル（縦 × 横）で画像を畳み込みます。
     *
     * <p>
     * 先に各行を横方向カーネルで、次に各列を縦方向カーネルで畳み込みます。
     * </p>
     *
     * @param image 入力画像です
     * @param vertical 縦方向カーネルです
     * @param horizontal 横方向カーネルです
     * @return ぼけ画像です
     */
    public static GrayImage separable(GrayImage image, double[] vertical, double[] horizontal) {
        requireKernel(vertical);
        requireKernel(horizontal);
        int h = image.height();
        int w = image.width();

        double[][] rows = new double[h][];
        for (int y = 0; y < h; y++) {
            rows[y] = same(image.row(y), horizontal);
        }

        double[][] out = new double[h][w];
        double[] column = new double[h];
        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                column[y] = rows[y][x];
            }
            double[] blurred = same(column, vertical);
            for (int y = 0; y < h; y++) {
                out[y][x] = blurred[y];
            }
        }
        return GrayImage.of(out);
    }

    /**
     * 2 次元カーネルで画像を畳み込みます。
     *
     * @param image 入力画像です
     * @param kernel 2 次元カーネルです（[y][x]、矩形）
     * @return ぼけ画像です
     */
    public static GrayImage twoDimensional(GrayImage image, double[][] kernel) {
        if (kernel == null || kernel.length == 0 || kernel[0].length == 0) {
            throw new InvalidInputException("カーネルは 1x1 以上が必要です");
        }
        int kh = kernel.length;
        int kw = kernel[0].length;
        int cy = (kh - 1) / 2;
        int cx = (kw - 1) / 2;
        int h = image.height();
        int w = image.width();

        double[][] out = new double[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double s = 0.0;
                for (int ky = 0; ky < kh; ky++) {
                    int sy = y + cy - ky;
                    if (sy < 0 || sy >= h) {
                        continue;
                    }
                    for (int kx = 0; kx < kw; kx++) {
                        int sx = x + cx - kx;
                        if (sx >= 0 && sx < w) {
                            s += kernel[ky][kx] * image.get(sy, sx);
                        }
                    }
                }
                out[y][x] = s;
            }
        }
        return GrayImage.of(out);
    }

    private static void requireKernel(double[] kernel) {
        if (kernel == null || kernel.length == 0) {
            throw new InvalidInputException("カーネルは長さ 1 以上が必要です");
        }
    }
}

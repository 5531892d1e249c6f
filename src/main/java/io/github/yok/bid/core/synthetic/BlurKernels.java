package io.github.yok.bid.core.synthetic;

import io.github.yok.bid.core.InvalidInputException;
import java.util.Arrays;

/**
 * 合成ぼけ用の正規化済みカーネルを生成するユーティリティです。
 */
public final class BlurKernels {

    private BlurKernels() {
    }

    /**
     * 長さ size の箱型カーネル（各要素 1/size）を返します。
     *
     * @param size カーネル長です（1 以上）
     * @return 箱型カーネルです
     * @throws InvalidInputException size が 1 未満の場合に発生します
     */
    public static double[] box(int size) {
        requirePositive(size);
        double[] k = new double[size];
        Arrays.fill(k, 1.0 / size);
        return k;
    }

    /**
     * 長さ size のガウスカーネル（総和 1）を返します。
     *
     * <p>
     * 中心は {@code size / 2}（整数除算）です。
     * </p>
     *
     * @param size カーネル長です（1 以上）
     * @param sigma 標準偏差です（正の有限値）
     * @return ガウスカーネルです
     * @throws InvalidInputException 引数が不正な場合に発生します
     */
    public static double[] gaussian1d(int size, double sigma) {
        requirePositive(size);
        requireSigma(sigma);
        int radius = size / 2;
        double[] k = new double[size];
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            k[i] = Math.exp(-(d * d) / (2.0 * sigma * sigma));
            sum += k[i];
        }
        for (int i = 0; i < size; i++) {
            k[i] /= sum;
        }
        return k;
    }

    /**
     * size×size の 2 次元ガウスカーネル（総和 1）を返します。
     *
     * @param size 一辺の長さです（1 以上）
     * @param sigma 標準偏差です（正の有限値）
     * @return 2 次元ガウスカーネルです（[y][x]）
     * @throws InvalidInputException 引数が不正な場合に発生します
     */
    public static double[][] gaussian2d(int size, double sigma) {
        double[] g = gaussian1d(size, sigma);
        double[][] k = new double[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                k[y][x] = g[y] * g[x];
            }
        }
        return k;
    }

    private static void requirePositive(int size) {
        if (size <= 0) {
            throw new InvalidInputException("カーネル長は 1 以上が必要です: " + size);
        }
    }

    private static void requireSigma(double sigma) {
        if (!(sigma > 0.0) || !Double.isFinite(sigma)) {
            throw new InvalidInputException("sigma は正の有限値が必要です: " + sigma);
        }
    }
}

package io.github.yok.bid.core.quality;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.image.GrayImage;

/**
 * 2 枚の画像の MSE, PSNR, SSIM を計算するクラスです。
 *
 * <p>
 * 復元処理の中では真の鮮明画像が得られないため、{@link #evaluate} はぼけ画像と復元画像を比較する自己整合性の指標です。
 * 真の画像が別途ある場合は {@link #mse}, {@link #psnr}, {@link #ssim} をそのまま適用できます。
 * </p>
 */
public final class QualityEvaluator {

    /**
     * SSIM の安定化定数 C1 です。
     */
    public static final double C1 = (0.01 * 255) * (0.01 * 255);

    /**
     * SSIM の安定化定数 C2 です。
     */
    public static final double C2 = (0.03 * 255) * (0.03 * 255);

    /**
     * SSIM 窓の一辺の既定値です。
     */
    public static final int DEFAULT_WINDOW_SIZE = 11;

    /**
     * SSIM の局所統計量の求め方です。
     */
    private final SsimMode ssimMode;

    /**
     * SSIM 窓の一辺です。
     */
    private final int windowSize;

    /**
     * 既定設定（2 次元窓、一辺 11）で評価器を生成します。
     */
    public QualityEvaluator() {
        this(SsimMode.SPATIAL, DEFAULT_WINDOW_SIZE);
    }

    /**
     * 評価器を生成します。
     *
     * @param ssimMode SSIM の局所統計量の求め方です（null 不可）
     * @param windowSize SSIM 窓の一辺です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public QualityEvaluator(SsimMode ssimMode, int windowSize) {
        if (ssimMode == null) {
            throw new IllegalArgumentException("ssimMode は null 不可です");
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize は 1 以上が必要です: " + windowSize);
        }
        this.ssimMode = ssimMode;
        this.windowSize = windowSize;
    }

    /**
     * ぼけ画像と復元画像を比較して評価値を返します。
     *
     * @param blurred ぼけ画像です
     * @param restored 復元画像です
     * @return 評価値です
     * @throws InvalidInputException 形状が一致しない場合に発生します
     */
    public QualityMetrics evaluate(GrayImage blurred, GrayImage restored) {
        double mse = mse(blurred, restored);
        return new QualityMetrics(mse, psnrFromMse(mse), ssim(blurred, restored));
    }

    /**
     * 平均二乗誤差を返します。
     *
     * @param a 画像 1 です
     * @param b 画像 2 です
     * @return MSE です
     * @throws InvalidInputException 形状が一致しない場合に発生します
     */
    public double mse(GrayImage a, GrayImage b) {
        requireSameShape(a, b);
        double sum = 0.0;
        for (int y = 0; y < a.height(); y++) {
            for (int x = 0; x < a.width(); x++) {
                double d = a.get(y, x) - b.get(y, x);
                sum += d * d;
            }
        }
        return sum / ((double) a.height() * a.width());
    }

    /**
     * ピーク値 1.0 の PSNR [dB] を返します。
     *
     * @param a 画像 1 です
     * @param b 画像 2 です
     * @return PSNR です（MSE が 0 の場合は +∞）
     * @throws InvalidInputException 形状が一致しない場合に発生します
     */
    public double psnr(GrayImage a, GrayImage b) {
        return psnrFromMse(mse(a, b));
    }

    /**
     * SSIM を返します。
     *
     * @param a 画像 1 です
     * @param b 画像 2 です
     * @return SSIM マップの平均です
     * @throws InvalidInputException 形状が一致しない場合に発生します
     */
    public double ssim(GrayImage a, GrayImage b) {
        requireSameShape(a, b);
        switch (ssimMode) {
            case FLATTENED:
                return ssimFlattened(a.flatten(), b.flatten());
            case SPATIAL:
            default:
                return ssimSpatial(a, b);
        }
    }

    /**
     * MSE から PSNR を求めます。
     *
     * @param mse 平均二乗誤差です
     * @return PSNR です（MSE が 0 の場合は +∞）
     */
    static double psnrFromMse(double mse) {
        if (mse <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return 10.0 * Math.log10(1.0 / mse);
    }

    /**
     * 2 次元窓で SSIM を計算します。
     *
     * <p>
     * 窓の一辺は {@code min(windowSize, height, width)} とし、画像より大きな窓は取りません。
     * </p>
     */
    private double ssimSpatial(GrayImage a, GrayImage b) {
        int win = Math.min(windowSize, Math.min(a.height(), a.width()));
        int rows = a.height() - win + 1;
        int cols = a.width() - win + 1;
        double count = (double) win * win;

        double total = 0.0;
        for (int y0 = 0; y0 < rows; y0++) {
            for (int x0 = 0; x0 < cols; x0++) {
                double sa = 0.0;
                double sb = 0.0;
                double saa = 0.0;
                double sbb = 0.0;
                double sab = 0.0;
                for (int y = y0; y < y0 + win; y++) {
                    for (int x = x0; x < x0 + win; x++) {
                        double va = a.get(y, x);
                        double vb = b.get(y, x);
                        sa += va;
                        sb += vb;
                        saa += va * va;
                        sbb += vb * vb;
                        sab += va * vb;
                    }
                }
                total += ssimIndex(sa / count, sb / count, saa / count, sbb / count, sab / count);
            }
        }
        return total / ((double) rows * cols);
    }

    /**
     * 平坦化した 1 次元系列で SSIM を計算します。
     *
     * <p>
     * カーネル長は windowSize² です。系列がカーネルより短い場合は valid 位置が系列全体を覆う 1 つだけになり、 その値は系列の総和をカーネル長で割ったものです。
     * </p>
     */
    private double ssimFlattened(double[] a, double[] b) {
        int kernel = windowSize * windowSize;
        int n = a.length;

        if (n < kernel) {
            double[] s = windowSums(a, b, 0, n);
            return ssimIndex(s[0] / kernel, s[1] / kernel, s[2] / kernel, s[3] / kernel,
                    s[4] / kernel);
        }

        int positions = n - kernel + 1;
        double total = 0.0;
        for (int p = 0; p < positions; p++) {
            double[] s = windowSums(a, b, p, p + kernel);
            total += ssimIndex(s[0] / kernel, s[1] / kernel, s[2] / kernel, s[3] / kernel,
                    s[4] / kernel);
        }
        return total / positions;
    }

    /**
     * 区間 [from, to) の Σa, Σb, Σa², Σb², Σab を返します。
     */
    private static double[] windowSums(double[] a, double[] b, int from, int to) {
        double[] s = new double[5];
        for (int i = from; i < to; i++) {
            s[0] += a[i];
            s[1] += b[i];
            s[2] += a[i] * a[i];
            s[3] += b[i] * b[i];
            s[4] += a[i] * b[i];
        }
        return s;
    }

    /**
     * 局所統計量から SSIM 指標を求めます。
     *
     * @param mu1 画像 1 の局所平均です
     * @param mu2 画像 2 の局所平均です
     * @param e11 画像 1 の二乗の局所平均です
     * @param e22 画像 2 の二乗の局所平均です
     * @param e12 積の局所平均です
     * @return SSIM 指標です
     */
    private static double ssimIndex(double mu1, double mu2, double e11, double e22, double e12) {
        double mu1Sq = mu1 * mu1;
        double mu2Sq = mu2 * mu2;
        double mu1Mu2 = mu1 * mu2;
        double sigma1Sq = e11 - mu1Sq;
        double sigma2Sq = e22 - mu2Sq;
        double sigma12 = e12 - mu1Mu2;

        double numerator = (2 * mu1Mu2 + C1) * (2 * sigma12 + C2);
        double denominator = (mu1Sq + mu2Sq + C1) * (sigma1Sq + sigma2Sq + C2);
        return numerator / denominator;
    }

    /**
     * 2 枚の画像の形状が一致することを検査します。
     */
    private static void requireSameShape(GrayImage a, GrayImage b) {
        if (a == null || b == null) {
            throw new InvalidInputException("比較する画像は null 不可です");
        }
        if (!a.sameShape(b)) {
            throw new InvalidInputException("画像の形状が一致しません: " + a.height() + "x" + a.width()
                    + " != " + b.height() + "x" + b.width());
        }
    }
}

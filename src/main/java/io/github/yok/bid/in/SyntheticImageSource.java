package io.github.yok.bid.in;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.synthetic.BlurKernels;
import io.github.yok.bid.core.synthetic.Convolution;
import lombok.extern.slf4j.Slf4j;

/**
 * 既知の PSF でぼかした合成画像を供給するクラスです。
 *
 * <p>
 * 真値はなめらかな放射状パターン（中心ガウス、σ = size/3.5）に、左上の正方形ブロック（+0.25、上限 1）を重ねたものです。
 * </p>
 */
@Slf4j
public final class SyntheticImageSource implements ImageSource {

    /**
     * 画像名です。
     */
    static final String NAME = "synthetic";

    /**
     * ぼけカーネルの種類です。
     */
    public enum KernelKind {
        BOX, GAUSSIAN
    }

    private final int size;
    private final KernelKind kernel;
    private final int kernelSize;
    private final double sigma;

    /**
     * 合成入力を生成します。
     *
     * @param size 画像の一辺です（4 以上）
     * @param kernel カーネルの種類です（null 不可）
     * @param kernelSize カーネル長です（1 以上）
     * @param sigma ガウスカーネルの標準偏差です（GAUSSIAN の場合のみ使用）
     * @throws InvalidInputException 引数が不正な場合に発生します
     */
    public SyntheticImageSource(int size, KernelKind kernel, int kernelSize, double sigma) {
        if (size < 4) {
            throw new InvalidInputException("size は 4 以上が必要です: " + size);
        }
        if (kernel == null) {
            throw new InvalidInputException("kernel は null 不可です");
        }
        if (kernelSize < 1) {
            throw new InvalidInputException("kernelSize は 1 以上が必要です: " + kernelSize);
        }
        this.size = size;
        this.kernel = kernel;
        this.kernelSize = kernelSize;
        this.sigma = sigma;
    }

    @Override
    public SourceImage load() {
        GrayImage original = pattern(size);
        GrayImage blurred;
        if (kernel == KernelKind.BOX) {
            double[] k = BlurKernels.box(kernelSize);
            blurred = Convolution.separable(original, k, k);
        } else {
            blurred = Convolution.twoDimensional(original,
                    BlurKernels.gaussian2d(kernelSize, sigma));
        }
        log.info("合成画像を生成しました。画像={}x{}、カーネル={}、カーネル長={}", size, size, kernel,
                kernelSize);
        return new SourceImage(NAME, blurred, original);
    }

    /**
     * ぼかす前の真値パターンを生成します。
     *
     * @param size 画像の一辺です
     * @return 真値画像です（値域 [0, 1]）
     */
    static GrayImage pattern(int size) {
        double c = (size - 1) / 2.0;
        double s = size / 3.5;
        int lo = size / 8;
        int hi = lo + size / 4;

        double[][] px = new double[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                double dy = y - c;
                double dx = x - c;
                double v = Math.exp(-(dy * dy + dx * dx) / (2.0 * s * s));
                if (y >= lo && y < hi && x >= lo && x < hi) {
                    v = Math.min(1.0, v + 0.25);
                }
                px[y][x] = v;
            }
        }
        return GrayImage.of(px);
    }
}

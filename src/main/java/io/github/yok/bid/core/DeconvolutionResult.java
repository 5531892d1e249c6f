package io.github.yok.bid.core;

import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.psf.PointSpreadFunction;
import lombok.Value;

/**
 * ブラインドデコンボリューションの結果を保持するクラスです。
 *
 * <p>
 * 評価値はぼけ画像と復元画像の比較（自己整合性の指標）です。
 * </p>
 */
@Value
public class DeconvolutionResult {

    /**
     * 復元画像です（入力と同じ形状）。
     */
    GrayImage restoredImage;

    /**
     * 復元に用いた 2 次元 PSF です。
     */
    PointSpreadFunction estimatedPsf;

    /**
     * 平均二乗誤差です。
     */
    double mse;

    /**
     * PSNR [dB] です（MSE が 0 の場合は +∞）。
     */
    double psnr;

    /**
     * SSIM です。
     */
    double ssim;
}

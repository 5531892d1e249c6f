package io.github.yok.bid.core.quality;

import lombok.Value;

/**
 * 画質評価値（MSE, PSNR, SSIM）を保持するクラスです。
 */
@Value
public class QualityMetrics {

    /**
     * 平均二乗誤差です（0 以上）。
     */
    double mse;

    /**
     * ピーク信号対雑音比 [dB] です（MSE が 0 の場合は +∞）。
     */
    double psnr;

    /**
     * 構造的類似度です（同一画像で 1.0）。
     */
    double ssim;
}

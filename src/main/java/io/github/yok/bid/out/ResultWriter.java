package io.github.yok.bid.out;

import io.github.yok.bid.core.DeconvolutionResult;
import io.github.yok.bid.core.psf.PsfEstimation;
import io.github.yok.bid.core.quality.QualityMetrics;

/**
 * 復元結果を出力する処理のインタフェースです。
 *
 * <p>
 * 出力の命名規約に必要な画像名と、真値が分かる場合はその比較結果を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 復元結果を出力します。
     *
     * @param imageName 画像名です
     * @param estimation PSF 推定結果です
     * @param result 復元結果です
     * @param fidelity 真値と復元画像の比較結果です（真値が無い場合は null）
     */
    void write(String imageName, PsfEstimation estimation, DeconvolutionResult result,
            QualityMetrics fidelity);
}

package io.github.yok.bid.app;

import io.github.yok.bid.core.BlindDeconvolutionEngine;
import io.github.yok.bid.core.DeconvolutionResult;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.psf.PsfEstimation;
import io.github.yok.bid.core.quality.QualityEvaluator;
import io.github.yok.bid.core.quality.QualityMetrics;
import io.github.yok.bid.in.ImageSource;
import io.github.yok.bid.in.SourceImage;
import io.github.yok.bid.out.ResultWriter;
import java.util.Arrays;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で bid-solver を実行するクラスです。
 *
 * <p>
 * 入力画像から PSF を推定して復元し、結果を出力します。 真値の画像がある場合（合成画像）は、真値と復元画像の比較結果も表示します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BidCliRunner implements CommandLineRunner {

    /**
     * bid-solver の設定値（bid.*）です。
     */
    private final BidProperties properties;

    /**
     * 入力画像の供給元です。
     */
    private final ImageSource imageSource;

    /**
     * ブラインドデコンボリューションエンジンです。
     */
    private final BlindDeconvolutionEngine engine;

    /**
     * 真値との比較に用いる画質評価ロジックです。
     */
    private final QualityEvaluator qualityEvaluator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== bid-solver start: blind deconvolution ===");
        System.out.print(properties.toMultilineString());

        SourceImage source = imageSource.load();
        GrayImage blurred = source.getBlurred();
        System.out.println("入力: name=" + source.getName() + ", size=" + blurred.height() + "x"
                + blurred.width());

        // PSF は 1 回だけ推定し、復元にそのまま渡します。
        PsfEstimation estimation = engine.estimateAxes(blurred);
        DeconvolutionResult result = engine.deconvolve(blurred, estimation.getPsf());

        QualityMetrics fidelity = source.groundTruth()
                .map(truth -> qualityEvaluator.evaluate(truth, result.getRestoredImage()))
                .orElse(null);

        resultWriter.write(source.getName(), estimation, result, fidelity);

        System.out.println("PSF: " + result.getEstimatedPsf().height() + "x"
                + result.getEstimatedPsf().width() + " (次数 縦="
                + estimation.getVertical().getDegree() + ", 横="
                + estimation.getHorizontal().getDegree() + ", フォールバック="
                + estimation.isDegenerate() + ")");
        System.out.println("PSF(縦)=" + Arrays.toString(estimation.getVertical().getKernel())
                + ", PSF(横)=" + Arrays.toString(estimation.getHorizontal().getKernel()));
        System.out.println("結果: MSE=" + fmt5(result.getMse()) + ", PSNR=" + fmt5(result.getPsnr())
                + ", SSIM=" + fmt5(result.getSsim()));
        if (fidelity != null) {
            System.out.println("真値比較: MSE=" + fmt5(fidelity.getMse()) + ", PSNR="
                    + fmt5(fidelity.getPsnr()) + ", SSIM=" + fmt5(fidelity.getSsim()));
        }
        System.out.println("出力先: " + properties.getOutput().getDir());
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}

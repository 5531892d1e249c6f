package io.github.yok.bid.core;

import io.github.yok.bid.core.image.Axis;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.linearalgebra.EjmlSingularValueDecompositionBackend;
import io.github.yok.bid.core.linearalgebra.SingularValueDecompositionBackend;
import io.github.yok.bid.core.linearalgebra.TriangularSylvesterEquationBackend;
import io.github.yok.bid.core.psf.AxisPsfEstimate;
import io.github.yok.bid.core.psf.AxisPsfEstimator;
import io.github.yok.bid.core.psf.DegreeEstimator;
import io.github.yok.bid.core.psf.PointSpreadFunction;
import io.github.yok.bid.core.psf.PsfEstimation;
import io.github.yok.bid.core.psf.ResultantMatrixBuilder;
import io.github.yok.bid.core.psf.SeparablePsfComposer;
import io.github.yok.bid.core.quality.QualityEvaluator;
import io.github.yok.bid.core.quality.QualityMetrics;
import io.github.yok.bid.core.restoration.BandedOperatorBuilder;
import io.github.yok.bid.core.restoration.BandedOperators;
import io.github.yok.bid.core.restoration.IntensityMapping;
import io.github.yok.bid.core.restoration.SylvesterRestorer;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * ブラインドデコンボリューションの一連の処理を実行するクラスです。
 *
 * <p>
 * ぼけ画像 → 軸ごとの 1 次元 PSF 推定（×2） → 2 次元 PSF 合成 → 帯行列構築 → Sylvester 方程式の求解 → 画質評価、の順に処理します。
 * </p>
 *
 * <p>
 * 推定した PSF は内部に保持しません。同じ PSF で復元を繰り返す場合は、 {@link #estimatePsf} の戻り値を
 * {@link #deconvolve(GrayImage, PointSpreadFunction)} に渡してください。 状態を持たないため、複数スレッドから同じインスタンスを呼び出せます。
 * </p>
 */
@Getter
@Slf4j
public final class BlindDeconvolutionEngine {

    /**
     * 最大 PSF サイズ（終結式行列の候補次数の上限）です。
     */
    private final int maxPsfSize;

    /**
     * 帯行列の対角に加える正則化係数 ε です。
     */
    private final double regularization;

    /**
     * 軸ごとの 1 次元 PSF 推定ロジックです。
     */
    private final AxisPsfEstimator axisPsfEstimator;

    /**
     * 2 次元 PSF の合成ロジックです。
     */
    private final SeparablePsfComposer psfComposer;

    /**
     * 帯行列の構築ロジックです。
     */
    private final BandedOperatorBuilder operatorBuilder;

    /**
     * Sylvester 方程式による復元ロジックです。
     */
    private final SylvesterRestorer restorer;

    /**
     * 画質評価ロジックです。
     */
    private final QualityEvaluator qualityEvaluator;

    /**
     * エンジンを生成します。
     *
     * @param maxPsfSize 最大 PSF サイズです（1 以上）
     * @param regularization 正則化係数です（有限かつ 0 以上）
     * @param axisPsfEstimator 1 次元 PSF 推定ロジックです（null 不可）
     * @param psfComposer 2 次元 PSF 合成ロジックです（null 不可）
     * @param operatorBuilder 帯行列の構築ロジックです（null 不可）
     * @param restorer 復元ロジックです（null 不可）
     * @param qualityEvaluator 画質評価ロジックです（null 不可）
     * @throws InvalidInputException 設定値が不正な場合に発生します
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public BlindDeconvolutionEngine(int maxPsfSize, double regularization,
            AxisPsfEstimator axisPsfEstimator, SeparablePsfComposer psfComposer,
            BandedOperatorBuilder operatorBuilder, SylvesterRestorer restorer,
            QualityEvaluator qualityEvaluator) {
        if (maxPsfSize < 1) {
            throw new InvalidInputException("maxPsfSize は 1 以上が必要です: " + maxPsfSize);
        }
        if (!Double.isFinite(regularization) || regularization < 0.0) {
            throw new InvalidInputException("regularization は有限かつ 0 以上が必要です: " + regularization);
        }
        if (axisPsfEstimator == null) {
            throw new IllegalArgumentException("axisPsfEstimator は null 不可です");
        }
        if (psfComposer == null) {
            throw new IllegalArgumentException("psfComposer は null 不可です");
        }
        if (operatorBuilder == null) {
            throw new IllegalArgumentException("operatorBuilder は null 不可です");
        }
        if (restorer == null) {
            throw new IllegalArgumentException("restorer は null 不可です");
        }
        if (qualityEvaluator == null) {
            throw new IllegalArgumentException("qualityEvaluator は null 不可です");
        }
        this.maxPsfSize = maxPsfSize;
        this.regularization = regularization;
        this.axisPsfEstimator = axisPsfEstimator;
        this.psfComposer = psfComposer;
        this.operatorBuilder = operatorBuilder;
        this.restorer = restorer;
        this.qualityEvaluator = qualityEvaluator;
    }

    /**
     * 既定の部品（EJML の SVD、三角 Sylvester 解法、入力輝度範囲への写像、2 次元 SSIM）でエンジンを生成します。
     *
     * @param maxPsfSize 最大 PSF サイズです（1 以上）
     * @param regularization 正則化係数です（有限かつ 0 以上）
     * @return エンジンです
     * @throws InvalidInputException 設定値が不正な場合に発生します
     */
    public static BlindDeconvolutionEngine create(int maxPsfSize, double regularization) {
        SingularValueDecompositionBackend svd = new EjmlSingularValueDecompositionBackend();
        AxisPsfEstimator estimator = new AxisPsfEstimator(new ResultantMatrixBuilder(),
                new DegreeEstimator(svd), svd);
        SylvesterRestorer restorer = new SylvesterRestorer(
                new TriangularSylvesterEquationBackend(), IntensityMapping.INPUT_RANGE);
        return new BlindDeconvolutionEngine(maxPsfSize, regularization, estimator,
                new SeparablePsfComposer(), new BandedOperatorBuilder(), restorer,
                new QualityEvaluator());
    }

    /**
     * ぼけ画像から分離可能な 2 次元 PSF を推定します。
     *
     * @param blurred ぼけ画像です
     * @return 2 次元 PSF です（各辺 maxPsfSize 以下、総和 1）
     * @throws InvalidInputException maxPsfSize が画像の短辺以上の場合などに発生します
     */
    public PointSpreadFunction estimatePsf(GrayImage blurred) {
        return estimateAxes(blurred).getPsf();
    }

    /**
     * ぼけ画像から 2 軸分の 1 次元 PSF を推定し、2 次元 PSF を合成します。
     *
     * @param blurred ぼけ画像です
     * @return 推定結果です
     * @throws InvalidInputException maxPsfSize が画像の短辺以上の場合などに発生します
     */
    public PsfEstimation estimateAxes(GrayImage blurred) {
        requireEstimable(blurred);

        AxisPsfEstimate horizontal =
                axisPsfEstimator.estimate(blurred, Axis.HORIZONTAL, maxPsfSize);
        AxisPsfEstimate vertical = axisPsfEstimator.estimate(blurred, Axis.VERTICAL, maxPsfSize);
        PointSpreadFunction psf = psfComposer.compose(vertical, horizontal);

        log.info("PSFを推定しました。画像={}x{}、PSF={}x{}、次数(縦)={}、次数(横)={}、フォールバック={}",
                blurred.height(), blurred.width(), psf.height(), psf.width(), vertical.getDegree(),
                horizontal.getDegree(), vertical.isDegenerate() || horizontal.isDegenerate());
        return new PsfEstimation(vertical, horizontal, psf);
    }

    /**
     * PSF を推定してから復元します。
     *
     * @param blurred ぼけ画像です
     * @return 復元結果です
     * @throws InvalidInputException 入力が不正な場合に発生します
     * @throws NumericalInstabilityException 求解が非有限値を返した場合に発生します
     */
    public DeconvolutionResult deconvolve(GrayImage blurred) {
        return deconvolve(blurred, estimatePsf(blurred));
    }

    /**
     * 指定した PSF でぼけ画像を復元し、評価値を計算します。
     *
     * @param blurred ぼけ画像です
     * @param psf 2 次元 PSF です
     * @return 復元結果です
     * @throws InvalidInputException 入力が不正な場合に発生します
     * @throws NumericalInstabilityException 求解が非有限値を返した場合に発生します
     */
    public DeconvolutionResult deconvolve(GrayImage blurred, PointSpreadFunction psf) {
        if (blurred == null) {
            throw new InvalidInputException("blurred は null 不可です");
        }
        if (psf == null) {
            throw new InvalidInputException("psf は null 不可です");
        }

        long t0 = System.nanoTime();
        BandedOperators operators =
                operatorBuilder.build(psf, blurred.height(), blurred.width(), regularization);
        GrayImage restored = restorer.restore(operators, blurred);
        QualityMetrics metrics = qualityEvaluator.evaluate(blurred, restored);

        log.info("復元が完了しました。画像={}x{}、MSE={}、PSNR={}、SSIM={}、経過={}ms", blurred.height(),
                blurred.width(), fmt5(metrics.getMse()), fmt5(metrics.getPsnr()),
                fmt5(metrics.getSsim()), (System.nanoTime() - t0) / 1_000_000L);

        return new DeconvolutionResult(restored, psf, metrics.getMse(), metrics.getPsnr(),
                metrics.getSsim());
    }

    /**
     * PSF 推定の前提（画像サイズと maxPsfSize の関係）を検査します。
     *
     * @param blurred ぼけ画像です
     * @throws InvalidInputException 前提を満たさない場合に発生します
     */
    private void requireEstimable(GrayImage blurred) {
        if (blurred == null) {
            throw new InvalidInputException("blurred は null 不可です");
        }
        int shortSide = Math.min(blurred.height(), blurred.width());
        if (maxPsfSize >= shortSide) {
            throw new InvalidInputException("maxPsfSize は画像の短辺未満が必要です: maxPsfSize=" + maxPsfSize
                    + ", image=" + blurred.height() + "x" + blurred.width());
        }
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

package io.github.yok.bid.app;

import io.github.yok.bid.core.BlindDeconvolutionEngine;
import io.github.yok.bid.core.linearalgebra.EjmlKroneckerSylvesterEquationBackend;
import io.github.yok.bid.core.linearalgebra.EjmlSingularValueDecompositionBackend;
import io.github.yok.bid.core.linearalgebra.SingularValueDecompositionBackend;
import io.github.yok.bid.core.linearalgebra.SylvesterEquationBackend;
import io.github.yok.bid.core.linearalgebra.TriangularSylvesterEquationBackend;
import io.github.yok.bid.core.psf.AxisPsfEstimator;
import io.github.yok.bid.core.psf.DegreeEstimator;
import io.github.yok.bid.core.psf.ResultantMatrixBuilder;
import io.github.yok.bid.core.psf.SeparablePsfComposer;
import io.github.yok.bid.core.quality.QualityEvaluator;
import io.github.yok.bid.core.restoration.BandedOperatorBuilder;
import io.github.yok.bid.core.restoration.SylvesterRestorer;
import io.github.yok.bid.in.CsvImageSource;
import io.github.yok.bid.in.ImageSource;
import io.github.yok.bid.in.SyntheticImageSource;
import io.github.yok.bid.out.CsvResultWriter;
import io.github.yok.bid.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 終結式による PSF 推定 + Sylvester 方程式による復元の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class BlindDeconvolutionConfiguration {

    /**
     * bid-solver の設定値（bid.*）です。
     */
    private final BidProperties p;

    /**
     * 特異値分解バックエンドを生成します。
     *
     * @return EJML による特異値分解バックエンドです
     */
    @Bean
    public SingularValueDecompositionBackend singularValueDecompositionBackend() {
        return new EjmlSingularValueDecompositionBackend();
    }

    /**
     * 1 次元 PSF 推定ロジックを生成します。
     *
     * @param svd 特異値分解バックエンドです
     * @return 1 次元 PSF 推定ロジックです
     */
    @Bean
    public AxisPsfEstimator axisPsfEstimator(SingularValueDecompositionBackend svd) {
        return new AxisPsfEstimator(new ResultantMatrixBuilder(), new DegreeEstimator(svd),
                svd);
    }

    /**
     * Sylvester 方程式の求解バックエンドを、設定された解法に従って生成します。
     *
     * @return 求解バックエンドです
     */
    @Bean
    public SylvesterEquationBackend sylvesterEquationBackend() {
        BidProperties.Restoration r = p.getRestoration();
        switch (r.getSolver()) {
            case KRONECKER:
                return new EjmlKroneckerSylvesterEquationBackend(r.getKroneckerMaxUnknowns());
            case TRIANGULAR:
            default:
                return new TriangularSylvesterEquationBackend();
        }
    }

    /**
     * 復元ロジックを生成します。
     *
     * @param backend 求解バックエンドです
     * @return 復元ロジックです
     */
    @Bean
    public SylvesterRestorer sylvesterRestorer(SylvesterEquationBackend backend) {
        return new SylvesterRestorer(backend, p.getRestoration().getIntensityMapping());
    }

    /**
     * 画質評価ロジックを生成します。
     *
     * @return 画質評価ロジックです
     */
    @Bean
    public QualityEvaluator qualityEvaluator() {
        return new QualityEvaluator(p.getQuality().getSsimMode(), p.getQuality().getWindowSize());
    }

    /**
     * ブラインドデコンボリューションエンジンを生成します。
     *
     * @param axisPsfEstimator 1 次元 PSF 推定ロジックです
     * @param restorer 復元ロジックです
     * @param qualityEvaluator 画質評価ロジックです
     * @return エンジンです
     */
    @Bean
    public BlindDeconvolutionEngine blindDeconvolutionEngine(AxisPsfEstimator axisPsfEstimator,
            SylvesterRestorer restorer, QualityEvaluator qualityEvaluator) {
        return new BlindDeconvolutionEngine(p.getPsf().getMaxPsfSize(),
                p.getRestoration().getRegularization(), axisPsfEstimator,
                new SeparablePsfComposer(), new BandedOperatorBuilder(), restorer,
                qualityEvaluator);
    }

    /**
     * 入力画像の供給元を生成します。
     *
     * <p>
     * input.path が空の場合は合成画像を使用します。
     * </p>
     *
     * @return 入力画像の供給元です
     */
    @Bean
    public ImageSource imageSource() {
        BidProperties.Input in = p.getInput();
        if (!in.isSynthetic()) {
            return new CsvImageSource(in.getPath());
        }
        BidProperties.Input.Synthetic s = in.getSynthetic();
        return new SyntheticImageSource(s.getSize(), s.getKernel(), s.getKernelSize(),
                s.getSigma());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir(), p.getPsf().getMaxPsfSize(),
                p.getRestoration().getRegularization());
    }
}

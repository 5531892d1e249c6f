package io.github.yok.bid.core.psf;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.image.Axis;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.linearalgebra.SingularValueDecompositionBackend;
import io.github.yok.bid.core.linearalgebra.SingularValueDecompositionBackend.SingularValueDecompositionResult;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 画像の 1 軸に沿って 1 次元 PSF を推定するクラスです。
 *
 * <p>
 * 代表系列 2 本（先頭 2 行または先頭 2 列）→ 共通平均の除去 → 終結式行列 → 次数推定 → 右特異ベクトルの切り出し → 正規化、の順に処理します。
 * </p>
 *
 * <p>
 * 行列がエネルギーを持たない（定数画像）場合、または係数の総和がほぼ 0 の場合は、 長さ maxPsfSize の一様カーネルに置き換えます。
 * </p>
 */
@Slf4j
public final class AxisPsfEstimator {

    /**
     * 係数総和を 0 とみなす許容誤差です。
     */
    static final double ZERO_SUM_TOLERANCE = 1e-12;

    /**
     * 最大特異値を 0 とみなす許容誤差です。
     */
    static final double ZERO_ENERGY_TOLERANCE = 1e-12;

    /**
     * 終結式行列の構築ロジックです。
     */
    private final ResultantMatrixBuilder resultantMatrixBuilder;

    /**
     * 次数推定ロジックです。
     */
    private final DegreeEstimator degreeEstimator;

    /**
     * 特異値分解バックエンドです。
     */
    private final SingularValueDecompositionBackend svdBackend;

    /**
     * 推定器を生成します。
     *
     * @param resultantMatrixBuilder 終結式行列の構築ロジックです（null 不可）
     * @param degreeEstimator 次数推定ロジックです（null 不可）
     * @param svdBackend 特異値分解バックエンドです（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public AxisPsfEstimator(ResultantMatrixBuilder resultantMatrixBuilder,
            DegreeEstimator degreeEstimator, SingularValueDecompositionBackend svdBackend) {
        if (resultantMatrixBuilder == null) {
            throw new IllegalArgumentException("resultantMatrixBuilder は null 不可です");
        }
        if (degreeEstimator == null) {
            throw new IllegalArgumentException("degreeEstimator は null 不可です");
        }
        if (svdBackend == null) {
            throw new IllegalArgumentException("svdBackend は null 不可です");
        }
        this.resultantMatrixBuilder = resultantMatrixBuilder;
        this.degreeEstimator = degreeEstimator;
        this.svdBackend = svdBackend;
    }

    /**
     * 指定軸の 1 次元 PSF を推定します。
     *
     * @param image ぼけ画像です
     * @param axis 推定する軸です
     * @param maxPsfSize 最大 PSF サイズです（1 以上、系列長未満）
     * @return 推定結果です
     * @throws InvalidInputException 画像が小さすぎる、または maxPsfSize が範囲外の場合に発生します
     */
    public AxisPsfEstimate estimate(GrayImage image, Axis axis, int maxPsfSize) {
        if (image == null) {
            throw new InvalidInputException("image は null 不可です");
        }
        if (axis == null) {
            throw new InvalidInputException("axis は null 不可です");
        }
        if (image.height() < 2 || image.width() < 2) {
            throw new InvalidInputException(
                    "代表系列を 2 本取るため画像は 2x2 以上が必要です: " + image.height() + "x" + image.width());
        }
        int n = axis.length(image);
        if (maxPsfSize < 1 || maxPsfSize >= n) {
            throw new InvalidInputException("maxPsfSize は 1 以上かつ系列長未満が必要です: maxPsfSize="
                    + maxPsfSize + ", axis=" + axis + ", 系列長=" + n);
        }

        double[][] sequences = axis.representativeSequences(image);
        centerJointly(sequences[0], sequences[1]);

        DMatrixRMaj resultant =
                resultantMatrixBuilder.build(sequences[0], sequences[1], maxPsfSize);
        SingularValueDecompositionResult svd = svdBackend.decomposeAndSort(resultant);
        double[] singularValues = svd.getSingularValues();

        if (singularValues[0] <= ZERO_ENERGY_TOLERANCE) {
            // 定数画像など、系列に情報がない場合です。
            return fallback(axis, 1, maxPsfSize, "終結式行列がエネルギーを持ちません");
        }

        int degree = degreeEstimator.estimateFromSpectrum(singularValues, maxPsfSize);
        double[] raw = Arrays.copyOf(svd.rightSingularVector(degree - 1), degree);

        double sum = 0.0;
        for (double v : raw) {
            sum += v;
        }
        if (Math.abs(sum) < ZERO_SUM_TOLERANCE) {
            return fallback(axis, degree, maxPsfSize, "PSF 係数の総和がほぼ 0 です: " + sum);
        }

        for (int i = 0; i < raw.length; i++) {
            raw[i] /= sum;
        }
        log.debug("1次元PSFを推定しました。軸={}、次数={}、カーネル={}", axis, degree,
                Arrays.toString(raw));
        return new AxisPsfEstimate(axis, degree, raw, false);
    }

    /**
     * 一様カーネル（1/maxPsfSize）へのフォールバック結果を返します。
     *
     * @param axis 軸です
     * @param degree 推定次数です
     * @param maxPsfSize 最大 PSF サイズです
     * @param reason 理由です
     * @return 一様カーネルの推定結果です
     */
    private static AxisPsfEstimate fallback(Axis axis, int degree, int maxPsfSize, String reason) {
        log.warn("PSF 推定が退化したため一様カーネルに置き換えます。軸={}、次数={}、長さ={}、理由={}", axis, degree,
                maxPsfSize, reason);
        double[] uniform = new double[maxPsfSize];
        Arrays.fill(uniform, 1.0 / maxPsfSize);
        return new AxisPsfEstimate(axis, degree, uniform, true);
    }

    /**
     * 2 本の系列から共通平均を差し引きます（その場で書き換えます）。
     *
     * <p>
     * 直流成分がスペクトルを支配して次数が常に 1 になるのを防ぎます。
     * </p>
     *
     * @param a 系列 1 です
     * @param b 系列 2 です
     */
    private static void centerJointly(double[] a, double[] b) {
        double sum = 0.0;
        for (double v : a) {
            sum += v;
        }
        for (double v : b) {
            sum += v;
        }
        double mean = sum / (a.length + b.length);
        for (int i = 0; i < a.length; i++) {
            a[i] -= mean;
        }
        for (int i = 0; i < b.length; i++) {
            b[i] -= mean;
        }
    }
}

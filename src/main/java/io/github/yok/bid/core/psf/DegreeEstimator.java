package io.github.yok.bid.core.psf;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.linearalgebra.SingularValueDecompositionBackend;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 終結式行列の特異値スペクトルから PSF の台の長さ（次数）を推定するクラスです。
 *
 * <p>
 * 最大特異値で正規化した降順スペクトルの落差 {@code s[i] − s[i+1]} が最大となる位置（ニー点）を求め、 {@code argmax + 1}
 * を次数とします。探索範囲は {@code i < maxDegree} に限るため、結果は常に [1, maxDegree] です。
 * </p>
 */
@Slf4j
public final class DegreeEstimator {

    /**
     * 特異値分解バックエンドです。
     */
    private final SingularValueDecompositionBackend svdBackend;

    /**
     * 次数推定器を生成します。
     *
     * @param svdBackend 特異値分解バックエンドです（null 不可）
     * @throws IllegalArgumentException svdBackend が null の場合に発生します
     */
    public DegreeEstimator(SingularValueDecompositionBackend svdBackend) {
        if (svdBackend == null) {
            throw new IllegalArgumentException("svdBackend は null 不可です");
        }
        this.svdBackend = svdBackend;
    }

    /**
     * 終結式行列から次数を推定します。
     *
     * @param resultant 最大候補次数で構築した終結式行列です
     * @param maxDegree 最大候補次数です（1 以上）
     * @return 推定次数です（1 以上 maxDegree 以下）
     * @throws InvalidInputException maxDegree が 1 未満の場合に発生します
     */
    public int estimate(DMatrixRMaj resultant, int maxDegree) {
        if (resultant == null) {
            throw new InvalidInputException("resultant は null 不可です");
        }
        return estimateFromSpectrum(svdBackend.singularValuesDescending(resultant), maxDegree);
    }

    /**
     * 降順の特異値スペクトルから次数を推定します。
     *
     * <p>
     * 全特異値が等しい（0 を含む平坦なスペクトル）場合は 1 を返します。 落差の最大値が複数ある場合は最初のインデックスを採用します。
     * </p>
     *
     * @param singularValues 降順の特異値です
     * @param maxDegree 最大候補次数です（1 以上）
     * @return 推定次数です（1 以上 maxDegree 以下）
     * @throws InvalidInputException maxDegree が 1 未満、または特異値が空の場合に発生します
     */
    public int estimateFromSpectrum(double[] singularValues, int maxDegree) {
        if (maxDegree < 1) {
            throw new InvalidInputException("maxDegree は 1 以上が必要です: " + maxDegree);
        }
        if (singularValues == null || singularValues.length == 0) {
            throw new InvalidInputException("特異値が空です");
        }

        double largest = singularValues[0];
        if (isFlat(singularValues)) {
            log.debug("特異値スペクトルが平坦なため次数 1 とします。最大特異値={}", largest);
            return 1;
        }

        int limit = Math.min(maxDegree, singularValues.length - 1);
        int knee = 0;
        double bestDrop = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < limit; i++) {
            double drop = (singularValues[i] - singularValues[i + 1]) / largest;
            // 厳密に大きい場合のみ更新し、同値は先頭を残します。
            if (drop > bestDrop) {
                bestDrop = drop;
                knee = i;
            }
        }

        int degree = knee + 1;
        log.debug("ニー点を検出しました。次数={}、落差={}、最大候補次数={}", degree, bestDrop, maxDegree);
        return degree;
    }

    /**
     * スペクトルが平坦（全特異値が等しい）かを返します。
     *
     * @param singularValues 降順の特異値です
     * @return 平坦な場合は true です
     */
    private static boolean isFlat(double[] singularValues) {
        double first = singularValues[0];
        for (double s : singularValues) {
            if (s != first) {
                return false;
            }
        }
        return true;
    }
}

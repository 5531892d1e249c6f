package io.github.yok.bid.core.psf;

import io.github.yok.bid.core.InvalidInputException;
import org.ejml.data.DMatrixRMaj;

/**
 * 2 本の系列から Sylvester 型の終結式行列を構築するクラスです。
 *
 * <p>
 * 長さ n の系列 row1, row2 と候補次数 d に対して、(2n−d)×(2n−d) の正方行列を作ります。
 * </p>
 *
 * <ul>
 * <li>列 i (0 ≤ i &lt; n−d): row1 を行 i..i+n−1 に配置（列ごとに 1 行ずつ下へシフト）</li>
 * <li>列 (n−d)+i (0 ≤ i &lt; n−d): row2 を行 i..i+n−1 に配置</li>
 * <li>右端の d 列: 0</li>
 * </ul>
 *
 * <p>
 * row2 が row1 と共通の畳み込み因子（次数 d の PSF）を持つ場合、この行列はその次数で階数落ちします。
 * </p>
 */
public final class ResultantMatrixBuilder {

    /**
     * 終結式行列を構築します。
     *
     * @param row1 系列 1 です（長さ n）
     * @param row2 系列 2 です（長さ n）
     * @param degree 候補次数 d です（1 ≤ d &lt; n）
     * @return (2n−d)×(2n−d) の行列です
     * @throws InvalidInputException 系列長の不一致、または次数が範囲外の場合に発生します
     */
    public DMatrixRMaj build(double[] row1, double[] row2, int degree) {
        if (row1 == null || row2 == null) {
            throw new InvalidInputException("row1/row2 は null 不可です");
        }
        int n = row1.length;
        if (row2.length != n) {
            throw new InvalidInputException(
                    "row1 と row2 の長さが一致しません: " + n + " != " + row2.length);
        }
        if (degree < 1 || degree >= n) {
            throw new InvalidInputException(
                    "次数 d は 1 以上かつ系列長未満が必要です: d=" + degree + ", n=" + n);
        }

        int size = 2 * n - degree;
        int shifts = n - degree;
        DMatrixRMaj s = new DMatrixRMaj(size, size);

        for (int i = 0; i < shifts; i++) {
            for (int k = 0; k < n; k++) {
                s.set(i + k, i, row1[k]);
                s.set(i + k, shifts + i, row2[k]);
            }
        }
        return s;
    }
}

package io.github.yok.bid.core.psf;

import lombok.Value;

/**
 * 2 軸分の 1 次元推定結果と、それらから合成した 2 次元 PSF を保持するクラスです。
 */
@Value
public class PsfEstimation {

    /**
     * 縦方向（列）の推定結果です。
     */
    AxisPsfEstimate vertical;

    /**
     * 横方向（行）の推定結果です。
     */
    AxisPsfEstimate horizontal;

    /**
     * 合成した 2 次元 PSF です。
     */
    PointSpreadFunction psf;

    /**
     * いずれかの軸で一様カーネルへのフォールバックが起きたかを返します。
     *
     * @return フォールバックが起きた場合は true です
     */
    public boolean isDegenerate() {
        return vertical.isDegenerate() || horizontal.isDegenerate();
    }
}

package io.github.yok.bid.core.psf;

import io.github.yok.bid.core.image.Axis;
import lombok.Value;

/**
 * 1 軸分の PSF 推定結果を保持するクラスです。
 */
@Value
public class AxisPsfEstimate {

    /**
     * 推定した軸です。
     */
    Axis axis;

    /**
     * ニー点から推定した次数です。
     */
    int degree;

    /**
     * 総和 1 に正規化した 1 次元カーネルです。
     */
    double[] kernel;

    /**
     * 一様カーネルへのフォールバックを行ったかどうかです。
     */
    boolean degenerate;

    /**
     * カーネル長を返します。
     *
     * @return カーネル長です
     */
    public int length() {
        return kernel.length;
    }
}

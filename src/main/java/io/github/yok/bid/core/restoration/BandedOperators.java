package io.github.yok.bid.core.restoration;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 縦・横 2 軸分の帯行列（ぼけ作用素）を保持するクラスです。
 */
@Value
public class BandedOperators {

    /**
     * 縦方向の作用素 H_y（height×height）です。
     */
    DMatrixRMaj vertical;

    /**
     * 横方向の作用素 H_x（width×width）です。
     */
    DMatrixRMaj horizontal;
}

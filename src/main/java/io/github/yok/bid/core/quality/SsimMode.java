package io.github.yok.bid.core.quality;

/**
 * SSIM の局所統計量を求める方法です。
 */
public enum SsimMode {

    /**
     * 画像グリッド上の 2 次元窓（一辺 windowSize、valid 配置）で局所統計量を求めます。
     */
    SPATIAL,

    /**
     * 各画像を行優先で 1 次元に平坦化し、長さ windowSize² の一様カーネルで valid 畳み込みします。
     *
     * <p>
     * 行の境界をまたいで窓が取られるため 2 次元の局所性は失われます。既存の計算結果との比較用です。
     * </p>
     */
    FLATTENED
}

package io.github.yok.bid.core.image;

/**
 * PSF を推定する画像の軸です。
 */
public enum Axis {

    /**
     * 行方向（x 方向）です。先頭 2 行を代表系列として用います。
     */
    HORIZONTAL {
        @Override
        public double[][] representativeSequences(GrayImage image) {
            return new double[][] {image.row(0), image.row(1)};
        }

        @Override
        public int length(GrayImage image) {
            return image.width();
        }
    },

    /**
     * 列方向（y 方向）です。先頭 2 列を代表系列として用います。
     */
    VERTICAL {
        @Override
        public double[][] representativeSequences(GrayImage image) {
            return new double[][] {image.column(0), image.column(1)};
        }

        @Override
        public int length(GrayImage image) {
            return image.height();
        }
    };

    /**
     * この軸に沿った代表系列 2 本を返します。
     *
     * @param image 画像です（この軸と直交する方向に 2 以上の長さが必要です）
     * @return {@code [系列1, 系列2]} です
     */
    public abstract double[][] representativeSequences(GrayImage image);

    /**
     * この軸に沿った系列長を返します。
     *
     * @param image 画像です
     * @return 系列長です
     */
    public abstract int length(GrayImage image);
}

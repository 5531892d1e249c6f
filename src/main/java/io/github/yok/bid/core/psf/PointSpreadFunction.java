package io.github.yok.bid.core.psf;

import io.github.yok.bid.core.InvalidInputException;
import java.util.Arrays;

/**
 * 2 次元の点拡がり関数（PSF）を保持する不変クラスです。
 *
 * <p>
 * 形状は psfHeight×psfWidth、係数の総和は 1 です。
 * </p>
 */
public final class PointSpreadFunction {

    /**
     * 高さ（縦方向の台の長さ）です。
     */
    private final int height;

    /**
     * 幅（横方向の台の長さ）です。
     */
    private final int width;

    /**
     * 行優先の係数です。
     */
    private final double[] coefficients;

    /**
     * PSF を生成します。
     *
     * @param coefficients 係数です（[y][x]、矩形かつ有限値のみ、コピーして保持します）
     * @throws InvalidInputException 空配列・非矩形・非有限値を含む場合に発生します
     */
    public PointSpreadFunction(double[][] coefficients) {
        if (coefficients == null || coefficients.length == 0 || coefficients[0] == null
                || coefficients[0].length == 0) {
            throw new InvalidInputException("PSF は 1x1 以上の 2 次元配列が必要です");
        }
        this.height = coefficients.length;
        this.width = coefficients[0].length;
        this.coefficients = new double[height * width];
        for (int y = 0; y < height; y++) {
            if (coefficients[y] == null || coefficients[y].length != width) {
                throw new InvalidInputException("PSF は矩形である必要があります: row=" + y);
            }
            for (int x = 0; x < width; x++) {
                double v = coefficients[y][x];
                if (!Double.isFinite(v)) {
                    throw new InvalidInputException(
                            "PSF 係数は有限値である必要があります: (y=" + y + ", x=" + x + ")=" + v);
                }
                this.coefficients[y * width + x] = v;
            }
        }
    }

    /**
     * 高さを返します。
     *
     * @return 高さです
     */
    public int height() {
        return height;
    }

    /**
     * 幅を返します。
     *
     * @return 幅です
     */
    public int width() {
        return width;
    }

    /**
     * 係数を返します。
     *
     * @param y 行インデックスです
     * @param x 列インデックスです
     * @return 係数です
     */
    public double get(int y, int x) {
        return coefficients[y * width + x];
    }

    /**
     * 先頭行（横方向のプロファイル）を返します。
     *
     * @return 長さ width の配列です
     */
    public double[] firstRow() {
        return Arrays.copyOf(coefficients, width);
    }

    /**
     * 先頭列（縦方向のプロファイル）を返します。
     *
     * @return 長さ height の配列です
     */
    public double[] firstColumn() {
        double[] out = new double[height];
        for (int y = 0; y < height; y++) {
            out[y] = coefficients[y * width];
        }
        return out;
    }

    /**
     * 係数の総和を返します。
     *
     * @return 総和です
     */
    public double sum() {
        double s = 0.0;
        for (double v : coefficients) {
            s += v;
        }
        return s;
    }

    /**
     * 係数を 2 次元配列として返します。
     *
     * @return 新しく確保した配列です（[y][x]）
     */
    public double[][] toArray() {
        double[][] out = new double[height][];
        for (int y = 0; y < height; y++) {
            out[y] = Arrays.copyOfRange(coefficients, y * width, (y + 1) * width);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PointSpreadFunction)) {
            return false;
        }
        PointSpreadFunction other = (PointSpreadFunction) o;
        return height == other.height && width == other.width
                && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return "PointSpreadFunction(" + height + "x" + width + ")";
    }
}

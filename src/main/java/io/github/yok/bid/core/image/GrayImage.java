package io.github.yok.bid.core.image;

import io.github.yok.bid.core.InvalidInputException;
import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;

/**
 * 単一チャネルの濃淡画像（[0,1] に正規化された画素値の 2 次元配列）を保持するクラスです。
 *
 * <p>
 * 画素は行優先で保持し、インデックス変換は {@code index = y * width + x} です。 生成時に入力をコピーするため、呼び出し元の配列が後から変更されても影響を受けません。
 * </p>
 */
public final class GrayImage {

    /**
     * 高さ（行数）です。
     */
    private final int height;

    /**
     * 幅（列数）です。
     */
    private final int width;

    /**
     * 行優先の画素値です。
     */
    private final double[] data;

    private GrayImage(int height, int width, double[] data) {
        this.height = height;
        this.width = width;
        this.data = data;
    }

    /**
     * 2 次元配列から画像を生成します。
     *
     * @param pixels 画素値です（pixels[y][x]、矩形かつ有限値のみ）
     * @return 画像です
     * @throws InvalidInputException 空配列・非矩形・非有限値を含む場合に発生します
     */
    public static GrayImage of(double[][] pixels) {
        if (pixels == null || pixels.length == 0) {
            throw new InvalidInputException("画像は 1 行以上の 2 次元配列が必要です");
        }
        if (pixels[0] == null || pixels[0].length == 0) {
            throw new InvalidInputException("画像は 1 列以上の 2 次元配列が必要です");
        }
        int h = pixels.length;
        int w = pixels[0].length;
        double[] copy = new double[h * w];
        for (int y = 0; y < h; y++) {
            double[] row = pixels[y];
            if (row == null || row.length != w) {
                throw new InvalidInputException("画像は矩形である必要があります: row=" + y + ", length="
                        + (row == null ? "null" : String.valueOf(row.length)) + ", width=" + w);
            }
            for (int x = 0; x < w; x++) {
                double v = row[x];
                if (!Double.isFinite(v)) {
                    throw new InvalidInputException(
                            "画素値は有限値である必要があります: (y=" + y + ", x=" + x + ")=" + v);
                }
                copy[y * w + x] = v;
            }
        }
        return new GrayImage(h, w, copy);
    }

    /**
     * 行列（行数=高さ、列数=幅）から画像を生成します。
     *
     * @param matrix 行列です
     * @return 画像です
     * @throws InvalidInputException 空行列・非有限値を含む場合に発生します
     */
    public static GrayImage fromMatrix(DMatrixRMaj matrix) {
        if (matrix == null || matrix.numRows == 0 || matrix.numCols == 0) {
            throw new InvalidInputException("画像は 1x1 以上の行列が必要です");
        }
        int h = matrix.numRows;
        int w = matrix.numCols;
        double[] copy = new double[h * w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = matrix.get(y, x);
                if (!Double.isFinite(v)) {
                    throw new InvalidInputException(
                            "画素値は有限値である必要があります: (y=" + y + ", x=" + x + ")=" + v);
                }
                copy[y * w + x] = v;
            }
        }
        return new GrayImage(h, w, copy);
    }

    /**
     * 全画素が同じ値の画像を生成します。
     *
     * @param height 高さです（1 以上）
     * @param width 幅です（1 以上）
     * @param value 画素値です（有限値）
     * @return 画像です
     * @throws InvalidInputException 引数が不正な場合に発生します
     */
    public static GrayImage filled(int height, int width, double value) {
        if (height <= 0 || width <= 0) {
            throw new InvalidInputException("画像サイズは 1 以上が必要です: " + height + "x" + width);
        }
        if (!Double.isFinite(value)) {
            throw new InvalidInputException("画素値は有限値である必要があります: " + value);
        }
        double[] data = new double[height * width];
        Arrays.fill(data, value);
        return new GrayImage(height, width, data);
    }

    /**
     * 高さ（行数）を返します。
     *
     * @return 高さです
     */
    public int height() {
        return height;
    }

    /**
     * 幅（列数）を返します。
     *
     * @return 幅です
     */
    public int width() {
        return width;
    }

    /**
     * 画素値を返します。
     *
     * @param y 行インデックスです（0 以上 height 未満）
     * @param x 列インデックスです（0 以上 width 未満）
     * @return 画素値です
     */
    public double get(int y, int x) {
        return data[y * width + x];
    }

    /**
     * 指定行のコピーを返します。
     *
     * @param y 行インデックスです
     * @return 長さ width の配列です
     */
    public double[] row(int y) {
        return Arrays.copyOfRange(data, y * width, (y + 1) * width);
    }

    /**
     * 指定列のコピーを返します。
     *
     * @param x 列インデックスです
     * @return 長さ height の配列です
     */
    public double[] column(int x) {
        double[] out = new double[height];
        for (int y = 0; y < height; y++) {
            out[y] = data[y * width + x];
        }
        return out;
    }

    /**
     * 最小画素値を返します。
     *
     * @return 最小値です
     */
    public double min() {
        double m = data[0];
        for (double v : data) {
            m = Math.min(m, v);
        }
        return m;
    }

    /**
     * 最大画素値を返します。
     *
     * @return 最大値です
     */
    public double max() {
        double m = data[0];
        for (double v : data) {
            m = Math.max(m, v);
        }
        return m;
    }

    /**
     * 行優先の画素値のコピーを返します。
     *
     * @return 長さ height*width の配列です
     */
    public double[] flatten() {
        return data.clone();
    }

    /**
     * 画素値を行列（height×width）として返します。
     *
     * @return 新しく確保した行列です
     */
    public DMatrixRMaj toMatrix() {
        return new DMatrixRMaj(height, width, true, data);
    }

    /**
     * 画素値を 2 次元配列として返します。
     *
     * @return 新しく確保した配列です（[y][x]）
     */
    public double[][] toArray() {
        double[][] out = new double[height][];
        for (int y = 0; y < height; y++) {
            out[y] = row(y);
        }
        return out;
    }

    /**
     * 形状が一致するかを返します。
     *
     * @param other 比較対象です
     * @return 高さと幅が一致する場合は true です
     */
    public boolean sameShape(GrayImage other) {
        return other != null && other.height == height && other.width == width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GrayImage)) {
            return false;
        }
        GrayImage other = (GrayImage) o;
        return height == other.height && width == other.width
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "GrayImage(" + height + "x" + width + ")";
    }
}

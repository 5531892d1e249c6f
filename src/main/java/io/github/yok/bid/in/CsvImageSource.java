package io.github.yok.bid.in;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.image.GrayImage;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 数値 CSV（1 レコード = 画像の 1 行）からぼけ画像を読み込むクラスです。
 *
 * <p>
 * 空行は無視します。画像名はファイル名から拡張子を除いたものです。
 * </p>
 */
@Slf4j
public final class CsvImageSource implements ImageSource {

    /**
     * 入力ファイルです。
     */
    private final Path file;

    /**
     * CSV 入力を生成します。
     *
     * @param path 入力ファイルのパスです
     * @throws IllegalArgumentException path が空の場合に発生します
     */
    public CsvImageSource(String path) {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException("input.path は必須です");
        }
        this.file = Paths.get(path.trim());
    }

    @Override
    public SourceImage load() {
        List<double[]> rows = new ArrayList<>();

        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setIgnoreEmptyLines(true).setTrim(true).build().parse(r)) {

            for (CSVRecord rec : parser) {
                double[] row = new double[rec.size()];
                for (int x = 0; x < rec.size(); x++) {
                    row[x] = parseValue(rec.get(x), rec.getRecordNumber(), x);
                }
                rows.add(row);
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 読み込みに失敗しました: " + file, e);
        }

        GrayImage image = GrayImage.of(rows.toArray(new double[0][]));
        log.info("入力画像を読み込みました。file={}、画像={}x{}", file, image.height(), image.width());
        return new SourceImage(baseName(file), image, null);
    }

    /**
     * セル文字列を数値に変換します。
     *
     * @param cell セル文字列です
     * @param recordNumber レコード番号（1 始まり）です
     * @param column 列番号（0 始まり）です
     * @return 数値です
     * @throws InvalidInputException 数値として解釈できない場合に発生します
     */
    private double parseValue(String cell, long recordNumber, int column) {
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("数値として解釈できません: file=" + file + ", record="
                    + recordNumber + ", column=" + column + ", value=" + cell);
        }
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}

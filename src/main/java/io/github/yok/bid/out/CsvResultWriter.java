package io.github.yok.bid.out;

import io.github.yok.bid.core.DeconvolutionResult;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.psf.PointSpreadFunction;
import io.github.yok.bid.core.psf.PsfEstimation;
import io.github.yok.bid.core.quality.QualityMetrics;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 復元結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は画像名）。
 * </p>
 *
 * <ul>
 * <li>{@code bid_restored_<name>.csv}（x, y, value）</li>
 * <li>{@code bid_psf_<name>.csv}（x, y, value）</li>
 * <li>{@code bid_meta_<name>.csv}（次数、評価値、設定値などの key/value）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "bid";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * 推定に用いた最大 PSF サイズです（メタ情報用）。
     */
    private final int maxPsfSize;

    /**
     * 復元に用いた正則化係数です（メタ情報用）。
     */
    private final double regularization;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param maxPsfSize 最大 PSF サイズです
     * @param regularization 正則化係数です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, int maxPsfSize, double regularization) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
        this.maxPsfSize = maxPsfSize;
        this.regularization = regularization;
    }

    /**
     * 復元結果を出力します。
     *
     * @param imageName 画像名です
     * @param estimation PSF 推定結果です
     * @param result 復元結果です
     * @param fidelity 真値と復元画像の比較結果です（真値が無い場合は null）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String imageName, PsfEstimation estimation, DeconvolutionResult result,
            QualityMetrics fidelity) {

        if (imageName == null || imageName.isEmpty()) {
            throw new IllegalArgumentException("imageName は必須です");
        }
        if (estimation == null) {
            throw new IllegalArgumentException("estimation は null 不可です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);
            writeRestoredCsv(imageName, result.getRestoredImage());
            writePsfCsv(imageName, result.getEstimatedPsf());
            writeMetaCsv(imageName, estimation, result, fidelity);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    private void writeRestoredCsv(String imageName, GrayImage image) throws IOException {
        Path file = outputDir.resolve(buildFileName("restored", imageName));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("x", "y", "value").build().print(w)) {

            for (int y = 0; y < image.height(); y++) {
                for (int x = 0; x < image.width(); x++) {
                    pr.printRecord(x, y, image.get(y, x));
                }
            }
        }
    }

    private void writePsfCsv(String imageName, PointSpreadFunction psf) throws IOException {
        Path file = outputDir.resolve(buildFileName("psf", imageName));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("x", "y", "value").build().print(w)) {

            for (int y = 0; y < psf.height(); y++) {
                for (int x = 0; x < psf.width(); x++) {
                    pr.printRecord(x, y, psf.get(y, x));
                }
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * <p>
     * {@code fidelity.*} は真値がある場合のみ出力します。
     * </p>
     *
     * @param imageName 画像名です
     * @param estimation PSF 推定結果です
     * @param result 復元結果です
     * @param fidelity 真値との比較結果です（null 可）
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(String imageName, PsfEstimation estimation,
            DeconvolutionResult result, QualityMetrics fidelity) throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", imageName));
        GrayImage restored = result.getRestoredImage();
        PointSpreadFunction psf = result.getEstimatedPsf();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("image.name", imageName);
            pr.printRecord("image.height", restored.height());
            pr.printRecord("image.width", restored.width());

            pr.printRecord("maxPsfSize", maxPsfSize);
            pr.printRecord("regularization", regularization);

            pr.printRecord("degree.vertical", estimation.getVertical().getDegree());
            pr.printRecord("degree.horizontal", estimation.getHorizontal().getDegree());
            pr.printRecord("degenerate", estimation.isDegenerate());
            pr.printRecord("psf.height", psf.height());
            pr.printRecord("psf.width", psf.width());
            pr.printRecord("psf.sum", psf.sum());

            pr.printRecord("mse", result.getMse());
            pr.printRecord("psnr", result.getPsnr());
            pr.printRecord("ssim", result.getSsim());

            if (fidelity != null) {
                pr.printRecord("fidelity.mse", fidelity.getMse());
                pr.printRecord("fidelity.psnr", fidelity.getPsnr());
                pr.printRecord("fidelity.ssim", fidelity.getSsim());
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param kind 出力の種類（restored/psf/meta）です
     * @param imageName 画像名です
     * @return ファイル名です（例: {@code bid_psf_synthetic.csv}）
     */
    private static String buildFileName(String kind, String imageName) {
        return FILE_HEAD + "_" + kind + "_" + imageName + ".csv";
    }
}

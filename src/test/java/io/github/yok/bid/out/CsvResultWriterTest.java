package io.github.yok.bid.out;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.bid.core.BlindDeconvolutionEngine;
import io.github.yok.bid.core.DeconvolutionResult;
import io.github.yok.bid.core.image.GrayImage;
import io.github.yok.bid.core.psf.PsfEstimation;
import io.github.yok.bid.core.quality.QualityMetrics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesRestoredPsfAndMetaFiles() throws IOException {
        GrayImage blurred = GrayImage.filled(4, 5, 0.5);
        BlindDeconvolutionEngine engine = BlindDeconvolutionEngine.create(3, 1e-6);
        PsfEstimation estimation = engine.estimateAxes(blurred);
        DeconvolutionResult result = engine.deconvolve(blurred, estimation.getPsf());
        Path out = dir.resolve("nested");

        new CsvResultWriter(out.toString(), 3, 1e-6).write("sample", estimation, result,
                new QualityMetrics(0.0, Double.POSITIVE_INFINITY, 1.0));

        List<String> restored =
                Files.readAllLines(out.resolve("bid_restored_sample.csv"), StandardCharsets.UTF_8);
        List<String> psf =
                Files.readAllLines(out.resolve("bid_psf_sample.csv"), StandardCharsets.UTF_8);
        List<String> meta =
                Files.readAllLines(out.resolve("bid_meta_sample.csv"), StandardCharsets.UTF_8);

        assertThat(restored).hasSize(1 + 4 * 5);
        assertThat(restored.get(0)).isEqualTo("x,y,value");
        assertThat(restored.get(1)).isEqualTo("0,0,0.5");
        assertThat(psf).hasSize(1 + 3 * 3);
        assertThat(meta).contains("degenerate,true", "maxPsfSize,3", "image.height,4",
                "image.width,5", "fidelity.ssim,1.0");
    }

    @Test
    void omitsFidelityWithoutGroundTruth() throws IOException {
        GrayImage blurred = GrayImage.filled(4, 4, 0.2);
        BlindDeconvolutionEngine engine = BlindDeconvolutionEngine.create(2, 1e-6);
        PsfEstimation estimation = engine.estimateAxes(blurred);
        DeconvolutionResult result = engine.deconvolve(blurred, estimation.getPsf());

        new CsvResultWriter(dir.toString(), 2, 1e-6).write("plain", estimation, result, null);

        List<String> meta =
                Files.readAllLines(dir.resolve("bid_meta_plain.csv"), StandardCharsets.UTF_8);
        assertThat(meta).noneMatch(line -> line.startsWith("fidelity."));
    }
}

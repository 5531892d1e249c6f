package io.github.yok.bid.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.bid.core.BlindDeconvolutionEngine;
import io.github.yok.bid.core.linearalgebra.SylvesterEquationBackend;
import io.github.yok.bid.core.linearalgebra.TriangularSylvesterEquationBackend;
import io.github.yok.bid.in.ImageSource;
import io.github.yok.bid.in.SyntheticImageSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * 小さな合成画像で CLI を実行し、出力ファイルを確認します。
 */
@SpringBootTest(properties = {"bid.input.synthetic.size=24", "bid.input.synthetic.kernel-size=5",
        "bid.input.synthetic.sigma=1.0", "bid.psf.max-psf-size=5",
        "bid.output.dir=target/cli-smoke-test"})
class BidCliRunnerTest {

    @Autowired
    private BidProperties properties;

    @Autowired
    private ImageSource imageSource;

    @Autowired
    private SylvesterEquationBackend sylvesterEquationBackend;

    @Autowired
    private BlindDeconvolutionEngine engine;

    @Test
    void bindsPropertiesAndAssemblesBeans() {
        assertThat(properties.getPsf().getMaxPsfSize()).isEqualTo(5);
        assertThat(properties.getInput().isSynthetic()).isTrue();
        assertThat(imageSource).isInstanceOf(SyntheticImageSource.class);
        assertThat(sylvesterEquationBackend).isInstanceOf(TriangularSylvesterEquationBackend.class);
        assertThat(engine.getMaxPsfSize()).isEqualTo(5);
        assertThat(properties.toMultilineString()).contains("maxPsfSize: 5", "(synthetic)");
    }

    @Test
    void runWritesResultFiles() throws IOException {
        Path out = Paths.get("target/cli-smoke-test");

        assertThat(out.resolve("bid_restored_synthetic.csv")).exists();
        assertThat(out.resolve("bid_psf_synthetic.csv")).exists();

        List<String> meta =
                Files.readAllLines(out.resolve("bid_meta_synthetic.csv"), StandardCharsets.UTF_8);
        assertThat(meta).contains("image.height,24", "maxPsfSize,5");
        assertThat(meta).anyMatch(line -> line.startsWith("fidelity.ssim,"));
    }
}

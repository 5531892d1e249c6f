package io.github.yok.bid.core.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.TestImages;
import io.github.yok.bid.core.image.GrayImage;
import org.junit.jupiter.api.Test;

class QualityEvaluatorTest {

    private static GrayImage pattern(int h, int w, double phase) {
        double[][] px = new double[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                px[y][x] = 0.5 + 0.4 * Math.sin(0.9 * y + 0.4 * x + phase);
            }
        }
        return GrayImage.of(px);
    }

    @Test
    void identicalImagesGiveExactSsimAndInfinitePsnrInBothModes() {
        GrayImage image = TestImages.gaussianBlob(16);

        for (SsimMode mode : SsimMode.values()) {
            QualityMetrics m = new QualityEvaluator(mode, 11).evaluate(image, image);

            assertThat(m.getMse()).isZero();
            assertThat(m.getPsnr()).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(m.getSsim()).isEqualTo(1.0);
        }
    }

    @Test
    void psnrUsesUnitPeak() {
        GrayImage a = GrayImage.filled(2, 2, 0.0);
        GrayImage b = GrayImage.filled(2, 2, 0.1);

        QualityEvaluator evaluator = new QualityEvaluator();

        assertThat(evaluator.mse(a, b)).isCloseTo(0.01, within(1e-15));
        assertThat(evaluator.psnr(a, b)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void psnrFromZeroMseIsInfinite() {
        assertThat(QualityEvaluator.psnrFromMse(0.0)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void defaultModeIsSpatialAndModesDiffer() {
        GrayImage a = pattern(16, 16, 0.0);
        GrayImage b = pattern(16, 16, 0.8);

        double defaultSsim = new QualityEvaluator().ssim(a, b);
        double spatial = new QualityEvaluator(SsimMode.SPATIAL, 11).ssim(a, b);
        double flattened = new QualityEvaluator(SsimMode.FLATTENED, 11).ssim(a, b);

        assertThat(defaultSsim).isEqualTo(spatial);
        assertThat(spatial).isNotEqualTo(flattened);
        assertThat(spatial).isLessThan(1.0);
        assertThat(flattened).isLessThan(1.0);
    }

    @Test
    void smallImagesAreEvaluatedInBothModes() {
        GrayImage a = pattern(4, 5, 0.0);
        GrayImage b = pattern(4, 5, 0.3);

        for (SsimMode mode : SsimMode.values()) {
            double ssim = new QualityEvaluator(mode, 11).ssim(a, b);

            assertThat(Double.isFinite(ssim)).isTrue();
            assertThat(ssim).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    void rejectsShapeMismatch() {
        QualityEvaluator evaluator = new QualityEvaluator();

        assertThatThrownBy(
                () -> evaluator.evaluate(GrayImage.filled(2, 3, 0), GrayImage.filled(3, 2, 0)))
                        .isInstanceOf(InvalidInputException.class);
    }
}

package io.github.yok.bid.core.restoration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.bid.core.image.GrayImage;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class IntensityMappingTest {

    private final DMatrixRMaj solution = new DMatrixRMaj(new double[][] {{-1, 0}, {1, 3}});

    @Test
    void inputRangeMapsOntoBlurredMinMax() {
        GrayImage blurred = GrayImage.of(new double[][] {{0.2, 0.4}, {0.6, 0.6}});

        GrayImage out = IntensityMapping.INPUT_RANGE.apply(solution, blurred);

        assertThat(out.min()).isCloseTo(0.2, within(1e-12));
        assertThat(out.max()).isCloseTo(0.6, within(1e-12));
        assertThat(out.get(0, 1)).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void inputRangeReturnsInputConstantForFlatInput() {
        GrayImage blurred = GrayImage.filled(2, 2, 0.5);

        GrayImage out = IntensityMapping.INPUT_RANGE.apply(solution, blurred);

        assertThat(out).isEqualTo(blurred);
    }

    @Test
    void unitRangeNormalizesToZeroOne() {
        GrayImage out = IntensityMapping.UNIT_RANGE.apply(solution, GrayImage.filled(2, 2, 0.0));

        assertThat(out.min()).isEqualTo(0.0);
        assertThat(out.max()).isEqualTo(1.0);
        assertThat(out.get(0, 1)).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void clipClampsOutOfRangeValues() {
        GrayImage out = IntensityMapping.CLIP.apply(solution, GrayImage.filled(2, 2, 0.0));

        assertThat(out.flatten()).containsExactly(0.0, 0.0, 1.0, 1.0);
    }

    @Test
    void doesNotModifySolution() {
        IntensityMapping.UNIT_RANGE.apply(solution, GrayImage.filled(2, 2, 0.0));

        assertThat(solution.data).containsExactly(-1, 0, 1, 3);
    }
}

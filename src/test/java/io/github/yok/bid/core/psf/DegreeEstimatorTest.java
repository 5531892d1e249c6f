package io.github.yok.bid.core.psf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.linearalgebra.EjmlSingularValueDecompositionBackend;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class DegreeEstimatorTest {

    private final DegreeEstimator estimator =
            new DegreeEstimator(new EjmlSingularValueDecompositionBackend());

    @Test
    void picksLargestNormalizedDrop() {
        assertThat(estimator.estimateFromSpectrum(new double[] {10, 9, 2, 1.5}, 3)).isEqualTo(2);
    }

    @Test
    void flatSpectrumGivesDegreeOne() {
        assertThat(estimator.estimateFromSpectrum(new double[] {2, 2, 2}, 2)).isEqualTo(1);
        assertThat(estimator.estimateFromSpectrum(new double[] {0, 0, 0, 0}, 3)).isEqualTo(1);
    }

    @Test
    void tieKeepsFirstIndex() {
        assertThat(estimator.estimateFromSpectrum(new double[] {3, 2, 1, 0}, 3)).isEqualTo(1);
    }

    @Test
    void degreeStaysWithinMaxDegree() {
        // 最大落差は i=2 ですが、候補は i < maxDegree に限られます。
        assertThat(estimator.estimateFromSpectrum(new double[] {5, 4.9, 4.8, 0}, 2))
                .isBetween(1, 2);
        assertThat(estimator.estimateFromSpectrum(new double[] {5, 4, 0, 0, 0}, 1)).isEqualTo(1);
    }

    @Test
    void estimatesFromMatrix() {
        DMatrixRMaj diag = new DMatrixRMaj(new double[][] {{1, 0, 0}, {0, 10, 0}, {0, 0, 9}});

        assertThat(estimator.estimate(diag, 2)).isEqualTo(2);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> estimator.estimateFromSpectrum(new double[] {1, 0}, 0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> estimator.estimateFromSpectrum(new double[0], 1))
                .isInstanceOf(InvalidInputException.class);
    }
}

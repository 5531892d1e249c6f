package io.github.yok.bid.core.restoration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.bid.core.InvalidInputException;
import io.github.yok.bid.core.psf.PointSpreadFunction;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class BandedOperatorBuilderTest {

    private final BandedOperatorBuilder builder = new BandedOperatorBuilder();

    @Test
    void buildsLowerBandWithoutWraparound() {
        double eps = 1e-3;
        DMatrixRMaj h = builder.buildAxisOperator(new double[] {0.5, 0.3, 0.2}, 5, eps);

        for (int i = 0; i < 5; i++) {
            for (int j = 0; j < 5; j++) {
                double expected;
                if (j > i || i - j >= 3) {
                    expected = 0.0;
                } else {
                    expected = new double[] {0.5, 0.3, 0.2}[i - j];
                }
                if (i == j) {
                    expected += eps;
                }
                assertThat(h.get(i, j)).as("h[%d,%d]", i, j).isEqualTo(expected);
            }
        }
        // 右上の角に折り返しはありません。
        assertThat(h.get(0, 4)).isZero();
        assertThat(h.get(0, 3)).isZero();
    }

    @Test
    void diagonalIsAtLeastEpsilonForNonNegativeLeadingCoefficient() {
        DMatrixRMaj h = builder.buildAxisOperator(new double[] {0.0, 1.0}, 4, 1e-6);

        for (int i = 0; i < 4; i++) {
            assertThat(h.get(i, i)).isGreaterThanOrEqualTo(1e-6);
        }
    }

    @Test
    void profileLongerThanOperatorIsTruncated() {
        DMatrixRMaj h = builder.buildAxisOperator(new double[] {1, 2, 3, 4, 5}, 2, 0.0);

        assertThat(h.get(0, 0)).isEqualTo(1.0);
        assertThat(h.get(1, 0)).isEqualTo(2.0);
        assertThat(h.get(1, 1)).isEqualTo(1.0);
        assertThat(h.get(0, 1)).isZero();
    }

    @Test
    void usesFirstColumnVerticallyAndFirstRowHorizontally() {
        PointSpreadFunction psf = new PointSpreadFunction(new double[][] {{0.1, 0.2}, {0.3, 0.4}});

        BandedOperators ops = builder.build(psf, 3, 4, 0.0);

        assertThat(ops.getVertical().numRows).isEqualTo(3);
        assertThat(ops.getHorizontal().numRows).isEqualTo(4);
        assertThat(ops.getVertical().get(1, 0)).isEqualTo(0.3);
        assertThat(ops.getHorizontal().get(1, 0)).isEqualTo(0.2);
    }

    @Test
    void rejectsInvalidRegularization() {
        assertThatThrownBy(() -> builder.buildAxisOperator(new double[] {1}, 3, -1e-6))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> builder.buildAxisOperator(new double[] {1}, 3, Double.NaN))
                .isInstanceOf(InvalidInputException.class);
    }
}

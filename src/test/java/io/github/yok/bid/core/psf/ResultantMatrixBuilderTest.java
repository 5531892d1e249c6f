package io.github.yok.bid.core.psf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.bid.core.InvalidInputException;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class ResultantMatrixBuilderTest {

    private final ResultantMatrixBuilder builder = new ResultantMatrixBuilder();

    @Test
    void placesShiftedCopiesOfBothSequences() {
        double[] row1 = {1, 2, 3, 4};
        double[] row2 = {5, 6, 7, 8};

        DMatrixRMaj s = builder.build(row1, row2, 2);

        // 2n−d = 6、各系列のシフト数 n−d = 2、末尾 d 列は 0 です。
        assertThat(s.numRows).isEqualTo(6);
        assertThat(s.numCols).isEqualTo(6);
        for (int i = 0; i < 2; i++) {
            for (int k = 0; k < 4; k++) {
                assertThat(s.get(i + k, i)).isEqualTo(row1[k]);
                assertThat(s.get(i + k, 2 + i)).isEqualTo(row2[k]);
            }
        }
        assertThat(s.get(4, 0)).isZero();
        assertThat(s.get(0, 1)).isZero();
        for (int r = 0; r < 6; r++) {
            assertThat(s.get(r, 4)).isZero();
            assertThat(s.get(r, 5)).isZero();
        }
    }

    @Test
    void sizeFollowsDegree() {
        double[] row = {1, 2, 3, 4, 5};

        assertThat(builder.build(row, row, 1).numRows).isEqualTo(9);
        assertThat(builder.build(row, row, 4).numRows).isEqualTo(6);
    }

    @Test
    void rejectsOutOfRangeDegreeAndLengthMismatch() {
        double[] row = {1, 2, 3};

        assertThatThrownBy(() -> builder.build(row, row, 0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> builder.build(row, row, 3))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> builder.build(row, new double[] {1, 2}, 1))
                .isInstanceOf(InvalidInputException.class);
    }
}

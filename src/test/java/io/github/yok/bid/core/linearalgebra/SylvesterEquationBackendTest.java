package io.github.yok.bid.core.linearalgebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

class SylvesterEquationBackendTest {

    private static DMatrixRMaj lowerBanded(int n, double[] profile) {
        DMatrixRMaj m = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = Math.max(0, i - profile.length + 1); j <= i; j++) {
                m.set(i, j, profile[i - j]);
            }
        }
        return m;
    }

    private static DMatrixRMaj rhs(int h, int w) {
        DMatrixRMaj c = new DMatrixRMaj(h, w);
        for (int i = 0; i < h; i++) {
            for (int j = 0; j < w; j++) {
                c.set(i, j, Math.sin(0.7 * i + 0.3 * j) + 0.1 * i * j);
            }
        }
        return c;
    }

    private static double residual(DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj c, DMatrixRMaj x) {
        DMatrixRMaj ax = new DMatrixRMaj(c.numRows, c.numCols);
        DMatrixRMaj xb = new DMatrixRMaj(c.numRows, c.numCols);
        CommonOps_DDRM.mult(a, x, ax);
        CommonOps_DDRM.mult(x, b, xb);
        double max = 0.0;
        for (int i = 0; i < c.getNumElements(); i++) {
            max = Math.max(max, Math.abs(ax.data[i] + xb.data[i] - c.data[i]));
        }
        return max;
    }

    @Test
    void triangularAndKroneckerAgree() {
        DMatrixRMaj a = lowerBanded(5, new double[] {0.5, 0.3, 0.2});
        DMatrixRMaj b = lowerBanded(4, new double[] {0.6, 0.4});
        DMatrixRMaj c = rhs(5, 4);

        DMatrixRMaj tri = new TriangularSylvesterEquationBackend().solve(a, b, c);
        DMatrixRMaj kron = new EjmlKroneckerSylvesterEquationBackend().solve(a, b, c);

        assertThat(residual(a, b, c, tri)).isLessThan(1e-10);
        assertThat(residual(a, b, c, kron)).isLessThan(1e-10);
        for (int i = 0; i < tri.getNumElements(); i++) {
            assertThat(tri.data[i]).isCloseTo(kron.data[i], within(1e-9));
        }
    }

    @Test
    void kroneckerHandlesFullMatrices() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{2, 1}, {0.5, 3}});
        DMatrixRMaj b = new DMatrixRMaj(new double[][] {{1, 0.2, 0}, {0.1, 2, 0.3}, {0, 0.4, 1.5}});
        DMatrixRMaj c = rhs(2, 3);

        DMatrixRMaj x = new EjmlKroneckerSylvesterEquationBackend().solve(a, b, c);

        assertThat(residual(a, b, c, x)).isLessThan(1e-10);
    }

    @Test
    void triangularRejectsUpperEntries() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 1}, {0, 1}});
        DMatrixRMaj b = lowerBanded(2, new double[] {1});

        assertThatThrownBy(
                () -> new TriangularSylvesterEquationBackend().solve(a, b, rhs(2, 2)))
                        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void kroneckerRejectsTooManyUnknowns() {
        DMatrixRMaj a = lowerBanded(3, new double[] {1});
        DMatrixRMaj b = lowerBanded(3, new double[] {1});

        assertThatThrownBy(
                () -> new EjmlKroneckerSylvesterEquationBackend(8).solve(a, b, rhs(3, 3)))
                        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsShapeMismatch() {
        DMatrixRMaj a = lowerBanded(3, new double[] {1});
        DMatrixRMaj b = lowerBanded(2, new double[] {1});

        assertThatThrownBy(() -> new TriangularSylvesterEquationBackend().solve(a, b, rhs(2, 2)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

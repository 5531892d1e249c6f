package io.github.yok.bid.core.linearalgebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.bid.core.linearalgebra.SingularValueDecompositionBackend.SingularValueDecompositionResult;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class EjmlSingularValueDecompositionBackendTest {

    private final EjmlSingularValueDecompositionBackend backend =
            new EjmlSingularValueDecompositionBackend();

    @Test
    void sortsSingularValuesDescendingWithMatchingVectors() {
        DMatrixRMaj m = new DMatrixRMaj(new double[][] {{2, 0, 0}, {0, 5, 0}, {0, 0, 3}});

        SingularValueDecompositionResult r = backend.decomposeAndSort(m);

        assertThat(r.getSingularValues()).containsExactly(new double[] {5, 3, 2}, within(1e-12));
        // 最大特異値の右特異ベクトルは e1（符号は不定）です。
        assertThat(Math.abs(r.rightSingularVector(0)[1])).isCloseTo(1.0, within(1e-12));
        assertThat(Math.abs(r.rightSingularVector(2)[0])).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void doesNotModifyInput() {
        DMatrixRMaj m = new DMatrixRMaj(new double[][] {{1, 2}, {3, 4}});
        DMatrixRMaj copy = m.copy();

        backend.singularValuesDescending(m);

        assertThat(m.data).containsExactly(copy.data);
    }
}

package io.github.yok.bid.core.synthetic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.bid.core.image.GrayImage;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ConvolutionTest {

    @Test
    void sameConvolutionKeepsLengthAndPadsWithZero() {
        double[] out = Convolution.same(new double[] {0, 0, 3, 0, 0}, BlurKernels.box(3));

        assertThat(out).containsExactly(new double[] {0, 1, 1, 1, 0}, within(1e-12));
        assertThat(Convolution.same(new double[] {3, 3}, BlurKernels.box(3)))
                .containsExactly(new double[] {2, 2}, within(1e-12));
    }

    @Test
    void evenLengthKernelUsesLeftCenter() {
        // K=2 の中心は 0 なので、出力は x[i]*k0 + x[i-1]*k1 です。
        double[] out = Convolution.same(new double[] {1, 2, 3}, new double[] {0.25, 0.75});

        assertThat(out).containsExactly(new double[] {0.25, 1.25, 2.25}, within(1e-12));
    }

    @Test
    void separableMatchesTwoDimensionalForOuterProductKernel() {
        double[][] px = new double[6][7];
        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 7; x++) {
                px[y][x] = (y * 7 + x) % 5;
            }
        }
        GrayImage image = GrayImage.of(px);
        double[] g = BlurKernels.gaussian1d(3, 1.0);

        GrayImage a = Convolution.separable(image, g, g);
        GrayImage b = Convolution.twoDimensional(image, BlurKernels.gaussian2d(3, 1.0));

        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 7; x++) {
                assertThat(a.get(y, x)).isCloseTo(b.get(y, x), within(1e-12));
            }
        }
    }

    @Test
    void kernelsAreNormalized() {
        assertThat(Arrays.stream(BlurKernels.box(4)).sum()).isCloseTo(1.0, within(1e-12));
        assertThat(Arrays.stream(BlurKernels.gaussian1d(9, 2.0)).sum()).isCloseTo(1.0,
                within(1e-12));
        double[] g = BlurKernels.gaussian1d(5, 1.0);
        assertThat(g[0]).isCloseTo(g[4], within(1e-15));
        assertThat(g[2]).isGreaterThan(g[1]);
    }
}

package io.github.yok.bid.app;

import io.github.yok.bid.core.quality.SsimMode;
import io.github.yok.bid.core.restoration.IntensityMapping;
import io.github.yok.bid.in.SyntheticImageSource;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * bid-solver の設定値（bid.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の部品組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "bid")
public class BidProperties {

    /**
     * PSF 推定の設定です。
     */
    @Valid
    private Psf psf = new Psf();

    /**
     * 復元（Sylvester 方程式）の設定です。
     */
    @Valid
    private Restoration restoration = new Restoration();

    /**
     * 画質評価の設定です。
     */
    @Valid
    private Quality quality = new Quality();

    /**
     * 入力画像の設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "bid")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Psf p = getPsf();
        Restoration r = getRestoration();
        Quality q = getQuality();
        Input i = getInput();
        Input.Synthetic s = i.getSynthetic();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "psf",
                // maxPsfSize: 候補次数の上限（画像の短辺未満）
                "maxPsfSize", p.getMaxPsfSize());

        appendSection(sb, nl, "restoration",
                // regularization: 帯行列の対角に加える ε
                "regularization", r.getRegularization(),
                // solver: Sylvester 方程式の解法（TRIANGULAR/KRONECKER）
                "solver", r.getSolver(),
                "kroneckerMaxUnknowns", r.getKroneckerMaxUnknowns(),
                // intensityMapping: 解から画像輝度への写像
                "intensityMapping", r.getIntensityMapping());

        appendSection(sb, nl, "quality",
                "ssimMode", q.getSsimMode(),
                "windowSize", q.getWindowSize());

        appendSection(sb, nl, "input",
                // path: 空の場合は合成画像を使用
                "path", i.isSynthetic() ? "(synthetic)" : i.getPath(),
                "synthetic.size", s.getSize(),
                "synthetic.kernel", s.getKernel(),
                "synthetic.kernelSize", s.getKernelSize(),
                "synthetic.sigma", s.getSigma());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int k = 0; k < kvPairs.length; k += 2) {
            String key = String.valueOf(kvPairs[k]);
            Object val = (k + 1 < kvPairs.length) ? kvPairs[k + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Psf {

        /**
         * 最大 PSF サイズです。
         */
        @Min(1)
        private int maxPsfSize = 15;
    }

    @Data
    public static class Restoration {

        /**
         * 正則化係数 ε です。
         */
        @DecimalMin("0.0")
        private double regularization = 1e-6;

        /**
         * Sylvester 方程式の解法です。
         */
        @NotNull
        private Solver solver = Solver.TRIANGULAR;

        /**
         * KRONECKER 解法で扱う未知数 h*w の上限です。
         */
        @Min(1)
        private int kroneckerMaxUnknowns = 1600;

        /**
         * 解から画像輝度への写像です。
         */
        @NotNull
        private IntensityMapping intensityMapping = IntensityMapping.INPUT_RANGE;

        public enum Solver {
            TRIANGULAR, KRONECKER
        }
    }

    @Data
    public static class Quality {

        /**
         * SSIM の計算方式です。
         */
        @NotNull
        private SsimMode ssimMode = SsimMode.SPATIAL;

        /**
         * SSIM の窓サイズ（一辺）です。
         */
        @Min(1)
        private int windowSize = 11;
    }

    @Data
    public static class Input {

        /**
         * 入力 CSV のパスです。空の場合は合成画像を使用します。
         */
        private String path = "";

        /**
         * 合成画像の設定です。
         */
        @Valid
        private Synthetic synthetic = new Synthetic();

        /**
         * 合成画像を使用するかを返します。
         *
         * @return path が空の場合は true です
         */
        public boolean isSynthetic() {
            return path == null || path.trim().isEmpty();
        }

        @Data
        public static class Synthetic {

            /**
             * 画像の一辺です。
             */
            @Min(4)
            private int size = 64;

            /**
             * ぼけカーネルの種類です。
             */
            @NotNull
            private SyntheticImageSource.KernelKind kernel =
                    SyntheticImageSource.KernelKind.GAUSSIAN;

            /**
             * カーネル長です。
             */
            @Min(1)
            private int kernelSize = 9;

            /**
             * ガウスカーネルの標準偏差です。
             */
            @DecimalMin(value = "0.0", inclusive = false)
            private double sigma = 2.0;
        }
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}

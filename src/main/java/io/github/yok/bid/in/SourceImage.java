package io.github.yok.bid.in;

import io.github.yok.bid.core.image.GrayImage;
import java.util.Optional;
import lombok.Value;

/**
 * 読み込んだ入力画像を保持するクラスです。
 */
@Value
public class SourceImage {

    /**
     * 出力ファイル名に使う画像名です。
     */
    String name;

    /**
     * ぼけ画像です。
     */
    GrayImage blurred;

    /**
     * ぼける前の画像です（合成画像の場合のみ）。
     */
    GrayImage original;

    /**
     * ぼける前の画像を返します。
     *
     * @return 真値の画像です（無い場合は空）
     */
    public Optional<GrayImage> groundTruth() {
        return Optional.ofNullable(original);
    }
}

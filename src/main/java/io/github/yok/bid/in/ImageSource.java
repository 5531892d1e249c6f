package io.github.yok.bid.in;

/**
 * 復元対象のぼけ画像を供給する処理のインタフェースです。
 */
public interface ImageSource {

    /**
     * 画像を読み込みます。
     *
     * @return 入力画像です
     * @throws io.github.yok.bid.core.InvalidInputException 画像の内容が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    SourceImage load();
}

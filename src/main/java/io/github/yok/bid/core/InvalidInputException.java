package io.github.yok.bid.core;

/**
 * 入力画像・設定値・次数などが制約を満たさない場合に発生する例外です。
 *
 * <p>
 * SVD や求解を行う前に検出し、違反した制約をメッセージに含めます。
 * </p>
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 違反した制約を表すメッセージです
     */
    public InvalidInputException(String message) {
        super(message);
    }
}

package io.github.yok.bid.core;

/**
 * 正則化後の Sylvester 方程式の求解が有限値を返さなかった場合に発生する例外です。
 *
 * <p>
 * 同じ入力で直接法を再実行しても結果は変わらないため、内部で再試行はしません。
 * </p>
 */
public class NumericalInstabilityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 問題となった作用素（または軸）の名前です。
     */
    private final String operator;

    /**
     * 例外を生成します。
     *
     * @param operator 問題となった作用素（H_y, H_x など）の名前です
     * @param message 詳細メッセージです
     */
    public NumericalInstabilityException(String operator, String message) {
        super(message + " (operator=" + operator + ")");
        this.operator = operator;
    }

    /**
     * 例外を生成します。
     *
     * @param operator 問題となった作用素（H_y, H_x など）の名前です
     * @param message 詳細メッセージです
     * @param cause 原因です
     */
    public NumericalInstabilityException(String operator, String message, Throwable cause) {
        super(message + " (operator=" + operator + ")", cause);
        this.operator = operator;
    }

    /**
     * 問題となった作用素の名前を返します。
     *
     * @return 作用素名です
     */
    public String getOperator() {
        return operator;
    }
}

package io.github.yok.fluxgrid.core.field;

/**
 * 磁束場の入力（座標軸・サンプル配列・評価点配列）が不正な場合に送出される例外です。
 */
public class FieldValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public FieldValidationException(String message) {
        super(message);
    }
}

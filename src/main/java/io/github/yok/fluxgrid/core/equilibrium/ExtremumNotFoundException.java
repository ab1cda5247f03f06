package io.github.yok.fluxgrid.core.equilibrium;

/**
 * 探索区間の内部に極小・極大のいずれも見つからない場合に送出される例外です。
 */
public class ExtremumNotFoundException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public ExtremumNotFoundException(String message) {
        super(message);
    }
}

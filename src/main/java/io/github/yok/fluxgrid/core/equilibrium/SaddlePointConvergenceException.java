package io.github.yok.fluxgrid.core.equilibrium;

/**
 * 鞍点（X 点）探索が失敗した場合に送出される例外です。
 *
 * <p>
 * 探索ボックスの辺上の極値の種類が鞍点の特徴と一致しない場合や、反復回数の上限に達した場合に発生します。
 * </p>
 */
public class SaddlePointConvergenceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public SaddlePointConvergenceException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public SaddlePointConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

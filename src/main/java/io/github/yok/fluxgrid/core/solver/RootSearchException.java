package io.github.yok.fluxgrid.core.solver;

/**
 * 根探索（符号反転区間の探索、挟み込み区間での反復、等値線への射影）に失敗した場合に送出される例外です。
 */
public class RootSearchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public RootSearchException(String message) {
        super(message);
    }
}

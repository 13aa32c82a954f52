package com.xqengine.model;

/**
 * {@link Board#play(Move)} 返回的走子守卫，close 时悔棋，重复 close 无效果。
 */
public final class MoveGuard implements AutoCloseable {
    private final Board board;
    private final Move move;
    private boolean undone;

    MoveGuard(Board board, Move move) {
        this.board = board;
        this.move = move;
    }

    @Override
    public void close() {
        if (undone) {
            return;
        }
        undone = true;
        board.undo(move);
    }
}

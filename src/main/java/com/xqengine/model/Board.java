package com.xqengine.model;

import java.util.Arrays;

/**
 * 棋盘类 - 10行×9列的棋子网格加上当前走棋方
 * <p>
 * 行号0~9自上而下（黑方在上），列号0~8自左而右。走子与悔棋原地修改棋盘，
 * 不做合法性检查；同一棋盘不能被两个搜索同时使用。
 */
public class Board {
    public static final int ROWS = 10;
    public static final int COLS = 9;

    private final Piece[][] board;
    private PieceColor currentTurn;

    /**
     * 空棋盘，红方先走
     */
    public Board() {
        board = new Piece[ROWS][COLS];
        currentTurn = PieceColor.RED;
    }

    public Board(Board other) {
        this.board = new Piece[ROWS][COLS];
        this.currentTurn = other.currentTurn;
        for (int row = 0; row < ROWS; row++) {
            System.arraycopy(other.board[row], 0, this.board[row], 0, COLS);
        }
    }

    /**
     * 标准开局
     */
    public static Board standard() {
        Board b = new Board();
        b.initializeBoard();
        return b;
    }

    public void initializeBoard() {
        clear();
        // 黑方棋子 (上方)
        PieceType[] backRank = {
            PieceType.CHARIOT, PieceType.HORSE, PieceType.ELEPHANT, PieceType.ADVISOR, PieceType.GENERAL,
            PieceType.ADVISOR, PieceType.ELEPHANT, PieceType.HORSE, PieceType.CHARIOT
        };
        for (int col = 0; col < COLS; col++) {
            board[0][col] = Piece.of(backRank[col], PieceColor.BLACK);
            board[9][col] = Piece.of(backRank[col], PieceColor.RED);
        }
        board[2][1] = Piece.of(PieceType.CANNON, PieceColor.BLACK);
        board[2][7] = Piece.of(PieceType.CANNON, PieceColor.BLACK);
        board[7][1] = Piece.of(PieceType.CANNON, PieceColor.RED);
        board[7][7] = Piece.of(PieceType.CANNON, PieceColor.RED);
        for (int i = 0; i < COLS; i += 2) {
            board[3][i] = Piece.of(PieceType.SOLDIER, PieceColor.BLACK);
            board[6][i] = Piece.of(PieceType.SOLDIER, PieceColor.RED);
        }
        currentTurn = PieceColor.RED;
    }

    public void clear() {
        for (Piece[] row : board) {
            Arrays.fill(row, null);
        }
        currentTurn = PieceColor.RED;
    }

    public static boolean isInside(int row, int col) {
        return row >= 0 && row < ROWS && col >= 0 && col < COLS;
    }

    public Piece getPiece(int row, int col) {
        if (!isInside(row, col)) {
            return null;
        }
        return board[row][col];
    }

    public boolean isEmpty(int row, int col) {
        return getPiece(row, col) == null;
    }

    /**
     * 越界写入被忽略
     */
    public void setPiece(int row, int col, Piece piece) {
        if (isInside(row, col)) {
            board[row][col] = piece;
        }
    }

    /**
     * 走子：把起点棋子移到终点，覆盖终点原有棋子并记录在 move 上，然后换边
     */
    public void apply(Move move) {
        Piece piece = board[move.getFromRow()][move.getFromCol()];
        move.setCapturedPiece(board[move.getToRow()][move.getToCol()]);
        board[move.getToRow()][move.getToCol()] = piece;
        board[move.getFromRow()][move.getFromCol()] = null;
        currentTurn = currentTurn.opposite();
    }

    /**
     * 撤销紧挨着的上一次 {@link #apply(Move)}
     */
    public void undo(Move move) {
        board[move.getFromRow()][move.getFromCol()] = board[move.getToRow()][move.getToCol()];
        board[move.getToRow()][move.getToCol()] = move.getCapturedPiece();
        currentTurn = currentTurn.opposite();
    }

    /**
     * 走子并返回守卫，关闭守卫时悔棋。配合 try-with-resources 使用，
     * 任何退出路径（包括剪枝提前返回）都会恢复棋盘。
     */
    public MoveGuard play(Move move) {
        apply(move);
        return new MoveGuard(this, move);
    }

    public Piece findGeneral(PieceColor color) {
        int[] pos = findGeneralSquare(color);
        return pos == null ? null : board[pos[0]][pos[1]];
    }

    /**
     * 返回 {row, col}，找不到返回null
     */
    public int[] findGeneralSquare(PieceColor color) {
        for (int row = 0; row < ROWS; row++) {
            for (int col = 0; col < COLS; col++) {
                Piece piece = board[row][col];
                if (piece != null && piece.getColor() == color && piece.getType().isGeneral()) {
                    return new int[] {row, col};
                }
            }
        }
        return null;
    }

    public int countPieces() {
        int count = 0;
        for (Piece[] row : board) {
            for (Piece piece : row) {
                if (piece != null) {
                    count++;
                }
            }
        }
        return count;
    }

    public PieceColor getCurrentTurn() {
        return currentTurn;
    }

    public void setCurrentTurn(PieceColor color) {
        this.currentTurn = color;
    }

    public Board copy() {
        return new Board(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Board other = (Board) obj;
        return currentTurn == other.currentTurn && Arrays.deepEquals(board, other.board);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(board) + currentTurn.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(ROWS * (COLS + 3));
        for (int row = 0; row < ROWS; row++) {
            sb.append(row).append(' ');
            for (int col = 0; col < COLS; col++) {
                Piece piece = board[row][col];
                sb.append(piece == null ? '.' : piece.toFenChar());
            }
            sb.append('\n');
        }
        sb.append("  abcdefghi ").append(currentTurn.getFenToken());
        return sb.toString();
    }
}

package com.xqengine.rules;

import com.xqengine.model.Board;
import com.xqengine.model.Move;
import com.xqengine.model.Piece;
import com.xqengine.model.PieceColor;

import java.util.ArrayList;
import java.util.List;

/**
 * 走法生成器 - 按棋子类型生成伪合法走法
 * <p>
 * 唯一的过滤条件是终点不能有己方棋子；不检查走后自己的将帅是否被攻击。
 * 单步校验 {@link #isPseudoLegal(Board, Move)} 与批量生成共用同一套规则，二者结论一致。
 */
public final class MoveGenerator {
    private static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    private static final int[][] DIAGONAL = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    private static final int[][] HORSE_JUMPS = {
        {-2, -1}, {-2, 1}, {2, -1}, {2, 1},
        {-1, -2}, {-1, 2}, {1, -2}, {1, 2}
    };
    // 与 HORSE_JUMPS 一一对应的马腿偏移
    private static final int[][] HORSE_LEGS = {
        {-1, 0}, {-1, 0}, {1, 0}, {1, 0},
        {0, -1}, {0, 1}, {0, -1}, {0, 1}
    };

    public List<Move> generate(Board board, PieceColor color) {
        List<Move> moves = new ArrayList<>(64);
        for (int row = 0; row < Board.ROWS; row++) {
            for (int col = 0; col < Board.COLS; col++) {
                Piece piece = board.getPiece(row, col);
                if (piece != null && piece.getColor() == color) {
                    addPieceMoves(board, row, col, piece, moves);
                }
            }
        }
        return moves;
    }

    /**
     * 指定格子上棋子的全部走法；空格返回空列表
     */
    public List<Move> generateFrom(Board board, int row, int col) {
        List<Move> moves = new ArrayList<>();
        Piece piece = board.getPiece(row, col);
        if (piece != null) {
            addPieceMoves(board, row, col, piece, moves);
        }
        return moves;
    }

    /**
     * 校验一步走法：起点须是当前走棋方的棋子，且该走法在生成结果中。
     * 不判断走后是否送将，需要时调用方再用 {@link #isInCheck(Board, PieceColor)} 检查。
     */
    public boolean isPseudoLegal(Board board, Move move) {
        if (move == null) {
            return false;
        }
        Piece piece = board.getPiece(move.getFromRow(), move.getFromCol());
        if (piece == null || piece.getColor() != board.getCurrentTurn()) {
            return false;
        }
        return generateFrom(board, move.getFromRow(), move.getFromCol()).contains(move);
    }

    /**
     * 对方是否有走法能吃到 color 的将帅（含将帅照面）。无将帅时返回false。
     */
    public boolean isInCheck(Board board, PieceColor color) {
        int[] general = board.findGeneralSquare(color);
        if (general == null) {
            return false;
        }
        for (Move move : generate(board, color.opposite())) {
            if (move.getToRow() == general[0] && move.getToCol() == general[1]) {
                return true;
            }
        }
        return false;
    }

    private void addPieceMoves(Board board, int row, int col, Piece piece, List<Move> moves) {
        PieceColor color = piece.getColor();
        switch (piece.getType()) {
            case GENERAL:
                addGeneralMoves(board, row, col, color, moves);
                break;
            case ADVISOR:
                addAdvisorMoves(board, row, col, color, moves);
                break;
            case ELEPHANT:
                addElephantMoves(board, row, col, color, moves);
                break;
            case HORSE:
                addHorseMoves(board, row, col, color, moves);
                break;
            case CHARIOT:
                addChariotMoves(board, row, col, color, moves);
                break;
            case CANNON:
                addCannonMoves(board, row, col, color, moves);
                break;
            case SOLDIER:
                addSoldierMoves(board, row, col, color, moves);
                break;
            default:
                break;
        }
    }

    // 帅/将：九宫内横竖走一步；沿本列向前直到第一个棋子，是对方将帅则可飞将吃
    private void addGeneralMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        for (int[] d : ORTHOGONAL) {
            int toRow = row + d[0];
            int toCol = col + d[1];
            if (isInPalace(toRow, toCol, color)) {
                addIfNotAlly(board, row, col, toRow, toCol, color, moves);
            }
        }
        int dir = color.forward();
        int r = row + dir;
        while (Board.isInside(r, col)) {
            Piece target = board.getPiece(r, col);
            if (target != null) {
                if (target.getColor() != color && target.getType().isGeneral()) {
                    moves.add(new Move(row, col, r, col, target));
                }
                break;
            }
            r += dir;
        }
    }

    // 仕/士：九宫内斜走一步
    private void addAdvisorMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        for (int[] d : DIAGONAL) {
            int toRow = row + d[0];
            int toCol = col + d[1];
            if (isInPalace(toRow, toCol, color)) {
                addIfNotAlly(board, row, col, toRow, toCol, color, moves);
            }
        }
    }

    // 相/象：田字，塞象眼，不过河
    private void addElephantMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        for (int[] d : DIAGONAL) {
            int toRow = row + 2 * d[0];
            int toCol = col + 2 * d[1];
            if (!Board.isInside(toRow, toCol) || !isOwnHalf(toRow, color)) {
                continue;
            }
            if (!board.isEmpty(row + d[0], col + d[1])) {
                continue;
            }
            addIfNotAlly(board, row, col, toRow, toCol, color, moves);
        }
    }

    // 马：日字，蹩马腿
    private void addHorseMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        for (int i = 0; i < HORSE_JUMPS.length; i++) {
            int toRow = row + HORSE_JUMPS[i][0];
            int toCol = col + HORSE_JUMPS[i][1];
            if (!Board.isInside(toRow, toCol)) {
                continue;
            }
            if (!board.isEmpty(row + HORSE_LEGS[i][0], col + HORSE_LEGS[i][1])) {
                continue;
            }
            addIfNotAlly(board, row, col, toRow, toCol, color, moves);
        }
    }

    // 车：横竖任意走，不能越子
    private void addChariotMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        for (int[] d : ORTHOGONAL) {
            int r = row + d[0];
            int c = col + d[1];
            while (Board.isInside(r, c)) {
                Piece target = board.getPiece(r, c);
                if (target == null) {
                    moves.add(new Move(row, col, r, c));
                } else {
                    if (target.getColor() != color) {
                        moves.add(new Move(row, col, r, c, target));
                    }
                    break;
                }
                r += d[0];
                c += d[1];
            }
        }
    }

    // 炮：走法同车，吃子须隔一子（炮架，不分颜色）
    private void addCannonMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        for (int[] d : ORTHOGONAL) {
            int r = row + d[0];
            int c = col + d[1];
            boolean screened = false;
            while (Board.isInside(r, c)) {
                Piece target = board.getPiece(r, c);
                if (!screened) {
                    if (target == null) {
                        moves.add(new Move(row, col, r, c));
                    } else {
                        screened = true;
                    }
                } else if (target != null) {
                    if (target.getColor() != color) {
                        moves.add(new Move(row, col, r, c, target));
                    }
                    break;
                }
                r += d[0];
                c += d[1];
            }
        }
    }

    // 兵/卒：过河前只能前行，过河后可横走，不能后退
    private void addSoldierMoves(Board board, int row, int col, PieceColor color, List<Move> moves) {
        addIfInside(board, row, col, row + color.forward(), col, color, moves);
        if (hasCrossedRiver(row, color)) {
            addIfInside(board, row, col, row, col - 1, color, moves);
            addIfInside(board, row, col, row, col + 1, color, moves);
        }
    }

    private void addIfInside(Board board, int row, int col, int toRow, int toCol, PieceColor color, List<Move> moves) {
        if (Board.isInside(toRow, toCol)) {
            addIfNotAlly(board, row, col, toRow, toCol, color, moves);
        }
    }

    private void addIfNotAlly(Board board, int row, int col, int toRow, int toCol, PieceColor color, List<Move> moves) {
        Piece target = board.getPiece(toRow, toCol);
        if (target != null && target.getColor() == color) {
            return;
        }
        moves.add(new Move(row, col, toRow, toCol, target));
    }

    /**
     * 九宫：列3-5，红方行7-9，黑方行0-2
     */
    public static boolean isInPalace(int row, int col, PieceColor color) {
        if (col < 3 || col > 5) {
            return false;
        }
        if (color == PieceColor.RED) {
            return row >= 7 && row <= 9;
        }
        return row >= 0 && row <= 2;
    }

    /**
     * 河界在第4、5行之间
     */
    public static boolean isOwnHalf(int row, PieceColor color) {
        return color == PieceColor.RED ? row >= 5 : row <= 4;
    }

    public static boolean hasCrossedRiver(int row, PieceColor color) {
        return !isOwnHalf(row, color);
    }
}

package com.xqengine.notation;

import com.xqengine.model.Board;
import com.xqengine.model.Move;
import com.xqengine.model.Piece;
import com.xqengine.model.PieceColor;

/**
 * 中文记谱，如"炮二平五"、"马８进７"。
 * <p>
 * 红方纵线自右向左记为一至九（第0列为"九"），黑方自左向右记为全角１至９。
 * 同一纵线上两子同名时不区分前后。
 */
public final class ChineseMoveNotation {
    private static final String RED_NUMBERS = "一二三四五六七八九";
    private static final String BLACK_NUMBERS = "１２３４５６７８９";

    private ChineseMoveNotation() {
    }

    /**
     * 须在走子之前调用；起点无子时退回坐标记法
     */
    public static String describe(Board board, Move move) {
        Piece piece = board.getPiece(move.getFromRow(), move.getFromCol());
        if (piece == null) {
            return MoveNotation.toCode(move);
        }
        PieceColor color = piece.getColor();
        int forwardSteps = (move.getToRow() - move.getFromRow()) * color.forward();

        StringBuilder sb = new StringBuilder(4);
        sb.append(piece.getDisplayName());
        sb.append(fileName(move.getFromCol(), color));
        if (forwardSteps == 0) {
            sb.append('平').append(fileName(move.getToCol(), color));
            return sb.toString();
        }
        sb.append(forwardSteps > 0 ? '进' : '退');
        if (piece.getType().movesStraight()) {
            sb.append(number(Math.abs(forwardSteps), color));
        } else {
            sb.append(fileName(move.getToCol(), color));
        }
        return sb.toString();
    }

    static char fileName(int col, PieceColor color) {
        if (color == PieceColor.RED) {
            return number(Board.COLS - col, color);
        }
        return number(col + 1, color);
    }

    private static char number(int n, PieceColor color) {
        String digits = color == PieceColor.RED ? RED_NUMBERS : BLACK_NUMBERS;
        return digits.charAt(n - 1);
    }
}

package com.xqengine.ai;

import com.xqengine.model.Board;
import com.xqengine.model.Piece;
import com.xqengine.model.PieceColor;
import com.xqengine.model.PieceType;
import com.xqengine.rules.MoveGenerator;

/**
 * 局面评估：子力价值加简单位置分，返回值以当前走棋方为正。
 */
public class Evaluator {
    public static final int GENERAL_VALUE = 10000;
    public static final int CHARIOT_VALUE = 900;
    public static final int CANNON_VALUE = 450;
    public static final int HORSE_VALUE = 400;
    public static final int ELEPHANT_VALUE = 200;
    public static final int ADVISOR_VALUE = 200;
    public static final int SOLDIER_VALUE = 100;

    // 兵/卒过河加分
    static final int SOLDIER_CROSSED_BONUS = 80;
    // 车每个可直达空格的加分
    static final int CHARIOT_MOBILITY_BONUS = 5;
    static final int CENTER_FILE_WEIGHT = 3;

    private static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    public int evaluate(Board board) {
        int score = 0;
        for (int row = 0; row < Board.ROWS; row++) {
            for (int col = 0; col < Board.COLS; col++) {
                Piece piece = board.getPiece(row, col);
                if (piece == null) {
                    continue;
                }
                int value = getPieceValue(piece.getType()) + getPositionValue(board, piece, row, col);
                score += piece.isRed() ? value : -value;
            }
        }
        return board.getCurrentTurn() == PieceColor.RED ? score : -score;
    }

    public static int getPieceValue(PieceType type) {
        switch (type) {
            case GENERAL:
                return GENERAL_VALUE;
            case CHARIOT:
                return CHARIOT_VALUE;
            case CANNON:
                return CANNON_VALUE;
            case HORSE:
                return HORSE_VALUE;
            case ELEPHANT:
                return ELEPHANT_VALUE;
            case ADVISOR:
                return ADVISOR_VALUE;
            case SOLDIER:
                return SOLDIER_VALUE;
            default:
                return 0;
        }
    }

    private int getPositionValue(Board board, Piece piece, int row, int col) {
        int value = (4 - Math.abs(col - 4)) * CENTER_FILE_WEIGHT;
        if (piece.getType() == PieceType.SOLDIER && MoveGenerator.hasCrossedRiver(row, piece.getColor())) {
            value += SOLDIER_CROSSED_BONUS;
        }
        if (piece.getType() == PieceType.CHARIOT) {
            value += chariotMobility(board, row, col) * CHARIOT_MOBILITY_BONUS;
        }
        return value;
    }

    private int chariotMobility(Board board, int row, int col) {
        int mobility = 0;
        for (int[] d : ORTHOGONAL) {
            int r = row + d[0];
            int c = col + d[1];
            while (Board.isInside(r, c) && board.isEmpty(r, c)) {
                mobility++;
                r += d[0];
                c += d[1];
            }
        }
        return mobility;
    }
}

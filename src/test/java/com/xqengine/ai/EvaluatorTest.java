package com.xqengine.ai;

import com.xqengine.model.Board;
import com.xqengine.model.FenCodec;
import com.xqengine.model.PieceColor;
import com.xqengine.model.PieceType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator();

    @Test
    void shouldScoreSymmetricOpeningAsEven() {
        Board board = Board.standard();
        assertEquals(0, evaluator.evaluate(board));
        board.setCurrentTurn(PieceColor.BLACK);
        assertEquals(0, evaluator.evaluate(board));
    }

    @Test
    void shouldRewardCrossedSoldierFromSideToMove() {
        // general 10000+9, soldier 100+80+12, black general 10000+12
        Board board = FenCodec.parse("4k4/9/9/9/4P4/9/9/9/9/3K5 w");
        assertEquals(189, evaluator.evaluate(board));
        board.setCurrentTurn(PieceColor.BLACK);
        assertEquals(-189, evaluator.evaluate(board));
    }

    @Test
    void shouldCountChariotOpenSquares() {
        // chariot sees 9 squares up and 3 across: 900 + 12 * 5
        Board board = FenCodec.parse("3k5/9/9/9/9/9/9/9/9/R3K4 w");
        assertEquals(960 + 10012 - 10009, evaluator.evaluate(board));
    }

    @Test
    void shouldExposePieceValues() {
        assertEquals(900, Evaluator.getPieceValue(PieceType.CHARIOT));
        assertEquals(450, Evaluator.getPieceValue(PieceType.CANNON));
        assertEquals(100, Evaluator.getPieceValue(PieceType.SOLDIER));
    }
}

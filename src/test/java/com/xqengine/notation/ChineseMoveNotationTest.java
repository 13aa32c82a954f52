package com.xqengine.notation;

import com.xqengine.model.Board;
import com.xqengine.model.FenCodec;
import com.xqengine.model.Move;
import com.xqengine.model.PieceColor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ChineseMoveNotationTest {

    @ParameterizedTest
    @CsvSource({
        "h7e7, 炮二平五",
        "b9c7, 马八进七",
        "a9a8, 车九进一",
        "c6c5, 兵七进一",
        "f9e8, 仕四进五",
        "b7b0, 炮八进七",
        "h2e2, 炮８平５",
        "h0g2, 马８进７",
        "b0c2, 马２进３",
        "c0e2, 象３进５"
    })
    void shouldDescribeOpeningMoves(String code, String expected) {
        Board board = Board.standard();
        assertEquals(expected, ChineseMoveNotation.describe(board, MoveNotation.fromCode(code)));
    }

    @Test
    void shouldWriteRetreatWithStepCount() {
        Board board = FenCodec.parse("3k5/9/9/9/9/9/9/9/4K4/9 w");
        assertEquals("帅五退一", ChineseMoveNotation.describe(board, new Move(8, 4, 9, 4)));
    }

    @Test
    void shouldFallBackToCodeForEmptySquare() {
        assertEquals("e4e5", ChineseMoveNotation.describe(Board.standard(), MoveNotation.fromCode("e4e5")));
    }

    @Test
    void shouldNumberFilesFromEachSidesRight() {
        assertEquals('九', ChineseMoveNotation.fileName(0, PieceColor.RED));
        assertEquals('一', ChineseMoveNotation.fileName(8, PieceColor.RED));
        assertEquals('１', ChineseMoveNotation.fileName(0, PieceColor.BLACK));
        assertEquals('９', ChineseMoveNotation.fileName(8, PieceColor.BLACK));
    }
}

package com.xqengine.ai;

import com.xqengine.model.Board;
import com.xqengine.model.FenCodec;
import com.xqengine.notation.MoveNotation;
import com.xqengine.rules.MoveGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlphaBetaSearchTest {

    private static final String NO_MOVES_FOR_BLACK = "9/9/9/9/9/9/9/9/4K4/ppppppppp b";
    private static final String CHARIOT_TAKES_GENERAL = "3k5/9/9/9/9/9/9/9/9/3RK4 w";

    private final MoveGenerator generator = new MoveGenerator();

    @Test
    void shouldReturnPseudoLegalMoveAtDepthOne() {
        Board board = Board.standard();
        SearchResult result = new AlphaBetaSearch(board).search(1, 5000);
        assertTrue(result.hasBestMove());
        assertEquals(1, result.getDepth());
        assertTrue(generator.isPseudoLegal(board, result.getBestMove()));
        assertEquals(AlphaBetaSearch.ENGINE_ID, result.getEngineId());
        assertTrue(result.getNodes() > 0);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 5})
    void shouldReportLossWhenSideHasNoMoves(int depth) {
        Board board = FenCodec.parse(NO_MOVES_FOR_BLACK);
        SearchResult result = new AlphaBetaSearch(board).search(depth, 1000);
        assertFalse(result.hasBestMove());
        assertTrue(result.getScore() <= -AlphaBetaSearch.MATE_SCORE);
        assertTrue(result.isMate());
        assertEquals(0, result.getDepth());
        assertEquals("已被将死", result.getScoreDisplay());
    }

    @Test
    void shouldTakeGeneralAndReportMateInOne() {
        Board board = FenCodec.parse(CHARIOT_TAKES_GENERAL);
        SearchResult result = new AlphaBetaSearch(board).search(3, 10000);
        assertEquals("d9d0", result.getBestMoveCode());
        assertTrue(result.isMate());
        assertEquals(1, result.getMateIn());
        assertEquals(AlphaBetaSearch.MATE_SCORE + 2, result.getScore());
        assertEquals("杀棋 1 步", result.getScoreDisplay());
        assertEquals(1, result.getPv().size());
    }

    @Test
    void shouldLeaveBoardUntouchedAfterSearch() {
        Board board = FenCodec.parse("2rak4/4a4/b8/9/2p6/1RC5r/8P/6p2/4p4/5K2R w");
        Board before = board.copy();
        new AlphaBetaSearch(board).search(3, 10000);
        assertEquals(before, board);
    }

    @Test
    void shouldKeepPartialFirstDepthWhenBudgetExhausted() {
        AtomicLong now = new AtomicLong();
        Board board = Board.standard();
        AlphaBetaSearch search = new AlphaBetaSearch(board, generator, new Evaluator(), () -> now.getAndAdd(100));
        SearchResult result = search.search(6, 50);
        assertTrue(result.hasBestMove());
        assertEquals(1, result.getDepth());
        assertEquals(Board.standard(), board);
    }

    @Test
    void shouldStopDeepeningOnceHalfTheBudgetIsSpent() {
        // one tick per clock read: depths 1 and 2 read it 44 times each, then 89 > 150 / 2
        AtomicLong now = new AtomicLong();
        AlphaBetaSearch search = new AlphaBetaSearch(Board.standard(), generator, new Evaluator(), now::getAndIncrement);
        SearchResult result = search.search(6, 150);
        assertEquals(2, result.getDepth());
        assertNotNull(result.getBestMove());
    }

    @Test
    void shouldPreferCaptureOfUndefendedChariot() {
        Board board = FenCodec.parse("3k5/9/9/9/9/9/9/r8/9/R3K4 w");
        SearchResult result = new AlphaBetaSearch(board).search(2, 10000);
        assertEquals(MoveNotation.fromCode("a9a7"), result.getBestMove());
    }

    @Test
    void shouldRejectNullBoard() {
        assertThrows(IllegalArgumentException.class, () -> new AlphaBetaSearch(null));
    }
}

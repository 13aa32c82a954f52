package com.xqengine.ai;

import com.xqengine.model.FenCodec;
import com.xqengine.model.Move;
import com.xqengine.notation.MoveNotation;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UciEngineAnalyzerTest {

    @Test
    void shouldBuildGoCommandFromLimits() {
        assertEquals("go depth 10", UciEngineAnalyzer.buildGoCommand(AnalysisLimits.ofDepth(10)));
        assertEquals("go movetime 800", UciEngineAnalyzer.buildGoCommand(AnalysisLimits.ofMoveTime(800)));
        assertEquals("go depth 6 movetime 15000", UciEngineAnalyzer.buildGoCommand(Difficulty.HARD.toLimits()));
        assertEquals("go depth " + UciEngineAnalyzer.DEFAULT_DEPTH, UciEngineAnalyzer.buildGoCommand(AnalysisLimits.defaults()));
    }

    @Test
    void shouldMapEngineMovesBackToBoardRows() {
        UciOutputParser.Info info = UciOutputParser.parseInfo("info depth 12 score cp 35 nodes 5000 time 90 pv h2e2 h9g7 b0c2");
        UciOutputParser.BestMove best = UciOutputParser.parseBestMove("bestmove h2e2 ponder h9g7");

        SearchResult result = UciEngineAnalyzer.toResult(info, best, "uci", 120L);

        assertEquals(new Move(7, 7, 7, 4), result.getBestMove());
        assertEquals("h7e7", result.getBestMoveCode());
        assertEquals(MoveNotation.fromCode("h0g2"), result.getPonderMove());
        assertEquals(3, result.getPv().size());
        assertEquals(35, result.getScore());
        assertEquals(12, result.getDepth());
        assertEquals(5000L, result.getNodes());
        assertEquals(90L, result.getTimeMs());
        assertEquals("+0.35", result.getScoreDisplay());
    }

    @Test
    void shouldReplacePvThatDisagreesWithBestMove() {
        UciOutputParser.Info info = UciOutputParser.parseInfo("info depth 8 score cp -40 pv h2e2 h9g7");
        UciOutputParser.BestMove best = UciOutputParser.parseBestMove("bestmove b0c2");

        SearchResult result = UciEngineAnalyzer.toResult(info, best, "uci", 50L);

        assertEquals(Collections.singletonList(MoveNotation.fromCode("b9c7")), result.getPv());
        assertEquals("-0.40", result.getScoreDisplay());
    }

    @Test
    void shouldCarryMateDistance() {
        UciOutputParser.Info info = UciOutputParser.parseInfo("info depth 20 score mate -3 pv h2e2");
        UciOutputParser.BestMove best = UciOutputParser.parseBestMove("bestmove h2e2");

        SearchResult result = UciEngineAnalyzer.toResult(info, best, "uci", 50L);

        assertEquals(ScoreType.MATE, result.getScoreType());
        assertEquals(-3, result.getMateIn());
        assertEquals(-AlphaBetaSearch.MATE_SCORE, result.getScore());
        assertEquals("被杀 3 步", result.getScoreDisplay());
    }

    @Test
    void shouldReturnEmptyResultForNoMove() {
        SearchResult result = UciEngineAnalyzer.toResult(null, UciOutputParser.parseBestMove("bestmove (none)"), "uci", 10L);
        assertFalse(result.hasBestMove());
        assertEquals("uci", result.getEngineId());
    }

    @Test
    void shouldReturnEmptyResultWhenEngineCannotStart() {
        UciEngineAnalyzer analyzer = new UciEngineAnalyzer(Collections.singletonList("/nonexistent/xq-uci-engine"));
        try {
            SearchResult result = analyzer.analyze(FenCodec.INITIAL_FEN, AnalysisLimits.ofDepth(1));
            assertFalse(result.hasBestMove());
            assertTrue(result.isEngineFailure());
        } finally {
            analyzer.close();
        }
    }

    @Test
    void shouldAnalyzeThroughLiveEngineAndReuseProcess() {
        UciEngineAnalyzer analyzer = new UciEngineAnalyzer(ScriptedUciEngine.command("normal"));
        try {
            SearchResult first = analyzer.analyze(FenCodec.INITIAL_FEN, AnalysisLimits.ofDepth(5));
            assertEquals("h7e7", first.getBestMoveCode());
            assertEquals(MoveNotation.fromCode("h0g2"), first.getPonderMove());
            assertEquals(35, first.getScore());
            assertEquals(5, first.getDepth());
            assertEquals(4096L, first.getNodes());
            assertEquals(2, first.getPv().size());
            assertFalse(first.isEngineFailure());

            // the scripted score grows with each go on the same process
            SearchResult second = analyzer.analyze(FenCodec.INITIAL_FEN, AnalysisLimits.ofDepth(5));
            assertEquals("h7e7", second.getBestMoveCode());
            assertEquals(36, second.getScore());
        } finally {
            analyzer.close();
        }
    }

    @Test
    void shouldSendStopWhenEngineOverrunsTimeout() {
        UciEngineAnalyzer analyzer = new UciEngineAnalyzer(ScriptedUciEngine.command("stall"), 1, 16, 200L);
        try {
            SearchResult result = analyzer.analyze(FenCodec.INITIAL_FEN, AnalysisLimits.ofDepth(30));
            assertEquals("b9c7", result.getBestMoveCode());
            assertEquals(-20, result.getScore());
            assertFalse(result.isEngineFailure());
        } finally {
            analyzer.close();
        }
    }

    @Test
    void shouldTreatEngineNoMoveAsOrdinaryResult() {
        UciEngineAnalyzer analyzer = new UciEngineAnalyzer(ScriptedUciEngine.command("none"));
        try {
            SearchResult result = analyzer.analyze("9/9/9/9/9/9/9/9/4K4/ppppppppp b", AnalysisLimits.ofDepth(2));
            assertFalse(result.hasBestMove());
            assertFalse(result.isEngineFailure());
        } finally {
            analyzer.close();
        }
    }

    @Test
    void shouldRejectEmptyCommand() {
        assertThrows(IllegalArgumentException.class, () -> new UciEngineAnalyzer(Collections.<String>emptyList()));
    }
}

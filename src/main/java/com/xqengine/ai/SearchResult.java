package com.xqengine.ai;

import com.xqengine.model.Move;
import com.xqengine.notation.MoveNotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 一次分析的结果。
 * <p>
 * {@code bestMove} 为 null 表示没有可走的棋。分数以走棋方为正；{@link ScoreType#MATE}
 * 时 {@code |score| >= MATE_SCORE}，{@link #getMateIn()} 给出带符号的杀棋步数
 * （负数表示被杀）。
 */
public final class SearchResult {
    private final Move bestMove;
    private final Move ponderMove;
    private final int score;
    private final ScoreType scoreType;
    private final int mateIn;
    private final int depth;
    private final long nodes;
    private final long timeMs;
    private final List<Move> pv;
    private final String engineId;
    private final boolean engineFailure;

    public SearchResult(Move bestMove, Move ponderMove, int score, ScoreType scoreType, int mateIn,
                        int depth, long nodes, long timeMs, List<Move> pv, String engineId) {
        this(bestMove, ponderMove, score, scoreType, mateIn, depth, nodes, timeMs, pv, engineId, false);
    }

    private SearchResult(Move bestMove, Move ponderMove, int score, ScoreType scoreType, int mateIn,
                         int depth, long nodes, long timeMs, List<Move> pv, String engineId, boolean engineFailure) {
        this.bestMove = bestMove;
        this.ponderMove = ponderMove;
        this.score = score;
        this.scoreType = scoreType == null ? ScoreType.CP : scoreType;
        this.mateIn = mateIn;
        this.depth = depth;
        this.nodes = nodes;
        this.timeMs = timeMs;
        this.pv = pv == null ? Collections.<Move>emptyList() : Collections.unmodifiableList(new ArrayList<Move>(pv));
        this.engineId = engineId == null ? "" : engineId;
        this.engineFailure = engineFailure;
    }

    /**
     * 无着可走时的结果
     */
    public static SearchResult none(String engineId, long timeMs) {
        return new SearchResult(null, null, 0, ScoreType.CP, 0, 0, 0L, timeMs, null, engineId, false);
    }

    /**
     * 外部引擎通信失败时的结果，与无着可走区分开
     */
    public static SearchResult failed(String engineId, long timeMs) {
        return new SearchResult(null, null, 0, ScoreType.CP, 0, 0, 0L, timeMs, null, engineId, true);
    }

    public Move getBestMove() {
        return bestMove;
    }

    public boolean hasBestMove() {
        return bestMove != null;
    }

    /**
     * 本引擎坐标记法，无着时为 null
     */
    public String getBestMoveCode() {
        return bestMove == null ? null : MoveNotation.toCode(bestMove);
    }

    public Move getPonderMove() {
        return ponderMove;
    }

    public int getScore() {
        return score;
    }

    public ScoreType getScoreType() {
        return scoreType;
    }

    public boolean isMate() {
        return scoreType == ScoreType.MATE;
    }

    public int getMateIn() {
        return mateIn;
    }

    public int getDepth() {
        return depth;
    }

    public long getNodes() {
        return nodes;
    }

    public long getTimeMs() {
        return timeMs;
    }

    public List<Move> getPv() {
        return pv;
    }

    public String getEngineId() {
        return engineId;
    }

    public boolean isEngineFailure() {
        return engineFailure;
    }

    /**
     * 显示用分数："+1.25"、"-0.40"、"杀棋 3 步"、"被杀 2 步"
     */
    public String getScoreDisplay() {
        if (scoreType == ScoreType.MATE) {
            if (mateIn > 0) {
                return "杀棋 " + mateIn + " 步";
            }
            if (mateIn < 0) {
                return "被杀 " + (-mateIn) + " 步";
            }
            return score < 0 ? "已被将死" : "杀棋";
        }
        double cp = score / 100.0;
        return cp >= 0 ? String.format(Locale.ROOT, "+%.2f", cp) : String.format(Locale.ROOT, "%.2f", cp);
    }

    @Override
    public String toString() {
        return "SearchResult{best=" + (bestMove == null ? "none" : getBestMoveCode())
            + ", score=" + getScoreDisplay()
            + ", depth=" + depth
            + ", nodes=" + nodes
            + ", timeMs=" + timeMs
            + ", engine=" + engineId + '}';
    }
}

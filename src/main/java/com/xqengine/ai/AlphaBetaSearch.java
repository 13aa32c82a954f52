package com.xqengine.ai;

import com.xqengine.model.Board;
import com.xqengine.model.Move;
import com.xqengine.model.MoveGuard;
import com.xqengine.rules.MoveGenerator;

import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 中国象棋搜索 - 迭代加深 + Negamax Alpha-Beta
 * <p>
 * 在传入的棋盘上原地走子/悔棋，每一步都由 {@link MoveGuard} 保证恢复，搜索结束后棋盘不变。
 * 只在每层开始和每个根节点走法之后检查时间，单个深分支不会被打断，时间预算是软限制。
 * 无着可走按负方计分：{@code -(MATE_SCORE + 剩余深度)}，越快的杀棋分数越高。
 */
public final class AlphaBetaSearch {
    private static final Logger LOG = Logger.getLogger(AlphaBetaSearch.class.getName());

    public static final int INF = 1_000_000;
    public static final int MATE_SCORE = 100_000;
    public static final String ENGINE_ID = "builtin";

    private final Board board;
    private final MoveGenerator generator;
    private final Evaluator evaluator;
    private final LongSupplier clock;

    private long nodes;
    private long searchStartTime;

    public AlphaBetaSearch(Board board) {
        this(board, new MoveGenerator(), new Evaluator());
    }

    public AlphaBetaSearch(Board board, MoveGenerator generator, Evaluator evaluator) {
        this(board, generator, evaluator, System::currentTimeMillis);
    }

    AlphaBetaSearch(Board board, MoveGenerator generator, Evaluator evaluator, LongSupplier clock) {
        if (board == null) {
            throw new IllegalArgumentException("board is null");
        }
        this.board = board;
        this.generator = generator;
        this.evaluator = evaluator;
        this.clock = clock;
    }

    public SearchResult search(int maxDepth, long timeLimitMs) {
        nodes = 0;
        searchStartTime = clock.getAsLong();
        int depthLimit = Math.max(1, maxDepth);

        List<Move> rootMoves = generator.generate(board, board.getCurrentTurn());
        if (rootMoves.isEmpty()) {
            long elapsed = elapsed();
            LOG.fine(() -> "Search: no moves for " + board.getCurrentTurn() + " time=" + elapsed + "ms");
            return new SearchResult(null, null, -MATE_SCORE, ScoreType.MATE, 0, 0, nodes, elapsed, null, ENGINE_ID);
        }

        Move bestMove = null;
        int bestScore = 0;
        int reachedDepth = 0;

        for (int depth = 1; depth <= depthLimit; depth++) {
            if (depth > 2 && elapsed() > timeLimitMs / 2) {
                break;
            }
            if (bestMove != null) {
                moveToFront(rootMoves, bestMove);
            }

            RootResult result = searchRoot(rootMoves, depth, timeLimitMs);
            // 中途放弃的一层作废，除非还没有任何完整结果
            if (result.bestMove != null && (result.complete || reachedDepth == 0)) {
                bestMove = result.bestMove;
                bestScore = result.score;
                reachedDepth = depth;
            }
            if (result.timeUp) {
                break;
            }
        }

        long totalTime = elapsed();
        SearchResult searchResult = toResult(bestMove, bestScore, reachedDepth, totalTime);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Search: depth=" + reachedDepth + " nodes=" + nodes + " time=" + totalTime + "ms"
                + " best=" + searchResult.getBestMoveCode() + " score=" + bestScore);
        }
        return searchResult;
    }

    public long getNodes() {
        return nodes;
    }

    private RootResult searchRoot(List<Move> rootMoves, int depth, long timeLimitMs) {
        Move best = null;
        int alpha = -INF;

        for (int i = 0; i < rootMoves.size(); i++) {
            Move move = rootMoves.get(i);
            int score;
            try (MoveGuard ignored = board.play(move)) {
                if (best == null) {
                    score = -negamax(depth - 1, -INF, -alpha);
                } else {
                    // PVS: 先用零窗口试探，超过 alpha 再全窗口重搜
                    score = -negamax(depth - 1, -alpha - 1, -alpha);
                    if (score > alpha) {
                        score = -negamax(depth - 1, -INF, -alpha);
                    }
                }
            }
            if (best == null || score > alpha) {
                alpha = score;
                best = move;
            }
            if (elapsed() > timeLimitMs) {
                return new RootResult(best, alpha, i == rootMoves.size() - 1, true);
            }
        }
        return new RootResult(best, alpha, true, false);
    }

    private int negamax(int depth, int alpha, int beta) {
        nodes++;
        if (depth <= 0) {
            return evaluator.evaluate(board);
        }

        List<Move> moves = generator.generate(board, board.getCurrentTurn());
        if (moves.isEmpty()) {
            return -(MATE_SCORE + depth);
        }

        int best = -INF;
        for (Move move : moves) {
            int score;
            try (MoveGuard ignored = board.play(move)) {
                score = -negamax(depth - 1, -beta, -alpha);
            }
            if (score > best) {
                best = score;
            }
            if (best > alpha) {
                alpha = best;
            }
            if (alpha >= beta) {
                break;
            }
        }
        return best;
    }

    private SearchResult toResult(Move bestMove, int score, int depth, long timeMs) {
        List<Move> pv = bestMove == null ? null : Collections.singletonList(bestMove);
        if (Math.abs(score) < MATE_SCORE) {
            return new SearchResult(bestMove, null, score, ScoreType.CP, 0, depth, nodes, timeMs, pv, ENGINE_ID);
        }
        // 终局出现在根之后第 ply 步
        int ply = depth - (Math.abs(score) - MATE_SCORE);
        int moves = (ply + 1) / 2;
        int mateIn = score > 0 ? moves : -moves;
        return new SearchResult(bestMove, null, score, ScoreType.MATE, mateIn, depth, nodes, timeMs, pv, ENGINE_ID);
    }

    private long elapsed() {
        return clock.getAsLong() - searchStartTime;
    }

    private static void moveToFront(List<Move> moves, Move move) {
        int idx = moves.indexOf(move);
        if (idx > 0) {
            moves.add(0, moves.remove(idx));
        }
    }

    private static final class RootResult {
        private final Move bestMove;
        private final int score;
        private final boolean complete;
        private final boolean timeUp;

        private RootResult(Move bestMove, int score, boolean complete, boolean timeUp) {
            this.bestMove = bestMove;
            this.score = score;
            this.complete = complete;
            this.timeUp = timeUp;
        }
    }
}

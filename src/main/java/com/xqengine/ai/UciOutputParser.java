package com.xqengine.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses the engine-to-GUI lines of the UCI protocol that an analysis needs:
 * {@code info ... depth ... score cp|mate ... pv ...} and {@code bestmove <move> [ponder <move>]}.
 */
public final class UciOutputParser {
    private UciOutputParser() {
    }

    /**
     * @return parsed info, or null when the line is not an {@code info} line
     */
    public static Info parseInfo(String line) {
        if (line == null) {
            return null;
        }
        String[] parts = line.trim().split("\\s+");
        if (parts.length == 0 || !"info".equals(parts[0])) {
            return null;
        }
        Info info = new Info();
        int i = 1;
        while (i < parts.length) {
            switch (parts[i]) {
                case "depth":
                    info.depth = parseInt(parts, i + 1, 0);
                    i += 2;
                    break;
                case "multipv":
                    info.multiPv = parseInt(parts, i + 1, 1);
                    i += 2;
                    break;
                case "score":
                    String type = i + 1 < parts.length ? parts[i + 1] : "cp";
                    info.scoreType = "mate".equals(type) ? ScoreType.MATE : ScoreType.CP;
                    info.score = parseInt(parts, i + 2, 0);
                    info.hasScore = true;
                    i += 3;
                    break;
                case "nodes":
                    info.nodes = parseLong(parts, i + 1);
                    i += 2;
                    break;
                case "nps":
                    info.nps = parseLong(parts, i + 1);
                    i += 2;
                    break;
                case "time":
                    info.timeMs = parseLong(parts, i + 1);
                    i += 2;
                    break;
                case "lowerbound":
                case "upperbound":
                    info.bound = true;
                    i++;
                    break;
                case "pv":
                    for (int j = i + 1; j < parts.length; j++) {
                        info.pv.add(parts[j]);
                    }
                    i = parts.length;
                    break;
                case "string":
                    // free text until end of line
                    i = parts.length;
                    break;
                default:
                    i++;
                    break;
            }
        }
        return info;
    }

    /**
     * @return parsed bestmove, or null when the line is not a {@code bestmove} line
     */
    public static BestMove parseBestMove(String line) {
        if (line == null) {
            return null;
        }
        String[] parts = line.trim().split("\\s+");
        if (!"bestmove".equals(parts[0].toLowerCase(Locale.ROOT))) {
            return null;
        }
        String best = parts.length > 1 ? parts[1] : null;
        String ponder = parts.length > 3 && "ponder".equals(parts[2]) ? parts[3] : null;
        return new BestMove(best, ponder);
    }

    private static int parseInt(String[] parts, int idx, int fallback) {
        if (idx >= parts.length) {
            return fallback;
        }
        try {
            return Integer.parseInt(parts[idx]);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static long parseLong(String[] parts, int idx) {
        if (idx >= parts.length) {
            return 0L;
        }
        try {
            return Long.parseLong(parts[idx]);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public static final class Info {
        private int depth;
        private int multiPv = 1;
        private boolean hasScore;
        private boolean bound;
        private ScoreType scoreType = ScoreType.CP;
        private int score;
        private long nodes;
        private long nps;
        private long timeMs;
        private final List<String> pv = new ArrayList<>();

        public int getDepth() {
            return depth;
        }

        public int getMultiPv() {
            return multiPv;
        }

        public boolean hasScore() {
            return hasScore;
        }

        /**
         * {@code lowerbound}/{@code upperbound} 标记的分数只是界，不是确切评估
         */
        public boolean isBound() {
            return bound;
        }

        public ScoreType getScoreType() {
            return scoreType;
        }

        /**
         * Centipawns for {@link ScoreType#CP}, signed moves to mate for {@link ScoreType#MATE}.
         */
        public int getScore() {
            return score;
        }

        public long getNodes() {
            return nodes;
        }

        public long getNps() {
            return nps;
        }

        public long getTimeMs() {
            return timeMs;
        }

        public List<String> getPv() {
            return Collections.unmodifiableList(pv);
        }
    }

    public static final class BestMove {
        private final String move;
        private final String ponder;

        private BestMove(String move, String ponder) {
            this.move = move;
            this.ponder = ponder;
        }

        public String getMove() {
            return move;
        }

        public String getPonder() {
            return ponder;
        }

        /**
         * {@code bestmove (none)} and friends mean the side to move has no move.
         */
        public boolean isNone() {
            return move == null || move.isEmpty() || "none".equalsIgnoreCase(move)
                || "(none)".equalsIgnoreCase(move) || "0000".equals(move);
        }
    }
}

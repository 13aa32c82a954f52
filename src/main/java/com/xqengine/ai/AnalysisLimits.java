package com.xqengine.ai;

/**
 * 分析限制：搜索深度与思考时间，0 表示使用分析器自己的默认值。
 */
public final class AnalysisLimits {
    private static final AnalysisLimits DEFAULTS = new AnalysisLimits(0, 0L);

    private final int depth;
    private final long moveTimeMs;

    private AnalysisLimits(int depth, long moveTimeMs) {
        this.depth = Math.max(0, depth);
        this.moveTimeMs = Math.max(0L, moveTimeMs);
    }

    public static AnalysisLimits defaults() {
        return DEFAULTS;
    }

    public static AnalysisLimits ofDepth(int depth) {
        return new AnalysisLimits(depth, 0L);
    }

    public static AnalysisLimits ofMoveTime(long moveTimeMs) {
        return new AnalysisLimits(0, moveTimeMs);
    }

    public static AnalysisLimits of(int depth, long moveTimeMs) {
        return new AnalysisLimits(depth, moveTimeMs);
    }

    public int getDepth() {
        return depth;
    }

    public long getMoveTimeMs() {
        return moveTimeMs;
    }

    public boolean hasDepth() {
        return depth > 0;
    }

    public boolean hasMoveTime() {
        return moveTimeMs > 0;
    }

    public int depthOr(int fallback) {
        return hasDepth() ? depth : fallback;
    }

    public long moveTimeOr(long fallback) {
        return hasMoveTime() ? moveTimeMs : fallback;
    }

    @Override
    public String toString() {
        return "AnalysisLimits{depth=" + depth + ", moveTimeMs=" + moveTimeMs + '}';
    }
}

package com.xqengine.ai;

/**
 * 难度预设，对应一组搜索深度与时间预算
 */
public enum Difficulty {
    EASY("简单", 2, 1200),
    MEDIUM("中等", 4, 6000),
    HARD("困难", 6, 15000);

    private final String displayName;
    private final int maxDepth;
    private final int timeLimitMs;

    Difficulty(String displayName, int maxDepth, int timeLimitMs) {
        this.displayName = displayName;
        this.maxDepth = maxDepth;
        this.timeLimitMs = timeLimitMs;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getTimeLimitMs() {
        return timeLimitMs;
    }

    public AnalysisLimits toLimits() {
        return AnalysisLimits.of(maxDepth, timeLimitMs);
    }

    @Override
    public String toString() {
        return displayName;
    }
}

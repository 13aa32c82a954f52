package com.xqengine.ai;

/**
 * 局面分析能力：输入 FEN 与限制，输出 {@link SearchResult}。
 * 内置搜索与外部 UCI 引擎都实现该接口，由调用方注入，互相可替换。
 */
public interface PositionAnalyzer {
    SearchResult analyze(String fen, AnalysisLimits limits);

    default SearchResult analyze(String fen, Difficulty difficulty) {
        return analyze(fen, difficulty == null ? AnalysisLimits.defaults() : difficulty.toLimits());
    }

    String getEngineId();

    String getEngineText();

    default void close() {
        // no-op
    }
}

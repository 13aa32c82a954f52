package com.xqengine.ai;

import com.xqengine.model.Board;
import com.xqengine.model.FenCodec;

public final class BuiltinAnalyzer implements PositionAnalyzer {
    public static final int DEFAULT_DEPTH = 4;
    public static final long DEFAULT_TIME_MS = 3000L;

    @Override
    public SearchResult analyze(String fen, AnalysisLimits limits) {
        AnalysisLimits l = limits == null ? AnalysisLimits.defaults() : limits;
        Board board = FenCodec.parse(fen);
        AlphaBetaSearch search = new AlphaBetaSearch(board);
        return search.search(l.depthOr(DEFAULT_DEPTH), l.moveTimeOr(DEFAULT_TIME_MS));
    }

    @Override
    public String getEngineId() {
        return AlphaBetaSearch.ENGINE_ID;
    }

    @Override
    public String getEngineText() {
        return "内置AI";
    }
}

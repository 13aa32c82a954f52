package com.xqengine.model;

/**
 * 棋子颜色枚举（走棋方）
 */
public enum PieceColor {
    RED("红方", 'w'), BLACK("黑方", 'b');

    private final String displayName;
    private final char fenToken;

    PieceColor(String displayName, char fenToken) {
        this.displayName = displayName;
        this.fenToken = fenToken;
    }

    public String getDisplayName() {
        return displayName;
    }

    public char getFenToken() {
        return fenToken;
    }

    public PieceColor opposite() {
        return this == RED ? BLACK : RED;
    }

    /**
     * 前进方向的行增量：红方向第0行走，黑方向第9行走
     */
    public int forward() {
        return this == RED ? -1 : 1;
    }
}

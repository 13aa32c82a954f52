package com.xqengine.model;

/**
 * 棋子类 - 不可变的（类型, 颜色）对，每种组合只有一个实例
 */
public final class Piece {
    private static final Piece[][] CACHE = initCache();

    private final PieceType type;
    private final PieceColor color;

    private Piece(PieceType type, PieceColor color) {
        this.type = type;
        this.color = color;
    }

    public static Piece of(PieceType type, PieceColor color) {
        return CACHE[color.ordinal()][type.ordinal()];
    }

    /**
     * 由FEN字母得到棋子，大写为红方；无法识别时返回null
     */
    public static Piece fromFenChar(char ch) {
        PieceType type = PieceType.fromFenChar(ch);
        if (type == null) {
            return null;
        }
        return of(type, Character.isUpperCase(ch) ? PieceColor.RED : PieceColor.BLACK);
    }

    public PieceType getType() {
        return type;
    }

    public PieceColor getColor() {
        return color;
    }

    public boolean isRed() {
        return color == PieceColor.RED;
    }

    public char toFenChar() {
        char c = type.getFenChar();
        return color == PieceColor.RED ? Character.toUpperCase(c) : c;
    }

    public String getDisplayName() {
        return type.getDisplayName(color);
    }

    @Override
    public String toString() {
        return color.getDisplayName() + getDisplayName();
    }

    private static Piece[][] initCache() {
        PieceColor[] colors = PieceColor.values();
        PieceType[] types = PieceType.values();
        Piece[][] cache = new Piece[colors.length][types.length];
        for (PieceColor color : colors) {
            for (PieceType type : types) {
                cache[color.ordinal()][type.ordinal()] = new Piece(type, color);
            }
        }
        return cache;
    }
}

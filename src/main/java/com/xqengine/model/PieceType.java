package com.xqengine.model;

/**
 * 棋子类型枚举，红黑双方共用
 */
public enum PieceType {
    GENERAL('k', "帅", "将"),
    ADVISOR('a', "仕", "士"),
    ELEPHANT('b', "相", "象"),
    HORSE('n', "马", "马"),
    CHARIOT('r', "车", "车"),
    CANNON('c', "炮", "炮"),
    SOLDIER('p', "兵", "卒");

    private final char fenChar;
    private final String redName;
    private final String blackName;

    PieceType(char fenChar, String redName, String blackName) {
        this.fenChar = fenChar;
        this.redName = redName;
        this.blackName = blackName;
    }

    /**
     * FEN中的小写字母
     */
    public char getFenChar() {
        return fenChar;
    }

    public String getDisplayName(PieceColor color) {
        return color == PieceColor.RED ? redName : blackName;
    }

    public boolean isGeneral() {
        return this == GENERAL;
    }

    /**
     * 直行棋子（帅、车、炮、兵）记谱时进退写步数，其余写目标纵线
     */
    public boolean movesStraight() {
        return this == GENERAL || this == CHARIOT || this == CANNON || this == SOLDIER;
    }

    public static PieceType fromFenChar(char ch) {
        char lower = Character.toLowerCase(ch);
        for (PieceType type : values()) {
            if (type.fenChar == lower) {
                return type;
            }
        }
        return null;
    }
}

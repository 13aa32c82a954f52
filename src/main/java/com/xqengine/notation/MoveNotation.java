package com.xqengine.notation;

import com.xqengine.model.Board;
import com.xqengine.model.Move;

import java.util.Locale;

/**
 * 四字符坐标走法与内部 (行, 列) 坐标互转。
 * <p>
 * 本引擎记法：{@code 'a'+列} 加原始行号，不翻转行号，例如红炮平中 {@code h7e7}。
 * 外部 UCI 引擎以红方底线为第0行，{@link #toUci(Move)} / {@link #fromUci(String)}
 * 负责行号翻转。解析失败一律返回 null，不抛异常。
 */
public final class MoveNotation {
    private MoveNotation() {
    }

    public static String toCode(Move move) {
        return format(move.getFromCol(), move.getFromRow(), move.getToCol(), move.getToRow());
    }

    public static Move fromCode(String code) {
        int[] squares = parse(code);
        if (squares == null) {
            return null;
        }
        return new Move(squares[1], squares[0], squares[3], squares[2]);
    }

    public static String toUci(Move move) {
        return format(move.getFromCol(), flipRank(move.getFromRow()), move.getToCol(), flipRank(move.getToRow()));
    }

    /**
     * 解析外部引擎的走法；{@code none}、{@code (none)}、{@code 0000} 表示无着
     */
    public static Move fromUci(String code) {
        if (code == null) {
            return null;
        }
        String t = code.trim().toLowerCase(Locale.ROOT);
        if ("none".equals(t) || "(none)".equals(t) || "0000".equals(t)) {
            return null;
        }
        int[] squares = parse(t);
        if (squares == null) {
            return null;
        }
        return new Move(flipRank(squares[1]), squares[0], flipRank(squares[3]), squares[2]);
    }

    /**
     * 引擎记法转 UCI 记法，非法输入返回 null
     */
    public static String codeToUci(String code) {
        Move move = fromCode(code);
        return move == null ? null : toUci(move);
    }

    public static String uciToCode(String uci) {
        Move move = fromUci(uci);
        return move == null ? null : toCode(move);
    }

    private static int flipRank(int row) {
        return Board.ROWS - 1 - row;
    }

    private static String format(int fromFile, int fromRank, int toFile, int toRank) {
        StringBuilder sb = new StringBuilder(4);
        sb.append((char) ('a' + fromFile));
        sb.append(fromRank);
        sb.append((char) ('a' + toFile));
        sb.append(toRank);
        return sb.toString();
    }

    // {fromFile, fromRank, toFile, toRank}
    private static int[] parse(String code) {
        if (code == null || code.length() != 4) {
            return null;
        }
        char fFile = code.charAt(0);
        char fRank = code.charAt(1);
        char tFile = code.charAt(2);
        char tRank = code.charAt(3);
        if (!isFileChar(fFile) || !isFileChar(tFile) || !isRankChar(fRank) || !isRankChar(tRank)) {
            return null;
        }
        return new int[] {fFile - 'a', fRank - '0', tFile - 'a', tRank - '0'};
    }

    private static boolean isFileChar(char ch) {
        return ch >= 'a' && ch < 'a' + Board.COLS;
    }

    private static boolean isRankChar(char ch) {
        return ch >= '0' && ch <= '9';
    }
}

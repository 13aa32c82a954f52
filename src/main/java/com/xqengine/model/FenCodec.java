package com.xqengine.model;

/**
 * FEN 与棋盘互转。
 * <p>
 * 解析不抛异常：任一行含无法识别的字符时得到空棋盘，超出 10 行 9 列的部分直接丢弃，
 * 不足的部分补空。输出固定带上 {@code " - - 0 1"}，不记录半回合与回合数。
 */
public final class FenCodec {
    public static final String INITIAL_FEN = "rnbakabnr/9/1c5c1/p1p1p1p1p/9/9/P1P1P1P1P/1C5C1/9/RNBAKABNR w - - 0 1";
    private static final String COUNTERS_SUFFIX = " - - 0 1";

    private FenCodec() {
    }

    public static Board parse(String fen) {
        Board board = new Board();
        if (fen == null || fen.trim().isEmpty()) {
            return board;
        }
        String[] parts = fen.trim().split("\\s+");
        String[] rows = parts[0].split("/", -1);
        for (int row = 0; row < rows.length && row < Board.ROWS; row++) {
            if (!parseRow(board, row, rows[row])) {
                board.clear();
                return board;
            }
        }
        if (parts.length > 1 && "b".equals(parts[1])) {
            board.setCurrentTurn(PieceColor.BLACK);
        } else {
            board.setCurrentTurn(PieceColor.RED);
        }
        return board;
    }

    private static boolean parseRow(Board board, int row, String text) {
        int col = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= '0' && ch <= '9') {
                col += ch - '0';
                continue;
            }
            Piece piece = Piece.fromFenChar(ch);
            if (piece == null) {
                return false;
            }
            board.setPiece(row, col, piece);
            col++;
        }
        return true;
    }

    public static String serialize(Board board) {
        if (board == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(96);
        sb.append(toPlacement(board));
        sb.append(' ');
        sb.append(board.getCurrentTurn().getFenToken());
        sb.append(COUNTERS_SUFFIX);
        return sb.toString();
    }

    /**
     * 仅棋子摆放字段
     */
    public static String toPlacement(Board board) {
        StringBuilder sb = new StringBuilder(90);
        for (int row = 0; row < Board.ROWS; row++) {
            if (row > 0) {
                sb.append('/');
            }
            int empty = 0;
            for (int col = 0; col < Board.COLS; col++) {
                Piece piece = board.getPiece(row, col);
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(piece.toFenChar());
            }
            if (empty > 0) {
                sb.append(empty);
            }
        }
        return sb.toString();
    }

    /**
     * 补齐到 UCI 引擎要求的六段式；已带计数字段的原样返回
     */
    public static String normalize(String fen) {
        if (fen == null) {
            return "";
        }
        String trimmed = fen.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String[] parts = trimmed.split("\\s+");
        if (parts.length >= 6) {
            return trimmed;
        }
        if (parts.length == 1) {
            return parts[0] + " w" + COUNTERS_SUFFIX;
        }
        return parts[0] + " " + parts[1] + COUNTERS_SUFFIX;
    }
}

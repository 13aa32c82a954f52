package com.xqengine.ai;

import com.xqengine.model.FenCodec;
import com.xqengine.model.Move;
import com.xqengine.notation.MoveNotation;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * External UCI engine adapter for Xiangqi (Pikafish-first).
 * Keeps a persistent engine process; on any protocol failure the process is dropped and
 * a {@link SearchResult#failed(String, long) failed} result is returned so a caller can fall
 * back to the built-in search. {@code bestmove (none)} is an ordinary no-move result.
 * Moves coming back from the engine are re-mapped from its rank origin to ours.
 */
public final class UciEngineAnalyzer implements PositionAnalyzer {
    private static final Logger LOG = Logger.getLogger(UciEngineAnalyzer.class.getName());

    private static final long UCI_INIT_TIMEOUT_MS = 12000L;
    private static final long READY_TIMEOUT_MS = 10000L;
    private static final long STOP_GRACE_MS = 1500L;
    private static final long BESTMOVE_MARGIN_MS = 2000L;
    public static final int DEFAULT_DEPTH = 18;
    public static final long DEFAULT_BESTMOVE_TIMEOUT_MS = 16000L;

    private final List<String> command;
    private final String commandText;
    private final int threads;
    private final int hashMb;
    private final long bestMoveTimeoutMs;
    private Process process;
    private BufferedWriter writer;
    private BufferedReader reader;
    private boolean protocolReady;

    public UciEngineAnalyzer(List<String> command) {
        this(command, 1, 64, DEFAULT_BESTMOVE_TIMEOUT_MS);
    }

    public UciEngineAnalyzer(List<String> command, int threads, int hashMb, long bestMoveTimeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("uci engine command is empty");
        }
        this.command = new ArrayList<>(command);
        this.commandText = String.join(" ", this.command);
        this.threads = Math.max(1, Math.min(threads, 8));
        this.hashMb = Math.max(16, Math.min(hashMb, 512));
        this.bestMoveTimeoutMs = Math.max(200L, bestMoveTimeoutMs);
    }

    @Override
    public synchronized SearchResult analyze(String fen, AnalysisLimits limits) {
        AnalysisLimits l = limits == null ? AnalysisLimits.defaults() : limits;
        long start = System.currentTimeMillis();
        try {
            ensureProcess();
            sendLine("ucinewgame");
            waitReady();
            sendLine("position fen " + FenCodec.normalize(fen));
            sendLine(buildGoCommand(l));
            long timeout = l.hasMoveTime() ? l.getMoveTimeMs() + BESTMOVE_MARGIN_MS : bestMoveTimeoutMs;
            return collectResult(timeout, start);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "uci engine failed (" + commandText + "): " + e.getMessage());
            closeProcess();
            return SearchResult.failed(getEngineId(), System.currentTimeMillis() - start);
        }
    }

    @Override
    public String getEngineId() {
        return "uci";
    }

    @Override
    public String getEngineText() {
        return "UCI(" + commandText + ")";
    }

    @Override
    public synchronized void close() {
        closeProcess();
    }

    static String buildGoCommand(AnalysisLimits limits) {
        StringBuilder sb = new StringBuilder("go");
        if (limits.hasDepth()) {
            sb.append(" depth ").append(limits.getDepth());
        }
        if (limits.hasMoveTime()) {
            sb.append(" movetime ").append(limits.getMoveTimeMs());
        }
        if (!limits.hasDepth() && !limits.hasMoveTime()) {
            sb.append(" depth ").append(DEFAULT_DEPTH);
        }
        return sb.toString();
    }

    /**
     * Builds a result from the last scored {@code info} line and the {@code bestmove} line.
     */
    static SearchResult toResult(UciOutputParser.Info info, UciOutputParser.BestMove best, String engineId, long elapsedMs) {
        if (best == null || best.isNone()) {
            return SearchResult.none(engineId, elapsedMs);
        }
        Move bestMove = MoveNotation.fromUci(best.getMove());
        if (bestMove == null) {
            LOG.warning("unrecognised bestmove: " + best.getMove());
            return SearchResult.failed(engineId, elapsedMs);
        }
        Move ponder = MoveNotation.fromUci(best.getPonder());
        if (info == null) {
            List<Move> pv = new ArrayList<>();
            pv.add(bestMove);
            return new SearchResult(bestMove, ponder, 0, ScoreType.CP, 0, 0, 0L, elapsedMs, pv, engineId);
        }

        List<Move> pv = new ArrayList<>();
        for (String token : info.getPv()) {
            Move m = MoveNotation.fromUci(token);
            if (m == null) {
                break;
            }
            pv.add(m);
        }
        if (pv.isEmpty() || !pv.get(0).equals(bestMove)) {
            pv.clear();
            pv.add(bestMove);
        }

        long time = info.getTimeMs() > 0 ? info.getTimeMs() : elapsedMs;
        if (info.getScoreType() == ScoreType.MATE) {
            int mateIn = info.getScore();
            int score = mateIn > 0 ? AlphaBetaSearch.MATE_SCORE : -AlphaBetaSearch.MATE_SCORE;
            return new SearchResult(bestMove, ponder, score, ScoreType.MATE, mateIn, info.getDepth(), info.getNodes(), time, pv, engineId);
        }
        return new SearchResult(bestMove, ponder, info.getScore(), ScoreType.CP, 0, info.getDepth(), info.getNodes(), time, pv, engineId);
    }

    private SearchResult collectResult(long timeoutMs, long start) throws IOException {
        UciOutputParser.Info lastInfo = null;
        long deadline = System.currentTimeMillis() + timeoutMs;
        boolean stopSent = false;
        while (true) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                if (stopSent) {
                    throw new IOException("uci timeout waiting bestmove");
                }
                // 超时先要求引擎立即给出当前最佳
                sendLine("stop");
                stopSent = true;
                deadline = System.currentTimeMillis() + STOP_GRACE_MS;
                continue;
            }
            String line = tryReadLine(remaining);
            if (line == null) {
                continue;
            }
            UciOutputParser.BestMove best = UciOutputParser.parseBestMove(line);
            if (best != null) {
                return toResult(lastInfo, best, getEngineId(), System.currentTimeMillis() - start);
            }
            UciOutputParser.Info info = UciOutputParser.parseInfo(line);
            if (info != null && info.hasScore() && !info.isBound() && info.getMultiPv() == 1) {
                lastInfo = info;
            }
        }
    }

    private void ensureProcess() throws IOException {
        if (process != null && process.isAlive() && protocolReady) {
            return;
        }
        closeProcess();
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        process = pb.start();
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        protocolReady = false;

        sendLine("uci");
        waitForToken("uciok", UCI_INIT_TIMEOUT_MS);
        // 不认识该选项的引擎会忽略它
        sendLine("setoption name UCI_Variant value xiangqi");
        sendLine("setoption name Threads value " + threads);
        sendLine("setoption name Hash value " + hashMb);
        waitReady();
        protocolReady = true;
        LOG.info("uci engine started: " + commandText);
    }

    private void waitReady() throws IOException {
        sendLine("isready");
        waitForToken("readyok", READY_TIMEOUT_MS);
    }

    private void waitForToken(String token, long timeoutMs) throws IOException {
        long deadline = System.currentTimeMillis() + Math.max(200L, timeoutMs);
        String needle = token.toLowerCase(Locale.ROOT);
        while (System.currentTimeMillis() < deadline) {
            String line = tryReadLine(deadline - System.currentTimeMillis());
            if (line == null) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains(needle)) {
                return;
            }
        }
        throw new IOException("uci timeout waiting token: " + token);
    }

    private String tryReadLine(long remainingMs) throws IOException {
        if (remainingMs <= 0) {
            return null;
        }
        long end = System.currentTimeMillis() + remainingMs;
        while (System.currentTimeMillis() < end) {
            if (reader.ready()) {
                String line = reader.readLine();
                if (line == null) {
                    throw new IOException("uci engine closed its output");
                }
                LOG.finer(() -> "<<< " + line);
                return line;
            }
            if (process == null || !process.isAlive()) {
                throw new IOException("uci engine exited");
            }
            sleepQuietly(6L);
        }
        return null;
    }

    private void sendLine(String text) throws IOException {
        if (writer == null) {
            throw new IOException("uci engine not running");
        }
        LOG.finer(() -> ">>> " + text);
        writer.write(text);
        writer.newLine();
        writer.flush();
    }

    private void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeProcess() {
        if (writer != null) {
            try {
                writer.write("quit");
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                LOG.log(Level.FINE, "quit not delivered", e);
            }
        }
        if (process != null) {
            process.destroy();
            try {
                if (!process.waitFor(250, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
        process = null;
        writer = null;
        reader = null;
        protocolReady = false;
    }
}

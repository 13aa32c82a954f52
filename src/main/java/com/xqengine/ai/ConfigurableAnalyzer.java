package com.xqengine.ai;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Picks the built-in search or an external UCI engine from configuration and falls back
 * to the built-in search for good when the external engine fails.
 * <p>
 * Settings are read from a system property first, then the environment:
 * <ul>
 *     <li>{@code xq.engine} / {@code XQ_ENGINE}: BUILTIN (default), UCI (alias PIKAFISH) or AUTO</li>
 *     <li>{@code xq.uci.cmd} / {@code XQ_UCI_CMD}: engine command line, quotes allowed</li>
 *     <li>{@code xq.uci.threads}, {@code xq.uci.hash}, {@code xq.uci.timeout.ms}</li>
 * </ul>
 */
public final class ConfigurableAnalyzer implements PositionAnalyzer {
    private static final Logger LOG = Logger.getLogger(ConfigurableAnalyzer.class.getName());

    public static final String PREF_BUILTIN = "BUILTIN";
    public static final String PREF_UCI = "UCI";
    public static final String PREF_AUTO = "AUTO";

    private final BuiltinAnalyzer builtin = new BuiltinAnalyzer();
    private final List<String> uciCmd;
    private final int uciThreads;
    private final int uciHashMb;
    private final long uciTimeoutMs;
    private String preferredEngine;
    private PositionAnalyzer selected;
    private String selectedText;

    public ConfigurableAnalyzer() {
        this(readSetting("xq.engine", "XQ_ENGINE", PREF_BUILTIN),
            splitCommand(readSetting("xq.uci.cmd", "XQ_UCI_CMD", "").trim()),
            readIntSetting("xq.uci.threads", "XQ_UCI_THREADS", 1),
            readIntSetting("xq.uci.hash", "XQ_UCI_HASH", 64),
            readIntSetting("xq.uci.timeout.ms", "XQ_UCI_TIMEOUT_MS", (int) UciEngineAnalyzer.DEFAULT_BESTMOVE_TIMEOUT_MS));
    }

    public ConfigurableAnalyzer(String preference, List<String> uciCommand) {
        this(preference, uciCommand, 1, 64, (int) UciEngineAnalyzer.DEFAULT_BESTMOVE_TIMEOUT_MS);
    }

    private ConfigurableAnalyzer(String preference, List<String> uciCommand, int threads, int hashMb, int timeoutMs) {
        this.uciCmd = uciCommand == null ? new ArrayList<String>() : new ArrayList<>(uciCommand);
        this.uciThreads = threads;
        this.uciHashMb = hashMb;
        this.uciTimeoutMs = timeoutMs;
        this.preferredEngine = normalizePreference(preference);
        selectEngineForPreference(preferredEngine);
    }

    @Override
    public synchronized SearchResult analyze(String fen, AnalysisLimits limits) {
        if (selected == null) {
            selectEngineForPreference(preferredEngine);
        }
        if (selected != builtin) {
            SearchResult result = selected.analyze(fen, limits);
            if (result != null && result.hasBestMove()) {
                return result;
            }
            if (result != null && !result.isEngineFailure()) {
                // 外部引擎判定无着：引擎仍可用，本次由内置搜索给出终局分数
                return builtin.analyze(fen, limits);
            }
            LOG.warning("external engine failed, falling back to builtin: " + selected.getEngineText());
            selected.close();
            selected = builtin;
            selectedText = builtin.getEngineText() + "（外部引擎异常已回退）";
        }
        return builtin.analyze(fen, limits);
    }

    @Override
    public synchronized String getEngineId() {
        return selected == null ? builtin.getEngineId() : selected.getEngineId();
    }

    @Override
    public synchronized String getEngineText() {
        return selectedText == null ? builtin.getEngineText() : selectedText;
    }

    public synchronized String getPreferredEngine() {
        return preferredEngine;
    }

    public synchronized void setPreferredEngine(String preference) {
        String normalized = normalizePreference(preference);
        if (normalized.equals(preferredEngine) && selected != null) {
            return;
        }
        preferredEngine = normalized;
        selectEngineForPreference(preferredEngine);
    }

    public boolean isUciConfigured() {
        return !uciCmd.isEmpty();
    }

    @Override
    public synchronized void close() {
        if (selected != null && selected != builtin) {
            selected.close();
        }
    }

    private void selectEngineForPreference(String preference) {
        if (selected != null && selected != builtin) {
            selected.close();
        }
        PositionAnalyzer next = chooseEngine(preference);
        if (next == null) {
            next = builtin;
        }
        selected = next;
        selectedText = next.getEngineText();
    }

    private PositionAnalyzer chooseEngine(String preference) {
        if (PREF_UCI.equals(preference)) {
            PositionAnalyzer uci = createUci();
            if (uci == null) {
                LOG.warning("xq.engine=UCI but no xq.uci.cmd configured, using builtin");
            }
            return uci;
        }
        if (PREF_AUTO.equals(preference)) {
            return createUci();
        }
        return builtin;
    }

    private PositionAnalyzer createUci() {
        if (uciCmd.isEmpty()) {
            return null;
        }
        return new UciEngineAnalyzer(uciCmd, uciThreads, uciHashMb, uciTimeoutMs);
    }

    static String normalizePreference(String prefRaw) {
        String p = prefRaw == null ? "" : prefRaw.trim().toUpperCase(Locale.ROOT);
        if (PREF_UCI.equals(p) || "PIKAFISH".equals(p)) {
            return PREF_UCI;
        }
        if (PREF_AUTO.equals(p)) {
            return PREF_AUTO;
        }
        return PREF_BUILTIN;
    }

    static String readSetting(String prop, String env, String defaultValue) {
        String v = System.getProperty(prop);
        if (v == null || v.trim().isEmpty()) {
            v = System.getenv(env);
        }
        if (v == null || v.trim().isEmpty()) {
            return defaultValue;
        }
        return v;
    }

    static int readIntSetting(String prop, String env, int defaultValue) {
        String v = readSetting(prop, env, null);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            LOG.warning("ignoring non-numeric " + prop + "=" + v);
            return defaultValue;
        }
    }

    static List<String> splitCommand(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        StringBuilder cur = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == '\'' && !inDouble) {
                inSingle = !inSingle;
                continue;
            }
            if (ch == '"' && !inSingle) {
                inDouble = !inDouble;
                continue;
            }
            if (Character.isWhitespace(ch) && !inSingle && !inDouble) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
                continue;
            }
            cur.append(ch);
        }
        if (cur.length() > 0) {
            out.add(cur.toString());
        }
        return out;
    }
}

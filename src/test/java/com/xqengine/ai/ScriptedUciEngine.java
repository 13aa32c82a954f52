package com.xqengine.ai;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * 测试用的脚本化 UCI 引擎，作为子进程运行。
 * <ul>
 *     <li>{@code normal}: 每次 go 立即回答 h2e2，主变分数为 34 + 第几次 go</li>
 *     <li>{@code none}: 每次 go 回答 {@code bestmove (none)}</li>
 *     <li>{@code stall}: 收到 stop 之前不回答</li>
 * </ul>
 */
final class ScriptedUciEngine {

    private ScriptedUciEngine() {
    }

    static List<String> command(String mode) {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        return Arrays.asList(java, "-cp", System.getProperty("java.class.path"),
            ScriptedUciEngine.class.getName(), mode);
    }

    public static void main(String[] args) throws IOException {
        String mode = args.length > 0 ? args[0] : "normal";
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        int goCount = 0;
        boolean searching = false;
        String line;
        while ((line = in.readLine()) != null) {
            String cmd = line.trim();
            if ("uci".equals(cmd)) {
                out.println("id name scripted");
                out.println("uciok");
            } else if ("isready".equals(cmd)) {
                out.println("readyok");
            } else if (cmd.startsWith("go")) {
                goCount++;
                if ("none".equals(mode)) {
                    out.println("info depth 0 score mate 0");
                    out.println("bestmove (none)");
                } else if ("stall".equals(mode)) {
                    searching = true;
                } else {
                    out.println("info string scripted search");
                    out.println("info depth 1 score cp 10 pv b0c2");
                    out.println("info depth 5 multipv 1 score cp " + (34 + goCount) + " nodes 4096 time 7 pv h2e2 h9g7");
                    out.println("info depth 5 multipv 2 score cp 5 pv b0c2");
                    out.println("info depth 6 multipv 1 score cp 900 lowerbound pv h2e2");
                    out.println("bestmove h2e2 ponder h9g7");
                }
            } else if ("stop".equals(cmd) && searching) {
                searching = false;
                out.println("info depth 3 score cp -20 pv b0c2");
                out.println("bestmove b0c2");
            } else if ("quit".equals(cmd)) {
                return;
            }
        }
    }
}

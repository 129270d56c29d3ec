package org.smtbridge.sexpr;

import java.util.ArrayList;
import java.util.List;

/**
 * 求解器常把一个 S 表达式打印成多行，这里把它们按括号配平重新拼成一行一个。
 */
public final class SExprLines {

    private SExprLines() {
    }

    /**
     * 合并多行 S 表达式。括号配平的行原样保留；字符串、|...| 符号和注释中的括号不计数。
     * @param lines 求解器的原始输出行。
     * @return 每个元素是一个完整的顶层 S 表达式 (或一行不含括号的文本)。
     */
    public static List<String> merge(List<String> lines) {
        List<String> result = new ArrayList<>();
        StringBuilder pending = null;
        ScanState state = new ScanState();
        for (String line : lines) {
            state.scan(line);
            if (pending == null) {
                if (state.depth <= 0) {
                    result.add(line);
                    state.reset();
                } else {
                    pending = new StringBuilder(line);
                }
            } else {
                pending.append(' ').append(line.trim());
                if (state.depth <= 0) {
                    result.add(pending.toString());
                    pending = null;
                    state.reset();
                }
            }
        }
        if (pending != null) {
            // 输出被截断：保留原样，交给解析器报错
            result.add(pending.toString());
        }
        return result;
    }

    private static final class ScanState {
        private int depth = 0;
        private boolean inString = false;
        private boolean inQuotedSymbol = false;

        void reset() {
            depth = 0;
            inString = false;
            inQuotedSymbol = false;
        }

        void scan(String line) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inString) {
                    if (c == '"') {
                        inString = false;
                    }
                } else if (inQuotedSymbol) {
                    if (c == '|') {
                        inQuotedSymbol = false;
                    }
                } else if (c == '"') {
                    inString = true;
                } else if (c == '|') {
                    inQuotedSymbol = true;
                } else if (c == ';') {
                    return;
                } else if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                }
            }
        }
    }
}

package com.csentinel.cli.preprocess;

import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;

/**
 * Removes {@code //} and {@code /* *\/} comments from C source while keeping
 * every newline, so token lines still match the original file. String and char
 * literals are copied verbatim, escapes included. Directives are left as they
 * are; nothing is expanded. Trailing whitespace is trimmed from each line.
 */
public class CommentStripper {

    private enum State { CODE, LINE_COMMENT, BLOCK_COMMENT, STRING, CHAR }

    private final Diagnostics diagnostics;

    public CommentStripper(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public String strip(String code) {
        StringBuilder out = new StringBuilder(code.length());
        State state = State.CODE;
        boolean escape = false;
        int i = 0;

        while (i < code.length()) {
            char ch = code.charAt(i);
            switch (state) {
                case LINE_COMMENT -> {
                    if (ch == '\n') {
                        out.append('\n');
                        state = State.CODE;
                    }
                    i++;
                }
                case BLOCK_COMMENT -> {
                    if (ch == '\n') {
                        out.append('\n');
                        i++;
                    } else if (code.startsWith("*/", i)) {
                        state = State.CODE;
                        i += 2;
                    } else {
                        i++;
                    }
                }
                case STRING, CHAR -> {
                    out.append(ch);
                    char quote = state == State.STRING ? '"' : '\'';
                    if (escape) {
                        escape = false;
                    } else if (ch == '\\') {
                        escape = true;
                    } else if (ch == quote) {
                        state = State.CODE;
                    }
                    i++;
                }
                default -> {
                    if (code.startsWith("//", i)) {
                        state = State.LINE_COMMENT;
                        i += 2;
                    } else if (code.startsWith("/*", i)) {
                        state = State.BLOCK_COMMENT;
                        i += 2;
                    } else {
                        if (ch == '"') state = State.STRING;
                        else if (ch == '\'') state = State.CHAR;
                        out.append(ch);
                        i++;
                    }
                }
            }
        }

        switch (state) {
            case BLOCK_COMMENT -> diagnostics.warn(Phase.PREPROCESS, "Unclosed multi-line comment at EOF");
            case STRING -> diagnostics.warn(Phase.PREPROCESS, "Unclosed string literal at EOF");
            case CHAR -> diagnostics.warn(Phase.PREPROCESS, "Unclosed char literal at EOF");
            default -> { }
        }

        String cleaned = trimLines(out.toString());
        diagnostics.info(Phase.PREPROCESS, "original=" + code.length() + " cleaned=" + cleaned.length());
        return cleaned;
    }

    private static String trimLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) result.append('\n');
            result.append(lines[i].stripTrailing());
        }
        return result.toString();
    }
}

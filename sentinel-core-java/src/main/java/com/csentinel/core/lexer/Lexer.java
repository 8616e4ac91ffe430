package com.csentinel.core.lexer;

import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans cleaned C source into an ordered token list.
 *
 * Rules are tried in a fixed priority order at every position (maximal munch
 * within each rule): preprocessor lines, string and char literals, floating
 * literals, hex/binary/octal/decimal integers, identifiers and keywords, then
 * operators longest first. A character no rule accepts becomes a one-character
 * ERROR token and scanning moves on.
 */
public class Lexer {

    private static final Pattern FLOAT = Pattern.compile(
        "(?:(?:\\d+\\.\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?|\\d+[eE][+-]?\\d+)[fFlL]?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+[uUlL]*");
    private static final Pattern BIN = Pattern.compile("0[bB][01]+[uUlL]*");
    private static final Pattern OCT = Pattern.compile("0[0-7]+[uUlL]*");
    private static final Pattern DEC = Pattern.compile("\\d+[uUlL]*");
    private static final Pattern[] INTEGERS = { HEX, BIN, OCT, DEC };

    private final Diagnostics diagnostics;

    // Per-run scanner state, reset by tokenize()
    private String source;
    private int pos;
    private int line;
    private int lineStart;
    private List<Token> tokens;

    public Lexer(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public static class SourceReadException extends RuntimeException {
        public SourceReadException(String msg) { super(msg); }
        public SourceReadException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Reads a file and tokenizes its content. Convenience for tests and tools;
     * the pipeline itself hands over an in-memory string.
     *
     * @throws SourceReadException if the file is missing or unreadable
     */
    public List<Token> tokenizeFile(Path path) {
        return tokenize(readSource(path, diagnostics));
    }

    public static String readSource(Path path) {
        return readSource(path, Diagnostics.silent());
    }

    /**
     * Reads a source file as UTF-8. Bytes that are not valid UTF-8 (a Latin-1
     * comment, say) become U+FFFD and a LEXER warning is logged.
     *
     * @throws SourceReadException if the file is missing or unreadable
     */
    public static String readSource(Path path, Diagnostics diagnostics) {
        if (!Files.isRegularFile(path)) {
            throw new SourceReadException("Source file not found: " + path);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SourceReadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            diagnostics.warn(Phase.LEXER, path + " is not valid UTF-8, undecodable bytes replaced with U+FFFD");
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    public List<Token> tokenize(String cleanedSource) {
        source = cleanedSource != null ? cleanedSource : "";
        pos = 0;
        line = 1;
        lineStart = 0;
        tokens = new ArrayList<>();

        diagnostics.info(Phase.LEXER, "tokenize started, " + source.length() + " chars");
        while (pos < source.length()) {
            scanNext();
        }
        diagnostics.info(Phase.LEXER, "tokenize finished, tokens = " + tokens.size());
        return tokens;
    }

    private void scanNext() {
        char c = source.charAt(pos);

        if (c == '\n') {
            pos++;
            line++;
            lineStart = pos;
            return;
        }
        if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == 0x0B) {
            pos++;
            return;
        }
        if (c == '/' && peek(1) == '/') {
            skipLineComment();
            return;
        }
        if (c == '/' && peek(1) == '*') {
            skipBlockComment();
            return;
        }
        if (c == '#') {
            emit(TokenType.PP_DIRECTIVE, endOfLine(pos));
            return;
        }
        if (c == '"') {
            scanQuoted('"', TokenType.STRING_LITERAL, "string");
            return;
        }
        if (c == '\'') {
            scanQuoted('\'', TokenType.CHAR_CONST, "char");
            return;
        }
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            if (scanNumber()) return;
        }
        if (c == '_' || Character.isLetter(c)) {
            int end = pos + 1;
            while (end < source.length() && isIdentifierPart(source.charAt(end))) end++;
            String word = source.substring(pos, end);
            emit(TokenType.keywordOrIdentifier(word), end);
            return;
        }
        for (TokenType op : TokenType.operatorsLongestFirst()) {
            if (source.startsWith(op.spelling(), pos)) {
                emit(op, pos + op.spelling().length());
                return;
            }
        }

        diagnostics.warn(Phase.LEXER, "Illegal character " + describe(c)
                + " at line " + line + " col " + column(pos));
        emit(TokenType.ERROR, pos + 1);
    }

    private boolean scanNumber() {
        Matcher floating = FLOAT.matcher(source).region(pos, source.length());
        if (floating.lookingAt()) {
            emit(TokenType.FLOAT_CONST, floating.end());
            return true;
        }
        for (Pattern integer : INTEGERS) {
            Matcher m = integer.matcher(source).region(pos, source.length());
            if (m.lookingAt()) {
                emit(TokenType.INT_CONST, m.end());
                return true;
            }
        }
        return false;
    }

    /**
     * Scans a quoted literal honouring backslash escapes. A literal that reaches
     * the end of its line without closing is emitted up to there and reported.
     */
    private void scanQuoted(char quote, TokenType type, String what) {
        int end = pos + 1;
        while (end < source.length()) {
            char ch = source.charAt(end);
            if (ch == '\\' && end + 1 < source.length() && source.charAt(end + 1) != '\n') {
                end += 2;
                continue;
            }
            if (ch == quote) {
                emit(type, end + 1);
                return;
            }
            if (ch == '\n') break;
            end++;
        }
        diagnostics.warn(Phase.LEXER, "Unterminated " + what + " literal at line " + line
                + " col " + column(pos));
        emit(type, end);
    }

    private void skipLineComment() {
        pos = endOfLine(pos);
    }

    private void skipBlockComment() {
        int close = source.indexOf("*/", pos + 2);
        int end = close < 0 ? source.length() : close + 2;
        if (close < 0) {
            diagnostics.warn(Phase.LEXER, "Unterminated block comment at line " + line);
        }
        for (int i = pos; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        pos = end;
    }

    private void emit(TokenType type, int end) {
        String value = source.substring(pos, end);
        int startLine = line;
        int startColumn = column(pos);
        int endLine = startLine;
        int endColumn = startColumn + value.length();
        int lastNewline = value.lastIndexOf('\n');
        if (lastNewline >= 0) {
            endLine += (int) value.chars().filter(ch -> ch == '\n').count();
            endColumn = value.length() - lastNewline;
        }
        tokens.add(new Token(type, value, startLine, startColumn, endLine, endColumn));
        pos = end;
    }

    private int column(int offset) {
        return offset - lineStart + 1;
    }

    private int endOfLine(int from) {
        int nl = source.indexOf('\n', from);
        return nl < 0 ? source.length() : nl;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static String describe(char c) {
        return Character.isISOControl(c) ? String.format("'\\u%04x'", (int) c) : "'" + c + "'";
    }
}

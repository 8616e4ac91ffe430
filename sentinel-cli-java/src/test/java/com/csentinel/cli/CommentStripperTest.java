package com.csentinel.cli;

import com.csentinel.cli.preprocess.CommentStripper;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommentStripperTest {

    private final Diagnostics diagnostics = Diagnostics.silent();
    private final CommentStripper stripper = new CommentStripper(diagnostics);

    private static long lineCount(String text) {
        return text.chars().filter(c -> c == '\n').count();
    }

    @Test
    void lineCommentRemoved() {
        assertEquals("int x;\nint y;", stripper.strip("int x; // note\nint y;"));
    }

    @Test
    void blockCommentKeepsNewlines() {
        String source = "a;\n/* one\ntwo\nthree */ b;\n";
        String cleaned = stripper.strip(source);
        assertEquals(lineCount(source), lineCount(cleaned));
        assertEquals("a;\n\n\n b;\n", cleaned);
    }

    @Test
    void commentMarkersInsideLiteralsAreKept() {
        String source = "s = \"// not a comment /* nor this */\"; c = '/';";
        assertEquals(source, stripper.strip(source));
    }

    @Test
    void escapedQuoteDoesNotEndString() {
        String source = "s = \"a\\\"b // still string\";";
        assertEquals(source, stripper.strip(source));
    }

    @Test
    void directivesAreLeftAlone() {
        String source = "#include <stdio.h>\n#define MAX 5\n";
        assertEquals(source, stripper.strip(source));
    }

    @Test
    void trailingWhitespaceTrimmed() {
        assertEquals("x = 1;\ny = 2;", stripper.strip("x = 1;   \ny = 2;\t"));
    }

    @Test
    void unclosedBlockCommentWarns() {
        String cleaned = stripper.strip("int a;\n/* never closed\nint b;");
        assertEquals("int a;\n\n", cleaned);
        assertEquals(1, diagnostics.entries(Phase.PREPROCESS).size());
    }
}

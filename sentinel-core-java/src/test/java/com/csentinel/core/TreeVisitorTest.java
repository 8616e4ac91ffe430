package com.csentinel.core;

import com.csentinel.core.ast.*;
import com.csentinel.core.diagnostics.Diagnostic;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.csentinel.core.parser.Parser;
import com.csentinel.core.visitor.TreeVisitor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeVisitorTest {

    private final Diagnostics diagnostics = Diagnostics.silent();

    private Program parse(String source) {
        return new Parser(SentinelConfig.defaults(), diagnostics).parse(source);
    }

    /** Records every identifier it reaches, optionally blowing up on one callee. */
    private static class RecordingVisitor extends TreeVisitor {
        final List<Identifier> identifiers = new ArrayList<>();
        final String failOnCall;

        RecordingVisitor(Diagnostics diagnostics, int maxDepth, String failOnCall) {
            super(diagnostics, maxDepth);
            this.failOnCall = failOnCall;
        }

        @Override
        protected void visitIdentifier(Identifier node) {
            identifiers.add(node);
            genericVisit(node);
        }

        @Override
        protected void visitCall(Call node) {
            if (node.calleeName() != null && node.calleeName().equals(failOnCall)) {
                throw new IllegalStateException("cannot handle " + failOnCall);
            }
            genericVisit(node);
        }
    }

    @Test
    void structurallyEqualNodesAreEachVisited() {
        Program program = parse("void f() { x; x; }");
        RecordingVisitor visitor = new RecordingVisitor(diagnostics, 256, null);
        visitor.visit(program);

        assertEquals(2, visitor.identifiers.size());
        assertNotSame(visitor.identifiers.get(0), visitor.identifiers.get(1));
    }

    @Test
    void sameNodeIsVisitedOnlyOnce() {
        Identifier x = new Identifier("x", new SourcePosition(1, 1));
        RecordingVisitor visitor = new RecordingVisitor(diagnostics, 256, null);
        visitor.visitAll(List.of(x, x));
        assertEquals(1, visitor.identifiers.size());
        assertTrue(visitor.wasVisited(x));
    }

    @Test
    void genericVisitAttachesParentLinks() {
        Program program = parse("int f() { return y; }");
        new RecordingVisitor(diagnostics, 256, null).visit(program);

        FunctionDef fn = program.functions().get(0);
        Return ret = (Return) fn.body().items().get(0);
        assertSame(ret, ret.expr().parent());
        assertSame(fn.body(), ret.parent());
        assertSame(fn, fn.body().parent());
        assertNull(program.parent());
    }

    @Test
    void parentLinkIsNotAField() {
        Program program = parse("int f() { return y; }");
        new RecordingVisitor(diagnostics, 256, null).visit(program);

        Return ret = (Return) program.functions().get(0).body().items().get(0);
        for (Node.Field field : ret.expr().fields()) {
            assertNotEquals("parent", field.name());
        }
        assertFalse(ret.expr().children().contains(ret));
    }

    @Test
    void failureOnOneNodeIsLoggedAndSiblingsContinue() {
        Program program = parse("void f() { boom(a); b; }");
        RecordingVisitor visitor = new RecordingVisitor(diagnostics, 256, "boom");
        visitor.visit(program);

        List<String> names = new ArrayList<>();
        for (Identifier id : visitor.identifiers) names.add(id.name());
        assertTrue(names.contains("b"), "Sibling after failing node should be visited: " + names);
        assertFalse(names.contains("a"), "Children of the failing node are skipped");

        List<Diagnostic> warnings = diagnostics.entries(Phase.ANALYSIS);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).message().startsWith("Call"), warnings.get(0).message());
    }

    @Test
    void depthLimitSkipsSubtreeWithError() {
        Program program = parse("void f() { if (a) { if (b) { if (c) { deep; } } } }");
        RecordingVisitor visitor = new RecordingVisitor(diagnostics, 4, null);
        visitor.visit(program);

        assertTrue(diagnostics.hasErrors());
        for (Identifier id : visitor.identifiers) {
            assertNotEquals("deep", id.name());
        }
    }
}

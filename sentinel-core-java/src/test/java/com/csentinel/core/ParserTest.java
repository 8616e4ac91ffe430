package com.csentinel.core;

import com.csentinel.core.ast.*;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.csentinel.core.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private final Diagnostics diagnostics = Diagnostics.silent();

    private Program parse(String source) {
        return new Parser(SentinelConfig.defaults(), diagnostics).parse(source);
    }

    /** Expression of the first statement in the body of the only function. */
    private Node firstExpression(String body) {
        Program program = parse("void f() {\n" + body + "\n}");
        Compound compound = program.functions().get(0).body();
        return ((ExprStmt) compound.items().get(0)).expr();
    }

    // --- Top level ---

    @Test
    void topLevelNodesKeepSourceOrder() {
        Program program = parse("#include <stdio.h>\nint g = 1;\nint main(void) { return g; }");
        List<Node> decls = program.declarations();
        assertEquals(3, decls.size());
        assertEquals(NodeKind.INCLUDE, decls.get(0).kind());
        assertEquals(NodeKind.DECLARATION, decls.get(1).kind());
        assertEquals(NodeKind.FUNCTION_DEF, decls.get(2).kind());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void functionSignature() {
        Program program = parse("static char *dup(const char *s, int n) { return 0; }");
        FunctionDef fn = program.functions().get(0);
        assertEquals("dup", fn.name());
        assertEquals("static char *", fn.returnType());
        assertEquals(2, fn.params().size());
        assertEquals("s", fn.params().get(0).name());
        assertTrue(fn.params().get(0).isPointer());
        assertFalse(fn.isPrototype());
    }

    @Test
    void implicitIntDefinition() {
        Program program = parse("main(void) { return 0; }");
        assertEquals(1, program.functions().size());
        FunctionDef fn = program.functions().get(0);
        assertEquals("main", fn.name());
        assertEquals("int", fn.returnType());
        assertEquals(NodeKind.RETURN, fn.body().items().get(0).kind());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void variadicPrototype() {
        FunctionDef fn = parse("int log_line(const char *fmt, ...);").functions().get(0);
        assertTrue(fn.isPrototype());
        assertTrue(fn.isVariadic());
        assertEquals(1, fn.params().size());
    }

    // --- Expressions ---

    @Test
    void multiplicationBindsTighterThanAddition() {
        BinaryOp assign = (BinaryOp) firstExpression("x = a + b * c;");
        assertEquals("=", assign.op());
        BinaryOp sum = (BinaryOp) assign.right();
        assertEquals("+", sum.op());
        assertEquals("*", ((BinaryOp) sum.right()).op());
    }

    @Test
    void assignmentIsRightAssociative() {
        BinaryOp outer = (BinaryOp) firstExpression("a = b = c;");
        assertEquals(NodeKind.IDENTIFIER, outer.left().kind());
        assertEquals("=", ((BinaryOp) outer.right()).op());
    }

    @Test
    void prefixMinusIsUnaryNotBinary() {
        BinaryOp diff = (BinaryOp) ((BinaryOp) firstExpression("x = -a - b;")).right();
        assertEquals("-", diff.op());
        UnaryOp neg = (UnaryOp) diff.left();
        assertEquals("-", neg.op());
    }

    @Test
    void logicalOperatorsLayerCorrectly() {
        BinaryOp or = (BinaryOp) firstExpression("a || b && c == d;");
        assertEquals("||", or.op());
        BinaryOp and = (BinaryOp) or.right();
        assertEquals("&&", and.op());
        assertEquals("==", ((BinaryOp) and.right()).op());
    }

    @Test
    void parenthesizedTypeFollowedByOperandIsCast() {
        BinaryOp assign = (BinaryOp) firstExpression("p = (char *)malloc(10);");
        Cast cast = (Cast) assign.right();
        assertEquals("char *", cast.toType());
        assertEquals("malloc", ((Call) cast.expr()).calleeName());
    }

    @Test
    void parenthesizedExpressionIsNotCast() {
        BinaryOp assign = (BinaryOp) firstExpression("y = (x) + 1;");
        assertEquals("+", ((BinaryOp) assign.right()).op());
    }

    @Test
    void sizeofTypeAndSizeofExpression() {
        UnaryOp ofType = (UnaryOp) ((BinaryOp) firstExpression("n = sizeof(int);")).right();
        assertEquals(UnaryOp.SIZEOF, ofType.op());
        assertEquals("int", ((TypeName) ofType.operand()).text());

        UnaryOp ofExpr = (UnaryOp) ((BinaryOp) firstExpression("n = sizeof buf;")).right();
        assertEquals(NodeKind.IDENTIFIER, ofExpr.operand().kind());
    }

    @Test
    void postfixChain() {
        ArrayRef ref = (ArrayRef) ((BinaryOp) firstExpression("v = s.a->b[2];")).right();
        PointerMemberAccess arrow = (PointerMemberAccess) ref.base();
        assertEquals("b", arrow.member().name());
        MemberAccess dot = (MemberAccess) arrow.base();
        assertEquals("a", dot.member().name());
        assertEquals("s", ((Identifier) dot.base()).name());
    }

    @Test
    void postIncrementAndTernary() {
        TernaryOp ternary = (TernaryOp) ((BinaryOp) firstExpression("r = i++ ? x : y;")).right();
        UnaryOp inc = (UnaryOp) ternary.condition();
        assertEquals(UnaryOp.POSTINC, inc.op());
    }

    @Test
    void operatorNodesRecordOperatorPosition() {
        BinaryOp assign = (BinaryOp) firstExpression("  x = a + b;");
        assertEquals(2, assign.position().line());
        assertEquals(5, assign.position().column());
        BinaryOp sum = (BinaryOp) assign.right();
        assertEquals(9, sum.position().column());
    }

    @Test
    void adjacentStringLiteralsConcatenate() {
        Call call = (Call) firstExpression("puts(\"a\" \"b\");");
        Constant text = (Constant) call.args().get(0);
        assertEquals("string", text.ctype());
        assertEquals("\"a\" \"b\"", text.value());
    }

    // --- Declarations ---

    @Test
    void pointerLevelsAndArrays() {
        Program program = parse("void f() { char **argv; int a[10], b[], c[N][2]; }");
        List<Node> items = program.functions().get(0).body().items();

        VarDeclarator argv = ((Declaration) items.get(0)).declarators().get(0);
        assertEquals(2, argv.pointer().level());

        List<VarDeclarator> arrays = ((Declaration) items.get(1)).declarators();
        assertEquals(3, arrays.size());
        assertEquals("10", ((Constant) arrays.get(0).dimensions().get(0).size()).value());
        assertNull(arrays.get(1).dimensions().get(0).size());
        assertEquals(2, arrays.get(2).dimensions().size());
        assertEquals("N", ((Identifier) arrays.get(2).dimensions().get(0).size()).name());
    }

    @Test
    void braceInitializer() {
        Program program = parse("int primes[] = {2, 3, 5};");
        VarDeclarator d = ((Declaration) program.declarations().get(0)).declarators().get(0);
        assertEquals(3, ((InitList) d.initializer()).items().size());
    }

    @Test
    void namedStructWithForwardReference() {
        Program program = parse("struct node { int v; struct node *next; };");
        Declaration decl = (Declaration) program.declarations().get(0);
        StructSpecifier spec = decl.struct();
        assertEquals("node", spec.name());
        assertEquals(2, spec.members().size());
        StructSpecifier nextType = spec.members().get(1).struct();
        assertTrue(nextType.isForwardReference());
        assertTrue(decl.declarators().isEmpty());
    }

    @Test
    void anonymousStructTypedefRegistersTypeName() {
        Program program = parse("typedef struct { int x; } Point;\nPoint origin;\nvoid f() { Point *p = 0; }");
        Declaration typedef = (Declaration) program.declarations().get(0);
        assertTrue(typedef.isTypedef());
        assertTrue(typedef.struct().isAnonymous());

        Declaration origin = (Declaration) program.declarations().get(1);
        assertEquals("Point", origin.declType());

        Node local = program.functions().get(0).body().items().get(0);
        assertEquals(NodeKind.DECLARATION, local.kind());
    }

    @Test
    void configuredTypedefNamesActAsTypes() {
        SentinelConfig config = new SentinelConfig(256, Set.of("handle_t"), false);
        Program program = new Parser(config, diagnostics).parse("void f() { x = (handle_t)y; }");
        ExprStmt stmt = (ExprStmt) program.functions().get(0).body().items().get(0);
        assertEquals(NodeKind.CAST, ((BinaryOp) stmt.expr()).right().kind());
    }

    // --- Statements ---

    @Test
    void controlStatements() {
        Program program = parse(
            "int f(int n) {\n" +
            "  if (n) n = 1; else n = 2;\n" +
            "  while (n) n--;\n" +
            "  do { n++; } while (n < 3);\n" +
            "  for (int i = 0; i < n; i++) continue;\n" +
            "  switch (n) { case 1: break; default: n = 0; }\n" +
            "  return n;\n" +
            "}");
        List<Node> items = program.functions().get(0).body().items();
        assertEquals(List.of(NodeKind.IF_STMT, NodeKind.WHILE_STMT, NodeKind.DO_WHILE_STMT,
                        NodeKind.FOR_STMT, NodeKind.SWITCH_STMT, NodeKind.RETURN),
                items.stream().map(Node::kind).collect(Collectors.toList()));

        ForStmt loop = (ForStmt) items.get(3);
        assertEquals(NodeKind.DECLARATION, loop.init().kind());
        assertEquals(NodeKind.CONTINUE, loop.body().kind());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void excessiveNestingIsASyntaxErrorNotACrash() {
        SentinelConfig shallow = new SentinelConfig(8, Set.of(), false);
        Program program = new Parser(shallow, diagnostics)
                .parse("int f() { x = ((((((((((1)))))))))); }\nint g() { return 2; }");
        assertNotNull(program);
        assertFalse(diagnostics.entries(Phase.PARSER).isEmpty());
        assertEquals("g", program.functions().get(program.functions().size() - 1).name());
    }

    @Test
    void longPostfixChainCountsTowardsNesting() {
        Program program = parse("void f() { x = a" + "[0]".repeat(300) + "; }\nint g() { return 2; }");
        assertTrue(diagnostics.entries(Phase.PARSER).get(0).message().contains("nesting deeper than 256"));
        assertEquals(List.of("f", "g"),
                program.functions().stream().map(FunctionDef::name).collect(Collectors.toList()));
    }

    @Test
    void longTernaryChainCountsTowardsNesting() {
        Program program = parse("void f() { x = a" + " ? b : a".repeat(20_000) + "; }");
        assertNotNull(program.functions().get(0).body());
        assertTrue(diagnostics.entries(Phase.PARSER).get(0).message().contains("nesting deeper than 256"));
    }
}

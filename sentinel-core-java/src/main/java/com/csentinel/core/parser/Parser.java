package com.csentinel.core.parser;

import com.csentinel.core.SentinelConfig;
import com.csentinel.core.ast.*;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.csentinel.core.lexer.Lexer;
import com.csentinel.core.lexer.Token;
import com.csentinel.core.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.csentinel.core.lexer.TokenType.*;

/**
 * Recursive-descent parser for the supported C subset.
 *
 * Expression tiers, loosest first: comma, assignment and ternary (right
 * associative), then the binary tiers in {@link #BINARY_TIERS}, then
 * unary/cast, postfix and primary. Prefix + and - are handled in the unary
 * tier, so they never compete with the additive tier.
 *
 * Syntax errors are logged and exactly one token is discarded before parsing
 * resumes at the next statement or top-level declaration. A closing brace or
 * the end of input is left for the enclosing block instead. The resulting
 * tree may therefore lack statements or whole declarations.
 */
public class Parser {

    /** Binary operator tiers from loosest to tightest binding. All left associative. */
    private static final List<Set<TokenType>> BINARY_TIERS = List.of(
        EnumSet.of(OR),
        EnumSet.of(AND),
        EnumSet.of(BOR),
        EnumSet.of(BXOR),
        EnumSet.of(BAND),
        EnumSet.of(EQ, NEQ),
        EnumSet.of(LT, GT, LE, GE),
        EnumSet.of(LSHIFT, RSHIFT),
        EnumSet.of(PLUS, MINUS),
        EnumSet.of(TIMES, DIVIDE, MOD)
    );

    private static final Set<TokenType> ASSIGNMENT_OPS = EnumSet.of(
        ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, MUL_ASSIGN, DIV_ASSIGN, MOD_ASSIGN,
        LSHIFT_ASSIGN, RSHIFT_ASSIGN, AND_ASSIGN, OR_ASSIGN, XOR_ASSIGN);

    private static final Set<TokenType> PREFIX_OPS = EnumSet.of(PLUS, MINUS, NOT, BNOT, BAND, TIMES);

    private static final Set<TokenType> POSTFIX_OPS = EnumSet.of(LBRACKET, LPAREN, DOT, ARROW, INC, DEC);

    private static final Set<TokenType> BASE_TYPES = EnumSet.of(
        VOID, CHAR, SHORT, INT, LONG, FLOAT, DOUBLE, SIGNED, UNSIGNED, BOOL, COMPLEX, IMAGINARY);

    private static final Set<TokenType> QUALIFIERS = EnumSet.of(
        CONST, VOLATILE, RESTRICT, ATOMIC, STATIC, EXTERN, REGISTER, AUTO, INLINE, THREAD_LOCAL);

    /** Tokens after which {@code T *name} is read as a declaration of name. */
    private static final Set<TokenType> DECLARATOR_FOLLOW = EnumSet.of(
        SEMICOLON, ASSIGN, COMMA, LBRACKET, LPAREN, RPAREN);

    /** Library type names that never reach the parser as typedefs because includes are not expanded. */
    private static final Set<String> BUILTIN_TYPEDEFS = Set.of(
        "FILE", "size_t", "ssize_t", "ptrdiff_t", "intptr_t", "uintptr_t", "off_t", "pid_t",
        "time_t", "wchar_t", "bool", "va_list",
        "int8_t", "int16_t", "int32_t", "int64_t", "uint8_t", "uint16_t", "uint32_t", "uint64_t");

    private final SentinelConfig config;
    private final Diagnostics diagnostics;

    // Per-run state, reset by parse()
    private List<Token> tokens;
    private int pos;
    private int depth;
    private Set<String> typedefNames;

    public Parser(SentinelConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public static class ParseException extends RuntimeException {
        private final transient Token token;

        public ParseException(String msg, Token token) {
            super(msg);
            this.token = token;
        }

        public Token getToken() { return token; }
    }

    /** Tokenizes with a fresh lexer sharing this parser's diagnostics, then parses. */
    public Program parse(String cleanedSource) {
        return parse(new Lexer(diagnostics).tokenize(cleanedSource));
    }

    public Program parse(List<Token> input) {
        tokens = new ArrayList<>(input);
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        int eofLine = last != null ? last.endLine() : 1;
        int eofCol = last != null ? last.endColumn() : 1;
        tokens.add(new Token(EOF, "", eofLine, eofCol, eofLine, eofCol));
        pos = 0;
        depth = 0;
        typedefNames = new HashSet<>(BUILTIN_TYPEDEFS);
        typedefNames.addAll(config.typedefNames);

        diagnostics.info(Phase.PARSER, "parse started, tokens = " + input.size());
        List<Node> declarations = new ArrayList<>();
        while (!check(EOF)) {
            int start = pos;
            try {
                Node external = parseExternalDeclaration();
                if (external != null) declarations.add(external);
            } catch (ParseException e) {
                reportSyntaxError(e);
                recover(start, true);
            }
        }
        diagnostics.info(Phase.PARSER, "parse finished, top-level nodes = " + declarations.size());
        return new Program(declarations);
    }

    // -----------------------------------------------------------------------
    // Top level
    // -----------------------------------------------------------------------

    private Node parseExternalDeclaration() {
        if (check(PP_DIRECTIVE)) {
            Token t = next();
            return new Include(t.value(), SourcePosition.of(t));
        }
        if (accept(SEMICOLON)) {
            return null;
        }
        boolean typedef = accept(TYPEDEF);
        // implicit int: main(void) { ... }
        TypeSpec spec = !typedef && check(IDENTIFIER) && peek(1).is(LPAREN)
                ? new TypeSpec("int", null, SourcePosition.of(peek()))
                : parseTypeSpecifiers(true);
        if (!typedef && looksLikeFunctionDeclarator()) {
            return parseFunction(spec);
        }
        return parseDeclarationRest(spec, typedef);
    }

    private boolean looksLikeFunctionDeclarator() {
        int i = 0;
        while (peek(i).is(TIMES) || (i > 0 && QUALIFIERS.contains(peek(i).type()))) i++;
        return peek(i).is(IDENTIFIER) && peek(i + 1).is(LPAREN);
    }

    private FunctionDef parseFunction(TypeSpec spec) {
        int pointerLevel = parsePointerLevel();
        Token name = expect(IDENTIFIER, "function name");
        expect(LPAREN, "'('");

        List<VarDeclarator> params = new ArrayList<>();
        boolean variadic = false;
        if (check(VOID) && peek(1).is(RPAREN)) {
            next();
        } else if (!check(RPAREN)) {
            do {
                if (accept(ELLIPSIS)) {
                    variadic = true;
                    break;
                }
                TypeSpec paramType = parseTypeSpecifiers(true);
                params.add(parseDeclarator(paramType, true, false));
            } while (accept(COMMA));
        }
        expect(RPAREN, "')'");

        String returnType = withPointer(spec.text(), pointerLevel);
        if (accept(SEMICOLON)) {
            return new FunctionDef(returnType, name.value(), params, variadic, null, SourcePosition.of(name));
        }
        Compound body = parseCompound();
        return new FunctionDef(returnType, name.value(), params, variadic, body, SourcePosition.of(name));
    }

    // -----------------------------------------------------------------------
    // Declarations
    // -----------------------------------------------------------------------

    private record TypeSpec(String text, StructSpecifier struct, SourcePosition position) {}

    /**
     * Reads storage classes, qualifiers and type specifiers.
     *
     * @param identifierIsType treat a leading unknown identifier as a type name,
     *                         unless it is followed by {@code (}
     */
    private TypeSpec parseTypeSpecifiers(boolean identifierIsType) {
        Token first = peek();
        List<String> words = new ArrayList<>();
        StructSpecifier struct = null;
        boolean sawBaseType = false;

        while (true) {
            Token t = peek();
            if (QUALIFIERS.contains(t.type())) {
                words.add(next().value());
            } else if (BASE_TYPES.contains(t.type())) {
                words.add(next().value());
                sawBaseType = true;
            } else if ((t.is(STRUCT) || t.is(UNION)) && !sawBaseType) {
                struct = parseStructSpecifier();
                words.add(struct.typeText());
                sawBaseType = true;
            } else if (t.is(ENUM) && !sawBaseType) {
                words.add(parseEnumSpecifier());
                sawBaseType = true;
            } else if (t.is(IDENTIFIER) && !sawBaseType && !peek(1).is(LPAREN)
                    && (typedefNames.contains(t.value()) || identifierIsType || identifierActsAsType(0))) {
                words.add(next().value());
                sawBaseType = true;
            } else {
                break;
            }
            identifierIsType = false;
        }
        if (words.isEmpty()) {
            throw error("expected a type specifier", first);
        }
        return new TypeSpec(String.join(" ", words), struct, SourcePosition.of(first));
    }

    private StructSpecifier parseStructSpecifier() {
        Token keyword = next();
        String name = null;
        if (check(IDENTIFIER)) {
            name = next().value();
        }
        if (!accept(LBRACE)) {
            if (name == null) {
                throw error("expected struct name or '{'", peek());
            }
            return new StructSpecifier(keyword.value(), name, null, SourcePosition.of(keyword));
        }
        enterNesting(keyword);
        try {
            List<StructField> fields = new ArrayList<>();
            while (!check(RBRACE) && !check(EOF)) {
                Token start = peek();
                TypeSpec fieldType = parseTypeSpecifiers(true);
                List<VarDeclarator> declarators = new ArrayList<>();
                if (!check(SEMICOLON)) {
                    do {
                        declarators.add(parseDeclarator(fieldType, false, false));
                        if (accept(COLON)) {
                            parseConditional(); // bit-field width, not modelled
                        }
                    } while (accept(COMMA));
                }
                expect(SEMICOLON, "';' after struct field");
                fields.add(new StructField(fieldType.text(), fieldType.struct(), declarators, SourcePosition.of(start)));
            }
            expect(RBRACE, "'}' closing struct");
            return new StructSpecifier(keyword.value(), name, fields, SourcePosition.of(keyword));
        } finally {
            depth--;
        }
    }

    /** Enumerators are consumed but not modelled; only the type text survives. */
    private String parseEnumSpecifier() {
        next();
        String name = check(IDENTIFIER) ? next().value() : null;
        if (accept(LBRACE)) {
            while (!check(RBRACE) && !check(EOF)) {
                expect(IDENTIFIER, "enumerator");
                if (accept(ASSIGN)) {
                    parseConditional();
                }
                if (!accept(COMMA)) break;
            }
            expect(RBRACE, "'}' closing enum");
        } else if (name == null) {
            throw error("expected enum name or '{'", peek());
        }
        return name != null ? "enum " + name : "enum";
    }

    private Declaration parseDeclarationRest(TypeSpec spec, boolean typedef) {
        List<VarDeclarator> declarators = new ArrayList<>();
        if (!check(SEMICOLON)) {
            do {
                VarDeclarator declarator = parseDeclarator(spec, false, true);
                declarators.add(declarator);
                if (typedef && declarator.name() != null) {
                    typedefNames.add(declarator.name());
                }
            } while (accept(COMMA));
        }
        expect(SEMICOLON, "';' after declaration");
        return new Declaration(spec.text(), spec.struct(), declarators, typedef, spec.position());
    }

    private Declaration parseDeclaration() {
        boolean typedef = accept(TYPEDEF);
        TypeSpec spec = parseTypeSpecifiers(false);
        return parseDeclarationRest(spec, typedef);
    }

    /**
     * {@code *... name [size]... (= initializer)?}
     *
     * @param abstractAllowed the name may be omitted (parameters)
     * @param initializerAllowed an {@code =} initializer may follow
     */
    private VarDeclarator parseDeclarator(TypeSpec spec, boolean abstractAllowed, boolean initializerAllowed) {
        Token star = peek();
        int level = parsePointerLevel();
        PointerDecl pointer = level > 0 ? new PointerDecl(level, SourcePosition.of(star)) : null;

        Token name = null;
        if (check(IDENTIFIER)) {
            name = next();
        } else if (!abstractAllowed) {
            throw error("expected declarator name", peek());
        }

        List<ArrayDecl> dimensions = new ArrayList<>();
        while (check(LBRACKET)) {
            Token open = next();
            Node size = check(RBRACKET) ? null : parseAssignment();
            expect(RBRACKET, "']'");
            dimensions.add(new ArrayDecl(size, SourcePosition.of(open)));
        }

        Node initializer = null;
        if (initializerAllowed && accept(ASSIGN)) {
            initializer = parseInitializer();
        }
        SourcePosition position = name != null ? SourcePosition.of(name) : SourcePosition.of(star);
        return new VarDeclarator(name != null ? name.value() : null, pointer, dimensions, initializer, position);
    }

    private Node parseInitializer() {
        if (!check(LBRACE)) {
            return parseAssignment();
        }
        Token open = next();
        enterNesting(open);
        try {
            List<Node> items = new ArrayList<>();
            while (!check(RBRACE) && !check(EOF)) {
                items.add(parseInitializer());
                if (!accept(COMMA)) break;
            }
            expect(RBRACE, "'}' closing initializer");
            return new InitList(items, SourcePosition.of(open));
        } finally {
            depth--;
        }
    }

    private int parsePointerLevel() {
        int level = 0;
        while (check(TIMES)) {
            next();
            level++;
            while (check(CONST) || check(VOLATILE) || check(RESTRICT)) next();
        }
        return level;
    }

    /** Type text for casts and sizeof: specifiers followed by pointer stars, e.g. "char *". */
    private String parseTypeName() {
        TypeSpec spec = parseTypeSpecifiers(true);
        int level = parsePointerLevel();
        StringBuilder text = new StringBuilder(withPointer(spec.text(), level));
        while (check(LBRACKET)) {
            next();
            text.append('[');
            if (!check(RBRACKET)) {
                text.append(peek().value());
                parseConditional();
            }
            expect(RBRACKET, "']'");
            text.append(']');
        }
        return text.toString();
    }

    private static String withPointer(String base, int level) {
        return level == 0 ? base : base + " " + "*".repeat(level);
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private Compound parseCompound() {
        Token open = expect(LBRACE, "'{'");
        enterNesting(open);
        try {
            List<Node> items = new ArrayList<>();
            while (!check(RBRACE) && !check(EOF)) {
                int start = pos;
                try {
                    items.add(parseStatement());
                } catch (ParseException e) {
                    reportSyntaxError(e);
                    recover(start, false);
                }
            }
            if (check(EOF)) {
                diagnostics.error(Phase.PARSER, "Missing '}' for block opened at line "
                        + open.line() + " col " + open.column());
            } else {
                next();
            }
            return new Compound(items, SourcePosition.of(open));
        } finally {
            depth--;
        }
    }

    private Node parseStatement() {
        Token t = peek();
        enterNesting(t);
        try {
            switch (t.type()) {
                case LBRACE:       return parseCompound();
                case IF:           return parseIf();
                case WHILE:        return parseWhile();
                case DO:           return parseDoWhile();
                case FOR:          return parseFor();
                case SWITCH:       return parseSwitch();
                case CASE:         return parseCase();
                case DEFAULT:      return parseDefault();
                case RETURN:       return parseReturn();
                case BREAK:
                    next();
                    expect(SEMICOLON, "';' after break");
                    return new Break(SourcePosition.of(t));
                case CONTINUE:
                    next();
                    expect(SEMICOLON, "';' after continue");
                    return new Continue(SourcePosition.of(t));
                case SEMICOLON:
                    next();
                    return new ExprStmt(null, SourcePosition.of(t));
                case PP_DIRECTIVE:
                    next();
                    return new Include(t.value(), SourcePosition.of(t));
                default:
                    if (startsDeclaration()) {
                        return parseDeclaration();
                    }
                    Node expr = parseExpression();
                    expect(SEMICOLON, "';' after expression");
                    return new ExprStmt(expr, SourcePosition.of(t));
            }
        } finally {
            depth--;
        }
    }

    private IfStmt parseIf() {
        Token keyword = next();
        Node cond = parseParenthesized();
        Node thenStmt = parseStatement();
        Node elseStmt = accept(ELSE) ? parseStatement() : null;
        return new IfStmt(cond, thenStmt, elseStmt, SourcePosition.of(keyword));
    }

    private WhileStmt parseWhile() {
        Token keyword = next();
        Node cond = parseParenthesized();
        Node body = parseStatement();
        return new WhileStmt(cond, body, SourcePosition.of(keyword));
    }

    private DoWhileStmt parseDoWhile() {
        Token keyword = next();
        Node body = parseStatement();
        expect(WHILE, "'while' after do body");
        Node cond = parseParenthesized();
        expect(SEMICOLON, "';' after do-while");
        return new DoWhileStmt(body, cond, SourcePosition.of(keyword));
    }

    private ForStmt parseFor() {
        Token keyword = next();
        expect(LPAREN, "'(' after for");
        Node init = null;
        if (startsDeclaration()) {
            init = parseDeclaration();
        } else {
            if (!check(SEMICOLON)) init = parseExpression();
            expect(SEMICOLON, "';' in for header");
        }
        Node cond = check(SEMICOLON) ? null : parseExpression();
        expect(SEMICOLON, "';' in for header");
        Node post = check(RPAREN) ? null : parseExpression();
        expect(RPAREN, "')' closing for header");
        Node body = parseStatement();
        return new ForStmt(init, cond, post, body, SourcePosition.of(keyword));
    }

    private SwitchStmt parseSwitch() {
        Token keyword = next();
        Node expr = parseParenthesized();
        Node body = parseStatement();
        return new SwitchStmt(expr, body, SourcePosition.of(keyword));
    }

    private CaseStmt parseCase() {
        Token keyword = next();
        Node value = parseConditional();
        expect(COLON, "':' after case value");
        Node statement = check(RBRACE) ? null : parseStatement();
        return new CaseStmt(value, statement, SourcePosition.of(keyword));
    }

    private DefaultStmt parseDefault() {
        Token keyword = next();
        expect(COLON, "':' after default");
        Node statement = check(RBRACE) ? null : parseStatement();
        return new DefaultStmt(statement, SourcePosition.of(keyword));
    }

    private Return parseReturn() {
        Token keyword = next();
        Node expr = check(SEMICOLON) ? null : parseExpression();
        expect(SEMICOLON, "';' after return");
        return new Return(expr, SourcePosition.of(keyword));
    }

    private Node parseParenthesized() {
        expect(LPAREN, "'('");
        Node expr = parseExpression();
        expect(RPAREN, "')'");
        return expr;
    }

    private boolean startsDeclaration() {
        Token t = peek();
        if (t.is(TYPEDEF) || t.is(STRUCT) || t.is(UNION) || t.is(ENUM)
                || BASE_TYPES.contains(t.type()) || QUALIFIERS.contains(t.type())) {
            return true;
        }
        return t.is(IDENTIFIER) && identifierActsAsType(0);
    }

    /**
     * Whether the identifier at {@code offset} names a type: a known typedef, or
     * an unknown name directly followed by a declarator ({@code T x}, {@code T *x;}).
     */
    private boolean identifierActsAsType(int offset) {
        Token t = peek(offset);
        if (!t.is(IDENTIFIER)) return false;
        if (typedefNames.contains(t.value())) return true;
        Token after = peek(offset + 1);
        if (after.is(IDENTIFIER)) return true;
        if (!after.is(TIMES)) return false;
        int i = offset + 1;
        while (peek(i).is(TIMES)) i++;
        return peek(i).is(IDENTIFIER) && DECLARATOR_FOLLOW.contains(peek(i + 1).type());
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    private Node parseExpression() {
        Node left = parseAssignment();
        int folded = 0;
        try {
            while (check(COMMA)) {
                enterNesting(peek());
                folded++;
                Token op = next();
                Node right = parseAssignment();
                left = new BinaryOp(",", left, right, SourcePosition.of(op));
            }
            return left;
        } finally {
            depth -= folded;
        }
    }

    private Node parseAssignment() {
        enterNesting(peek());
        try {
            Node left = parseConditional();
            if (ASSIGNMENT_OPS.contains(peek().type())) {
                Token op = next();
                Node right = parseAssignment();
                return new BinaryOp(op.value(), left, right, SourcePosition.of(op));
            }
            return left;
        } finally {
            depth--;
        }
    }

    private Node parseConditional() {
        Node cond = parseBinary(0);
        if (!check(QUESTION)) {
            return cond;
        }
        enterNesting(peek());
        try {
            Token question = next();
            Node trueExpr = parseExpression();
            expect(COLON, "':' in conditional expression");
            Node falseExpr = parseConditional();
            return new TernaryOp(cond, trueExpr, falseExpr, SourcePosition.of(question));
        } finally {
            depth--;
        }
    }

    private Node parseBinary(int tier) {
        if (tier == BINARY_TIERS.size()) {
            return parseUnary();
        }
        Set<TokenType> operators = BINARY_TIERS.get(tier);
        Node left = parseBinary(tier + 1);
        // each folded operator deepens the left spine by one level
        int folded = 0;
        try {
            while (operators.contains(peek().type())) {
                enterNesting(peek());
                folded++;
                Token op = next();
                Node right = parseBinary(tier + 1);
                left = new BinaryOp(op.value(), left, right, SourcePosition.of(op));
            }
            return left;
        } finally {
            depth -= folded;
        }
    }

    private Node parseUnary() {
        Token t = peek();
        enterNesting(t);
        try {
            if (PREFIX_OPS.contains(t.type()) || t.is(INC) || t.is(DEC)) {
                next();
                Node operand = parseUnary();
                return new UnaryOp(t.value(), operand, SourcePosition.of(t));
            }
            if (t.is(SIZEOF)) {
                next();
                if (check(LPAREN) && startsTypeName(1)) {
                    Token open = next();
                    String type = parseTypeName();
                    expect(RPAREN, "')' after sizeof type");
                    return new UnaryOp(UnaryOp.SIZEOF, new TypeName(type, SourcePosition.of(open)),
                            SourcePosition.of(t));
                }
                return new UnaryOp(UnaryOp.SIZEOF, parseUnary(), SourcePosition.of(t));
            }
            if (t.is(LPAREN) && startsTypeName(1)) {
                next();
                String type = parseTypeName();
                expect(RPAREN, "')' after cast type");
                Node operand = parseUnary();
                return new Cast(type, operand, SourcePosition.of(t));
            }
            return parsePostfix();
        } finally {
            depth--;
        }
    }

    /** Type name inside parentheses: keywords, a known typedef, or {@code T *)}. */
    private boolean startsTypeName(int offset) {
        Token t = peek(offset);
        if (t.is(STRUCT) || t.is(UNION) || t.is(ENUM)
                || BASE_TYPES.contains(t.type()) || QUALIFIERS.contains(t.type())) {
            return true;
        }
        if (!t.is(IDENTIFIER)) return false;
        if (typedefNames.contains(t.value())) return true;
        int i = offset + 1;
        if (!peek(i).is(TIMES)) return false;
        while (peek(i).is(TIMES)) i++;
        return peek(i).is(RPAREN);
    }

    private Node parsePostfix() {
        Node expr = parsePrimary();
        int folded = 0;
        try {
            while (true) {
                Token t = peek();
                if (!POSTFIX_OPS.contains(t.type())) {
                    return expr;
                }
                enterNesting(t);
                folded++;
                expr = parsePostfixOperator(expr, t);
            }
        } finally {
            depth -= folded;
        }
    }

    private Node parsePostfixOperator(Node expr, Token t) {
        next();
        switch (t.type()) {
            case LBRACKET -> {
                Node index = parseExpression();
                expect(RBRACKET, "']'");
                return new ArrayRef(expr, index, SourcePosition.of(t));
            }
            case LPAREN -> {
                List<Node> args = new ArrayList<>();
                if (!check(RPAREN)) {
                    do {
                        args.add(parseAssignment());
                    } while (accept(COMMA));
                }
                expect(RPAREN, "')' closing call");
                return new Call(expr, args, SourcePosition.of(t));
            }
            case DOT -> {
                Token member = expect(IDENTIFIER, "member name");
                return new MemberAccess(expr, new Identifier(member.value(), SourcePosition.of(member)),
                        SourcePosition.of(t));
            }
            case ARROW -> {
                Token member = expect(IDENTIFIER, "member name");
                return new PointerMemberAccess(expr, new Identifier(member.value(), SourcePosition.of(member)),
                        SourcePosition.of(t));
            }
            case INC -> {
                return new UnaryOp(UnaryOp.POSTINC, expr, SourcePosition.of(t));
            }
            default -> {
                return new UnaryOp(UnaryOp.POSTDEC, expr, SourcePosition.of(t));
            }
        }
    }

    private Node parsePrimary() {
        Token t = peek();
        switch (t.type()) {
            case IDENTIFIER:
                next();
                return new Identifier(t.value(), SourcePosition.of(t));
            case INT_CONST:
                next();
                return new Constant(t.value(), "int", SourcePosition.of(t));
            case FLOAT_CONST:
                next();
                return new Constant(t.value(), "float", SourcePosition.of(t));
            case CHAR_CONST:
                next();
                return new Constant(t.value(), "char", SourcePosition.of(t));
            case STRING_LITERAL: {
                // adjacent literals concatenate
                StringBuilder text = new StringBuilder(next().value());
                while (check(STRING_LITERAL)) {
                    text.append(' ').append(next().value());
                }
                return new Constant(text.toString(), "string", SourcePosition.of(t));
            }
            case LPAREN: {
                next();
                Node inner = parseExpression();
                expect(RPAREN, "')'");
                return inner;
            }
            default:
                throw error("unexpected token in expression", t);
        }
    }

    // -----------------------------------------------------------------------
    // Token helpers and recovery
    // -----------------------------------------------------------------------

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        int i = Math.min(pos + ahead, tokens.size() - 1);
        return tokens.get(i);
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (pos < tokens.size() - 1) pos++;
        return t;
    }

    private boolean accept(TokenType type) {
        if (check(type)) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        if (!check(type)) {
            throw error("expected " + what, peek());
        }
        return next();
    }

    private void enterNesting(Token at) {
        if (depth >= config.maxNestingDepth) {
            throw error("nesting deeper than " + config.maxNestingDepth + " levels", at);
        }
        depth++;
    }

    private ParseException error(String message, Token token) {
        return new ParseException(message, token);
    }

    private void reportSyntaxError(ParseException e) {
        Token t = e.getToken();
        if (t == null || t.is(EOF)) {
            diagnostics.error(Phase.PARSER, "Syntax error at EOF: " + e.getMessage());
            return;
        }
        diagnostics.error(Phase.PARSER, "Syntax error at token " + t.type() + " (value='" + t.value()
                + "') line=" + t.line() + " col=" + t.column() + ": " + e.getMessage());
    }

    /**
     * Discards the offending token. Statement-level recovery leaves a closing
     * brace in place for the enclosing block; both levels guarantee progress
     * past {@code start}.
     */
    private void recover(int start, boolean topLevel) {
        if (check(EOF)) return;
        if (!topLevel && check(RBRACE) && pos > start) return;
        next();
    }
}

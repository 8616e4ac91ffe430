package com.csentinel.core.ast;

/**
 * Closed set of AST node kinds. Visitors switch over this.
 */
public enum NodeKind {
    PROGRAM("Program"),
    INCLUDE("Include"),
    FUNCTION_DEF("FunctionDef"),
    DECLARATION("Declaration"),
    VAR_DECLARATOR("VarDeclarator"),
    POINTER_DECL("PointerDecl"),
    ARRAY_DECL("ArrayDecl"),
    INIT_LIST("InitList"),
    COMPOUND("Compound"),
    EXPR_STMT("ExprStmt"),
    IF_STMT("IfStmt"),
    WHILE_STMT("WhileStmt"),
    DO_WHILE_STMT("DoWhileStmt"),
    FOR_STMT("ForStmt"),
    SWITCH_STMT("SwitchStmt"),
    CASE_STMT("CaseStmt"),
    DEFAULT_STMT("DefaultStmt"),
    RETURN("Return"),
    BREAK("Break"),
    CONTINUE("Continue"),
    CALL("Call"),
    IDENTIFIER("Identifier"),
    CONSTANT("Constant"),
    BINARY_OP("BinaryOp"),
    UNARY_OP("UnaryOp"),
    CAST("Cast"),
    TYPE_NAME("TypeName"),
    TERNARY_OP("TernaryOp"),
    ARRAY_REF("ArrayRef"),
    MEMBER_ACCESS("MemberAccess"),
    POINTER_MEMBER_ACCESS("PointerMemberAccess"),
    STRUCT_SPECIFIER("StructSpecifier"),
    STRUCT_FIELD("StructField");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in rendered trees and JSON output. */
    public String displayName() { return displayName; }
}

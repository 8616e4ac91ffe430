package com.csentinel.core.cfg;

import com.csentinel.core.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders statements and expressions as short C-like text for block instructions.
 * Missing parts of a partially parsed tree render as empty text.
 */
public class InstructionFormatter {

    public String format(Node node) {
        if (node == null) {
            return "";
        }
        switch (node.kind()) {
            case CONSTANT:
                return ((Constant) node).value();
            case IDENTIFIER:
                return ((Identifier) node).name();
            case TYPE_NAME:
                return ((TypeName) node).text();
            case BINARY_OP:
                return formatBinary((BinaryOp) node);
            case UNARY_OP:
                return formatUnary((UnaryOp) node);
            case CAST: {
                Cast cast = (Cast) node;
                return "(" + cast.toType() + ")" + format(cast.expr());
            }
            case TERNARY_OP: {
                TernaryOp t = (TernaryOp) node;
                return format(t.condition()) + " ? " + format(t.trueExpr()) + " : " + format(t.falseExpr());
            }
            case CALL: {
                Call call = (Call) node;
                return format(call.func()) + "(" + joined(call.args()) + ")";
            }
            case ARRAY_REF: {
                ArrayRef ref = (ArrayRef) node;
                return format(ref.base()) + "[" + format(ref.index()) + "]";
            }
            case MEMBER_ACCESS: {
                MemberAccess access = (MemberAccess) node;
                return format(access.base()) + "." + format(access.member());
            }
            case POINTER_MEMBER_ACCESS: {
                PointerMemberAccess access = (PointerMemberAccess) node;
                return format(access.base()) + "->" + format(access.member());
            }
            case INIT_LIST:
                return "{" + joined(((InitList) node).items()) + "}";
            case DECLARATION:
                return formatDeclaration((Declaration) node);
            case VAR_DECLARATOR:
                return formatDeclarator((VarDeclarator) node);
            case EXPR_STMT:
                return format(((ExprStmt) node).expr());
            case RETURN: {
                Node expr = ((Return) node).expr();
                return expr == null ? "return" : "return " + format(expr);
            }
            case BREAK:
                return "break";
            case CONTINUE:
                return "continue";
            case INCLUDE:
                return ((Include) node).text();
            case SWITCH_STMT:
                return "SWITCH (" + format(((SwitchStmt) node).expr()) + ")";
            case CASE_STMT:
                return "CASE " + format(((CaseStmt) node).value());
            case DEFAULT_STMT:
                return "DEFAULT";
            case STRUCT_SPECIFIER:
                return ((StructSpecifier) node).typeText();
            default:
                return node.kind().displayName();
        }
    }

    private String formatBinary(BinaryOp op) {
        if (",".equals(op.op())) {
            return format(op.left()) + ", " + format(op.right());
        }
        if (op.isAssignment()) {
            return format(op.left()) + " " + op.op() + " " + format(op.right());
        }
        return operand(op.left()) + " " + op.op() + " " + operand(op.right());
    }

    private String operand(Node node) {
        String text = format(node);
        if (node instanceof BinaryOp || node instanceof TernaryOp) {
            return "(" + text + ")";
        }
        return text;
    }

    private String formatUnary(UnaryOp op) {
        String operand = operand(op.operand());
        switch (op.op()) {
            case UnaryOp.POSTINC: return operand + "++";
            case UnaryOp.POSTDEC: return operand + "--";
            case UnaryOp.SIZEOF:  return "sizeof(" + format(op.operand()) + ")";
            default:              return op.op() + operand;
        }
    }

    private String formatDeclaration(Declaration decl) {
        String type = decl.isTypedef() ? "typedef " + decl.declType() : decl.declType();
        if (decl.declarators().isEmpty()) {
            return type;
        }
        List<String> parts = new ArrayList<>();
        for (VarDeclarator d : decl.declarators()) {
            parts.add(formatDeclarator(d));
        }
        return type + " " + String.join(", ", parts);
    }

    private String formatDeclarator(VarDeclarator d) {
        StringBuilder text = new StringBuilder();
        if (d.pointer() != null) {
            text.append("*".repeat(d.pointer().level()));
        }
        if (d.name() != null) {
            text.append(d.name());
        }
        for (ArrayDecl dim : d.dimensions()) {
            text.append('[').append(format(dim.size())).append(']');
        }
        if (d.initializer() != null) {
            text.append(" = ").append(format(d.initializer()));
        }
        return text.toString();
    }

    private String joined(List<Node> nodes) {
        return nodes.stream().map(this::format).collect(Collectors.joining(", "));
    }
}

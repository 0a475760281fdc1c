package com.uclang.compiler.backend;

import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.expr.*;

import java.util.List;

/**
 * 表达式降级为 C++ 表达式文本。运行时库函数名（uc_add、uc_array_index 等）由 expr.h 提供。
 */
public final class ExpressionLowering implements AstVisitor<String, Void> {

    public String lower(Expression expression) {
        return expression.accept(this, null);
    }

    /** 逗号分隔的参数列表（不含括号） */
    public String lowerArgs(List<Expression> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(lower(args.get(i)));
        }
        return sb.toString();
    }

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case STRING:
                // 构造 std::string 的字面量后缀
                return node.getText() + "s";
            case NULL:
                return "nullptr";
            default:
                return node.getText();
        }
    }

    @Override
    public String visitNameExpr(NameExpr node, Void ctx) {
        return "UC_VAR(" + node.getName() + ")";
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        return node.getFunction().mangle() + "(" + lowerArgs(node.getArgs()) + ")";
    }

    @Override
    public String visitNewExpr(NewExpr node, Void ctx) {
        return "uc_make_object<" + node.getType().mangle() + ">(" + lowerArgs(node.getArgs()) + ")";
    }

    @Override
    public String visitNewArrayExpr(NewArrayExpr node, Void ctx) {
        return "uc_make_array_of<" + node.getElementType().getType().mangle() + ">("
                + lowerArgs(node.getArgs()) + ")";
    }

    @Override
    public String visitFieldAccessExpr(FieldAccessExpr node, Void ctx) {
        if (node.isLengthField()) {
            return "uc_length_field(" + lower(node.getReceiver()) + ")";
        }
        return lower(node.getReceiver()) + "->UC_VAR(" + node.getFieldName() + ")";
    }

    @Override
    public String visitIndexExpr(IndexExpr node, Void ctx) {
        return "uc_array_index(" + lower(node.getReceiver()) + ", " + lower(node.getIndex()) + ")";
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        String operand = lower(node.getOperand());
        if (node.getOperator() == UnaryExpr.UnaryOp.ID) {
            return "uc_id(" + operand + ")";
        }
        return node.getOperator().toSourceString() + "(" + operand + ")";
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        String lhs = lower(node.getLeft());
        String rhs = lower(node.getRight());
        switch (node.getOperator()) {
            case ADD:
                return "uc_add(" + lhs + ", " + rhs + ")";
            case PUSH:
                return "uc_array_push(" + lhs + ", " + rhs + ")";
            case POP:
                return "uc_array_pop(" + lhs + ", " + rhs + ")";
            default:
                return "(" + lhs + ") " + node.getOperator().toSourceString() + " (" + rhs + ")";
        }
    }

    @Override
    public String visitAssignExpr(AssignExpr node, Void ctx) {
        return lower(node.getTarget()) + " = " + lower(node.getValue());
    }
}

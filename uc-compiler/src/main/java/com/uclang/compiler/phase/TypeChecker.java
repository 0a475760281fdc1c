package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.analysis.func.UcFunction;
import com.uclang.compiler.analysis.types.ArrayType;
import com.uclang.compiler.analysis.types.PrimitiveType;
import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.expr.*;
import com.uclang.compiler.ast.stmt.ForStmt;
import com.uclang.compiler.ast.stmt.IfStmt;
import com.uclang.compiler.ast.stmt.ReturnStmt;
import com.uclang.compiler.ast.stmt.WhileStmt;

/**
 * 阶段 6：计算每个表达式的类型并检查上下文约束。
 *
 * <p>子表达式先于父表达式检查。任何检查失败都会报告诊断，但节点仍会得到一个可用的类型
 * （通常是 int），以便同一次编译继续发现后续错误。</p>
 */
public final class TypeChecker extends AstTraversal<PhaseContext> {

    // ============ 声明 ============

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        visitChildren(node, ctx.withLocalEnv(node.getLocalEnv()));
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        visitChildren(node, ctx.withLocalEnv(node.getLocalEnv())
                .withReturnType(node.getFunction().getReturnType()));
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitIfStmt(IfStmt node, PhaseContext ctx) {
        visitChildren(node, ctx);
        checkTest(node.getCondition(), node.getLocation(), ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, PhaseContext ctx) {
        visitChildren(node, ctx);
        checkTest(node.getCondition(), node.getLocation(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, PhaseContext ctx) {
        visitChildren(node, ctx);
        if (node.getCondition() != null) {
            checkTest(node.getCondition(), node.getLocation(), ctx);
        }
        return null;
    }

    private void checkTest(Expression test, SourceLocation location, PhaseContext ctx) {
        if (test.getType() != UcTypes.BOOLEAN) {
            ctx.error(location, "type of test expression must be boolean, but was given " + test.getType());
        }
    }

    /** 非 void 函数要求返回值类型与声明完全一致，不接受隐式转换 */
    @Override
    public Void visitReturnStmt(ReturnStmt node, PhaseContext ctx) {
        visitChildren(node, ctx);
        UcType expected = ctx.getReturnType();
        if (expected == UcTypes.VOID) {
            if (node.hasValue()) {
                ctx.error(node.getLocation(), "function with return type void cannot return a value");
            }
        } else if (!node.hasValue()) {
            ctx.error(node.getLocation(), "function requires return type " + expected
                    + ", but got no return value");
        } else if (node.getValue().getType() != expected) {
            ctx.error(node.getLocation(), "function requires return type " + expected
                    + ", but got " + node.getValue().getType());
        }
        return null;
    }

    // ============ 基本表达式 ============

    @Override
    public Void visitLiteral(Literal node, PhaseContext ctx) {
        switch (node.getKind()) {
            case INTEGER:
                node.setType(node.hasLongSuffix() ? UcTypes.LONG : UcTypes.INT);
                break;
            case FLOAT:
                node.setType(UcTypes.FLOAT);
                break;
            case STRING:
                node.setType(UcTypes.STRING);
                break;
            case BOOLEAN:
                node.setType(UcTypes.BOOLEAN);
                break;
            case NULL:
                node.setType(UcTypes.NULL);
                break;
            default:
                throw new IllegalStateException("unknown literal kind " + node.getKind());
        }
        return null;
    }

    @Override
    public Void visitNameExpr(NameExpr node, PhaseContext ctx) {
        node.setType(ctx.getLocalEnv().getType(ctx.getPhase(), node.getLocation(), node.getName()));
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        UcFunction function = node.getFunction();
        function.checkArgs(ctx.getPhase(), node.getLocation(), node.getArgs(), ctx.getGlobalEnv());
        node.setType(function.getReturnType());
        return null;
    }

    /** 名义类型已在阶段 2 赋值 */
    @Override
    public Void visitNewExpr(NewExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        node.getType().checkArgs(ctx.getPhase(), node.getLocation(), node.getArgs(), ctx.getGlobalEnv());
        return null;
    }

    @Override
    public Void visitNewArrayExpr(NewArrayExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        node.getType().checkArgs(ctx.getPhase(), node.getLocation(), node.getArgs(), ctx.getGlobalEnv());
        return null;
    }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        UcType receiver = node.getReceiver().getType();
        if (receiver instanceof PrimitiveType) {
            ctx.error(node.getLocation(), "receiver must be user-defined type or array type, but was "
                    + receiver);
            node.setType(UcTypes.INT);
        } else {
            node.setType(receiver.lookupField(ctx.getPhase(), node.getLocation(), node.getFieldName(),
                    ctx.getGlobalEnv()));
        }
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        UcType receiver = node.getReceiver().getType();
        UcType index = node.getIndex().getType();
        if (!(receiver instanceof ArrayType)) {
            ctx.error(node.getLocation(), "cannot index into non-array type " + receiver);
            node.setType(UcTypes.INT);
        } else if (index != UcTypes.INT) {
            ctx.error(node.getLocation(), "array index expects type int, but got type " + index);
            node.setType(UcTypes.INT);
        } else {
            node.setType(((ArrayType) receiver).getElementType());
        }
        return null;
    }

    // ============ 一元表达式 ============

    @Override
    public Void visitUnaryExpr(UnaryExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        Expression operand = node.getOperand();
        UcType type = operand.getType();
        switch (node.getOperator()) {
            case PLUS:
            case MINUS:
                if (!UcTypes.isNumeric(type)) {
                    ctx.error(node.getLocation(), "subexpression given is of type " + type
                            + ", but must be numeric");
                }
                node.setType(type);
                break;
            case NOT:
                if (type != UcTypes.BOOLEAN) {
                    ctx.error(node.getLocation(), "subexpression given is of type " + type
                            + ", but must be boolean");
                }
                node.setType(UcTypes.BOOLEAN);
                break;
            case INCREMENT:
            case DECREMENT:
                if (!(operand.isLvalue() && UcTypes.isNumeric(type))) {
                    ctx.error(node.getLocation(), "subexpression must be a numeric l-value");
                }
                node.setType(type);
                break;
            case ID:
                if (!UcTypes.isReference(type)) {
                    ctx.error(node.getLocation(), "subexpression was of type " + type
                            + ", but must be of reference type");
                }
                node.setType(UcTypes.LONG);
                break;
            default:
                throw new IllegalStateException("unknown unary operator " + node.getOperator());
        }
        return null;
    }

    // ============ 二元表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        switch (node.getOperator().getCategory()) {
            case ARITHMETIC:
                node.setType(checkArithmetic(node, ctx));
                break;
            case LOGICAL:
                node.setType(checkLogical(node, ctx));
                break;
            case RELATIONAL:
                node.setType(checkRelational(node, ctx));
                break;
            case EQUALITY:
                node.setType(checkEquality(node, ctx));
                break;
            case ARRAY:
                node.setType(node.getOperator() == BinaryExpr.BinaryOp.PUSH
                        ? checkPush(node, ctx) : checkPop(node, ctx));
                break;
            default:
                throw new IllegalStateException("unknown operator " + node.getOperator());
        }
        return null;
    }

    private UcType checkArithmetic(BinaryExpr node, PhaseContext ctx) {
        UcType lhs = node.getLeft().getType();
        UcType rhs = node.getRight().getType();
        switch (node.getOperator()) {
            case ADD:
                return checkPlus(node, ctx);
            case MOD:
                if (!(UcTypes.isIntegral(lhs) && UcTypes.isIntegral(rhs))) {
                    ctx.error(node.getLocation(), "lhs and rhs must be of type int or long");
                    return UcTypes.INT;
                }
                break;
            default:
                if (!(UcTypes.isNumeric(lhs) && UcTypes.isNumeric(rhs))) {
                    ctx.error(node.getLocation(), "lhs and rhs must be of numeric type");
                    return UcTypes.INT;
                }
                break;
        }
        return UcTypes.join(ctx.getPhase(), node.getLocation(), lhs, rhs, ctx.getGlobalEnv());
    }

    /**
     * + 同时用于数值加法和字符串拼接。
     * 布尔值只能与字符串拼接，任意一侧是字符串时结果为字符串。
     */
    private UcType checkPlus(BinaryExpr node, PhaseContext ctx) {
        UcType lhs = node.getLeft().getType();
        UcType rhs = node.getRight().getType();
        String problem = null;
        if (!(lhs instanceof PrimitiveType && rhs instanceof PrimitiveType)) {
            problem = "lhs and rhs operands must be primitive types";
        } else if (lhs == UcTypes.VOID || lhs == UcTypes.NULL) {
            problem = "lhs operand cannot be of type void or null";
        } else if (rhs == UcTypes.VOID || rhs == UcTypes.NULL) {
            problem = "rhs operand cannot be of type void or null";
        } else if (lhs == UcTypes.BOOLEAN && rhs != UcTypes.STRING) {
            problem = "lhs operand is of type boolean, so rhs operand must be of type string";
        } else if (rhs == UcTypes.BOOLEAN && lhs != UcTypes.STRING) {
            problem = "rhs operand is of type boolean, so lhs operand must be of type string";
        }
        if (problem != null) {
            ctx.error(node.getLocation(), problem);
            return UcTypes.INT;
        }
        if (lhs == UcTypes.STRING || rhs == UcTypes.STRING) {
            return UcTypes.STRING;
        }
        return UcTypes.join(ctx.getPhase(), node.getLocation(), lhs, rhs, ctx.getGlobalEnv());
    }

    private UcType checkLogical(BinaryExpr node, PhaseContext ctx) {
        if (node.getLeft().getType() != UcTypes.BOOLEAN || node.getRight().getType() != UcTypes.BOOLEAN) {
            ctx.error(node.getLocation(), "lhs and rhs operands must be of type boolean");
        }
        return UcTypes.BOOLEAN;
    }

    private UcType checkRelational(BinaryExpr node, PhaseContext ctx) {
        UcType lhs = node.getLeft().getType();
        UcType rhs = node.getRight().getType();
        boolean numeric = UcTypes.isNumeric(lhs) && UcTypes.isNumeric(rhs);
        boolean strings = lhs == UcTypes.STRING && rhs == UcTypes.STRING;
        if (!numeric && !strings) {
            ctx.error(node.getLocation(), "lhs and rhs must be both numeric or both strings");
        }
        return UcTypes.BOOLEAN;
    }

    private UcType checkEquality(BinaryExpr node, PhaseContext ctx) {
        UcType lhs = node.getLeft().getType();
        UcType rhs = node.getRight().getType();
        if (!UcTypes.isCompatible(lhs, rhs) && !UcTypes.isCompatible(rhs, lhs)) {
            ctx.error(node.getLocation(), "lhs and rhs cannot be compared");
        }
        return UcTypes.BOOLEAN;
    }

    private UcType checkPush(BinaryExpr node, PhaseContext ctx) {
        UcType lhs = node.getLeft().getType();
        UcType rhs = node.getRight().getType();
        if (!(lhs instanceof ArrayType)) {
            ctx.error(node.getLocation(), "lhs operand must be of array type");
        } else if (!UcTypes.isCompatible(rhs, ((ArrayType) lhs).getElementType())) {
            ctx.error(node.getLocation(), "rhs operand is not implicitly convertible to element type of lhs operand");
        }
        return lhs;
    }

    /** 右侧为 null 时只取出不保存，否则右侧必须是能接收元素的左值 */
    private UcType checkPop(BinaryExpr node, PhaseContext ctx) {
        UcType lhs = node.getLeft().getType();
        Expression right = node.getRight();
        if (!(lhs instanceof ArrayType)) {
            ctx.error(node.getLocation(), "lhs operand must be of array type");
        } else if (!(right.getType() == UcTypes.NULL || right.isLvalue())) {
            ctx.error(node.getLocation(), "rhs operand must be null or l-value");
        } else if (right.isLvalue()
                && !UcTypes.isCompatible(((ArrayType) lhs).getElementType(), right.getType())) {
            ctx.error(node.getLocation(), "rhs operand is an l-value, so element type of lhs operand "
                    + "must be implicitly convertible to it");
        }
        return lhs;
    }

    // ============ 赋值 ============

    @Override
    public Void visitAssignExpr(AssignExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        UcType lhs = node.getTarget().getType();
        UcType rhs = node.getValue().getType();
        if (!UcTypes.isCompatible(rhs, lhs)) {
            ctx.error(node.getLocation(), "rhs operand must be implicitly convertible to lhs operand");
        } else if (!node.getTarget().isLvalue()) {
            ctx.error(node.getLocation(), "lhs operand must produce l-value");
        }
        node.setType(lhs);
        return null;
    }
}

package com.uclang.compiler.backend;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.decl.VarDecl;
import com.uclang.compiler.ast.expr.Expression;
import com.uclang.compiler.ast.stmt.*;

/**
 * 第 4 遍：函数完整定义与语句降级。每条语句从所在块的缩进开始占一行或多行。
 */
final class FunctionDefinitionPass extends AstTraversal<PhaseContext> {

    private final ExpressionLowering expressions = new ExpressionLowering();

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        PhaseContext header = ctx.indented();
        PhaseContext body = header.indented();

        ctx.line(node.getFunction().getReturnType().mangle());
        header.line(FunctionDeclarationPass.signature(node) + " {");
        for (VarDecl local : node.getLocals()) {
            body.line(local.getType().getType().mangle() + " UC_VAR(" + local.getName() + ");");
        }
        visit(node.getBody(), body);
        ctx.line("}");
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, PhaseContext ctx) {
        for (Statement statement : node.getStatements()) {
            visit(statement, ctx);
        }
        return null;
    }

    /** 总是输出 else 分支，缺省时为空 */
    @Override
    public Void visitIfStmt(IfStmt node, PhaseContext ctx) {
        ctx.line("if (" + lower(node.getCondition()) + ") {");
        visit(node.getThenBranch(), ctx.indented());
        ctx.line("} else {");
        visit(node.getElseBranch(), ctx.indented());
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, PhaseContext ctx) {
        ctx.line("while (" + lower(node.getCondition()) + ") {");
        visit(node.getBody(), ctx.indented());
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, PhaseContext ctx) {
        ctx.line("for (" + lower(node.getInit()) + "; " + lower(node.getCondition()) + "; "
                + lower(node.getUpdate()) + ") {");
        visit(node.getBody(), ctx.indented());
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, PhaseContext ctx) {
        ctx.line("break;");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, PhaseContext ctx) {
        ctx.line("continue;");
        return null;
    }

    /** 无返回值时输出 "return ;" */
    @Override
    public Void visitReturnStmt(ReturnStmt node, PhaseContext ctx) {
        ctx.line("return " + lower(node.getValue()) + ";");
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, PhaseContext ctx) {
        ctx.line(lower(node.getExpression()) + ";");
        return null;
    }

    /** 省略的表达式输出为空 */
    private String lower(Expression expression) {
        return expression == null ? "" : expressions.lower(expression);
    }
}

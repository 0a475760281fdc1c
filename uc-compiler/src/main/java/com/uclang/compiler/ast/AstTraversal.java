package com.uclang.compiler.ast;

import com.uclang.compiler.ast.decl.*;
import com.uclang.compiler.ast.expr.*;
import com.uclang.compiler.ast.stmt.*;
import com.uclang.compiler.ast.type.*;

/**
 * 默认递归遍历：每种节点的默认行为都是按顺序访问全部子节点。
 *
 * <p>编译阶段继承此类，只覆盖语义与默认不同的节点。上下文按值传递，
 * 子作用域需要不同属性时构造新的上下文对象。</p>
 */
public abstract class AstTraversal<C> implements AstVisitor<Void, C> {

    /** 依次访问 node 的所有子节点 */
    protected void visitChildren(AstNode node, C ctx) {
        for (AstNode child : node.getChildren()) {
            child.accept(this, ctx);
        }
    }

    /** 访问单个节点，允许 null（可选子节点） */
    protected void visit(AstNode node, C ctx) {
        if (node != null) {
            node.accept(this, ctx);
        }
    }

    @Override
    public Void visitProgram(Program node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitStructDecl(StructDecl node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitVarDecl(VarDecl node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitParameter(Parameter node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitSimpleTypeName(SimpleTypeName node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitArrayTypeName(ArrayTypeName node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitBlock(Block node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitIfStmt(IfStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitWhileStmt(WhileStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitForStmt(ForStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitBreakStmt(BreakStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitContinueStmt(ContinueStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitReturnStmt(ReturnStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitLiteral(Literal node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitNameExpr(NameExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitCallExpr(CallExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitNewExpr(NewExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitNewArrayExpr(NewArrayExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitIndexExpr(IndexExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, C ctx) { visitChildren(node, ctx); return null; }

    @Override
    public Void visitAssignExpr(AssignExpr node, C ctx) { visitChildren(node, ctx); return null; }
}

package com.uclang.compiler.ast;

import com.uclang.compiler.ast.decl.*;
import com.uclang.compiler.ast.expr.*;
import com.uclang.compiler.ast.stmt.*;
import com.uclang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。
 * 需要"默认递归子节点"语义的阶段应继承 {@link AstTraversal}。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitVarDecl(VarDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 类型名 ============

    default R visitSimpleTypeName(SimpleTypeName node, C ctx) { return null; }

    default R visitArrayTypeName(ArrayTypeName node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitNameExpr(NameExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitNewExpr(NewExpr node, C ctx) { return null; }

    default R visitNewArrayExpr(NewArrayExpr node, C ctx) { return null; }

    default R visitFieldAccessExpr(FieldAccessExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }
}

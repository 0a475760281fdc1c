package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.ErrorKind;
import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.stmt.BreakStmt;
import com.uclang.compiler.ast.stmt.ContinueStmt;
import com.uclang.compiler.ast.stmt.ForStmt;
import com.uclang.compiler.ast.stmt.WhileStmt;

/**
 * 阶段 5：break / continue 必须位于循环体内
 */
public final class BasicControlChecker extends AstTraversal<PhaseContext> {

    @Override
    public Void visitWhileStmt(WhileStmt node, PhaseContext ctx) {
        visitChildren(node, ctx.withInLoop(true));
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, PhaseContext ctx) {
        visitChildren(node, ctx.withInLoop(true));
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, PhaseContext ctx) {
        if (!ctx.isInLoop()) {
            ctx.report(node.getLocation(), ErrorKind.CONTROL_FLOW, "break statement must occur within a loop");
        }
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, PhaseContext ctx) {
        if (!ctx.isInLoop()) {
            ctx.report(node.getLocation(), ErrorKind.CONTROL_FLOW,
                    "continue statement must occur within a loop");
        }
        return null;
    }
}

package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.expr.CallExpr;

/**
 * 阶段 3：把调用表达式的函数名解析为函数对象
 */
public final class CallResolver extends AstTraversal<PhaseContext> {

    @Override
    public Void visitCallExpr(CallExpr node, PhaseContext ctx) {
        node.setFunction(ctx.getGlobalEnv().lookupFunction(ctx.getPhase(), node.getLocation(), node.getName()));
        visitChildren(node, ctx);
        return null;
    }
}

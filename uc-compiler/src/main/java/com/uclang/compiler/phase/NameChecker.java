package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.analysis.VarEnv;
import com.uclang.compiler.analysis.VarEnv.VarKind;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.Parameter;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.decl.VarDecl;

/**
 * 阶段 4：为结构体和函数建立局部环境，检查字段、参数、局部变量名唯一。
 * 参数和局部变量共用一个环境，二者之间重名同样报告。
 * 重名诊断的位置是所在结构体或函数的声明位置。
 */
public final class NameChecker extends AstTraversal<PhaseContext> {

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        if (node.getLocalEnv() == null) {
            VarEnv env = new VarEnv(ctx.getGlobalEnv());
            for (VarDecl field : node.getFields()) {
                env.addVariable(ctx.getPhase(), node.getLocation(), field.getName(),
                        field.getType().getType(), VarKind.FIELD);
            }
            node.setLocalEnv(env);
        }
        visitChildren(node, ctx.withLocalEnv(node.getLocalEnv()));
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        if (node.getLocalEnv() == null) {
            VarEnv env = new VarEnv(ctx.getGlobalEnv());
            for (Parameter param : node.getParams()) {
                env.addVariable(ctx.getPhase(), node.getLocation(), param.getName(),
                        param.getType().getType(), VarKind.PARAMETER);
            }
            for (VarDecl local : node.getLocals()) {
                env.addVariable(ctx.getPhase(), node.getLocation(), local.getName(),
                        local.getType().getType(), VarKind.VARIABLE);
            }
            node.setLocalEnv(env);
        }
        visitChildren(node, ctx.withLocalEnv(node.getLocalEnv()));
        return null;
    }
}

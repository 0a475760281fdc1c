package com.uclang.compiler.backend;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.analysis.func.UserFunction;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.Parameter;
import com.uclang.compiler.ast.decl.StructDecl;

/**
 * 第 2 遍：函数前向声明。返回类型单独一行，函数名与参数列表缩进一级。
 */
final class FunctionDeclarationPass extends AstTraversal<PhaseContext> {

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        UserFunction function = node.getFunction();
        ctx.line(function.getReturnType().mangle());
        ctx.indented().line(signature(node) + ";");
        return null;
    }

    /** 函数名加参数列表，参数之间只用逗号分隔 */
    static String signature(FunctionDecl node) {
        StringBuilder sb = new StringBuilder(node.getFunction().mangle()).append('(');
        for (int i = 0; i < node.getParams().size(); i++) {
            Parameter param = node.getParams().get(i);
            if (i > 0) sb.append(',');
            sb.append(param.getType().getType().mangle()).append(" UC_VAR(").append(param.getName()).append(')');
        }
        return sb.append(')').toString();
    }
}

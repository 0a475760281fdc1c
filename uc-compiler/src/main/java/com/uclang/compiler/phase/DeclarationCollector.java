package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.analysis.func.UcFunction;
import com.uclang.compiler.analysis.func.UserFunction;
import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.analysis.types.UserType;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;

/**
 * 阶段 1：将结构体和函数声明登记到全局环境。
 *
 * <p>重复的名称报告重定义后，该声明得到一个不登记的独立类型/函数对象，
 * 后续阶段仍可检查它的内部。已登记过的声明不再处理。</p>
 */
public final class DeclarationCollector extends AstTraversal<PhaseContext> {

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        if (node.isTypeRegistered()) {
            return null;
        }
        GlobalEnv env = ctx.getGlobalEnv();
        UcType type = env.addType(ctx.getPhase(), node.getLocation(), node.getName(), node);
        if (type instanceof UserType && ((UserType) type).getDecl() == node) {
            node.setType((UserType) type);
        } else {
            node.setType(new UserType(node.getName(), node));
        }
        // 声明内部没有可登记的东西
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        if (node.isFunctionRegistered()) {
            return null;
        }
        GlobalEnv env = ctx.getGlobalEnv();
        UcFunction function = env.addFunction(ctx.getPhase(), node.getLocation(), node.getName(), node);
        if (function instanceof UserFunction && ((UserFunction) function).getDecl() == node) {
            node.setFunction((UserFunction) function);
        } else {
            node.setFunction(new UserFunction(node.getName(), node));
        }
        return null;
    }
}

package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.analysis.types.PrimitiveType;
import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.Parameter;
import com.uclang.compiler.ast.decl.VarDecl;
import com.uclang.compiler.ast.expr.NewArrayExpr;
import com.uclang.compiler.ast.expr.NewExpr;
import com.uclang.compiler.ast.type.ArrayTypeName;
import com.uclang.compiler.ast.type.SimpleTypeName;

import java.util.ArrayList;
import java.util.List;

/**
 * 阶段 2：把类型名解析为类型，补全函数签名，给分配表达式赋名义类型。
 */
public final class TypeNameResolver extends AstTraversal<PhaseContext> {

    @Override
    public Void visitSimpleTypeName(SimpleTypeName node, PhaseContext ctx) {
        if (UcTypes.VOID.getName().equals(node.getName()) && !ctx.isReturnPosition()) {
            ctx.error(node.getLocation(), "void can only be used as return type");
        }
        node.setType(ctx.getGlobalEnv().lookupType(ctx.getPhase(), node.getLocation(), node.getName()));
        return null;
    }

    /** 元素类型不算返回类型位置，void[] 总是错误 */
    @Override
    public Void visitArrayTypeName(ArrayTypeName node, PhaseContext ctx) {
        visit(node.getElementType(), ctx.withReturnPosition(false));
        node.setType(node.getElementType().getType().getArrayType());
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        visit(node.getReturnType(), ctx.withReturnPosition(true));
        node.getFunction().setReturnType(node.getReturnType().getType());

        List<UcType> paramTypes = new ArrayList<UcType>();
        for (Parameter param : node.getParams()) {
            visit(param, ctx);
            paramTypes.add(param.getType().getType());
        }
        node.getFunction().setParamTypes(paramTypes);

        for (VarDecl local : node.getLocals()) {
            visit(local, ctx);
        }
        visit(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitNewExpr(NewExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        UcType type = ctx.getGlobalEnv().lookupType(ctx.getPhase(), node.getLocation(), node.getTypeName());
        if (type instanceof PrimitiveType) {
            ctx.error(node.getLocation(), "simple allocations of primitives are not allowed");
        }
        node.setType(type);
        return null;
    }

    @Override
    public Void visitNewArrayExpr(NewArrayExpr node, PhaseContext ctx) {
        visitChildren(node, ctx);
        node.setType(node.getElementType().getType().getArrayType());
        return null;
    }
}

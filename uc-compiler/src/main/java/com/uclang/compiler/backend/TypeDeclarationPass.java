package com.uclang.compiler.backend;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;

/**
 * 第 1 遍：结构体前向声明
 */
final class TypeDeclarationPass extends AstTraversal<PhaseContext> {

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        ctx.line("struct " + node.getType().mangleDefinition() + ";");
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        return null;
    }
}

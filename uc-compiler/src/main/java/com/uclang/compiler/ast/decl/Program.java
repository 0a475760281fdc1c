package com.uclang.compiler.ast.decl;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 程序：按源码顺序排列的顶层声明
 */
public class Program extends AstNode {
    private final List<Declaration> declarations;

    public Program(SourceLocation location, List<Declaration> declarations) {
        super(location);
        this.declarations = declarations;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(declarations);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}

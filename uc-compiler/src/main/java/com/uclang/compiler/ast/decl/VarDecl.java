package com.uclang.compiler.ast.decl;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.type.TypeName;

import java.util.Collections;
import java.util.List;

/**
 * 字段或局部变量声明
 */
public class VarDecl extends AstNode {
    private final TypeName type;
    private final String name;

    public VarDecl(SourceLocation location, TypeName type, String name) {
        super(location);
        this.type = type;
        this.name = name;
    }

    public TypeName getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(type);
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}

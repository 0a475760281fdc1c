package com.uclang.compiler.ast.decl;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.type.TypeName;

import java.util.Collections;
import java.util.List;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final TypeName type;
    private final String name;

    public Parameter(SourceLocation location, TypeName type, String name) {
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
        return visitor.visitParameter(this, context);
    }
}

package com.uclang.compiler.ast.type;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 简单类型名（如 int, string, particle）
 */
public final class SimpleTypeName extends TypeName {
    private final String name;

    public SimpleTypeName(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSimpleTypeName(this, context);
    }
}

package com.uclang.compiler.ast.type;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组类型名（如 int[]）
 */
public final class ArrayTypeName extends TypeName {
    private final TypeName elementType;

    public ArrayTypeName(SourceLocation location, TypeName elementType) {
        super(location);
        this.elementType = elementType;
    }

    public TypeName getElementType() {
        return elementType;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elementType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayTypeName(this, context);
    }
}

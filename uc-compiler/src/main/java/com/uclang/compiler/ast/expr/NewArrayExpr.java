package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.type.TypeName;

import java.util.List;

/**
 * 数组分配：new T[]{args}，args 为初始元素
 */
public class NewArrayExpr extends Expression {
    private final TypeName elementType;
    private final List<Expression> args;

    public NewArrayExpr(SourceLocation location, TypeName elementType, List<Expression> args) {
        super(location);
        this.elementType = elementType;
        this.args = args;
    }

    public TypeName getElementType() {
        return elementType;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elementType, args);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNewArrayExpr(this, context);
    }
}

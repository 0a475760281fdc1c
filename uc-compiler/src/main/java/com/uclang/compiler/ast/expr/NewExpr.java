package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 对象分配：new T(args)
 */
public class NewExpr extends Expression {
    private final String typeName;
    private final List<Expression> args;

    public NewExpr(SourceLocation location, String typeName, List<Expression> args) {
        super(location);
        this.typeName = typeName;
        this.args = args;
    }

    public String getTypeName() {
        return typeName;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(args);
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(typeName);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNewExpr(this, context);
    }
}

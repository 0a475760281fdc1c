package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 赋值表达式：target = value
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(target, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}

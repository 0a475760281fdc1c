package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组下标：receiver[index]
 */
public class IndexExpr extends Expression {
    private final Expression receiver;
    private final Expression index;

    public IndexExpr(SourceLocation location, Expression receiver, Expression index) {
        super(location);
        this.receiver = receiver;
        this.index = index;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public boolean isLvalue() {
        return true;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(receiver, index);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}

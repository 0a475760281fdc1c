package com.uclang.compiler.ast.stmt;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * C 风格 For 语句。init、condition、update 均可省略。
 */
public class ForStmt extends Statement {
    private final Expression init;
    private final Expression condition;
    private final Expression update;
    private final Block body;

    public ForStmt(SourceLocation location, Expression init, Expression condition,
                   Expression update, Block body) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public Expression getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(init, condition, update, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}

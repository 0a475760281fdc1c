package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 一元前缀表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(operand);
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(operator.toSourceString());
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        PLUS("+"),
        MINUS("-"),
        NOT("!"),
        INCREMENT("++"),
        DECREMENT("--"),
        ID("#");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        /** 返回 uC 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isSign() {
            return this == PLUS || this == MINUS;
        }

        public boolean isIncrementOrDecrement() {
            return this == INCREMENT || this == DECREMENT;
        }
    }
}

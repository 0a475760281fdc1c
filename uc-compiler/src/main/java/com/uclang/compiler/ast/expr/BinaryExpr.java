package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 二元表达式（赋值见 {@link AssignExpr}）
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(left, right);
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(operator.toSourceString());
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+", Category.ARITHMETIC),
        SUB("-", Category.ARITHMETIC),
        MUL("*", Category.ARITHMETIC),
        DIV("/", Category.ARITHMETIC),
        MOD("%", Category.ARITHMETIC),

        // 逻辑
        OR("||", Category.LOGICAL),
        AND("&&", Category.LOGICAL),

        // 比较
        LT("<", Category.RELATIONAL),
        LE("<=", Category.RELATIONAL),
        GT(">", Category.RELATIONAL),
        GE(">=", Category.RELATIONAL),

        // 相等
        EQ("==", Category.EQUALITY),
        NE("!=", Category.EQUALITY),

        // 数组插入 / 取出
        PUSH("<<", Category.ARRAY),
        POP(">>", Category.ARRAY);

        private final String source;
        private final Category category;

        BinaryOp(String source, Category category) {
            this.source = source;
            this.category = category;
        }

        /** 返回 uC 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public Category getCategory() {
            return category;
        }
    }

    /**
     * 运算符分组，决定类型检查规则
     */
    public enum Category {
        ARITHMETIC,
        LOGICAL,
        RELATIONAL,
        EQUALITY,
        ARRAY
    }
}

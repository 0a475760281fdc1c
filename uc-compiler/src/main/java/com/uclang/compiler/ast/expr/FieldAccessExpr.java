package com.uclang.compiler.ast.expr;

import com.uclang.compiler.analysis.types.ArrayType;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 字段访问：receiver.field
 */
public class FieldAccessExpr extends Expression {
    /** 数组的内置伪字段 */
    public static final String LENGTH_FIELD = "length";

    private final Expression receiver;
    private final String fieldName;

    public FieldAccessExpr(SourceLocation location, Expression receiver, String fieldName) {
        super(location);
        this.receiver = receiver;
        this.fieldName = fieldName;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getFieldName() {
        return fieldName;
    }

    public boolean isLengthField() {
        return LENGTH_FIELD.equals(fieldName);
    }

    /** 数组的 length 不可赋值 */
    @Override
    public boolean isLvalue() {
        return !(receiver.peekType() instanceof ArrayType);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(receiver);
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(fieldName);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}

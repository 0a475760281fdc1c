package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 名称引用（字段、参数或局部变量）
 */
public class NameExpr extends Expression {
    private final String name;

    public NameExpr(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isLvalue() {
        return true;
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
        return visitor.visitNameExpr(this, context);
    }
}

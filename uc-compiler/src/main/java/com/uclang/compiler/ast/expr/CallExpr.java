package com.uclang.compiler.ast.expr;

import com.uclang.compiler.analysis.func.UcFunction;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final String name;
    private final List<Expression> args;

    // 阶段 3 解析
    private UcFunction function;

    public CallExpr(SourceLocation location, String name, List<Expression> args) {
        super(location);
        this.name = name;
        this.args = args;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public boolean isResolved() {
        return function != null;
    }

    public UcFunction getFunction() {
        if (function == null) {
            throw new IllegalStateException("call to " + name + " at " + location + " read before resolution");
        }
        return function;
    }

    public void setFunction(UcFunction function) {
        this.function = function;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(args);
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}

package com.uclang.compiler.ast.expr;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 字面量表达式。text 保留源码文本，代码生成时原样输出。
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final String text;

    public Literal(SourceLocation location, LiteralKind kind, String text) {
        super(location);
        this.kind = kind;
        this.text = text;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    /** 整数字面量以 l/L 结尾时为 long */
    public boolean hasLongSuffix() {
        if (kind != LiteralKind.INTEGER || text.isEmpty()) return false;
        char last = text.charAt(text.length() - 1);
        return last == 'l' || last == 'L';
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(text);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INTEGER,
        FLOAT,
        STRING,
        BOOLEAN,
        NULL
    }
}

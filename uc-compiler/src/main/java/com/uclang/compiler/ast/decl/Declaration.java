package com.uclang.compiler.ast.decl;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 顶层声明基类（结构体或函数）
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<String> getTerminals() {
        return Collections.singletonList(name);
    }
}

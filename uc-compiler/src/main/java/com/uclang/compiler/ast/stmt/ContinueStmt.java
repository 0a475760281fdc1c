package com.uclang.compiler.ast.stmt;

import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Continue 语句
 */
public class ContinueStmt extends Statement {

    public ContinueStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }
}

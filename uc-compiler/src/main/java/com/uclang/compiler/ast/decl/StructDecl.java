package com.uclang.compiler.ast.decl;

import com.uclang.compiler.analysis.VarEnv;
import com.uclang.compiler.analysis.types.UserType;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 结构体声明
 */
public class StructDecl extends Declaration {
    private final List<VarDecl> fields;

    // 阶段 1 登记后填充
    private UserType type;
    // 阶段 4 建立的字段表
    private VarEnv localEnv;

    public StructDecl(SourceLocation location, String name, List<VarDecl> fields) {
        super(location, name);
        this.fields = fields;
    }

    public List<VarDecl> getFields() {
        return fields;
    }

    public boolean isTypeRegistered() {
        return type != null;
    }

    public UserType getType() {
        if (type == null) {
            throw new IllegalStateException("struct " + name + " has not been registered yet");
        }
        return type;
    }

    public void setType(UserType type) {
        this.type = type;
    }

    /** 阶段 4 之前为 null */
    public VarEnv getLocalEnv() {
        return localEnv;
    }

    public void setLocalEnv(VarEnv localEnv) {
        this.localEnv = localEnv;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(fields);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}

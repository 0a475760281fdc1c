package com.uclang.compiler.ast.decl;

import com.uclang.compiler.analysis.VarEnv;
import com.uclang.compiler.analysis.func.UserFunction;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.AstVisitor;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.stmt.Block;
import com.uclang.compiler.ast.type.TypeName;

import java.util.List;

/**
 * 函数声明
 */
public class FunctionDecl extends Declaration {
    private final TypeName returnType;
    private final List<Parameter> params;
    private final List<VarDecl> locals;
    private final Block body;

    // 阶段 1 登记，阶段 2 补全返回类型和参数类型
    private UserFunction function;
    // 阶段 4 建立的参数 + 局部变量表
    private VarEnv localEnv;

    public FunctionDecl(SourceLocation location, TypeName returnType, String name,
                        List<Parameter> params, List<VarDecl> locals, Block body) {
        super(location, name);
        this.returnType = returnType;
        this.params = params;
        this.locals = locals;
        this.body = body;
    }

    public TypeName getReturnType() {
        return returnType;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public List<VarDecl> getLocals() {
        return locals;
    }

    public Block getBody() {
        return body;
    }

    public boolean isFunctionRegistered() {
        return function != null;
    }

    public UserFunction getFunction() {
        if (function == null) {
            throw new IllegalStateException("function " + name + " has not been registered yet");
        }
        return function;
    }

    public void setFunction(UserFunction function) {
        this.function = function;
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
        return childrenOf(returnType, params, locals, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}

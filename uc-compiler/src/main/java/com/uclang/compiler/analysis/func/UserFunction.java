package com.uclang.compiler.analysis.func;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.decl.FunctionDecl;

import java.util.List;

/**
 * 用户定义的函数。阶段 1 登记名称，阶段 2 补全返回类型与参数类型。
 */
public final class UserFunction extends UcFunction {

    private final FunctionDecl decl;

    public UserFunction(String name, FunctionDecl decl) {
        super(name);
        this.decl = decl;
    }

    public FunctionDecl getDecl() {
        return decl;
    }

    public void setReturnType(UcType returnType) {
        this.returnType = returnType;
    }

    /** 替换参数类型列表（重复执行阶段 2 不会累积） */
    public void setParamTypes(List<UcType> types) {
        paramTypes.clear();
        paramTypes.addAll(types);
    }
}

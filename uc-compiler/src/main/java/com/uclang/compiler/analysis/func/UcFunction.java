package com.uclang.compiler.analysis.func;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * uC 函数：名称、返回类型、有序参数类型
 */
public abstract class UcFunction {

    protected final String name;
    protected UcType returnType;
    protected final List<UcType> paramTypes = new ArrayList<UcType>();

    protected UcFunction(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** 用户函数在阶段 2 之前为 null */
    public UcType getReturnType() {
        return returnType;
    }

    public List<UcType> getParamTypes() {
        return Collections.unmodifiableList(paramTypes);
    }

    public String mangle() {
        return "UC_FUNCTION(" + name + ")";
    }

    /**
     * 检查调用参数，参数类型须已计算。
     * 个数不符时只报告一次，不再逐个检查参数。
     */
    public void checkArgs(int phase, SourceLocation location, List<Expression> args, GlobalEnv env) {
        if (args.size() != paramTypes.size()) {
            env.error(phase, location, "function " + name + " expected " + paramTypes.size()
                    + " argument(s), but got " + args.size());
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            UcType argType = args.get(i).getType();
            UcType paramType = paramTypes.get(i);
            if (!UcTypes.isCompatible(argType, paramType)) {
                env.error(phase, location, "type " + argType
                        + " of argument is not compatible with parameter of type " + paramType);
            }
        }
    }

    @Override
    public String toString() {
        return name;
    }
}

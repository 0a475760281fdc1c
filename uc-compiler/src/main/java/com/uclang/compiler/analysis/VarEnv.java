package com.uclang.compiler.analysis;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.SourceLocation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 局部环境：一个结构体的字段，或一个函数的参数与局部变量。
 *
 * <p>只有一层，没有块级作用域。阶段 4 写入，之后只读。</p>
 */
public final class VarEnv {

    public enum VarKind {
        FIELD("field"),
        VARIABLE("variable"),
        PARAMETER("parameter");

        private final String label;

        VarKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final GlobalEnv globalEnv;
    private final Map<String, UcType> varTypes = new LinkedHashMap<String, UcType>();

    public VarEnv(GlobalEnv globalEnv) {
        this.globalEnv = globalEnv;
    }

    /** 绑定名称。本环境中已存在同名绑定时报告重声明，保留原绑定。 */
    public void addVariable(int phase, SourceLocation location, String name, UcType type, VarKind kind) {
        if (varTypes.containsKey(name)) {
            globalEnv.report(phase, location, ErrorKind.REDEFINITION,
                    "redeclaration of " + kind.getLabel() + " " + name);
            return;
        }
        varTypes.put(name, type);
    }

    public boolean contains(String name) {
        return varTypes.containsKey(name);
    }

    /** 未定义时报告诊断并返回 int */
    public UcType getType(int phase, SourceLocation location, String name) {
        UcType type = varTypes.get(name);
        if (type == null) {
            globalEnv.report(phase, location, ErrorKind.UNDEFINED_NAME, "undefined variable " + name);
            return globalEnv.lookupType(phase, location, "int");
        }
        return type;
    }

    public int size() {
        return varTypes.size();
    }
}

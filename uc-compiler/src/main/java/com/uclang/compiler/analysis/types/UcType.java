package com.uclang.compiler.analysis.types;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * uC 类型基类：原始类型、数组类型、用户结构体类型。
 *
 * <p>类型按身份比较。原始类型在 {@link UcTypes} 中是单例，数组类型由元素类型缓存，
 * 用户类型在一次编译中由 {@code GlobalEnv} 唯一登记。</p>
 */
public abstract class UcType {

    protected final String name;
    // 延迟创建，保证 T[] 对同一个 T 只有一个实例
    private ArrayType arrayType;

    protected UcType(String name) {
        this.name = name;
    }

    /** 诊断消息中使用的类型名（数组为 "T[]"） */
    public String getName() {
        return name;
    }

    /** 生成代码中引用该类型的名字 */
    public abstract String mangle();

    /** 以该类型为元素的数组类型 */
    public ArrayType getArrayType() {
        if (arrayType == null) {
            arrayType = new ArrayType(this);
        }
        return arrayType;
    }

    /**
     * 查找字段类型。字段不存在时报告诊断并返回 int。
     */
    public UcType lookupField(int phase, SourceLocation location, String fieldName, GlobalEnv env) {
        env.error(phase, location, "type " + name + " has no field " + fieldName);
        return UcTypes.INT;
    }

    /**
     * 检查分配表达式（new）的参数，参数类型须已计算。
     */
    public abstract void checkArgs(int phase, SourceLocation location, List<Expression> args, GlobalEnv env);

    @Override
    public String toString() {
        return name;
    }
}

package com.uclang.compiler.analysis.func;

import com.uclang.compiler.analysis.types.UcType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.uclang.compiler.analysis.types.UcTypes.*;

/**
 * 内置函数表：类型转换、字符串与数值函数、输入输出
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {}

    /** 失败查找时替代的默认函数名 */
    public static final String RECOVERY_FUNCTION = "string_to_int";

    private static final List<PrimitiveFunction> ALL = Collections.unmodifiableList(create());

    public static List<PrimitiveFunction> all() {
        return ALL;
    }

    private static List<PrimitiveFunction> create() {
        List<PrimitiveFunction> result = new ArrayList<PrimitiveFunction>();

        // S_to_T 转换，{int, long, float, string} 中任意两个不同类型
        List<UcType> convertible = Arrays.<UcType>asList(INT, LONG, FLOAT, STRING);
        for (UcType target : convertible) {
            for (UcType source : convertible) {
                if (source != target) {
                    result.add(conversion(source, target));
                }
            }
        }
        result.add(conversion(STRING, BOOLEAN));
        result.add(conversion(BOOLEAN, STRING));

        // 字符串
        result.add(new PrimitiveFunction("length", INT, STRING));
        result.add(new PrimitiveFunction("substr", STRING, STRING, INT, INT));
        result.add(new PrimitiveFunction("ordinal", INT, STRING));
        result.add(new PrimitiveFunction("character", STRING, INT));

        // 数值
        result.add(new PrimitiveFunction("pow", FLOAT, FLOAT, FLOAT));
        result.add(new PrimitiveFunction("sqrt", FLOAT, FLOAT));
        result.add(new PrimitiveFunction("ceil", FLOAT, FLOAT));
        result.add(new PrimitiveFunction("floor", FLOAT, FLOAT));

        // 输出
        result.add(new PrimitiveFunction("print", VOID, STRING));
        result.add(new PrimitiveFunction("println", VOID, STRING));

        // 输入
        result.add(new PrimitiveFunction("peekchar", STRING));
        result.add(new PrimitiveFunction("readchar", STRING));
        result.add(new PrimitiveFunction("readline", STRING));
        return result;
    }

    private static PrimitiveFunction conversion(UcType source, UcType target) {
        return new PrimitiveFunction(source.getName() + "_to_" + target.getName(), target, source);
    }
}

package com.uclang.compiler.analysis.types;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 内置类型常量和类型规则（数值分类、隐式转换、合并）。
 */
public final class UcTypes {

    private UcTypes() {}

    public static final PrimitiveType INT = new PrimitiveType("int");
    public static final PrimitiveType LONG = new PrimitiveType("long");
    public static final PrimitiveType FLOAT = new PrimitiveType("float");
    public static final PrimitiveType STRING = new PrimitiveType("string");
    public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean");
    public static final PrimitiveType VOID = new PrimitiveType("void");
    // null 字面量的类型
    public static final PrimitiveType NULL = new PrimitiveType("null");

    private static final List<PrimitiveType> BUILTINS = Collections.unmodifiableList(
            Arrays.asList(INT, LONG, FLOAT, STRING, BOOLEAN, VOID, NULL));

    /** 全局环境预置的原始类型，按固定顺序 */
    public static List<PrimitiveType> builtinTypes() {
        return BUILTINS;
    }

    public static boolean isNumeric(UcType type) {
        return type == INT || type == LONG || type == FLOAT;
    }

    public static boolean isIntegral(UcType type) {
        return type == INT || type == LONG;
    }

    /** 引用类型：用户类型或数组，可以为 null */
    public static boolean isReference(UcType type) {
        return type instanceof UserType || type instanceof ArrayType;
    }

    /**
     * from 类型的值能否隐式转换为 to 类型。
     * 规则：相同类型；int → long；int → float；long → float；null → 任意引用类型。
     */
    public static boolean isCompatible(UcType from, UcType to) {
        if (from == to) return true;
        if (from == INT) return to == LONG || to == FLOAT;
        if (from == LONG) return to == FLOAT;
        if (from == NULL) return isReference(to);
        return false;
    }

    /**
     * 二元算术运算的结果类型：能被另一方接受的那一方转换为另一方。
     * 两个方向都不兼容时报告诊断并返回 int。
     */
    public static UcType join(int phase, SourceLocation location, UcType a, UcType b, GlobalEnv env) {
        if (isCompatible(a, b)) return b;
        if (isCompatible(b, a)) return a;
        env.error(phase, location, "cannot join types " + a + " and " + b);
        return INT;
    }
}

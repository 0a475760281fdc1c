package com.uclang.compiler.analysis;

import com.uclang.compiler.analysis.func.BuiltinFunctions;
import com.uclang.compiler.analysis.func.PrimitiveFunction;
import com.uclang.compiler.analysis.func.UcFunction;
import com.uclang.compiler.analysis.func.UserFunction;
import com.uclang.compiler.analysis.types.PrimitiveType;
import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.analysis.types.UserType;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 全局环境：程序范围的类型表和函数表，构造时预置内置类型与内置函数。
 *
 * <p>同时持有本次编译的诊断接收端，各阶段经由它报告错误。
 * 类型表只在阶段 1 写入，函数签名在阶段 2 补全，之后只读。</p>
 */
public final class GlobalEnv {

    private final DiagnosticSink sink;
    private final Map<String, UcType> types = new LinkedHashMap<String, UcType>();
    private final Map<String, UcFunction> functions = new LinkedHashMap<String, UcFunction>();

    public GlobalEnv(DiagnosticSink sink) {
        this.sink = sink;
        for (PrimitiveType type : UcTypes.builtinTypes()) {
            types.put(type.getName(), type);
        }
        for (PrimitiveFunction function : BuiltinFunctions.all()) {
            functions.put(function.getName(), function);
        }
    }

    // ============ 诊断 ============

    public void report(int phase, SourceLocation location, ErrorKind kind, String message) {
        sink.report(phase, location, kind, message);
    }

    /** 报告类型错误 */
    public void error(int phase, SourceLocation location, String message) {
        sink.report(phase, location, ErrorKind.TYPE, message);
    }

    // ============ 类型 ============

    /**
     * 登记用户类型。名称已存在时报告重定义并返回已有类型。
     */
    public UcType addType(int phase, SourceLocation location, String name, StructDecl decl) {
        UcType existing = types.get(name);
        if (existing != null) {
            report(phase, location, ErrorKind.REDEFINITION, "redefinition of type " + name);
            return existing;
        }
        UserType type = new UserType(name, decl);
        types.put(name, type);
        return type;
    }

    /** 严格查找：未定义时报告诊断并返回 int */
    public UcType lookupType(int phase, SourceLocation location, String name) {
        return lookupType(phase, location, name, true);
    }

    /**
     * 查找类型。未定义时，strict 为 true 报告诊断并返回 int，否则静默返回 null。
     */
    public UcType lookupType(int phase, SourceLocation location, String name, boolean strict) {
        UcType type = types.get(name);
        if (type == null && strict) {
            report(phase, location, ErrorKind.UNDEFINED_NAME, "undefined type " + name);
            return UcTypes.INT;
        }
        return type;
    }

    // ============ 函数 ============

    /**
     * 登记用户函数。名称已存在（含内置函数）时报告重定义并返回已有函数。
     */
    public UcFunction addFunction(int phase, SourceLocation location, String name, FunctionDecl decl) {
        UcFunction existing = functions.get(name);
        if (existing != null) {
            report(phase, location, ErrorKind.REDEFINITION, "redefinition of function " + name);
            return existing;
        }
        UserFunction function = new UserFunction(name, decl);
        functions.put(name, function);
        return function;
    }

    /** 严格查找：未定义时报告诊断并返回 string_to_int */
    public UcFunction lookupFunction(int phase, SourceLocation location, String name) {
        return lookupFunction(phase, location, name, true);
    }

    public UcFunction lookupFunction(int phase, SourceLocation location, String name, boolean strict) {
        UcFunction function = functions.get(name);
        if (function == null && strict) {
            report(phase, location, ErrorKind.UNDEFINED_NAME, "undefined function " + name);
            return functions.get(BuiltinFunctions.RECOVERY_FUNCTION);
        }
        return function;
    }

    // ============ 查询 ============

    /** 已登记的类型名，按登记顺序 */
    public List<String> getTypeNames() {
        return new ArrayList<String>(types.keySet());
    }

    public List<String> getFunctionNames() {
        return new ArrayList<String>(functions.keySet());
    }
}

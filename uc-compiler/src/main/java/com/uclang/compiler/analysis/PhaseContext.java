package com.uclang.compiler.analysis;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.backend.CodeBuffer;

/**
 * 阶段上下文：阶段编号、全局环境、输出缓冲区、缩进层级，以及子树继承的属性
 * （局部环境、期望返回类型、是否在循环内、是否在返回类型位置）。
 *
 * <p>不可变。进入子作用域时用 {@code withXxx} 构造新上下文，兄弟子树互不影响。</p>
 */
public final class PhaseContext {

    private final int phase;
    private final GlobalEnv globalEnv;
    private final CodeBuffer out;
    private final int indentLevel;
    private final VarEnv localEnv;
    private final UcType returnType;
    private final boolean inLoop;
    private final boolean returnPosition;

    private PhaseContext(int phase, GlobalEnv globalEnv, CodeBuffer out, int indentLevel,
                         VarEnv localEnv, UcType returnType, boolean inLoop, boolean returnPosition) {
        this.phase = phase;
        this.globalEnv = globalEnv;
        this.out = out;
        this.indentLevel = indentLevel;
        this.localEnv = localEnv;
        this.returnType = returnType;
        this.inLoop = inLoop;
        this.returnPosition = returnPosition;
    }

    /** 分析阶段的初始上下文（无输出） */
    public static PhaseContext forPhase(int phase, GlobalEnv globalEnv) {
        return new PhaseContext(phase, globalEnv, null, 0, null, null, false, false);
    }

    /** 代码生成的初始上下文，顶层声明位于 namespace 内一级缩进 */
    public static PhaseContext forBackend(int pass, GlobalEnv globalEnv, CodeBuffer out) {
        return new PhaseContext(pass, globalEnv, out, 1, null, null, false, false);
    }

    public int getPhase() { return phase; }
    public GlobalEnv getGlobalEnv() { return globalEnv; }
    public int getIndentLevel() { return indentLevel; }
    public UcType getReturnType() { return returnType; }
    public boolean isInLoop() { return inLoop; }
    public boolean isReturnPosition() { return returnPosition; }

    public CodeBuffer getOut() {
        if (out == null) {
            throw new IllegalStateException("phase " + phase + " has no output buffer");
        }
        return out;
    }

    public VarEnv getLocalEnv() {
        if (localEnv == null) {
            throw new IllegalStateException("no local environment outside struct or function");
        }
        return localEnv;
    }

    // ============ 派生 ============

    public PhaseContext withLocalEnv(VarEnv env) {
        return new PhaseContext(phase, globalEnv, out, indentLevel, env, returnType, inLoop, returnPosition);
    }

    public PhaseContext withReturnType(UcType type) {
        return new PhaseContext(phase, globalEnv, out, indentLevel, localEnv, type, inLoop, returnPosition);
    }

    public PhaseContext withInLoop(boolean loop) {
        return new PhaseContext(phase, globalEnv, out, indentLevel, localEnv, returnType, loop, returnPosition);
    }

    public PhaseContext withReturnPosition(boolean position) {
        return new PhaseContext(phase, globalEnv, out, indentLevel, localEnv, returnType, inLoop, position);
    }

    /** 缩进加一级 */
    public PhaseContext indented() {
        return new PhaseContext(phase, globalEnv, out, indentLevel + 1, localEnv, returnType, inLoop,
                returnPosition);
    }

    // ============ 便捷方法 ============

    /** 以当前阶段编号报告诊断 */
    public void report(SourceLocation location, ErrorKind kind, String message) {
        globalEnv.report(phase, location, kind, message);
    }

    /** 以当前阶段编号报告类型错误 */
    public void error(SourceLocation location, String message) {
        globalEnv.error(phase, location, message);
    }

    /** 按当前缩进写入一行 */
    public void line(String text) {
        getOut().line(indentLevel, text);
    }
}

package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.Program;

/**
 * 前端分析阶段，按声明顺序执行。每个阶段是一次完整的树遍历。
 */
public enum Phase {
    FIND_DECLS(1, "declaration collection"),
    RESOLVE_TYPES(2, "type resolution"),
    RESOLVE_CALLS(3, "call resolution"),
    CHECK_NAMES(4, "name checking"),
    BASIC_CONTROL(5, "basic control flow"),
    ADVANCED_CONTROL(5, "advanced control flow"),
    TYPE_CHECK(6, "type checking");

    /** 最后一个阶段的编号 */
    public static final int LAST = 6;

    private final int number;
    private final String description;

    Phase(int number, String description) {
        this.number = number;
        this.description = description;
    }

    /** 诊断中使用的阶段编号（两个控制流检查共用 5） */
    public int getNumber() {
        return number;
    }

    public String getDescription() {
        return description;
    }

    /** 每次调用创建新的遍历器 */
    public AstTraversal<PhaseContext> newPass() {
        switch (this) {
            case FIND_DECLS: return new DeclarationCollector();
            case RESOLVE_TYPES: return new TypeNameResolver();
            case RESOLVE_CALLS: return new CallResolver();
            case CHECK_NAMES: return new NameChecker();
            case BASIC_CONTROL: return new BasicControlChecker();
            case ADVANCED_CONTROL: return new AdvancedControlChecker();
            case TYPE_CHECK: return new TypeChecker();
            default: throw new IllegalStateException("unknown phase " + this);
        }
    }

    /** 在 program 上执行本阶段 */
    public void run(Program program, GlobalEnv env) {
        program.accept(newPass(), PhaseContext.forPhase(number, env));
    }
}

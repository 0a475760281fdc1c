package com.uclang.compiler.compiler;

import com.uclang.compiler.backend.CppBackend;
import com.uclang.compiler.phase.Phase;

/**
 * 编译选项
 */
public class CompilerOptions {
    private String sourceName = "<input>";
    private int frontendPhase = Phase.LAST;
    // null 表示完整输出（含头部和尾部）
    private Integer backendPhase = null;
    private boolean generateCode = true;
    private boolean dumpTypes = false;
    private boolean dumpGraph = false;

    public CompilerOptions() {
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        if (sourceName == null) {
            throw new IllegalArgumentException("sourceName must not be null");
        }
        this.sourceName = sourceName;
    }

    public int getFrontendPhase() {
        return frontendPhase;
    }

    /**
     * 最后执行的分析阶段（1..6），5 同时包含两遍控制流检查
     */
    public void setFrontendPhase(int frontendPhase) {
        if (frontendPhase < 1 || frontendPhase > Phase.LAST) {
            throw new IllegalArgumentException("frontend phase must be between 1 and " + Phase.LAST
                    + ", got " + frontendPhase);
        }
        this.frontendPhase = frontendPhase;
    }

    public Integer getBackendPhase() {
        return backendPhase;
    }

    /**
     * 只生成第 1..N 遍且不带头尾（null 恢复完整输出）
     */
    public void setBackendPhase(Integer backendPhase) {
        if (backendPhase != null && (backendPhase < 1 || backendPhase > CppBackend.PASS_COUNT)) {
            throw new IllegalArgumentException("backend phase must be between 1 and " + CppBackend.PASS_COUNT
                    + ", got " + backendPhase);
        }
        this.backendPhase = backendPhase;
    }

    public boolean isGenerateCode() {
        return generateCode;
    }

    public void setGenerateCode(boolean generateCode) {
        this.generateCode = generateCode;
    }

    public boolean isDumpTypes() {
        return dumpTypes;
    }

    public void setDumpTypes(boolean dumpTypes) {
        this.dumpTypes = dumpTypes;
    }

    public boolean isDumpGraph() {
        return dumpGraph;
    }

    public void setDumpGraph(boolean dumpGraph) {
        this.dumpGraph = dumpGraph;
    }
}

package com.uclang.compiler.compiler;

import com.uclang.compiler.analysis.Diagnostic;
import com.uclang.compiler.analysis.GlobalEnv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译的结果。未生成的输出为 null。
 */
public final class CompilationResult {

    private final List<Diagnostic> diagnostics;
    private final GlobalEnv globalEnv;
    private final String code;
    private final String typeDump;
    private final String graphDump;

    public CompilationResult(List<Diagnostic> diagnostics, GlobalEnv globalEnv, String code,
                             String typeDump, String graphDump) {
        this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
        this.globalEnv = globalEnv;
        this.code = code;
        this.typeDump = typeDump;
        this.graphDump = graphDump;
    }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public GlobalEnv getGlobalEnv() { return globalEnv; }
    public String getCode() { return code; }
    public String getTypeDump() { return typeDump; }
    public String getGraphDump() { return graphDump; }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public boolean hasCode() {
        return code != null;
    }

    /** 每条诊断一行，格式同 {@link Diagnostic#format()} */
    public String formatDiagnostics() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d.format()).append('\n');
        }
        return sb.toString();
    }
}

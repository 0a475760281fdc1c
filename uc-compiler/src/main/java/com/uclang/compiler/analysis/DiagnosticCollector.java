package com.uclang.compiler.analysis;

import com.uclang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 按报告顺序收集诊断
 */
public final class DiagnosticCollector implements DiagnosticSink {

    private static final Logger LOG = Logger.getLogger(DiagnosticCollector.class.getName());

    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

    @Override
    public void report(int phase, SourceLocation location, ErrorKind kind, String message) {
        Diagnostic diagnostic = new Diagnostic(phase, location, kind, message);
        LOG.fine(diagnostic.format());
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** 指定阶段报告的诊断 */
    public List<Diagnostic> forPhase(int phase) {
        List<Diagnostic> result = new ArrayList<Diagnostic>();
        for (Diagnostic d : diagnostics) {
            if (d.getPhase() == phase) result.add(d);
        }
        return result;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }
}

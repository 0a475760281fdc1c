package com.uclang.compiler.analysis;

import com.uclang.compiler.ast.SourceLocation;

/**
 * 编译诊断条目
 */
public final class Diagnostic {

    private final int phase;
    private final SourceLocation location;
    private final ErrorKind kind;
    private final String message;

    public Diagnostic(int phase, SourceLocation location, ErrorKind kind, String message) {
        this.phase = phase;
        this.location = location;
        this.kind = kind;
        this.message = message;
    }

    public int getPhase() { return phase; }
    public SourceLocation getLocation() { return location; }
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }

    /** 格式：Error (PHASE) at line LINE: MESSAGE */
    public String format() {
        return "Error (" + phase + ") at line " + location.getLine() + ": " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}

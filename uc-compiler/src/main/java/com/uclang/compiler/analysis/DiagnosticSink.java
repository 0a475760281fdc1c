package com.uclang.compiler.analysis;

import com.uclang.compiler.ast.SourceLocation;

/**
 * 诊断接收端。实现不得抛出异常，调用方报告后继续遍历。
 */
public interface DiagnosticSink {

    void report(int phase, SourceLocation location, ErrorKind kind, String message);
}

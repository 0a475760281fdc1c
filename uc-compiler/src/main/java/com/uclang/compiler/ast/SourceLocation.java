package com.uclang.compiler.ast;

/**
 * 源码位置信息
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public SourceLocation(String file, int line, int column) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
    }

    /** 仅有行号的位置（上游解析器只提供行号时使用） */
    public static SourceLocation atLine(int line) {
        return new SourceLocation(null, line, 0);
    }

    public String getFile() {
        return file;
    }

    /** 1 起始的行号 */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        if (file == null) {
            return "line " + line;
        }
        return file + ":" + line + ":" + column;
    }
}

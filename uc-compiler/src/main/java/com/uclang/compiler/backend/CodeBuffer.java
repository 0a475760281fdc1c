package com.uclang.compiler.backend;

/**
 * 代码输出缓冲区。缩进层级由调用方给出，每级两个空格。
 */
public class CodeBuffer {
    public static final String INDENT_UNIT = "  ";

    private final StringBuilder output = new StringBuilder();

    private void indent(int level) {
        for (int i = 0; i < level; i++) {
            output.append(INDENT_UNIT);
        }
    }

    /** 缩进后写入一整行 */
    public void line(int level, String text) {
        indent(level);
        output.append(text).append('\n');
    }

    /** 写入不缩进的一行 */
    public void line(String text) {
        line(0, text);
    }

    /** 追加空行 */
    public void blankLine() {
        output.append('\n');
    }

    public String getOutput() {
        return output.toString();
    }

    @Override
    public String toString() {
        return output.toString();
    }
}

package com.uclang.compiler.backend;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.Program;

/**
 * C++ 后端：固定头部、四遍生成、固定尾部。
 *
 * <p>只能作用于没有任何诊断的树，调用方负责保证。</p>
 */
public final class CppBackend {

    public static final int PASS_COUNT = 4;

    private final GlobalEnv globalEnv;

    public CppBackend(GlobalEnv globalEnv) {
        this.globalEnv = globalEnv;
    }

    /** 完整翻译单元 */
    public String generate(Program program) {
        return generate(program, PASS_COUNT, true);
    }

    /**
     * 生成第 1 至 lastPass 遍。wrap 为 false 时省略头部和尾部，
     * 输出片段可以直接 #include 到 namespace uc 内。
     */
    public String generate(Program program, int lastPass, boolean wrap) {
        if (lastPass < 1 || lastPass > PASS_COUNT) {
            throw new IllegalArgumentException("backend pass must be between 1 and " + PASS_COUNT
                    + ", got " + lastPass);
        }
        CodeBuffer out = new CodeBuffer();
        if (wrap) {
            writeHeader(out);
        }
        for (int pass = 1; pass <= lastPass; pass++) {
            runPass(pass, program, out);
        }
        if (wrap) {
            writeFooter(out);
        }
        return out.getOutput();
    }

    private void runPass(int pass, Program program, CodeBuffer out) {
        PhaseContext ctx = PhaseContext.forBackend(pass, globalEnv, out);
        AstTraversal<PhaseContext> visitor;
        String title;
        switch (pass) {
            case 1:
                visitor = new TypeDeclarationPass();
                title = "// Forward type declarations";
                break;
            case 2:
                visitor = new FunctionDeclarationPass();
                title = "// Forward function declarations";
                break;
            case 3:
                visitor = new TypeDefinitionPass();
                title = "// Full type definitions";
                break;
            default:
                visitor = new FunctionDefinitionPass();
                title = "// Full function definitions";
                break;
        }
        ctx.line(title);
        out.blankLine();
        program.accept(visitor, ctx);
        // 前向声明段落之后空一行，定义段落自带间隔
        if (pass <= 2) {
            out.blankLine();
        }
    }

    static void writeHeader(CodeBuffer out) {
        out.line("#include \"defs.h\"");
        out.line("#include \"ref.h\"");
        out.line("#include \"array.h\"");
        out.line("#include \"library.h\"");
        out.line("#include \"expr.h\"");
        out.blankLine();
        out.line("namespace uc {");
        out.blankLine();
    }

    static void writeFooter(CodeBuffer out) {
        out.line("} // namespace uc");
        out.blankLine();
        out.line("int main(int argc, char **argv) {");
        out.line(1, "uc::UC_ARRAY(uc::UC_PRIMITIVE(string)) args = "
                + "uc::uc_make_array_of<uc::UC_PRIMITIVE(string)>();");
        out.line(1, "for (int i = 1; i < argc; i++) {");
        out.line(2, "uc::uc_array_push(args, uc::UC_PRIMITIVE(string)(argv[i]));");
        out.line(1, "}");
        out.line(1, "uc::UC_FUNCTION(main)(args);");
        out.line(1, "return 0;");
        out.line("}");
    }
}

package com.uclang.compiler.compiler;

import com.uclang.compiler.analysis.DiagnosticCollector;
import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.AstBuilder;
import com.uclang.compiler.ast.decl.Program;
import com.uclang.compiler.ast.decl.VarDecl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static com.uclang.compiler.ast.expr.BinaryExpr.BinaryOp.ADD;
import static org.assertj.core.api.Assertions.*;

@DisplayName("UcCompiler 测试")
class UcCompilerTest {

    private AstBuilder b;
    private CompilerOptions options;

    @BeforeEach
    void setUp() {
        b = new AstBuilder("hello.uc");
        options = new CompilerOptions();
        options.setSourceName("hello.uc");
    }

    /** void main(string[] args) { println("hello " + args.length); } */
    private Program hello() {
        return b.program(b.function(b.type("void"), "main",
                AstBuilder.list(b.param(b.arrayOf("string"), "args")),
                new ArrayList<VarDecl>(),
                b.block(b.exprStmt(b.call("println",
                        b.binary(b.str("hello "), ADD, b.fieldAccess(b.name("args"), "length")))))));
    }

    /** 三个相互独立的错误，分别属于阶段 1、5、6 */
    private Program broken() {
        return b.program(
                b.at(1).struct("A"),
                b.at(2).struct("A"),
                b.at(3).function("void", "main",
                        b.at(4).breakStmt(),
                        b.at(5).exprStmt(b.binary(b.bool(true), ADD, b.integer(1)))));
    }

    @Nested
    @DisplayName("成功编译")
    class Success {

        @Test
        @DisplayName("默认选项生成完整代码")
        void fullOutput() {
            CompilationResult result = new UcCompiler(options).compile(hello());

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.hasCode()).isTrue();
            assertThat(result.getCode())
                    .startsWith("#include \"defs.h\"\n")
                    .contains("      UC_FUNCTION(println)(uc_add(\"hello \"s, uc_length_field(UC_VAR(args))));\n")
                    .endsWith("  return 0;\n}\n");
            assertThat(result.getTypeDump()).isNull();
            assertThat(result.getGraphDump()).isNull();
            assertThat(result.formatDiagnostics()).isEmpty();
        }

        @Test
        @DisplayName("指定后端遍数时输出片段")
        void backendFragment() {
            options.setBackendPhase(2);
            CompilationResult result = new UcCompiler(options).compile(hello());

            assertThat(result.getCode()).isEqualTo(
                    "  // Forward type declarations\n\n\n"
                            + "  // Forward function declarations\n\n"
                            + "  UC_PRIMITIVE(void)\n"
                            + "    UC_FUNCTION(main)(UC_ARRAY(UC_PRIMITIVE(string)) UC_VAR(args));\n\n");
        }

        @Test
        @DisplayName("关闭代码生成")
        void noCodegen() {
            options.setGenerateCode(false);
            CompilationResult result = new UcCompiler(options).compile(hello());
            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getCode()).isNull();
        }

        @Test
        @DisplayName("输出类型标注和图形")
        void dumps() {
            options.setDumpTypes(true);
            options.setDumpGraph(true);
            CompilationResult result = new UcCompiler(options).compile(hello());

            assertThat(result.getTypeDump()).startsWith("Program {\n").contains("FieldAccessExpr: int {");
            assertThat(result.getGraphDump()).startsWith("digraph {\n").contains("(string[])");
        }

        @Test
        @DisplayName("全局环境包含用户函数")
        void globalEnv() {
            CompilationResult result = new UcCompiler().compile(hello());
            assertThat(result.getGlobalEnv().getFunctionNames()).contains("main", "println");
        }
    }

    @Nested
    @DisplayName("存在错误")
    class Failure {

        @Test
        @DisplayName("一次编译报告所有阶段的错误，不生成代码")
        void reportsEverything() {
            CompilationResult result = new UcCompiler(options).compile(broken());

            assertThat(result.hasErrors()).isTrue();
            assertThat(result.hasCode()).isFalse();
            assertThat(result.formatDiagnostics()).isEqualTo(
                    "Error (1) at line 2: redefinition of type A\n"
                            + "Error (5) at line 4: break statement must occur within a loop\n"
                            + "Error (6) at line 5: lhs operand is of type boolean, so rhs operand must be of type string\n");
        }

        @Test
        @DisplayName("前端阶段限制只执行前几个阶段")
        void frontendPhaseLimit() {
            options.setFrontendPhase(4);
            CompilationResult result = new UcCompiler(options).compile(broken());

            assertThat(result.getDiagnostics()).extracting("phase").containsExactly(1);
            assertThat(result.getCode()).isNull();
        }

        @Test
        @DisplayName("未到最后阶段时即使没有错误也不生成代码")
        void partialFrontendNoCode() {
            options.setFrontendPhase(5);
            CompilationResult result = new UcCompiler(options).compile(hello());
            assertThat(result.hasErrors()).isFalse();
            assertThat(result.hasCode()).isFalse();
        }

        @Test
        @DisplayName("有诊断时直接调用生成抛出异常")
        void generateRejectsErrors() {
            UcCompiler compiler = new UcCompiler(options);
            DiagnosticCollector diagnostics = new DiagnosticCollector();
            GlobalEnv env = new GlobalEnv(diagnostics);
            Program program = broken();
            compiler.analyze(program, env);

            assertThatThrownBy(() -> compiler.generate(program, env, diagnostics))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("hello.uc");
        }
    }

    @Test
    @DisplayName("诊断位置带文件名")
    void locationCarriesFile() {
        CompilationResult result = new UcCompiler(options).compile(broken());
        assertThat(result.getDiagnostics().get(0).getLocation().getFile()).isEqualTo("hello.uc");
    }
}

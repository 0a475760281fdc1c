package com.uclang.compiler.debug;

import com.uclang.compiler.analysis.DiagnosticCollector;
import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.AstBuilder;
import com.uclang.compiler.ast.decl.Program;
import com.uclang.compiler.ast.expr.BinaryExpr;
import com.uclang.compiler.phase.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.uclang.compiler.ast.expr.BinaryExpr.BinaryOp.ADD;
import static org.assertj.core.api.Assertions.*;

@DisplayName("类型标注输出")
class TypeAnnotationPrinterTest {

    private final AstBuilder b = new AstBuilder();
    private final TypeAnnotationPrinter printer = new TypeAnnotationPrinter();

    @Test
    @DisplayName("未分析的表达式类型为 null")
    void untyped() {
        BinaryExpr sum = b.binary(b.integer(1), ADD, b.str("a"));
        assertThat(printer.print(sum)).isEqualTo(
                "BinaryExpr: null {\n"
                        + "  +\n"
                        + "  Literal: null {\n"
                        + "    1\n"
                        + "  }\n"
                        + "  Literal: null {\n"
                        + "    \"a\"\n"
                        + "  }\n"
                        + "}\n");
    }

    @Test
    @DisplayName("分析后标注类型，没有类型属性的节点不标注")
    void typed() {
        Program program = b.program(
                b.struct("Point", b.var("int", "x")),
                b.function("void", "main", b.exprStmt(b.binary(b.integer(1), ADD, b.str("a")))));
        GlobalEnv env = new GlobalEnv(new DiagnosticCollector());
        for (Phase phase : Phase.values()) {
            phase.run(program, env);
        }

        assertThat(printer.print(program)).isEqualTo(
                "Program {\n"
                        + "  StructDecl: Point {\n"
                        + "    Point\n"
                        + "    VarDecl {\n"
                        + "      x\n"
                        + "      SimpleTypeName: int {\n"
                        + "        int\n"
                        + "      }\n"
                        + "    }\n"
                        + "  }\n"
                        + "  FunctionDecl {\n"
                        + "    main\n"
                        + "    SimpleTypeName: void {\n"
                        + "      void\n"
                        + "    }\n"
                        + "    Block {\n"
                        + "      ExpressionStmt {\n"
                        + "        BinaryExpr: string {\n"
                        + "          +\n"
                        + "          Literal: int {\n"
                        + "            1\n"
                        + "          }\n"
                        + "          Literal: string {\n"
                        + "            \"a\"\n"
                        + "          }\n"
                        + "        }\n"
                        + "      }\n"
                        + "    }\n"
                        + "  }\n"
                        + "}\n");
    }
}

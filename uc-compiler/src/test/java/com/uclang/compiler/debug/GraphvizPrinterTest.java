package com.uclang.compiler.debug;

import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.ast.AstBuilder;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.BinaryExpr;
import com.uclang.compiler.ast.expr.Literal;
import com.uclang.compiler.ast.expr.NameExpr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.uclang.compiler.ast.expr.BinaryExpr.BinaryOp.ADD;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Graphviz 输出")
class GraphvizPrinterTest {

    private final AstBuilder b = new AstBuilder();

    @Test
    @DisplayName("根节点以类名命名，子节点内联声明在边上")
    void registeredNodes() {
        BinaryExpr sum = b.binary(b.integer(1), ADD, b.str("a"));
        sum.setType(UcTypes.STRING);

        assertThat(new GraphvizPrinter().print(sum)).isEqualTo(
                "digraph {\n"
                        + "  BinaryExpr -> {BinaryExprT0 [label=\"+\"]} [label=\"0\"]\n"
                        + "  BinaryExpr -> {N0 [label=\"Literal\"]} [label=\"0\"]\n"
                        + "  N0 -> {N0T0 [label=\"1\"]} [label=\"0\"]\n"
                        + "  BinaryExpr -> {N1 [label=\"Literal\"]} [label=\"1\"]\n"
                        + "  N1 -> {N1T0 [label=\"\\\"a\\\"\"]} [label=\"0\"]\n"
                        + "}\n");
    }

    @Test
    @DisplayName("类型已知的子节点在标签中带类型")
    void typedChild() {
        BinaryExpr sum = b.binary(b.name("x"), ADD, b.integer(2));
        ((NameExpr) sum.getChildren().get(0)).setType(UcTypes.INT);

        assertThat(new GraphvizPrinter().print(sum))
                .contains("  BinaryExpr -> {N0 [label=\"NameExpr (int)\"]} [label=\"0\"]\n");
    }

    @Test
    @DisplayName("未登记的节点按出现顺序命名")
    void unregisteredNodes() {
        SourceLocation at = SourceLocation.atLine(1);
        BinaryExpr sum = new BinaryExpr(at, new NameExpr(at, "x"), ADD,
                new Literal(at, Literal.LiteralKind.INTEGER, "2"));

        String dot = new GraphvizPrinter().print(sum);
        assertThat(dot).startsWith("digraph {\n  BinaryExpr -> {BinaryExprT0 [label=\"+\"]} [label=\"0\"]\n");
        assertThat(dot).contains("  BinaryExpr -> {U0 [label=\"NameExpr\"]} [label=\"0\"]\n",
                "  BinaryExpr -> {U1 [label=\"Literal\"]} [label=\"1\"]\n",
                "  U0 -> {U0T0 [label=\"x\"]} [label=\"0\"]\n");
        assertThat(dot).endsWith("}\n");
    }
}

package com.uclang.compiler.backend;

import com.uclang.compiler.analysis.DiagnosticCollector;
import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.analysis.types.UserType;
import com.uclang.compiler.ast.AstBuilder;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.CallExpr;
import com.uclang.compiler.ast.expr.NewArrayExpr;
import com.uclang.compiler.ast.expr.NewExpr;
import com.uclang.compiler.ast.type.TypeName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.uclang.compiler.ast.expr.BinaryExpr.BinaryOp.*;
import static com.uclang.compiler.ast.expr.UnaryExpr.UnaryOp.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("表达式降级")
class ExpressionLoweringTest {

    private final AstBuilder b = new AstBuilder();
    private final ExpressionLowering lowering = new ExpressionLowering();

    @Test
    @DisplayName("字面量")
    void literals() {
        assertThat(lowering.lower(b.integer("12L"))).isEqualTo("12L");
        assertThat(lowering.lower(b.floating("2.5e3"))).isEqualTo("2.5e3");
        assertThat(lowering.lower(b.str("a\\n"))).isEqualTo("\"a\\n\"s");
        assertThat(lowering.lower(b.bool(true))).isEqualTo("true");
        assertThat(lowering.lower(b.nullLiteral())).isEqualTo("nullptr");
    }

    @Test
    @DisplayName("变量、字段、下标")
    void access() {
        assertThat(lowering.lower(b.name("x"))).isEqualTo("UC_VAR(x)");
        assertThat(lowering.lower(b.fieldAccess(b.name("p"), "next"))).isEqualTo("UC_VAR(p)->UC_VAR(next)");
        assertThat(lowering.lower(b.fieldAccess(b.name("a"), "length"))).isEqualTo("uc_length_field(UC_VAR(a))");
        assertThat(lowering.lower(b.index(b.name("a"), b.integer(0)))).isEqualTo("uc_array_index(UC_VAR(a), 0)");
    }

    @Test
    @DisplayName("一元运算")
    void unary() {
        assertThat(lowering.lower(b.unary(MINUS, b.name("x")))).isEqualTo("-(UC_VAR(x))");
        assertThat(lowering.lower(b.unary(NOT, b.name("z")))).isEqualTo("!(UC_VAR(z))");
        assertThat(lowering.lower(b.unary(DECREMENT, b.name("i")))).isEqualTo("--(UC_VAR(i))");
        assertThat(lowering.lower(b.unary(ID, b.name("p")))).isEqualTo("uc_id(UC_VAR(p))");
    }

    @Test
    @DisplayName("二元运算：加法和数组运算走运行时函数")
    void binary() {
        assertThat(lowering.lower(b.binary(b.str("n="), ADD, b.name("n")))).isEqualTo("uc_add(\"n=\"s, UC_VAR(n))");
        assertThat(lowering.lower(b.binary(b.name("a"), PUSH, b.integer(1)))).isEqualTo("uc_array_push(UC_VAR(a), 1)");
        assertThat(lowering.lower(b.binary(b.name("a"), POP, b.nullLiteral()))).isEqualTo("uc_array_pop(UC_VAR(a), nullptr)");
        assertThat(lowering.lower(b.binary(b.name("x"), MOD, b.integer(2)))).isEqualTo("(UC_VAR(x)) % (2)");
        assertThat(lowering.lower(b.binary(
                b.binary(b.name("a"), AND, b.name("b")), OR, b.unary(NOT, b.name("c")))))
                .isEqualTo("((UC_VAR(a)) && (UC_VAR(b))) || (!(UC_VAR(c)))");
    }

    @Test
    @DisplayName("赋值不加括号")
    void assignment() {
        assertThat(lowering.lower(b.assign(b.index(b.name("a"), b.name("i")), b.integer(3))))
                .isEqualTo("uc_array_index(UC_VAR(a), UC_VAR(i)) = 3");
    }

    @Test
    @DisplayName("调用使用函数的修饰名")
    void call() {
        GlobalEnv env = new GlobalEnv(new DiagnosticCollector());
        CallExpr call = b.call("pow", b.floating("2.0"), b.integer(8));
        call.setFunction(env.lookupFunction(3, SourceLocation.atLine(1), "pow"));
        assertThat(lowering.lower(call)).isEqualTo("UC_FUNCTION(pow)(2.0, 8)");
    }

    @Test
    @DisplayName("对象和数组分配")
    void allocations() {
        NewExpr alloc = b.newObject("Point", b.integer(1), b.integer(2));
        alloc.setType(new UserType("Point", b.struct("Point")));
        assertThat(lowering.lower(alloc)).isEqualTo("uc_make_object<UC_REFERENCE(Point)>(1, 2)");

        TypeName element = b.type("string");
        element.setType(UcTypes.STRING);
        NewArrayExpr array = b.newArray(element, b.str("a"), b.str("b"));
        assertThat(lowering.lower(array)).isEqualTo("uc_make_array_of<UC_PRIMITIVE(string)>(\"a\"s, \"b\"s)");

        TypeName nested = b.arrayOf("int");
        nested.setType(UcTypes.INT.getArrayType());
        assertThat(lowering.lower(b.newArray(nested)))
                .isEqualTo("uc_make_array_of<UC_ARRAY(UC_PRIMITIVE(int))>()");
    }
}

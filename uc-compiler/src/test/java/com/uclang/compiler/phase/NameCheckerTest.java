package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.DiagnosticCollector;
import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.ast.AstBuilder;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.Program;
import com.uclang.compiler.ast.decl.Parameter;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.decl.VarDecl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("阶段 4：名称检查")
class NameCheckerTest {

    private DiagnosticCollector diagnostics;
    private GlobalEnv env;
    private AstBuilder b;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
        env = new GlobalEnv(diagnostics);
        b = new AstBuilder();
    }

    private void check(Program program) {
        for (Phase phase : Phase.values()) {
            if (phase.getNumber() <= 4) {
                phase.run(program, env);
            }
        }
    }

    @Test
    @DisplayName("结构体字段建立局部环境")
    void structEnv() {
        StructDecl point = b.struct("Point", b.var("int", "x"), b.var("float", "y"));
        check(b.program(point));

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(point.getLocalEnv()).isNotNull();
        assertThat(point.getLocalEnv().size()).isEqualTo(2);
        assertThat(point.getLocalEnv().getType(4, point.getLocation(), "y")).isSameAs(UcTypes.FLOAT);
    }

    @Test
    @DisplayName("重复字段报告在结构体声明的位置")
    void duplicateField() {
        VarDecl first = b.at(4).var("int", "x");
        VarDecl second = b.at(5).var("long", "x");
        StructDecl s = b.at(3).struct("S", first, second);
        check(b.program(s));

        assertThat(diagnostics.getDiagnostics()).extracting("message").containsExactly("redeclaration of field x");
        assertThat(diagnostics.getDiagnostics().get(0).format())
                .isEqualTo("Error (4) at line 3: redeclaration of field x");
    }

    @Test
    @DisplayName("重复参数和局部变量报告在函数声明的位置")
    void duplicateInFunctionAtDeclaration() {
        List<Parameter> params = AstBuilder.list(b.at(8).param("int", "a"), b.at(8).param("int", "a"));
        List<VarDecl> locals = AstBuilder.list(b.at(9).var("int", "a"));
        FunctionDecl f = b.at(7).function(b.type("void"), "f", params, locals, b.block());
        check(b.program(f));

        assertThat(diagnostics.getDiagnostics()).extracting("location.line").containsExactly(7, 7);
    }

    @Test
    @DisplayName("参数与局部变量共用一个环境")
    void paramsAndLocals() {
        FunctionDecl f = b.function(b.type("void"), "f",
                AstBuilder.list(b.param("int", "a"), b.param("int", "a")),
                AstBuilder.list(b.var("string", "a"), b.var("boolean", "ok")),
                b.block());
        check(b.program(f));

        assertThat(diagnostics.getDiagnostics()).extracting("message")
                .containsExactly("redeclaration of parameter a", "redeclaration of variable a");
        assertThat(f.getLocalEnv().getType(4, f.getLocation(), "a")).isSameAs(UcTypes.INT);
        assertThat(f.getLocalEnv().getType(4, f.getLocation(), "ok")).isSameAs(UcTypes.BOOLEAN);
    }

    @Test
    @DisplayName("不同函数的同名变量互不影响")
    void separateScopes() {
        FunctionDecl f = b.function(b.type("void"), "f", AstBuilder.list(b.param("int", "a")),
                AstBuilder.list(b.var("int", "i")), b.block());
        FunctionDecl g = b.function(b.type("void"), "g", AstBuilder.list(b.param("string", "a")),
                AstBuilder.list(b.var("int", "i")), b.block());
        check(b.program(f, g));

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(g.getLocalEnv().getType(4, g.getLocation(), "a")).isSameAs(UcTypes.STRING);
    }

    @Test
    @DisplayName("重复执行复用已有环境")
    void idempotent() {
        FunctionDecl f = b.function(b.type("void"), "f", AstBuilder.list(b.param("int", "a"), b.param("int", "a")),
                AstBuilder.list(b.var("int", "i")), b.block());
        Program program = b.program(f);
        check(program);
        Object firstEnv = f.getLocalEnv();
        Phase.CHECK_NAMES.run(program, env);

        assertThat(f.getLocalEnv()).isSameAs(firstEnv);
        assertThat(diagnostics.size()).isEqualTo(1);
    }
}

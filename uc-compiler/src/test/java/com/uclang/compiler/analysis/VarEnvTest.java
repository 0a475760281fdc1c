package com.uclang.compiler.analysis;

import com.uclang.compiler.analysis.VarEnv.VarKind;
import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VarEnv 测试")
class VarEnvTest {

    private static final SourceLocation AT = SourceLocation.atLine(9);

    private DiagnosticCollector diagnostics;
    private VarEnv env;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
        env = new VarEnv(new GlobalEnv(diagnostics));
    }

    @Test
    @DisplayName("绑定后可查到类型")
    void bindAndLookup() {
        env.addVariable(4, AT, "x", UcTypes.FLOAT, VarKind.VARIABLE);
        assertThat(env.contains("x")).isTrue();
        assertThat(env.getType(6, AT, "x")).isSameAs(UcTypes.FLOAT);
        assertThat(env.size()).isEqualTo(1);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("重复绑定报告重声明，保留第一个")
    void redeclaration() {
        env.addVariable(4, AT, "a", UcTypes.INT, VarKind.PARAMETER);
        env.addVariable(4, AT, "a", UcTypes.STRING, VarKind.PARAMETER);
        env.addVariable(4, AT, "a", UcTypes.STRING, VarKind.FIELD);
        assertThat(env.getType(6, AT, "a")).isSameAs(UcTypes.INT);
        assertThat(diagnostics.getDiagnostics()).extracting("message")
                .containsExactly("redeclaration of parameter a", "redeclaration of field a");
        assertThat(diagnostics.getDiagnostics()).extracting("kind")
                .containsOnly(ErrorKind.REDEFINITION);
    }

    @Test
    @DisplayName("未定义变量报告并返回 int")
    void undefined() {
        assertThat(env.contains("y")).isFalse();
        assertThat(env.getType(6, AT, "y")).isSameAs(UcTypes.INT);
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.getDiagnostics().get(0).format())
                .isEqualTo("Error (6) at line 9: undefined variable y");
    }
}

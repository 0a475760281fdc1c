package com.uclang.compiler.backend;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.decl.VarDecl;

import java.util.List;

/**
 * 第 3 遍：结构体完整定义。
 *
 * <p>每个结构体生成：字段成员、默认构造函数、（有字段时）逐字段构造函数、
 * 逐字段比较的 operator== 以及取反的 operator!=，结尾跟一个空行。</p>
 */
final class TypeDefinitionPass extends AstTraversal<PhaseContext> {

    @Override
    public Void visitStructDecl(StructDecl node, PhaseContext ctx) {
        String typedef = node.getType().mangleDefinition();
        List<VarDecl> fields = node.getFields();
        PhaseContext body = ctx.indented();
        PhaseContext inner = body.indented();

        ctx.line("struct " + typedef + " {");
        for (VarDecl field : fields) {
            body.line(field.getType().getType().mangle() + " UC_VAR(" + field.getName() + ");");
        }

        body.line(typedef + "() = default;");
        if (!fields.isEmpty()) {
            StringBuilder params = new StringBuilder();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) params.append(", ");
                params.append("const ").append(fields.get(i).getType().getType().mangle())
                        .append(" &var").append(i);
            }
            body.line(typedef + "(" + params + ") {");
            for (int i = 0; i < fields.size(); i++) {
                inner.line("UC_VAR(" + fields.get(i).getName() + ") = var" + i + ";");
            }
            body.line("}");
        }

        body.line("UC_PRIMITIVE(boolean) operator==(const " + typedef + " &rhs) const {");
        inner.line("return " + equalityChain(fields) + ";");
        body.line("}");

        body.line("UC_PRIMITIVE(boolean) operator!=(const " + typedef + " &rhs) const {");
        inner.line("return !((*this)==rhs);");
        body.line("}");

        ctx.line("};");
        ctx.getOut().blankLine();
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, PhaseContext ctx) {
        return null;
    }

    /** 无字段时恒为 true */
    private static String equalityChain(List<VarDecl> fields) {
        if (fields.isEmpty()) {
            return "true";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(" && ");
            String member = "UC_VAR(" + fields.get(i).getName() + ")";
            sb.append(member).append(" == rhs.").append(member);
        }
        return sb.toString();
    }
}

package com.uclang.compiler.debug;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.expr.Expression;
import com.uclang.compiler.ast.type.TypeName;
import com.uclang.compiler.backend.CodeBuffer;

/**
 * 带类型标注的 AST 文本输出。
 *
 * <p>每个节点先输出一行"类名: 类型"加左花括号，类型部分只出现在带类型属性的节点上
 * （未计算时为 null）；随后是缩进两格的终结值和子节点，最后一行是右花括号。</p>
 */
public final class TypeAnnotationPrinter {

    public String print(AstNode root) {
        CodeBuffer out = new CodeBuffer();
        print(root, 0, out);
        return out.getOutput();
    }

    private void print(AstNode node, int level, CodeBuffer out) {
        StringBuilder header = new StringBuilder(node.getClass().getSimpleName());
        if (hasTypeAttribute(node)) {
            UcType type = typeAttribute(node);
            header.append(": ").append(type == null ? "null" : type.getName());
        }
        out.line(level, header.append(" {").toString());
        for (String terminal : node.getTerminals()) {
            out.line(level + 1, terminal);
        }
        for (AstNode child : node.getChildren()) {
            print(child, level + 1, out);
        }
        out.line(level, "}");
    }

    static boolean hasTypeAttribute(AstNode node) {
        return node instanceof Expression || node instanceof TypeName || node instanceof StructDecl;
    }

    /** 未计算时返回 null */
    static UcType typeAttribute(AstNode node) {
        if (node instanceof Expression) {
            return ((Expression) node).peekType();
        }
        if (node instanceof TypeName) {
            return ((TypeName) node).peekType();
        }
        if (node instanceof StructDecl) {
            StructDecl decl = (StructDecl) node;
            return decl.isTypeRegistered() ? decl.getType() : null;
        }
        return null;
    }
}

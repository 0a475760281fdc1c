package com.uclang.compiler.debug;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.backend.CodeBuffer;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graphviz (dot) 格式的 AST 输出。
 *
 * <p>根节点以类名命名，其余节点为 {@code N<编号>}（编号来自 AstArena，未登记的节点用
 * {@code U<序号>}）。每条边内联声明子节点：{@code P -> {N3 [label="Literal (int)"]} [label="0"]}。
 * 子节点列表已展开，边标签是子节点在 {@link AstNode#getChildren()} 中的序号，不生成列表节点；
 * 终结值是叶子 {@code <父节点>T<序号>}。</p>
 */
public final class GraphvizPrinter {

    private final Map<AstNode, String> unregistered = new IdentityHashMap<AstNode, String>();

    public String print(AstNode root) {
        CodeBuffer out = new CodeBuffer();
        out.line("digraph {");
        walk(root, root.getClass().getSimpleName(), out);
        out.line("}");
        return out.getOutput();
    }

    private void walk(AstNode node, String name, CodeBuffer out) {
        List<String> terminals = node.getTerminals();
        for (int i = 0; i < terminals.size(); i++) {
            out.line(1, edge(name, name + "T" + i, terminals.get(i), i));
        }
        List<AstNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            AstNode child = children.get(i);
            String childName = nameOf(child);
            out.line(1, edge(name, childName, label(child), i));
            walk(child, childName, out);
        }
    }

    private static String edge(String parent, String child, String label, int index) {
        return parent + " -> {" + child + " [label=\"" + escape(label) + "\"]} [label=\"" + index + "\"]";
    }

    private static String label(AstNode node) {
        StringBuilder label = new StringBuilder(node.getClass().getSimpleName());
        UcType type = TypeAnnotationPrinter.typeAttribute(node);
        if (type != null) {
            label.append(" (").append(type.getName()).append(')');
        }
        return label.toString();
    }

    private String nameOf(AstNode node) {
        if (node.getId() >= 0) {
            return "N" + node.getId();
        }
        String name = unregistered.get(node);
        if (name == null) {
            name = "U" + unregistered.size();
            unregistered.put(node, name);
        }
        return name;
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

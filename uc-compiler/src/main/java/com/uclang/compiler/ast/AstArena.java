package com.uclang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译的节点仓库：登记时按顺序分配节点编号（诊断和图形输出使用）。
 * 生命周期与一次编译相同。
 */
public final class AstArena {
    private final List<AstNode> nodes = new ArrayList<AstNode>();

    /** 登记节点并分配下一个编号，返回节点本身 */
    public <T extends AstNode> T add(T node) {
        node.assignId(nodes.size());
        nodes.add(node);
        return node;
    }

    /** 已登记的节点，下标即编号 */
    public List<AstNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }
}

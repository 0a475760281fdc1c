package com.uclang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>子节点（{@link #getChildren()}）只包含结构字段；分析结果（类型、环境等）是属性，
 * 不参与遍历。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;
    // 由 AstArena 分配，-1 表示未登记
    private int id = -1;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getId() {
        return id;
    }

    void assignId(int id) {
        if (this.id >= 0) {
            throw new IllegalStateException("node already registered with id " + this.id);
        }
        this.id = id;
    }

    /** 结构子节点，按声明顺序；缺省的可选子节点不出现 */
    public abstract List<AstNode> getChildren();

    /**
     * 节点上的终结值（名称、字面量文本、运算符），用于调试输出。
     * 没有终结值的节点返回空列表。
     */
    public List<String> getTerminals() {
        return Collections.emptyList();
    }

    /** 将单个节点和节点列表按顺序展开为子节点列表，跳过 null */
    protected static List<AstNode> childrenOf(Object... parts) {
        List<AstNode> result = new ArrayList<AstNode>();
        for (Object part : parts) {
            if (part instanceof AstNode) {
                result.add((AstNode) part);
            } else if (part instanceof List) {
                for (Object item : (List<?>) part) {
                    result.add((AstNode) item);
                }
            }
        }
        return result;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}

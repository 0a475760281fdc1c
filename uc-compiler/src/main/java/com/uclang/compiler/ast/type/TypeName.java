package com.uclang.compiler.ast.type;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.SourceLocation;

/**
 * 类型名基类
 */
public abstract class TypeName extends AstNode {
    // 阶段 2 解析后填充
    protected UcType type;

    protected TypeName(SourceLocation location) {
        super(location);
    }

    public boolean isResolved() {
        return type != null;
    }

    /** 解析前读取属于实现错误 */
    public UcType getType() {
        if (type == null) {
            throw new IllegalStateException("type name at " + location + " read before resolution");
        }
        return type;
    }

    public void setType(UcType type) {
        this.type = type;
    }

    /** 未解析时返回 null（调试输出使用） */
    public UcType peekType() {
        return type;
    }
}

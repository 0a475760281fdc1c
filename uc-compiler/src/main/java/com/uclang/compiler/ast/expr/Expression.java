package com.uclang.compiler.ast.expr;

import com.uclang.compiler.analysis.types.UcType;
import com.uclang.compiler.ast.AstNode;
import com.uclang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    // 类型信息（阶段 6 填充；new 表达式在阶段 2 先得到名义类型）
    protected UcType type;

    protected Expression(SourceLocation location) {
        super(location);
    }

    public boolean isTyped() {
        return type != null;
    }

    /** 类型计算前读取属于实现错误 */
    public UcType getType() {
        if (type == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " at " + location
                    + " read before type checking");
        }
        return type;
    }

    /** 未计算时返回 null */
    public UcType peekType() {
        return type;
    }

    public void setType(UcType type) {
        this.type = type;
    }

    /** 是否表示可赋值的存储位置 */
    public boolean isLvalue() {
        return false;
    }
}

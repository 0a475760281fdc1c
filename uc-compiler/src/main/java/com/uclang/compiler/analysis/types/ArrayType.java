package com.uclang.compiler.analysis.types;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.Expression;
import com.uclang.compiler.ast.expr.FieldAccessExpr;

import java.util.List;

/**
 * 数组类型 T[]。通过 {@link UcType#getArrayType()} 获取，不直接构造。
 */
public final class ArrayType extends UcType {

    private final UcType elementType;

    ArrayType(UcType elementType) {
        super(elementType.getName() + "[]");
        this.elementType = elementType;
    }

    public UcType getElementType() {
        return elementType;
    }

    @Override
    public String mangle() {
        return "UC_ARRAY(" + elementType.mangle() + ")";
    }

    /** 数组只有伪字段 length */
    @Override
    public UcType lookupField(int phase, SourceLocation location, String fieldName, GlobalEnv env) {
        if (FieldAccessExpr.LENGTH_FIELD.equals(fieldName)) {
            return UcTypes.INT;
        }
        return super.lookupField(phase, location, fieldName, env);
    }

    /** 每个参数都是一个初始元素 */
    @Override
    public void checkArgs(int phase, SourceLocation location, List<Expression> args, GlobalEnv env) {
        for (Expression arg : args) {
            if (!UcTypes.isCompatible(arg.getType(), elementType)) {
                env.error(phase, location, "type " + arg.getType()
                        + " of argument is not compatible with element type " + elementType);
            }
        }
    }
}

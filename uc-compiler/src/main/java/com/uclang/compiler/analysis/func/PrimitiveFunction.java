package com.uclang.compiler.analysis.func;

import com.uclang.compiler.analysis.types.UcType;

import java.util.Arrays;

/**
 * 内置函数，签名在构造时确定
 */
public final class PrimitiveFunction extends UcFunction {

    public PrimitiveFunction(String name, UcType returnType, UcType... paramTypes) {
        super(name);
        this.returnType = returnType;
        this.paramTypes.addAll(Arrays.asList(paramTypes));
    }
}

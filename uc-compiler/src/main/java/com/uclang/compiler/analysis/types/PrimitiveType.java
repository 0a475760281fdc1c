package com.uclang.compiler.analysis.types;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 原始类型: int, long, float, string, boolean, void, null
 */
public final class PrimitiveType extends UcType {

    PrimitiveType(String name) {
        super(name);
    }

    @Override
    public String mangle() {
        return "UC_PRIMITIVE(" + name + ")";
    }

    /** 0 个参数（默认值）或 1 个可隐式转换的参数 */
    @Override
    public void checkArgs(int phase, SourceLocation location, List<Expression> args, GlobalEnv env) {
        if (args.size() > 1) {
            env.error(phase, location, "type " + name + " expected 0 or 1 argument(s), but got "
                    + args.size());
        } else if (args.size() == 1 && !UcTypes.isCompatible(args.get(0).getType(), this)) {
            env.error(phase, location, "type " + args.get(0).getType()
                    + " of argument is not compatible with type " + name);
        }
    }
}

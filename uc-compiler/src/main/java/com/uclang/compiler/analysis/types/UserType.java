package com.uclang.compiler.analysis.types;

import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.SourceLocation;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.decl.VarDecl;
import com.uclang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 用户定义的结构体类型
 *
 * <p>字段列表直接读取声明节点，因此字段类型在阶段 2 之后才可用。</p>
 */
public final class UserType extends UcType {

    private final StructDecl decl;

    public UserType(String name, StructDecl decl) {
        super(name);
        this.decl = decl;
    }

    public StructDecl getDecl() {
        return decl;
    }

    public List<VarDecl> getFields() {
        return decl.getFields();
    }

    /** 作为值引用时的名字 */
    @Override
    public String mangle() {
        return "UC_REFERENCE(" + name + ")";
    }

    /** 结构体定义本身的名字 */
    public String mangleDefinition() {
        return "UC_TYPEDEF(" + name + ")";
    }

    @Override
    public UcType lookupField(int phase, SourceLocation location, String fieldName, GlobalEnv env) {
        for (VarDecl field : decl.getFields()) {
            if (field.getName().equals(fieldName)) {
                return field.getType().getType();
            }
        }
        return super.lookupField(phase, location, fieldName, env);
    }

    /** 0 个参数，或按声明顺序每个字段一个可隐式转换的参数 */
    @Override
    public void checkArgs(int phase, SourceLocation location, List<Expression> args, GlobalEnv env) {
        List<VarDecl> fields = decl.getFields();
        if (args.isEmpty()) {
            return;
        }
        if (args.size() != fields.size()) {
            env.error(phase, location, "type " + name + " expected 0 or " + fields.size()
                    + " argument(s), but got " + args.size());
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            UcType argType = args.get(i).getType();
            UcType fieldType = fields.get(i).getType().getType();
            if (!UcTypes.isCompatible(argType, fieldType)) {
                env.error(phase, location, "type " + argType + " of argument is not compatible with field "
                        + fields.get(i).getName() + " of type " + fieldType);
            }
        }
    }
}

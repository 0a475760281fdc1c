package com.uclang.compiler.phase;

import com.uclang.compiler.analysis.PhaseContext;
import com.uclang.compiler.ast.AstTraversal;

/**
 * 阶段 5 的第二遍：高级控制流检查的挂载点。
 *
 * <p>目前只做默认遍历，不报告任何诊断。缺少 return 的非 void 函数不会在这里报错。</p>
 */
public final class AdvancedControlChecker extends AstTraversal<PhaseContext> {
}

package com.uclang.compiler.compiler;

import com.uclang.compiler.analysis.DiagnosticCollector;
import com.uclang.compiler.analysis.GlobalEnv;
import com.uclang.compiler.ast.decl.Program;
import com.uclang.compiler.backend.CppBackend;
import com.uclang.compiler.debug.GraphvizPrinter;
import com.uclang.compiler.debug.TypeAnnotationPrinter;
import com.uclang.compiler.phase.Phase;

import java.util.logging.Logger;

/**
 * 编译驱动：按顺序执行分析阶段，无诊断时生成 C++ 代码。
 *
 * <p>诊断不会中断分析，选定的阶段总是全部执行，以便一次报告尽可能多的错误。</p>
 */
public final class UcCompiler {

    private static final Logger LOG = Logger.getLogger(UcCompiler.class.getName());

    private final CompilerOptions options;

    public UcCompiler() {
        this(new CompilerOptions());
    }

    public UcCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public CompilationResult compile(Program program) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        GlobalEnv env = new GlobalEnv(diagnostics);

        analyze(program, env);

        String code = null;
        if (diagnostics.hasErrors()) {
            LOG.info(options.getSourceName() + ": " + diagnostics.size()
                    + " error(s), code generation skipped");
        } else if (options.getFrontendPhase() == Phase.LAST && options.isGenerateCode()) {
            code = generate(program, env, diagnostics);
        }

        String typeDump = options.isDumpTypes() ? new TypeAnnotationPrinter().print(program) : null;
        String graphDump = options.isDumpGraph() ? new GraphvizPrinter().print(program) : null;
        return new CompilationResult(diagnostics.getDiagnostics(), env, code, typeDump, graphDump);
    }

    /** 执行 1..frontendPhase 的全部分析阶段 */
    public void analyze(Program program, GlobalEnv env) {
        for (Phase phase : Phase.values()) {
            if (phase.getNumber() > options.getFrontendPhase()) {
                break;
            }
            LOG.fine(options.getSourceName() + ": running phase " + phase.getNumber()
                    + " (" + phase.getDescription() + ")");
            phase.run(program, env);
        }
    }

    /**
     * 生成代码。树上存在诊断时抛出 IllegalStateException。
     */
    public String generate(Program program, GlobalEnv env, DiagnosticCollector diagnostics) {
        if (diagnostics.hasErrors()) {
            throw new IllegalStateException("cannot generate code for " + options.getSourceName()
                    + " with " + diagnostics.size() + " diagnostic(s)");
        }
        CppBackend backend = new CppBackend(env);
        Integer lastPass = options.getBackendPhase();
        LOG.fine(options.getSourceName() + ": generating code"
                + (lastPass == null ? "" : " up to pass " + lastPass));
        if (lastPass == null) {
            return backend.generate(program);
        }
        return backend.generate(program, lastPass, false);
    }
}

package org.ember.compiler;

import org.ember.compiler.api.CompilationException;
import org.ember.compiler.api.ICompiler;
import org.ember.compiler.api.LoweredProgram;
import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.config.ConfigLoader;
import org.ember.compiler.diagnostics.CompileError;
import org.ember.compiler.diagnostics.DiagnosticsEngine;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.expansion.DispatchResolver;
import org.ember.compiler.frontend.expansion.Environment;
import org.ember.compiler.frontend.expansion.EnvironmentDispatchResolver;
import org.ember.compiler.frontend.expansion.Expander;
import org.ember.compiler.frontend.expansion.UniqueCounter;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LowererRegistry;
import org.ember.compiler.frontend.lowering.LoweringCollaborators;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.Translator;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.util.DebugDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The main compiler implementation. This class runs function literal and capture expansion followed
 * by lowering over every form of a unit. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerConfig config;
    private final DispatchResolver resolver;
    private final LowererRegistry registry = LowererRegistry.initializeWithDefaults();
    private final LoweringCollaborators collaborators;
    private final UniqueCounter counter;

    /**
     * Creates a compiler configured from {@code ember.conf}, system properties and the environment.
     */
    public Compiler() {
        this(CompilerConfig.fromConfig(ConfigLoader.load()));
    }

    /**
     * @param config The compiler configuration.
     */
    public Compiler(CompilerConfig config) {
        this(config, new EnvironmentDispatchResolver(), LoweringCollaborators.defaults(), new UniqueCounter());
    }

    /**
     * @param config        The compiler configuration.
     * @param resolver      Decides which captures become direct function references.
     * @param collaborators The clause-level lowering collaborators.
     * @param counter       The source of unique numbers for generated names.
     */
    public Compiler(CompilerConfig config, DispatchResolver resolver, LoweringCollaborators collaborators,
                    UniqueCounter counter) {
        this.config = config;
        this.resolver = resolver;
        this.collaborators = collaborators;
        this.counter = counter;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Forms are processed in order and each starts from an empty scope. The first error aborts the unit.
     */
    @Override
    public LoweredProgram compile(List<AstNode> forms, String fileName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Environment env = new Environment(fileName, config.module(), config, counter);
        Expander expander = new Expander(resolver);
        Translator translator = new Translator(env, diagnostics, registry, collaborators);

        List<IrExpr> lowered = new ArrayList<>(forms.size());
        boolean caller = false;
        try {
            for (AstNode form : forms) {
                AstNode expanded = expander.expand(form, env);
                Lowered<IrExpr> result = translator.translate(expanded, ScopeState.initial(fileName));
                lowered.add(result.value());
                caller |= result.state().caller();
            }
        } catch (CompileError e) {
            diagnostics.reportError(e.getMessage(), e.source().fileName(), e.source().lineNumber());
            LOG.debug("Compilation of {} aborted: {}", fileName, e.toString());
            throw new CompilationException(diagnostics.summary(), e.code(), e);
        }

        LoweredProgram program = new LoweredProgram(fileName, lowered, caller, diagnostics.warnings());
        LOG.debug("Lowered {} form(s) of {} with {} warning(s)", lowered.size(), fileName, program.warnings().size());
        if (config.debugDump()) {
            DebugDump.dumpLowered(Path.of(config.dumpDirectory()), program);
        }
        return program;
    }

    /**
     * @return The configuration this compiler runs with.
     */
    public CompilerConfig config() {
        return config;
    }
}

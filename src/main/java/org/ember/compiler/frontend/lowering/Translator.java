package org.ember.compiler.frontend.lowering;

import org.ember.compiler.diagnostics.DiagnosticsEngine;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.expansion.Environment;
import org.ember.compiler.ir.IrExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase: lowers expanded forms by delegating to lowerers resolved via the {@link LowererRegistry}.
 */
public final class Translator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);

    private final LoweringContext ctx;

    /**
     * Creates a new translator for one compilation unit.
     *
     * @param env           The compilation environment.
     * @param diagnostics   The diagnostics engine for reporting warnings.
     * @param registry      The lowerer registry.
     * @param collaborators The clause-level collaborators.
     */
    public Translator(Environment env, DiagnosticsEngine diagnostics, LowererRegistry registry,
                      LoweringCollaborators collaborators) {
        this.ctx = new LoweringContext(env, diagnostics, registry, collaborators);
    }

    /**
     * Lowers one expanded form.
     *
     * @param form The expanded form.
     * @param s    The scope state to start from.
     * @return The lowered form and the final scope state.
     */
    public Lowered<IrExpr> translate(AstNode form, ScopeState s) {
        LOG.debug("Lowering {} in {}", form.getClass().getSimpleName(), s.file());
        return ctx.lower(form, s);
    }

    /**
     * @return The context shared by all forms lowered by this translator.
     */
    public LoweringContext context() {
        return ctx;
    }
}

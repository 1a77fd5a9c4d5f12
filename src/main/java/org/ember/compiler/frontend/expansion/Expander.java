package org.ember.compiler.frontend.expansion;

import org.ember.compiler.frontend.TreeWalker;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.FnNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expansion driver. Rewrites every function literal and capture of a form into canonical shape;
 * all other nodes are kept and searched for nested literals.
 */
public class Expander {

    private static final Logger LOG = LoggerFactory.getLogger(Expander.class);

    private final FnExpander fnExpander;
    private final TreeWalker walker = new TreeWalker();

    /**
     * Creates an expander whose clause expansion recurses into this expander.
     *
     * @param resolver Decides which captures become direct function references.
     */
    public Expander(DispatchResolver resolver) {
        this.fnExpander = new FnExpander(new DefaultClauseExpander(this), resolver);
    }

    /**
     * @param fnExpander The function literal expander to route literals through.
     */
    public Expander(FnExpander fnExpander) {
        this.fnExpander = fnExpander;
    }

    /**
     * @param form The form to expand.
     * @param env  The compilation environment.
     * @return The expanded form.
     */
    public AstNode expand(AstNode form, Environment env) {
        return walker.transform(form, node -> rewrite(node, env));
    }

    private AstNode rewrite(AstNode node, Environment env) {
        if (node instanceof FnNode fn) {
            return fnExpander.expand(fn.meta(), fn.clauses(), env);
        }
        if (node instanceof CaptureNode capture) {
            CaptureResult result = fnExpander.capture(capture.meta(), capture.expr(), env);
            if (result instanceof CaptureResult.Expand expand) {
                LOG.debug("{}:{}: capture expanded into a function literal", env.file(), capture.meta().line());
                return expand(expand.fn(), env);
            }
            if (result instanceof CaptureResult.LocalRef local) {
                return local.toAst(capture.meta());
            }
            return ((CaptureResult.RemoteRef) result).toAst(capture.meta());
        }
        return null;
    }
}

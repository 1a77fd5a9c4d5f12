package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.CaseNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.GeneratorNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.ast.WithNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code with} into nested cases and lowers the result.
 * <p>
 * Each {@code pattern <- expr} step becomes a case whose first clause continues with the remaining
 * steps; any other step is evaluated in sequence. A value that does not match is returned as is,
 * or handed to the {@code else} clauses, which raise {@code {with_clause, Value}} when none matches.
 * Bindings made inside the {@code with} do not escape it.
 */
public class DefaultWithLowering implements WithLowering {

    private static final String UNMATCHED = "unmatched";

    @Override
    public Lowered<IrExpr> lower(WithNode node, ScopeState s, LoweringContext ctx) {
        AstNode rewritten = node.body();
        List<AstNode> steps = node.steps();
        for (int i = steps.size() - 1; i >= 0; i--) {
            AstNode step = steps.get(i);
            if (step instanceof GeneratorNode generator) {
                VarNode unmatched = new VarNode(UNMATCHED, Meta.counter(ctx.env().counter().next()), "with");
                Meta meta = generator.meta().with(Meta.GENERATED, true);
                rewritten = new CaseNode(meta, generator.source(), List.of(
                        new ClauseNode(generator.meta(), List.of(generator.pattern()), rewritten),
                        new ClauseNode(meta, List.of(unmatched), onMismatch(node, unmatched, ctx))));
            } else {
                rewritten = new BlockNode(step.meta(), List.of(step, rewritten));
            }
        }
        Lowered<IrExpr> lowered = ctx.lower(rewritten, s);
        return new Lowered<>(lowered.value(), ScopeState.mergeCounters(s, lowered.state()));
    }

    private AstNode onMismatch(WithNode node, VarNode unmatched, LoweringContext ctx) {
        if (node.elseClauses().isEmpty()) {
            return unmatched;
        }
        Meta meta = node.meta().with(Meta.GENERATED, true);
        VarNode other = new VarNode(UNMATCHED, Meta.counter(ctx.env().counter().next()), "with");
        AstNode raise = new RemoteCallNode(AtomLiteral.of(ctx.config().runtimeModule()), "error", meta,
                List.of(new TupleNode(meta, List.of(AtomLiteral.of("with_clause"), other))));
        List<ClauseNode> clauses = new ArrayList<>(node.elseClauses());
        clauses.add(new ClauseNode(meta, List.of(other), raise));
        return new CaseNode(meta, unmatched, clauses);
    }
}

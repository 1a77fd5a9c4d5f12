package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.ForNode;
import org.ember.compiler.frontend.ast.GeneratorNode;
import org.ember.compiler.frontend.ast.WhenNode;
import org.ember.compiler.frontend.lowering.BooleanAnalysis;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrCase;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrComprehension;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrOp;
import org.ember.compiler.ir.IrVar;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code for} over lists. Generators bind their pattern for the qualifiers and the body that
 * follow them; filters that are not known to return a boolean are tested for truthiness.
 */
public class DefaultComprehensionLowering implements ComprehensionLowering {

    @Override
    public Lowered<IrExpr> lower(ForNode node, boolean collect, ScopeState s, LoweringContext ctx) {
        if (node.qualifiers().isEmpty() || !(node.qualifiers().get(0) instanceof GeneratorNode)) {
            throw ctx.error(node.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
                    "for comprehensions must start with a generator");
        }
        ClauseLowering clauses = ctx.collaborators().clauses();
        List<IrComprehension.Qualifier> qualifiers = new ArrayList<>();
        ScopeState acc = s;
        for (AstNode qualifier : node.qualifiers()) {
            if (qualifier instanceof GeneratorNode generator) {
                Lowered<IrExpr> source = ctx.lower(generator.source(), acc);
                AstNode pattern = generator.pattern();
                AstNode guard = null;
                if (pattern instanceof WhenNode when && when.args().size() == 2) {
                    pattern = when.args().get(0);
                    guard = when.args().get(1);
                }
                AstNode toMatch = pattern;
                Lowered<IrExpr> loweredPattern = clauses.match(st -> ctx.lower(toMatch, st), source.state());
                qualifiers.add(new IrComprehension.Generator(IrAnno.of(generator.meta()), loweredPattern.value(),
                        source.value()));
                acc = loweredPattern.state();
                if (guard != null) {
                    IrExpr test = ctx.lower(guard, acc.withContext(ScopeState.Context.GUARD)).value();
                    qualifiers.add(new IrComprehension.Filter(test));
                }
            } else {
                Lowered<IrExpr> filter = ctx.lower(qualifier, acc);
                acc = filter.state();
                IrExpr test = BooleanAnalysis.returnsBoolean(qualifier, ctx.config())
                        ? filter.value()
                        : truthy(IrAnno.of(qualifier.meta()), filter.value(), ctx);
                qualifiers.add(new IrComprehension.Filter(test));
            }
        }
        Lowered<IrExpr> body = ctx.lower(node.body(), acc);
        IrExpr result = new IrComprehension(IrAnno.of(node.meta()), body.value(), qualifiers, collect);
        return new Lowered<>(result, ScopeState.mergeCounters(s, body.state()));
    }

    /** {@code case Value of V when V /= nil andalso V /= false -> true; _ -> false end} */
    private static IrExpr truthy(IrAnno anno, IrExpr value, LoweringContext ctx) {
        IrAnno generated = anno.asGenerated();
        IrVar var = new IrVar(generated, ctx.buildVar());
        IrExpr notNil = new IrOp(generated, "/=", List.of(var, new IrAtom(generated, "nil")));
        IrExpr notFalse = new IrOp(generated, "/=", List.of(var, new IrAtom(generated, "false")));
        IrExpr guard = new IrOp(generated, "andalso", List.of(notNil, notFalse));
        return new IrCase(generated, value, List.of(
                new IrClause(generated, List.of(var), List.of(List.of(guard)), List.of(new IrAtom(generated, "true"))),
                new IrClause(generated, List.of(new IrVar(generated, "_")), List.of(),
                        List.of(new IrAtom(generated, "false")))));
    }
}

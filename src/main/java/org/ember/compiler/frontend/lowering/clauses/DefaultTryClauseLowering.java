package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.ast.WhenNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrClause;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites rescue and catch clauses into clauses over the raised {@code {Kind, Reason, Stacktrace}}
 * triple and lowers them through the {@link ClauseLowering} collaborator.
 * <ul>
 *   <li>{@code catch value} and {@code catch kind, value} match {@code {kind, value, _}}, with
 *       {@code throw} as the default kind.</li>
 *   <li>{@code rescue var} matches {@code {error, var, _}}.</li>
 *   <li>{@code rescue var in [Mod, ...]} additionally requires the reason to be a struct of one of
 *       the modules.</li>
 * </ul>
 */
public class DefaultTryClauseLowering implements TryClauseLowering {

    @Override
    public Lowered<List<IrClause>> clauses(Meta meta, List<ClauseNode> rescueClauses, List<ClauseNode> catchClauses,
                                           ScopeState s, LoweringContext ctx) {
        List<ClauseNode> rewritten = new ArrayList<>();
        for (ClauseNode clause : rescueClauses) {
            rewritten.add(rescue(clause, ctx));
        }
        for (ClauseNode clause : catchClauses) {
            rewritten.add(catchClause(clause, ctx));
        }
        return ctx.collaborators().clauses().clauses(meta, rewritten, s, ctx);
    }

    private ClauseNode catchClause(ClauseNode clause, LoweringContext ctx) {
        GuardedArgs split = GuardedArgs.extract(clause.args());
        AstNode kind;
        AstNode value;
        if (split.args().size() == 1) {
            kind = AtomLiteral.of("throw");
            value = split.args().get(0);
        } else if (split.args().size() == 2) {
            kind = split.args().get(0);
            value = split.args().get(1);
        } else {
            throw ctx.error(clause.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
                    "catch clauses take one or two arguments, got: %s", AstPrinter.toDisplayString(clause));
        }
        return withGuards(clause, raised(clause.meta(), kind, value), split.guards());
    }

    private ClauseNode rescue(ClauseNode clause, LoweringContext ctx) {
        if (clause.args().size() == 1 && clause.args().get(0) instanceof VarNode var) {
            return withGuards(clause, raised(clause.meta(), AtomLiteral.of("error"), var), List.of());
        }
        if (clause.args().size() == 1 && clause.args().get(0) instanceof LocalCallNode in
                && in.name().equals("in") && in.args().size() == 2 && in.args().get(0) instanceof VarNode var) {
            List<AstNode> guards = new ArrayList<>();
            for (AstNode module : modules(in.args().get(1), clause, ctx)) {
                guards.add(isStruct(var, module, ctx));
            }
            return withGuards(clause, raised(clause.meta(), AtomLiteral.of("error"), var), guards);
        }
        throw ctx.error(clause.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
                "rescue clauses expect a variable or \"var in [Module, ...]\", got: %s", AstPrinter.toDisplayString(clause));
    }

    private List<AstNode> modules(AstNode modules, ClauseNode clause, LoweringContext ctx) {
        if (modules instanceof AtomLiteral) {
            return List.of(modules);
        }
        if (modules instanceof ListNode list && !list.elements().isEmpty()
                && list.elements().stream().allMatch(AtomLiteral.class::isInstance)) {
            return list.elements();
        }
        throw ctx.error(clause.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
                "rescue expects a list of modules after \"in\", got: %s", AstPrinter.toDisplayString(modules));
    }

    private static TupleNode raised(Meta meta, AstNode kind, AstNode value) {
        return new TupleNode(meta, List.of(kind, value, VarNode.of(VarNode.WILDCARD)));
    }

    /** {@code is_map(var) andalso map_get('__struct__', var) =:= module} */
    private static AstNode isStruct(VarNode var, AstNode module, LoweringContext ctx) {
        return runtime(ctx, "andalso",
                runtime(ctx, "is_map", var),
                runtime(ctx, "=:=", runtime(ctx, "map_get", AtomLiteral.of("__struct__"), var), module));
    }

    private static AstNode runtime(LoweringContext ctx, String name, AstNode... args) {
        return new RemoteCallNode(AtomLiteral.of(ctx.config().runtimeModule()), name, Meta.EMPTY, List.of(args));
    }

    private static ClauseNode withGuards(ClauseNode clause, AstNode pattern, List<AstNode> guards) {
        if (guards.isEmpty()) {
            return new ClauseNode(clause.meta(), List.of(pattern), clause.body());
        }
        AstNode alternatives = guards.get(guards.size() - 1);
        for (int i = guards.size() - 2; i >= 0; i--) {
            alternatives = new WhenNode(clause.meta(), List.of(guards.get(i), alternatives));
        }
        return new ClauseNode(clause.meta(), List.of(new WhenNode(clause.meta(), List.of(pattern, alternatives))),
                clause.body());
    }
}

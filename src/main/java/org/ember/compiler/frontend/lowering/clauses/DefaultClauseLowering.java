package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.VarBinding;
import org.ember.compiler.frontend.lowering.VarKey;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrBlock;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrClosure;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrFloat;
import org.ember.compiler.ir.IrInteger;
import org.ember.compiler.ir.IrLocalFun;
import org.ember.compiler.ir.IrMatch;
import org.ember.compiler.ir.IrNil;
import org.ember.compiler.ir.IrRemoteFun;
import org.ember.compiler.ir.IrTuple;
import org.ember.compiler.ir.IrVar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default pattern and clause lowering.
 * <p>
 * Multi-clause constructs export the variables their clauses bind. Each such variable gets one
 * common internal name; every clause body ends by assigning it, from the clause's own binding,
 * the binding that was in scope before the construct, or {@code nil}. The exported variable is safe
 * only when every clause bound it. Generated variables are never exported.
 */
public class DefaultClauseLowering implements ClauseLowering {

    @Override
    public <T> Lowered<T> match(MatchStep<T> step, ScopeState s) {
        if (s.isMatch()) {
            return step.apply(s);
        }
        ScopeState inMatch = s.withContext(ScopeState.Context.MATCH)
                .withMatchVars(Set.of())
                .withBackupVars(s.vars());
        Lowered<T> result = step.apply(inMatch);
        ScopeState restored = result.state()
                .withContext(s.context())
                .withMatchVars(s.matchVars())
                .withBackupVars(s.backupVars());
        return new Lowered<>(result.value(), restored);
    }

    @Override
    public Lowered<IrClause> clause(Meta meta, ArgStep argStep, List<AstNode> args, AstNode body, List<AstNode> guards,
                                    ScopeState s, LoweringContext ctx) {
        Lowered<List<IrExpr>> patterns = match(st -> argStep.apply(args, st), s.withExtraGuards(List.of()));
        ScopeState afterArgs = patterns.state();
        List<IrExpr> extra = afterArgs.extraGuards();

        ScopeState guardState = afterArgs.withContext(ScopeState.Context.GUARD).withExtraGuards(List.of());
        List<List<IrExpr>> loweredGuards = new ArrayList<>();
        if (guards.isEmpty()) {
            if (!extra.isEmpty()) {
                loweredGuards.add(extra);
            }
        } else {
            for (AstNode guard : guards) {
                List<IrExpr> conjunction = new ArrayList<>();
                conjunction.add(ctx.lower(guard, guardState).value());
                conjunction.addAll(extra);
                loweredGuards.add(conjunction);
            }
        }

        Lowered<IrExpr> loweredBody = ctx.lower(body, afterArgs.withExtraGuards(List.of()));
        IrClause clause = new IrClause(IrAnno.of(meta), patterns.value(), loweredGuards, IrBlock.unblock(loweredBody.value()));
        return new Lowered<>(clause, loweredBody.state().withExtraGuards(s.extraGuards()));
    }

    @Override
    public Lowered<List<IrClause>> clauses(Meta meta, List<ClauseNode> clauses, ScopeState s, LoweringContext ctx) {
        return clauses(meta, clauses, null, s, ctx);
    }

    @Override
    public Lowered<List<IrClause>> clauses(Meta meta, List<ClauseNode> clauses, ClauseNode timeout, ScopeState s,
                                           LoweringContext ctx) {
        List<IrClause> lowered = new ArrayList<>();
        List<ScopeState> states = new ArrayList<>();
        ScopeState acc = s;
        for (ClauseNode clause : clauses) {
            GuardedArgs split = GuardedArgs.extract(clause.args());
            Lowered<IrClause> result = clause(clause.meta(), ctx::lowerArgs, split.args(), clause.body(), split.guards(),
                    ScopeState.mergeCounters(s, acc), ctx);
            lowered.add(result.value());
            states.add(result.state());
            acc = result.state();
        }
        if (timeout != null) {
            ScopeState in = ScopeState.mergeCounters(s, acc);
            Lowered<IrExpr> after = ctx.lower(timeout.args().get(0), in);
            Lowered<IrExpr> body = ctx.lower(timeout.body(), after.state());
            lowered.add(new IrClause(IrAnno.of(timeout.meta()), List.of(after.value()), List.of(),
                    IrBlock.unblock(body.value())));
            states.add(body.state());
            acc = body.state();
        }
        return normalize(meta, lowered, states, s, ScopeState.mergeCounters(s, acc), ctx);
    }

    private Lowered<List<IrClause>> normalize(Meta meta, List<IrClause> lowered, List<ScopeState> states,
                                              ScopeState before, ScopeState after, LoweringContext ctx) {
        Map<VarKey, VarBinding> outer = before.vars();
        List<Map<VarKey, VarBinding>> newBindings = new ArrayList<>(states.size());
        Set<VarKey> exported = new LinkedHashSet<>();
        for (ScopeState state : states) {
            Map<VarKey, VarBinding> bound = new LinkedHashMap<>();
            state.vars().forEach((key, binding) -> {
                if (!key.isGenerated() && !binding.equals(outer.get(key))) {
                    bound.put(key, binding);
                }
            });
            newBindings.add(bound);
            exported.addAll(bound.keySet());
        }
        if (exported.isEmpty()) {
            return new Lowered<>(lowered, after);
        }

        Map<VarKey, VarBinding> common = new LinkedHashMap<>();
        for (VarKey key : exported) {
            boolean everywhere = newBindings.stream().allMatch(bound -> bound.containsKey(key));
            VarBinding fresh = ctx.freshBinding(key.name());
            common.put(key, everywhere ? fresh : fresh.unsafe());
        }

        IrAnno anno = IrAnno.of(meta);
        List<IrClause> normalized = new ArrayList<>(lowered.size());
        for (int i = 0; i < lowered.size(); i++) {
            List<IrExpr> left = new ArrayList<>();
            List<IrExpr> right = new ArrayList<>();
            for (Map.Entry<VarKey, VarBinding> entry : common.entrySet()) {
                VarKey key = entry.getKey();
                left.add(new IrVar(anno, entry.getValue().internalName()));
                VarBinding own = newBindings.get(i).get(key);
                VarBinding previous = outer.get(key);
                if (own != null) {
                    right.add(new IrVar(anno, own.internalName()));
                } else if (previous != null) {
                    right.add(new IrVar(anno, previous.internalName()));
                } else {
                    right.add(new IrAtom(anno, "nil"));
                }
            }
            IrExpr export = left.size() == 1
                    ? new IrMatch(anno, left.get(0), right.get(0))
                    : new IrMatch(anno, new IrTuple(anno, left), new IrTuple(anno, right));
            IrClause clause = lowered.get(i);
            normalized.add(new IrClause(clause.anno(), clause.patterns(), clause.guards(),
                    appendExport(anno, clause.body(), export, ctx)));
        }

        Map<VarKey, VarBinding> vars = new LinkedHashMap<>(after.vars());
        common.forEach((key, binding) -> {
            vars.remove(key);
            vars.put(key, binding);
        });
        return new Lowered<>(normalized, after.withVars(vars));
    }

    /**
     * Adds the export match to a clause body while keeping the body's value. A last expression that
     * cannot bind anything is kept last; otherwise its value is stored first. An empty body is {@code nil}.
     */
    private List<IrExpr> appendExport(IrAnno anno, List<IrExpr> body, IrExpr export, LoweringContext ctx) {
        if (body.isEmpty()) {
            return List.of(export, new IrAtom(anno, "nil"));
        }
        List<IrExpr> result = new ArrayList<>(body.subList(0, body.size() - 1));
        IrExpr last = body.get(body.size() - 1);
        if (isInert(last)) {
            result.add(export);
            result.add(last);
        } else if (last instanceof IrMatch match && match.pattern() instanceof IrVar var && !var.name().equals("_")) {
            result.add(last);
            result.add(export);
            result.add(var);
        } else {
            IrVar storage = new IrVar(anno, ctx.buildVar());
            result.add(new IrMatch(anno, storage, last));
            result.add(export);
            result.add(storage);
        }
        return result;
    }

    private static boolean isInert(IrExpr expr) {
        return expr instanceof IrVar || expr instanceof IrAtom || expr instanceof IrInteger
                || expr instanceof IrFloat || expr instanceof IrNil || expr instanceof IrLocalFun
                || expr instanceof IrRemoteFun || expr instanceof IrClosure;
    }
}

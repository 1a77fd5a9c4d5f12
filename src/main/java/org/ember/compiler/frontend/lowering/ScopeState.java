package org.ember.compiler.frontend.lowering;

import org.ember.compiler.ir.IrExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable compilation scope threaded through lowering. Every change returns a new state; branches
 * start from the same state and are merged explicitly with {@link #mergeVars}, {@link #mergeCounters}
 * and {@link #mergeSection}.
 *
 * @param file        The file being compiled.
 * @param context     Whether nodes are lowered as expressions, patterns or guards.
 * @param extra       The sub-mode of the current context.
 * @param vars        The variables in scope, in binding order.
 * @param backupVars  The variables in scope when the current match began. Pins read from here.
 * @param matchVars   The variables bound by the current match.
 * @param extraGuards Guards produced by pins in the current clause head.
 * @param caller      Whether the caller-identity pseudo-variable was referenced.
 */
public record ScopeState(
        String file,
        Context context,
        ExtraMode extra,
        Map<VarKey, VarBinding> vars,
        Map<VarKey, VarBinding> backupVars,
        Set<VarKey> matchVars,
        List<IrExpr> extraGuards,
        boolean caller
) {

    public enum Context {
        EXPRESSION,
        MATCH,
        GUARD
    }

    public enum ExtraMode {
        NONE,
        /** Pins in a function head become equality guards. */
        PIN_GUARD,
        /** A map key is being lowered. */
        MAP_KEY
    }

    public ScopeState {
        vars = Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        backupVars = Collections.unmodifiableMap(new LinkedHashMap<>(backupVars));
        matchVars = Collections.unmodifiableSet(new LinkedHashSet<>(matchVars));
        extraGuards = List.copyOf(extraGuards);
    }

    /**
     * @param file The file being compiled.
     * @return The state at the start of a top-level form.
     */
    public static ScopeState initial(String file) {
        return new ScopeState(file, Context.EXPRESSION, ExtraMode.NONE, Map.of(), Map.of(), Set.of(), List.of(), false);
    }

    public Optional<VarBinding> lookup(VarKey key) {
        return Optional.ofNullable(vars.get(key));
    }

    public boolean isMatch() {
        return context == Context.MATCH;
    }

    public ScopeState withContext(Context newContext) {
        return new ScopeState(file, newContext, extra, vars, backupVars, matchVars, extraGuards, caller);
    }

    public ScopeState withExtra(ExtraMode newExtra) {
        return new ScopeState(file, context, newExtra, vars, backupVars, matchVars, extraGuards, caller);
    }

    public ScopeState withVars(Map<VarKey, VarBinding> newVars) {
        return new ScopeState(file, context, extra, newVars, backupVars, matchVars, extraGuards, caller);
    }

    public ScopeState withBackupVars(Map<VarKey, VarBinding> newBackupVars) {
        return new ScopeState(file, context, extra, vars, newBackupVars, matchVars, extraGuards, caller);
    }

    public ScopeState withMatchVars(Set<VarKey> newMatchVars) {
        return new ScopeState(file, context, extra, vars, backupVars, newMatchVars, extraGuards, caller);
    }

    public ScopeState withExtraGuards(List<IrExpr> newExtraGuards) {
        return new ScopeState(file, context, extra, vars, backupVars, matchVars, newExtraGuards, caller);
    }

    public ScopeState withCaller(boolean newCaller) {
        return new ScopeState(file, context, extra, vars, backupVars, matchVars, extraGuards, newCaller);
    }

    /**
     * Binds a variable in the current match.
     *
     * @param key     The source variable.
     * @param binding Its new binding.
     * @return The state with the binding added to both the scope and the match variables.
     */
    public ScopeState bind(VarKey key, VarBinding binding) {
        Map<VarKey, VarBinding> newVars = new LinkedHashMap<>(vars);
        newVars.remove(key);
        newVars.put(key, binding);
        Set<VarKey> newMatchVars = new LinkedHashSet<>(matchVars);
        newMatchVars.add(key);
        return new ScopeState(file, context, extra, newVars, backupVars, newMatchVars, extraGuards, caller);
    }

    /**
     * @param guard A guard to add to the current clause.
     * @return The state with the guard appended.
     */
    public ScopeState addExtraGuard(IrExpr guard) {
        List<IrExpr> guards = new ArrayList<>(extraGuards);
        guards.add(guard);
        return withExtraGuards(guards);
    }

    /**
     * Sequential merge: {@code later} follows {@code earlier} in evaluation order.
     *
     * @return {@code later} with the variables of both (later bindings win), the guards of both and
     *         the caller flags combined.
     */
    public static ScopeState mergeVars(ScopeState earlier, ScopeState later) {
        Map<VarKey, VarBinding> merged = new LinkedHashMap<>(earlier.vars);
        later.vars.forEach((key, binding) -> {
            merged.remove(key);
            merged.put(key, binding);
        });
        Set<IrExpr> guards = new LinkedHashSet<>(earlier.extraGuards);
        guards.addAll(later.extraGuards);
        return new ScopeState(later.file, later.context, later.extra, merged, later.backupVars, later.matchVars,
                new ArrayList<>(guards), earlier.caller || later.caller);
    }

    /**
     * Keeps the scope of {@code base} but carries over what {@code evaluated} learned that outlives
     * scopes: the caller flag.
     */
    public static ScopeState mergeCounters(ScopeState base, ScopeState evaluated) {
        return base.withCaller(base.caller || evaluated.caller);
    }

    /**
     * Starts a section of a construct whose earlier sections may have been interrupted part way,
     * such as the rescue or after part of a try.
     *
     * @param base     The state the construct started from.
     * @param previous The state at the end of the previous section.
     * @return {@code base} with the bindings {@code previous} added on top of it visible as unsafe.
     */
    public static ScopeState mergeSection(ScopeState base, ScopeState previous) {
        Map<VarKey, VarBinding> merged = new LinkedHashMap<>(base.vars);
        previous.vars.forEach((key, binding) -> {
            if (!binding.equals(base.vars.get(key))) {
                merged.remove(key);
                merged.put(key, binding.unsafe());
            }
        });
        return base.withVars(merged).withCaller(base.caller || previous.caller);
    }
}

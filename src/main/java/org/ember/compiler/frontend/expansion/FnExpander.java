package org.ember.compiler.frontend.expansion;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.diagnostics.CompileError;
import org.ember.compiler.frontend.TreeWalker;
import org.ember.compiler.frontend.ast.AnonCallNode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.BitStringNode;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.FnNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.ast.Literal;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.MapNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.PairNode;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.StructNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.ast.WhenNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Expands function literals and the capture shorthand.
 * <p>
 * {@link #expand} validates that all clauses of a function literal share one arity.
 * {@link #capture} turns {@code &Mod.fun/arity}, {@code &local/arity} and {@code &(expr)} with
 * {@code &N} placeholders into either a direct function reference or a one-clause function literal.
 */
public class FnExpander {

    /** Context of the variables that replace {@code &N} placeholders. */
    public static final String CAPTURE_CONTEXT = "capture";

    private static final int MAX_CAPTURE_ARITY = 255;

    private final ClauseExpander clauseExpander;
    private final DispatchResolver resolver;
    private final TreeWalker walker = new TreeWalker();

    public FnExpander(ClauseExpander clauseExpander, DispatchResolver resolver) {
        this.clauseExpander = clauseExpander;
        this.resolver = resolver;
    }

    /**
     * Expands the clauses of a function literal.
     *
     * @param meta    The metadata of the {@code fn} node.
     * @param clauses The clauses, in source order.
     * @param env     The compilation environment.
     * @return The expanded function literal.
     * @throws CompileError with {@link CompilerErrorCode#ARITY_MISMATCH} unless all clauses share one arity.
     */
    public FnNode expand(Meta meta, List<ClauseNode> clauses, Environment env) {
        List<ClauseNode> expanded = new ArrayList<>(clauses.size());
        TreeSet<Integer> arities = new TreeSet<>();
        for (ClauseNode clause : clauses) {
            ClauseNode e = clauseExpander.expandClause(meta, clause, env);
            arities.add(arity(e.args()));
            expanded.add(e);
        }
        if (arities.size() != 1) {
            throw CompileError.raise(meta.line(), env.file(), CompilerErrorCode.ARITY_MISMATCH,
                    "cannot mix clauses with different arities in anonymous functions");
        }
        return new FnNode(meta, expanded);
    }

    /**
     * @param args The argument list of a clause.
     * @return The number of patterns, not counting the guard of a {@code when} wrapper.
     */
    static int arity(List<AstNode> args) {
        if (args.size() == 1 && args.get(0) instanceof WhenNode when) {
            return when.args().size() - 1;
        }
        return args.size();
    }

    /**
     * Expands the payload of a capture operator.
     *
     * @param meta The metadata of the {@code &} node.
     * @param expr The captured expression.
     * @param env  The compilation environment.
     * @return A direct reference, or a function literal that the caller still has to expand.
     */
    public CaptureResult capture(Meta meta, AstNode expr, Environment env) {
        if (expr instanceof LocalCallNode call && call.name().equals("/") && call.args().size() == 2
                && call.args().get(1) instanceof Literal arity) {
            AstNode target = call.args().get(0);
            if (target instanceof RemoteCallNode remote && remote.args().isEmpty()) {
                List<AstNode> args = argsFromArity(meta, arity, env);
                return captureRequire(meta,
                        new RemoteCallNode(remote.receiver(), remote.name(), remote.meta(), args), env, true);
            }
            if (target instanceof VarNode var) {
                List<AstNode> args = argsFromArity(meta, arity, env);
                return captureImport(meta, new LocalCallNode(var.name(), importMeta(meta), args), env, true);
            }
        }
        if (expr instanceof RemoteCallNode remote) {
            return captureRequire(meta, remote, env, isSequentialAndNotEmpty(remote.args()));
        }
        if (expr instanceof AnonCallNode) {
            return captureExpr(meta, expr, env, false);
        }
        if (expr instanceof BlockNode block) {
            if (block.exprs().size() == 1) {
                return capture(meta, block.exprs().get(0), env);
            }
            throw CompileError.raise(meta.line(), env.file(), CompilerErrorCode.BLOCK_IN_CAPTURE,
                    "invalid args for &, block expressions are not allowed, got: %s", AstPrinter.toDisplayString(expr));
        }
        if (expr instanceof LocalCallNode call) {
            return captureImport(meta, call, env, isSequentialAndNotEmpty(call.args()));
        }
        if (expr instanceof PairNode pair) {
            return capture(meta, new TupleNode(meta, List.of(pair.left(), pair.right())), env);
        }
        if (expr instanceof ListNode list) {
            return captureExpr(meta, list, env, isSequentialAndNotEmpty(list.elements()));
        }
        if (expr instanceof TupleNode || expr instanceof MapNode || expr instanceof StructNode
                || expr instanceof BitStringNode || expr instanceof MatchNode) {
            return captureExpr(meta, expr, env, false);
        }
        if (expr instanceof IntegerLiteral placeholder) {
            if (placeholder.value() > 0) {
                throw CompileError.raise(meta.line(), env.file(), CompilerErrorCode.BARE_CAPTURE_DIGIT,
                        "unhandled &%d outside of a capture", placeholder.value());
            }
            throw CompileError.raise(meta.line(), env.file(), CompilerErrorCode.NON_POSITIVE_PLACEHOLDER,
                    "capture &%d is not allowed", placeholder.value());
        }
        if (expr instanceof CaptureNode nested) {
            throw nestedCapture(nested, env);
        }
        throw invalidCapture(meta, expr, env);
    }

    private Meta importMeta(Meta meta) {
        Optional<Meta.ImportHint> hint = meta.importFa();
        if (hint.isEmpty()) {
            return meta;
        }
        return meta.with(Meta.IMPORT, hint.get().receiver()).with(Meta.CONTEXT, hint.get().context());
    }

    private CaptureResult captureImport(Meta meta, LocalCallNode call, Environment env, boolean sequential) {
        if (sequential) {
            Optional<CaptureResult> resolved = resolver.resolveImport(call.meta(), call.name(), call.args().size(), env);
            if (resolved.isPresent()) {
                return resolved.get();
            }
        }
        return captureExpr(meta, call, env, sequential);
    }

    private CaptureResult captureRequire(Meta meta, RemoteCallNode call, Environment env, boolean sequential) {
        long counter = env.counter().next();
        SortedMap<Integer, VarNode> placeholders = new TreeMap<>();
        AstNode receiver = escape(call.receiver(), counter, placeholders, env);
        if (!placeholders.isEmpty()) {
            RemoteCallNode escaped = new RemoteCallNode(receiver, call.name(), call.meta(), call.args());
            return captureExpr(meta, escaped, counter, placeholders, env, sequential);
        }
        if (sequential) {
            int arity = call.args().size();
            Optional<CaptureResult> resolved = Optional.empty();
            if (receiver instanceof VarNode) {
                resolved = Optional.of(new CaptureResult.RemoteRef(receiver, call.name(), arity));
            } else if (receiver instanceof AtomLiteral module) {
                resolved = resolver.resolveRequire(call.meta(), module.value(), call.name(), arity, env);
            }
            if (resolved.isPresent()) {
                return resolved.get();
            }
        }
        return captureExpr(meta, call, env, sequential);
    }

    private CaptureResult captureExpr(Meta meta, AstNode expr, Environment env, boolean sequential) {
        return captureExpr(meta, expr, env.counter().next(), new TreeMap<>(), env, sequential);
    }

    private CaptureResult captureExpr(Meta meta, AstNode expr, long counter, SortedMap<Integer, VarNode> placeholders,
                                      Environment env, boolean sequential) {
        AstNode body = escape(expr, counter, placeholders, env);
        if (placeholders.isEmpty() && !sequential) {
            throw invalidCapture(meta, expr, env);
        }
        List<AstNode> vars = validate(meta, placeholders, env);
        return new CaptureResult.Expand(new FnNode(meta, List.of(new ClauseNode(meta, vars, body))));
    }

    /**
     * Replaces every {@code &N} inside {@code expr} with the variable {@code xN}, recording the
     * replacements in {@code placeholders}.
     */
    private AstNode escape(AstNode expr, long counter, SortedMap<Integer, VarNode> placeholders, Environment env) {
        return walker.transform(expr, node -> {
            if (!(node instanceof CaptureNode capture)) {
                return null;
            }
            if (capture.expr() instanceof IntegerLiteral index) {
                if (index.value() <= 0) {
                    throw CompileError.raise(capture.meta().line(), env.file(), CompilerErrorCode.NON_POSITIVE_PLACEHOLDER,
                            "capture &%d is not allowed", index.value());
                }
                int position = (int) index.value();
                return placeholders.computeIfAbsent(position,
                        p -> new VarNode("x" + p, Meta.counter(counter), CAPTURE_CONTEXT));
            }
            throw nestedCapture(capture, env);
        });
    }

    private List<AstNode> validate(Meta meta, SortedMap<Integer, VarNode> placeholders, Environment env) {
        List<AstNode> vars = new ArrayList<>(placeholders.size());
        int expected = 1;
        for (Map.Entry<Integer, VarNode> entry : placeholders.entrySet()) {
            if (entry.getKey() != expected) {
                throw CompileError.raise(meta.line(), env.file(), CompilerErrorCode.GAP_IN_PLACEHOLDERS,
                        "capture &%d cannot be defined without &%d", entry.getKey(), expected);
            }
            vars.add(entry.getValue());
            expected++;
        }
        return vars;
    }

    private List<AstNode> argsFromArity(Meta meta, Literal arity, Environment env) {
        if (!(arity instanceof IntegerLiteral count) || count.value() < 0 || count.value() > MAX_CAPTURE_ARITY) {
            throw CompileError.raise(meta.line(), env.file(), CompilerErrorCode.INVALID_CAPTURE_ARITY,
                    "invalid arity for &, expected a number between 0 and %d, got: %s",
                    MAX_CAPTURE_ARITY, AstPrinter.toDisplayString(arity));
        }
        List<AstNode> args = new ArrayList<>((int) count.value());
        for (int i = 1; i <= count.value(); i++) {
            args.add(new CaptureNode(Meta.EMPTY, IntegerLiteral.of(i)));
        }
        return args;
    }

    /**
     * @return {@code true} when {@code args} is exactly {@code &1, &2, ..., &K} with K at least one.
     */
    static boolean isSequentialAndNotEmpty(List<AstNode> args) {
        if (args.isEmpty()) {
            return false;
        }
        for (int i = 0; i < args.size(); i++) {
            if (!(args.get(i) instanceof CaptureNode capture)
                    || !(capture.expr() instanceof IntegerLiteral index)
                    || index.value() != i + 1) {
                return false;
            }
        }
        return true;
    }

    private CompileError nestedCapture(CaptureNode capture, Environment env) {
        return CompileError.raise(capture.meta().line(), env.file(), CompilerErrorCode.NESTED_CAPTURE,
                "nested captures via & are not allowed: %s", AstPrinter.toDisplayString(capture));
    }

    private CompileError invalidCapture(Meta meta, AstNode expr, Environment env) {
        return CompileError.raise(meta.line(), env.file(), CompilerErrorCode.INVALID_CAPTURE_SHAPE,
                "invalid args for &, expected an expression in the format of &Mod.fun/arity, "
                        + "&local/arity or a capture containing at least one argument as &1, got: %s",
                AstPrinter.toDisplayString(expr));
    }
}

package org.ember.compiler.frontend.lowering;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.diagnostics.CompileError;
import org.ember.compiler.diagnostics.DiagnosticsEngine;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.Literal;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.expansion.Environment;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrCall;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrRemote;

import java.util.ArrayList;
import java.util.List;

/**
 * Context passed to lowerers and clause collaborators while lowering one form.
 * Provides child lowering, the argument rule, fresh names, diagnostics and configuration access.
 */
public final class LoweringContext {

	private final Environment env;
	private final DiagnosticsEngine diagnostics;
	private final LowererRegistry registry;
	private final LoweringCollaborators collaborators;

	/**
	 * Constructs a new lowering context.
	 * @param env The compilation environment.
	 * @param diagnostics The diagnostics engine for reporting warnings.
	 * @param registry The registry for resolving node lowerers.
	 * @param collaborators The clause, bit-string, comprehension, with and try collaborators.
	 */
	public LoweringContext(Environment env, DiagnosticsEngine diagnostics, LowererRegistry registry,
						   LoweringCollaborators collaborators) {
		this.env = env;
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.collaborators = collaborators;
	}

	/**
	 * Lowers the given node by resolving and invoking the appropriate lowerer.
	 * @param node The node to lower.
	 * @param s The scope state before the node.
	 * @return The lowered node and the resulting state.
	 */
	public Lowered<IrExpr> lower(AstNode node, ScopeState s) {
		return registry.resolve(node).lower(node, s, this);
	}

	/**
	 * Lowers one argument of a call or container outside of a match. Literals are lowered on their own
	 * and leave the accumulated state untouched; anything else is lowered from the accumulated state,
	 * in the mode of {@code s}, and its result is merged forward.
	 *
	 * @param arg The argument.
	 * @param acc The state accumulated from the previous arguments.
	 * @param s The state of the enclosing node, which decides the mode.
	 * @return The lowered argument and the new accumulated state.
	 */
	public Lowered<IrExpr> lowerArg(AstNode arg, ScopeState acc, ScopeState s) {
		if (arg instanceof Literal) {
			return new Lowered<>(lower(arg, s).value(), acc);
		}
		Lowered<IrExpr> lowered = lower(arg, acc.withContext(s.context()).withExtra(s.extra()));
		return new Lowered<>(lowered.value(), ScopeState.mergeVars(acc, lowered.state()));
	}

	/**
	 * Lowers arguments left to right. Inside a match the state is threaded as is; elsewhere
	 * {@link #lowerArg} applies to each argument.
	 *
	 * @param args The arguments.
	 * @param s The state before the first argument.
	 * @return The lowered arguments and the state after the last one.
	 */
	public Lowered<List<IrExpr>> lowerArgs(List<AstNode> args, ScopeState s) {
		List<IrExpr> lowered = new ArrayList<>(args.size());
		ScopeState acc = s;
		for (AstNode arg : args) {
			Lowered<IrExpr> result = s.isMatch() ? lower(arg, acc) : lowerArg(arg, acc, s);
			lowered.add(result.value());
			acc = result.state();
		}
		return new Lowered<>(lowered, acc);
	}

	/**
	 * @param name The source name the variable stands for.
	 * @return A safe binding with a unique internal name {@code _name@N}.
	 */
	public VarBinding freshBinding(String name) {
		long counter = env.counter().next();
		return new VarBinding("_" + name + "@" + counter, counter, true);
	}

	/**
	 * @return The internal name of a new compiler temporary, {@code _@N}.
	 */
	public String buildVar() {
		return freshBinding("").internalName();
	}

	/**
	 * Builds a call to a function of the runtime module, e.g. {@code erlang:error/1}.
	 */
	public IrExpr runtimeCall(IrAnno anno, String function, List<IrExpr> args) {
		IrRemote target = new IrRemote(anno, new IrAtom(anno, config().runtimeModule()), new IrAtom(anno, function));
		return new IrCall(anno, target, args);
	}

	/**
	 * Reports a warning for the given node.
	 */
	public void warn(Meta meta, String format, Object... args) {
		diagnostics.reportWarning(String.format(format, args), env.file(), meta.line());
	}

	/**
	 * Raises a compile error for the given node. Never returns normally.
	 *
	 * @return never returns; declared so callers can write {@code throw ctx.error(...)}
	 */
	public CompileError error(Meta meta, CompilerErrorCode code, String format, Object... args) {
		return CompileError.raise(meta.line(), env.file(), code, format, args);
	}

	public CompilerConfig config() {
		return env.config();
	}

	public Environment env() {
		return env;
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public LoweringCollaborators collaborators() {
		return collaborators;
	}
}

package org.ember.compiler.frontend.lowering;

import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.diagnostics.DiagnosticsEngine;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.expansion.Environment;
import org.ember.compiler.frontend.expansion.UniqueCounter;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrPrinter;

import java.util.Set;

/**
 * Wires a {@link LoweringContext} with the default lowerers and a counter starting at 1, so that
 * internal variable names are stable across test runs.
 */
public final class LoweringFixture {

	public static final String FILE = "test.ex";

	private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
	private final LoweringContext ctx;

	public LoweringFixture() {
		this(LoweringCollaborators.defaults());
	}

	public LoweringFixture(LoweringCollaborators collaborators) {
		Environment env = new Environment(FILE, "nil", CompilerConfig.defaults(), new UniqueCounter(1));
		this.ctx = new LoweringContext(env, diagnostics, LowererRegistry.initializeWithDefaults(), collaborators);
	}

	public LoweringContext ctx() {
		return ctx;
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public ScopeState initial() {
		return ScopeState.initial(FILE);
	}

	/**
	 * @return {@code s} with the source variable {@code name} bound to {@code _name@0}.
	 */
	public static ScopeState bound(ScopeState s, String name) {
		ScopeState bound = s.bind(VarKey.of(VarNode.of(name)), new VarBinding("_" + name + "@0", 0, true));
		return bound.withMatchVars(Set.of());
	}

	public Lowered<IrExpr> lower(AstNode node, ScopeState s) {
		return ctx.lower(node, s);
	}

	public Lowered<IrExpr> lower(AstNode node) {
		return lower(node, initial());
	}

	public String print(AstNode node, ScopeState s) {
		return IrPrinter.print(lower(node, s).value());
	}

	public String print(AstNode node) {
		return print(node, initial());
	}
}

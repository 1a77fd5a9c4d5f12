package org.ember.compiler.frontend.lowering;

import org.ember.compiler.frontend.ast.AnonCallNode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.BitStringNode;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.CaseNode;
import org.ember.compiler.frontend.ast.CondNode;
import org.ember.compiler.frontend.ast.FloatLiteral;
import org.ember.compiler.frontend.ast.FnNode;
import org.ember.compiler.frontend.ast.ForNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.ast.Literal;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.MapNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.PairNode;
import org.ember.compiler.frontend.ast.PinNode;
import org.ember.compiler.frontend.ast.ReceiveNode;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.StringLiteral;
import org.ember.compiler.frontend.ast.StructNode;
import org.ember.compiler.frontend.ast.TryNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.ast.WithNode;
import org.ember.compiler.frontend.lowering.lowerers.AnonCallLowerer;
import org.ember.compiler.frontend.lowering.lowerers.BitStringNodeLowerer;
import org.ember.compiler.frontend.lowering.lowerers.BlockLowerer;
import org.ember.compiler.frontend.lowering.lowerers.CaptureLowerer;
import org.ember.compiler.frontend.lowering.lowerers.CaseLowerer;
import org.ember.compiler.frontend.lowering.lowerers.CondLowerer;
import org.ember.compiler.frontend.lowering.lowerers.FnLowerer;
import org.ember.compiler.frontend.lowering.lowerers.ForLowerer;
import org.ember.compiler.frontend.lowering.lowerers.ListLowerer;
import org.ember.compiler.frontend.lowering.lowerers.LiteralLowerer;
import org.ember.compiler.frontend.lowering.lowerers.LocalCallLowerer;
import org.ember.compiler.frontend.lowering.lowerers.MapLowerer;
import org.ember.compiler.frontend.lowering.lowerers.MatchLowerer;
import org.ember.compiler.frontend.lowering.lowerers.PairLowerer;
import org.ember.compiler.frontend.lowering.lowerers.PinLowerer;
import org.ember.compiler.frontend.lowering.lowerers.ReceiveLowerer;
import org.ember.compiler.frontend.lowering.lowerers.RemoteCallLowerer;
import org.ember.compiler.frontend.lowering.lowerers.StructLowerer;
import org.ember.compiler.frontend.lowering.lowerers.TryLowerer;
import org.ember.compiler.frontend.lowering.lowerers.TupleLowerer;
import org.ember.compiler.frontend.lowering.lowerers.VarLowerer;
import org.ember.compiler.frontend.lowering.lowerers.WithLowerer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to lowerer instances.
 * <p>
 * Provides explicit registration and a default lowerer fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered lowerer.
 */
public final class LowererRegistry {

	/** Every node type that may appear where an expression or pattern is lowered. */
	public static final List<Class<? extends AstNode>> LOWERABLE_NODE_TYPES = List.of(
			AtomLiteral.class, IntegerLiteral.class, FloatLiteral.class, StringLiteral.class,
			ListNode.class, PairNode.class, TupleNode.class, MapNode.class, StructNode.class, BitStringNode.class,
			VarNode.class, PinNode.class, MatchNode.class, BlockNode.class,
			LocalCallNode.class, RemoteCallNode.class, AnonCallNode.class,
			CaptureNode.class, FnNode.class, CondNode.class, CaseNode.class, TryNode.class, ReceiveNode.class,
			ForNode.class, WithNode.class);

	private final Map<Class<? extends AstNode>, INodeLowerer<? extends AstNode>> byClass = new HashMap<>();
	private final INodeLowerer<AstNode> defaultLowerer;

	private LowererRegistry(INodeLowerer<AstNode> defaultLowerer) {
		this.defaultLowerer = defaultLowerer;
	}

	/**
	 * Registers a lowerer for the given AST node class.
	 *
	 * @param nodeType The AST node class or interface.
	 * @param lowerer  The lowerer instance handling that class.
	 * @param <T>      Concrete AST type parameter.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, INodeLowerer<T> lowerer) {
		byClass.put(nodeType, lowerer);
	}

	/**
	 * Retrieves the lowerer strictly registered for the given class (no hierarchy search).
	 *
	 * @param nodeType The AST node class to look up.
	 * @return Optional lowerer if present.
	 */
	public Optional<INodeLowerer<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves a lowerer for the given node by searching the node's concrete class,
	 * then walking up its superclasses and interfaces. Falls back to the default lowerer.
	 *
	 * @param node The AST node instance to resolve a lowerer for.
	 * @return A non-null lowerer to handle the node.
	 */
	public INodeLowerer<AstNode> resolve(AstNode node) {
		return lookup(node.getClass()).orElse(defaultLowerer);
	}

	/**
	 * @return The lowerable node types that would fall back to the default lowerer.
	 */
	public List<Class<? extends AstNode>> unhandledNodeTypes() {
		List<Class<? extends AstNode>> unhandled = new ArrayList<>();
		for (Class<? extends AstNode> type : LOWERABLE_NODE_TYPES) {
			if (lookup(type).isEmpty()) {
				unhandled.add(type);
			}
		}
		return unhandled;
	}

	@SuppressWarnings("unchecked")
	private Optional<INodeLowerer<AstNode>> lookup(Class<?> type) {
		Class<?> c = type;
		while (c != null && AstNode.class.isAssignableFrom(c)) {
			INodeLowerer<?> found = byClass.get(c);
			if (found != null) return Optional.of((INodeLowerer<AstNode>) found);
			for (Class<?> i : c.getInterfaces()) {
				if (AstNode.class.isAssignableFrom(i)) {
					found = byClass.get(i.asSubclass(AstNode.class));
					if (found != null) return Optional.of((INodeLowerer<AstNode>) found);
				}
			}
			c = c.getSuperclass();
		}
		return Optional.empty();
	}

	/**
	 * @return The default/fallback lowerer used when no specific lowerer is registered.
	 */
	public INodeLowerer<AstNode> defaultLowerer() {
		return defaultLowerer;
	}

	/**
	 * Creates a registry with the given default lowerer and no registrations.
	 *
	 * @param defaultLowerer The fallback lowerer used for unknown node types.
	 * @return A new registry instance.
	 */
	public static LowererRegistry initialize(INodeLowerer<AstNode> defaultLowerer) {
		return new LowererRegistry(defaultLowerer);
	}

	/**
	 * Initializes a registry with the default lowerer and registers all built-in lowerers.
	 *
	 * @return A registry pre-populated with the standard lowerers.
	 */
	public static LowererRegistry initializeWithDefaults() {
		LowererRegistry reg = initialize(new DefaultNodeLowerer());
		reg.register(Literal.class, new LiteralLowerer());
		reg.register(ListNode.class, new ListLowerer());
		reg.register(PairNode.class, new PairLowerer());
		reg.register(TupleNode.class, new TupleLowerer());
		reg.register(MapNode.class, new MapLowerer());
		reg.register(StructNode.class, new StructLowerer());
		reg.register(BitStringNode.class, new BitStringNodeLowerer());
		reg.register(VarNode.class, new VarLowerer());
		reg.register(PinNode.class, new PinLowerer());
		reg.register(MatchNode.class, new MatchLowerer());
		reg.register(BlockNode.class, new BlockLowerer());
		reg.register(LocalCallNode.class, new LocalCallLowerer());
		reg.register(RemoteCallNode.class, new RemoteCallLowerer());
		reg.register(AnonCallNode.class, new AnonCallLowerer());
		reg.register(CaptureNode.class, new CaptureLowerer());
		reg.register(FnNode.class, new FnLowerer());
		reg.register(CondNode.class, new CondLowerer());
		reg.register(CaseNode.class, new CaseLowerer());
		reg.register(TryNode.class, new TryLowerer());
		reg.register(ReceiveNode.class, new ReceiveLowerer());
		reg.register(ForNode.class, new ForLowerer());
		reg.register(WithNode.class, new WithLowerer());
		return reg;
	}
}

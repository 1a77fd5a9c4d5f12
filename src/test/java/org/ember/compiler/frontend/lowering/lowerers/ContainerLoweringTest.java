package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.ConsNode;
import org.ember.compiler.frontend.ast.FloatLiteral;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.ast.MapNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.PairNode;
import org.ember.compiler.frontend.ast.StringLiteral;
import org.ember.compiler.frontend.ast.StructNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringFixture;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.VarKey;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrCall;
import org.ember.compiler.ir.IrCase;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrMap;
import org.ember.compiler.ir.IrMapField;
import org.ember.compiler.ir.IrPrinter;
import org.ember.compiler.ir.IrVar;
import org.ember.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
class ContainerLoweringTest {

	private LoweringFixture fixture;

	@BeforeEach
	void setUp() {
		fixture = new LoweringFixture();
	}

	@Test
	@Tag("unit")
	void lowersLiterals() {
		assertThat(fixture.print(AtomLiteral.of("ok"))).isEqualTo("{atom,0,ok}");
		assertThat(fixture.print(AtomLiteral.of("Elixir.Enum"))).isEqualTo("{atom,0,'Elixir.Enum'}");
		assertThat(fixture.print(IntegerLiteral.of(42))).isEqualTo("{integer,0,42}");
		assertThat(fixture.print(new FloatLiteral(1.5))).isEqualTo("{float,0,1.5}");
		assertThat(fixture.print(new StringLiteral("hi")))
				.isEqualTo("{bin,0,[{bin_element,0,{string,0,\"hi\"},default,default}]}");
	}

	@Test
	@Tag("unit")
	void lowersProperAndImproperLists() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "t");

		assertThat(fixture.print(ListNode.of())).isEqualTo("{nil,0}");
		assertThat(fixture.print(ListNode.of(IntegerLiteral.of(1), IntegerLiteral.of(2))))
				.isEqualTo("{cons,0,{integer,0,1},{cons,0,{integer,0,2},{nil,0}}}");
		assertThat(fixture.print(ListNode.of(IntegerLiteral.of(1), new ConsNode(Meta.EMPTY, IntegerLiteral.of(2), VarNode.of("t"))), s))
				.isEqualTo("{cons,0,{integer,0,1},{cons,0,{integer,0,2},{var,0,'_t@0'}}}");
	}

	@Test
	@Tag("unit")
	void lowersTuplesAndPairs() {
		assertThat(fixture.print(new TupleNode(Meta.line(2), List.of(AtomLiteral.of("ok"), IntegerLiteral.of(1)))))
				.isEqualTo("{tuple,2,[{atom,0,ok},{integer,0,1}]}");
		assertThat(fixture.print(new PairNode(AtomLiteral.of("a"), AtomLiteral.of("b"))))
				.isEqualTo("{tuple,0,[{atom,0,a},{atom,0,b}]}");
	}

	@Test
	@Tag("unit")
	void mapLiteralUsesAssociationFields() {
		MapNode map = new MapNode(Meta.line(1), null, List.of(new PairNode(AtomLiteral.of("a"), IntegerLiteral.of(1))));

		assertThat(fixture.print(map)).isEqualTo("{map,1,[{map_field_assoc,1,{atom,0,a},{integer,0,1}}]}");
	}

	@Test
	@Tag("unit")
	void mapPatternUsesExactFieldsAndBindsValues() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "m");
		MapNode pattern = new MapNode(Meta.line(1), null, List.of(new PairNode(AtomLiteral.of("a"), VarNode.of("x"))));

		Lowered<IrExpr> result = fixture.lower(new MatchNode(Meta.line(1), pattern, VarNode.of("m")), s);

		assertThat(IrPrinter.print(result.value()))
				.isEqualTo("{match,1,{map,1,[{map_field_exact,1,{atom,0,a},{var,0,'_x@1'}}]},{var,0,'_m@0'}}");
		assertThat(result.state().lookup(VarKey.of(VarNode.of("x")))).isPresent();
		assertThat(result.state().extra()).isEqualTo(ScopeState.ExtraMode.NONE);
	}

	@Test
	@Tag("unit")
	void mapUpdateUsesExactFields() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "m");
		MapNode update = new MapNode(Meta.line(1), VarNode.of("m"), List.of(new PairNode(AtomLiteral.of("a"), IntegerLiteral.of(1))));

		assertThat(fixture.print(update, s))
				.isEqualTo("{map,1,{var,0,'_m@0'},[{map_field_exact,1,{atom,0,a},{integer,0,1}}]}");
	}

	@Test
	@Tag("unit")
	void structLiteralAddsStructKey() {
		StructNode struct = new StructNode(Meta.EMPTY, AtomLiteral.of("Elixir.User"),
				new MapNode(Meta.EMPTY, null, List.of(new PairNode(AtomLiteral.of("name"), IntegerLiteral.of(1)))));

		assertThat(fixture.print(struct)).isEqualTo("{map,0,["
				+ "{map_field_assoc,0,{atom,0,name},{integer,0,1}},"
				+ "{map_field_assoc,0,{atom,0,'__struct__'},{atom,0,'Elixir.User'}}]}");
	}

	@Test
	@Tag("unit")
	void structUpdateChecksTheStructBeforeUpdating() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "u");
		StructNode update = new StructNode(Meta.line(5), AtomLiteral.of("Elixir.User"),
				new MapNode(Meta.line(5), VarNode.of("u"), List.of(new PairNode(AtomLiteral.of("name"), IntegerLiteral.of(2)))));

		IrExpr result = fixture.lower(update, s).value();

		assertThat(result).isInstanceOf(IrCase.class);
		IrCase check = (IrCase) result;
		assertThat(check.anno().generated()).isTrue();
		assertThat(IrPrinter.print(check.expr())).isEqualTo("{var,0,'_u@0'}");
		assertThat(check.clauses()).hasSize(2);

		IrClause matched = check.clauses().get(0);
		assertThat(IrPrinter.print(matched.patterns().get(0))).isEqualTo(
				"{match,5,{var,5,'_@1'},{map,5,[{map_field_exact,5,{atom,5,'__struct__'},{atom,5,'Elixir.User'}}]}}");
		assertThat(IrPrinter.print(matched.body().get(0))).isEqualTo(
				"{map,5,{var,5,'_@1'},[{map_field_exact,5,{atom,0,name},{integer,0,2}}]}");

		IrClause mismatched = check.clauses().get(1);
		assertThat(mismatched.anno().generated()).isTrue();
		assertThat(mismatched.body().get(0)).isInstanceOfSatisfying(IrCall.class, call ->
				assertThat(IrPrinter.print(call)).isEqualTo(
						"{call,5,{remote,5,{atom,5,erlang},{atom,5,error}},"
								+ "[{tuple,5,[{atom,5,badstruct},{atom,5,'Elixir.User'},{var,5,'_@1'}]}]}"));
	}

	@Test
	@Tag("unit")
	void mapKeysAreLoweredInKeyMode() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "k");
		MapNode map = new MapNode(Meta.EMPTY, null, List.of(new PairNode(VarNode.of("k"), IntegerLiteral.of(1))));

		IrMap lowered = (IrMap) fixture.lower(map, s).value();

		assertThat(lowered.fields()).singleElement().satisfies(field -> {
			assertThat(field.kind()).isEqualTo(IrMapField.Kind.ASSOC);
			assertThat(field.key()).isEqualTo(new IrVar(IrAnno.NONE, "_k@0"));
		});
	}
}

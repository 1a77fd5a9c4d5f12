package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.diagnostics.CompileError;
import org.ember.compiler.frontend.ast.AnonCallNode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringFixture;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.VarKey;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrCall;
import org.ember.compiler.ir.IrCase;
import org.ember.compiler.ir.IrClause;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrMap;
import org.ember.compiler.ir.IrMapField;
import org.ember.compiler.ir.IrPrinter;
import org.ember.compiler.ir.IrRemote;
import org.ember.compiler.ir.IrVar;
import org.ember.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(LogWatchExtension.class)
class CallLoweringTest {

	private LoweringFixture fixture;

	@BeforeEach
	void setUp() {
		fixture = new LoweringFixture();
	}

	private static AstNode erlang(String name, AstNode... args) {
		return new RemoteCallNode(AtomLiteral.of("erlang"), name, Meta.EMPTY, List.of(args));
	}

	@Test
	@Tag("unit")
	void localCallSeesBindingsOfEarlierArguments() {
		AstNode call = new LocalCallNode("foo", Meta.line(3), List.of(
				new MatchNode(Meta.EMPTY, VarNode.of("x"), IntegerLiteral.of(1)), VarNode.of("x")));

		Lowered<IrExpr> result = fixture.lower(call);

		assertThat(IrPrinter.print(result.value())).isEqualTo(
				"{call,3,{atom,3,foo},[{match,0,{var,0,'_x@1'},{integer,0,1}},{var,0,'_x@1'}]}");
		assertThat(result.state().lookup(VarKey.of(VarNode.of("x")))).isPresent();
	}

	@Test
	@Tag("unit")
	void guardOperatorOfRuntimeModuleBecomesOperator() {
		assertThat(fixture.print(erlang("+", IntegerLiteral.of(1), IntegerLiteral.of(2))))
				.isEqualTo("{op,0,'+',{integer,0,1},{integer,0,2}}");
		assertThat(fixture.print(erlang("not", AtomLiteral.of("true"))))
				.isEqualTo("{op,0,'not',{atom,0,true}}");
	}

	@Test
	@Tag("unit")
	void otherRemoteCallsStayCalls() {
		AstNode call = new RemoteCallNode(AtomLiteral.of("Elixir.Enum"), "map", Meta.line(2),
				List.of(AtomLiteral.of("a"), AtomLiteral.of("b")));

		assertThat(fixture.print(call)).isEqualTo(
				"{call,2,{remote,2,{atom,0,'Elixir.Enum'},{atom,2,map}},[{atom,0,a},{atom,0,b}]}");
		assertThat(fixture.print(erlang("is_atom", AtomLiteral.of("a"))))
				.isEqualTo("{call,0,{remote,0,{atom,0,erlang},{atom,0,is_atom}},[{atom,0,a}]}");
	}

	@Test
	@Tag("unit")
	void fieldAccessOnVariableBecomesGeneratedCase() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "map");
		AstNode access = new RemoteCallNode(VarNode.of("map"), "key", Meta.line(3), List.of());

		IrExpr result = fixture.lower(access, s).value();

		assertThat(result).isInstanceOf(IrCase.class);
		IrCase lowered = (IrCase) result;
		assertThat(lowered.anno().generated()).isTrue();
		assertThat(lowered.expr()).isEqualTo(new IrVar(IrAnno.NONE, "_map@0"));
		assertThat(lowered.clauses()).hasSize(3);

		IrClause found = lowered.clauses().get(0);
		assertThat(found.patterns().get(0)).isInstanceOfSatisfying(IrMap.class, map ->
				assertThat(map.fields()).singleElement().satisfies(field -> {
					assertThat(field.kind()).isEqualTo(IrMapField.Kind.EXACT);
					assertThat(field.key()).isInstanceOfSatisfying(IrAtom.class, key -> assertThat(key.value()).isEqualTo("key"));
				}));

		IrClause notMap = lowered.clauses().get(1);
		assertThat(notMap.guards()).singleElement().satisfies(guard -> assertThat(IrPrinter.print(guard.get(0)))
				.contains("{atom,[{location,0},{generated,true}],is_map}"));
		assertThat(IrPrinter.print(notMap.body().get(0))).contains("{atom,3,badkey},{atom,3,key},{var,3,'_@1'}");

		IrClause call = lowered.clauses().get(2);
		assertThat(call.body().get(0)).isInstanceOfSatisfying(IrCall.class, c -> {
			assertThat(c.args()).isEmpty();
			assertThat(c.target()).isInstanceOfSatisfying(IrRemote.class,
					r -> assertThat(r.module()).isEqualTo(call.patterns().get(0)));
		});
	}

	@Test
	@Tag("unit")
	void anonymousCallLowersFunctionBeforeArguments() {
		ScopeState s = LoweringFixture.bound(fixture.initial(), "f");
		AstNode call = new AnonCallNode(VarNode.of("f"), Meta.line(1), List.of(IntegerLiteral.of(1)));

		assertThat(fixture.print(call, s)).isEqualTo("{call,1,{var,0,'_f@0'},[{integer,0,1}]}");
	}

	@Test
	@Tag("unit")
	void capturesOfNamedFunctionsBecomeFunctionReferences() {
		AstNode remote = new CaptureNode(Meta.line(2), new LocalCallNode("/", Meta.EMPTY, List.of(
				new RemoteCallNode(AtomLiteral.of("Elixir.Enum"), "map", Meta.EMPTY, List.of()), IntegerLiteral.of(2))));
		AstNode local = new CaptureNode(Meta.line(2), new LocalCallNode("/", Meta.EMPTY, List.of(
				VarNode.of("foo"), IntegerLiteral.of(1))));

		assertThat(fixture.print(remote))
				.isEqualTo("{'fun',2,{function,{atom,0,'Elixir.Enum'},{atom,2,map},{integer,2,2}}}");
		assertThat(fixture.print(local)).isEqualTo("{'fun',2,{function,foo,1}}");
	}

	@Test
	@Tag("unit")
	void captureOfAnythingElseIsRejected() {
		AstNode capture = new CaptureNode(Meta.line(9), new LocalCallNode("foo", Meta.EMPTY, List.of()));

		assertThatThrownBy(() -> fixture.lower(capture))
				.isInstanceOfSatisfying(CompileError.class, e -> {
					assertThat(e.code()).isEqualTo(CompilerErrorCode.INVALID_CAPTURE_SHAPE);
					assertThat(e.source().lineNumber()).isEqualTo(9);
				});
	}
}

package org.ember.compiler.frontend.expansion;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.diagnostics.CompileError;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.FnNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Expands whole forms with the configuration-backed resolver.
 */
@ExtendWith(LogWatchExtension.class)
class ExpanderTest {

    private static final AtomLiteral KERNEL = AtomLiteral.of("Elixir.Kernel");
    private static final AtomLiteral ENUM = AtomLiteral.of("Elixir.Enum");

    private Expander expander;
    private Environment env;

    @BeforeEach
    void setUp() {
        expander = new Expander(new EnvironmentDispatchResolver());
        env = new Environment("t.ex", "nil", CompilerConfig.defaults(), new UniqueCounter(1));
    }

    private static CaptureNode amp(AstNode expr) {
        return new CaptureNode(Meta.line(3), expr);
    }

    private static CaptureNode placeholder(long n) {
        return new CaptureNode(Meta.EMPTY, IntegerLiteral.of(n));
    }

    private static AstNode slash(AstNode target, long arity) {
        return new LocalCallNode("/", Meta.EMPTY, List.of(target, IntegerLiteral.of(arity)));
    }

    private static AstNode remote(AstNode module, String name, AstNode... args) {
        return new RemoteCallNode(module, name, Meta.EMPTY, List.of(args));
    }

    private static VarNode x(int position, long counter) {
        return new VarNode("x" + position, Meta.counter(counter), FnExpander.CAPTURE_CONTEXT);
    }

    private AstNode expand(AstNode form) {
        return expander.expand(form, env);
    }

    private void expectCompileError(AstNode form, CompilerErrorCode code) {
        assertThatThrownBy(() -> expand(form))
                .isInstanceOfSatisfying(CompileError.class, e -> assertThat(e.code()).isEqualTo(code));
    }

    @Test
    @Tag("unit")
    void importedFunctionBecomesRemoteReference() {
        AstNode result = expand(amp(slash(VarNode.of("is_atom"), 1)));

        assertThat(result).isEqualTo(new CaptureResult.RemoteRef(KERNEL, "is_atom", 1).toAst(Meta.line(3)));
        assertThat(AstPrinter.toDisplayString(result)).isEqualTo("&Kernel.is_atom/1");
    }

    @Test
    @Tag("unit")
    void unknownNameBecomesLocalReference() {
        assertThat(expand(amp(slash(VarNode.of("foo"), 2))))
                .isEqualTo(new CaptureResult.LocalRef("foo", 2).toAst(Meta.line(3)));
    }

    @Test
    @Tag("unit")
    void macroReferenceBecomesFunctionLiteral() {
        AstNode result = expand(amp(slash(VarNode.of("if"), 2)));

        assertThat(result).isInstanceOfSatisfying(FnNode.class, fn -> {
            assertThat(fn.meta()).isEqualTo(Meta.line(3));
            ClauseNode clause = fn.clauses().get(0);
            assertThat(clause.args()).containsExactly(x(1, 1), x(2, 1));
            assertThat(clause.body()).isEqualTo(new LocalCallNode("if", Meta.line(3), List.of(x(1, 1), x(2, 1))));
        });
    }

    @Test
    @Tag("unit")
    void qualifiedMacroReferenceBecomesFunctionLiteral() {
        AstNode result = expand(amp(slash(remote(KERNEL, "unless"), 2)));

        assertThat(result).isInstanceOf(FnNode.class);
    }

    @Test
    @Tag("unit")
    void placeholderExpressionBecomesFunctionLiteral() {
        AstNode sum = new LocalCallNode("+", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(1)));

        AstNode result = expand(amp(sum));

        FnNode expected = new FnNode(Meta.line(3), List.of(new ClauseNode(Meta.line(3), List.of(x(1, 1)),
                new LocalCallNode("+", Meta.EMPTY, List.of(x(1, 1), IntegerLiteral.of(1))))));
        assertThat(result).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void expandedFormsExpandToThemselves() {
        AstNode fn = expand(amp(new LocalCallNode("+", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(1)))));
        AstNode reference = new CaptureResult.LocalRef("foo", 2).toAst(Meta.line(3));
        VarNode escaped = x(1, 1);

        assertThat(expand(fn)).isEqualTo(fn);
        assertThat(expand(reference)).isEqualTo(reference);
        assertThat(expand(escaped)).isSameAs(escaped);
        assertThat(env.counter().next()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void sequentialRemoteCallBecomesReference() {
        AstNode result = expand(amp(remote(ENUM, "map", placeholder(1), placeholder(2))));

        assertThat(result).isEqualTo(new CaptureResult.RemoteRef(ENUM, "map", 2).toAst(Meta.line(3)));
        assertThat(AstPrinter.toDisplayString(result)).isEqualTo("&Enum.map/2");
    }

    @Test
    @Tag("unit")
    void placeholderInReceiverIsEscaped() {
        AstNode call = new RemoteCallNode(placeholder(1), "run", Meta.EMPTY, List.of(placeholder(2)));

        AstNode result = expand(amp(call));

        assertThat(result).isInstanceOfSatisfying(FnNode.class, fn -> {
            ClauseNode clause = fn.clauses().get(0);
            assertThat(clause.args()).containsExactly(x(1, 1), x(2, 1));
            assertThat(clause.body()).isEqualTo(new RemoteCallNode(x(1, 1), "run", Meta.EMPTY, List.of(x(2, 1))));
        });
    }

    @Test
    @Tag("unit")
    void capturesInsideFunctionBodiesAreExpanded() {
        AstNode fn = new FnNode(Meta.line(1), List.of(new ClauseNode(Meta.line(1), List.of(VarNode.of("list")),
                remote(ENUM, "map", VarNode.of("list"), amp(slash(VarNode.of("hd"), 1))))));

        AstNode result = expand(fn);

        assertThat(AstPrinter.toDisplayString(result))
                .isEqualTo("fn list -> Enum.map(list, &Kernel.hd/1) end");
    }

    @Test
    @Tag("unit")
    void counterAdvancesForEveryCapture() {
        AstNode pair = new TupleNode(Meta.EMPTY, List.of(
                amp(new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(0)))),
                amp(new LocalCallNode("bar", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(0))))));

        TupleNode result = (TupleNode) expand(pair);

        assertThat(((FnNode) result.elements().get(0)).clauses().get(0).args()).containsExactly(x(1, 1));
        assertThat(((FnNode) result.elements().get(1)).clauses().get(0).args()).containsExactly(x(1, 2));
    }

    @Test
    @Tag("unit")
    void listAndMatchCapturesExpand() {
        assertThat(expand(amp(ListNode.of(placeholder(1), placeholder(2))))).isInstanceOf(FnNode.class);
        assertThat(expand(amp(new MatchNode(Meta.EMPTY, VarNode.of("a"), placeholder(1))))).isInstanceOf(FnNode.class);
    }

    @Test
    @Tag("unit")
    void rejectsMalformedCaptures() {
        expectCompileError(amp(new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(2)))),
                CompilerErrorCode.GAP_IN_PLACEHOLDERS);
        expectCompileError(amp(slash(VarNode.of("foo"), 256)), CompilerErrorCode.INVALID_CAPTURE_ARITY);
        expectCompileError(placeholder(1), CompilerErrorCode.BARE_CAPTURE_DIGIT);
        expectCompileError(amp(new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(0)))),
                CompilerErrorCode.NON_POSITIVE_PLACEHOLDER);
        expectCompileError(amp(placeholder(1)), CompilerErrorCode.NESTED_CAPTURE);
        expectCompileError(amp(ListNode.of()), CompilerErrorCode.INVALID_CAPTURE_SHAPE);
    }

    @Test
    @Tag("unit")
    void errorCarriesFileAndLine() {
        assertThatThrownBy(() -> expand(amp(slash(VarNode.of("foo"), 300))))
                .isInstanceOfSatisfying(CompileError.class, e -> {
                    assertThat(e.source().fileName()).isEqualTo("t.ex");
                    assertThat(e.source().lineNumber()).isEqualTo(3);
                    assertThat(e.getMessage()).contains("expected a number between 0 and 255, got: 300");
                });
    }

    @Test
    @Tag("unit")
    void rejectsFunctionWithMixedArities() {
        AstNode fn = new FnNode(Meta.line(2), List.of(
                new ClauseNode(Meta.line(2), List.of(VarNode.of("a")), VarNode.of("a")),
                new ClauseNode(Meta.line(2), List.of(VarNode.of("a"), VarNode.of("b")), VarNode.of("b"))));

        expectCompileError(fn, CompilerErrorCode.ARITY_MISMATCH);
    }

    @Test
    @Tag("unit")
    void formsWithoutFunctionsAreUnchanged() {
        AstNode form = new MatchNode(Meta.line(1), VarNode.of("a"), IntegerLiteral.of(1));

        assertThat(expand(form)).isEqualTo(form);
    }
}

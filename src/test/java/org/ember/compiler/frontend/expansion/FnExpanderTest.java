package org.ember.compiler.frontend.expansion;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.diagnostics.CompileError;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.FnNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.ListNode;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.TupleNode;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.ast.WhenNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FnExpanderTest {

    private static final Meta META = Meta.line(5);

    @Mock
    private DispatchResolver resolver;

    @Mock
    private ClauseExpander clauseExpander;

    private FnExpander expander;
    private Environment env;

    @BeforeEach
    void setUp() {
        expander = new FnExpander(clauseExpander, resolver);
        env = new Environment("t.ex", "nil", CompilerConfig.defaults(), new UniqueCounter(1));
    }

    private static CaptureNode placeholder(long n) {
        return new CaptureNode(Meta.EMPTY, IntegerLiteral.of(n));
    }

    private static AstNode slash(AstNode target, AstNode arity) {
        return new LocalCallNode("/", Meta.EMPTY, List.of(target, arity));
    }

    private static VarNode captureVar(int position, long counter) {
        return new VarNode("x" + position, Meta.counter(counter), FnExpander.CAPTURE_CONTEXT);
    }

    private static ClauseNode clause(AstNode... args) {
        return new ClauseNode(Meta.EMPTY, List.of(args), AtomLiteral.of("ok"));
    }

    private void expectCompileError(Runnable action, CompilerErrorCode code) {
        assertThatThrownBy(action::run).isInstanceOfSatisfying(CompileError.class, e -> assertThat(e.code()).isEqualTo(code));
    }

    @Test
    @Tag("unit")
    void expandKeepsClausesOfOneArity() {
        when(clauseExpander.expandClause(eq(META), any(ClauseNode.class), eq(env))).thenAnswer(inv -> inv.getArgument(1));
        ClauseNode guarded = clause(new WhenNode(Meta.EMPTY, List.of(VarNode.of("a"), AtomLiteral.of("true"))));

        FnNode fn = expander.expand(META, List.of(clause(VarNode.of("b")), guarded), env);

        assertThat(fn.meta()).isEqualTo(META);
        assertThat(fn.clauses()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void expandRejectsMixedArities() {
        when(clauseExpander.expandClause(eq(META), any(ClauseNode.class), eq(env))).thenAnswer(inv -> inv.getArgument(1));

        assertThatThrownBy(() -> expander.expand(META, List.of(clause(VarNode.of("a")), clause(VarNode.of("a"), VarNode.of("b"))), env))
                .isInstanceOfSatisfying(CompileError.class, e -> {
                    assertThat(e.code()).isEqualTo(CompilerErrorCode.ARITY_MISMATCH);
                    assertThat(e.source().lineNumber()).isEqualTo(5);
                    assertThat(e.getMessage()).isEqualTo("cannot mix clauses with different arities in anonymous functions");
                });
    }

    @Test
    @Tag("unit")
    void expandRejectsFunctionWithoutClauses() {
        expectCompileError(() -> expander.expand(META, List.of(), env), CompilerErrorCode.ARITY_MISMATCH);
    }

    @Test
    @Tag("unit")
    void localReferenceIsResolvedByTheResolver() {
        CaptureResult.LocalRef ref = new CaptureResult.LocalRef("foo", 2);
        when(resolver.resolveImport(any(Meta.class), eq("foo"), eq(2), eq(env))).thenReturn(Optional.of(ref));

        assertThat(expander.capture(META, slash(VarNode.of("foo"), IntegerLiteral.of(2)), env)).isSameAs(ref);
    }

    @Test
    @Tag("unit")
    void unresolvedReferenceExpandsToFunction() {
        when(resolver.resolveImport(any(Meta.class), eq("if"), eq(2), eq(env))).thenReturn(Optional.empty());

        CaptureResult result = expander.capture(META, slash(VarNode.of("if"), IntegerLiteral.of(2)), env);

        assertThat(result).isInstanceOfSatisfying(CaptureResult.Expand.class, expand -> {
            ClauseNode only = expand.fn().clauses().get(0);
            assertThat(only.args()).containsExactly(captureVar(1, 1), captureVar(2, 1));
            assertThat(only.body()).isInstanceOfSatisfying(LocalCallNode.class, call -> {
                assertThat(call.name()).isEqualTo("if");
                assertThat(call.args()).containsExactly(captureVar(1, 1), captureVar(2, 1));
            });
        });
    }

    @Test
    @Tag("unit")
    void importHintIsPassedToTheResolver() {
        Meta hinted = META.with(Meta.IMPORT_FA, new Meta.ImportHint("Elixir.Kernel", "Elixir"));
        when(resolver.resolveImport(any(Meta.class), anyString(), anyInt(), eq(env))).thenReturn(Optional.empty());

        expander.capture(hinted, slash(VarNode.of("hd"), IntegerLiteral.of(1)), env);

        verify(resolver).resolveImport(eq(hinted.with(Meta.IMPORT, "Elixir.Kernel").with(Meta.CONTEXT, "Elixir")),
                eq("hd"), eq(1), eq(env));
    }

    @Test
    @Tag("unit")
    void remoteReferenceIsResolvedAsRequire() {
        CaptureResult.RemoteRef ref = new CaptureResult.RemoteRef(AtomLiteral.of("Elixir.Enum"), "map", 2);
        when(resolver.resolveRequire(any(Meta.class), eq("Elixir.Enum"), eq("map"), eq(2), eq(env))).thenReturn(Optional.of(ref));
        AstNode target = new RemoteCallNode(AtomLiteral.of("Elixir.Enum"), "map", Meta.EMPTY, List.of());

        assertThat(expander.capture(META, slash(target, IntegerLiteral.of(2)), env)).isSameAs(ref);
    }

    @Test
    @Tag("unit")
    void remoteReferenceOnVariableNeedsNoResolver() {
        AstNode target = new RemoteCallNode(VarNode.of("mod"), "run", Meta.EMPTY, List.of());

        CaptureResult result = expander.capture(META, slash(target, IntegerLiteral.of(0)), env);

        assertThat(result).isEqualTo(new CaptureResult.RemoteRef(VarNode.of("mod"), "run", 0));
        verifyNoInteractions(resolver);
    }

    @Test
    @Tag("unit")
    void nonSequentialArgumentsSkipTheResolver() {
        AstNode call = new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(2)));

        CaptureResult result = expander.capture(META, call, env);

        assertThat(result).isInstanceOf(CaptureResult.Expand.class);
        verify(resolver, never()).resolveImport(any(), anyString(), anyInt(), any());
    }

    @Test
    @Tag("unit")
    void reorderedRemoteArgumentsBuildClosureWithoutResolver() {
        AstNode call = new RemoteCallNode(AtomLiteral.of("Elixir.Enum"), "map", Meta.EMPTY, List.of(placeholder(2), placeholder(1)));

        CaptureResult result = expander.capture(META, call, env);

        assertThat(result).isInstanceOfSatisfying(CaptureResult.Expand.class, expand -> {
            ClauseNode only = expand.fn().clauses().get(0);
            assertThat(only.args()).containsExactly(captureVar(1, 2), captureVar(2, 2));
            assertThat(only.body()).isInstanceOfSatisfying(RemoteCallNode.class, body -> {
                assertThat(body.name()).isEqualTo("map");
                assertThat(body.args()).containsExactly(captureVar(2, 2), captureVar(1, 2));
            });
        });
        verify(resolver, never()).resolveRequire(any(), anyString(), anyString(), anyInt(), any());
    }

    @Test
    @Tag("unit")
    void placeholdersBecomeParametersInOrder() {
        AstNode call = new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(2), placeholder(1), placeholder(2)));

        CaptureResult.Expand result = (CaptureResult.Expand) expander.capture(META, call, env);

        ClauseNode only = result.fn().clauses().get(0);
        assertThat(only.meta()).isEqualTo(META);
        assertThat(only.args()).containsExactly(captureVar(1, 1), captureVar(2, 1));
        assertThat(((LocalCallNode) only.body()).args()).containsExactly(captureVar(2, 1), captureVar(1, 1), captureVar(2, 1));
    }

    @Test
    @Tag("unit")
    void sequentialListAndTupleCapturesExpand() {
        CaptureResult list = expander.capture(META, ListNode.of(placeholder(1), placeholder(2)), env);
        CaptureResult tuple = expander.capture(META, new TupleNode(Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(0))), env);

        assertThat(list).isInstanceOfSatisfying(CaptureResult.Expand.class,
                e -> assertThat(e.fn().clauses().get(0).args()).hasSize(2));
        assertThat(tuple).isInstanceOfSatisfying(CaptureResult.Expand.class,
                e -> assertThat(e.fn().clauses().get(0).args()).hasSize(1));
    }

    @Test
    @Tag("unit")
    void singleExpressionBlockIsUnwrapped() {
        AstNode block = new BlockNode(Meta.EMPTY, List.of(new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(1)))));

        assertThat(expander.capture(META, block, env)).isInstanceOf(CaptureResult.Expand.class);
    }

    @Test
    @Tag("unit")
    void rejectsInvalidCaptures() {
        AstNode twoExprs = new BlockNode(Meta.EMPTY, List.of(placeholder(1), placeholder(2)));
        AstNode gap = new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(2)));
        AstNode zero = new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(0)));
        AstNode nested = new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(1),
                new CaptureNode(Meta.EMPTY, slash(VarNode.of("bar"), IntegerLiteral.of(1)))));

        expectCompileError(() -> expander.capture(META, twoExprs, env), CompilerErrorCode.BLOCK_IN_CAPTURE);
        expectCompileError(() -> expander.capture(META, gap, env), CompilerErrorCode.GAP_IN_PLACEHOLDERS);
        expectCompileError(() -> expander.capture(META, zero, env), CompilerErrorCode.NON_POSITIVE_PLACEHOLDER);
        expectCompileError(() -> expander.capture(META, nested, env), CompilerErrorCode.NESTED_CAPTURE);
        expectCompileError(() -> expander.capture(META, placeholder(1), env), CompilerErrorCode.BARE_CAPTURE_DIGIT);
        expectCompileError(() -> expander.capture(META, placeholder(-1), env), CompilerErrorCode.NON_POSITIVE_PLACEHOLDER);
        expectCompileError(() -> expander.capture(META, new CaptureNode(META, placeholder(1)), env), CompilerErrorCode.NESTED_CAPTURE);
        expectCompileError(() -> expander.capture(META, ListNode.of(), env), CompilerErrorCode.INVALID_CAPTURE_SHAPE);
        expectCompileError(() -> expander.capture(META, AtomLiteral.of("a"), env), CompilerErrorCode.INVALID_CAPTURE_SHAPE);
        verifyNoInteractions(resolver);
    }

    @Test
    @Tag("unit")
    void rejectsArityOutOfRange() {
        expectCompileError(() -> expander.capture(META, slash(VarNode.of("foo"), IntegerLiteral.of(256)), env),
                CompilerErrorCode.INVALID_CAPTURE_ARITY);
        expectCompileError(() -> expander.capture(META, slash(VarNode.of("foo"), AtomLiteral.of("a")), env),
                CompilerErrorCode.INVALID_CAPTURE_ARITY);
        expectCompileError(() -> expander.capture(META, slash(VarNode.of("foo"), VarNode.of("n")), env),
                CompilerErrorCode.INVALID_CAPTURE_SHAPE);
    }

    @Test
    @Tag("unit")
    void captureVariablesAreNumberedFromTheSharedCounter() {
        env.counter().next();
        env.counter().next();

        CaptureResult.Expand result = (CaptureResult.Expand) expander.capture(META,
                new LocalCallNode("foo", Meta.EMPTY, List.of(placeholder(1), IntegerLiteral.of(1))), env);

        assertThat(result.fn().clauses().get(0).args()).containsExactly(captureVar(1, 3));
    }
}

package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.CaseNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.MatchNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringFixture;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.frontend.lowering.VarBinding;
import org.ember.compiler.frontend.lowering.VarKey;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrPrinter;
import org.ember.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
class DefaultClauseLoweringTest {

    private LoweringFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new LoweringFixture();
    }

    private static ClauseNode clause(AstNode body, AstNode... args) {
        return new ClauseNode(Meta.EMPTY, List.of(args), body);
    }

    private static AstNode match(String name, AstNode value) {
        return new MatchNode(Meta.EMPTY, VarNode.of(name), value);
    }

    private VarBinding binding(ScopeState s, String name) {
        return s.lookup(VarKey.of(VarNode.of(name))).orElseThrow();
    }

    @Test
    @Tag("unit")
    void variableBoundInSomeClausesIsExportedAsUnsafe() {
        AstNode node = new CaseNode(Meta.EMPTY, IntegerLiteral.of(1), List.of(
                clause(match("z", IntegerLiteral.of(2)), IntegerLiteral.of(1)),
                clause(AtomLiteral.of("ok"), VarNode.of("_"))));

        Lowered<IrExpr> result = fixture.lower(node);

        assertThat(IrPrinter.print(result.value())).isEqualTo("{'case',0,{integer,0,1},["
                + "{clause,0,[{integer,0,1}],[],[{match,0,{var,0,'_z@1'},{integer,0,2}},"
                + "{match,0,{var,0,'_z@2'},{var,0,'_z@1'}},{var,0,'_z@1'}]},"
                + "{clause,0,[{var,0,'_'}],[],[{match,0,{var,0,'_z@2'},{atom,0,nil}},{atom,0,ok}]}]}");
        VarBinding z = binding(result.state(), "z");
        assertThat(z.internalName()).isEqualTo("_z@2");
        assertThat(z.safe()).isFalse();
    }

    @Test
    @Tag("unit")
    void exportIntoEmptyClauseBodyKeepsNilAsItsValue() {
        AstNode node = new CaseNode(Meta.EMPTY, IntegerLiteral.of(1), List.of(
                clause(match("z", IntegerLiteral.of(2)), IntegerLiteral.of(1)),
                clause(new BlockNode(Meta.EMPTY, List.of()), VarNode.of("_"))));

        Lowered<IrExpr> result = fixture.lower(node);

        assertThat(IrPrinter.print(result.value())).isEqualTo("{'case',0,{integer,0,1},["
                + "{clause,0,[{integer,0,1}],[],[{match,0,{var,0,'_z@1'},{integer,0,2}},"
                + "{match,0,{var,0,'_z@2'},{var,0,'_z@1'}},{var,0,'_z@1'}]},"
                + "{clause,0,[{var,0,'_'}],[],[{match,0,{var,0,'_z@2'},{atom,0,nil}},{atom,0,nil}]}]}");
        assertThat(binding(result.state(), "z").safe()).isFalse();
    }

    @Test
    @Tag("unit")
    void variableBoundInEveryClauseIsSafe() {
        AstNode node = new CaseNode(Meta.EMPTY, IntegerLiteral.of(1), List.of(
                clause(match("z", IntegerLiteral.of(2)), IntegerLiteral.of(1)),
                clause(match("z", IntegerLiteral.of(3)), VarNode.of("_"))));

        Lowered<IrExpr> result = fixture.lower(node);

        VarBinding z = binding(result.state(), "z");
        assertThat(z.internalName()).isEqualTo("_z@3");
        assertThat(z.safe()).isTrue();
    }

    @Test
    @Tag("unit")
    void clauseWithoutOwnBindingExportsThePreviousOne() {
        ScopeState s = LoweringFixture.bound(fixture.initial(), "z");
        AstNode node = new CaseNode(Meta.EMPTY, IntegerLiteral.of(1), List.of(
                clause(match("z", IntegerLiteral.of(2)), IntegerLiteral.of(1)),
                clause(AtomLiteral.of("ok"), VarNode.of("_"))));

        Lowered<IrExpr> result = fixture.lower(node, s);

        assertThat(IrPrinter.print(result.value()))
                .contains("[{match,0,{var,0,'_z@2'},{var,0,'_z@0'}},{atom,0,ok}]");
    }

    @Test
    @Tag("unit")
    void bodyValueIsKeptWhenTheExportIsAppended() {
        AstNode node = new CaseNode(Meta.EMPTY, IntegerLiteral.of(1), List.of(
                clause(new LocalCallNode("compute", Meta.EMPTY, List.of(match("z", IntegerLiteral.of(2)))),
                        IntegerLiteral.of(1))));

        Lowered<IrExpr> result = fixture.lower(node);

        assertThat(IrPrinter.print(result.value())).isEqualTo("{'case',0,{integer,0,1},["
                + "{clause,0,[{integer,0,1}],[],["
                + "{match,0,{var,0,'_@3'},{call,0,{atom,0,compute},[{match,0,{var,0,'_z@1'},{integer,0,2}}]}},"
                + "{match,0,{var,0,'_z@2'},{var,0,'_z@1'}},"
                + "{var,0,'_@3'}]}]}");
    }

    @Test
    @Tag("unit")
    void severalExportsAreAssignedAsTuple() {
        AstNode node = new CaseNode(Meta.EMPTY, IntegerLiteral.of(1), List.of(
                clause(new BlockNode(Meta.EMPTY, List.of(
                        match("a", IntegerLiteral.of(1)), match("b", IntegerLiteral.of(2)), AtomLiteral.of("ok"))),
                        VarNode.of("_"))));

        Lowered<IrExpr> result = fixture.lower(node);

        assertThat(IrPrinter.print(result.value())).contains(
                "{match,0,{tuple,0,[{var,0,'_a@3'},{var,0,'_b@4'}]},{tuple,0,[{var,0,'_a@1'},{var,0,'_b@2'}]}},{atom,0,ok}");
        assertThat(binding(result.state(), "a").safe()).isTrue();
    }

    @Test
    @Tag("unit")
    void subjectBindingsAreVisibleInClauses() {
        AstNode node = new CaseNode(Meta.EMPTY, match("s", IntegerLiteral.of(1)), List.of(
                clause(VarNode.of("s"), VarNode.of("_"))));

        assertThat(fixture.print(node)).isEqualTo(
                "{'case',0,{match,0,{var,0,'_s@1'},{integer,0,1}},[{clause,0,[{var,0,'_'}],[],[{var,0,'_s@1'}]}]}");
    }
}

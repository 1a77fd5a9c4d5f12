package org.ember.compiler.frontend.lowering;

import org.ember.compiler.config.CompilerConfig;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.BlockNode;
import org.ember.compiler.frontend.ast.CaseNode;
import org.ember.compiler.frontend.ast.ClauseNode;
import org.ember.compiler.frontend.ast.CondNode;
import org.ember.compiler.frontend.ast.RemoteCallNode;

import java.util.List;

/**
 * Static knowledge about expressions that always evaluate to {@code true} or {@code false}.
 */
public final class BooleanAnalysis {

    private BooleanAnalysis() {}

    /**
     * @param expr   An expanded expression.
     * @param config The configuration declaring the boolean operators and type tests.
     * @return {@code true} if {@code expr} is known to produce a boolean.
     */
    public static boolean returnsBoolean(AstNode expr, CompilerConfig config) {
        if (expr instanceof AtomLiteral atom) {
            return atom.equals(AtomLiteral.TRUE) || atom.equals(AtomLiteral.FALSE);
        }
        if (expr instanceof RemoteCallNode call && call.receiver() instanceof AtomLiteral module
                && module.value().equals(config.runtimeModule())) {
            int arity = call.args().size();
            if (arity == 2 && config.isShortCircuit(call.name())) {
                return returnsBoolean(call.args().get(1), config);
            }
            return config.isBooleanOperator(call.name(), arity) || config.isTypeTest(call.name(), arity);
        }
        if (expr instanceof CaseNode caseNode) {
            return allReturnBoolean(caseNode.clauses(), config);
        }
        if (expr instanceof CondNode cond) {
            return allReturnBoolean(cond.clauses(), config);
        }
        if (expr instanceof BlockNode block && !block.exprs().isEmpty()) {
            return returnsBoolean(block.exprs().get(block.exprs().size() - 1), config);
        }
        return false;
    }

    private static boolean allReturnBoolean(List<ClauseNode> clauses, CompilerConfig config) {
        return !clauses.isEmpty() && clauses.stream().allMatch(c -> returnsBoolean(c.body(), config));
    }
}

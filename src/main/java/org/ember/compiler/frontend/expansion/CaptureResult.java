package org.ember.compiler.frontend.expansion;

import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.CaptureNode;
import org.ember.compiler.frontend.ast.FnNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.Meta;
import org.ember.compiler.frontend.ast.RemoteCallNode;
import org.ember.compiler.frontend.ast.VarNode;

import java.util.List;

/**
 * Outcome of expanding a capture: either a function literal that still has to be expanded, or a
 * direct reference to a named function.
 */
public sealed interface CaptureResult {

    /**
     * A one-clause function literal built from the captured expression.
     *
     * @param fn The function literal.
     */
    record Expand(FnNode fn) implements CaptureResult {}

    /**
     * A reference to a function of the current module.
     */
    record LocalRef(String name, int arity) implements CaptureResult {

        /**
         * @param meta The metadata of the original capture.
         * @return The canonical {@code &name/arity} node.
         */
        public CaptureNode toAst(Meta meta) {
            return new CaptureNode(meta, new LocalCallNode("/", Meta.EMPTY,
                    List.of(VarNode.of(name), IntegerLiteral.of(arity))));
        }
    }

    /**
     * A reference to a function of another module, or of a module held in a variable.
     */
    record RemoteRef(AstNode module, String name, int arity) implements CaptureResult {

        /**
         * @param meta The metadata of the original capture.
         * @return The canonical {@code &Mod.name/arity} node.
         */
        public CaptureNode toAst(Meta meta) {
            return new CaptureNode(meta, new LocalCallNode("/", Meta.EMPTY,
                    List.of(new RemoteCallNode(module, name, Meta.EMPTY, List.of()), IntegerLiteral.of(arity))));
        }
    }
}

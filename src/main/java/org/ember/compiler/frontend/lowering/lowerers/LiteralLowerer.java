package org.ember.compiler.frontend.lowering.lowerers;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AtomLiteral;
import org.ember.compiler.frontend.ast.FloatLiteral;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.Literal;
import org.ember.compiler.frontend.ast.StringLiteral;
import org.ember.compiler.frontend.lowering.INodeLowerer;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrAtom;
import org.ember.compiler.ir.IrBin;
import org.ember.compiler.ir.IrBinElement;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrFloat;
import org.ember.compiler.ir.IrInteger;
import org.ember.compiler.ir.IrString;

import java.util.List;

/**
 * Converts immediate literals. Strings become a binary with a single string segment.
 * Literals carry no position, so their annotation is always line 0.
 */
public final class LiteralLowerer implements INodeLowerer<Literal> {

	@Override
	public Lowered<IrExpr> lower(Literal node, ScopeState s, LoweringContext ctx) {
		IrAnno anno = IrAnno.NONE;
		IrExpr value;
		if (node instanceof AtomLiteral atom) {
			value = new IrAtom(anno, atom.value());
		} else if (node instanceof IntegerLiteral integer) {
			value = new IrInteger(anno, integer.value());
		} else if (node instanceof FloatLiteral number) {
			value = new IrFloat(anno, number.value());
		} else if (node instanceof StringLiteral string) {
			IrBinElement segment = new IrBinElement(anno, new IrString(anno, string.value()), null, List.of());
			value = new IrBin(anno, List.of(segment));
		} else {
			throw ctx.error(node.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
					"unknown literal: %s", node);
		}
		return new Lowered<>(value, s);
	}
}

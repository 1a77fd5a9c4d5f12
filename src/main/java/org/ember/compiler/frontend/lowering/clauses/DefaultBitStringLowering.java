package org.ember.compiler.frontend.lowering.clauses;

import org.ember.compiler.api.CompilerErrorCode;
import org.ember.compiler.frontend.ast.AstNode;
import org.ember.compiler.frontend.ast.AstPrinter;
import org.ember.compiler.frontend.ast.BitStringNode;
import org.ember.compiler.frontend.ast.IntegerLiteral;
import org.ember.compiler.frontend.ast.LocalCallNode;
import org.ember.compiler.frontend.ast.StringLiteral;
import org.ember.compiler.frontend.ast.VarNode;
import org.ember.compiler.frontend.lowering.Lowered;
import org.ember.compiler.frontend.lowering.LoweringContext;
import org.ember.compiler.frontend.lowering.ScopeState;
import org.ember.compiler.ir.IrAnno;
import org.ember.compiler.ir.IrBin;
import org.ember.compiler.ir.IrBinElement;
import org.ember.compiler.ir.IrExpr;
import org.ember.compiler.ir.IrInteger;
import org.ember.compiler.ir.IrString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowers {@code <<segment, ...>>}. A segment is {@code value} or {@code value :: spec}, where spec is a
 * type name, {@code size(n)}, {@code unit(n)}, a bare size, or a {@code -} chain of those.
 */
public class DefaultBitStringLowering implements BitStringLowering {

    private static final Set<String> TYPES = Set.of(
            "integer", "float", "bits", "binary", "utf8", "utf16", "utf32",
            "signed", "unsigned", "big", "little", "native");
    private static final Map<String, String> ALIASES = Map.of("bitstring", "bits", "bytes", "binary");

    @Override
    public Lowered<IrExpr> lower(BitStringNode node, ScopeState s, LoweringContext ctx) {
        List<IrBinElement> elements = new ArrayList<>(node.segments().size());
        ScopeState acc = s;
        for (AstNode segment : node.segments()) {
            AstNode value = segment;
            AstNode spec = null;
            if (segment instanceof LocalCallNode typed && typed.name().equals("::") && typed.args().size() == 2) {
                value = typed.args().get(0);
                spec = typed.args().get(1);
            }
            IrAnno anno = IrAnno.of(segment.meta());
            IrExpr loweredValue;
            if (value instanceof StringLiteral string) {
                loweredValue = new IrString(anno, string.value());
            } else {
                Lowered<IrExpr> lowered = s.isMatch() ? ctx.lower(value, acc) : ctx.lowerArg(value, acc, s);
                loweredValue = lowered.value();
                acc = lowered.state();
            }
            Spec parsed = new Spec();
            if (spec != null) {
                parseSpec(spec, parsed, acc, ctx);
            }
            elements.add(new IrBinElement(anno, loweredValue, parsed.size, parsed.types));
        }
        return new Lowered<>(new IrBin(IrAnno.of(node.meta()), elements), acc);
    }

    private void parseSpec(AstNode spec, Spec parsed, ScopeState s, LoweringContext ctx) {
        if (spec instanceof LocalCallNode call && call.name().equals("-") && call.args().size() == 2) {
            parseSpec(call.args().get(0), parsed, s, ctx);
            parseSpec(call.args().get(1), parsed, s, ctx);
        } else if (spec instanceof IntegerLiteral size) {
            parsed.size = new IrInteger(IrAnno.NONE, size.value());
        } else if (spec instanceof LocalCallNode call && call.name().equals("size") && call.args().size() == 1) {
            // Sizes refer to values bound before the segment, even inside a pattern.
            ScopeState expression = s.withContext(ScopeState.Context.EXPRESSION);
            parsed.size = ctx.lower(call.args().get(0), expression).value();
        } else if (spec instanceof LocalCallNode call && call.name().equals("unit") && call.args().size() == 1
                && call.args().get(0) instanceof IntegerLiteral unit) {
            parsed.types.add("unit:" + unit.value());
        } else if (typeName(spec) != null && TYPES.contains(typeName(spec))) {
            parsed.types.add(typeName(spec));
        } else {
            throw ctx.error(spec.meta(), CompilerErrorCode.UNSUPPORTED_FORM,
                    "unknown bitstring specifier: %s", AstPrinter.toDisplayString(spec));
        }
    }

    private static String typeName(AstNode spec) {
        String name = null;
        if (spec instanceof VarNode var) {
            name = var.name();
        } else if (spec instanceof LocalCallNode call && call.args().isEmpty()) {
            name = call.name();
        }
        return name == null ? null : ALIASES.getOrDefault(name, name);
    }

    private static final class Spec {
        private IrExpr size;
        private final List<String> types = new ArrayList<>();
    }
}

package org.ember.compiler.ir;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Renders lowered trees as Erlang abstract-format terms, e.g. {@code {match,3,{var,3,'_x@1'},{integer,3,1}}}.
 * Used by debug dumps and by tests that compare whole trees at a glance.
 */
public final class IrPrinter {

    private static final Pattern BARE_ATOM = Pattern.compile("[a-z][A-Za-z0-9_@]*");
    private static final List<String> RESERVED = List.of(
            "after", "and", "andalso", "band", "begin", "bnot", "bor", "bsl", "bsr", "bxor", "case", "catch",
            "cond", "div", "end", "fun", "if", "let", "not", "of", "or", "orelse", "receive", "rem", "try",
            "when", "xor");

    private IrPrinter() {}

    /**
     * @param expr The lowered expression.
     * @return The expression as an abstract-format term.
     */
    public static String print(IrExpr expr) {
        StringBuilder sb = new StringBuilder();
        expr(sb, expr);
        return sb.toString();
    }

    /**
     * @param forms Lowered top-level forms.
     * @return One term per line, each terminated by a full stop.
     */
    public static String printAll(List<IrExpr> forms) {
        StringBuilder sb = new StringBuilder();
        for (IrExpr form : forms) {
            expr(sb, form);
            sb.append(".\n");
        }
        return sb.toString();
    }

    private static void expr(StringBuilder sb, IrExpr e) {
        if (e instanceof IrAtom a) {
            open(sb, "atom", a.anno()).append(atom(a.value())).append('}');
        } else if (e instanceof IrInteger i) {
            open(sb, "integer", i.anno()).append(i.value()).append('}');
        } else if (e instanceof IrFloat f) {
            open(sb, "float", f.anno()).append(f.value()).append('}');
        } else if (e instanceof IrString s) {
            open(sb, "string", s.anno()).append(quote(s.value(), '"')).append('}');
        } else if (e instanceof IrNil n) {
            sb.append("{nil,");
            anno(sb, n.anno());
            sb.append('}');
        } else if (e instanceof IrVar v) {
            open(sb, "var", v.anno()).append(quote(v.name(), '\'')).append('}');
        } else if (e instanceof IrMatch m) {
            open(sb, "match", m.anno());
            expr(sb, m.pattern());
            sb.append(',');
            expr(sb, m.expr());
            sb.append('}');
        } else if (e instanceof IrTuple t) {
            open(sb, "tuple", t.anno());
            exprs(sb, t.elements());
            sb.append('}');
        } else if (e instanceof IrCons c) {
            open(sb, "cons", c.anno());
            expr(sb, c.head());
            sb.append(',');
            expr(sb, c.tail());
            sb.append('}');
        } else if (e instanceof IrMap m) {
            open(sb, "map", m.anno());
            if (m.base() != null) {
                expr(sb, m.base());
                sb.append(',');
            }
            list(sb, m.fields(), f -> {
                StringBuilder field = new StringBuilder();
                open(field, f.kind() == IrMapField.Kind.ASSOC ? "map_field_assoc" : "map_field_exact", f.anno());
                expr(field, f.key());
                field.append(',');
                expr(field, f.value());
                return field.append('}').toString();
            });
            sb.append('}');
        } else if (e instanceof IrBlock b) {
            open(sb, "block", b.anno());
            exprs(sb, b.exprs());
            sb.append('}');
        } else if (e instanceof IrLocalFun f) {
            open(sb, "'fun'", f.anno()).append("{function,").append(atom(f.name())).append(',')
                    .append(f.arity()).append("}}");
        } else if (e instanceof IrRemoteFun f) {
            open(sb, "'fun'", f.anno()).append("{function,");
            expr(sb, f.module());
            sb.append(',');
            expr(sb, f.function());
            sb.append(',');
            expr(sb, f.arity());
            sb.append("}}");
        } else if (e instanceof IrClosure c) {
            open(sb, "'fun'", c.anno()).append("{clauses,");
            clauses(sb, c.clauses());
            sb.append("}}");
        } else if (e instanceof IrCall c) {
            open(sb, "call", c.anno());
            expr(sb, c.target());
            sb.append(',');
            exprs(sb, c.args());
            sb.append('}');
        } else if (e instanceof IrRemote r) {
            open(sb, "remote", r.anno());
            expr(sb, r.module());
            sb.append(',');
            expr(sb, r.function());
            sb.append('}');
        } else if (e instanceof IrOp o) {
            open(sb, "op", o.anno()).append(atom(o.op()));
            for (IrExpr operand : o.operands()) {
                sb.append(',');
                expr(sb, operand);
            }
            sb.append('}');
        } else if (e instanceof IrCase c) {
            open(sb, "'case'", c.anno());
            expr(sb, c.expr());
            sb.append(',');
            clauses(sb, c.clauses());
            sb.append('}');
        } else if (e instanceof IrTry t) {
            open(sb, "'try'", t.anno());
            exprs(sb, t.body());
            sb.append(',');
            clauses(sb, t.elseClauses());
            sb.append(',');
            clauses(sb, t.catchClauses());
            sb.append(',');
            exprs(sb, t.after());
            sb.append('}');
        } else if (e instanceof IrReceive r) {
            open(sb, "'receive'", r.anno());
            clauses(sb, r.clauses());
            if (r.timeout() != null) {
                sb.append(',');
                expr(sb, r.timeout());
                sb.append(',');
                exprs(sb, r.after());
            }
            sb.append('}');
        } else if (e instanceof IrBin b) {
            open(sb, "bin", b.anno());
            list(sb, b.elements(), IrPrinter::binElement);
            sb.append('}');
        } else if (e instanceof IrComprehension c) {
            open(sb, "lc", c.anno());
            expr(sb, c.body());
            sb.append(',');
            list(sb, c.qualifiers(), IrPrinter::qualifier);
            if (!c.collect()) {
                sb.append(",nocollect");
            }
            sb.append('}');
        } else {
            throw new IllegalArgumentException("Unknown lowered node: " + e);
        }
    }

    private static String binElement(IrBinElement element) {
        StringBuilder sb = new StringBuilder();
        open(sb, "bin_element", element.anno());
        expr(sb, element.value());
        sb.append(',');
        if (element.size() == null) {
            sb.append("default");
        } else {
            expr(sb, element.size());
        }
        sb.append(',');
        if (element.types().isEmpty()) {
            sb.append("default");
        } else {
            list(sb, element.types(), IrPrinter::atom);
        }
        return sb.append('}').toString();
    }

    private static String qualifier(IrComprehension.Qualifier qualifier) {
        StringBuilder sb = new StringBuilder();
        if (qualifier instanceof IrComprehension.Generator g) {
            open(sb, "generate", g.anno());
            expr(sb, g.pattern());
            sb.append(',');
            expr(sb, g.source());
            sb.append('}');
        } else if (qualifier instanceof IrComprehension.Filter f) {
            expr(sb, f.condition());
        }
        return sb.toString();
    }

    private static void clauses(StringBuilder sb, List<IrClause> clauses) {
        list(sb, clauses, clause -> {
            StringBuilder c = new StringBuilder();
            open(c, "clause", clause.anno());
            exprs(c, clause.patterns());
            c.append(',');
            list(c, clause.guards(), guard -> {
                StringBuilder g = new StringBuilder();
                exprs(g, guard);
                return g.toString();
            });
            c.append(',');
            exprs(c, clause.body());
            return c.append('}').toString();
        });
    }

    private static void exprs(StringBuilder sb, List<IrExpr> exprs) {
        list(sb, exprs, e -> {
            StringBuilder inner = new StringBuilder();
            expr(inner, e);
            return inner.toString();
        });
    }

    private static <T> void list(StringBuilder sb, List<T> items, Function<T, String> render) {
        sb.append('[');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(render.apply(items.get(i)));
        }
        sb.append(']');
    }

    private static StringBuilder open(StringBuilder sb, String tag, IrAnno anno) {
        sb.append('{').append(tag).append(',');
        anno(sb, anno);
        return sb.append(',');
    }

    private static void anno(StringBuilder sb, IrAnno anno) {
        if (anno.generated()) {
            sb.append("[{location,").append(anno.line()).append("},{generated,true}]");
        } else {
            sb.append(anno.line());
        }
    }

    private static String atom(String value) {
        if (BARE_ATOM.matcher(value).matches() && !RESERVED.contains(value)) {
            return value;
        }
        return quote(value, '\'');
    }

    private static String quote(String value, char delimiter) {
        String escaped = value.replace("\\", "\\\\").replace(String.valueOf(delimiter), "\\" + delimiter)
                .replace("\n", "\\n");
        return delimiter + escaped + delimiter;
    }
}

package org.ember.compiler.frontend.ast;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders AST fragments back into source syntax for diagnostics.
 * <p>
 * The output is meant for humans; it is not guaranteed to parse back into the same tree.
 */
public final class AstPrinter {

    private static final String MODULE_PREFIX = "Elixir.";
    private static final Pattern PLAIN_ATOM = Pattern.compile("[a-z_][A-Za-z0-9_@]*[?!]?");
    private static final Set<String> BINARY_OPERATORS = Set.of(
            "+", "-", "*", "/", "++", "--", "<>", "==", "!=", "===", "!==", "<", ">", "<=", ">=",
            "&&", "||", "and", "or", "in", "|>", "::", "..", "=~");
    private static final Set<String> UNARY_OPERATORS = Set.of("-", "+", "!", "not");

    private AstPrinter() {}

    /**
     * @param node The fragment to render.
     * @return The fragment in source syntax.
     */
    public static String toDisplayString(AstNode node) {
        if (node == null) return "nil";
        if (node instanceof AtomLiteral a) return atom(a.value());
        if (node instanceof IntegerLiteral i) return Long.toString(i.value());
        if (node instanceof FloatLiteral f) return Double.toString(f.value());
        if (node instanceof StringLiteral s) return quote(s.value());
        if (node instanceof VarNode v) return v.name();
        if (node instanceof ListNode l) return list(l.elements());
        if (node instanceof PairNode p) return "{" + toDisplayString(p.left()) + ", " + toDisplayString(p.right()) + "}";
        if (node instanceof TupleNode t) return "{" + join(t.elements()) + "}";
        if (node instanceof LocalCallNode c) return localCall(c);
        if (node instanceof RemoteCallNode c) return remoteCall(c);
        if (node instanceof AnonCallNode c) return toDisplayString(c.fun()) + ".(" + join(c.args()) + ")";
        if (node instanceof MatchNode m) return toDisplayString(m.left()) + " = " + toDisplayString(m.right());
        if (node instanceof MapNode m) return "%" + map(m);
        if (node instanceof StructNode s) return "%" + atom(s.name().value()) + map(s.map());
        if (node instanceof BitStringNode b) return "<<" + join(b.segments()) + ">>";
        if (node instanceof BlockNode b) return "(" + b.exprs().stream().map(AstPrinter::toDisplayString).collect(Collectors.joining("; ")) + ")";
        if (node instanceof CaptureNode c) return capture(c);
        if (node instanceof PinNode p) return "^" + toDisplayString(p.var());
        if (node instanceof ConsNode c) return toDisplayString(c.head()) + " | " + toDisplayString(c.tail());
        if (node instanceof WhenNode w) return join(w.patterns()) + " when " + toDisplayString(w.guard());
        if (node instanceof GeneratorNode g) return toDisplayString(g.pattern()) + " <- " + toDisplayString(g.source());
        if (node instanceof ClauseNode c) return join(c.args()) + " -> " + toDisplayString(c.body());
        if (node instanceof FnNode f) return "fn " + clauses(f.clauses()) + " end";
        if (node instanceof CondNode c) return "cond do " + clauses(c.clauses()) + " end";
        if (node instanceof CaseNode c) return "case " + toDisplayString(c.subject()) + " do " + clauses(c.clauses()) + " end";
        if (node instanceof ReceiveNode r) return receive(r);
        if (node instanceof TryNode t) return tryExpr(t);
        if (node instanceof ForNode f) return "for " + join(f.qualifiers()) + " do " + toDisplayString(f.body()) + " end";
        if (node instanceof WithNode w) return with(w);
        return node.toString();
    }

    private static String atom(String value) {
        if (value.startsWith(MODULE_PREFIX)) return value.substring(MODULE_PREFIX.length());
        if (value.equals("true") || value.equals("false") || value.equals("nil")) return value;
        return PLAIN_ATOM.matcher(value).matches() ? ":" + value : ":" + quote(value);
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }

    private static String join(List<? extends AstNode> nodes) {
        return nodes.stream().map(AstPrinter::toDisplayString).collect(Collectors.joining(", "));
    }

    private static String clauses(List<ClauseNode> clauses) {
        return clauses.stream().map(AstPrinter::toDisplayString).collect(Collectors.joining("; "));
    }

    private static String list(List<AstNode> elements) {
        return "[" + join(elements) + "]";
    }

    private static String localCall(LocalCallNode call) {
        List<AstNode> args = call.args();
        if (args.size() == 2 && BINARY_OPERATORS.contains(call.name())) {
            return toDisplayString(args.get(0)) + " " + call.name() + " " + toDisplayString(args.get(1));
        }
        if (args.size() == 1 && UNARY_OPERATORS.contains(call.name())) {
            String separator = Character.isLetter(call.name().charAt(0)) ? " " : "";
            return call.name() + separator + toDisplayString(args.get(0));
        }
        return call.name() + "(" + join(args) + ")";
    }

    private static String remoteCall(RemoteCallNode call) {
        String receiver = toDisplayString(call.receiver());
        if (call.args().isEmpty() && !(call.receiver() instanceof AtomLiteral)) {
            return receiver + "." + call.name();
        }
        return receiver + "." + call.name() + "(" + join(call.args()) + ")";
    }

    private static String map(MapNode map) {
        String entries = map.entries().stream()
                .map(e -> e.left() instanceof AtomLiteral a && PLAIN_ATOM.matcher(a.value()).matches()
                        ? a.value() + ": " + toDisplayString(e.right())
                        : toDisplayString(e.left()) + " => " + toDisplayString(e.right()))
                .collect(Collectors.joining(", "));
        if (map.isUpdate()) {
            return "{" + toDisplayString(map.update()) + " | " + entries + "}";
        }
        return "{" + entries + "}";
    }

    private static String capture(CaptureNode capture) {
        if (capture.isPlaceholder()) {
            return "&" + toDisplayString(capture.expr());
        }
        if (capture.expr() instanceof LocalCallNode c && c.name().equals("/") && c.args().size() == 2) {
            AstNode target = c.args().get(0);
            String name = target instanceof RemoteCallNode r && r.args().isEmpty()
                    ? toDisplayString(r.receiver()) + "." + r.name()
                    : toDisplayString(target);
            return "&" + name + "/" + toDisplayString(c.args().get(1));
        }
        return "&(" + toDisplayString(capture.expr()) + ")";
    }

    private static String receive(ReceiveNode receive) {
        StringBuilder sb = new StringBuilder("receive do ").append(clauses(receive.clauses()));
        if (receive.after() != null) {
            sb.append(" after ").append(toDisplayString(receive.after()));
        }
        return sb.append(" end").toString();
    }

    private static String tryExpr(TryNode node) {
        StringBuilder sb = new StringBuilder("try do ").append(toDisplayString(node.body()));
        if (!node.rescueClauses().isEmpty()) sb.append(" rescue ").append(clauses(node.rescueClauses()));
        if (!node.catchClauses().isEmpty()) sb.append(" catch ").append(clauses(node.catchClauses()));
        if (!node.elseClauses().isEmpty()) sb.append(" else ").append(clauses(node.elseClauses()));
        if (node.after() != null) sb.append(" after ").append(toDisplayString(node.after()));
        return sb.append(" end").toString();
    }

    private static String with(WithNode node) {
        StringBuilder sb = new StringBuilder("with ").append(join(node.steps()))
                .append(" do ").append(toDisplayString(node.body()));
        if (!node.elseClauses().isEmpty()) {
            sb.append(" else ").append(clauses(node.elseClauses()));
        }
        return sb.append(" end").toString();
    }
}

package org.solsmt.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.ErrorKind;
import org.solsmt.core.Scope;
import org.solsmt.core.SmtScriptException;
import org.solsmt.core.Sort;
import org.solsmt.core.SolSmtConfig;
import org.solsmt.parsing.Node;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a parsed {@link Node} into a {@link LogicalExpression}, resolving
 * variables against a {@link Scope} and inferring the sort of every subterm.
 *
 * <p>Sort inference is deliberately shallow: connectives and comparisons are
 * Boolean, every other operator takes the sort of its last argument. This is
 * only right when operands share a sort.</p>
 */
public final class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    public static final String LET = "let";

    /** Operators whose result is Boolean whatever their operands are. */
    public static final Set<String> BOOLEAN_OPERATORS = Set.of("and", "or", "not", "=", "<", ">", "<=", ">=", "=>");

    private final int maxDepth;

    public ExpressionTranslator() {
        this(SolSmtConfig.defaults());
    }

    public ExpressionTranslator(SolSmtConfig config) {
        this.maxDepth = Objects.requireNonNull(config, "Config cannot be null").getMaxDepth();
    }

    /**
     * Translates a term.
     * @param node parsed term.
     * @param scope names visible to the term.
     * @return the typed expression.
     * @throws SmtScriptException on unresolved names, unsupported numerals or a
     *     malformed term.
     */
    public LogicalExpression translate(Node node, Scope scope) {
        Objects.requireNonNull(node, "Node cannot be null");
        Objects.requireNonNull(scope, "Scope cannot be null");
        return translate(node, scope, 0);
    }

    private LogicalExpression translate(Node node, Scope scope, int depth) {
        if (depth >= maxDepth) {
            throw fail(ErrorKind.NESTING_TOO_DEEP, "Term nesting exceeds " + maxDepth);
        }
        return node.match(
                atom -> translateAtom(atom, scope),
                list -> translateList(list, scope, depth));
    }

    private LogicalExpression translateAtom(Node.Atom atom, Scope scope) {
        String text = atom.getText();
        if (!atom.isQuoted() && !text.isEmpty() && (Character.isDigit(text.charAt(0)) || text.charAt(0) == '.')) {
            return LogicalExpression.numeral(parseNumeral(text));
        }
        return scope.lookup(text)
                .map(sort -> LogicalExpression.variable(text, sort))
                .orElseGet(() -> {
                    if (!atom.isQuoted() && (text.equals("true") || text.equals("false"))) {
                        return LogicalExpression.bool(Boolean.parseBoolean(text));
                    }
                    throw fail(ErrorKind.UNRESOLVED_VARIABLE, "Unknown variable: " + atom);
                });
    }

    private LogicalExpression translateList(Node.SList list, Scope scope, int depth) {
        if (list.isEmpty()) {
            throw fail(ErrorKind.MALFORMED_EXPRESSION, "Empty term ()");
        }
        String op = list.get(0).match(
                Node.Atom::getText,
                head -> {
                    throw fail(ErrorKind.MALFORMED_EXPRESSION, "Operator must be a symbol, got " + head);
                });

        if (op.equals(LET)) {
            return translateLet(list, scope, depth);
        }

        List<LogicalExpression> arguments = new ArrayList<>(list.size() - 1);
        for (int i = 1; i < list.size(); i++) {
            arguments.add(translate(list.get(i), scope, depth + 1));
        }
        Sort sort;
        if (BOOLEAN_OPERATORS.contains(op)) {
            sort = Sort.BOOL;
        } else if (arguments.isEmpty()) {
            throw fail(ErrorKind.MALFORMED_EXPRESSION, "Cannot infer the sort of " + list + " without arguments");
        } else {
            sort = arguments.get(arguments.size() - 1).getSort();
        }
        return LogicalExpression.of(op, arguments, sort);
    }

    /**
     * (let ((x1 t1) (x2 t2)) T) becomes let(x1(t1), x2(t2), T).
     * All ti are translated in the outer scope; T sees the new bindings.
     */
    private LogicalExpression translateLet(Node.SList list, Scope scope, int depth) {
        if (list.size() != 3) {
            throw fail(ErrorKind.MALFORMED_EXPRESSION, "let expects a binding list and a body: " + list);
        }
        List<Node> bindings = list.get(1).match(
                atom -> {
                    throw fail(ErrorKind.MALFORMED_EXPRESSION, "let bindings must be a list, got " + atom);
                },
                Node.SList::getItems);

        Map<String, Sort> boundSorts = new LinkedHashMap<>();
        List<LogicalExpression> arguments = new ArrayList<>(bindings.size() + 1);
        for (Node binding : bindings) {
            Node.SList pair = binding.match(
                    atom -> {
                        throw fail(ErrorKind.MALFORMED_EXPRESSION, "let binding must be (name term), got " + atom);
                    },
                    l -> l);
            if (pair.size() != 2 || !pair.get(0).isAtom()) {
                throw fail(ErrorKind.MALFORMED_EXPRESSION, "let binding must be (name term), got " + pair);
            }
            String varName = ((Node.Atom) pair.get(0)).getText();
            LogicalExpression value = translate(pair.get(1), scope, depth + 1);
            logger.debug("Binding {} to {}", varName, value);
            boundSorts.put(varName, value.getSort());
            arguments.add(LogicalExpression.of(varName, List.of(value), value.getSort()));
        }

        LogicalExpression body = translate(list.get(2), scope.extend(boundSorts), depth + 1);
        arguments.add(body);
        return LogicalExpression.of(LET, arguments, body.getSort());
    }

    /**
     * Only whole numbers are supported: a trailing ".0" is dropped (repeatedly)
     * and the rest must be a plain decimal integer.
     */
    static BigInteger parseNumeral(String text) {
        String digits = text;
        while (digits.length() >= 3 && digits.endsWith(".0")) {
            digits = digits.substring(0, digits.length() - 2);
        }
        try {
            return new BigInteger(digits);
        } catch (NumberFormatException e) {
            logger.error("Unsupported numeral: {}", text);
            throw new SmtScriptException(ErrorKind.UNSUPPORTED_LITERAL, "Unsupported numeral: " + text, e);
        }
    }

    private static SmtScriptException fail(ErrorKind kind, String message) {
        logger.error(message);
        return new SmtScriptException(kind, message);
    }
}

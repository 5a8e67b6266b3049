package org.solsmt.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.ErrorKind;
import org.solsmt.core.SmtScriptException;
import org.solsmt.expressions.ExpressionTranslator;
import org.solsmt.expressions.LogicalExpression;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Lowers {@link LogicalExpression} trees to Z3 expressions.
 * {@code let} is expanded by substitution: bound names map to the Z3 term of
 * their value in an environment that is copied, never changed, per binder.
 */
public class Z3ExpressionEncoder {

    private static final Logger logger = LoggerFactory.getLogger(Z3ExpressionEncoder.class);

    private final Context ctx;
    private final Z3VariableManager varManager;

    public Z3ExpressionEncoder(Context ctx, Z3VariableManager varManager) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.varManager = Objects.requireNonNull(varManager, "Z3VariableManager cannot be null.");
    }

    /**
     * Encodes a Boolean expression.
     * @param expression the expression, typically an assertion.
     * @return the Z3 formula.
     * @throws SmtScriptException if the expression is not Boolean or uses an
     *     operator with no Z3 encoding.
     */
    public BoolExpr encodeBool(LogicalExpression expression) {
        return asBool(encode(expression, Collections.emptyMap()), expression);
    }

    public Expr<?> encode(LogicalExpression expression) {
        return encode(expression, Collections.emptyMap());
    }

    private Expr<?> encode(LogicalExpression e, Map<String, Expr<?>> env) {
        if (e.isLeaf()) {
            return encodeLeaf(e, env);
        }
        String op = e.getName();
        if (op.equals(ExpressionTranslator.LET)) {
            return encodeLet(e, env);
        }
        List<LogicalExpression> args = e.getArguments();
        return switch (op) {
            case "and" -> ctx.mkAnd(bools(args, env));
            case "or" -> ctx.mkOr(bools(args, env));
            case "not" -> {
                requireArity(e, 1);
                yield ctx.mkNot(asBool(encode(args.get(0), env), args.get(0)));
            }
            case "=>" -> {
                requireMinArity(e, 2);
                BoolExpr[] operands = bools(args, env);
                // right associative: (=> a b c) is (=> a (=> b c))
                BoolExpr result = operands[operands.length - 1];
                for (int i = operands.length - 2; i >= 0; i--) {
                    result = ctx.mkImplies(operands[i], result);
                }
                yield result;
            }
            case "xor" -> {
                requireMinArity(e, 2);
                BoolExpr[] operands = bools(args, env);
                BoolExpr result = operands[0];
                for (int i = 1; i < operands.length; i++) {
                    result = ctx.mkXor(result, operands[i]);
                }
                yield result;
            }
            case "=" -> chain(e, env, (a, b) -> ctx.mkEq(a, b), false);
            case "<" -> chain(e, env, (a, b) -> ctx.mkLt((ArithExpr) a, (ArithExpr) b), true);
            case ">" -> chain(e, env, (a, b) -> ctx.mkGt((ArithExpr) a, (ArithExpr) b), true);
            case "<=" -> chain(e, env, (a, b) -> ctx.mkLe((ArithExpr) a, (ArithExpr) b), true);
            case ">=" -> chain(e, env, (a, b) -> ctx.mkGe((ArithExpr) a, (ArithExpr) b), true);
            case "distinct" -> {
                requireMinArity(e, 2);
                Expr[] operands = new Expr[args.size()];
                for (int i = 0; i < operands.length; i++) {
                    operands[i] = encode(args.get(i), env);
                }
                requireSameSort(operands, e);
                yield ctx.mkDistinct(operands);
            }
            case "+" -> ctx.mkAdd(ariths(e, env));
            case "*" -> ctx.mkMul(ariths(e, env));
            case "-" -> {
                ArithExpr[] operands = ariths(e, env);
                yield operands.length == 1 ? ctx.mkUnaryMinus(operands[0]) : ctx.mkSub(operands);
            }
            case "/" -> {
                requireMinArity(e, 2);
                ArithExpr[] operands = ariths(e, env);
                ArithExpr result = operands[0];
                for (int i = 1; i < operands.length; i++) {
                    result = ctx.mkDiv(result, operands[i]);
                }
                yield result;
            }
            case "ite" -> {
                requireArity(e, 3);
                Expr thenBranch = encode(args.get(1), env);
                Expr elseBranch = encode(args.get(2), env);
                requireSameSort(new Expr[]{thenBranch, elseBranch}, e);
                yield ctx.mkITE(asBool(encode(args.get(0), env), args.get(0)), thenBranch, elseBranch);
            }
            default -> {
                logger.error("No Z3 encoding for operator {} in {}", op, e);
                throw new SmtScriptException(ErrorKind.UNSUPPORTED_OPERATOR, "Unsupported operator: " + op);
            }
        };
    }

    private Expr<?> encodeLeaf(LogicalExpression e, Map<String, Expr<?>> env) {
        String name = e.getName();
        Expr<?> bound = env.get(name);
        if (bound != null) {
            return bound;
        }
        return varManager.getZ3Var(name).orElseGet(() -> {
            if (e.isNumeral()) {
                return ctx.mkReal(name);
            }
            if (e.equals(LogicalExpression.TRUE)) {
                return ctx.mkTrue();
            }
            if (e.equals(LogicalExpression.FALSE)) {
                return ctx.mkFalse();
            }
            logger.error("Variable {} is not declared in the solver", name);
            throw new SmtScriptException(ErrorKind.UNRESOLVED_VARIABLE, "Unknown variable: " + name);
        });
    }

    /**
     * Arguments are the bindings name(value) followed by the body.
     */
    private Expr<?> encodeLet(LogicalExpression e, Map<String, Expr<?>> env) {
        List<LogicalExpression> args = e.getArguments();
        requireMinArity(e, 1);
        Map<String, Expr<?>> inner = new HashMap<>(env);
        for (LogicalExpression binding : args.subList(0, args.size() - 1)) {
            requireArity(binding, 1);
            // values see the outer environment only
            inner.put(binding.getName(), encode(binding.getArgument(0), env));
        }
        return encode(args.get(args.size() - 1), Collections.unmodifiableMap(inner));
    }

    private Expr<?> chain(LogicalExpression e, Map<String, Expr<?>> env,
                          BinaryOperator<Expr> relation, boolean arithmetic) {
        requireMinArity(e, 2);
        List<LogicalExpression> args = e.getArguments();
        Expr[] operands = new Expr[args.size()];
        for (int i = 0; i < operands.length; i++) {
            Expr<?> encoded = encode(args.get(i), env);
            operands[i] = arithmetic ? asArith(encoded, args.get(i)) : encoded;
        }
        requireSameSort(operands, e);
        if (operands.length == 2) {
            return relation.apply(operands[0], operands[1]);
        }
        BoolExpr[] pairs = new BoolExpr[operands.length - 1];
        for (int i = 0; i + 1 < operands.length; i++) {
            pairs[i] = (BoolExpr) relation.apply(operands[i], operands[i + 1]);
        }
        return ctx.mkAnd(pairs);
    }

    private BoolExpr[] bools(List<LogicalExpression> args, Map<String, Expr<?>> env) {
        BoolExpr[] result = new BoolExpr[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = asBool(encode(args.get(i), env), args.get(i));
        }
        return result;
    }

    private ArithExpr[] ariths(LogicalExpression e, Map<String, Expr<?>> env) {
        requireMinArity(e, 1);
        List<LogicalExpression> args = e.getArguments();
        ArithExpr[] result = new ArithExpr[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = asArith(encode(args.get(i), env), args.get(i));
        }
        return result;
    }

    private static BoolExpr asBool(Expr<?> z3, LogicalExpression source) {
        if (z3 instanceof BoolExpr) {
            return (BoolExpr) z3;
        }
        logger.error("Expected a Bool term, got {} : {}", source, source.getSort());
        throw new SmtScriptException(ErrorKind.MALFORMED_EXPRESSION, "Expected a Bool term: " + source);
    }

    private static ArithExpr asArith(Expr<?> z3, LogicalExpression source) {
        if (z3 instanceof ArithExpr) {
            return (ArithExpr) z3;
        }
        logger.error("Expected a Real term, got {} : {}", source, source.getSort());
        throw new SmtScriptException(ErrorKind.MALFORMED_EXPRESSION, "Expected a Real term: " + source);
    }

    private static void requireSameSort(Expr[] operands, LogicalExpression e) {
        for (int i = 1; i < operands.length; i++) {
            if (!operands[i].getSort().equals(operands[0].getSort())) {
                logger.error("Operands of {} mix sorts {} and {}: {}",
                        e.getName(), operands[0].getSort(), operands[i].getSort(), e);
                throw new SmtScriptException(ErrorKind.MALFORMED_EXPRESSION,
                        "Operands of " + e.getName() + " mix sorts " + operands[0].getSort()
                                + " and " + operands[i].getSort() + ": " + e);
            }
        }
    }

    private static void requireArity(LogicalExpression e, int arity) {
        if (e.getArguments().size() != arity) {
            logger.error("{} expects {} arguments: {}", e.getName(), arity, e);
            throw new SmtScriptException(ErrorKind.MALFORMED_EXPRESSION,
                    e.getName() + " expects " + arity + " argument(s): " + e);
        }
    }

    private static void requireMinArity(LogicalExpression e, int arity) {
        if (e.getArguments().size() < arity) {
            logger.error("{} expects at least {} arguments: {}", e.getName(), arity, e);
            throw new SmtScriptException(ErrorKind.MALFORMED_EXPRESSION,
                    e.getName() + " expects at least " + arity + " argument(s): " + e);
        }
    }
}

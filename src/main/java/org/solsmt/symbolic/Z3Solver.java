package org.solsmt.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.ErrorKind;
import org.solsmt.core.SmtScriptException;
import org.solsmt.core.Sort;
import org.solsmt.expressions.LogicalExpression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ConstraintSolver} backed by a Z3 {@link Solver}.
 * Owns its Z3 Context unless one is passed in; {@link #close()} releases it.
 */
@Getter
public class Z3Solver implements ConstraintSolver {

    private static final Logger logger = LoggerFactory.getLogger(Z3Solver.class);

    private final Context ctx;
    private final Solver solver;
    private final Z3VariableManager varManager;
    private final Z3ExpressionEncoder encoder;
    private final boolean ownsContext;

    public Z3Solver() {
        this(new Context(), true);
    }

    public Z3Solver(Context ctx) {
        this(ctx, false);
    }

    private Z3Solver(Context ctx, boolean ownsContext) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.ownsContext = ownsContext;
        this.solver = ctx.mkSolver();
        this.varManager = new Z3VariableManager(ctx);
        this.encoder = new Z3ExpressionEncoder(ctx, varManager);
        logger.debug("Z3Solver initialised");
    }

    @Override
    public void declareVariable(String name, Sort sort) {
        varManager.declare(name, sort);
    }

    @Override
    public void addAssertion(LogicalExpression expression) {
        try {
            BoolExpr formula = encoder.encodeBool(expression);
            solver.add(formula);
            logger.debug("Asserted {}", formula);
        } catch (Z3Exception e) {
            throw rejected("assertion " + expression, e);
        }
    }

    @Override
    public Pair<CheckResult, Map<String, String>> check(Set<LogicalExpression> assumptions) {
        BoolExpr[] z3Assumptions;
        Status status;
        try {
            z3Assumptions = assumptions.stream()
                    .map(encoder::encodeBool)
                    .toArray(BoolExpr[]::new);
            status = solver.check(z3Assumptions);
        } catch (Z3Exception e) {
            throw rejected("check with assumptions " + assumptions, e);
        }
        CheckResult result = switch (status) {
            case SATISFIABLE -> CheckResult.SATISFIABLE;
            case UNSATISFIABLE -> CheckResult.UNSATISFIABLE;
            case UNKNOWN -> CheckResult.UNKNOWN;
        };
        logger.info("Z3 check with {} assumption(s): {}", z3Assumptions.length, result);
        if (result == CheckResult.UNKNOWN) {
            logger.warn("Z3 returned UNKNOWN: {}", solver.getReasonUnknown());
        }
        if (result != CheckResult.SATISFIABLE) {
            return Pair.of(result, Collections.emptyMap());
        }
        return Pair.of(result, extractModel(solver.getModel()));
    }

    private Map<String, String> extractModel(Model model) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String name : varManager.getDeclaredNames()) {
            Expr<?> var = varManager.getZ3Var(name).orElseThrow();
            // completion gives unconstrained variables a default value
            values.put(name, model.evaluate(var, true).toString());
        }
        return Collections.unmodifiableMap(values);
    }

    private static SmtScriptException rejected(String what, Z3Exception e) {
        logger.error("Z3 rejected {}: {}", what, e.getMessage());
        return new SmtScriptException(ErrorKind.SOLVER_FAILURE, "Z3 rejected " + what + ": " + e.getMessage(), e);
    }

    @Override
    public void close() {
        if (ownsContext) {
            ctx.close();
            logger.debug("Z3 Context closed");
        }
    }
}

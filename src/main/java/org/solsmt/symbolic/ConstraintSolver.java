package org.solsmt.symbolic;

import org.apache.commons.lang3.tuple.Pair;
import org.solsmt.core.Sort;
import org.solsmt.expressions.LogicalExpression;

import java.util.Map;
import java.util.Set;

/**
 * The solver backend driven by the command interpreter.
 * Calls are synchronous; any timeout policy belongs to the implementation.
 */
public interface ConstraintSolver extends AutoCloseable {

    /**
     * Declares a free variable.
     * @param name variable name.
     * @param sort its sort.
     */
    void declareVariable(String name, Sort sort);

    /**
     * Adds a constraint that must hold. Assertions accumulate and are never retracted.
     * @param expression a Boolean expression.
     */
    void addAssertion(LogicalExpression expression);

    /**
     * Checks the current assertions together with {@code assumptions}.
     * @param assumptions extra Boolean expressions that hold only for this check.
     * @return the verdict and, when satisfiable, the value of every declared
     *     variable rendered as text. The map is empty for other verdicts.
     */
    Pair<CheckResult, Map<String, String>> check(Set<LogicalExpression> assumptions);

    @Override
    void close();
}

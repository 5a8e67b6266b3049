package org.solsmt.expressions;

import lombok.Getter;
import org.solsmt.core.Sort;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A typed logical expression: an operator name, its arguments and the sort
 * inferred for the whole expression. Leaves are variables, numerals or the
 * Boolean constants.
 * Immutable.
 */
@Getter
public final class LogicalExpression {

    public static final LogicalExpression TRUE = new LogicalExpression("true", List.of(), Sort.BOOL);
    public static final LogicalExpression FALSE = new LogicalExpression("false", List.of(), Sort.BOOL);

    private final String name;
    private final List<LogicalExpression> arguments;
    private final Sort sort;

    private final int hashCode;

    private LogicalExpression(String name, List<LogicalExpression> arguments, Sort sort) {
        this.name = Objects.requireNonNull(name, "Expression name cannot be null");
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "Arguments cannot be null"));
        this.sort = Objects.requireNonNull(sort, "Sort cannot be null");
        this.hashCode = Objects.hash(this.name, this.arguments, this.sort);
    }

    public static LogicalExpression of(String name, List<LogicalExpression> arguments, Sort sort) {
        return new LogicalExpression(name, arguments, sort);
    }

    public static LogicalExpression variable(String name, Sort sort) {
        return new LogicalExpression(name, List.of(), sort);
    }

    public static LogicalExpression numeral(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Numerals are non-negative: " + value);
        }
        return new LogicalExpression(value.toString(), List.of(), Sort.REAL);
    }

    public static LogicalExpression bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isLeaf() {
        return arguments.isEmpty();
    }

    /**
     * @return true if this leaf is written as a decimal numeral.
     */
    public boolean isNumeral() {
        return isLeaf() && !name.isEmpty() && name.chars().allMatch(Character::isDigit);
    }

    public LogicalExpression getArgument(int index) {
        return arguments.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LogicalExpression that = (LogicalExpression) o;
        return name.equals(that.name) && sort == that.sort && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return arguments.stream()
                .map(LogicalExpression::toString)
                .collect(Collectors.joining(" ", "(" + name + " ", ")"));
    }
}

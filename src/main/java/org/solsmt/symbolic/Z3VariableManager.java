package org.solsmt.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.Sort;

import java.util.*;

/**
 * Maps declared variable names to Z3 constants.
 * Each name has exactly one Z3 constant in the Context; redeclaring a name
 * replaces it with a constant of the new sort.
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // insertion order is kept so models list variables in declaration order
    private final Map<String, Expr<?>> z3Vars;
    private final Map<String, Sort> sorts;

    /**
     * @param ctx the Z3 Context that owns the constants.
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.z3Vars = new LinkedHashMap<>();
        this.sorts = new LinkedHashMap<>();
    }

    /**
     * Creates the Z3 constant for a variable.
     * @param name variable name.
     * @param sort variable sort.
     * @return the Z3 constant.
     */
    public Expr<?> declare(String name, Sort sort) {
        Objects.requireNonNull(name, "Variable name cannot be null.");
        Objects.requireNonNull(sort, "Sort cannot be null.");
        Expr<?> var = switch (sort) {
            case BOOL -> ctx.mkBoolConst(name);
            case REAL -> ctx.mkRealConst(name);
        };
        Sort previous = sorts.put(name, sort);
        z3Vars.put(name, var);
        if (previous != null && previous != sort) {
            logger.warn("Z3 variable {} redeclared with sort {} (was {})", name, sort, previous);
        } else {
            logger.info("Created Z3 variable: {} : {}", name, sort);
        }
        return var;
    }

    /**
     * @param name variable name.
     * @return the Z3 constant, or empty if the name was never declared.
     */
    public Optional<Expr<?>> getZ3Var(String name) {
        return Optional.ofNullable(z3Vars.get(name));
    }

    public Set<String> getDeclaredNames() {
        return Collections.unmodifiableSet(z3Vars.keySet());
    }
}

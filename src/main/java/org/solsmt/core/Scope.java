package org.solsmt.core;

import java.util.Map;
import java.util.Optional;

/**
 * Name to sort lookup used while translating an expression.
 * A scope is never changed once it is visible to a translation; binders get a
 * new scope through {@link #extend(Map)} and the parent stays as it was.
 */
public interface Scope {

    /** Scope with no names in it. */
    Scope EMPTY = name -> Optional.empty();

    /**
     * @param name variable name.
     * @return the sort bound to the name, or empty if it is not visible here.
     */
    Optional<Sort> lookup(String name);

    default boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Creates a child scope in which {@code bindings} shadow this scope.
     * @param bindings new names and their sorts.
     * @return a new scope; this one is not modified.
     */
    default Scope extend(Map<String, Sort> bindings) {
        return new NestedScope(this, bindings);
    }
}

package org.solsmt.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sorts of the variables declared so far in a run. Entries are only added or
 * overwritten by declarations, never removed. It is the outermost scope seen
 * by the expression translator.
 * Owned by a single interpreter; not thread-safe.
 */
public final class DeclarationTable implements Scope {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationTable.class);

    private final Map<String, Sort> declarations = new LinkedHashMap<>();

    /**
     * Registers a variable.
     * @param name variable name.
     * @param sort declared sort.
     */
    public void declare(String name, Sort sort) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(sort, "Sort cannot be null");
        Sort previous = declarations.put(name, sort);
        if (previous != null) {
            logger.warn("Variable {} redeclared: {} -> {}", name, previous, sort);
        } else {
            logger.debug("Declared {}: {}", name, sort);
        }
    }

    @Override
    public Optional<Sort> lookup(String name) {
        return Optional.ofNullable(declarations.get(name));
    }

    public int size() {
        return declarations.size();
    }

    /** @return read-only view in declaration order. */
    public Map<String, Sort> asMap() {
        return Collections.unmodifiableMap(declarations);
    }

    @Override
    public String toString() {
        return declarations.toString();
    }
}

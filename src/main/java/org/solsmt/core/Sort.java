package org.solsmt.core;

import java.util.Optional;

/**
 * Value domain of an expression. Only these two are modelled.
 */
public enum Sort {

    BOOL("Bool"),
    REAL("Real");

    private final String smtName;

    Sort(String smtName) {
        this.smtName = smtName;
    }

    public String getSmtName() {
        return smtName;
    }

    /**
     * Looks a sort up by its SMT-LIB name ("Bool" or "Real").
     * @param name sort name as written in the script.
     * @return the sort, or empty if the name is not supported.
     */
    public static Optional<Sort> fromSmtName(String name) {
        for (Sort sort : values()) {
            if (sort.smtName.equals(name)) {
                return Optional.of(sort);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return smtName;
    }
}

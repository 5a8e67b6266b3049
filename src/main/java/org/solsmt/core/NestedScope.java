package org.solsmt.core;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scope introduced by a binder. Holds its own bindings and falls back to the
 * parent for everything else. Immutable.
 */
@Getter
public final class NestedScope implements Scope {

    private final Scope parent;
    private final Map<String, Sort> bindings;

    NestedScope(Scope parent, Map<String, Sort> bindings) {
        this.parent = Objects.requireNonNull(parent, "Parent scope cannot be null");
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        // copied so later changes to the caller's map are not seen here
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    @Override
    public Optional<Sort> lookup(String name) {
        Sort sort = bindings.get(name);
        if (sort != null) {
            return Optional.of(sort);
        }
        return parent.lookup(name);
    }

    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}")) + " -> " + parent;
    }
}

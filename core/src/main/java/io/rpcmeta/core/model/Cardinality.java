package io.rpcmeta.core.model;

/**
 * Contract between a schema parameter and the real declarations (or
 * annotations) matching it.
 */
public enum Cardinality {
    /** Exactly one match; the parameter holds the value itself. */
    EXACTLY_ONE,
    /** Zero or one match; the parameter is an {@code Optional}. */
    ZERO_OR_ONE,
    /**
     * Any number of matches in declaration order; the parameter is a
     * {@code List}.
     */
    MANY_LISTED,
    /**
     * Any number of matches keyed by externally-facing name; the parameter is a
     * {@code Map}.
     */
    MANY_NAMED;

    public boolean isMany() {
        return this == MANY_LISTED || this == MANY_NAMED;
    }
}

package io.rpcmeta.core.spi;

import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Resolves contextually provided instances by requested type. Consulted for
 * schema parameters with the contextual lookup strategy.
 *
 * <p>
 * Implementations MUST be synchronous, idempotent and free of side effects: the
 * engine may call them any number of times for the same type during one
 * derivation.
 */
public interface ContextResolver {

    /** A resolver that never finds anything. */
    ContextResolver EMPTY = type -> Optional.empty();

    /**
     * Looks up an instance for a non-strict parameter. Called when the value
     * tree is finalized.
     *
     * @param type the requested type, possibly parameterized
     * @return the instance, or empty if none is registered
     */
    Optional<Object> lookup(Type type);

    /**
     * Looks up an instance for a strict ({@code @Checked}) parameter. Called
     * while matching, so the result decides whether the surrounding real
     * declaration matches. Defaults to {@link #lookup(Type)}.
     */
    default Optional<Object> lookupStrict(Type type) {
        return lookup(type);
    }
}

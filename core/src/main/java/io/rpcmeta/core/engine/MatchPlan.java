package io.rpcmeta.core.engine;

import io.rpcmeta.core.error.AggregatedDerivationException;
import io.rpcmeta.core.error.ValueConstructionException;
import io.rpcmeta.core.spi.ContextResolver;
import java.util.List;

/**
 * A successful structural match of a schema against a real interface, not yet
 * materialized. Non-strict contextual lookups are still pending: a plan may
 * exist for an interface whose dependencies later turn out to be unresolvable.
 *
 * @param <T> the schema type
 */
public final class MatchPlan<T> {

    private final Class<T> schemaType;
    private final String interfaceName;
    private final ValuePlan root;
    private final ContextResolver resolver;

    MatchPlan(Class<T> schemaType, String interfaceName, ValuePlan root, ContextResolver resolver) {
        this.schemaType = schemaType;
        this.interfaceName = interfaceName;
        this.root = root;
        this.resolver = resolver;
    }

    public Class<T> schemaType() {
        return schemaType;
    }

    public String interfaceName() {
        return interfaceName;
    }

    /** The value plan of the root schema. */
    public ValuePlan root() {
        return root;
    }

    /**
     * Non-strict lookups that {@link #materialize()} will resolve, in
     * depth-first order.
     */
    public List<ValuePlan.DeferredLookup> pendingLookups() {
        return Finalizer.deferredLookups(root);
    }

    /**
     * Resolves pending lookups and constructs the value tree. May be called
     * repeatedly; every call builds a fresh, structurally equal tree as long as
     * the resolver answers the same.
     *
     * @throws AggregatedDerivationException in the finalization phase if a
     *                                       lookup finds nothing
     * @throws ValueConstructionException if a schema constructor throws
     */
    public T materialize() {
        return schemaType.cast(new Finalizer(resolver, schemaType.getName(), interfaceName).run(root));
    }

    @Override
    public String toString() {
        return "MatchPlan[" + schemaType.getName() + " for " + interfaceName + "]";
    }
}

package io.rpcmeta.core.engine;

import io.rpcmeta.core.config.DerivationConfig;
import io.rpcmeta.core.engine.reflect.ReflectiveInterfaceModel;
import io.rpcmeta.core.error.AggregatedDerivationException;
import io.rpcmeta.core.error.MetadataException;
import io.rpcmeta.core.error.SchemaDefinitionException;
import io.rpcmeta.core.model.RealInterface;
import io.rpcmeta.core.spi.ContextResolver;
import io.rpcmeta.core.spi.InterfaceModel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives metadata schema instances from real interfaces.
 *
 * <p>
 * Derivation runs in two phases. {@link #match} validates the schema (once per
 * schema class) and structurally matches it against the interface, collecting
 * every independent failure into one {@link AggregatedDerivationException}.
 * {@link MatchPlan#materialize()} then resolves the non-strict contextual
 * lookups and constructs the value tree. {@link #derive} runs both.
 *
 * <p>
 * Thread-safe: independent derivations may run concurrently. Each derivation
 * has its own matching state; only validated schemas and derived values are
 * shared.
 */
public final class MetadataDeriver {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataDeriver.class);

    private final InterfaceModel model;
    private final ContextResolver resolver;
    private final DerivationConfig config;
    private final SchemaAnalyzer analyzer = new SchemaAnalyzer();
    private final MetadataCache cache = new MetadataCache();

    /** Reflective model, no contextual instances, default configuration. */
    public MetadataDeriver() {
        this(ContextResolver.EMPTY, DerivationConfig.DEFAULT);
    }

    /**
     * Reflective model built from {@code config}, so every setting of
     * {@code config} applies, including
     * {@link DerivationConfig#includeDefaultMethods()}.
     */
    public MetadataDeriver(ContextResolver resolver, DerivationConfig config) {
        this(new ReflectiveInterfaceModel(config), resolver, config);
    }

    /**
     * Explicit interface model. Settings that shape the model itself
     * ({@link DerivationConfig#includeDefaultMethods()}) are the model's own:
     * pass the same config to {@link ReflectiveInterfaceModel} when building
     * it.
     */
    public MetadataDeriver(InterfaceModel model, ContextResolver resolver, DerivationConfig config) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Structurally matches a schema against an interface.
     *
     * @throws SchemaDefinitionException if the schema is malformed
     * @throws AggregatedDerivationException if matching fails
     */
    public <T> MatchPlan<T> match(Class<T> schema, Class<?> iface) {
        return match(schema, model.describe(iface));
    }

    /** Structurally matches a schema against an already described interface. */
    public <T> MatchPlan<T> match(Class<T> schema, RealInterface iface) {
        SchemaType type = analyzer.analyze(schema);
        SchemaConstructor constructor = new SchemaConstructor(new TagMatcher(), resolver, config);
        Res<ValuePlan> result = constructor.construct(type, iface, 0);
        if (!result.isOk()) {
            LOG.warn(
                    "derivation.failed schema={} interface={} phase={} problems={}",
                    schema.getName(),
                    iface.source(),
                    MetadataException.Phase.MATCHING,
                    result.failures().size());
            throw new AggregatedDerivationException(
                    schema.getName(), iface.source(), MetadataException.Phase.MATCHING, result.failures());
        }
        return new MatchPlan<>(schema, iface.source(), result.value(), resolver);
    }

    /**
     * Derives the schema instance describing an interface. With caching
     * enabled, each (schema, interface) pair is derived once and the same
     * instance returned afterwards.
     *
     * @throws SchemaDefinitionException if the schema is malformed
     * @throws AggregatedDerivationException if matching or deferred lookups
     *                                       fail
     * @throws io.rpcmeta.core.error.ValueConstructionException if a schema
     *                                                          constructor
     *                                                          throws
     */
    public <T> T derive(Class<T> schema, Class<?> iface) {
        if (!config.cacheEnabled()) {
            return derive(schema, model.describe(iface));
        }
        return cache.get(schema, iface, () -> derive(schema, model.describe(iface)));
    }

    /**
     * Derives the schema instance describing an already described interface;
     * never cached.
     */
    public <T> T derive(Class<T> schema, RealInterface iface) {
        long start = System.nanoTime();
        MatchPlan<T> plan = match(schema, iface);
        T value;
        try {
            value = plan.materialize();
        } catch (MetadataException e) {
            LOG.warn(
                    "derivation.failed schema={} interface={} phase={} detail={}",
                    schema.getName(),
                    iface.source(),
                    e.phase(),
                    e.getMessage());
            throw e;
        }
        LOG.info(
                "derivation.completed schema={} interface={} methods={} duration_ms={}",
                schema.getName(),
                iface.source(),
                iface.methods().size(),
                (System.nanoTime() - start) / 1_000_000);
        return value;
    }

    /**
     * Like {@link #derive(Class, Class)}, reporting failures as a value instead
     * of throwing them.
     */
    public <T> DerivationResult<T> tryDerive(Class<T> schema, Class<?> iface) {
        try {
            return DerivationResult.success(derive(schema, iface));
        } catch (MetadataException e) {
            return DerivationResult.failure(e);
        }
    }

    /** Validates a schema without deriving it. */
    public SchemaType analyze(Class<?> schema) {
        return analyzer.analyze(schema);
    }

    public DerivationConfig config() {
        return config;
    }

    /** Number of cached derived values. */
    public int cachedValues() {
        return cache.size();
    }

    /** Drops every cached derived value; validated schemas stay cached. */
    public void clearCache() {
        cache.clear();
    }
}

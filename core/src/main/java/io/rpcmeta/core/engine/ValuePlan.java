package io.rpcmeta.core.engine;

import io.rpcmeta.core.model.Cardinality;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural result of matching one schema against one real declaration: what
 * to construct and from which values. Produced by the matching phase, turned
 * into instances by {@link Finalizer}. Non-strict contextual lookups stay
 * unresolved ({@link DeferredLookup}) until then.
 */
public sealed interface ValuePlan
        permits ValuePlan.Constant,
                ValuePlan.DeferredLookup,
                ValuePlan.Construct,
                ValuePlan.OptionalOf,
                ValuePlan.ListOf,
                ValuePlan.MapOf {

    /** A value known at match time. */
    record Constant(Object value) implements ValuePlan {}

    /**
     * A non-strict contextual lookup, resolved at finalization.
     *
     * @param type      requested type
     * @param parameter description of the schema parameter asking for it
     * @param source    source position of the real declaration being described
     */
    record DeferredLookup(Type type, String parameter, String source) implements ValuePlan {}

    /**
     * One schema instance.
     *
     * @param schema    the schema to construct
     * @param arguments one plan per constructor parameter, in order
     * @param source    source position of the real declaration it describes
     */
    record Construct(SchemaType schema, List<ValuePlan> arguments, String source) implements ValuePlan {
        public Construct {
            arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }
    }

    /** A zero-or-one value; {@code element} is {@code null} when empty. */
    record OptionalOf(ValuePlan element) implements ValuePlan {}

    record ListOf(List<ValuePlan> elements) implements ValuePlan {
        public ListOf {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Name-keyed values; iteration order is the declaration order of the
     * matched members.
     */
    record MapOf(Map<String, ValuePlan> entries) implements ValuePlan {
        public MapOf {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * Shapes resolved candidates according to the cardinality of the parameter
     * they were matched for.
     */
    static ValuePlan collect(Cardinality cardinality, List<Candidate<ValuePlan>> accepted) {
        return switch (cardinality) {
            case EXACTLY_ONE -> accepted.get(0).value();
            case ZERO_OR_ONE -> new OptionalOf(accepted.isEmpty() ? null : accepted.get(0).value());
            case MANY_LISTED -> new ListOf(accepted.stream().map(Candidate::value).toList());
            case MANY_NAMED -> {
                Map<String, ValuePlan> entries = new LinkedHashMap<>();
                accepted.forEach(c -> entries.put(c.name(), c.value()));
                yield new MapOf(entries);
            }
        };
    }
}

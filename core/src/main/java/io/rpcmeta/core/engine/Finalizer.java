package io.rpcmeta.core.engine;

import io.rpcmeta.core.error.AggregatedDerivationException;
import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.error.MetadataException;
import io.rpcmeta.core.error.ValueConstructionException;
import io.rpcmeta.core.spi.ContextResolver;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a value plan into schema instances. Every deferred lookup is resolved
 * before the first constructor runs, so a missing instance never leaves a
 * half-built tree behind.
 */
final class Finalizer {

    private final ContextResolver resolver;
    private final String schemaType;
    private final String interfaceName;
    private final Map<Type, Object> resolved = new HashMap<>();

    Finalizer(ContextResolver resolver, String schemaType, String interfaceName) {
        this.resolver = resolver;
        this.schemaType = schemaType;
        this.interfaceName = interfaceName;
    }

    /**
     * @throws AggregatedDerivationException with {@code LOOKUP_FAILURE}
     *                                       diagnostics if deferred lookups
     *                                       cannot be resolved
     * @throws ValueConstructionException if a schema constructor throws
     */
    Object run(ValuePlan plan) {
        List<Diagnostic> missing = new ArrayList<>();
        for (ValuePlan.DeferredLookup lookup : deferredLookups(plan)) {
            if (resolved.containsKey(lookup.type())) {
                continue;
            }
            Optional<Object> found = resolver.lookup(lookup.type());
            if (found.isPresent()) {
                resolved.put(lookup.type(), found.get());
            } else {
                missing.add(new Diagnostic(
                        Diagnostic.Kind.LOOKUP_FAILURE,
                        lookup.parameter(),
                        List.of(lookup.source()),
                        "no instance of " + lookup.type().getTypeName() + " available for " + lookup.parameter()));
            }
        }
        if (!missing.isEmpty()) {
            throw new AggregatedDerivationException(
                    schemaType, interfaceName, MetadataException.Phase.FINALIZATION, missing);
        }
        return build(plan);
    }

    /** All deferred lookups of the plan, depth first. */
    static List<ValuePlan.DeferredLookup> deferredLookups(ValuePlan plan) {
        List<ValuePlan.DeferredLookup> result = new ArrayList<>();
        collect(plan, result);
        return result;
    }

    private static void collect(ValuePlan plan, List<ValuePlan.DeferredLookup> into) {
        if (plan instanceof ValuePlan.DeferredLookup lookup) {
            into.add(lookup);
        } else if (plan instanceof ValuePlan.Construct construct) {
            construct.arguments().forEach(a -> collect(a, into));
        } else if (plan instanceof ValuePlan.OptionalOf optional && optional.element() != null) {
            collect(optional.element(), into);
        } else if (plan instanceof ValuePlan.ListOf list) {
            list.elements().forEach(e -> collect(e, into));
        } else if (plan instanceof ValuePlan.MapOf map) {
            map.entries().values().forEach(e -> collect(e, into));
        }
    }

    private Object build(ValuePlan plan) {
        if (plan instanceof ValuePlan.Constant constant) {
            return constant.value();
        }
        if (plan instanceof ValuePlan.DeferredLookup lookup) {
            return resolved.get(lookup.type());
        }
        if (plan instanceof ValuePlan.OptionalOf optional) {
            return optional.element() == null ? Optional.empty() : Optional.ofNullable(build(optional.element()));
        }
        if (plan instanceof ValuePlan.ListOf list) {
            List<Object> values = new ArrayList<>(list.elements().size());
            list.elements().forEach(e -> values.add(build(e)));
            return Collections.unmodifiableList(values);
        }
        if (plan instanceof ValuePlan.MapOf map) {
            Map<String, Object> values = new LinkedHashMap<>();
            map.entries().forEach((name, e) -> values.put(name, build(e)));
            return Collections.unmodifiableMap(values);
        }
        ValuePlan.Construct construct = (ValuePlan.Construct) plan;
        Object[] arguments = new Object[construct.arguments().size()];
        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = build(construct.arguments().get(i));
        }
        try {
            return construct.schema().constructor().newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new ValueConstructionException(
                    construct.schema().description() + " rejected the values derived from " + construct.source()
                            + ": " + e.getCause().getMessage(),
                    e.getCause(),
                    schemaType,
                    interfaceName);
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new ValueConstructionException(
                    "cannot construct " + construct.schema().description() + " for " + construct.source(),
                    e,
                    schemaType,
                    interfaceName);
        }
    }
}

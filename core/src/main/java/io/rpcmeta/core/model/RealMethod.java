package io.rpcmeta.core.model;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A real interface method.
 *
 * @param name            method name
 * @param resultType      declared result type
 * @param annotations     annotations declared on the method
 * @param parameterGroups parameters, grouped; reflected Java methods have
 *                        exactly one group
 * @param overridden      methods of supertypes overridden or implemented by
 *                        this method
 * @param source          source position
 */
public record RealMethod(
        String name,
        Type resultType,
        List<Annotation> annotations,
        List<List<RealParam>> parameterGroups,
        List<RealMethod> overridden,
        String source)
        implements RealDeclaration {

    public RealMethod {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(resultType, "resultType must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        parameterGroups = parameterGroups != null
                ? parameterGroups.stream().map(List::copyOf).toList()
                : List.of();
        overridden = overridden != null ? List.copyOf(overridden) : List.of();
        source = source != null ? source : name;
    }

    @Override
    public Type type() {
        return resultType;
    }

    @Override
    public List<RealMethod> inherited() {
        return overridden;
    }

    @Override
    public Scope scope() {
        return Scope.METHOD;
    }

    /** All parameters of all groups, in declaration order. */
    public List<RealParam> parameters() {
        List<RealParam> all = new ArrayList<>();
        parameterGroups.forEach(all::addAll);
        return all;
    }

    @Override
    public String toString() {
        return "RealMethod[" + source + "]";
    }
}

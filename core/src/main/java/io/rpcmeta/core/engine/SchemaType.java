package io.rpcmeta.core.engine;

import io.rpcmeta.core.model.Scope;
import io.rpcmeta.core.model.Strategy;
import java.lang.reflect.Constructor;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * A validated schema class at one scope: its constructor, parameters and tag
 * configuration. Created by {@link SchemaAnalyzer}; immutable once the schema
 * tree is built and safe to share across derivations.
 */
public final class SchemaType {

    private final Class<?> type;
    private final Scope scope;
    private final Constructor<?> constructor;
    private final SchemaParam enclosing;
    private final TagConfig methodTags;
    private final TagConfig paramTags;
    private final Type describedType;
    private List<SchemaParam> params = List.of();
    private List<SchemaParam> memberParams;

    SchemaType(
            Class<?> type,
            Scope scope,
            Constructor<?> constructor,
            SchemaParam enclosing,
            TagConfig methodTags,
            TagConfig paramTags,
            Type describedType) {
        this.type = type;
        this.scope = scope;
        this.constructor = constructor;
        this.enclosing = enclosing;
        this.methodTags = methodTags;
        this.paramTags = paramTags;
        this.describedType = describedType;
    }

    void params(List<SchemaParam> params) {
        this.params = List.copyOf(params);
    }

    public Class<?> type() {
        return type;
    }

    public Scope scope() {
        return scope;
    }

    public Constructor<?> constructor() {
        return constructor;
    }

    /**
     * The parameter this schema is nested at, or {@code null} for the root
     * schema.
     */
    public SchemaParam enclosing() {
        return enclosing;
    }

    /** Tag family for matching real methods (interface scope). */
    public TagConfig methodTags() {
        return methodTags;
    }

    /** Tag family for matching real parameters (interface and method scope). */
    public TagConfig paramTags() {
        return paramTags;
    }

    /**
     * The real type this schema is restricted to via {@code TypedMetadata}, or
     * {@code null}.
     */
    public Type describedType() {
        return describedType;
    }

    public List<SchemaParam> params() {
        return params;
    }

    /**
     * Member-matching parameters of this schema and of every schema embedded in
     * it, in declaration order. These are matched together against the members
     * of one real declaration.
     */
    public List<SchemaParam> memberParams() {
        if (memberParams == null) {
            List<SchemaParam> result = new ArrayList<>();
            for (SchemaParam param : params) {
                Strategy.Kind kind = param.strategy().kind();
                if (kind.isMemberMatching()) {
                    result.add(param);
                } else if (kind == Strategy.Kind.EMBEDDED) {
                    result.addAll(param.nested().memberParams());
                }
            }
            memberParams = List.copyOf(result);
        }
        return memberParams;
    }

    /**
     * Identifier with owner chain, e.g.
     * {@code schema MethodMeta at parameter 'calls' of schema ApiMeta}.
     */
    public String description() {
        String self = "schema " + type.getSimpleName();
        return enclosing == null ? self : self + " at " + enclosing.description();
    }

    @Override
    public String toString() {
        return "SchemaType[" + type.getName() + ", " + scope + "]";
    }
}

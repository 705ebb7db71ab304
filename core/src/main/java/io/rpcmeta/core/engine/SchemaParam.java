package io.rpcmeta.core.engine;

import io.rpcmeta.core.model.Cardinality;
import io.rpcmeta.core.model.Strategy;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;

/**
 * One validated constructor parameter of a schema. Created by
 * {@link SchemaAnalyzer}; immutable once the owning schema tree is built.
 */
public final class SchemaParam {

    private final SchemaType owner;
    private final int index;
    private final String name;
    private final Type type;
    private final Strategy strategy;
    private final Cardinality cardinality;
    private final Type elementType;
    private final Class<? extends Annotation> tagged;
    private final boolean auxiliary;
    private SchemaType nested;

    SchemaParam(
            SchemaType owner,
            int index,
            String name,
            Type type,
            Strategy strategy,
            Cardinality cardinality,
            Type elementType,
            Class<? extends Annotation> tagged,
            boolean auxiliary) {
        this.owner = owner;
        this.index = index;
        this.name = name;
        this.type = type;
        this.strategy = strategy;
        this.cardinality = cardinality;
        this.elementType = elementType;
        this.tagged = tagged;
        this.auxiliary = auxiliary;
    }

    void nested(SchemaType nested) {
        this.nested = nested;
    }

    public SchemaType owner() {
        return owner;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    /** Declared (generic) type of the constructor parameter. */
    public Type type() {
        return type;
    }

    public Strategy strategy() {
        return strategy;
    }

    /** Cardinality, or {@code null} for strategies that take none. */
    public Cardinality cardinality() {
        return cardinality;
    }

    /**
     * The type of one matched value: the parameter type itself for exactly-one,
     * the type argument of {@code Optional}, {@code List} or the value type of
     * {@code Map} otherwise.
     */
    public Type elementType() {
        return elementType;
    }

    /** Tag restriction from {@code @Tagged}, or {@code null}. */
    public Class<? extends Annotation> tagged() {
        return tagged;
    }

    public boolean auxiliary() {
        return auxiliary;
    }

    /**
     * The schema resolved for each match (embedded, per-method, per-parameter),
     * or {@code null}.
     */
    public SchemaType nested() {
        return nested;
    }

    /**
     * Identifier with owner chain, e.g.
     * {@code parameter 'users' of schema ApiMeta}.
     */
    public String description() {
        return "parameter '" + name + "' of " + owner.description();
    }

    @Override
    public String toString() {
        return "SchemaParam[" + description() + ", " + strategy.kind() + "]";
    }
}

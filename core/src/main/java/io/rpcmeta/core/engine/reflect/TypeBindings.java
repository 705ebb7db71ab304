package io.rpcmeta.core.engine.reflect;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.HashMap;
import java.util.Map;

/**
 * Type arguments an interface passes to its superinterfaces, transitively.
 *
 * <p>
 * For {@code interface StringStore extends Store<String>}, the type variable
 * {@code T} of {@code Store} is bound to {@code String}, so the inherited
 * {@code put(T)} erases to {@code put(String)} as seen from
 * {@code StringStore}.
 */
final class TypeBindings {

    private final Map<TypeVariable<?>, Type> bindings = new HashMap<>();

    private TypeBindings() {}

    static TypeBindings of(Class<?> iface) {
        TypeBindings result = new TypeBindings();
        result.collect(iface);
        return result;
    }

    private void collect(Class<?> type) {
        for (Type supertype : type.getGenericInterfaces()) {
            if (supertype instanceof ParameterizedType parameterized) {
                Class<?> raw = (Class<?>) parameterized.getRawType();
                TypeVariable<?>[] variables = raw.getTypeParameters();
                Type[] arguments = parameterized.getActualTypeArguments();
                for (int i = 0; i < variables.length; i++) {
                    bindings.putIfAbsent(variables[i], resolve(arguments[i]));
                }
                collect(raw);
            } else if (supertype instanceof Class<?> raw) {
                collect(raw);
            }
        }
    }

    /** Substitutes bound type variables; unbound ones are left as they are. */
    Type resolve(Type type) {
        Type current = type;
        while (current instanceof TypeVariable<?> variable && bindings.containsKey(variable)) {
            current = bindings.get(variable);
        }
        return current;
    }

    /** Erasure of the type after substitution. */
    Class<?> erase(Type type) {
        Type resolved = resolve(type);
        if (resolved instanceof Class<?> raw) {
            return raw;
        }
        if (resolved instanceof ParameterizedType parameterized) {
            return (Class<?>) parameterized.getRawType();
        }
        if (resolved instanceof GenericArrayType array) {
            return erase(array.getGenericComponentType()).arrayType();
        }
        if (resolved instanceof TypeVariable<?> variable) {
            return erase(variable.getBounds()[0]);
        }
        if (resolved instanceof WildcardType wildcard) {
            return erase(wildcard.getUpperBounds()[0]);
        }
        return Object.class;
    }
}

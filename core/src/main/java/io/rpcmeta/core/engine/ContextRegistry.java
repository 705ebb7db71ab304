package io.rpcmeta.core.engine;

import io.rpcmeta.core.model.TypeRef;
import io.rpcmeta.core.spi.ContextResolver;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit registry of contextual instances, keyed by requested type. Callers
 * populate it before invoking derivation. Thread-safe: registration and lookup
 * can happen concurrently.
 */
public final class ContextRegistry implements ContextResolver {

    private final Map<Type, Object> instances = new ConcurrentHashMap<>();

    /**
     * Registers an instance under a raw class. If an instance is already
     * registered for the type, it is replaced (last-write-wins semantics).
     *
     * @throws NullPointerException if type or instance is null
     * @throws IllegalArgumentException if instance is not an instance of type
     */
    public <T> ContextRegistry register(Class<T> type, T instance) {
        if (type == null || instance == null) {
            throw new NullPointerException("type and instance must not be null");
        }
        if (!box(type).isInstance(instance)) {
            throw new IllegalArgumentException(
                    "instance of " + instance.getClass().getName() + " is not a " + type.getName());
        }
        instances.put(type, instance);
        return this;
    }

    /**
     * Registers an instance under a possibly parameterized type captured by a
     * {@link TypeRef}.
     */
    public <T> ContextRegistry register(TypeRef<T> typeRef, T instance) {
        if (typeRef == null || instance == null) {
            throw new NullPointerException("typeRef and instance must not be null");
        }
        instances.put(typeRef.type(), instance);
        return this;
    }

    @Override
    public Optional<Object> lookup(Type type) {
        return Optional.ofNullable(instances.get(type));
    }

    /** Returns {@code true} if an instance is registered for the given type. */
    public boolean contains(Type type) {
        return instances.containsKey(type);
    }

    /** Returns the number of registered instances. */
    public int size() {
        return instances.size();
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }
}

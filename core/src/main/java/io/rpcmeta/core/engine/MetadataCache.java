package io.rpcmeta.core.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Derived values keyed by (schema type, interface). Failures are not cached:
 * they are rethrown to the caller and derivation runs again next time.
 */
final class MetadataCache {

    private record Key(Class<?> schema, Class<?> iface) {}

    private final Map<Key, Object> values = new ConcurrentHashMap<>();

    <T> T get(Class<T> schema, Class<?> iface, Supplier<T> derivation) {
        Key key = new Key(schema, iface);
        Object cached = values.get(key);
        if (cached != null) {
            return schema.cast(cached);
        }
        T derived = derivation.get();
        Object previous = values.putIfAbsent(key, derived);
        return previous != null ? schema.cast(previous) : derived;
    }

    int size() {
        return values.size();
    }

    void clear() {
        values.clear();
    }
}

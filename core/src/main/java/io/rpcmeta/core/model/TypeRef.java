package io.rpcmeta.core.model;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a possibly parameterized type at compile time:
 *
 * <pre>{@code
 * registry.register(new TypeRef<Codec<String>>() {}, stringCodec);
 * }</pre>
 *
 * @param <T> the captured type
 */
public abstract class TypeRef<T> {

    private final Type type;

    protected TypeRef() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType parameterized)) {
            throw new IllegalStateException("TypeRef must be created with an explicit type argument");
        }
        this.type = parameterized.getActualTypeArguments()[0];
    }

    public Type type() {
        return type;
    }

    @Override
    public String toString() {
        return "TypeRef[" + type.getTypeName() + "]";
    }
}

package io.rpcmeta.core.model;

/**
 * Implemented by schema classes that only describe real declarations of a
 * particular type: the interface type for interface-scope schemas, the result
 * type for method-scope schemas, the parameter type for parameter-scope
 * schemas.
 *
 * <p>
 * When {@code T} is a concrete type, a real declaration of any other type does
 * not match the schema. When {@code T} is a type variable or wildcard, the
 * schema is unconstrained.
 *
 * @param <T> the real type described
 */
public interface TypedMetadata<T> {}

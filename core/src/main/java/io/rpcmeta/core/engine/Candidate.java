package io.rpcmeta.core.engine;

/**
 * One qualifying candidate offered to {@link CardinalityResolver}.
 *
 * @param name   externally-facing name, used as the key of name-keyed matches
 * @param source source position of the real declaration the candidate came from
 * @param value  the candidate value
 * @param <T>    value type
 */
public record Candidate<T>(String name, String source, T value) {}

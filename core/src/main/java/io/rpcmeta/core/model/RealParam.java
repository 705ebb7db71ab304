package io.rpcmeta.core.model;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;

/**
 * A real method parameter.
 *
 * @param name         parameter name
 * @param type         declared parameter type
 * @param index        index among all parameters of the method
 * @param indexOfGroup index of the parameter group
 * @param indexInGroup index within the parameter group
 * @param flags        parameter flags
 * @param annotations  annotations declared on the parameter
 * @param overridden   parameters at the same index in methods overridden by the
 *                     owning method
 * @param source       source position
 */
public record RealParam(
        String name,
        Type type,
        int index,
        int indexOfGroup,
        int indexInGroup,
        ParamFlags flags,
        List<Annotation> annotations,
        List<RealParam> overridden,
        String source)
        implements RealDeclaration {

    public RealParam {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        flags = flags != null ? flags : ParamFlags.EMPTY;
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        overridden = overridden != null ? List.copyOf(overridden) : List.of();
        source = source != null ? source : name;
    }

    @Override
    public List<RealParam> inherited() {
        return overridden;
    }

    @Override
    public Scope scope() {
        return Scope.PARAMETER;
    }

    /**
     * Position of this parameter when it is the {@code indexInMatched}-th match
     * of a schema parameter.
     */
    public ParamPosition position(int indexInMatched) {
        return new ParamPosition(index, indexOfGroup, indexInGroup, indexInMatched);
    }

    @Override
    public String toString() {
        return "RealParam[" + source + "]";
    }
}

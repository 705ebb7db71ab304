package io.rpcmeta.core.model;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;

/**
 * The real interface being described.
 *
 * @param name        simple name of the interface
 * @param type        the interface type
 * @param annotations annotations declared on the interface
 * @param supertypes  direct superinterfaces
 * @param methods     abstract methods (declared and inherited), in declaration
 *                    order
 * @param source      source position (usually the fully qualified name)
 */
public record RealInterface(
        String name,
        Type type,
        List<Annotation> annotations,
        List<RealInterface> supertypes,
        List<RealMethod> methods,
        String source)
        implements RealDeclaration {

    public RealInterface {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        supertypes = supertypes != null ? List.copyOf(supertypes) : List.of();
        methods = methods != null ? List.copyOf(methods) : List.of();
        source = source != null ? source : type.getTypeName();
    }

    @Override
    public List<RealInterface> inherited() {
        return supertypes;
    }

    @Override
    public Scope scope() {
        return Scope.INTERFACE;
    }

    @Override
    public String toString() {
        return "RealInterface[" + source + "]";
    }
}

package io.rpcmeta.core.model;

import io.rpcmeta.core.annotation.RpcName;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A declaration of the real interface being described: the interface itself,
 * one of its methods, or one of their parameters.
 */
public interface RealDeclaration {

    /** Java identifier of the declaration. */
    String name();

    /**
     * The declared type: the interface type, the method result type or the
     * parameter type.
     */
    Type type();

    /**
     * Annotations declared directly on this declaration, in declaration order.
     */
    List<Annotation> annotations();

    /**
     * Declarations this one inherits annotations from: supertypes of an
     * interface, methods overridden by a method, index-corresponding parameters
     * of overridden methods.
     */
    List<? extends RealDeclaration> inherited();

    /**
     * Human-readable source position, e.g.
     * {@code com.acme.UserApi#find(java.lang.String)}.
     */
    String source();

    Scope scope();

    /**
     * Own annotations followed by inherited ones, closest declarations first.
     * Equal annotation instances reachable through several inheritance paths
     * appear once.
     */
    default List<Annotation> allAnnotations() {
        Set<Annotation> result = new LinkedHashSet<>();
        Set<RealDeclaration> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<RealDeclaration> queue = new ArrayDeque<>();
        queue.add(this);
        while (!queue.isEmpty()) {
            RealDeclaration current = queue.poll();
            if (visited.add(current)) {
                result.addAll(current.annotations());
                queue.addAll(current.inherited());
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * The externally-facing name: the value of the closest {@link RpcName},
     * else {@link #name()}.
     */
    default String rpcName() {
        for (Annotation annotation : allAnnotations()) {
            if (annotation instanceof RpcName rpcName) {
                return rpcName.value();
            }
        }
        return name();
    }
}

package io.rpcmeta.core.engine;

import io.rpcmeta.core.annotation.RpcTag;
import io.rpcmeta.core.model.RealDeclaration;
import java.lang.annotation.Annotation;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Hierarchical tag inheritance and filtering shared by every matching step.
 *
 * <p>
 * A real declaration's effective tag is its own (or inherited) tag annotation
 * belonging to the configured family, else the family's default tag, else none.
 * A schema parameter restricted to tag {@code T} accepts only declarations
 * whose effective tag is {@code T} or a refinement of it.
 *
 * <p>
 * Effective tags and annotation lists are cached per instance; one instance
 * serves exactly one derivation and is not thread-safe.
 */
public final class TagMatcher {

    private final Map<TagConfig, Map<RealDeclaration, Optional<Class<? extends Annotation>>>> effectiveTags =
            new HashMap<>();
    private final Map<RealDeclaration, List<Annotation>> annotations = new IdentityHashMap<>();

    /**
     * Returns {@code true} if the annotation type is meta-annotated with
     * {@link RpcTag}.
     */
    public static boolean isTag(Class<? extends Annotation> type) {
        return type != null && type.isAnnotationPresent(RpcTag.class);
    }

    /**
     * Returns {@code true} if {@code tag} is {@code ancestor} or refines it
     * through a chain of {@link RpcTag#parent()} links.
     */
    public static boolean refines(Class<? extends Annotation> tag, Class<? extends Annotation> ancestor) {
        Set<Class<?>> seen = new HashSet<>();
        Class<? extends Annotation> current = tag;
        while (current != null && seen.add(current)) {
            if (current == ancestor) {
                return true;
            }
            RpcTag meta = current.getAnnotation(RpcTag.class);
            if (meta == null || meta.parent() == RpcTag.class) {
                return false;
            }
            current = meta.parent();
        }
        return false;
    }

    /**
     * Returns {@code true} if the annotation is an instance of the requested
     * type or, for tags, a refinement of it.
     */
    public static boolean isAssignable(Annotation annotation, Class<?> requested) {
        if (requested.isInstance(annotation)) {
            return true;
        }
        return requested.isAnnotation()
                && isTag(annotation.annotationType())
                && refines(annotation.annotationType(), requested.asSubclass(Annotation.class));
    }

    /** All annotations of the declaration including inherited ones, cached. */
    public List<Annotation> annotationsOf(RealDeclaration declaration) {
        return annotations.computeIfAbsent(declaration, RealDeclaration::allAnnotations);
    }

    /** The declaration's effective tag in the given family, if any. */
    public Optional<Class<? extends Annotation>> effectiveTag(RealDeclaration declaration, TagConfig config) {
        return effectiveTags
                .computeIfAbsent(config, c -> new IdentityHashMap<>())
                .computeIfAbsent(declaration, d -> computeEffectiveTag(d, config));
    }

    /**
     * Returns {@code true} if a schema parameter restricted to {@code required}
     * (or unrestricted, when {@code null}) accepts the declaration in the given
     * tag family.
     */
    public boolean accepts(Class<? extends Annotation> required, TagConfig config, RealDeclaration declaration) {
        Class<? extends Annotation> restriction = required != null ? required : config.base();
        if (restriction == null) {
            return true;
        }
        return effectiveTag(declaration, config)
                .map(tag -> refines(tag, restriction))
                .orElse(false);
    }

    private Optional<Class<? extends Annotation>> computeEffectiveTag(RealDeclaration declaration, TagConfig config) {
        for (Annotation annotation : annotationsOf(declaration)) {
            Class<? extends Annotation> type = annotation.annotationType();
            if (isTag(type) && (config.base() == null || refines(type, config.base()))) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(config.defaultTag());
    }
}

package io.rpcmeta.core.engine;

import io.rpcmeta.core.annotation.Auxiliary;
import io.rpcmeta.core.annotation.Checked;
import io.rpcmeta.core.annotation.MethodTag;
import io.rpcmeta.core.annotation.Multi;
import io.rpcmeta.core.annotation.ParamTag;
import io.rpcmeta.core.annotation.RpcTag;
import io.rpcmeta.core.annotation.Single;
import io.rpcmeta.core.annotation.Tagged;
import io.rpcmeta.core.annotation.ZeroOrOne;
import io.rpcmeta.core.error.CycleException;
import io.rpcmeta.core.error.SchemaConfigurationException;
import io.rpcmeta.core.error.SchemaDefinitionException;
import io.rpcmeta.core.model.Cardinality;
import io.rpcmeta.core.model.ParamFlags;
import io.rpcmeta.core.model.ParamPosition;
import io.rpcmeta.core.model.Scope;
import io.rpcmeta.core.model.Strategy;
import io.rpcmeta.core.model.TypedMetadata;
import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates schema classes and builds their {@link SchemaType} trees.
 * Validation is independent of any real interface, so results (including
 * failures) are cached per schema class and shared by every derivation using
 * it.
 *
 * <p>
 * Thread-safe.
 */
public final class SchemaAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaAnalyzer.class);

    private final Map<Class<?>, Object> cache = new ConcurrentHashMap<>();

    /**
     * Returns the interface-scope schema tree for the given class.
     *
     * @throws SchemaConfigurationException if the schema is malformed
     * @throws CycleException if the schema embeds itself
     */
    public SchemaType analyze(Class<?> schema) {
        Object cached = cache.get(schema);
        if (cached == null) {
            cached = build(schema);
            Object previous = cache.putIfAbsent(schema, cached);
            if (previous != null) {
                cached = previous;
            }
        }
        if (cached instanceof SchemaDefinitionException e) {
            throw e;
        }
        return (SchemaType) cached;
    }

    /** Returns the number of schema classes analyzed so far, valid or not. */
    public int cachedCount() {
        return cache.size();
    }

    private Object build(Class<?> schema) {
        try {
            SchemaType type = new Builder(schema).root();
            LOG.debug("Analyzed schema {}: {} member-matching parameter(s)", schema.getName(), type.memberParams().size());
            return type;
        } catch (SchemaDefinitionException e) {
            LOG.debug("Schema {} rejected: {}", schema.getName(), e.getMessage());
            return e;
        }
    }

    /**
     * Builds one schema tree, tracking the descent path for cycle detection.
     */
    private static final class Builder {

        private record PathKey(Class<?> type, Scope scope) {}

        private final Class<?> root;
        private final List<PathKey> path = new ArrayList<>();

        Builder(Class<?> root) {
            this.root = root;
        }

        SchemaType root() {
            TagConfig methodTags = tagConfig(root.getAnnotation(MethodTag.class), null);
            TagConfig paramTags = tagConfig(root.getAnnotation(ParamTag.class), null);
            return analyzeAt(root, Scope.INTERFACE, null, orNone(methodTags), orNone(paramTags));
        }

        private SchemaType analyzeAt(
                Class<?> type, Scope scope, SchemaParam enclosing, TagConfig methodTags, TagConfig paramTags) {
            PathKey key = new PathKey(type, scope);
            if (path.contains(key)) {
                List<String> cycle = new ArrayList<>();
                for (PathKey k : path.subList(path.indexOf(key), path.size())) {
                    cycle.add(k.type().getSimpleName());
                }
                cycle.add(type.getSimpleName());
                throw new CycleException(
                        "schema " + type.getSimpleName() + " embeds itself: " + String.join(" -> ", cycle),
                        root.getName(),
                        enclosing != null ? enclosing.description() : null,
                        cycle);
            }
            path.add(key);

            Constructor<?> constructor = primaryConstructor(type, enclosing);
            SchemaType schema = new SchemaType(
                    type,
                    scope,
                    constructor,
                    enclosing,
                    scope == Scope.INTERFACE ? methodTags : TagConfig.NONE,
                    scope == Scope.PARAMETER ? TagConfig.NONE : paramTags,
                    describedType(type));

            Type[] types = parameterTypes(type, constructor);
            String[] names = parameterNames(type, constructor);
            Annotation[][] annotations = constructor.getParameterAnnotations();
            int offset = constructor.getParameterCount() - annotations.length;
            List<SchemaParam> params = new ArrayList<>();
            for (int i = 0; i < types.length; i++) {
                List<Annotation> paramAnnotations =
                        i - offset >= 0 ? Arrays.asList(annotations[i - offset]) : List.of();
                params.add(analyzeParam(schema, i, names[i], types[i], paramAnnotations));
            }
            schema.params(params);

            path.remove(path.size() - 1);
            return schema;
        }

        private SchemaParam analyzeParam(
                SchemaType owner, int index, String name, Type type, List<Annotation> annotations) {
            String description = "parameter '" + name + "' of " + owner.description();
            Class<?> raw = rawClass(type, description);

            Strategy strategy;
            try {
                strategy = StrategyClassifier.classify(annotations, raw, owner.scope());
            } catch (IllegalArgumentException e) {
                throw problem(description, e.getMessage());
            }
            Strategy.Kind kind = strategy.kind();
            if (kind == Strategy.Kind.UNRECOGNIZED) {
                throw problem(description, "no strategy annotation (e.g. @Infer, @ReifyName) found");
            }
            if (find(annotations, Checked.class) != null && kind != Strategy.Kind.CONTEXTUAL_LOOKUP) {
                throw problem(description, "@Checked only applies to contextual lookups");
            }

            Cardinality declared = declaredCardinality(annotations, description);
            if (declared != null && !kind.acceptsCardinality()) {
                throw problem(description, "cardinality annotations are not allowed for strategy " + kind);
            }
            Tagged tagged = find(annotations, Tagged.class);
            boolean auxiliary = find(annotations, Auxiliary.class) != null;
            if ((tagged != null || auxiliary) && !kind.isMemberMatching()) {
                throw problem(description, "@Tagged and @Auxiliary only apply to member-matching parameters");
            }
            if (tagged != null && !TagMatcher.isTag(tagged.value())) {
                throw problem(description, tagged.value().getName() + " is not annotated with @RpcTag");
            }
            MethodTag methodTag = find(annotations, MethodTag.class);
            ParamTag paramTag = find(annotations, ParamTag.class);
            if (methodTag != null && !(kind == Strategy.Kind.EMBEDDED && owner.scope() == Scope.INTERFACE)) {
                throw problem(description, "@MethodTag only applies to interface-scope schemas");
            }
            if (paramTag != null
                    && !(kind == Strategy.Kind.PER_METHOD
                            || (kind == Strategy.Kind.EMBEDDED && owner.scope() != Scope.PARAMETER))) {
                throw problem(description, "@ParamTag only applies to per-method and embedded parameters");
            }

            Cardinality cardinality = null;
            Type element = type;
            if (kind.acceptsCardinality()) {
                cardinality = declared != null ? declared : Cardinality.EXACTLY_ONE;
                if (cardinality == Cardinality.ZERO_OR_ONE) {
                    element = typeArgument(type, Optional.class, 0, description, "Optional<X>");
                } else if (cardinality == Cardinality.MANY_LISTED) {
                    if (raw == List.class) {
                        element = typeArgument(type, List.class, 0, description, "List<X>");
                    } else if (raw == Map.class) {
                        if (typeArgument(type, Map.class, 0, description, "Map<String, X>") != String.class) {
                            throw problem(description, "name-keyed parameters must be typed Map<String, X>");
                        }
                        cardinality = Cardinality.MANY_NAMED;
                        element = typeArgument(type, Map.class, 1, description, "Map<String, X>");
                    } else {
                        throw problem(description, "@Multi parameters must be typed List<X> or Map<String, X>");
                    }
                }
                if (kind == Strategy.Kind.PER_METHOD && cardinality == Cardinality.MANY_LISTED) {
                    throw problem(description, "per-method metadata must be collected into Map<String, X>");
                }
                if (kind == Strategy.Kind.CAPTURE_ANNOTATION && cardinality == Cardinality.MANY_NAMED) {
                    throw problem(description, "annotations must be collected into List<X>");
                }
                Class<?> elementRaw = rawClass(element, description);
                if (kind == Strategy.Kind.CAPTURE_ANNOTATION
                        && !(elementRaw.isAnnotation() || elementRaw == Annotation.class)) {
                    throw problem(description, elementRaw.getName() + " is not an annotation type");
                }
            }

            switch (kind) {
                case CAPTURE_NAME -> requireType(raw, String.class, description);
                case PRESENCE_CHECK -> {
                    if (raw != boolean.class && raw != Boolean.class) {
                        throw problem(description, "@HasAnnot can only be used on boolean parameters");
                    }
                }
                case CAPTURE_POSITION -> {
                    requireParameterScope(owner, description, "@ReifyPosition");
                    requireType(raw, ParamPosition.class, description);
                }
                case CAPTURE_FLAGS -> {
                    requireParameterScope(owner, description, "@ReifyFlags");
                    requireType(raw, ParamFlags.class, description);
                }
                default -> {}
            }

            SchemaParam param = new SchemaParam(
                    owner,
                    index,
                    name,
                    type,
                    strategy,
                    cardinality,
                    element,
                    tagged != null ? tagged.value() : null,
                    auxiliary);

            switch (kind) {
                case EMBEDDED -> {
                    TagConfig methodTags = firstOf(
                            tagConfig(methodTag, description),
                            tagConfig(raw.getAnnotation(MethodTag.class), description),
                            owner.methodTags());
                    TagConfig paramTags = firstOf(
                            tagConfig(paramTag, description),
                            tagConfig(raw.getAnnotation(ParamTag.class), description),
                            owner.paramTags());
                    param.nested(analyzeAt(raw, owner.scope(), param, methodTags, paramTags));
                }
                case PER_METHOD -> {
                    Class<?> elementRaw = rawClass(element, description);
                    TagConfig paramTags = firstOf(
                            tagConfig(paramTag, description),
                            tagConfig(elementRaw.getAnnotation(ParamTag.class), description),
                            owner.paramTags());
                    param.nested(analyzeAt(elementRaw, Scope.METHOD, param, TagConfig.NONE, paramTags));
                }
                case PER_PARAMETER -> param.nested(
                        analyzeAt(rawClass(element, description), Scope.PARAMETER, param, TagConfig.NONE, TagConfig.NONE));
                default -> {}
            }
            return param;
        }

        private Constructor<?> primaryConstructor(Class<?> type, SchemaParam enclosing) {
            String where = enclosing != null ? enclosing.description() : null;
            if (type.isInterface()
                    || type.isPrimitive()
                    || type.isArray()
                    || type.isEnum()
                    || Modifier.isAbstract(type.getModifiers())) {
                throw new SchemaConfigurationException(
                        type.getName() + " is not a constructible schema class", root.getName(), where);
            }
            if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
                throw new SchemaConfigurationException(
                        type.getName() + " is an inner class; schema classes must be static", root.getName(), where);
            }
            Constructor<?> constructor;
            if (type.isRecord()) {
                Class<?>[] componentTypes = Arrays.stream(type.getRecordComponents())
                        .map(RecordComponent::getType)
                        .toArray(Class<?>[]::new);
                try {
                    constructor = type.getDeclaredConstructor(componentTypes);
                } catch (NoSuchMethodException e) {
                    throw new SchemaConfigurationException(
                            "record " + type.getName() + " has no canonical constructor", e, root.getName(), where);
                }
            } else {
                Constructor<?>[] candidates = type.getConstructors();
                if (candidates.length == 0) {
                    candidates = type.getDeclaredConstructors();
                }
                if (candidates.length != 1) {
                    throw new SchemaConfigurationException(
                            type.getName() + " must have exactly one public constructor, found " + candidates.length,
                            root.getName(),
                            where);
                }
                constructor = candidates[0];
            }
            if (!constructor.trySetAccessible()) {
                throw new SchemaConfigurationException(
                        "constructor of " + type.getName() + " is not accessible", root.getName(), where);
            }
            return constructor;
        }

        private static Type[] parameterTypes(Class<?> type, Constructor<?> constructor) {
            if (type.isRecord()) {
                return Arrays.stream(type.getRecordComponents())
                        .map(RecordComponent::getGenericType)
                        .toArray(Type[]::new);
            }
            return constructor.getGenericParameterTypes();
        }

        private static String[] parameterNames(Class<?> type, Constructor<?> constructor) {
            if (type.isRecord()) {
                return Arrays.stream(type.getRecordComponents())
                        .map(RecordComponent::getName)
                        .toArray(String[]::new);
            }
            return Arrays.stream(constructor.getParameters())
                    .map(java.lang.reflect.Parameter::getName)
                    .toArray(String[]::new);
        }

        private Cardinality declaredCardinality(List<Annotation> annotations, String description) {
            List<Cardinality> found = new ArrayList<>();
            if (find(annotations, Single.class) != null) found.add(Cardinality.EXACTLY_ONE);
            if (find(annotations, ZeroOrOne.class) != null) found.add(Cardinality.ZERO_OR_ONE);
            if (find(annotations, Multi.class) != null) found.add(Cardinality.MANY_LISTED);
            if (found.size() > 1) {
                throw problem(description, "conflicting cardinality annotations: " + found);
            }
            return found.isEmpty() ? null : found.get(0);
        }

        private TagConfig tagConfig(Annotation annotation, String description) {
            if (annotation == null) {
                return null;
            }
            Class<? extends Annotation> base;
            Class<? extends Annotation> defaultTag;
            if (annotation instanceof MethodTag methodTag) {
                base = methodTag.base();
                defaultTag = methodTag.defaultTag();
            } else {
                ParamTag paramTag = (ParamTag) annotation;
                base = paramTag.base();
                defaultTag = paramTag.defaultTag();
            }
            String where = description != null ? description : "schema " + root.getSimpleName();
            if (!TagMatcher.isTag(base)) {
                throw problem(where, "tag base " + base.getName() + " is not annotated with @RpcTag");
            }
            if (defaultTag == RpcTag.class) {
                return new TagConfig(base, null);
            }
            if (!TagMatcher.isTag(defaultTag) || !TagMatcher.refines(defaultTag, base)) {
                throw problem(where, "default tag " + defaultTag.getName() + " is not a tag refining " + base.getName());
            }
            return new TagConfig(base, defaultTag);
        }

        private static TagConfig firstOf(TagConfig first, TagConfig second, TagConfig fallback) {
            return first != null ? first : second != null ? second : fallback;
        }

        private static TagConfig orNone(TagConfig config) {
            return config != null ? config : TagConfig.NONE;
        }

        private void requireParameterScope(SchemaType owner, String description, String what) {
            if (owner.scope() != Scope.PARAMETER) {
                throw problem(description, what + " is only legal in parameter-scope schemas, not in "
                        + owner.scope().label() + "-scope " + owner.description());
            }
        }

        private void requireType(Class<?> actual, Class<?> expected, String description) {
            if (actual != expected) {
                throw problem(description, "its type is not " + expected.getSimpleName());
            }
        }

        private Class<?> rawClass(Type type, String description) {
            if (type instanceof Class<?> c) {
                return c;
            }
            if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> c) {
                return c;
            }
            throw problem(description, "unsupported parameter type " + type.getTypeName());
        }

        private Type typeArgument(Type type, Class<?> expectedRaw, int index, String description, String shape) {
            if (type instanceof ParameterizedType p && p.getRawType() == expectedRaw) {
                Type argument = p.getActualTypeArguments()[index];
                if (argument instanceof WildcardType wildcard && wildcard.getLowerBounds().length == 0) {
                    argument = wildcard.getUpperBounds()[0];
                }
                return argument;
            }
            throw problem(description, "its type must be " + shape + ", found " + type.getTypeName());
        }

        private SchemaConfigurationException problem(String description, String message) {
            return new SchemaConfigurationException(description + ": " + message, root.getName(), description);
        }
    }

    /**
     * Resolves {@code T} of {@code TypedMetadata<T>}, or {@code null} when
     * absent or not concrete.
     */
    static Type describedType(Class<?> type) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Type found = describedTypeIn(c.getGenericInterfaces());
            if (found != null) {
                return containsVariables(found) ? null : found;
            }
        }
        return null;
    }

    private static Type describedTypeIn(Type[] interfaces) {
        for (Type candidate : interfaces) {
            if (candidate instanceof ParameterizedType p && p.getRawType() == TypedMetadata.class) {
                return p.getActualTypeArguments()[0];
            }
            Class<?> raw = candidate instanceof ParameterizedType parameterized
                    ? (Class<?>) parameterized.getRawType()
                    : (Class<?>) candidate;
            Type nested = describedTypeIn(raw.getGenericInterfaces());
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static boolean containsVariables(Type type) {
        if (type instanceof TypeVariable<?> || type instanceof WildcardType) {
            return true;
        }
        if (type instanceof ParameterizedType p) {
            return Arrays.stream(p.getActualTypeArguments()).anyMatch(SchemaAnalyzer::containsVariables);
        }
        if (type instanceof GenericArrayType array) {
            return containsVariables(array.getGenericComponentType());
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private static <A extends Annotation> A find(List<Annotation> annotations, Class<A> type) {
        for (Annotation annotation : annotations) {
            if (annotation.annotationType() == type) {
                return (A) annotation;
            }
        }
        return null;
    }
}

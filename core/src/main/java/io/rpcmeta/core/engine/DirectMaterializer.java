package io.rpcmeta.core.engine;

import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.model.RealDeclaration;
import io.rpcmeta.core.model.RealParam;
import io.rpcmeta.core.model.Strategy;
import io.rpcmeta.core.spi.ContextResolver;
import java.lang.annotation.Annotation;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces the value of one non-recursive schema parameter from one real
 * declaration: contextual lookups, annotation capture, name, position and flags
 * capture, presence checks.
 *
 * <p>
 * One instance serves one derivation.
 */
final class DirectMaterializer {

    private final TagMatcher tags;
    private final ContextResolver resolver;

    DirectMaterializer(TagMatcher tags, ContextResolver resolver) {
        this.tags = tags;
        this.resolver = resolver;
    }

    /**
     * @param param          a parameter with a direct strategy
     * @param subject        the real declaration the owning schema describes
     * @param indexInMatched index of {@code subject} among the matches of the
     *                       enclosing parameter
     */
    Res<ValuePlan> materialize(SchemaParam param, RealDeclaration subject, int indexInMatched) {
        Strategy strategy = param.strategy();
        return switch (strategy.kind()) {
            case CONTEXTUAL_LOOKUP -> lookup(param, subject, strategy.strict());
            case CAPTURE_ANNOTATION -> captureAnnotations(param, subject);
            case CAPTURE_NAME -> constant(strategy.useRpcName() ? subject.rpcName() : subject.name());
            case CAPTURE_POSITION -> constant(((RealParam) subject).position(indexInMatched));
            case CAPTURE_FLAGS -> constant(((RealParam) subject).flags());
            case PRESENCE_CHECK -> constant(tags.annotationsOf(subject).stream()
                    .anyMatch(a -> TagMatcher.isAssignable(a, strategy.annotationType())));
            case EMBEDDED, PER_METHOD, PER_PARAMETER, UNRECOGNIZED -> throw new IllegalStateException(
                    "not a direct strategy: " + param);
        };
    }

    private Res<ValuePlan> lookup(SchemaParam param, RealDeclaration subject, boolean strict) {
        Type type = param.type();
        if (!strict) {
            return Res.ok(new ValuePlan.DeferredLookup(type, param.description(), subject.source()));
        }
        Optional<Object> found = resolver.lookupStrict(type);
        if (found.isEmpty()) {
            return Res.fail(new Diagnostic(
                    Diagnostic.Kind.LOOKUP_FAILURE,
                    param.description(),
                    List.of(subject.source()),
                    "no instance of " + type.getTypeName() + " available for " + param.description()));
        }
        return constant(found.get());
    }

    private Res<ValuePlan> captureAnnotations(SchemaParam param, RealDeclaration subject) {
        Class<?> requested = rawClass(param.elementType());
        List<Candidate<ValuePlan>> candidates = new ArrayList<>();
        for (Annotation annotation : tags.annotationsOf(subject)) {
            if (TagMatcher.isAssignable(annotation, requested)) {
                candidates.add(new Candidate<>(
                        annotation.annotationType().getSimpleName(),
                        "@" + annotation.annotationType().getSimpleName() + " on " + subject.source(),
                        new ValuePlan.Constant(annotation)));
            }
        }
        return CardinalityResolver.resolve(
                        param.cardinality(),
                        candidates,
                        param.description(),
                        "annotation",
                        subject.source())
                .map(accepted -> ValuePlan.collect(param.cardinality(), accepted));
    }

    private static Res<ValuePlan> constant(Object value) {
        return Res.ok(new ValuePlan.Constant(value));
    }

    private static Class<?> rawClass(Type type) {
        return type instanceof ParameterizedType p ? (Class<?>) p.getRawType() : (Class<?>) type;
    }
}

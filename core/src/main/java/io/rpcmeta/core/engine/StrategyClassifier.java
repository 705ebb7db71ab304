package io.rpcmeta.core.engine;

import io.rpcmeta.core.annotation.Checked;
import io.rpcmeta.core.annotation.Composite;
import io.rpcmeta.core.annotation.Contextual;
import io.rpcmeta.core.annotation.HasAnnot;
import io.rpcmeta.core.annotation.Infer;
import io.rpcmeta.core.annotation.ReifyAnnot;
import io.rpcmeta.core.annotation.ReifyFlags;
import io.rpcmeta.core.annotation.ReifyName;
import io.rpcmeta.core.annotation.ReifyPosition;
import io.rpcmeta.core.model.Scope;
import io.rpcmeta.core.model.Strategy;
import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a schema parameter into exactly one {@link Strategy}.
 *
 * <p>
 * Precedence: {@code @Composite} &gt; explicit direct-strategy annotation &gt;
 * contextual default (the parameter's type is {@link Contextual}) &gt; the
 * member-matching default of the scope (per-method at interface scope,
 * per-parameter at method scope) &gt; {@link Strategy.Kind#UNRECOGNIZED}.
 */
public final class StrategyClassifier {

    private StrategyClassifier() {}

    /**
     * @param annotations annotations on the schema parameter
     * @param rawType     raw declared type of the schema parameter
     * @param scope       scope of the owning schema
     * @return the strategy, {@link Strategy.Kind#UNRECOGNIZED} if none applies
     * @throws IllegalArgumentException if the annotations name conflicting
     *                                  strategies; the message describes the
     *                                  conflict
     */
    public static Strategy classify(List<Annotation> annotations, Class<?> rawType, Scope scope) {
        boolean composite = false;
        boolean checked = false;
        List<Strategy> direct = new ArrayList<>();
        for (Annotation annotation : annotations) {
            if (annotation instanceof Composite) {
                composite = true;
            } else if (annotation instanceof Checked) {
                checked = true;
            } else if (annotation instanceof Infer) {
                direct.add(Strategy.contextual(false));
            } else if (annotation instanceof ReifyAnnot) {
                direct.add(Strategy.of(Strategy.Kind.CAPTURE_ANNOTATION));
            } else if (annotation instanceof ReifyName reifyName) {
                direct.add(Strategy.captureName(reifyName.rpcName()));
            } else if (annotation instanceof ReifyPosition) {
                direct.add(Strategy.of(Strategy.Kind.CAPTURE_POSITION));
            } else if (annotation instanceof ReifyFlags) {
                direct.add(Strategy.of(Strategy.Kind.CAPTURE_FLAGS));
            } else if (annotation instanceof HasAnnot hasAnnot) {
                direct.add(Strategy.presenceCheck(hasAnnot.value()));
            }
        }

        if (composite) {
            if (!direct.isEmpty()) {
                throw new IllegalArgumentException("@Composite cannot be combined with a direct strategy annotation");
            }
            return Strategy.of(Strategy.Kind.EMBEDDED);
        }
        if (direct.size() > 1) {
            throw new IllegalArgumentException("multiple strategy annotations: " + kinds(direct));
        }
        if (direct.size() == 1) {
            Strategy strategy = direct.get(0);
            return strategy.kind() == Strategy.Kind.CONTEXTUAL_LOOKUP ? Strategy.contextual(checked) : strategy;
        }
        if (rawType.isAnnotationPresent(Contextual.class)) {
            return Strategy.contextual(checked);
        }
        return switch (scope) {
            case INTERFACE -> Strategy.of(Strategy.Kind.PER_METHOD);
            case METHOD -> Strategy.of(Strategy.Kind.PER_PARAMETER);
            case PARAMETER -> Strategy.of(Strategy.Kind.UNRECOGNIZED);
        };
    }

    private static String kinds(List<Strategy> strategies) {
        return String.join(", ", strategies.stream().map(s -> s.kind().name()).toList());
    }
}

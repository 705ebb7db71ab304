package io.rpcmeta.core.model;

import java.lang.annotation.Annotation;
import java.util.Objects;

/**
 * How the value of one schema parameter is derived. Every schema parameter has
 * exactly one strategy; the set of kinds is closed.
 *
 * @param kind           the strategy kind
 * @param strict         for {@link Kind#CONTEXTUAL_LOOKUP}: whether absence
 *                       fails the match
 * @param useRpcName     for {@link Kind#CAPTURE_NAME}: whether {@code @RpcName}
 *                       aliases are honored
 * @param annotationType for {@link Kind#PRESENCE_CHECK}: the annotation type
 *                       tested for
 */
public record Strategy(Kind kind, boolean strict, boolean useRpcName, Class<? extends Annotation> annotationType) {

    /** Closed set of strategy kinds. */
    public enum Kind {
        CONTEXTUAL_LOOKUP,
        CAPTURE_ANNOTATION,
        CAPTURE_NAME,
        CAPTURE_POSITION,
        CAPTURE_FLAGS,
        PRESENCE_CHECK,
        EMBEDDED,
        PER_METHOD,
        PER_PARAMETER,
        UNRECOGNIZED;

        /**
         * Kinds whose value comes from matching members of the current
         * declaration.
         */
        public boolean isMemberMatching() {
            return this == PER_METHOD || this == PER_PARAMETER;
        }

        /** Kinds that accept a cardinality qualifier. */
        public boolean acceptsCardinality() {
            return isMemberMatching() || this == CAPTURE_ANNOTATION;
        }
    }

    public Strategy {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.PRESENCE_CHECK) {
            Objects.requireNonNull(annotationType, "annotationType must not be null for PRESENCE_CHECK");
        }
    }

    public static Strategy of(Kind kind) {
        return new Strategy(kind, false, false, null);
    }

    public static Strategy contextual(boolean strict) {
        return new Strategy(Kind.CONTEXTUAL_LOOKUP, strict, false, null);
    }

    public static Strategy captureName(boolean useRpcName) {
        return new Strategy(Kind.CAPTURE_NAME, false, useRpcName, null);
    }

    public static Strategy presenceCheck(Class<? extends Annotation> annotationType) {
        return new Strategy(Kind.PRESENCE_CHECK, false, false, annotationType);
    }
}

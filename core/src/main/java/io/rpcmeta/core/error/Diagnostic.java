package io.rpcmeta.core.error;

import java.util.List;
import java.util.Objects;

/**
 * One independent failure found while matching a schema against a real
 * interface.
 *
 * @param kind         failure category
 * @param parameter    the offending schema parameter with its owner chain, or
 *                     {@code null} when the failure concerns a real declaration
 *                     only
 * @param declarations source positions of the offending real declarations
 * @param message      human-readable description
 */
public record Diagnostic(Kind kind, String parameter, List<String> declarations, String message) {

    /** Failure categories. */
    public enum Kind {
        /** An exactly-one match (or a required annotation) found nothing. */
        NO_MATCH,
        /** An exactly-one or zero-or-one match found several candidates. */
        AMBIGUOUS_MATCH,
        /**
         * A real declaration was consumed by several non-auxiliary schema
         * parameters.
         */
        DUPLICATE_CONSUMPTION,
        /**
         * Two matches of a name-keyed schema parameter share an
         * externally-facing name.
         */
        DUPLICATE_NAME,
        /** No instance could be found for a contextual lookup. */
        LOOKUP_FAILURE,
        /**
         * A typed schema does not describe the type of the real declaration.
         */
        INCOMPATIBLE_TYPE,
        /** A real declaration is not consumed by any schema parameter. */
        UNMATCHED_MEMBER
    }

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
    }

    /** Single-line rendering: kind, message, declarations. */
    public String render() {
        StringBuilder sb = new StringBuilder().append('[').append(kind).append("] ").append(message);
        if (!declarations.isEmpty()) {
            sb.append(" (at ").append(String.join(", ", declarations)).append(')');
        }
        return sb.toString();
    }
}

package io.rpcmeta.core.model;

/**
 * The level of a real declaration a schema describes. Scopes nest strictly: an
 * interface-scope schema matches methods, a method-scope schema matches
 * parameters.
 */
public enum Scope {
    INTERFACE,
    METHOD,
    PARAMETER;

    /**
     * The scope of the members matched from this scope, or {@code null} for
     * parameters.
     */
    public Scope memberScope() {
        return switch (this) {
            case INTERFACE -> METHOD;
            case METHOD -> PARAMETER;
            case PARAMETER -> null;
        };
    }

    /** Lower-case label used in diagnostics. */
    public String label() {
        return switch (this) {
            case INTERFACE -> "interface";
            case METHOD -> "method";
            case PARAMETER -> "parameter";
        };
    }
}

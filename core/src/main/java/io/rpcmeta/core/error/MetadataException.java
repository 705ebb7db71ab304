package io.rpcmeta.core.error;

/**
 * Abstract base for all rpc-metadata exceptions. Never thrown directly: use the
 * concrete subclasses under {@link SchemaDefinitionException} or
 * {@link DerivationException}.
 */
public abstract class MetadataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /**
         * Validating the shape of a schema, independent of any real interface.
         */
        SCHEMA,
        /**
         * Matching schema parameters against the declarations of one real
         * interface.
         */
        MATCHING,
        /** Building the value tree from a successful match. */
        FINALIZATION
    }

    private final String schemaType;
    private final Phase phase;

    protected MetadataException(String message, String schemaType, Phase phase) {
        super(message);
        this.schemaType = schemaType;
        this.phase = phase;
    }

    protected MetadataException(String message, Throwable cause, String schemaType, Phase phase) {
        super(message, cause);
        this.schemaType = schemaType;
        this.phase = phase;
    }

    /**
     * Fully qualified name of the schema being derived, or {@code null} if not
     * yet identified.
     */
    public String schemaType() {
        return schemaType;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}

package io.rpcmeta.core.error;

/**
 * Abstract parent for malformed schemas. Detected without looking at any real
 * interface, always fatal: every derivation using the schema fails with the
 * same exception.
 */
public abstract class SchemaDefinitionException extends MetadataException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    protected SchemaDefinitionException(String message, String schemaType, String parameter) {
        super(message, schemaType, Phase.SCHEMA);
        this.parameter = parameter;
    }

    protected SchemaDefinitionException(String message, Throwable cause, String schemaType, String parameter) {
        super(message, cause, schemaType, Phase.SCHEMA);
        this.parameter = parameter;
    }

    /**
     * Description of the offending schema parameter with its owner chain, or
     * {@code null}.
     */
    public String parameter() {
        return parameter;
    }
}

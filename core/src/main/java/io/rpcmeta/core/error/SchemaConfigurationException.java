package io.rpcmeta.core.error;

/**
 * Thrown when a schema is malformed: an unrecognized or conflicting strategy, a
 * cardinality on a strategy that does not accept one, a parameter type that
 * does not fit its strategy, a parameter-only strategy outside a
 * parameter-scope schema, an invalid tag, or a class that cannot be
 * constructed.
 */
public final class SchemaConfigurationException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public SchemaConfigurationException(String message, String schemaType, String parameter) {
        super(message, schemaType, parameter);
    }

    public SchemaConfigurationException(String message, Throwable cause, String schemaType, String parameter) {
        super(message, cause, schemaType, parameter);
    }
}

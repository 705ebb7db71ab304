package io.rpcmeta.core.error;

/**
 * Abstract parent for failures deriving a schema against one particular real
 * interface. Carries an additional {@code interfaceName} field.
 */
public abstract class DerivationException extends MetadataException {

    private static final long serialVersionUID = 1L;

    private final String interfaceName;

    protected DerivationException(String message, String schemaType, String interfaceName, Phase phase) {
        super(message, schemaType, phase);
        this.interfaceName = interfaceName;
    }

    protected DerivationException(
            String message, Throwable cause, String schemaType, String interfaceName, Phase phase) {
        super(message, cause, schemaType, phase);
        this.interfaceName = interfaceName;
    }

    /** Name of the real interface the schema was derived against. */
    public String interfaceName() {
        return interfaceName;
    }
}

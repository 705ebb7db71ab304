package io.rpcmeta.core.error;

/** Thrown when a schema constructor rejects the values derived for it. */
public final class ValueConstructionException extends DerivationException {

    private static final long serialVersionUID = 1L;

    public ValueConstructionException(String message, Throwable cause, String schemaType, String interfaceName) {
        super(message, cause, schemaType, interfaceName, Phase.FINALIZATION);
    }
}

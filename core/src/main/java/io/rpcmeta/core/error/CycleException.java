package io.rpcmeta.core.error;

import java.util.List;

/**
 * Thrown when a schema embeds itself, directly or through other embedded
 * schemas.
 */
public final class CycleException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CycleException(String message, String schemaType, String parameter, List<String> cycle) {
        super(message, schemaType, parameter);
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Schema type names along the cycle, starting and ending with the same
     * type.
     */
    public List<String> cycle() {
        return cycle;
    }
}

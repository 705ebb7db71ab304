package io.rpcmeta.core.config;

/**
 * How a real declaration claimed by several consuming schema parameters is
 * resolved.
 */
public enum ConsumptionPolicy {
    /**
     * Every consuming claim must be unique; a second successful claim is a
     * duplicate-consumption error.
     */
    EXCLUSIVE,
    /**
     * Schema parameters are tried in declaration order and the first successful
     * consuming claim wins.
     */
    FIRST_MATCH;

    static ConsumptionPolicy parse(String value) {
        return switch (value.trim().toLowerCase().replace('_', '-')) {
            case "exclusive" -> EXCLUSIVE;
            case "first-match" -> FIRST_MATCH;
            default -> throw new ConfigLoadException(
                    "Invalid consumption-policy '" + value + "': expected 'exclusive' or 'first-match'");
        };
    }
}

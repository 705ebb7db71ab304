package io.rpcmeta.core.config;

import java.util.Objects;

/**
 * Derivation settings. Immutable and thread-safe.
 *
 * @param consumptionPolicy        how competing consuming claims on one real
 *                                 declaration resolve
 * @param requireAllMembersMatched whether a real method or parameter that no
 *                                 schema parameter consumes is an error
 * @param includeDefaultMethods    whether default interface methods count as
 *                                 real methods
 * @param cacheEnabled             whether derived values are cached per
 *                                 (schema, interface) pair
 */
public record DerivationConfig(
        ConsumptionPolicy consumptionPolicy,
        boolean requireAllMembersMatched,
        boolean includeDefaultMethods,
        boolean cacheEnabled) {

    /**
     * Exclusive consumption, unmatched members allowed, abstract methods only,
     * caching on.
     */
    public static final DerivationConfig DEFAULT = builder().build();

    public DerivationConfig {
        Objects.requireNonNull(consumptionPolicy, "consumptionPolicy must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .consumptionPolicy(consumptionPolicy)
                .requireAllMembersMatched(requireAllMembersMatched)
                .includeDefaultMethods(includeDefaultMethods)
                .cacheEnabled(cacheEnabled);
    }

    /** Builder with the documented defaults. */
    public static final class Builder {

        private ConsumptionPolicy consumptionPolicy = ConsumptionPolicy.EXCLUSIVE;
        private boolean requireAllMembersMatched = false;
        private boolean includeDefaultMethods = false;
        private boolean cacheEnabled = true;

        private Builder() {}

        public Builder consumptionPolicy(ConsumptionPolicy consumptionPolicy) {
            this.consumptionPolicy = consumptionPolicy;
            return this;
        }

        public Builder requireAllMembersMatched(boolean requireAllMembersMatched) {
            this.requireAllMembersMatched = requireAllMembersMatched;
            return this;
        }

        public Builder includeDefaultMethods(boolean includeDefaultMethods) {
            this.includeDefaultMethods = includeDefaultMethods;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public DerivationConfig build() {
            return new DerivationConfig(
                    consumptionPolicy, requireAllMembersMatched, includeDefaultMethods, cacheEnabled);
        }
    }
}

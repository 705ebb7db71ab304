package io.rpcmeta.core.spi;

import io.rpcmeta.core.model.RealInterface;

/**
 * Introspection SPI. Describes a real interface as a {@link RealInterface}: its
 * methods in declaration order, their parameter groups, their annotations and
 * the declarations they override.
 *
 * <p>
 * Implementations MUST be stateless or thread-safe; descriptions are immutable.
 */
public interface InterfaceModel {

    /**
     * Describes the given interface.
     *
     * @param iface the interface to describe
     * @return the immutable description
     * @throws IllegalArgumentException if {@code iface} is not an interface
     */
    RealInterface describe(Class<?> iface);
}

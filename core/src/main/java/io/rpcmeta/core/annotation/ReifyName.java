package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Captures the name of the real interface, method or parameter. Only legal on
 * {@code String} parameters.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface ReifyName {

    /**
     * When {@code true}, an {@link RpcName} alias takes precedence over the
     * Java identifier.
     */
    boolean rpcName() default false;
}

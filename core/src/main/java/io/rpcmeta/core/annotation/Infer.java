package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Materializes the parameter by looking up a registered instance of its
 * declared type in the {@link io.rpcmeta.core.spi.ContextResolver}. Absence of
 * the instance is only reported when the value tree is finalized, unless the
 * parameter is also {@link Checked}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Infer {}

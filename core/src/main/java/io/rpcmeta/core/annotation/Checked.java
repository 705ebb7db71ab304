package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Makes the contextual lookup of an {@link Infer} parameter strict: when no
 * instance is registered, the surrounding match fails, so the lookup takes part
 * in deciding which real declaration matches.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Checked {}

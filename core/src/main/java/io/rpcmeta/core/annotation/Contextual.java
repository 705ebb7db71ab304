package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type whose instances are provided contextually (codecs, factories and
 * the like). Schema parameters of such a type default to the {@link Infer}
 * strategy, and real parameters of such a type are flagged {@code CONTEXTUAL}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Contextual {}

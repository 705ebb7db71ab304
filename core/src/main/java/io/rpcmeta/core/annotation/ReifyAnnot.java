package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Captures annotations of the real interface, method or parameter whose type is
 * assignable to the parameter's element type. Annotations are inherited from
 * supertypes, overridden methods and the index-corresponding parameters of
 * overridden methods. Governed by {@link Single}, {@link ZeroOrOne} and
 * {@link Multi} like any other match.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface ReifyAnnot {}

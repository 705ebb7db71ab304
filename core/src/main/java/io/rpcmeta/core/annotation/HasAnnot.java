package io.rpcmeta.core.annotation;

import java.lang.annotation.Annotation;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Captures whether the real interface, method or parameter carries an
 * annotation of the given type (or, for tags, any refinement of it). Only legal
 * on {@code boolean} parameters.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface HasAnnot {

    Class<? extends Annotation> value();
}

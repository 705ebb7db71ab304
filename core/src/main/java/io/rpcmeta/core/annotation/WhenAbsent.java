package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a default value for a real parameter. Its presence sets
 * {@code HAS_DEFAULT} in the parameter's
 * {@link io.rpcmeta.core.model.ParamFlags}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface WhenAbsent {

    /**
     * Textual form of the default value, interpreted by whoever consumes the
     * metadata.
     */
    String value() default "";
}
